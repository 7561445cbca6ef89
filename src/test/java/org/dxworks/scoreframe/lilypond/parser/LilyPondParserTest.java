package org.dxworks.scoreframe.lilypond.parser;

import org.dxworks.scoreframe.ext.Direction;
import org.dxworks.scoreframe.ext.Fraction;
import org.dxworks.scoreframe.ext.GraceInfo;
import org.dxworks.scoreframe.ext.RepeatInfo;
import org.dxworks.scoreframe.lilypond.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LilyPondParserTest {

    private static List<Music> items(String source) throws ParseException {
        return ((SequentialMusic) LilyPondParser.parseMusic(source)).items;
    }

    @Test
    void fileLevelBlocks() throws ParseException {
        LilyPondFile file = LilyPondParser.parse("\\version \"2.24.0\"\n"
                + "\\header { title = \"A \\\"B\\\"\" tagline = ##f }\n"
                + "\\score { { c'1 } \\layout { indent = 0 } \\midi { } }");

        assertEquals("2.24.0", file.version);
        assertTrue(file.scoreBlock);
        assertEquals(2, file.header.size());
        assertEquals("\"A \\\"B\\\"\"", file.header.get(0).value);
        assertEquals("A \"B\"", file.header.get(0).text());
        assertEquals("##f", file.header.get(1).value);
        assertFalse(file.header.get(1).isQuoted());
        assertEquals(List.of("layout", "midi"), List.of(file.outputDefs.get(0).kind, file.outputDefs.get(1).kind));
        assertEquals("0", file.outputDefs.get(0).assignments.get(0).value);
        assertEquals(1, file.music.size());
    }

    @Test
    void notesKeepWrittenDurationsOnly() throws ParseException {
        List<Music> items = items("{ cis''4.. des, }");

        NoteEvent first = (NoteEvent) items.get(0);
        assertEquals(new Pitch('c', 1, 2), first.pitch);
        assertEquals(new Duration(4, 2), first.duration);
        NoteEvent second = (NoteEvent) items.get(1);
        assertEquals('d', second.pitch.step);
        assertEquals(-1, second.pitch.alter);
        assertEquals(-1, second.pitch.octave);
        assertNull(second.duration);
    }

    @Test
    void forcedAndCautionaryAccidentals() throws ParseException {
        List<Music> items = items("{ fis!4 bes? }");

        assertTrue(((NoteEvent) items.get(0)).pitch.forcedAccidental);
        assertTrue(((NoteEvent) items.get(1)).pitch.cautionaryAccidental);
    }

    @Test
    void postEventsInWrittenOrder() throws ParseException {
        NoteEvent note = (NoteEvent) items("{ c'4~( [ \\< -. ^\\fermata _3 \\2 \\mf \\) }").get(0);

        assertEquals(List.of(
                new PostEvent(PostEvent.Kind.TIE),
                new PostEvent(PostEvent.Kind.SLUR_START),
                new PostEvent(PostEvent.Kind.BEAM_START),
                new PostEvent(PostEvent.Kind.CRESCENDO),
                new PostEvent(PostEvent.Kind.ABBREVIATED_SCRIPT, Direction.NEUTRAL, "."),
                new PostEvent(PostEvent.Kind.SCRIPT, Direction.UP, "fermata"),
                new PostEvent(PostEvent.Kind.FINGERING, Direction.DOWN, "3"),
                new PostEvent(PostEvent.Kind.STRING_NUMBER, Direction.NEUTRAL, "2"),
                new PostEvent(PostEvent.Kind.DYNAMIC, Direction.NEUTRAL, "mf"),
                new PostEvent(PostEvent.Kind.PHRASING_SLUR_END)
        ), note.postEvents);
    }

    @Test
    void tremoloWithAndWithoutSubdivision() throws ParseException {
        List<Music> items = items("{ c'4:32 d': e' }");

        assertEquals(32, ((NoteEvent) items.get(0)).tremolo);
        assertEquals(0, ((NoteEvent) items.get(1)).tremolo);
        assertNull(((NoteEvent) items.get(2)).tremolo);
    }

    @Test
    void pitchedRestRestsAndSkips() throws ParseException {
        List<Music> items = items("{ b4\\rest r8. s2 }");

        RestEvent pitched = (RestEvent) items.get(0);
        assertFalse(pitched.skip);
        assertEquals(new Pitch('b', 0, 0), pitched.position);
        assertEquals(new Duration(4, 0), pitched.duration);

        RestEvent rest = (RestEvent) items.get(1);
        assertNull(rest.position);
        assertEquals(new Duration(8, 1), rest.duration);
        assertTrue(((RestEvent) items.get(2)).skip);
    }

    @Test
    void chordsAndChordRepetition() throws ParseException {
        List<Music> items = items("{ <c' e' g'>2-> q4 }");

        ChordEvent chord = (ChordEvent) items.get(0);
        assertEquals(3, chord.pitches.size());
        assertEquals(new Duration(2, 0), chord.duration);
        assertEquals(1, chord.postEvents.size());
        ChordRepetition repetition = (ChordRepetition) items.get(1);
        assertEquals(new Duration(4, 0), repetition.duration);
    }

    @Test
    void emptyChordFails() {
        assertThrows(ParseException.class, () -> LilyPondParser.parseMusic("{ <>4 }"));
    }

    @Test
    void tupletKeepsRatioAndSpanDuration() throws ParseException {
        TupletMusic tuplet = (TupletMusic) items("{ \\tuplet 3/2 8 { c8 d e f g a } }").get(0);

        assertEquals(3, tuplet.numerator);
        assertEquals(2, tuplet.denominator);
        assertEquals(new Duration(8, 0), tuplet.spanDuration);
        assertEquals(6, ((SequentialMusic) tuplet.body).items.size());
    }

    @Test
    void timesIsTheInverseOfTuplet() throws ParseException {
        TupletMusic tuplet = (TupletMusic) items("{ \\times 2/3 { c8 d e } }").get(0);

        assertEquals(3, tuplet.numerator);
        assertEquals(2, tuplet.denominator);
        assertNull(tuplet.spanDuration);
    }

    @Test
    void graceKinds() throws ParseException {
        List<Music> items = items("{ \\grace c16 \\acciaccatura d8 \\appoggiatura e8 f4 }");

        assertEquals(GraceInfo.Kind.GRACE, ((GraceMusic) items.get(0)).kind);
        assertEquals(GraceInfo.Kind.ACCIACCATURA, ((GraceMusic) items.get(1)).kind);
        assertEquals(GraceInfo.Kind.APPOGGIATURA, ((GraceMusic) items.get(2)).kind);
        assertInstanceOf(NoteEvent.class, ((GraceMusic) items.get(0)).body);
    }

    @Test
    void afterGraceWithOptionalFraction() throws ParseException {
        List<Music> items = items("{ \\afterGrace 15/16 c'2 { d'16 } \\afterGrace e'2 { f'16 } }");

        AfterGraceMusic withFraction = (AfterGraceMusic) items.get(0);
        assertEquals(new Fraction(15, 16), withFraction.fraction);
        assertInstanceOf(NoteEvent.class, withFraction.main);
        assertInstanceOf(SequentialMusic.class, withFraction.grace);
        assertNull(((AfterGraceMusic) items.get(1)).fraction);
    }

    @Test
    void repeatWithAlternatives() throws ParseException {
        RepeatMusic repeat = (RepeatMusic) items("{ \\repeat volta 3 { c'1 } \\alternative { { d'1 } { e'1 } } }").get(0);

        assertEquals(RepeatInfo.RepeatType.VOLTA, repeat.kind);
        assertEquals(3, repeat.count);
        assertEquals(2, repeat.alternatives.size());
    }

    @Test
    void unknownRepeatKindFails() {
        ParseException e = assertThrows(ParseException.class,
                () -> LilyPondParser.parseMusic("{ \\repeat tremolo 4 { c'16 d' } }"));
        assertEquals("repeat kind volta, unfold or percent", e.getExpected());
    }

    @Test
    void alternativeWithoutRepeatFails() {
        ParseException e = assertThrows(ParseException.class,
                () -> LilyPondParser.parseMusic("{ c'1 \\alternative { { d'1 } } }"));
        assertEquals("\\repeat before \\alternative", e.getExpected());
        assertEquals(6, e.getPosition());
    }

    @Test
    void voiceSeparatorsSplitSimultaneousMusic() throws ParseException {
        SimultaneousMusic sim = (SimultaneousMusic) LilyPondParser.parseMusic("<< { c''2 } \\\\ e'4 f' >>");

        assertTrue(sim.voiceSeparated);
        assertEquals(2, sim.items.size());
        assertEquals(1, ((SequentialMusic) sim.items.get(0)).items.size());
        assertEquals(2, ((SequentialMusic) sim.items.get(1)).items.size());
    }

    @Test
    void plainSimultaneousMusic() throws ParseException {
        SimultaneousMusic sim = (SimultaneousMusic) LilyPondParser.parseMusic("<< { c''1 } { e'1 } >>");

        assertFalse(sim.voiceSeparated);
        assertEquals(2, sim.items.size());
    }

    @Test
    void contextWithNameAndWithBlock() throws ParseException {
        ContextedMusic staff = (ContextedMusic) LilyPondParser.parseMusic(
                "\\new Staff = \"up\" \\with { instrumentName = \"Violin\" } { c''1 }");

        assertEquals("new", staff.keyword);
        assertEquals("Staff", staff.contextType);
        assertEquals("up", staff.name);
        assertEquals("instrumentName", staff.with.get(0).key);
        assertEquals("Violin", staff.with.get(0).text());
        assertInstanceOf(SequentialMusic.class, staff.music);
    }

    @Test
    void relativeWithAndWithoutReference() throws ParseException {
        RelativeMusic withReference = (RelativeMusic) LilyPondParser.parseMusic("\\relative c'' { c4 }");
        assertEquals(new Pitch('c', 0, 2), withReference.reference);

        RelativeMusic withoutReference = (RelativeMusic) LilyPondParser.parseMusic("\\relative { c'4 }");
        assertNull(withoutReference.reference);
    }

    @Test
    void signaturesAndBarLines() throws ParseException {
        List<Music> items = items("{ \\clef \"treble_8\" \\clef bass \\key bes \\minor \\time 6/8 | \\bar \"|.\" }");

        assertEquals("treble_8", ((ClefChange) items.get(0)).name);
        assertEquals("bass", ((ClefChange) items.get(1)).name);
        KeySignature key = (KeySignature) items.get(2);
        assertEquals("bes", key.tonic);
        assertEquals("minor", key.mode);
        TimeSignature time = (TimeSignature) items.get(3);
        assertEquals(6, time.numerator);
        assertEquals(8, time.denominator);
        assertInstanceOf(BarCheck.class, items.get(4));
        assertEquals("|.", ((BarLine) items.get(5)).style);
    }

    @Test
    void markupIsCanonicalized() throws ParseException {
        List<Music> items = items("{ \\markup   {\\bold   \"loud\"  text } \\markup \\hspace #2 \\markuplist { a b } }");

        MarkupMusic markup = (MarkupMusic) items.get(0);
        assertFalse(markup.list);
        assertEquals("{ \\bold \"loud\" text }", markup.serialized);
        assertEquals("\\hspace #2", ((MarkupMusic) items.get(1)).serialized);
        assertTrue(((MarkupMusic) items.get(2)).list);
        assertEquals("{ a b }", ((MarkupMusic) items.get(2)).serialized);
    }

    @Test
    void invalidDurationReportsItsPosition() {
        ParseException e = assertThrows(ParseException.class, () -> LilyPondParser.parse("{ c4 d8 e3 }"));

        assertEquals(9, e.getPosition());
        assertEquals(1, e.getLine());
        assertEquals(10, e.getColumn());
        assertEquals("'3'", e.getFound());
    }

    @Test
    void missingCloseBraceReportsEndOfInput() {
        ParseException e = assertThrows(ParseException.class, () -> LilyPondParser.parse("{\n  c4\n  d\n"));

        assertEquals("'}'", e.getExpected());
        assertEquals("end of input", e.getFound());
        assertEquals(11, e.getPosition());
        assertEquals(4, e.getLine());
        assertEquals(1, e.getColumn());
        assertTrue(e.getMessage().startsWith("Parse error at line 4, column 1"));
    }

    @Test
    void durationBeforePitchFails() {
        ParseException e = assertThrows(ParseException.class, () -> LilyPondParser.parseMusic("{ 4 }"));
        assertEquals("a pitch before the duration", e.getExpected());
    }

    @Test
    void trailingInputAfterSingleExpressionFails() {
        assertThrows(ParseException.class, () -> LilyPondParser.parseMusic("{ c4 } d"));
    }

    @Test
    void oversizedNumbersAreSyntaxErrors() {
        ParseException tremolo = assertThrows(ParseException.class, () -> LilyPondParser.parse("{ c4:99999999999 }"));
        assertEquals(5, tremolo.getPosition());
        assertEquals("'99999999999'", tremolo.getFound());

        ParseException repeat = assertThrows(ParseException.class,
                () -> LilyPondParser.parse("{ \\repeat volta 99999999999 { c4 } }"));
        assertEquals(16, repeat.getPosition());
        assertEquals("repeat count", repeat.getExpected());

        assertThrows(ParseException.class, () -> LilyPondParser.parse("{ c99999999999 }"));
        assertThrows(ParseException.class, () -> LilyPondParser.parse("{ \\time 99999999999/4 c4 }"));
    }

    @Test
    void tupletFractionsMustNotBeZero() {
        ParseException e = assertThrows(ParseException.class,
                () -> LilyPondParser.parse("{ \\tuplet 3/0 { c8 d e } }"));
        assertEquals("non-zero tuplet denominator", e.getExpected());
        assertEquals("'0'", e.getFound());

        assertThrows(ParseException.class, () -> LilyPondParser.parse("{ \\tuplet 0/2 { c8 d e } }"));
        assertThrows(ParseException.class, () -> LilyPondParser.parse("{ \\times 0/2 { c8 d e } }"));
    }

    @Test
    void tremoloSubdivisionIsAPowerOfTwoFromEight() throws ParseException {
        assertThrows(ParseException.class, () -> LilyPondParser.parse("{ c4:3 }"));
        assertThrows(ParseException.class, () -> LilyPondParser.parse("{ c4:4 }"));
        assertThrows(ParseException.class, () -> LilyPondParser.parse("{ c4:24 }"));

        List<Music> items = items("{ c'4:8 d':16 e':0 }");
        assertEquals(8, ((NoteEvent) items.get(0)).tremolo);
        assertEquals(16, ((NoteEvent) items.get(1)).tremolo);
        assertEquals(0, ((NoteEvent) items.get(2)).tremolo);
    }
}
