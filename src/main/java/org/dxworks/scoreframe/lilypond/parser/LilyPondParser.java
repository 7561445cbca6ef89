package org.dxworks.scoreframe.lilypond.parser;

import org.dxworks.scoreframe.ext.Direction;
import org.dxworks.scoreframe.ext.Fraction;
import org.dxworks.scoreframe.ext.GraceInfo;
import org.dxworks.scoreframe.ext.RepeatInfo;
import org.dxworks.scoreframe.lilypond.lexer.Lexer;
import org.dxworks.scoreframe.lilypond.lexer.NoteNames;
import org.dxworks.scoreframe.lilypond.lexer.Token;
import org.dxworks.scoreframe.lilypond.lexer.TokenType;
import org.dxworks.scoreframe.lilypond.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the supported LilyPond subset. Stops at the first structural error.
 */
public final class LilyPondParser {

    private static final Set<String> SCHEME_ONLY_MARKUP_COMMANDS = Set.of("hspace", "vspace", "musicglyph", "char");
    private static final Set<String> NO_ARGUMENT_MARKUP_COMMANDS = Set.of("null", "strut");

    private final String source;
    private final List<Token> tokens;
    private int index;

    private LilyPondParser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    public static LilyPondFile parse(String source) throws ParseException {
        List<Token> tokens = new Lexer(source).tokenize();
        return new LilyPondParser(source, tokens).parseFile();
    }

    /**
     * Parses a single music expression, e.g. {@code "{ c4 d e }"}.
     */
    public static Music parseMusic(String source) throws ParseException {
        LilyPondParser parser = new LilyPondParser(source, new Lexer(source).tokenize());
        Music music = parser.music();
        parser.expect(TokenType.EOF, "end of input");
        return music;
    }

    private LilyPondFile parseFile() throws ParseException {
        LilyPondFile file = new LilyPondFile();
        while (!peek().is(TokenType.EOF)) {
            Token token = peek();
            if (token.isCommand("version")) {
                advance();
                file.version = expect(TokenType.STRING, "version string").text;
            } else if (token.isCommand("header")) {
                advance();
                file.header = assignmentBlock();
            } else if (token.isCommand("score")) {
                advance();
                scoreBlock(file);
            } else if (token.isCommand("layout") || token.isCommand("midi")) {
                file.outputDefs.add(outputDef());
            } else {
                file.music.add(music());
            }
        }
        return file;
    }

    private void scoreBlock(LilyPondFile file) throws ParseException {
        file.scoreBlock = true;
        expect(TokenType.OPEN_BRACE, "'{' after \\score");
        while (!peek().is(TokenType.CLOSE_BRACE)) {
            Token token = peek();
            if (token.is(TokenType.EOF)) {
                throw error("'}' closing \\score");
            } else if (token.isCommand("layout") || token.isCommand("midi")) {
                file.outputDefs.add(outputDef());
            } else if (token.isCommand("header")) {
                advance();
                file.header = assignmentBlock();
            } else {
                file.music.add(music());
            }
        }
        advance();
    }

    private OutputDef outputDef() throws ParseException {
        OutputDef def = new OutputDef(advance().text);
        def.assignments = assignmentBlock();
        return def;
    }

    private List<Assignment> assignmentBlock() throws ParseException {
        expect(TokenType.OPEN_BRACE, "'{'");
        List<Assignment> assignments = new ArrayList<>();
        while (!peek().is(TokenType.CLOSE_BRACE)) {
            Token key = peek();
            if (!key.is(TokenType.WORD) && !key.is(TokenType.NOTE_NAME)) {
                throw error(key.is(TokenType.EOF) ? "'}'" : "property name");
            }
            advance();
            expect(TokenType.EQUALS, "'=' after " + key.text);
            assignments.add(new Assignment(key.text, assignmentValue()));
        }
        advance();
        return assignments;
    }

    private String assignmentValue() throws ParseException {
        Token token = peek();
        switch (token.type) {
            case STRING:
                advance();
                return Assignment.quote(token.text);
            case NUMBER:
                advance();
                if (peek().is(TokenType.DOT) && peekAt(1).is(TokenType.NUMBER)) {
                    advance();
                    return token.text + "." + advance().text;
                }
                return token.text;
            case WORD:
            case NOTE_NAME:
            case SCHEME:
                advance();
                return token.text;
            case COMMAND:
                if (token.text.equals("markup")) {
                    advance();
                    return "\\markup " + markupExpression();
                }
                break;
            default:
                break;
        }
        throw error("property value");
    }

    // ---- music ----

    private Music music() throws ParseException {
        Token token = peek();
        switch (token.type) {
            case OPEN_BRACE:
                return sequential();
            case DOUBLE_ANGLE_OPEN:
                return simultaneous();
            case ANGLE_OPEN:
                return chord();
            case NOTE_NAME:
                return noteOrPitchedRest();
            case WORD:
                return wordMusic(token);
            case PIPE:
                advance();
                return new BarCheck();
            case NUMBER:
                throw error("a pitch before the duration");
            case COMMAND:
                return commandMusic(token);
            default:
                throw error("music expression");
        }
    }

    private Music wordMusic(Token token) throws ParseException {
        switch (token.text) {
            case "r":
            case "s": {
                advance();
                RestEvent rest = new RestEvent(token.text.equals("s"));
                rhythmicSuffix(rest);
                return rest;
            }
            case "q": {
                advance();
                ChordRepetition repetition = new ChordRepetition();
                rhythmicSuffix(repetition);
                return repetition;
            }
            default:
                throw error("music expression");
        }
    }

    private Music commandMusic(Token token) throws ParseException {
        switch (token.text) {
            case "tuplet":
                return tuplet();
            case "times":
                return times();
            case "grace":
                advance();
                return new GraceMusic(GraceInfo.Kind.GRACE, music());
            case "acciaccatura":
                advance();
                return new GraceMusic(GraceInfo.Kind.ACCIACCATURA, music());
            case "appoggiatura":
                advance();
                return new GraceMusic(GraceInfo.Kind.APPOGGIATURA, music());
            case "afterGrace":
                return afterGrace();
            case "repeat":
                return repeat();
            case "alternative":
                throw error("\\repeat before \\alternative");
            case "bar":
                advance();
                return new BarLine(expect(TokenType.STRING, "bar line style string").text);
            case "markup":
                advance();
                return new MarkupMusic(false, markupExpression());
            case "markuplist":
                advance();
                return new MarkupMusic(true, markupExpression());
            case "new":
            case "context":
                return contexted();
            case "relative":
                return relative();
            case "clef":
                return clef();
            case "key":
                return key();
            case "time": {
                advance();
                int numerator = expectNumber("time signature numerator");
                expect(TokenType.SLASH, "'/' in time signature");
                int denominator = expectNumber("time signature denominator");
                return new TimeSignature(numerator, denominator);
            }
            default:
                throw error("music expression");
        }
    }

    private SequentialMusic sequential() throws ParseException {
        expect(TokenType.OPEN_BRACE, "'{'");
        SequentialMusic seq = new SequentialMusic();
        while (!peek().is(TokenType.CLOSE_BRACE)) {
            if (peek().is(TokenType.EOF)) {
                throw error("'}'");
            }
            seq.items.add(music());
        }
        advance();
        return seq;
    }

    private SimultaneousMusic simultaneous() throws ParseException {
        expect(TokenType.DOUBLE_ANGLE_OPEN, "'<<'");
        SimultaneousMusic sim = new SimultaneousMusic();
        List<List<Music>> voices = new ArrayList<>();
        List<Music> current = new ArrayList<>();
        while (!peek().is(TokenType.DOUBLE_ANGLE_CLOSE)) {
            if (peek().is(TokenType.EOF)) {
                throw error("'>>'");
            }
            if (peek().is(TokenType.DOUBLE_BACKSLASH)) {
                advance();
                voices.add(current);
                current = new ArrayList<>();
                continue;
            }
            current.add(music());
        }
        advance();
        if (voices.isEmpty()) {
            sim.items = current;
            return sim;
        }
        voices.add(current);
        sim.voiceSeparated = true;
        for (List<Music> voice : voices) {
            sim.items.add(voice.size() == 1 && voice.get(0) instanceof SequentialMusic
                    ? voice.get(0) : new SequentialMusic(voice));
        }
        return sim;
    }

    private NoteEvent note() throws ParseException {
        Pitch pitch = pitch();
        if (peek().is(TokenType.EXCLAMATION)) {
            advance();
            pitch.forcedAccidental = true;
        } else if (peek().is(TokenType.QUESTION)) {
            advance();
            pitch.cautionaryAccidental = true;
        }
        NoteEvent note = new NoteEvent(pitch);
        note.duration = duration();
        tremoloAndPostEvents(note);
        return note;
    }

    /**
     * A note name starts either a note or a pitched rest such as {@code c4\rest}.
     */
    private Music noteOrPitchedRest() throws ParseException {
        int mark = index;
        pitch();
        duration();
        boolean pitchedRest = peek().isCommand("rest");
        index = mark;
        if (!pitchedRest) {
            return note();
        }
        RestEvent rest = new RestEvent(false);
        rest.position = pitch();
        rest.duration = duration();
        advance();
        tremoloAndPostEvents(rest);
        return rest;
    }

    private Pitch pitch() throws ParseException {
        Token name = expect(TokenType.NOTE_NAME, "note name");
        NoteNames.Spelled spelled = NoteNames.parse(name.text)
                .orElseThrow(() -> new ParseException(source, name.offset, "note name", name.describe()));
        int octave = 0;
        while (peek().is(TokenType.APOSTROPHE) || peek().is(TokenType.COMMA)) {
            octave += advance().is(TokenType.APOSTROPHE) ? 1 : -1;
        }
        return new Pitch(spelled.step, spelled.alter, octave);
    }

    private ChordEvent chord() throws ParseException {
        expect(TokenType.ANGLE_OPEN, "'<'");
        ChordEvent chord = new ChordEvent();
        while (!peek().is(TokenType.ANGLE_CLOSE)) {
            if (peek().is(TokenType.EOF)) {
                throw error("'>'");
            }
            Pitch pitch = pitch();
            if (peek().is(TokenType.EXCLAMATION)) {
                advance();
                pitch.forcedAccidental = true;
            } else if (peek().is(TokenType.QUESTION)) {
                advance();
                pitch.cautionaryAccidental = true;
            }
            chord.pitches.add(pitch);
        }
        advance();
        if (chord.pitches.isEmpty()) {
            throw new ParseException(source, peekAt(-1).offset, "at least one pitch in chord", "'>'");
        }
        rhythmicSuffix(chord);
        return chord;
    }

    private void rhythmicSuffix(RhythmicEvent event) throws ParseException {
        event.duration = duration();
        tremoloAndPostEvents(event);
    }

    private void tremoloAndPostEvents(RhythmicEvent event) throws ParseException {
        if (peek().is(TokenType.COLON)) {
            advance();
            event.tremolo = peek().is(TokenType.NUMBER) ? tremolo(advance()) : 0;
        }
        postEvents(event.postEvents);
    }

    private Duration duration() throws ParseException {
        if (!peek().is(TokenType.NUMBER)) {
            return null;
        }
        Token number = advance();
        int base = number(number, "duration 1, 2, 4, 8, 16, 32, 64 or 128");
        if (!Duration.BASES.contains(base)) {
            throw new ParseException(source, number.offset, "duration 1, 2, 4, 8, 16, 32, 64 or 128", number.describe());
        }
        int dots = 0;
        while (peek().is(TokenType.DOT)) {
            advance();
            dots++;
        }
        return new Duration(base, dots);
    }

    private void postEvents(List<PostEvent> events) throws ParseException {
        while (true) {
            Token token = peek();
            switch (token.type) {
                case TILDE -> events.add(simple(PostEvent.Kind.TIE));
                case OPEN_PAREN -> events.add(simple(PostEvent.Kind.SLUR_START));
                case CLOSE_PAREN -> events.add(simple(PostEvent.Kind.SLUR_END));
                case PHRASING_OPEN -> events.add(simple(PostEvent.Kind.PHRASING_SLUR_START));
                case PHRASING_CLOSE -> events.add(simple(PostEvent.Kind.PHRASING_SLUR_END));
                case OPEN_BRACKET -> events.add(simple(PostEvent.Kind.BEAM_START));
                case CLOSE_BRACKET -> events.add(simple(PostEvent.Kind.BEAM_END));
                case CRESCENDO -> events.add(simple(PostEvent.Kind.CRESCENDO));
                case DECRESCENDO -> events.add(simple(PostEvent.Kind.DECRESCENDO));
                case HAIRPIN_END -> events.add(simple(PostEvent.Kind.HAIRPIN_END));
                case ESCAPED_NUMBER -> {
                    advance();
                    events.add(new PostEvent(PostEvent.Kind.STRING_NUMBER, Direction.NEUTRAL, token.text));
                }
                case COMMAND -> {
                    if (Scripts.DYNAMICS.contains(token.text)) {
                        advance();
                        events.add(new PostEvent(PostEvent.Kind.DYNAMIC, Direction.NEUTRAL, token.text));
                    } else if (Scripts.NAMED.contains(token.text)) {
                        advance();
                        events.add(new PostEvent(PostEvent.Kind.SCRIPT, Direction.NEUTRAL, token.text));
                    } else {
                        return;
                    }
                }
                case DASH, CARET, UNDERSCORE -> {
                    advance();
                    events.add(directedPostEvent(direction(token.type)));
                }
                default -> {
                    return;
                }
            }
        }
    }

    private PostEvent directedPostEvent(Direction direction) throws ParseException {
        Token token = peek();
        switch (token.type) {
            case COMMAND:
                if (Scripts.NAMED.contains(token.text)) {
                    advance();
                    return new PostEvent(PostEvent.Kind.SCRIPT, direction, token.text);
                }
                if (Scripts.DYNAMICS.contains(token.text)) {
                    advance();
                    return new PostEvent(PostEvent.Kind.DYNAMIC, direction, token.text);
                }
                break;
            case NUMBER:
                advance();
                return new PostEvent(PostEvent.Kind.FINGERING, direction, token.text);
            case ESCAPED_NUMBER:
                advance();
                return new PostEvent(PostEvent.Kind.STRING_NUMBER, direction, token.text);
            case DOT:
            case ANGLE_CLOSE:
            case DASH:
            case CARET:
            case PLUS:
            case EXCLAMATION:
            case UNDERSCORE:
                advance();
                return new PostEvent(PostEvent.Kind.ABBREVIATED_SCRIPT, direction, token.text);
            default:
                break;
        }
        throw error("script, fingering or string number after direction mark");
    }

    private static Direction direction(TokenType type) {
        return switch (type) {
            case CARET -> Direction.UP;
            case UNDERSCORE -> Direction.DOWN;
            default -> Direction.NEUTRAL;
        };
    }

    private PostEvent simple(PostEvent.Kind kind) {
        advance();
        return new PostEvent(kind);
    }

    // ---- blocks ----

    private TupletMusic tuplet() throws ParseException {
        advance();
        int numerator = expectPositive("non-zero tuplet numerator");
        expect(TokenType.SLASH, "'/' in tuplet fraction");
        int denominator = expectPositive("non-zero tuplet denominator");
        Duration span = duration();
        return new TupletMusic(numerator, denominator, span, music());
    }

    private TupletMusic times() throws ParseException {
        advance();
        int numerator = expectPositive("non-zero \\times numerator");
        expect(TokenType.SLASH, "'/' in \\times fraction");
        int denominator = expectPositive("non-zero \\times denominator");
        return new TupletMusic(denominator, numerator, null, music());
    }

    private AfterGraceMusic afterGrace() throws ParseException {
        advance();
        Fraction fraction = null;
        if (peek().is(TokenType.NUMBER) && peekAt(1).is(TokenType.SLASH)) {
            int numerator = number(advance(), "after-grace fraction numerator");
            advance();
            int denominator = expectNumber("after-grace fraction denominator");
            if (denominator == 0) {
                throw new ParseException(source, peekAt(-1).offset, "non-zero denominator", "0");
            }
            fraction = new Fraction(numerator, denominator);
        }
        Music main = music();
        Music grace = music();
        return new AfterGraceMusic(fraction, main, grace);
    }

    private RepeatMusic repeat() throws ParseException {
        advance();
        Token kindToken = peek();
        if (!kindToken.is(TokenType.WORD)) {
            throw error("repeat kind volta, unfold or percent");
        }
        RepeatInfo.RepeatType kind = RepeatInfo.RepeatType.fromKeyword(kindToken.text)
                .orElseThrow(() -> error("repeat kind volta, unfold or percent"));
        advance();
        int count = expectNumber("repeat count");
        RepeatMusic repeat = new RepeatMusic(kind, count, music());
        if (peek().isCommand("alternative")) {
            advance();
            expect(TokenType.OPEN_BRACE, "'{' after \\alternative");
            while (!peek().is(TokenType.CLOSE_BRACE)) {
                if (peek().is(TokenType.EOF)) {
                    throw error("'}' closing \\alternative");
                }
                repeat.alternatives.add(music());
            }
            advance();
        }
        return repeat;
    }

    private ContextedMusic contexted() throws ParseException {
        String keyword = advance().text;
        Token type = expect(TokenType.WORD, "context type");
        ContextedMusic contexted = new ContextedMusic(keyword, type.text);
        if (peek().is(TokenType.EQUALS)) {
            advance();
            Token name = peek();
            if (!name.is(TokenType.STRING) && !name.is(TokenType.WORD) && !name.is(TokenType.NOTE_NAME)) {
                throw error("context name");
            }
            contexted.name = advance().text;
        }
        if (peek().isCommand("with")) {
            advance();
            contexted.with = assignmentBlock();
        }
        contexted.music = music();
        return contexted;
    }

    private RelativeMusic relative() throws ParseException {
        advance();
        Pitch reference = null;
        if (peek().is(TokenType.NOTE_NAME)) {
            reference = pitch();
        }
        return new RelativeMusic(reference, music());
    }

    private ClefChange clef() throws ParseException {
        advance();
        Token name = peek();
        if (!name.is(TokenType.STRING) && !name.is(TokenType.WORD) && !name.is(TokenType.NOTE_NAME)) {
            throw error("clef name");
        }
        advance();
        return new ClefChange(name.text);
    }

    private KeySignature key() throws ParseException {
        advance();
        Token tonic = expect(TokenType.NOTE_NAME, "key tonic");
        Token mode = expect(TokenType.COMMAND, "key mode such as \\major");
        return new KeySignature(tonic.text, mode.text);
    }

    // ---- markup ----

    /**
     * Reads one markup expression and returns it in canonical form: tokens separated by single spaces,
     * strings quoted, braces spaced.
     */
    private String markupExpression() throws ParseException {
        Token token = peek();
        switch (token.type) {
            case STRING:
                advance();
                return Assignment.quote(token.text);
            case WORD:
            case NOTE_NAME:
            case NUMBER:
            case SCHEME:
            case DOT:
            case COMMA:
            case EXCLAMATION:
            case QUESTION:
            case COLON:
            case DASH:
                advance();
                return token.text;
            case OPEN_BRACE: {
                advance();
                StringBuilder sb = new StringBuilder("{");
                while (!peek().is(TokenType.CLOSE_BRACE)) {
                    if (peek().is(TokenType.EOF)) {
                        throw error("'}' closing markup");
                    }
                    sb.append(' ').append(markupExpression());
                }
                advance();
                return sb.append(" }").toString();
            }
            case COMMAND: {
                advance();
                String command = "\\" + token.text;
                if (NO_ARGUMENT_MARKUP_COMMANDS.contains(token.text)) {
                    return command;
                }
                if (SCHEME_ONLY_MARKUP_COMMANDS.contains(token.text)) {
                    return command + " " + expect(TokenType.SCHEME, "Scheme argument").text;
                }
                StringBuilder sb = new StringBuilder(command);
                while (peek().is(TokenType.SCHEME)) {
                    sb.append(' ').append(advance().text);
                }
                if (peek().is(TokenType.CLOSE_BRACE) || peek().is(TokenType.EOF)) {
                    return sb.toString();
                }
                return sb.append(' ').append(markupExpression()).toString();
            }
            default:
                throw error("markup");
        }
    }

    // ---- token plumbing ----

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAt(int ahead) {
        int i = Math.max(0, Math.min(index + ahead, tokens.size() - 1));
        return tokens.get(i);
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (!token.is(TokenType.EOF)) {
            index++;
        }
        return token;
    }

    private Token expect(TokenType type, String expected) throws ParseException {
        if (!peek().is(type)) {
            throw error(expected);
        }
        return advance();
    }

    private int expectNumber(String expected) throws ParseException {
        return number(expect(TokenType.NUMBER, expected), expected);
    }

    private int expectPositive(String expected) throws ParseException {
        Token token = expect(TokenType.NUMBER, expected);
        int value = number(token, expected);
        if (value == 0) {
            throw new ParseException(source, token.offset, expected, token.describe());
        }
        return value;
    }

    private int number(Token token, String expected) throws ParseException {
        try {
            return Integer.parseInt(token.text);
        } catch (NumberFormatException e) {
            throw new ParseException(source, token.offset, expected, token.describe());
        }
    }

    /**
     * Unmeasured (0) or a subdivision of at least 8 that is a power of two.
     */
    private int tremolo(Token token) throws ParseException {
        String expected = "tremolo subdivision 8, 16, 32, ...";
        int value = number(token, expected);
        if (value != 0 && (value < 8 || Integer.bitCount(value) != 1)) {
            throw new ParseException(source, token.offset, expected, token.describe());
        }
        return value;
    }

    private ParseException error(String expected) {
        Token found = peek();
        return new ParseException(source, found.offset, expected, found.describe());
    }
}
