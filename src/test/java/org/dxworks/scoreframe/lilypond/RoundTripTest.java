package org.dxworks.scoreframe.lilypond;

import org.dxworks.scoreframe.ScoreConverter;
import org.dxworks.scoreframe.TestUtils;
import org.dxworks.scoreframe.lilypond.importer.ImportedScore;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Importing the exported text gives back the same tree and store, and exporting it again gives the
 * same text.
 */
public class RoundTripTest {

    private final ScoreConverter converter = new ScoreConverter();

    @ParameterizedTest
    @ValueSource(strings = {"piano.ly", "ornaments.ly", "repeats.ly", "choir.ly"})
    void samplesSurviveImportExportImport(String fileName) throws Exception {
        String source = TestUtils.readSample(fileName);

        ImportedScore first = converter.importLilyPond(source).value;
        String exported = converter.exportLilyPond(first).value;
        ImportedScore second = converter.importLilyPond(exported).value;

        assertEquals(json(first.document), json(second.document));
        assertEquals(json(first.store), json(second.store));
        assertEquals(exported, converter.exportLilyPond(second).value);
        assertTrue(converter.validate(second.document).isValid());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{ c'4 d' e' f' }",
            "{ c'4:32 d'2: }",
            "{ \\tuplet 3/2 4 { c'8 d' e' } \\times 2/3 { f'4 g' a' } }",
            "{ <c' e' g'>4 q q2 }",
            "{ c'4( d' e'\\( f'\\) g') }",
            "{ c'4 \\markup { \\italic \"dolce\" } d'2 }",
            "\\relative { c4 e g c, <c e g> q b4\\rest c' }",
            "{ c'4 \\bar \"||\" \\clef \"treble_8\" d' }"
    })
    void canonicalTextIsStable(String source) throws Exception {
        String once = converter.roundTrip(source).value;
        assertEquals(once, converter.roundTrip(once).value);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{ \\tuplet 3/2 { c'8 d' e' } \\tuplet 3/2 { | f' g' a' } }",
            "{ \\repeat volta 2 { c'4 d' } \\alternative { { | e' } { f' } } }",
            "\\new Staff << { c'4 d' | } \\\\ { | e' f' } >>",
            "{ \\grace { \\tuplet 3/2 { c''16 d'' e'' } } f'4 }",
            "{ \\tuplet 3/2 { \\grace { c''16 } d''8 e'' f'' } }",
            "\\new Staff << { c'4 } { e' } >>",
            "{ \\tuplet 3/2 { c'8 \\tuplet 5/4 { d'16 e' f' g' a' } b'8 } }"
    })
    void canonicalTextComesBackUnchanged(String source) throws Exception {
        assertEquals(source, converter.roundTrip(source).value);
    }

    private static String json(Object value) throws Exception {
        return TestUtils.APPROVAL_MAPPER.writeValueAsString(value);
    }
}
