package org.dxworks.scoreframe;

import org.dxworks.scoreframe.lilypond.parser.ParseException;
import org.dxworks.scoreframe.musicxml.model.PartList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AppTest {

    @TempDir
    Path tempDir;

    private final ScoreConverter converter = new ScoreConverter();

    @Test
    void convertFileReportsAllResultsOfOneScore() throws Exception {
        Path file = tempDir.resolve("piano.ly");
        Files.writeString(file, "\uFEFF" + TestUtils.readSample("piano.ly"), StandardCharsets.UTF_8);

        Map<String, Object> record = App.convertFile(file, converter);

        assertEquals(List.of("kind", "file", "format", "lilypond", "partList", "store", "warnings", "diagnostics"),
                List.copyOf(record.keySet()));
        assertEquals("conversion", record.get("kind"));
        assertEquals("LilyPond", record.get("format"));
        assertTrue(((String) record.get("lilypond")).startsWith("\\version \"2.24.0\""));
        assertEquals(1, ((PartList) record.get("partList")).scoreParts().size());
        assertEquals(List.of(), record.get("warnings"));
        assertEquals(List.of(), record.get("diagnostics"));
        assertDoesNotThrow(() -> TestUtils.APPROVAL_MAPPER.writeValueAsString(record));
    }

    @Test
    void syntaxErrorsPropagateWithTheirPosition() throws Exception {
        Path file = tempDir.resolve("broken.ly");
        Files.writeString(file, "{ c'4 d'3 }", StandardCharsets.UTF_8);

        ParseException e = assertThrows(ParseException.class, () -> App.convertFile(file, converter));
        assertEquals(1, e.getLine());
        assertEquals(9, e.getColumn());
    }
}
