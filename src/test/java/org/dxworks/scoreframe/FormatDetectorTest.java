package org.dxworks.scoreframe;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class FormatDetectorTest {

    @Test
    void lilyPondFilesAreDetectedByExtension() {
        assertEquals(ScoreFormat.LILYPOND, FormatDetector.detectFormat(Paths.get("scores", "etude.ly")).orElseThrow());
        assertEquals(ScoreFormat.LILYPOND, FormatDetector.detectFormat(Paths.get("ETUDE.LY")).orElseThrow());
    }

    @Test
    void otherFilesAreIgnored() {
        assertTrue(FormatDetector.detectFormat(Paths.get("etude.musicxml")).isEmpty());
        assertTrue(FormatDetector.detectFormat(Paths.get("etude.ly.bak")).isEmpty());
        assertTrue(FormatDetector.detectFormat(Paths.get("README")).isEmpty());
    }
}
