package org.dxworks.scoreframe;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public class FormatDetector {

    public static Optional<ScoreFormat> detectFormat(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);

        if (fileName.endsWith(".ly")) {
            return Optional.of(ScoreFormat.LILYPOND);
        }

        return Optional.empty();
    }
}
