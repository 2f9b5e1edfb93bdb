package org.dxworks.mathrules;

import java.nio.file.Path;
import java.util.Optional;

public class InputFormatDetector {

    public static Optional<InputFormat> detectFormat(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase();

        if (fileName.endsWith(".xml") || fileName.endsWith(".mml")) {
            return Optional.of(InputFormat.MATHML);
        } else if (fileName.endsWith(".json")) {
            return Optional.of(InputFormat.JSON);
        }

        return Optional.empty();
    }
}
