package org.dxworks.fortframe;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Maps file extensions to source form using the configured extension lists, and recognises the
 * extra non-Fortran file types. Case-sensitive, like the lists.
 */
public class SourceFormDetector {
    private final FortframeConfig config;

    public SourceFormDetector(FortframeConfig config) {
        this.config = config;
    }

    public Optional<SourceForm> detectForm(Path filePath) {
        String extension = extensionOf(filePath);
        if (extension == null) {
            return Optional.empty();
        }
        if (config.getFixedExtensions().contains(extension)) {
            return Optional.of(SourceForm.FIXED);
        }
        if (config.getExtensions().contains(extension) || config.getFppExtensions().contains(extension)) {
            return Optional.of(SourceForm.FREE);
        }
        return Optional.empty();
    }

    public boolean needsPreprocessing(Path filePath) {
        String extension = extensionOf(filePath);
        return extension != null && config.getFppExtensions().contains(extension);
    }

    public boolean isSource(Path filePath) {
        return detectForm(filePath).isPresent();
    }

    /** Comment marker of an extra file type, or empty for Fortran and unknown files. */
    public Optional<String> extraFileComment(Path filePath) {
        String extension = extensionOf(filePath);
        return extension == null ? Optional.empty() : Optional.ofNullable(config.getExtraFiletypes().get(extension));
    }

    public boolean isExtraFile(Path filePath) {
        return extraFileComment(filePath).isPresent();
    }

    private static String extensionOf(Path filePath) {
        String fileName = filePath.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        if (lastDot <= 0 || lastDot == fileName.length() - 1) {
            return null;
        }
        return fileName.substring(lastDot + 1);
    }
}
