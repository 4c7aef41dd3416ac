package org.dxworks.fortframe.project;

import java.nio.file.Path;

/**
 * Text filter applied to sources with a preprocessed extension before they are read.
 * Implementations throw {@link org.dxworks.fortframe.diagnostics.PreprocessingException} on failure.
 */
public interface Preprocessor {
    String preprocess(Path file);
}
