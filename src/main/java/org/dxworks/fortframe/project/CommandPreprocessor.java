package org.dxworks.fortframe.project;

import org.dxworks.fortframe.diagnostics.PreprocessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs an external preprocessor command such as {@code cpp -traditional-cpp -E -P} on a source file,
 * adding {@code -D} and {@code -I} options for the configured macros and include directories.
 * Standard output is the preprocessed text.
 */
public class CommandPreprocessor implements Preprocessor {
    private static final Logger logger = LoggerFactory.getLogger(CommandPreprocessor.class);

    private final List<String> command;
    private final Charset charset;

    public CommandPreprocessor(String command, List<String> macros, List<String> includeDirs, Charset charset) {
        this.command = new ArrayList<>(Arrays.asList(command.trim().split("\\s+")));
        macros.forEach(macro -> this.command.add("-D" + macro));
        includeDirs.forEach(dir -> this.command.add("-I" + dir));
        this.charset = charset;
    }

    public List<String> getCommand() {
        return List.copyOf(command);
    }

    @Override
    public String preprocess(Path file) {
        List<String> invocation = new ArrayList<>(command);
        invocation.add(file.toString());
        Path errors = null;
        try {
            errors = Files.createTempFile("fortframe-cpp", ".err");
            Process process = new ProcessBuilder(invocation)
                    .redirectError(errors.toFile())
                    .start();
            byte[] output;
            try (InputStream stdout = process.getInputStream()) {
                output = stdout.readAllBytes();
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                String stderr = Files.readString(errors, StandardCharsets.UTF_8).strip();
                throw new PreprocessingException(file.toString(),
                        "`" + String.join(" ", invocation) + "` exited with " + exitCode
                                + (stderr.isEmpty() ? "" : ": " + stderr));
            }
            logger.debug("Preprocessed {}", file);
            return SourceDecoder.decode(file.toString(), output, charset);
        } catch (IOException e) {
            throw new PreprocessingException(file.toString(), "cannot run " + command.get(0), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PreprocessingException(file.toString(), "interrupted", e);
        } finally {
            deleteQuietly(errors);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.debug("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
