package org.dxworks.fortframe.project;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.SourceForm;
import org.dxworks.fortframe.SourceFormDetector;
import org.dxworks.fortframe.correlate.ExternalLinkDirectory;
import org.dxworks.fortframe.diagnostics.*;
import org.dxworks.fortframe.model.GenericSourceEntity;
import org.dxworks.fortframe.model.ModuleEntity;
import org.dxworks.fortframe.model.SourceFileEntity;
import org.dxworks.fortframe.parser.FortranParser;
import org.dxworks.fortframe.parser.GenericSourceParser;
import org.dxworks.fortframe.parser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Builds a {@link Project}: finds the sources, parses each file on its own (on a worker pool when
 * {@code parallel > 0}), merges the results in path order and loads the external link directories.
 * Files of an extra file type are not parsed as Fortran; only their documentation comments are read.
 * <p>
 * A file that fails to preprocess, decode or parse aborts loading, unless force mode is on; then the
 * file is dropped, an ERROR diagnostic is recorded and loading continues.
 */
public class ProjectLoader {
    private static final Logger logger = LoggerFactory.getLogger(ProjectLoader.class);

    private final FortframeConfig config;
    private final SourceFormDetector detector;
    private final FortranParser parser;
    private final GenericSourceParser genericParser;
    private final Preprocessor preprocessor;

    public ProjectLoader(FortframeConfig config) {
        this(config, new CommandPreprocessor(config.getPreprocessor(), config.getMacros(),
                config.getIncludeDirs(), config.getEncoding()));
    }

    public ProjectLoader(FortframeConfig config, Preprocessor preprocessor) {
        this.config = config;
        this.detector = new SourceFormDetector(config);
        this.parser = new FortranParser(config);
        this.genericParser = new GenericSourceParser(config);
        this.preprocessor = preprocessor;
    }

    public Project load(List<Path> sourceDirs) throws IOException {
        List<Path> files = new SourceFileCollector(config).collect(sourceDirs);
        logger.debug("Found {} source files", files.size());
        return load(sourceDirs, files);
    }

    private Project load(List<Path> sourceDirs, List<Path> files) {
        List<FileOutcome> outcomes = config.getParallel() == 0 ? parseSequentially(files) : parseInParallel(files);

        List<SourceFileEntity> parsed = new ArrayList<>();
        List<GenericSourceEntity> extraFiles = new ArrayList<>();
        Diagnostics diagnostics = new Diagnostics();
        for (FileOutcome outcome : outcomes) {
            if (outcome.failure == null) {
                if (outcome.sourceFile != null) {
                    parsed.add(outcome.sourceFile);
                } else {
                    extraFiles.add(outcome.extraFile);
                }
                diagnostics.addAll(outcome.diagnostics);
                continue;
            }
            if (!config.isForce()) {
                throw outcome.failure;
            }
            logger.warn("Skipping {}: {}", outcome.file, outcome.failure.getMessage());
            diagnostics.add(toDiagnostic(outcome.file, outcome.failure));
        }
        List<ModuleEntity> external = loadExternalProjects(diagnostics);
        logger.debug("Parsed {} of {} files from {}", parsed.size() + extraFiles.size(), files.size(), sourceDirs);
        return new Project(config, parsed, extraFiles, external, diagnostics);
    }

    private List<FileOutcome> parseSequentially(List<Path> files) {
        List<FileOutcome> outcomes = new ArrayList<>();
        for (Path file : files) {
            FileOutcome outcome = parseFile(file);
            outcomes.add(outcome);
            if (outcome.failure != null && !config.isForce()) {
                break;
            }
        }
        return outcomes;
    }

    private List<FileOutcome> parseInParallel(List<Path> files) {
        ExecutorService pool = Executors.newFixedThreadPool(config.getParallel());
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(pool.submit(() -> parseFile(file)));
            }
            List<FileOutcome> outcomes = new ArrayList<>();
            for (Future<FileOutcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FortframeException("Interrupted while parsing sources", e);
        } catch (ExecutionException e) {
            throw new FortframeException("Parser failed unexpectedly: " + e.getCause().getMessage(), e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    /** Parses one file; per-file failures are returned, not thrown, so the merge can apply force mode in order. */
    FileOutcome parseFile(Path file) {
        String path = file.toString().replace('\\', '/');
        try {
            Optional<String> commentMarker = detector.extraFileComment(file);
            if (commentMarker.isPresent()) {
                String text = SourceDecoder.decode(path, Files.readAllBytes(file), config.getEncoding());
                Diagnostics diagnostics = new Diagnostics();
                GenericSourceEntity extraFile = genericParser.parse(path, text, commentMarker.get(), diagnostics);
                logger.debug("Read documentation of {}", path);
                return FileOutcome.extraFile(path, extraFile, diagnostics);
            }
            SourceForm form = detector.detectForm(file).orElse(SourceForm.FREE);
            boolean preprocessed = detector.needsPreprocessing(file);
            String text = preprocessed
                    ? preprocessor.preprocess(file)
                    : SourceDecoder.decode(path, Files.readAllBytes(file), config.getEncoding());
            ParseResult result = parser.parse(path, text, form);
            result.getSourceFile().preprocessed = preprocessed;
            logger.debug("Parsed {}", path);
            return FileOutcome.parsed(path, result);
        } catch (StructuralParseException | SourceEncodingException | PreprocessingException e) {
            return FileOutcome.failed(path, e);
        } catch (IOException e) {
            return FileOutcome.failed(path, new FortframeException("Cannot read " + path + ": " + e.getMessage(), e));
        }
    }

    private List<ModuleEntity> loadExternalProjects(Diagnostics diagnostics) {
        List<ModuleEntity> modules = new ArrayList<>();
        for (Map.Entry<String, String> entry : config.getExternal().entrySet()) {
            try {
                List<ModuleEntity> loaded = ExternalLinkDirectory.read(entry.getValue()).toModules();
                logger.debug("Loaded {} modules of external project {}", loaded.size(), entry.getKey());
                modules.addAll(loaded);
            } catch (ConfigurationException e) {
                logger.warn("External project {} ignored: {}", entry.getKey(), e.getMessage());
                diagnostics.warn(entry.getValue(), 0, DiagnosticKind.CONFIGURATION, e.getMessage());
            }
        }
        return modules;
    }

    private static Diagnostic toDiagnostic(String file, FortframeException failure) {
        if (failure instanceof StructuralParseException structural) {
            return new Diagnostic(file, structural.getLine(), Severity.ERROR, DiagnosticKind.STRUCTURAL,
                    structural.getReason());
        }
        DiagnosticKind kind = failure instanceof SourceEncodingException ? DiagnosticKind.ENCODING
                : failure instanceof PreprocessingException ? DiagnosticKind.PREPROCESSING
                : DiagnosticKind.STRUCTURAL;
        return new Diagnostic(file, 0, Severity.ERROR, kind, failure.getMessage());
    }

    static final class FileOutcome {
        final String file;
        final SourceFileEntity sourceFile;
        final GenericSourceEntity extraFile;
        final Diagnostics diagnostics;
        final FortframeException failure;

        private FileOutcome(String file, SourceFileEntity sourceFile, GenericSourceEntity extraFile,
                            Diagnostics diagnostics, FortframeException failure) {
            this.file = file;
            this.sourceFile = sourceFile;
            this.extraFile = extraFile;
            this.diagnostics = diagnostics;
            this.failure = failure;
        }

        static FileOutcome parsed(String file, ParseResult result) {
            return new FileOutcome(file, result.getSourceFile(), null, result.getDiagnostics(), null);
        }

        static FileOutcome extraFile(String file, GenericSourceEntity extraFile, Diagnostics diagnostics) {
            return new FileOutcome(file, null, extraFile, diagnostics, null);
        }

        static FileOutcome failed(String file, FortframeException failure) {
            return new FileOutcome(file, null, null, null, failure);
        }
    }
}
