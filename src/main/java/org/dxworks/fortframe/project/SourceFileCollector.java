package org.dxworks.fortframe.project;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.SourceFormDetector;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds the Fortran sources and extra-type files under a set of directories. Exclusion globs are matched against both the
 * bare name and the path relative to the directory being walked.
 */
public class SourceFileCollector {
    private final SourceFormDetector detector;
    private final List<PathMatcher> excludedFiles;
    private final List<PathMatcher> excludedDirs;

    public SourceFileCollector(FortframeConfig config) {
        FileSystem fileSystem = FileSystems.getDefault();
        this.detector = new SourceFormDetector(config);
        this.excludedFiles = config.getExclude().stream().map(g -> fileSystem.getPathMatcher("glob:" + g)).toList();
        this.excludedDirs = config.getExcludeDir().stream().map(g -> fileSystem.getPathMatcher("glob:" + g)).toList();
    }

    /** Source and extra-type files under the roots (a root may also be a single file), sorted by path. */
    public List<Path> collect(List<Path> roots) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path root : roots) {
            Path base = root.toAbsolutePath().normalize();
            if (Files.isRegularFile(base)) {
                if (isCollected(base) && !matches(excludedFiles, base.getFileName(), base.getFileName())) {
                    files.add(base);
                }
                continue;
            }
            Files.walkFileTree(base, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(base) && matches(excludedDirs, dir.getFileName(), base.relativize(dir))) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isCollected(file)
                            && !matches(excludedFiles, file.getFileName(), base.relativize(file))) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        }
        files.sort(Comparator.comparing(Path::toString));
        return files.stream().distinct().toList();
    }

    private boolean isCollected(Path file) {
        return detector.isSource(file) || detector.isExtraFile(file);
    }

    private static boolean matches(List<PathMatcher> matchers, Path name, Path relative) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(name) || matcher.matches(relative)) {
                return true;
            }
        }
        return false;
    }
}
