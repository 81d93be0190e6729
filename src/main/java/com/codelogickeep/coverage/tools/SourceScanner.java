package com.codelogickeep.coverage.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Decides which files under the source root are analyzable production sources.
 * Test classes and build output are always excluded. Exclude patterns are matched against
 * the path relative to the source root, with a leading {@code /}.
 */
public class SourceScanner {
    private static final Logger log = LoggerFactory.getLogger(SourceScanner.class);

    private static final List<Pattern> DEFAULT_EXCLUDE_PATTERNS = List.of(
            // Test classes
            Pattern.compile(".*/Test[^/]*\\.java$"),
            Pattern.compile(".*Test\\.java$"),
            Pattern.compile(".*Tests\\.java$"),
            Pattern.compile(".*IT\\.java$"),
            Pattern.compile(".*TestCase\\.java$"),
            Pattern.compile(".*/src/test/.*"),
            // Build output
            Pattern.compile(".*/target/.*"),
            Pattern.compile(".*/build/.*"),
            Pattern.compile(".*/generated-sources/.*")
    );

    private final Path sourceRoot;
    private final List<Pattern> patterns;

    public SourceScanner(Path sourceRoot, List<String> excludePatterns) {
        this.sourceRoot = sourceRoot.toAbsolutePath().normalize();
        this.patterns = new ArrayList<>(DEFAULT_EXCLUDE_PATTERNS);
        if (excludePatterns != null) {
            for (String p : excludePatterns) {
                String trimmed = p.trim();
                if (!trimmed.isEmpty()) {
                    patterns.add(Pattern.compile(trimmed));
                }
            }
        }
    }

    public Path getSourceRoot() {
        return sourceRoot;
    }

    public boolean isSourceFile(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        if (!normalized.startsWith(sourceRoot) || !normalized.toString().endsWith(".java")) {
            return false;
        }
        // Directories above the root never take part in matching
        String relative = "/" + sourceRoot.relativize(normalized).toString().replace('\\', '/');
        return !isExcluded(relative);
    }

    /**
     * Lists every analyzable source file, sorted by path. A missing root yields an empty list.
     */
    public List<Path> scanSources() throws IOException {
        if (!Files.isDirectory(sourceRoot)) {
            log.warn("Source root does not exist: {}", sourceRoot);
            return List.of();
        }
        try (Stream<Path> stream = Files.find(sourceRoot, Integer.MAX_VALUE,
                (p, attr) -> attr.isRegularFile() && p.toString().endsWith(".java"))) {
            List<Path> result = stream
                    .filter(this::isSourceFile)
                    .sorted()
                    .collect(Collectors.toList());
            log.debug("Found {} source files under {}", result.size(), sourceRoot);
            return result;
        }
    }

    private boolean isExcluded(String path) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(path).matches()) {
                return true;
            }
        }
        return false;
    }
}
