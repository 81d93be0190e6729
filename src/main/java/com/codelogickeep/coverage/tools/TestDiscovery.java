package com.codelogickeep.coverage.tools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Locates test classes by the usual naming conventions in the mirrored package directory.
 */
public class TestDiscovery {

    private static final String[] TEST_SUFFIXES = {"Test", "Tests", "TestCase"};
    private static final String[] TEST_PREFIXES = {"Test"};

    private final Path sourceRoot;
    private final Path testRoot;

    public TestDiscovery(Path sourceRoot, Path testRoot) {
        this.sourceRoot = sourceRoot.toAbsolutePath().normalize();
        this.testRoot = testRoot.toAbsolutePath().normalize();
    }

    public Path getTestRoot() {
        return testRoot;
    }

    /**
     * Conventional {@code <Name>Test.java} location for a source file, whether or not it exists.
     */
    public Path expectedTestPath(Path sourceFile) {
        return testDirectoryFor(sourceFile).resolve(classNameOf(sourceFile) + "Test.java");
    }

    /**
     * Existing test file for the source file under any supported naming convention.
     */
    public Optional<Path> findTestFile(Path sourceFile) {
        Path testDir = testDirectoryFor(sourceFile);
        String className = classNameOf(sourceFile);

        for (String suffix : TEST_SUFFIXES) {
            Path testPath = testDir.resolve(className + suffix + ".java");
            if (Files.exists(testPath)) {
                return Optional.of(testPath);
            }
        }
        for (String prefix : TEST_PREFIXES) {
            Path testPath = testDir.resolve(prefix + className + ".java");
            if (Files.exists(testPath)) {
                return Optional.of(testPath);
            }
        }
        return Optional.empty();
    }

    /**
     * All Java files under the test root, sorted; empty when the root is absent.
     */
    public List<Path> listTestFiles() throws IOException {
        if (!Files.isDirectory(testRoot)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.find(testRoot, Integer.MAX_VALUE,
                (p, attr) -> attr.isRegularFile() && p.toString().endsWith(".java"))) {
            return stream.sorted().collect(Collectors.toList());
        }
    }

    /**
     * Fully qualified class name derived from the path relative to the source root.
     */
    public String qualifiedClassName(Path sourceFile) {
        Path normalized = sourceFile.toAbsolutePath().normalize();
        Path relative = normalized.startsWith(sourceRoot) ? sourceRoot.relativize(normalized) : normalized.getFileName();
        String name = relative.toString().replace('\\', '/');
        if (name.endsWith(".java")) {
            name = name.substring(0, name.length() - ".java".length());
        }
        return name.replace('/', '.');
    }

    private Path testDirectoryFor(Path sourceFile) {
        Path normalized = sourceFile.toAbsolutePath().normalize();
        if (normalized.startsWith(sourceRoot)) {
            Path parent = sourceRoot.relativize(normalized).getParent();
            return parent == null ? testRoot : testRoot.resolve(parent);
        }
        return testRoot;
    }

    private static String classNameOf(Path sourceFile) {
        String fileName = sourceFile.getFileName().toString();
        return fileName.endsWith(".java") ? fileName.substring(0, fileName.length() - ".java".length()) : fileName;
    }
}
