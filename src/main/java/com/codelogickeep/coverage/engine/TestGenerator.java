package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.model.CoverageGap;
import com.codelogickeep.coverage.model.GapType;
import com.codelogickeep.coverage.model.MissingTestFile;
import com.codelogickeep.coverage.model.Priority;
import com.codelogickeep.coverage.model.Severity;
import com.codelogickeep.coverage.model.TestSuggestion;
import com.codelogickeep.coverage.model.TestType;
import com.codelogickeep.coverage.tools.ScopeNode;
import com.codelogickeep.coverage.tools.ScopeTree;
import com.codelogickeep.coverage.tools.SourceScanner;
import com.codelogickeep.coverage.tools.TestDiscovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns coverage gaps into prioritized JUnit 5 test suggestions and finds sources
 * without a companion test class.
 */
public class TestGenerator {
    private static final Logger log = LoggerFactory.getLogger(TestGenerator.class);

    public static final int DEFAULT_MAX_SUGGESTIONS = 50;

    private static final Comparator<TestSuggestion> BY_PRIORITY_THEN_COMPLEXITY = Comparator
            .comparingInt((TestSuggestion s) -> s.getPriority().getRank())
            .thenComparingInt(TestSuggestion::getComplexityScore)
            .reversed();

    private final CoverageAnalyzer analyzer;
    private final SourceScanner scanner;
    private final TestDiscovery testDiscovery;

    public TestGenerator(CoverageAnalyzer analyzer, SourceScanner scanner, TestDiscovery testDiscovery) {
        this.analyzer = analyzer;
        this.scanner = scanner;
        this.testDiscovery = testDiscovery;
    }

    /**
     * One suggestion per scope and gap type, plus one edge-case suggestion per parameter
     * of each resolvable method, sorted by priority then complexity and truncated.
     * Empty when coverage data cannot be loaded.
     */
    public List<TestSuggestion> generateSuggestions(int maxCount) {
        if (!analyzer.isLoaded() && !analyzer.load()) {
            return List.of();
        }

        Map<String, List<CoverageGap>> gapsByFile = new LinkedHashMap<>();
        for (CoverageGap gap : analyzer.analyzeGaps()) {
            gapsByFile.computeIfAbsent(gap.getFilePath(), k -> new ArrayList<>()).add(gap);
        }

        List<TestSuggestion> suggestions = new ArrayList<>();
        for (Map.Entry<String, List<CoverageGap>> entry : gapsByFile.entrySet()) {
            try {
                suggestions.addAll(fileSuggestions(entry.getKey(), entry.getValue()));
            } catch (RuntimeException e) {
                log.warn("Error generating suggestions for {}: {}", entry.getKey(), e.getMessage());
            }
        }

        suggestions.sort(BY_PRIORITY_THEN_COMPLEXITY);
        return suggestions.size() > maxCount ? new ArrayList<>(suggestions.subList(0, maxCount)) : suggestions;
    }

    private List<TestSuggestion> fileSuggestions(String filePath, List<CoverageGap> gaps) {
        ScopeTree scopes = analyzer.parsedSource(Paths.get(filePath))
                .map(CoverageAnalyzer.ParsedSource::scopes)
                .orElse(ScopeTree.empty());

        Map<Scope, List<CoverageGap>> gapsByScope = new LinkedHashMap<>();
        for (CoverageGap gap : gaps) {
            gapsByScope.computeIfAbsent(new Scope(gap.getClassName(), gap.getFunctionName()), k -> new ArrayList<>())
                    .add(gap);
        }

        List<TestSuggestion> suggestions = new ArrayList<>();
        for (Map.Entry<Scope, List<CoverageGap>> entry : gapsByScope.entrySet()) {
            Scope scope = entry.getKey();
            Map<GapType, List<CoverageGap>> byType = new EnumMap<>(GapType.class);
            for (CoverageGap gap : entry.getValue()) {
                byType.computeIfAbsent(gap.getGapType(), k -> new ArrayList<>()).add(gap);
            }
            for (Map.Entry<GapType, List<CoverageGap>> typed : byType.entrySet()) {
                suggestions.add(suggestionFor(filePath, scope, typed.getKey(), typed.getValue()));
            }

            List<String> parameters = resolveParameters(scopes, scope);
            for (String parameter : parameters) {
                suggestions.add(edgeCaseSuggestion(filePath, scope, parameter, parameters.size()));
            }
        }
        return suggestions;
    }

    /**
     * Parameters of the method named by the scope, declared inside the scope's class.
     * Overloads resolve to the first declaration.
     */
    private static List<String> resolveParameters(ScopeTree scopes, Scope scope) {
        if (scope.function() == null) {
            return List.of();
        }
        for (ScopeNode function : scopes.scopes(ScopeNode.Kind.FUNCTION)) {
            if (!function.name().equals(scope.function())) {
                continue;
            }
            String owner = scopes.innermost(function.declarationLine(), ScopeNode.Kind.CLASS)
                    .map(ScopeNode::name)
                    .orElse(null);
            if (Objects.equals(owner, scope.className())) {
                return function.parameters();
            }
        }
        return List.of();
    }

    private TestSuggestion suggestionFor(String filePath, Scope scope, GapType type, List<CoverageGap> gaps) {
        String fn = scope.function();
        String target = fn != null ? fn : "code";
        TestSuggestion.TestSuggestionBuilder builder = TestSuggestion.builder()
                .filePath(filePath)
                .functionName(fn)
                .className(scope.className())
                .coverageLines(gaps.stream().map(CoverageGap::getLineStart).collect(Collectors.toList()))
                .complexityScore(gaps.stream().mapToInt(g -> Math.max(1, g.getComplexityScore())).sum());

        switch (type) {
            case MISSING_BRANCH -> {
                boolean severe = gaps.stream().anyMatch(g ->
                        g.getSeverity() == Severity.CRITICAL || g.getSeverity() == Severity.HIGH);
                String description = "Test branch conditions in " + target;
                if (gaps.size() > 1) {
                    description += " (" + gaps.size() + " uncovered branches)";
                }
                builder.testType(TestType.UNIT)
                        .priority(severe ? Priority.HIGH : Priority.MEDIUM)
                        .description(description)
                        .suggestedTestName(testName(fn, "branchCoverage"))
                        .testTemplate(branchTemplate(fn));
            }
            case EXCEPTION_HANDLING -> builder.testType(TestType.ERROR_HANDLING)
                    .priority(Priority.HIGH)
                    .description("Test exception handling in " + target)
                    .suggestedTestName(testName(fn, "exceptionHandling"))
                    .testTemplate(exceptionTemplate(fn));
            case UNCOVERED_FUNCTION -> builder.testType(TestType.UNIT)
                    .priority(Priority.MEDIUM)
                    .description("Test basic functionality of " + (fn != null ? fn : "function"))
                    .suggestedTestName(testName(fn, "basicFunctionality"))
                    .testTemplate(functionTemplate(fn));
            case ERROR_PATH -> builder.testType(TestType.EDGE_CASE)
                    .priority(Priority.HIGH)
                    .description("Test error conditions and edge cases in " + target)
                    .suggestedTestName(testName(fn, "errorConditions"))
                    .testTemplate(errorPathTemplate(fn));
            default -> builder.testType(TestType.UNIT)
                    .priority(Priority.LOW)
                    .description("Improve test coverage for " + target)
                    .suggestedTestName(testName(fn, "coverage"))
                    .testTemplate(genericTemplate(fn));
        }
        return builder.build();
    }

    private TestSuggestion edgeCaseSuggestion(String filePath, Scope scope, String parameter, int parameterCount) {
        String fn = scope.function();
        String name = fn + "_" + parameter + "EdgeCases";
        return TestSuggestion.builder()
                .filePath(filePath)
                .functionName(fn)
                .className(scope.className())
                .testType(TestType.EDGE_CASE)
                .priority(Priority.MEDIUM)
                .description("Test edge cases for parameter '" + parameter + "' of " + fn)
                .suggestedTestName(name)
                .testTemplate(testMethod(name, "Edge cases for the " + parameter + " parameter.", List.of(
                        "// TODO: null value",
                        "// TODO: empty value",
                        "// TODO: boundary values",
                        "// TODO: invalid values")))
                .coverageLines(List.of())
                .complexityScore(parameterCount)
                .build();
    }

    private static String testName(String function, String suffix) {
        return function != null ? function + "_" + suffix : suffix;
    }

    private static String branchTemplate(String fn) {
        if (fn == null) {
            return "    // TODO: add branch coverage tests\n";
        }
        return testMethod(fn + "_trueCondition", fn + " when the condition holds.", List.of(
                "// TODO: arrange input for the true branch",
                "// TODO: call " + fn + " and assert the result"))
                + "\n"
                + testMethod(fn + "_falseCondition", fn + " when the condition does not hold.", List.of(
                "// TODO: arrange input for the false branch",
                "// TODO: call " + fn + " and assert the result"));
    }

    private static String exceptionTemplate(String fn) {
        if (fn == null) {
            return "    // TODO: add exception handling tests\n";
        }
        return testMethod(fn + "_handlesExceptions", fn + " exception handling.", List.of(
                "// TODO: arrange conditions that trigger the exception",
                "assertThrows(Exception.class, () -> {",
                "    // TODO: call " + fn + " with invalid input",
                "});"))
                + "\n"
                + testMethod(fn + "_recoversFromErrors", fn + " error recovery.", List.of(
                "// TODO: verify graceful handling and recovery"));
    }

    private static String functionTemplate(String fn) {
        if (fn == null) {
            return "    // TODO: add function tests\n";
        }
        return testMethod(fn + "_basicFunctionality", "Basic functionality of " + fn + ".", List.of(
                "// TODO: arrange",
                "// TODO: act",
                "// TODO: assert"));
    }

    private static String errorPathTemplate(String fn) {
        if (fn == null) {
            return "    // TODO: add error path tests\n";
        }
        return testMethod(fn + "_errorConditions", "Error conditions in " + fn + ".", List.of(
                "// TODO: invalid input",
                "// TODO: boundary conditions",
                "// TODO: resource exhaustion"));
    }

    private static String genericTemplate(String fn) {
        if (fn == null) {
            return "    // TODO: add coverage tests\n";
        }
        return testMethod(fn + "_coverage", "Covers the remaining lines of " + fn + ".", List.of(
                "// TODO: exercise the uncovered lines"));
    }

    private static String testMethod(String name, String doc, List<String> body) {
        StringBuilder sb = new StringBuilder();
        sb.append("    /** ").append(doc).append(" */\n");
        sb.append("    @Test\n");
        sb.append("    void ").append(name).append("() {\n");
        for (String line : body) {
            sb.append("        ").append(line).append('\n');
        }
        sb.append("    }\n");
        return sb.toString();
    }

    /**
     * Sources lacking a companion test under any supported naming convention.
     */
    public List<MissingTestFile> findMissingTestFiles() {
        List<Path> sources;
        try {
            sources = scanner.scanSources();
        } catch (IOException e) {
            log.warn("Cannot scan {}: {}", scanner.getSourceRoot(), e.getMessage());
            return List.of();
        }

        List<MissingTestFile> missing = new ArrayList<>();
        for (Path source : sources) {
            String fileName = source.getFileName().toString();
            if (fileName.equals("package-info.java") || fileName.equals("module-info.java")) {
                continue;
            }
            if (testDiscovery.findTestFile(source).isPresent()) {
                continue;
            }
            MissingTestFile.TestStructure structure = analyzeStructure(source);
            missing.add(new MissingTestFile(
                    source.toString(),
                    testDiscovery.expectedTestPath(source).toString(),
                    structure,
                    priorityFor(structure)));
        }
        return missing;
    }

    private MissingTestFile.TestStructure analyzeStructure(Path source) {
        Optional<CoverageAnalyzer.ParsedSource> parsed = analyzer.parsedSource(source);
        if (parsed.isEmpty()) {
            return MissingTestFile.TestStructure.empty();
        }
        ScopeTree scopes = parsed.get().scopes();

        List<MissingTestFile.ClassOutline> classes = new ArrayList<>();
        List<String> functions = new ArrayList<>();
        Map<ScopeNode, List<String>> methodsByClass = new LinkedHashMap<>();
        for (ScopeNode type : scopes.scopes(ScopeNode.Kind.CLASS)) {
            methodsByClass.put(type, new ArrayList<>());
        }
        for (ScopeNode function : scopes.scopes(ScopeNode.Kind.FUNCTION)) {
            Optional<ScopeNode> owner = scopes.innermost(function.declarationLine(), ScopeNode.Kind.CLASS);
            owner.ifPresent(o -> methodsByClass.get(o).add(function.name()));
            functions.add(owner.map(o -> o.name() + ".").orElse("") + function.name());
        }
        methodsByClass.forEach((type, methods) ->
                classes.add(new MissingTestFile.ClassOutline(type.name(), methods, type.declarationLine())));

        return new MissingTestFile.TestStructure(classes, functions, parsed.get().lines().size(),
                classes.size() + functions.size());
    }

    static Priority priorityFor(MissingTestFile.TestStructure structure) {
        if (structure.complexity() > 10) {
            return Priority.HIGH;
        }
        if (structure.complexity() > 5) {
            return Priority.MEDIUM;
        }
        return Priority.LOW;
    }

    /**
     * Complete test source for a suggestion: package, imports and a {@code <Class>Test} class
     * with a fixture. Gaps outside any type are wrapped in a {@code <FileName>Test} class.
     */
    public String renderTemplate(TestSuggestion suggestion) {
        Path sourceFile = Paths.get(suggestion.getFilePath());
        String qualifiedName = testDiscovery.qualifiedClassName(sourceFile);
        int lastDot = qualifiedName.lastIndexOf('.');
        String packageName = lastDot > 0 ? qualifiedName.substring(0, lastDot) : "";
        boolean errorHandling = suggestion.getTestType() == TestType.ERROR_HANDLING;

        StringBuilder sb = new StringBuilder();
        if (!packageName.isEmpty()) {
            sb.append("package ").append(packageName).append(";\n\n");
        }

        if (suggestion.getClassName() != null) {
            String topLevel = lastDot > 0 ? qualifiedName.substring(lastDot + 1) : qualifiedName;
            String imported = topLevel.equals(suggestion.getClassName())
                    ? qualifiedName
                    : qualifiedName + "." + suggestion.getClassName();
            sb.append("import ").append(imported).append(";\n");
            sb.append("import org.junit.jupiter.api.BeforeEach;\n");
        }
        sb.append("import org.junit.jupiter.api.Test;\n");
        if (errorHandling) {
            sb.append("import org.mockito.MockitoAnnotations;\n");
        }
        sb.append('\n');
        sb.append("import static org.junit.jupiter.api.Assertions.*;\n");
        if (errorHandling) {
            sb.append("import static org.mockito.Mockito.*;\n");
        }
        sb.append('\n');

        if (suggestion.getClassName() == null) {
            String fileName = sourceFile.getFileName().toString();
            String baseName = fileName.endsWith(".java") ? fileName.substring(0, fileName.length() - 5) : fileName;
            sb.append("class ").append(baseName).append("Test {\n\n");
            sb.append(suggestion.getTestTemplate());
            sb.append("}\n");
            return sb.toString();
        }

        String className = suggestion.getClassName();
        sb.append("/**\n * Tests for {@link ").append(className).append("}, generated from coverage gaps.\n */\n");
        sb.append("class ").append(className).append("Test {\n\n");
        sb.append("    @BeforeEach\n");
        sb.append("    void setUp() {\n");
        if (errorHandling) {
            sb.append("        MockitoAnnotations.openMocks(this);\n");
        }
        sb.append("        // TODO: create the ").append(className).append(" under test\n");
        sb.append("    }\n\n");
        sb.append(suggestion.getTestTemplate());
        sb.append("}\n");
        return sb.toString();
    }

    private record Scope(String className, String function) {
    }
}
