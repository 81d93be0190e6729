package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.tools.TestDiscovery;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Percentage of test methods that assert or verify something.
 * <p>
 * A test method is any method annotated {@code @Test}, {@code @ParameterizedTest} or
 * {@code @RepeatedTest}; it asserts when its body calls a method named {@code assert*},
 * {@code verify*}, {@code fail} or {@code expect*}. No test methods scores 0.
 */
@Slf4j
public class AssertionDensityScorer implements TestQualityScorer {

    private static final Set<String> TEST_ANNOTATIONS = Set.of("Test", "ParameterizedTest", "RepeatedTest");

    private final TestDiscovery testDiscovery;
    private final JavaParser parser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    public AssertionDensityScorer(TestDiscovery testDiscovery) {
        this.testDiscovery = testDiscovery;
    }

    @Override
    public double score() {
        List<Path> testFiles;
        try {
            testFiles = testDiscovery.listTestFiles();
        } catch (IOException e) {
            log.warn("Cannot list test sources: {}", e.getMessage());
            return 0.0;
        }

        int testMethods = 0;
        int asserting = 0;
        for (Path file : testFiles) {
            try {
                ParseResult<CompilationUnit> result = parser.parse(file);
                if (result.getResult().isEmpty()) {
                    log.debug("Skipping unparsable test source {}", file);
                    continue;
                }
                for (MethodDeclaration method : result.getResult().get().findAll(MethodDeclaration.class)) {
                    if (!isTestMethod(method)) {
                        continue;
                    }
                    testMethods++;
                    if (hasAssertion(method)) {
                        asserting++;
                    }
                }
            } catch (IOException e) {
                log.warn("Skipping unreadable test source {}: {}", file, e.getMessage());
            }
        }

        if (testMethods == 0) {
            return 0.0;
        }
        double score = asserting * 100.0 / testMethods;
        log.debug("{} of {} test methods assert", asserting, testMethods);
        return score;
    }

    private static boolean isTestMethod(MethodDeclaration method) {
        return method.getAnnotations().stream()
                .anyMatch(a -> TEST_ANNOTATIONS.contains(a.getName().getIdentifier()));
    }

    private static boolean hasAssertion(MethodDeclaration method) {
        return method.findAll(MethodCallExpr.class).stream()
                .map(MethodCallExpr::getNameAsString)
                .anyMatch(name -> name.startsWith("assert")
                        || name.startsWith("verify")
                        || name.startsWith("expect")
                        || name.equals("fail"));
    }
}
