package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.engine.GapClassifier.LineContext;
import com.codelogickeep.coverage.model.GapType;
import com.codelogickeep.coverage.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GapClassifier")
class GapClassifierTest {

    private final GapClassifier classifier = new GapClassifier();

    private static LineContext inFunction(String text, String function) {
        return new LineContext(text, function, "Service", false);
    }

    @Nested
    @DisplayName("Gap type")
    class GapTypes {

        @Test
        @DisplayName("conditionals should be missing branches")
        void classifyType_shouldDetectBranches() {
            assertEquals(GapType.MISSING_BRANCH, classifier.classifyType(LineContext.of("if (a && b) {")));
            assertEquals(GapType.MISSING_BRANCH, classifier.classifyType(LineContext.of("switch (mode) {")));
            assertEquals(GapType.MISSING_BRANCH, classifier.classifyType(LineContext.of("case READY:")));
            assertEquals(GapType.MISSING_BRANCH, classifier.classifyType(LineContext.of("default:")));
        }

        @Test
        @DisplayName("catch and finally should be exception handling")
        void classifyType_shouldDetectExceptionHandling() {
            assertEquals(GapType.EXCEPTION_HANDLING, classifier.classifyType(LineContext.of("} catch (IOException e) {")));
            assertEquals(GapType.EXCEPTION_HANDLING, classifier.classifyType(LineContext.of("} finally {")));
        }

        @Test
        @DisplayName("a line declaring a method should be an uncovered function")
        void classifyType_shouldDetectFunctionDeclaration() {
            LineContext context = new LineContext("public void run() {", "run", "Service", true);

            assertEquals(GapType.UNCOVERED_FUNCTION, classifier.classifyType(context));
        }

        @Test
        @DisplayName("type declarations should be uncovered classes")
        void classifyType_shouldDetectTypeDeclaration() {
            assertEquals(GapType.UNCOVERED_CLASS, classifier.classifyType(LineContext.of("public class Service {")));
            assertEquals(GapType.UNCOVERED_CLASS, classifier.classifyType(LineContext.of("enum Mode {")));
            assertEquals(GapType.UNCOVERED_CLASS, classifier.classifyType(LineContext.of("record Point(int x, int y) {")));
        }

        @Test
        @DisplayName("throw statements should be error paths")
        void classifyType_shouldDetectErrorPath() {
            assertEquals(GapType.ERROR_PATH, classifier.classifyType(LineContext.of("throw new IllegalStateException();")));
        }

        @Test
        @DisplayName("a branch rule should win over a later rule on the same line")
        void classifyType_shouldApplyRulesInOrder() {
            assertEquals(GapType.MISSING_BRANCH,
                    classifier.classifyType(LineContext.of("if (closed) throw new IllegalStateException();")));
        }

        @Test
        @DisplayName("ordinary statements should be uncovered lines")
        void classifyType_shouldDefaultToUncoveredLines() {
            assertEquals(GapType.UNCOVERED_LINES, classifier.classifyType(LineContext.of("int total = a + b;")));
            assertEquals(GapType.UNCOVERED_LINES, classifier.classifyType(LineContext.of("String className = name;")));
        }
    }

    @Nested
    @DisplayName("Severity")
    class Severities {

        @Test
        @DisplayName("error handling and security keywords should be critical")
        void classifySeverity_shouldDetectCritical() {
            assertEquals(Severity.CRITICAL, classifier.classifySeverity(LineContext.of("throw new IOException();")));
            assertEquals(Severity.CRITICAL, classifier.classifySeverity(LineContext.of("} catch (Exception e) {")));
            assertEquals(Severity.CRITICAL, classifier.classifySeverity(LineContext.of("} finally {")));
            assertEquals(Severity.CRITICAL, classifier.classifySeverity(LineContext.of("String Password = read();")));
            assertEquals(Severity.CRITICAL, classifier.classifySeverity(LineContext.of("session.refreshToken();")));
        }

        @Test
        @DisplayName("conditionals and validation should be high")
        void classifySeverity_shouldDetectHigh() {
            assertEquals(Severity.HIGH, classifier.classifySeverity(LineContext.of("if (ready) {")));
            assertEquals(Severity.HIGH, classifier.classifySeverity(LineContext.of("validate(input);")));
            assertEquals(Severity.HIGH, classifier.classifySeverity(LineContext.of("checkState(open);")));
        }

        @Test
        @DisplayName("lines in utility functions should be medium")
        void classifySeverity_shouldDetectUtilityFunction() {
            assertEquals(Severity.MEDIUM, classifier.classifySeverity(inFunction("int x = 1;", "formatDate")));
            assertEquals(Severity.MEDIUM, classifier.classifySeverity(inFunction("int x = 1;", "parseHeader")));
        }

        @Test
        @DisplayName("anything else should be low")
        void classifySeverity_shouldDefaultToLow() {
            assertEquals(Severity.LOW, classifier.classifySeverity(inFunction("int x = 1;", "run")));
            assertEquals(Severity.LOW, classifier.classifySeverity(LineContext.of("return total;")));
        }
    }

    @Test
    @DisplayName("complexity should count branch, loop and logical tokens")
    void complexity_shouldCountTokens() {
        assertEquals(1, classifier.complexity("int x = 1;"));
        assertEquals(3, classifier.complexity("if (a && b) {"));
        assertEquals(2, classifier.complexity("for (int i = 0; i < n; i++) {"));
        assertEquals(3, classifier.complexity("while (x || y) {"));
        assertEquals(2, classifier.complexity("return ok ? a : b;"));
        assertEquals(2, classifier.complexity("} catch (IOException e) {"));
    }

    @Test
    @DisplayName("suggestTests should describe the tests that reach the line")
    void suggestTests_shouldDescribeTests() {
        List<String> suggestions = classifier.suggestTests(inFunction("if (ready) {", "start"));

        assertEquals(List.of(
                "Test both true and false conditions for: if (ready) {",
                "Test method 'start' with edge cases"), suggestions);

        assertEquals(List.of("Test error condition that triggers: throw new IOException();"),
                classifier.suggestTests(LineContext.of("throw new IOException();")));
        assertTrue(classifier.suggestTests(LineContext.of("int x = 1;")).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "// note", "/* block", " * javadoc", "*/"})
    @DisplayName("isBlankOrComment should accept blank and comment lines")
    void isBlankOrComment_shouldAcceptComments(String line) {
        assertTrue(GapClassifier.isBlankOrComment(line));
    }

    @Test
    @DisplayName("isBlankOrComment should reject code")
    void isBlankOrComment_shouldRejectCode() {
        assertFalse(GapClassifier.isBlankOrComment("int x = 1; // trailing"));
        assertFalse(GapClassifier.isBlankOrComment("}"));
    }

    @Test
    @DisplayName("rule tables should end with a catch-all default")
    void rules_shouldEndWithDefault() {
        assertEquals("default", classifier.typeRules().get(classifier.typeRules().size() - 1).name());
        assertEquals("default", classifier.severityRules().get(classifier.severityRules().size() - 1).name());
    }
}
