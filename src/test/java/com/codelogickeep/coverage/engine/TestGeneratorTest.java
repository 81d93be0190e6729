package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.CoverageFixtures;
import com.codelogickeep.coverage.model.MissingTestFile;
import com.codelogickeep.coverage.model.Priority;
import com.codelogickeep.coverage.model.TestSuggestion;
import com.codelogickeep.coverage.model.TestType;
import com.codelogickeep.coverage.tools.TestDiscovery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TestGenerator.
 * Uses small on-disk projects with a matching JaCoCo report.
 */
class TestGeneratorTest {

    @TempDir
    Path tempDir;

    private TestGenerator generator() {
        return new TestGenerator(CoverageFixtures.analyzer(tempDir), CoverageFixtures.scanner(tempDir),
                new TestDiscovery(tempDir.resolve(CoverageFixtures.SOURCE_DIR), tempDir.resolve(CoverageFixtures.TEST_DIR)));
    }

    @Nested
    @DisplayName("generateSuggestions")
    class GenerateSuggestions {

        @Test
        @DisplayName("should return nothing when coverage data is missing")
        void generateSuggestions_shouldBeEmptyWithoutData() {
            assertTrue(generator().generateSuggestions(10).isEmpty());
        }

        @Test
        @DisplayName("should order suggestions by priority then complexity")
        void generateSuggestions_shouldSortByPriority() throws IOException {
            CoverageFixtures.writeParserProject(tempDir);

            List<TestSuggestion> suggestions = generator().generateSuggestions(TestGenerator.DEFAULT_MAX_SUGGESTIONS);

            assertEquals(List.of(
                            "parse_exceptionHandling",
                            "parse_errorConditions",
                            "parse_inputEdgeCases",
                            "parse_radixEdgeCases",
                            "parse_coverage"),
                    suggestions.stream().map(TestSuggestion::getSuggestedTestName).toList());

            TestSuggestion exception = suggestions.get(0);
            assertEquals(Priority.HIGH, exception.getPriority());
            assertEquals(TestType.ERROR_HANDLING, exception.getTestType());
            assertEquals(2, exception.getComplexityScore());
            assertEquals(List.of(11), exception.getCoverageLines());
            assertEquals("ParserTest.parse_exceptionHandling", exception.getFullTestName());

            TestSuggestion errorPath = suggestions.get(1);
            assertEquals(Priority.HIGH, errorPath.getPriority());
            assertEquals(TestType.EDGE_CASE, errorPath.getTestType());
            assertEquals(List.of(7), errorPath.getCoverageLines());

            assertEquals(Priority.LOW, suggestions.get(4).getPriority());
        }

        @Test
        @DisplayName("should add one edge case suggestion per parameter")
        void generateSuggestions_shouldSuggestParameterEdgeCases() throws IOException {
            CoverageFixtures.writeParserProject(tempDir);

            List<TestSuggestion> edgeCases = generator().generateSuggestions(50).stream()
                    .filter(s -> s.getSuggestedTestName().endsWith("EdgeCases"))
                    .toList();

            assertEquals(2, edgeCases.size());
            for (TestSuggestion suggestion : edgeCases) {
                assertEquals(TestType.EDGE_CASE, suggestion.getTestType());
                assertEquals(Priority.MEDIUM, suggestion.getPriority());
                assertEquals(2, suggestion.getComplexityScore());
                assertTrue(suggestion.getCoverageLines().isEmpty());
            }
            assertTrue(edgeCases.get(0).getDescription().contains("'input'"));
        }

        @Test
        @DisplayName("should truncate to the requested count")
        void generateSuggestions_shouldTruncate() throws IOException {
            CoverageFixtures.writeParserProject(tempDir);

            List<TestSuggestion> suggestions = generator().generateSuggestions(2);

            assertEquals(2, suggestions.size());
            assertEquals("parse_exceptionHandling", suggestions.get(0).getSuggestedTestName());
        }

        @Test
        @DisplayName("plain uncovered lines should produce a low priority coverage suggestion")
        void generateSuggestions_shouldGroupPlainLines() throws IOException {
            CoverageFixtures.writeCalculatorProject(tempDir);

            List<TestSuggestion> suggestions = generator().generateSuggestions(10);

            assertEquals(1, suggestions.size());
            TestSuggestion suggestion = suggestions.get(0);
            assertEquals("describe_coverage", suggestion.getSuggestedTestName());
            assertEquals("CalculatorTest.describe_coverage", suggestion.getFullTestName());
            assertEquals(Priority.LOW, suggestion.getPriority());
            assertEquals(2, suggestion.getComplexityScore());
            assertEquals(List.of(21, 22), suggestion.getCoverageLines());
            assertTrue(suggestion.getTestTemplate().contains("void describe_coverage()"));
        }
    }

    @Test
    @DisplayName("renderTemplate should produce a compilable test class skeleton")
    void renderTemplate_shouldWrapInTestClass() throws IOException {
        CoverageFixtures.writeParserProject(tempDir);
        TestGenerator generator = generator();
        TestSuggestion exception = generator.generateSuggestions(1).get(0);

        String source = generator.renderTemplate(exception);

        assertTrue(source.startsWith("package com.example;"));
        assertTrue(source.contains("import com.example.Parser;"));
        assertTrue(source.contains("import static org.mockito.Mockito.*;"));
        assertTrue(source.contains("class ParserTest {"));
        assertTrue(source.contains("MockitoAnnotations.openMocks(this);"));
        assertTrue(source.contains("void parse_handlesExceptions()"));
        assertTrue(source.trim().endsWith("}"));
    }

    @Test
    @DisplayName("renderTemplate should wrap gaps outside any type in a class named after the file")
    void renderTemplate_shouldWrapTopLevelGaps() {
        TestSuggestion suggestion = TestSuggestion.builder()
                .filePath(tempDir.resolve("src/main/java/com/example/Helpers.java").toString())
                .testType(TestType.UNIT)
                .priority(Priority.LOW)
                .suggestedTestName("coverage")
                .testTemplate("    @Test\n    void coverage() {\n    }\n")
                .build();

        String source = generator().renderTemplate(suggestion);

        assertTrue(source.startsWith("package com.example;"));
        assertTrue(source.contains("class HelpersTest {"));
        assertFalse(source.contains("import com.example.Helpers;"));
        assertTrue(source.contains("    @Test\n    void coverage() {\n    }\n}\n"));
        assertTrue(source.trim().endsWith("}"));
    }

    @Nested
    @DisplayName("findMissingTestFiles")
    class FindMissingTestFiles {

        @Test
        @DisplayName("should report sources without a companion test")
        void findMissingTestFiles_shouldReportUntestedSources() throws IOException {
            CoverageFixtures.writeCalculatorProject(tempDir);

            List<MissingTestFile> missing = generator().findMissingTestFiles();

            assertEquals(1, missing.size());
            MissingTestFile file = missing.get(0);
            assertTrue(file.sourceFile().endsWith("Calculator.java"));
            assertEquals(tempDir.resolve("src/test/java/com/example/CalculatorTest.java").toString(),
                    file.expectedTestFile());
            assertEquals(1, file.testStructure().classes().size());
            assertEquals(List.of("add", "multiply", "negate", "describe", "twice"),
                    file.testStructure().classes().get(0).methods());
            assertTrue(file.testStructure().functions().contains("Calculator.describe"));
            assertEquals(6, file.testStructure().complexity());
            assertEquals(Priority.MEDIUM, file.priority());
        }

        @Test
        @DisplayName("should accept any supported test naming convention")
        void findMissingTestFiles_shouldHonourNamingConventions() throws IOException {
            CoverageFixtures.writeCalculatorProject(tempDir);
            Path testFile = tempDir.resolve("src/test/java/com/example/TestCalculator.java");
            Files.createDirectories(testFile.getParent());
            Files.writeString(testFile, "package com.example;\nclass TestCalculator {}\n");

            assertTrue(generator().findMissingTestFiles().isEmpty());
        }
    }

    @Test
    @DisplayName("priorityFor should scale with structure complexity")
    void priorityFor_shouldScaleWithComplexity() {
        assertEquals(Priority.LOW, TestGenerator.priorityFor(structure(5)));
        assertEquals(Priority.MEDIUM, TestGenerator.priorityFor(structure(6)));
        assertEquals(Priority.HIGH, TestGenerator.priorityFor(structure(11)));
    }

    private static MissingTestFile.TestStructure structure(int complexity) {
        return new MissingTestFile.TestStructure(List.of(), List.of(), 0, complexity);
    }
}
