package com.codelogickeep.coverage;

import com.codelogickeep.coverage.engine.CoverageAnalyzer;
import com.codelogickeep.coverage.engine.FixedTestQualityScorer;
import com.codelogickeep.coverage.engine.GapClassifier;
import com.codelogickeep.coverage.tools.JacocoCoverageDataSource;
import com.codelogickeep.coverage.tools.SourceScanner;
import com.codelogickeep.coverage.tools.SourceScopeParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Small projects on disk with a matching JaCoCo report, shared by the engine and report tests.
 */
public final class CoverageFixtures {

    public static final String SOURCE_DIR = "src/main/java";
    public static final String TEST_DIR = "src/test/java";
    public static final String JACOCO_REPORT = "target/site/jacoco/jacoco.xml";

    /**
     * Five single-statement methods; {@code describe} (lines 21-22) is never executed.
     */
    public static final String CALCULATOR_SOURCE = """
            package com.example;

            public class Calculator {

                public int add(int a, int b) {
                    int sum = a + b;
                    return sum;
                }

                public int multiply(int a, int b) {
                    int product = a * b;
                    return product;
                }

                public int negate(int value) {
                    int result = -value;
                    return result;
                }

                public String describe() {
                    String text = "calc";
                    return text;
                }

                public int twice(int value) {
                    int doubled = value * 2;
                    return doubled;
                }
            }
            """;

    public static final String CALCULATOR_REPORT = """
            <?xml version="1.0" encoding="UTF-8" standalone="yes"?>
            <!DOCTYPE report PUBLIC "-//JACOCO//DTD Report 1.1//EN" "report.dtd">
            <report name="calculator">
                <package name="com/example">
                    <class name="com/example/Calculator" sourcefilename="Calculator.java"/>
                    <sourcefile name="Calculator.java">
                        <line nr="6" mi="0" ci="4" mb="0" cb="0"/>
                        <line nr="7" mi="0" ci="2" mb="0" cb="0"/>
                        <line nr="11" mi="0" ci="4" mb="0" cb="0"/>
                        <line nr="12" mi="0" ci="2" mb="0" cb="0"/>
                        <line nr="16" mi="0" ci="3" mb="0" cb="0"/>
                        <line nr="17" mi="0" ci="2" mb="0" cb="0"/>
                        <line nr="21" mi="2" ci="0" mb="0" cb="0"/>
                        <line nr="22" mi="2" ci="0" mb="0" cb="0"/>
                        <line nr="26" mi="0" ci="4" mb="0" cb="0"/>
                        <line nr="27" mi="0" ci="2" mb="0" cb="0"/>
                    </sourcefile>
                </package>
            </report>
            """;

    /**
     * Null check throwing on line 7 and a catch block on lines 11-12, none of them executed.
     */
    public static final String PARSER_SOURCE = """
            package com.example;

            public class Parser {

                public int parse(String input, int radix) {
                    if (input == null) {
                        throw new IllegalArgumentException("input");
                    }
                    try {
                        return Integer.parseInt(input, radix);
                    } catch (NumberFormatException e) {
                        return -1;
                    }
                }
            }
            """;

    public static final String PARSER_REPORT = """
            <?xml version="1.0" encoding="UTF-8" standalone="yes"?>
            <!DOCTYPE report PUBLIC "-//JACOCO//DTD Report 1.1//EN" "report.dtd">
            <report name="parser">
                <package name="com/example">
                    <class name="com/example/Parser" sourcefilename="Parser.java"/>
                    <sourcefile name="Parser.java">
                        <line nr="6" mi="0" ci="3" mb="1" cb="1"/>
                        <line nr="7" mi="4" ci="0" mb="0" cb="0"/>
                        <line nr="10" mi="0" ci="4" mb="0" cb="0"/>
                        <line nr="11" mi="1" ci="0" mb="0" cb="0"/>
                        <line nr="12" mi="2" ci="0" mb="0" cb="0"/>
                    </sourcefile>
                </package>
            </report>
            """;

    private CoverageFixtures() {
    }

    /**
     * Writes {@code com/example/<fileName>} under the source dir and the report under target.
     */
    public static void writeProject(Path projectDir, String fileName, String source, String report) throws IOException {
        Path sourceFile = projectDir.resolve(SOURCE_DIR).resolve("com/example").resolve(fileName);
        Files.createDirectories(sourceFile.getParent());
        Files.writeString(sourceFile, source);

        Path reportFile = projectDir.resolve(JACOCO_REPORT);
        Files.createDirectories(reportFile.getParent());
        Files.writeString(reportFile, report);
    }

    public static void writeCalculatorProject(Path projectDir) throws IOException {
        writeProject(projectDir, "Calculator.java", CALCULATOR_SOURCE, CALCULATOR_REPORT);
    }

    public static void writeParserProject(Path projectDir) throws IOException {
        writeProject(projectDir, "Parser.java", PARSER_SOURCE, PARSER_REPORT);
    }

    public static SourceScanner scanner(Path projectDir) {
        return new SourceScanner(projectDir.resolve(SOURCE_DIR), List.of());
    }

    /**
     * Analyzer over the project layout with a fixed test quality score of 75.
     */
    public static CoverageAnalyzer analyzer(Path projectDir) {
        return new CoverageAnalyzer(
                new JacocoCoverageDataSource(projectDir.resolve(JACOCO_REPORT), projectDir.resolve(SOURCE_DIR)),
                scanner(projectDir),
                new SourceScopeParser(),
                new GapClassifier(),
                new FixedTestQualityScorer(75.0));
    }
}
