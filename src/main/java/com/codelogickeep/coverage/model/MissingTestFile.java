package com.codelogickeep.coverage.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A source file without a conventionally named companion test.
 */
public record MissingTestFile(
        @JsonProperty("source_file") String sourceFile,
        @JsonProperty("expected_test_file") String expectedTestFile,
        @JsonProperty("test_structure") TestStructure testStructure,
        @JsonProperty("priority") Priority priority
) {

    /**
     * Outline of the source file, used to propose the test class layout.
     *
     * @param functions  every method and constructor, qualified by its type
     * @param complexity number of classes plus functions found
     */
    public record TestStructure(
            @JsonProperty("classes") List<ClassOutline> classes,
            @JsonProperty("functions") List<String> functions,
            @JsonProperty("total_lines") int totalLines,
            @JsonProperty("complexity") int complexity
    ) {

        public static TestStructure empty() {
            return new TestStructure(List.of(), List.of(), 0, 0);
        }
    }

    public record ClassOutline(String name, List<String> methods, int line) {
    }
}
