package com.codelogickeep.coverage.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A proposed JUnit test that would close one or more coverage gaps.
 */
@Data
@Builder
public class TestSuggestion {
    private String filePath;

    private String functionName;

    private String className;

    private TestType testType;

    private Priority priority;

    private String description;

    /** Method name of the suggested test, e.g. "parse_branchCoverage" */
    private String suggestedTestName;

    /** JUnit test method bodies, without imports or class wrapper */
    private String testTemplate;

    @Builder.Default
    private List<Integer> coverageLines = new ArrayList<>();

    @Builder.Default
    private int complexityScore = 1;

    /**
     * Test name qualified by the conventional test class when a class scope exists.
     */
    public String getFullTestName() {
        if (className != null) {
            return className + "Test." + suggestedTestName;
        }
        return suggestedTestName;
    }
}
