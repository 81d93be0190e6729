package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.model.GapType;
import com.codelogickeep.coverage.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies an uncovered source line through ordered rule tables. The first matching
 * rule wins; the last rule of each table always matches.
 */
public class GapClassifier {

    /**
     * What is known about one uncovered line.
     *
     * @param text              the line, trimmed
     * @param functionName      innermost enclosing method or constructor, may be null
     * @param className         innermost enclosing type, may be null
     * @param declaresFunction  whether a method or constructor name is declared on this line
     */
    public record LineContext(String text, String functionName, String className, boolean declaresFunction) {

        public static LineContext of(String text) {
            return new LineContext(text.trim(), null, null, false);
        }
    }

    public record Rule<T>(String name, Predicate<LineContext> predicate, T result) {

        public boolean matches(LineContext context) {
            return predicate.test(context);
        }
    }

    private static final Pattern BRANCH = Pattern.compile("\\bif\\s*\\(|\\bswitch\\s*\\(|\\bcase\\s|\\bdefault\\s*:");
    private static final Pattern EXCEPTION = Pattern.compile("\\bcatch\\s*\\(|\\bfinally\\b");
    private static final Pattern TYPE_DECLARATION = Pattern.compile(
            "\\b(class|interface|enum)\\s+[A-Za-z_$][\\w$]*|\\brecord\\s+[A-Za-z_$][\\w$]*\\s*[(<]");
    private static final Pattern THROW = Pattern.compile("\\bthrow\\s");

    private static final List<String> CRITICAL_KEYWORDS = List.of("throw ", "catch", "finally", "assert", "auth", "password", "token");
    private static final List<String> HIGH_KEYWORDS = List.of("if (", "if(", "switch", "case ", "validate", "check", "verify");
    private static final List<String> MEDIUM_FUNCTION_KEYWORDS = List.of("format", "convert", "parse", "util");

    private static final Pattern COMPLEXITY_TOKENS = Pattern.compile(
            "\\bif\\b|\\bfor\\b|\\bwhile\\b|\\btry\\b|\\bcatch\\b|\\bcase\\b|&&|\\|\\||\\s\\?\\s");

    private final List<Rule<GapType>> typeRules = List.of(
            new Rule<>("branch", c -> BRANCH.matcher(c.text()).find(), GapType.MISSING_BRANCH),
            new Rule<>("exception", c -> EXCEPTION.matcher(c.text()).find(), GapType.EXCEPTION_HANDLING),
            new Rule<>("function", LineContext::declaresFunction, GapType.UNCOVERED_FUNCTION),
            new Rule<>("class", c -> TYPE_DECLARATION.matcher(c.text()).find(), GapType.UNCOVERED_CLASS),
            new Rule<>("error-path", c -> THROW.matcher(c.text()).find(), GapType.ERROR_PATH),
            new Rule<>("default", c -> true, GapType.UNCOVERED_LINES)
    );

    private final List<Rule<Severity>> severityRules = List.of(
            new Rule<>("error-handling-or-security",
                    c -> containsAny(c.text().toLowerCase(Locale.ROOT), CRITICAL_KEYWORDS), Severity.CRITICAL),
            new Rule<>("branch-or-validation", c -> containsAny(c.text(), HIGH_KEYWORDS), Severity.HIGH),
            new Rule<>("utility-function",
                    c -> c.functionName() != null
                            && containsAny(c.functionName().toLowerCase(Locale.ROOT), MEDIUM_FUNCTION_KEYWORDS),
                    Severity.MEDIUM),
            new Rule<>("default", c -> true, Severity.LOW)
    );

    public List<Rule<GapType>> typeRules() {
        return typeRules;
    }

    public List<Rule<Severity>> severityRules() {
        return severityRules;
    }

    public GapType classifyType(LineContext context) {
        return firstMatch(typeRules, context);
    }

    public Severity classifySeverity(LineContext context) {
        return firstMatch(severityRules, context);
    }

    /**
     * 1 plus the number of branch, loop and logical operator tokens on the line.
     */
    public int complexity(String line) {
        Matcher matcher = COMPLEXITY_TOKENS.matcher(line);
        int complexity = 1;
        while (matcher.find()) {
            complexity++;
        }
        return complexity;
    }

    /**
     * Short hints describing the tests that would exercise the line.
     */
    public List<String> suggestTests(LineContext context) {
        List<String> suggestions = new ArrayList<>();
        String text = context.text();

        if (BRANCH.matcher(text).find()) {
            suggestions.add("Test both true and false conditions for: " + text);
        }
        if (EXCEPTION.matcher(text).find()) {
            suggestions.add("Test exception handling: " + text);
        }
        if (context.functionName() != null) {
            suggestions.add("Test method '" + context.functionName() + "' with edge cases");
        }
        if (THROW.matcher(text).find()) {
            suggestions.add("Test error condition that triggers: " + text);
        }
        return suggestions;
    }

    /**
     * True for blank lines and lines that are entirely comment.
     */
    public static boolean isBlankOrComment(String line) {
        String trimmed = line.trim();
        return trimmed.isEmpty()
                || trimmed.startsWith("//")
                || trimmed.startsWith("/*")
                || trimmed.startsWith("*");
    }

    private static <T> T firstMatch(List<Rule<T>> rules, LineContext context) {
        for (Rule<T> rule : rules) {
            if (rule.matches(context)) {
                return rule.result();
            }
        }
        throw new IllegalStateException("Rule table without a default rule");
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
