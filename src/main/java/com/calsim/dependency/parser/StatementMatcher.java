package com.calsim.dependency.parser;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import lombok.experimental.UtilityClass;

/**
 * Locates {@code <kind> <name> { ... }} statements in (usually sanitized) WRESL text.
 *
 * Matching is case-insensitive and non-greedy on braces: a statement ends at the
 * first {@code }} after its opening brace, so bodies with nested braces are cut
 * short. Case blocks should be stripped from the text first.
 */
@UtilityClass
public class StatementMatcher {

    // Any run of non-brace characters between the keyword and the opening brace
    private static final String ANY_NAME = "[^{}]*?";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * All statements of {@code kind} declaring exactly {@code variable} (whole word).
     */
    public static List<StatementMatch> find(String text, StatementKind kind, String variable) {
        Objects.requireNonNull(variable, "variable");
        return find(text, kind, compile(kind, "\\b" + Pattern.quote(variable) + "\\b"));
    }

    /**
     * All statements of {@code kind}, whatever variable they declare.
     */
    public static List<StatementMatch> findAll(String text, StatementKind kind) {
        return find(text, kind, compile(kind, ANY_NAME));
    }

    /**
     * Statement head: everything before the first opening brace.
     */
    public static String head(String statementText) {
        int brace = statementText.indexOf('{');
        return brace < 0 ? statementText : statementText.substring(0, brace);
    }

    /**
     * Statement body: everything after the first opening brace, closing brace included.
     */
    public static String body(String statementText) {
        int brace = statementText.indexOf('{');
        return brace < 0 ? "" : statementText.substring(brace + 1);
    }

    /**
     * The declared variable: last whitespace-separated token of the head.
     */
    public static String declaredName(String statementText) {
        String[] parts = WHITESPACE.split(head(statementText).trim());
        return parts[parts.length - 1];
    }

    private static List<StatementMatch> find(String text, StatementKind kind, Pattern pattern) {
        Objects.requireNonNull(text, "text");
        return pattern.matcher(text).results()
                .map(r -> new StatementMatch(kind, r.start(), r.end()))
                .collect(Collectors.toList());
    }

    private static Pattern compile(StatementKind kind, String namePattern) {
        return Pattern.compile(
                "\\b" + kind.getKeyword() + "\\s+" + namePattern + "\\s*\\{.*?}",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL
        );
    }
}
