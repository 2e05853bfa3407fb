package com.calsim.dependency.parser;

import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import lombok.experimental.UtilityClass;

/**
 * Reduces WRESL source text to the tokens that are likely variable references.
 *
 * Every operation replaces what it removes with spaces of the same length (line
 * terminators inside a removed span are kept), so an offset in sanitized text
 * is also a valid offset into the original text.
 */
@UtilityClass
public class WreslSanitizer {

    /**
     * Reserved WRESL words: statement types, units, operators, boolean connectives
     * and structural keywords. {@code case} is handled separately as a case header.
     */
    public static final List<String> KEYWORDS = List.of(
            "initial", "define", "svar", "goal", "group", "dvar",
            "integer", "alias", "value", "std", "kind", "units",
            "weight", "upper", "lower", "convert", "name", "type",
            "desc", "bounds", "penalty", "month", "wateryear", "always",
            "never", "constrain", "include", "condition", "lhs",
            "rhs", "import", "sequence", "model", "order", "timeseries",
            "lookup", "select", "from", "where", "given", "use", "sum",
            "max", "min", "abs", "binary", "and", "or", "cfs", "taf",
            "storage", "diversion", "flow"
    );

    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);

    private static final Pattern LINE_COMMENT = Pattern.compile("!.*");

    private static final Pattern CASE_BLOCK = Pattern.compile(
            "\\bcase\\b.*?\\{.*?}",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );

    // Header only: "case <label> {" on a single line
    private static final Pattern CASE_HEADER = Pattern.compile("\\bcase\\b.*?\\{", Pattern.CASE_INSENSITIVE);

    private static final Pattern NUMERIC = Pattern.compile("\\b\\d+\\.?\\d*\\b");

    private static final Pattern CYCLE_REFERENCE = Pattern.compile("\\[.+?]");

    private static final Pattern KEYWORD = Pattern.compile(
            KEYWORDS.stream().collect(Collectors.joining("|", "\\b(?:", ")\\b")),
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b");

    public static String stripBlockComments(String code) {
        return blank(code, BLOCK_COMMENT);
    }

    public static String stripLineComments(String code) {
        return blank(code, LINE_COMMENT);
    }

    public static String stripComments(String code) {
        return stripLineComments(stripBlockComments(code));
    }

    /**
     * Removes {@code case ... { ... }} sub-blocks. Only meant for locating a
     * statement itself; the references inside a case are legitimate inputs.
     */
    public static String stripCaseBlocks(String code) {
        return blank(code, CASE_BLOCK);
    }

    /**
     * Removes numeric literals, cycle references, reserved keywords and case
     * headers. All matches are found against the incoming text before any of
     * them is blanked.
     */
    public static String stripNonVariables(String code) {
        char[] out = code.toCharArray();
        blankInto(out, code, NUMERIC);
        blankInto(out, code, CYCLE_REFERENCE);
        blankInto(out, code, KEYWORD);
        blankInto(out, code, CASE_HEADER);
        return new String(out);
    }

    /**
     * Text in which {@code define}/{@code goal} statements can be located:
     * comments and case blocks removed, keywords kept.
     */
    public static String forStatementSearch(String code) {
        return stripCaseBlocks(stripComments(code));
    }

    /**
     * Text whose remaining words are candidate variable references.
     */
    public static String forInputExtraction(String code) {
        return stripNonVariables(stripComments(code));
    }

    /**
     * Word tokens left in already sanitized text, in order of appearance.
     */
    public static List<String> words(String sanitized) {
        Matcher m = WORD.matcher(sanitized);
        return m.results().map(MatchResult::group).collect(Collectors.toList());
    }

    private static String blank(String code, Pattern pattern) {
        char[] out = code.toCharArray();
        blankInto(out, code, pattern);
        return new String(out);
    }

    private static void blankInto(char[] out, String source, Pattern pattern) {
        Matcher m = pattern.matcher(source);
        while (m.find()) {
            for (int i = m.start(); i < m.end(); i++) {
                if (out[i] != '\n' && out[i] != '\r') {
                    out[i] = ' ';
                }
            }
        }
    }
}
