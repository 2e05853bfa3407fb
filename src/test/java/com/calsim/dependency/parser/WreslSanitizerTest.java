package com.calsim.dependency.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for WreslSanitizer.
 */
class WreslSanitizerTest {

    @Test
    void testBlockCommentReplacedWithSpaces() {
        String code = "define A /* S_X */ { value B }";

        String result = WreslSanitizer.stripBlockComments(code);

        assertThat(result).hasSameSizeAs(code);
        assertThat(result).doesNotContain("S_X");
        assertThat(result.indexOf('{')).isEqualTo(code.indexOf('{'));
    }

    @Test
    void testMultiLineBlockCommentKeepsLineBreaks() {
        String code = "A\n/* first\nsecond\nthird */\nB";

        String result = WreslSanitizer.stripBlockComments(code);

        assertThat(result).doesNotContain("first", "second", "third");
        assertThat(result.chars().filter(c -> c == '\n').count()).isEqualTo(4);
        assertThat(result.indexOf('B')).isEqualTo(code.indexOf('B'));
    }

    @Test
    void testLineCommentRunsToEndOfLine() {
        String code = "define A { value B } ! uses C\ndefine D { value E }";

        String result = WreslSanitizer.stripLineComments(code);

        assertThat(result).hasSameSizeAs(code);
        assertThat(result).doesNotContain("uses").doesNotContain("C\n");
        assertThat(result).contains("define D { value E }");
    }

    @Test
    void testLineCommentOnLastLineWithoutNewline() {
        String result = WreslSanitizer.stripLineComments("value A ! trailing B");

        assertThat(result.trim()).isEqualTo("value A");
    }

    @Test
    void testCaseBlockRemoved() {
        String code = "define X { case wet { condition always value Y } }";

        String result = WreslSanitizer.stripCaseBlocks(code);

        assertThat(result).hasSameSizeAs(code);
        assertThat(result).doesNotContain("Y").doesNotContain("wet");
        assertThat(result).startsWith("define X {").endsWith("}");
    }

    @Test
    void testCaseKeywordNeedsWordBoundary() {
        String code = "define showcase { value briefcase }";

        assertThat(WreslSanitizer.stripCaseBlocks(code)).isEqualTo(code);
    }

    @Test
    void testNonVariablesLeaveNoWordsInStorageDefinition() {
        String body = " kind 'storage' upper 100.0 }";

        String result = WreslSanitizer.stripNonVariables(body);

        assertThat(result).hasSameSizeAs(body);
        assertThat(WreslSanitizer.words(result)).isEmpty();
    }

    @Test
    void testKeywordsMatchWholeWordsOnly() {
        String result = WreslSanitizer.stripNonVariables("maximum_flow + max(A, 3)");

        assertThat(WreslSanitizer.words(result)).containsExactly("maximum_flow", "A");
    }

    @Test
    void testKeywordsAreCaseInsensitive() {
        String result = WreslSanitizer.stripNonVariables("SUM C_X And D_Y Lookup");

        assertThat(WreslSanitizer.words(result)).containsExactly("C_X", "D_Y");
    }

    @ParameterizedTest
    @ValueSource(strings = {"DEFINE", "Goal", "taf", "WaterYear", "dvar", "TIMESERIES"})
    void testReservedWordIsStripped(String keyword) {
        String result = WreslSanitizer.stripNonVariables(keyword);

        assertThat(result).isBlank();
    }

    @Test
    void testCycleReferenceStripped() {
        String result = WreslSanitizer.stripNonVariables("S_SHSTA[UPSTREAM] + X");

        assertThat(WreslSanitizer.words(result)).containsExactly("S_SHSTA", "X");
    }

    @Test
    void testNumericLiteralsStrippedButNotInsideIdentifiers() {
        String result = WreslSanitizer.stripNonVariables("A1 + 2.5 + B_2 - 40");

        assertThat(WreslSanitizer.words(result)).containsExactly("A1", "B_2");
    }

    @Test
    void testCaseHeaderLabelIsNotACandidate() {
        String result = WreslSanitizer.stripNonVariables("case wet {\n condition C1 > 0\n value D1 }");

        assertThat(WreslSanitizer.words(result)).containsExactly("C1", "D1");
    }

    @Test
    void testStatementSearchViewDropsCommentsAndCases() {
        String code = """
                /* define Q { value 1 } */
                ! define Q { value 2 }
                define R {
                  case wet {
                    condition always
                    value Q
                  }
                }
                """;

        String result = WreslSanitizer.forStatementSearch(code);

        assertThat(result).hasSameSizeAs(code);
        assertThat(result).doesNotContain("Q");
        assertThat(result).contains("define R {");
    }

    @Test
    void testInputExtractionViewKeepsCaseContents() {
        String code = "{ case wet { condition always value Q } ! not P\n }";

        String result = WreslSanitizer.forInputExtraction(code);

        assertThat(WreslSanitizer.words(result)).containsExactly("Q");
    }
}
