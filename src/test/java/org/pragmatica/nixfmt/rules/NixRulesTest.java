package org.pragmatica.nixfmt.rules;

import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;
import org.pragmatica.nixfmt.FormatterConfig;
import org.pragmatica.nixfmt.NixFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.nixfmt.FormatterConfig.TerminatorPolicy.KEEP_EXISTING_NEWLINE;

/**
 * Checks the Nix rule tables against the examples written next to them and
 * against the bad/good file pairs under {@code src/test/resources}.
 */
class NixRulesTest {
    private static final Logger log = LoggerFactory.getLogger(NixRulesTest.class);

    private static final Path RULES_SOURCE = Path.of("src/main/java/org/pragmatica/nixfmt/rules/NixRules.java");
    private static final Path TEST_DATA = Path.of("src/test/resources/test_data");
    private static final Path KEEP_NEWLINE_TEST_DATA = Path.of("src/test/resources/test_data_keep_newline");

    private final NixFormatter formatter = NixFormatter.nixFormatter(FormatterConfig.DEFAULT);

    @Test
    void smoke() {
        FormatTestCase.of("{ foo = 1;\nbar = 2; }", "{\n  foo = 1;\n  bar = 2;\n}")
                      .run(formatter::format);
    }

    @TestFactory
    Stream<DynamicTest> inlineTests() throws IOException {
        var cases = FormatTestCase.collectFromComments(Files.readString(RULES_SOURCE));
        return dynamicTests(cases, formatter);
    }

    @TestFactory
    Stream<DynamicTest> badGoodTests() throws IOException {
        return dynamicTests(FormatTestCase.collectFromDir(TEST_DATA), formatter);
    }

    @TestFactory
    Stream<DynamicTest> badGoodTests_keepExistingNewlineBeforeTerminator() throws IOException {
        var lenient = NixFormatter.builder()
                                  .terminatorAfterLiteral(KEEP_EXISTING_NEWLINE)
                                  .build();
        return dynamicTests(FormatTestCase.collectFromDir(KEEP_NEWLINE_TEST_DATA), lenient);
    }

    @Test
    void inlineTests_coverEveryScenarioOfTheRuleTable() throws IOException {
        var cases = FormatTestCase.collectFromComments(Files.readString(RULES_SOURCE));

        assertThat(cases).extracting(FormatTestCase::before)
                         .contains("{ a=92; }",
                                   "{ a = 92 ; }",
                                   "a==  b",
                                   "a++  b",
                                   "foo . bar . baz",
                                   "[1 2 3]");
    }

    @Test
    void spacing_anchorsOnSignificantTokensOnly() {
        var rules = NixRules.spacing(FormatterConfig.DEFAULT);

        assertThat(rules.directives()).isNotEmpty();
        assertThat(rules.directives()).allSatisfy(directive -> assertThat(directive.anchor()
                                                                                   .isTrivia()).isFalse());
    }

    private static Stream<DynamicTest> dynamicTests(List<FormatTestCase> cases, NixFormatter formatter) {
        log.info("Running {} formatting cases", cases.size());
        return cases.stream()
                    .map(testCase -> DynamicTest.dynamicTest(testCase.toString(),
                                                             () -> testCase.run(formatter::format)));
    }
}
