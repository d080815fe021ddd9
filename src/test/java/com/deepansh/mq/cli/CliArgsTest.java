package com.deepansh.mq.cli;

import com.deepansh.mq.exception.UserException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliArgsTest {

    private static final String HELP = "usage: mq x [-s S] [--json] a b\n\nmore text\n";

    private static CliArgs.Options options() {
        return CliArgs.options(HELP).option("--sysprompt", "-s").flag("--json").flag("--no-session", "-n");
    }

    @Test
    void parse_mixedOrder_separatesPositionalsAndOptions() {
        CliArgs args = options().parse(List.of("m", "-s", "S", "--json", "query")).expect("shortname", "query");

        assertThat(args.positional(0)).isEqualTo("m");
        assertThat(args.positional(1)).isEqualTo("query");
        assertThat(args.value("--sysprompt")).contains("S");
        assertThat(args.has("--json")).isTrue();
        assertThat(args.has("--no-session")).isFalse();
    }

    @Test
    void parse_inlineValueAndAlias() {
        CliArgs args = options().parse(List.of("--sysprompt=a=b", "-n", "x")).expect("q");

        assertThat(args.value("--sysprompt")).contains("a=b");
        assertThat(args.has("--no-session")).isTrue();
    }

    @Test
    void parse_doubleDash_endsOptions() {
        CliArgs args = options().parse(List.of("m", "--", "--json")).expect("shortname", "query");

        assertThat(args.positional(1)).isEqualTo("--json");
        assertThat(args.has("--json")).isFalse();
    }

    @Test
    void parse_unknownOption_isRejectedWithUsage() {
        assertThatThrownBy(() -> options().parse(List.of("--bogus")))
                .isInstanceOf(UserException.class)
                .hasMessageContaining("--bogus")
                .hasMessageContaining("usage: mq x")
                .hasMessageNotContaining("more text");
    }

    @Test
    void parse_optionWithoutValue_isRejected() {
        assertThatThrownBy(() -> options().parse(List.of("m", "-s")))
                .hasMessageContaining("expected one argument");
    }

    @Test
    void expect_tooManyPositionals_isRejected() {
        assertThatThrownBy(() -> options().parse(List.of("a", "b", "c")).expect("one", "two"))
                .hasMessageContaining("unrecognized arguments: c");
    }

    @Test
    void intValue_notANumber_isRejected() {
        CliArgs args = CliArgs.options(HELP).option("--workers", "-w").parse(List.of("-w", "many"));

        assertThatThrownBy(() -> args.intValue("--workers"))
                .isInstanceOf(UserException.class)
                .hasMessageContaining("invalid int value");
    }
}
