package io.coldtag.cli.ui;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AnsiStylesTest {

    @Test
    void shouldApplyBoldFormattingWhenColorEnabled() {
        AnsiStyles styles = AnsiStyles.of(true);

        String result = styles.bold("test");

        assertThat(result).startsWith("\033[1m").contains("test").endsWith("\033[0m");
    }

    @Test
    void shouldReturnPlainTextWhenColorDisabled() {
        AnsiStyles styles = AnsiStyles.of(false);

        assertThat(styles.bold("test")).isEqualTo("test");
        assertThat(styles.checkmark()).isEqualTo("✓");
        assertThat(styles.separator()).doesNotContain("\033[");
    }

    @Test
    void shouldColorByOutcome() {
        AnsiStyles styles = AnsiStyles.of(true);

        assertThat(styles.successOrError("success", true)).startsWith("\033[0;32m");
        assertThat(styles.successOrError("error", false)).startsWith("\033[38;5;167m");
    }
}
