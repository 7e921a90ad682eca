package io.coldtag.cli.ui;

/// ANSI text styling for CLI output with semantic color methods.
///
/// All methods return styled strings; output handling is the caller's responsibility.
///
/// ### Usage
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);  // color enabled
/// System.out.println(styles.checkmark() + " " + styles.bold("计算完成"));
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable after construction.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String DIM = "\033[38;5;241m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// Creates an AnsiStyles instance with specified color preference.
    ///
    /// @param useColor true to apply ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    /// Applies bold formatting.
    public String bold(String text) {
        return style(text, BOLD);
    }

    /// Applies dim color for labels and the detail log.
    public String dim(String text) {
        return style(text, DIM);
    }

    /// Applies blue for identifiers.
    public String accent(String text) {
        return style(text, BLUE);
    }

    /// Colors green on success, red on failure.
    public String successOrError(String text, boolean isSuccess) {
        return style(text, isSuccess ? GREEN : RED);
    }

    /// Checkmark for success.
    public String checkmark() {
        return style("✓", GREEN);
    }

    /// Cross mark for failure.
    public String crossmark() {
        return style("✗", RED);
    }

    /// Full-width horizontal separator.
    public String separator() {
        return style("─".repeat(60), DIM);
    }
}
