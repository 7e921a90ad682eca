package io.coldtag.core.result;

import java.util.ArrayList;
import java.util.List;

/// Line-oriented builder for the diagnostic log attached to a {@link FunctionResult}.
///
/// Window-based metrics start the log with the shared query block (device list, interval,
/// hit count) and append their own lines after it.
///
/// {@snippet :
/// String detail = DetailLog.start(window.queryInfo())
///         .entry("阈值", 8)
///         .entry("最快", "A | B")
///         .render();
/// }
///
/// @implNote **Not thread-safe**. One instance is built per evaluation.
public final class DetailLog {

    private final List<String> lines = new ArrayList<>();

    private DetailLog() {}

    /// Starts an empty log.
    ///
    /// @return new log, never null
    public static DetailLog start() {
        return new DetailLog();
    }

    /// Starts a log with a header block.
    ///
    /// @param header header text, may span several lines, may be null
    /// @return new log, never null
    public static DetailLog start(String header) {
        DetailLog log = new DetailLog();
        if (header != null && !header.isEmpty()) {
            log.lines.add(header);
        }
        return log;
    }

    /// Appends a raw line.
    public DetailLog line(String text) {
        lines.add(text);
        return this;
    }

    /// Appends a `label: value` line.
    public DetailLog entry(String label, Object value) {
        lines.add(label + ": " + value);
        return this;
    }

    /// Appends an empty separator line.
    public DetailLog blank() {
        lines.add("");
        return this;
    }

    /// Appends a titled section listing at most `limit` items.
    ///
    /// When items are dropped a closing line reports the total count. An empty list renders
    /// as `无`.
    ///
    /// @param title section title, not null
    /// @param items section lines, not null
    /// @param limit maximum number of items to show, must be positive
    /// @return this log for chaining
    public DetailLog preview(String title, List<String> items, int limit) {
        lines.add("");
        lines.add(title + ":");
        if (items.isEmpty()) {
            lines.add("无");
            return this;
        }
        int shown = Math.min(limit, items.size());
        lines.addAll(items.subList(0, shown));
        if (shown < items.size()) {
            lines.add("...（共 " + items.size() + " 条）");
        }
        return this;
    }

    /// Renders the log.
    ///
    /// @return lines joined by `\n`, never null
    public String render() {
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return render();
    }
}
