package io.coldtag.core.metric;

import io.coldtag.core.ColdtagConfig;
import io.coldtag.core.result.ResultFormatter;
import io.coldtag.core.tag.TagRoster;
import io.coldtag.core.window.DataWindowResolver;

/// Inputs and services one evaluation needs besides its {@link io.coldtag.core.function.FunctionSpec}.
///
/// ### Required Fields
/// - `roster` - read-only tag snapshot taken when the evaluation started
/// - `config` - defaults table
/// - `windowResolver` - query window resolution and reading access
///
/// ### Optional Fields
/// - `taskId` - the task whose readings are queried; power kinds need none
/// - `formatter` - defaults to a plain {@link ResultFormatter}
///
/// @implNote Immutable after construction. Thread-safe for read access.
///
/// @see MetricAlgorithm
public final class EvaluationContext {

    private final String taskId;
    private final TagRoster roster;
    private final ColdtagConfig config;
    private final DataWindowResolver windowResolver;
    private final ResultFormatter formatter;

    private EvaluationContext(Builder builder) {
        this.taskId = builder.taskId;
        this.roster = builder.roster;
        this.config = builder.config;
        this.windowResolver = builder.windowResolver;
        this.formatter = builder.formatter != null ? builder.formatter : new ResultFormatter();
    }

    /// Returns the task whose readings are queried.
    ///
    /// @return task id, may be null for kinds that read no readings
    public String getTaskId() {
        return taskId;
    }

    public TagRoster getRoster() {
        return roster;
    }

    public ColdtagConfig getConfig() {
        return config;
    }

    public DataWindowResolver getWindowResolver() {
        return windowResolver;
    }

    public ResultFormatter getFormatter() {
        return formatter;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String taskId;
        private TagRoster roster;
        private ColdtagConfig config;
        private DataWindowResolver windowResolver;
        private ResultFormatter formatter;

        private Builder() {}

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder roster(TagRoster roster) {
            this.roster = roster;
            return this;
        }

        public Builder config(ColdtagConfig config) {
            this.config = config;
            return this;
        }

        public Builder windowResolver(DataWindowResolver windowResolver) {
            this.windowResolver = windowResolver;
            return this;
        }

        public Builder formatter(ResultFormatter formatter) {
            this.formatter = formatter;
            return this;
        }

        public EvaluationContext build() {
            if (roster == null) {
                throw new IllegalStateException("roster is required");
            }
            if (config == null) {
                throw new IllegalStateException("config is required");
            }
            if (windowResolver == null) {
                throw new IllegalStateException("windowResolver is required");
            }
            return new EvaluationContext(this);
        }
    }
}
