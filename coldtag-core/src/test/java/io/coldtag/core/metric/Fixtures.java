package io.coldtag.core.metric;

import io.coldtag.core.ColdtagConfig;
import io.coldtag.core.function.FunctionConfig;
import io.coldtag.core.function.FunctionKind;
import io.coldtag.core.reading.InMemoryReadingStore;
import io.coldtag.core.reading.Reading;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.tag.Tag;
import io.coldtag.core.tag.TagRoster;
import io.coldtag.core.tag.TagType;
import io.coldtag.core.window.DataWindowResolver;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Builds rosters, readings and evaluators for metric tests.
///
/// The default roster holds a location tag `loc` with devices `A | B` and a window
/// `2024-01-15 09:00` to `2024-01-15 10:00` in tags `start`/`end`.
public final class Fixtures {

    public static final String TASK = "task-1";
    public static final LocalDateTime NINE = LocalDateTime.of(2024, 1, 15, 9, 0);

    private final InMemoryReadingStore store = new InMemoryReadingStore();
    private final List<Tag> tags = new ArrayList<>();
    private ColdtagConfig config = ColdtagConfig.builder().zone(ZoneOffset.UTC).build();

    public Fixtures() {
        tag("loc", TagType.LOCATION, "A | B");
        tag("start", TagType.DATETIME, "2024-01-15 09:00");
        tag("end", TagType.DATETIME, "2024-01-15 10:00");
    }

    /// Adds or replaces a tag.
    public Fixtures tag(String id, TagType type, Object value) {
        tags.removeIf(tag -> tag.getId().equals(id));
        tags.add(Tag.builder().id(id).type(type).value(value).build());
        return this;
    }

    public Fixtures config(ColdtagConfig config) {
        this.config = config;
        return this;
    }

    public Fixtures readings(Reading... readings) {
        store.load(TASK, Arrays.asList(readings));
        return this;
    }

    public InMemoryReadingStore store() {
        return store;
    }

    public TagRoster roster() {
        return TagRoster.of(tags);
    }

    public List<Tag> tags() {
        return List.copyOf(tags);
    }

    public FunctionEvaluator evaluator() {
        return new FunctionEvaluator(
                new DefaultMetricRegistry(),
                config,
                new DataWindowResolver(store, config.getZone()));
    }

    public FunctionResult evaluate(FunctionConfig functionConfig) {
        return evaluator().evaluate(functionConfig, TASK, roster());
    }

    /// Returns a config of the kind over the default window and location tag.
    public static FunctionConfig.Builder window(FunctionKind kind) {
        return FunctionConfig.builder()
                .kind(kind)
                .locationTagIds(List.of("loc"))
                .startTagId("start")
                .endTagId("end");
    }

    /// Creates a reading `minutes` after 09:00 with a humidity of 50.
    public static Reading at(String device, int minutes, double temperature) {
        return new Reading(device, NINE.plusMinutes(minutes), temperature, 50.0);
    }

    public static Reading at(String device, int minutes, double temperature, double humidity) {
        return new Reading(device, NINE.plusMinutes(minutes), temperature, humidity);
    }
}
