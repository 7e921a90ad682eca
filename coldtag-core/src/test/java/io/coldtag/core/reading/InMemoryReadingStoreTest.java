package io.coldtag.core.reading;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryReadingStoreTest {

    private static final LocalDateTime NINE = LocalDateTime.of(2024, 1, 15, 9, 0);

    private InMemoryReadingStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryReadingStore();
        store.load(
                "task",
                List.of(
                        new Reading("A", NINE.minusSeconds(1), 1.0, 50.0),
                        new Reading("A", NINE, 2.0, 50.0),
                        new Reading("B", NINE.plusMinutes(30), 3.0, 50.0),
                        new Reading("A", NINE.plusHours(1), 4.0, 50.0)));
    }

    @Test
    void shouldMatchInclusiveBounds() {
        List<Reading> readings =
                store.queryReadings("task", NINE, NINE.plusHours(1), Set.of("A", "B"));

        assertThat(readings).extracting(Reading::temperature).containsExactly(2.0, 3.0, 4.0);
    }

    @Test
    void shouldFilterByDevice() {
        List<Reading> readings = store.queryReadings("task", NINE, NINE.plusHours(1), Set.of("B"));

        assertThat(readings).extracting(Reading::deviceId).containsExactly("B");
    }

    @Test
    void shouldReturnEmptyForUnknownTask() {
        assertThat(store.queryReadings("other", NINE, NINE.plusHours(1), Set.of())).isEmpty();
    }

    @Test
    void shouldClearTask() {
        assertThat(store.clear("task")).isTrue();
        assertThat(store.queryReadings("task", NINE, NINE.plusHours(1), Set.of())).isEmpty();
    }
}
