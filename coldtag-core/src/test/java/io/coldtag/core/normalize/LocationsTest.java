package io.coldtag.core.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import io.coldtag.core.tag.Tag;
import io.coldtag.core.tag.TagRoster;
import io.coldtag.core.tag.TagType;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class LocationsTest {

    @Test
    void shouldSplitOnEveryDelimiter() {
        Set<String> locations = Locations.toLocationSet(" A | B, C，D|A ");

        assertThat(locations).containsExactly("A", "B", "C", "D");
    }

    @Test
    void shouldNormalizeListValues() {
        Set<String> locations = Locations.toLocationSet(Arrays.asList(" A", null, "", "B", "A"));

        assertThat(locations).containsExactly("A", "B");
    }

    @Test
    void shouldReturnEmptySetForNull() {
        assertThat(Locations.toLocationSet(null)).isEmpty();
    }

    @Test
    void shouldUnionLocationTagsOnly() {
        // Given
        TagRoster roster =
                TagRoster.of(
                        List.of(
                                Tag.builder().id("l1").type(TagType.LOCATION).value("A|B").build(),
                                Tag.builder().id("l2").type(TagType.LOCATION).value(List.of("B", "C")).build(),
                                Tag.builder().id("t").type(TagType.TEXT).value("X").build()));

        // When
        Set<String> locations = Locations.distinctLocations(List.of("l1", "t", "missing", "l2"), roster);

        // Then
        assertThat(locations).containsExactly("A", "B", "C");
    }

    @Test
    void shouldJoinWithPipe() {
        assertThat(Locations.join(List.of("A", "B"))).isEqualTo("A | B");
        assertThat(Locations.join(List.of())).isEqualTo("无");
    }
}
