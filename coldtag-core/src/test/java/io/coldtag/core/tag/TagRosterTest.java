package io.coldtag.core.tag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.result.ErrorCode;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TagRosterTest {

    private static Tag tag(String id, Object value) {
        return Tag.builder().id(id).type(TagType.TEXT).value(value).build();
    }

    @Test
    void shouldKeepFirstTagForDuplicateIds() {
        TagRoster roster = TagRoster.of(Arrays.asList(tag("a", 1), null, tag("a", 2), tag("b", 3)));

        assertThat(roster.size()).isEqualTo(2);
        assertThat(roster.find("a")).map(Tag::getValue).contains(1);
        assertThat(roster.all()).extracting(Tag::getId).containsExactly("a", "b");
    }

    @Test
    void shouldTreatNullIdAsUnknown() {
        TagRoster roster = TagRoster.of(List.of(tag("a", 1)));

        assertThat(roster.find(null)).isEmpty();
        assertThat(roster.contains(null)).isFalse();
        assertThat(TagRoster.empty().size()).isZero();
    }

    @Test
    void shouldFailRequireWithGivenMessage() {
        TagRoster roster = TagRoster.of(List.of(tag("a", 1)));

        assertThatThrownBy(() -> roster.require("b", "时间标签不存在"))
                .isInstanceOf(EvaluationException.class)
                .hasMessage("时间标签不存在")
                .satisfies(
                        e ->
                                assertThat(((EvaluationException) e).getErrorCode())
                                        .isEqualTo(ErrorCode.TAG_NOT_FOUND));
    }
}
