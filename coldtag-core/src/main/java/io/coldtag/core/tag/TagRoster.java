package io.coldtag.core.tag;

import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.result.ErrorCode;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Read-only snapshot of a template's tags, keyed by id.
///
/// An evaluation reads every input tag from one roster snapshot, so later changes made by the
/// caller to its own tag collection do not leak into a running evaluation.
///
/// @implNote Immutable and thread-safe. When several tags share an id the first one wins.
public final class TagRoster {

    private static final TagRoster EMPTY = new TagRoster(Map.of());

    private final Map<String, Tag> tags;

    private TagRoster(Map<String, Tag> tags) {
        this.tags = tags;
    }

    /// Takes a snapshot of the given tags.
    ///
    /// @param tags the tags, not null; null elements are skipped
    /// @return new roster, never null
    public static TagRoster of(Collection<Tag> tags) {
        Map<String, Tag> byId = new LinkedHashMap<>();
        for (Tag tag : tags) {
            if (tag != null) {
                byId.putIfAbsent(tag.getId(), tag);
            }
        }
        return new TagRoster(Collections.unmodifiableMap(byId));
    }

    public static TagRoster empty() {
        return EMPTY;
    }

    /// Finds a tag by id.
    ///
    /// @param id tag id, may be null
    /// @return the tag, or empty when the id is null or unknown
    public Optional<Tag> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tags.get(id));
    }

    /// Finds a tag by id or fails with {@link ErrorCode#TAG_NOT_FOUND}.
    ///
    /// @param id tag id, may be null
    /// @param notFoundMessage message reported when the tag is missing, not null
    /// @return the tag, never null
    /// @throws EvaluationException if no tag has that id
    public Tag require(String id, String notFoundMessage) throws EvaluationException {
        return find(id)
                .orElseThrow(
                        () -> new EvaluationException(ErrorCode.TAG_NOT_FOUND, notFoundMessage));
    }

    public boolean contains(String id) {
        return id != null && tags.containsKey(id);
    }

    /// Returns all tags in insertion order.
    ///
    /// @return unmodifiable list, never null
    public List<Tag> all() {
        return List.copyOf(tags.values());
    }

    public int size() {
        return tags.size();
    }
}
