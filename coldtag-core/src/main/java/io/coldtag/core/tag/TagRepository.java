package io.coldtag.core.tag;

import java.util.List;
import java.util.Optional;

/// Storage for the tags of one report template.
///
/// The evaluation session reads a {@link TagRoster} snapshot from the repository and writes
/// back only the tag it evaluates.
///
/// @implNote Implementations must be thread-safe; batch evaluation writes different tags
/// concurrently.
///
/// @see InMemoryTagRepository for the default implementation
public interface TagRepository {

    /// Stores a tag, replacing any tag with the same id.
    ///
    /// @param tag the tag to store, not null
    void save(Tag tag);

    /// Finds a tag by id.
    ///
    /// @param tagId the tag id, not null
    /// @return the tag, or empty if not found
    Optional<Tag> findById(String tagId);

    /// Returns all stored tags.
    ///
    /// @return unmodifiable list, never null
    List<Tag> findAll();

    /// Removes a tag.
    ///
    /// @param tagId the tag id, not null
    /// @return true if a tag was removed
    boolean delete(String tagId);

    /// Takes a read-only snapshot of all stored tags.
    ///
    /// @return roster snapshot, never null
    default TagRoster snapshot() {
        return TagRoster.of(findAll());
    }
}
