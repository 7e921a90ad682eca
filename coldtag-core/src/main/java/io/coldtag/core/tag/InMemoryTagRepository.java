package io.coldtag.core.tag;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Thread-safe in-memory {@link TagRepository}.
///
/// Used by the command line front end and by tests. Iteration order of {@link #findAll()} is
/// unspecified.
public final class InMemoryTagRepository implements TagRepository {

    private final Map<String, Tag> storage = new ConcurrentHashMap<>();

    public InMemoryTagRepository() {}

    /// Creates a repository pre-populated with the given tags.
    ///
    /// @param tags initial tags, not null
    public InMemoryTagRepository(Collection<Tag> tags) {
        tags.forEach(this::save);
    }

    @Override
    public void save(Tag tag) {
        Objects.requireNonNull(tag, "tag must not be null");
        storage.put(tag.getId(), tag);
    }

    @Override
    public Optional<Tag> findById(String tagId) {
        Objects.requireNonNull(tagId, "tagId must not be null");
        return Optional.ofNullable(storage.get(tagId));
    }

    @Override
    public List<Tag> findAll() {
        return List.copyOf(storage.values());
    }

    @Override
    public boolean delete(String tagId) {
        Objects.requireNonNull(tagId, "tagId must not be null");
        return storage.remove(tagId) != null;
    }

    public int count() {
        return storage.size();
    }

    public void clear() {
        storage.clear();
    }
}
