package io.coldtag.core.normalize;

import io.coldtag.core.tag.Tag;
import io.coldtag.core.tag.TagRoster;
import io.coldtag.core.tag.TagType;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/// Normalizes location tag values into sets of device identifiers.
///
/// A location value is a native list or a string delimited by `|`, an ASCII comma or a
/// full-width comma (`，`). Tokens are trimmed, empty tokens dropped and duplicates removed.
/// The returned sets keep first-appearance order so rendered device lists are stable.
public final class Locations {

    /// Delimiters accepted between device identifiers.
    public static final Pattern DELIMITERS = Pattern.compile("[|,，]");

    /// Separator used when rendering a device set.
    public static final String JOINER = " | ";

    private Locations() {}

    /// Converts a raw location value into a set of device ids.
    ///
    /// @param raw a collection, a delimited string or any scalar; may be null
    /// @return unmodifiable ordered set, never null (empty for null or blank values)
    public static Set<String> toLocationSet(Object raw) {
        Set<String> result = new LinkedHashSet<>();
        if (raw == null) {
            return Collections.unmodifiableSet(result);
        }
        if (raw instanceof Collection) {
            for (Object item : (Collection<?>) raw) {
                if (item != null) {
                    addToken(result, String.valueOf(item));
                }
            }
        } else {
            for (String token : DELIMITERS.split(String.valueOf(raw))) {
                addToken(result, token);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    /// Unions the location sets of the referenced location tags.
    ///
    /// Ids that are missing from the roster or point to a non-location tag are skipped.
    ///
    /// @param tagIds referenced tag ids, may be null
    /// @param roster the tag roster, not null
    /// @return unmodifiable ordered set, never null
    public static Set<String> distinctLocations(List<String> tagIds, TagRoster roster) {
        Set<String> result = new LinkedHashSet<>();
        if (tagIds == null) {
            return Collections.unmodifiableSet(result);
        }
        for (String tagId : tagIds) {
            roster.find(tagId)
                    .filter(tag -> tag.getType() == TagType.LOCATION)
                    .map(Tag::getValue)
                    .ifPresent(value -> result.addAll(toLocationSet(value)));
        }
        return Collections.unmodifiableSet(result);
    }

    /// Renders a device set, or `无` when empty.
    public static String join(Collection<String> locations) {
        return locations.isEmpty() ? "无" : String.join(JOINER, locations);
    }

    private static void addToken(Set<String> target, String token) {
        String trimmed = token.trim();
        if (!trimmed.isEmpty()) {
            target.add(trimmed);
        }
    }
}
