package io.zmanim.selection;

import java.util.Objects;

/**
 * A tag known to the system.
 *
 * @param tagKey the key, such as {@code erev_shabbos}
 * @param type the tag type
 */
public record EventTagDefinition(String tagKey, TagType type) {
  public EventTagDefinition {
    Objects.requireNonNull(tagKey, "tagKey");
    Objects.requireNonNull(type, "type");
  }
}
