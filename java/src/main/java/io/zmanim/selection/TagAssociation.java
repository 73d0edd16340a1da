package io.zmanim.selection;

import java.util.Objects;

/**
 * A tag attached to a zman. A negated tag hides the zman whenever the tag is active.
 *
 * @param tagKey the tag key
 * @param type the tag type
 * @param negated whether the association excludes rather than requires
 */
public record TagAssociation(String tagKey, TagType type, boolean negated) {
  public TagAssociation {
    Objects.requireNonNull(tagKey, "tagKey");
    Objects.requireNonNull(type, "type");
  }

  /**
   * Creates a positive association.
   *
   * @param definition the tag
   * @return the association
   */
  public static TagAssociation of(EventTagDefinition definition) {
    return new TagAssociation(definition.tagKey(), definition.type(), false);
  }

  /**
   * Creates a negated association.
   *
   * @param definition the tag
   * @return the association
   */
  public static TagAssociation not(EventTagDefinition definition) {
    return new TagAssociation(definition.tagKey(), definition.type(), true);
  }
}
