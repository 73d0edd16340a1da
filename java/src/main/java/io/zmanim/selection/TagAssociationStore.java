package io.zmanim.selection;

import java.util.List;
import java.util.Map;

/** Supplies the tags attached to each zman. */
@FunctionalInterface
public interface TagAssociationStore {

  /**
   * Returns the tags attached to a zman.
   *
   * @param key the zman key
   * @return the associations; empty if the zman has none
   */
  List<TagAssociation> tagsFor(String key);

  /**
   * Returns a store backed by a map. Keys missing from the map have no tags.
   *
   * @param associations the tags per zman key
   * @return the store
   */
  static TagAssociationStore of(Map<String, List<TagAssociation>> associations) {
    Map<String, List<TagAssociation>> copy = Map.copyOf(associations);
    return key -> copy.getOrDefault(key, List.of());
  }
}
