package com.mpl.model;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import java.util.HashSet;
import java.util.Set;

/**
 * Mutable record of one world, owned by its {@link KripkeModel}. Only true propositions are stored.
 */
final class World {
  final Set<String> valuation = new HashSet<>();
  final ListMultimap<String, Integer> successors = MultimapBuilder.treeKeys().arrayListValues().build();

  World(Set<String> valuation) {
    this.valuation.addAll(valuation);
  }

  @Override
  public String toString() {
    return "%s -> %s".formatted(valuation, successors);
  }
}
