package com.mpl.model;

import static com.google.common.base.Preconditions.checkArgument;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * Closure of the agent relations of a {@link KripkeModel}. None of the methods modify the model,
 * every call uses its own visited set.
 */
public final class Reachability {
  private Reachability() {}

  /**
   * Returns the worlds reachable from {@code world} in one or more steps of the agent's relation.
   * The start world is only contained if it lies on a cycle.
   */
  public static IntSet allReachable(KripkeModel model, int world, String agent) {
    IntSet reached = new IntOpenHashSet();
    IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
    queue.enqueue(world);
    while (!queue.isEmpty()) {
      int current = queue.dequeueInt();
      for (int successor : model.successors(current, agent).orElse(List.of())) {
        if (reached.add(successor)) {
          queue.enqueue(successor);
        }
      }
    }
    return reached;
  }

  /**
   * Returns the worlds reachable by at least one of the agents, as used by common knowledge.
   */
  public static IntSet unionReachable(KripkeModel model, int world, Collection<String> agents) {
    IntSet reached = new IntOpenHashSet();
    for (String agent : agents) {
      reached.addAll(allReachable(model, world, agent));
    }
    return reached;
  }

  /**
   * Returns the worlds reachable by every one of the agents, as used by distributed knowledge.
   *
   * @throws IllegalArgumentException if no agent is given
   */
  public static IntSet intersectReachable(KripkeModel model, int world, Collection<String> agents) {
    checkArgument(!agents.isEmpty(), "Intersection over an empty set of agents");
    Iterator<String> iterator = agents.iterator();
    IntSet reached = allReachable(model, world, iterator.next());
    while (iterator.hasNext() && !reached.isEmpty()) {
      reached.retainAll(allReachable(model, world, iterator.next()));
    }
    return reached;
  }
}
