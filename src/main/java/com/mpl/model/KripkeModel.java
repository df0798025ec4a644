package com.mpl.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import javax.annotation.Nullable;

/**
 * A Kripke model with one accessibility relation per agent.
 *
 * <p>Worlds are identified by their index. Removing a world leaves a hole at its index, so indices
 * of the remaining worlds never change. Mutators silently ignore indices of absent worlds, while
 * {@link #valuation(String, int)} fails on them.
 *
 * <p>Instances are not thread safe.
 */
public final class KripkeModel {
  private final List<World> worlds = new ArrayList<>();

  @Nullable
  private World world(int index) {
    return 0 <= index && index < worlds.size() ? worlds.get(index) : null;
  }

  /**
   * Adds a world where exactly the propositions mapped to {@code true} hold.
   *
   * @return the index of the new world
   */
  public int addWorld(Map<String, Boolean> assignment) {
    return addWorld(assignment.entrySet().stream()
        .filter(Map.Entry::getValue)
        .map(Map.Entry::getKey)
        .collect(Collectors.toSet()));
  }

  /**
   * Adds a world where exactly the given propositions hold.
   *
   * @return the index of the new world
   */
  public int addWorld(Set<String> valuation) {
    int index = worlds.size();
    worlds.add(new World(valuation));
    return index;
  }

  /**
   * Removes the world and every transition leading into it.
   */
  public void removeWorld(int index) {
    if (world(index) == null) {
      return;
    }
    worlds.set(index, null);
    for (World world : worlds) {
      if (world != null) {
        world.successors.values().removeIf(target -> target == index);
      }
    }
  }

  public void addTransition(int source, int target, String... agents) {
    addTransition(source, target, Arrays.asList(agents));
  }

  /**
   * Appends {@code target} to the successors of {@code source} for each of the agents. Repeated
   * transitions are kept.
   */
  public void addTransition(int source, int target, Collection<String> agents) {
    World sourceWorld = world(source);
    if (sourceWorld == null || world(target) == null) {
      return;
    }
    for (String agent : agents) {
      sourceWorld.successors.put(agent, target);
    }
  }

  public void removeTransition(int source, int target, String... agents) {
    removeTransition(source, target, Arrays.asList(agents));
  }

  /**
   * Removes the first occurrence of {@code target} from the successors of {@code source} for each
   * of the agents.
   */
  public void removeTransition(int source, int target, Collection<String> agents) {
    World sourceWorld = world(source);
    if (sourceWorld == null) {
      return;
    }
    for (String agent : agents) {
      sourceWorld.successors.remove(agent, target);
    }
  }

  /**
   * Sets propositions mapped to {@code true} and clears those mapped to {@code false}.
   */
  public void editValuation(int index, Map<String, Boolean> assignment) {
    World world = world(index);
    if (world == null) {
      return;
    }
    assignment.forEach((proposition, value) -> {
      if (value) {
        world.valuation.add(proposition);
      } else {
        world.valuation.remove(proposition);
      }
    });
  }

  /**
   * Returns whether the proposition holds in the given world.
   *
   * @throws StateNotFoundException if there is no world with that index
   */
  public boolean valuation(String proposition, int index) {
    World world = world(index);
    if (world == null) {
      throw new StateNotFoundException(index);
    }
    return world.valuation.contains(proposition);
  }

  /**
   * Returns the successors of the world for the agent, empty if the world is absent. The list is
   * empty if the agent has no transition from that world.
   */
  public Optional<List<Integer>> successors(int index, String agent) {
    return Optional.ofNullable(world(index)).map(world -> ImmutableList.copyOf(world.successors.get(agent)));
  }

  /**
   * Returns the successors of the world over all agents, empty if the world is absent.
   */
  public List<Integer> allSuccessors(int index) {
    World world = world(index);
    return world == null ? List.of() : ImmutableList.copyOf(world.successors.values());
  }

  /**
   * Returns the agents with at least one transition from the given world.
   */
  public Set<String> agentsAt(int index) {
    World world = world(index);
    return world == null ? Set.of() : ImmutableSortedSet.copyOf(world.successors.keySet());
  }

  /**
   * Returns all agents with at least one transition in the model.
   */
  public Set<String> agents() {
    return worlds.stream()
        .filter(Objects::nonNull)
        .flatMap(world -> world.successors.keySet().stream())
        .collect(ImmutableSortedSet.toImmutableSortedSet(String::compareTo));
  }

  /**
   * Returns the valuation of each world by index, empty for removed worlds.
   */
  public List<Optional<Set<String>>> worlds() {
    return worlds.stream()
        .map(world -> Optional.ofNullable(world).map(w -> (Set<String>) ImmutableSet.copyOf(w.valuation)))
        .toList();
  }

  public boolean contains(int index) {
    return world(index) != null;
  }

  /**
   * Number of world slots, including removed ones.
   */
  public int size() {
    return worlds.size();
  }

  public IntStream liveWorlds() {
    return IntStream.range(0, worlds.size()).filter(this::contains);
  }

  @Override
  public String toString() {
    return IntStream.range(0, worlds.size())
        .mapToObj(i -> "%d: %s".formatted(i, worlds.get(i) == null ? "-" : worlds.get(i)))
        .collect(Collectors.joining(", ", "[", "]"));
  }
}
