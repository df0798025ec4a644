package com.mpl.output;

import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.SetMultimap;
import com.mpl.model.KripkeModel;
import java.io.PrintStream;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

public final class DotWriter {
  private DotWriter() {
  }

  /**
   * Writes the model as a graph with one edge per pair of worlds, labelled with all agents having
   * that transition.
   */
  public static void writeModel(KripkeModel model, PrintStream writer) {
    List<Optional<Set<String>>> worlds = model.worlds();
    writer.append("digraph {\n");
    model.liveWorlds().forEach(world -> {
      Set<String> valuation = worlds.get(world).orElseThrow();
      writer.append("W_%d [label=\"%d: %s\"]\n".formatted(world, world,
          valuation.stream().sorted().collect(Collectors.joining(","))));
    });
    model.liveWorlds().forEach(world -> {
      SetMultimap<Integer, String> agentsBySuccessor = MultimapBuilder.treeKeys().treeSetValues().build();
      for (String agent : model.agentsAt(world)) {
        model.successors(world, agent).orElseThrow()
            .forEach(successor -> agentsBySuccessor.put(successor, agent));
      }
      for (var entry : agentsBySuccessor.asMap().entrySet()) {
        writer.append("W_%d -> W_%d [label=\"%s\"]\n".formatted(world, entry.getKey(),
            String.join(",", entry.getValue())));
      }
    });
    writer.append("}");
  }
}
