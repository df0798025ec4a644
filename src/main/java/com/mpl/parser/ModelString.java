package com.mpl.parser;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import com.mpl.model.KripkeModel;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Compact text form of a model, one {@code ;}-terminated token per world.
 *
 * <p>A world with valuation {@code {p, q}} and transitions {@code a -> 0, 2} and {@code b -> 1}
 * is written {@code Ap,qSa0,2b1;}. Removed worlds are written as empty tokens, e.g.
 * {@code AqSa0,2;;AS;}. Proposition names must match {@code [a-z0-9_]+} and agent names
 * {@code [a-z_]+}.
 */
public final class ModelString {
  private static final Logger log = Logger.getLogger(ModelString.class.getName());

  private static final Pattern PROPOSITION = Pattern.compile("[a-z0-9_]+");
  private static final Pattern AGENT = Pattern.compile("[a-z_]+");
  private static final Pattern MODEL = Pattern.compile(
      "(?:(?:A(?:[a-z0-9_]+(?:,[a-z0-9_]+)*)?S(?:[a-z_]+\\d+(?:,\\d+)*)*)?;)*");
  private static final Pattern WORLD = Pattern.compile("A([a-z0-9_,]*)S(.*)");
  private static final Pattern RELATION = Pattern.compile("([a-z_]+)(\\d+(?:,\\d+)*)");
  private static final Splitter COMMA = Splitter.on(',').omitEmptyStrings();

  private ModelString() {}

  /**
   * @throws IllegalArgumentException if a proposition or agent name cannot be represented
   */
  public static String serialize(KripkeModel model) {
    StringBuilder builder = new StringBuilder();
    List<Optional<Set<String>>> worlds = model.worlds();
    for (int index = 0; index < worlds.size(); index++) {
      Optional<Set<String>> valuation = worlds.get(index);
      if (valuation.isPresent()) {
        for (String proposition : valuation.get()) {
          checkArgument(PROPOSITION.matcher(proposition).matches(),
              "Proposition %s cannot be serialized", proposition);
        }
        builder.append('A').append(valuation.get().stream().sorted().collect(Collectors.joining(",")));
        builder.append('S');
        for (String agent : model.agentsAt(index)) {
          checkArgument(AGENT.matcher(agent).matches(), "Agent %s cannot be serialized", agent);
          builder.append(agent).append(model.successors(index, agent).orElseThrow().stream()
              .map(String::valueOf)
              .collect(Collectors.joining(",")));
        }
      }
      builder.append(';');
    }
    return builder.toString();
  }

  /**
   * Builds a new model from its text form.
   *
   * @throws IllegalArgumentException if the string is malformed or a transition leads to a missing world
   */
  public static KripkeModel deserialize(String modelString) {
    checkArgument(MODEL.matcher(modelString).matches(), "Malformed model string %s", modelString);
    List<String> tokens = Arrays.asList(modelString.split(";", -1));
    tokens = tokens.subList(0, tokens.size() - 1);

    List<WorldToken> worlds = new ArrayList<>(tokens.size());
    for (String token : tokens) {
      worlds.add(token.isEmpty() ? null : WorldToken.parse(token));
    }
    for (int source = 0; source < worlds.size(); source++) {
      @Nullable
      WorldToken world = worlds.get(source);
      if (world == null) {
        continue;
      }
      for (int target : world.successors.values()) {
        checkArgument(target < worlds.size() && worlds.get(target) != null,
            "Transition from %s to missing world %s", source, target);
      }
    }

    KripkeModel model = new KripkeModel();
    for (WorldToken world : worlds) {
      model.addWorld(world == null ? Set.of() : world.valuation);
    }
    for (int source = 0; source < worlds.size(); source++) {
      @Nullable
      WorldToken world = worlds.get(source);
      if (world != null) {
        int from = source;
        world.successors.forEach((agent, target) -> model.addTransition(from, target, agent));
      }
    }
    for (int index = 0; index < worlds.size(); index++) {
      if (worlds.get(index) == null) {
        model.removeWorld(index);
      }
    }
    log.log(Level.FINE, () -> "Loaded model with %d worlds from model string".formatted(model.size()));
    return model;
  }

  private record WorldToken(Set<String> valuation, ListMultimap<String, Integer> successors) {
    static WorldToken parse(String token) {
      Matcher world = WORLD.matcher(token);
      checkArgument(world.matches(), "Malformed world %s", token);
      Set<String> valuation = Set.copyOf(COMMA.splitToList(world.group(1)));

      ImmutableListMultimap.Builder<String, Integer> successors = ImmutableListMultimap.builder();
      Matcher relation = RELATION.matcher(world.group(2));
      while (relation.find()) {
        String agent = relation.group(1);
        COMMA.split(relation.group(2)).forEach(target -> successors.put(agent, Integer.parseInt(target)));
      }
      return new WorldToken(valuation, successors.build());
    }
  }
}
