package com.mpl.parser;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.mpl.model.KripkeModel;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Reads models from JSON of the form
 *
 * <pre>{@code
 * {"worlds": [{"valuation": ["p"], "successors": {"a": [1]}}, null, {"valuation": []}]}
 * }</pre>
 *
 * <p>{@code null} entries are removed worlds, missing {@code successors} means no transitions.
 */
public final class ModelParser {
  private static final Logger log = Logger.getLogger(ModelParser.class.getName());

  private ModelParser() {}

  public static KripkeModel parse(Reader reader) {
    return parse(JsonParser.parseReader(reader).getAsJsonObject());
  }

  public static KripkeModel parse(JsonObject json) {
    JsonArray worlds = requireNonNull(json.getAsJsonArray("worlds"), "Missing worlds");

    KripkeModel model = new KripkeModel();
    List<JsonObject> transitions = new ArrayList<>(worlds.size());
    for (JsonElement element : worlds) {
      if (element.isJsonNull()) {
        model.addWorld(Set.of());
        transitions.add(null);
        continue;
      }
      int index = model.size();
      JsonObject world = element.getAsJsonObject();
      Set<String> valuation = ParseUtil.stream(requireNonNull(world.getAsJsonArray("valuation"),
              () -> "Missing valuation for world %d".formatted(index)))
          .map(JsonElement::getAsString)
          .collect(Collectors.toSet());
      model.addWorld(valuation);
      transitions.add(world.has("successors") ? world.getAsJsonObject("successors") : new JsonObject());
    }

    for (int source = 0; source < transitions.size(); source++) {
      JsonObject successors = transitions.get(source);
      if (successors == null) {
        continue;
      }
      for (Map.Entry<String, JsonElement> entry : successors.entrySet()) {
        for (JsonElement targetElement : entry.getValue().getAsJsonArray()) {
          int target = targetElement.getAsInt();
          checkArgument(0 <= target && target < worlds.size() && !worlds.get(target).isJsonNull(),
              "Transition from %s to missing world %s", source, target);
          model.addTransition(source, target, entry.getKey());
        }
      }
    }

    for (int index = 0; index < worlds.size(); index++) {
      if (worlds.get(index).isJsonNull()) {
        model.removeWorld(index);
      }
    }
    log.log(Level.FINE, () -> "Loaded model with %d worlds and agents %s".formatted(model.size(), model.agents()));
    return model;
  }
}
