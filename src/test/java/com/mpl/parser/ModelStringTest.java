package com.mpl.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mpl.model.KripkeModel;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ModelStringTest {
  private static KripkeModel example() {
    KripkeModel model = new KripkeModel();
    model.addWorld(Set.of("p", "q"));
    model.addWorld(Set.of("r"));
    model.addWorld(Set.of());
    model.addWorld(Set.of("p"));
    model.addTransition(0, 3, "a");
    model.addTransition(0, 2, "a");
    model.addTransition(0, 0, "b");
    model.addTransition(3, 2, "b", "c");
    model.addTransition(2, 0, "a");
    model.addTransition(1, 0, "a");
    model.removeWorld(1);
    return model;
  }

  @Test
  void serializeWritesOneTokenPerWorld() {
    KripkeModel model = new KripkeModel();
    model.addWorld(Set.of("q"));
    model.addWorld(Set.of());
    model.addWorld(Set.of());
    model.addTransition(0, 0, "a");
    model.addTransition(0, 2, "a");
    model.removeWorld(1);

    assertThat(ModelString.serialize(model)).isEqualTo("AqSa0,2;;AS;");
    assertThat(ModelString.serialize(example())).isEqualTo("Ap,qSa3,2b0;;ASa0;ApSb2c2;");
    assertThat(ModelString.serialize(new KripkeModel())).isEmpty();
  }

  @Test
  void deserializeRestoresWorldsAndRelations() {
    KripkeModel model = ModelString.deserialize("AqSa0,2;;AS;");

    assertThat(model.size()).isEqualTo(3);
    assertThat(model.contains(1)).isFalse();
    assertThat(model.valuation("q", 0)).isTrue();
    assertThat(model.valuation("q", 2)).isFalse();
    assertThat(model.successors(0, "a")).contains(List.of(0, 2));
    assertThat(model.agents()).containsExactly("a");
  }

  @Test
  void roundTripPreservesWorldsValuationsAndRelations() {
    KripkeModel model = example();
    KripkeModel restored = ModelString.deserialize(ModelString.serialize(model));

    assertThat(restored.worlds()).isEqualTo(model.worlds());
    assertThat(restored.agents()).isEqualTo(model.agents());
    model.liveWorlds().forEach(world -> {
      for (String agent : model.agents()) {
        assertThat(restored.successors(world, agent)).isEqualTo(model.successors(world, agent));
      }
    });
    assertThat(ModelString.serialize(restored)).isEqualTo(ModelString.serialize(model));
  }

  @Test
  void duplicateTransitionsSurvive() {
    KripkeModel model = ModelString.deserialize("ASa1,1;AS;");
    assertThat(model.successors(0, "a")).contains(List.of(1, 1));
    assertThat(ModelString.serialize(model)).isEqualTo("ASa1,1;AS;");
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "AqSa0",
      "Xp;",
      "ApSa;",
      "APS;",
      "Ap,S;",
      "ASa1;;",
      "ASa3;",
      "AS;AS;x",
  })
  void rejectsMalformedStrings(String modelString) {
    assertThatThrownBy(() -> ModelString.deserialize(modelString)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsNamesThatCannotBeWritten() {
    KripkeModel propositions = new KripkeModel();
    propositions.addWorld(Set.of("Sx"));
    assertThatThrownBy(() -> ModelString.serialize(propositions)).isInstanceOf(IllegalArgumentException.class);

    KripkeModel agents = new KripkeModel();
    agents.addWorld(Set.of());
    agents.addTransition(0, 0, "a1");
    assertThatThrownBy(() -> ModelString.serialize(agents)).isInstanceOf(IllegalArgumentException.class);
  }
}
