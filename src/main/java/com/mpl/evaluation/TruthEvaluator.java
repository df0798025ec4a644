package com.mpl.evaluation;

import com.google.common.collect.ImmutableMap;
import com.mpl.Wff;
import com.mpl.formula.Formula;
import com.mpl.formula.FormulaVisitor;
import com.mpl.model.KripkeModel;
import com.mpl.model.Reachability;
import com.mpl.model.StateNotFoundException;
import it.unimi.dsi.fastutil.ints.IntIterable;
import java.util.Map;
import java.util.Set;
import java.util.function.IntPredicate;
import javax.annotation.Nullable;

/**
 * Decides the truth of formulas in the worlds of a {@link KripkeModel}. The model is only read;
 * callers must not modify it while an evaluation is running.
 */
public final class TruthEvaluator {
  private final KripkeModel model;

  /**
   * @throws InvalidModelException if no model is given
   */
  public TruthEvaluator(@Nullable KripkeModel model) {
    this.model = checkModel(model);
  }

  /**
   * Evaluates the formula at the given world.
   *
   * @throws InvalidModelException if no model is given
   * @throws InvalidWffException if no formula is given or the formula is a bare agent list
   * @throws StateNotFoundException if the world does not exist
   */
  public static boolean truth(@Nullable KripkeModel model, int world, @Nullable Wff wff) {
    KripkeModel checkedModel = checkModel(model);
    Formula formula = checkWff(wff).formula();
    if (!checkedModel.contains(world)) {
      throw new StateNotFoundException(world);
    }
    return new TruthEvaluator(checkedModel).holds(world, formula);
  }

  /**
   * Evaluates the formula at every world of the model, keyed by world index.
   */
  public static Map<Integer, Boolean> truthAtAllWorlds(@Nullable KripkeModel model, @Nullable Wff wff) {
    KripkeModel checkedModel = checkModel(model);
    Formula formula = checkWff(wff).formula();
    TruthEvaluator evaluator = new TruthEvaluator(checkedModel);
    ImmutableMap.Builder<Integer, Boolean> truth = ImmutableMap.builder();
    checkedModel.liveWorlds().forEach(world -> truth.put(world, evaluator.holds(world, formula)));
    return truth.build();
  }

  private static KripkeModel checkModel(@Nullable KripkeModel model) {
    if (model == null) {
      throw new InvalidModelException("Invalid model!");
    }
    return model;
  }

  private static Wff checkWff(@Nullable Wff wff) {
    if (wff == null) {
      throw new InvalidWffException("Invalid wff!");
    }
    if (wff.formula() instanceof Formula.Group) {
      throw new InvalidWffException("Agent list %s is not a formula".formatted(wff));
    }
    return wff;
  }

  /**
   * @throws StateNotFoundException if the world does not exist
   */
  public boolean holds(int world, Formula formula) {
    if (!model.contains(world)) {
      throw new StateNotFoundException(world);
    }
    return formula.accept(new WorldEvaluator(world));
  }

  private static boolean all(IntIterable worlds, IntPredicate predicate) {
    var iterator = worlds.iterator();
    while (iterator.hasNext()) {
      if (!predicate.test(iterator.nextInt())) {
        return false;
      }
    }
    return true;
  }

  private final class WorldEvaluator implements FormulaVisitor<Boolean> {
    private final int world;

    WorldEvaluator(int world) {
      this.world = world;
    }

    private boolean knows(String agent, Formula formula) {
      return model.successors(world, agent).orElseThrow(() -> new StateNotFoundException(world))
          .stream().allMatch(successor -> holds(successor, formula));
    }

    @Override
    public Boolean visit(Formula.Prop prop) {
      return model.valuation(prop.name(), world);
    }

    @Override
    public Boolean visit(Formula.Neg neg) {
      return !neg.operand().accept(this);
    }

    @Override
    public Boolean visit(Formula.Nec nec) {
      return model.allSuccessors(world).stream().allMatch(successor -> holds(successor, nec.operand()));
    }

    @Override
    public Boolean visit(Formula.Poss poss) {
      return model.allSuccessors(world).stream().anyMatch(successor -> holds(successor, poss.operand()));
    }

    @Override
    public Boolean visit(Formula.Conj conj) {
      return conj.left().accept(this) && conj.right().accept(this);
    }

    @Override
    public Boolean visit(Formula.Disj disj) {
      return disj.left().accept(this) || disj.right().accept(this);
    }

    @Override
    public Boolean visit(Formula.Impl impl) {
      return !impl.left().accept(this) || impl.right().accept(this);
    }

    @Override
    public Boolean visit(Formula.Equi equi) {
      return equi.left().accept(this).equals(equi.right().accept(this));
    }

    @Override
    public Boolean visit(Formula.Know know) {
      return knows(know.agent().name(), know.operand());
    }

    @Override
    public Boolean visit(Formula.Group group) {
      throw new InvalidFormulaException("Agent list %s used as a formula".formatted(group.agents()));
    }

    @Override
    public Boolean visit(Formula.EveryoneKnows everyoneKnows) {
      Set<String> agents = everyoneKnows.group().agents();
      return agents.stream().allMatch(agent -> knows(agent, everyoneKnows.operand()));
    }

    @Override
    public Boolean visit(Formula.Distributed distributed) {
      var reachable = Reachability.intersectReachable(model, world, distributed.group().agents());
      return all(reachable, successor -> holds(successor, distributed.operand()));
    }

    @Override
    public Boolean visit(Formula.Common common) {
      var reachable = Reachability.unionReachable(model, world, common.group().agents());
      return all(reachable, successor -> holds(successor, common.operand()));
    }
  }
}
