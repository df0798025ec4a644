package com.mpl.formula;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;

/**
 * Immutable syntax tree of an epistemic formula. The hierarchy is closed, dispatch goes through
 * {@link FormulaVisitor}.
 */
public sealed interface Formula {
  <R> R accept(FormulaVisitor<R> visitor);

  /**
   * Operand of the group operators: either a single agent or a list of agents.
   */
  sealed interface AgentTerm extends Formula {
    /** The distinct agents named by this term, in order of appearance. */
    ImmutableSet<String> agents();
  }

  /**
   * A propositional variable, or an agent name when it stands in agent position.
   */
  record Prop(String name) implements AgentTerm {
    public Prop {
      requireNonNull(name);
      checkArgument(!name.isEmpty(), "Empty name");
    }

    @Override
    public ImmutableSet<String> agents() {
      return ImmutableSet.of(name);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record Neg(Formula operand) implements Formula {
    public Neg {
      requireNonNull(operand);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record Nec(Formula operand) implements Formula {
    public Nec {
      requireNonNull(operand);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record Poss(Formula operand) implements Formula {
    public Poss {
      requireNonNull(operand);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record Conj(Formula left, Formula right) implements Formula {
    public Conj {
      requireNonNull(left);
      requireNonNull(right);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record Disj(Formula left, Formula right) implements Formula {
    public Disj {
      requireNonNull(left);
      requireNonNull(right);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record Impl(Formula left, Formula right) implements Formula {
    public Impl {
      requireNonNull(left);
      requireNonNull(right);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record Equi(Formula left, Formula right) implements Formula {
    public Equi {
      requireNonNull(left);
      requireNonNull(right);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Individual knowledge: {@code agent} knows {@code operand}.
   */
  record Know(Prop agent, Formula operand) implements Formula {
    public Know {
      requireNonNull(agent);
      requireNonNull(operand);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Right-nested agent list, {@code a,b,c} is {@code Group(a, Group(b, c))}.
   */
  record Group(Prop agent, AgentTerm rest) implements AgentTerm {
    public Group {
      requireNonNull(agent);
      requireNonNull(rest);
    }

    @Override
    public ImmutableSet<String> agents() {
      return ImmutableSet.<String>builder().add(agent.name()).addAll(rest.agents()).build();
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record EveryoneKnows(AgentTerm group, Formula operand) implements Formula {
    public EveryoneKnows {
      requireNonNull(group);
      requireNonNull(operand);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record Distributed(AgentTerm group, Formula operand) implements Formula {
    public Distributed {
      requireNonNull(group);
      requireNonNull(operand);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  record Common(AgentTerm group, Formula operand) implements Formula {
    public Common {
      requireNonNull(group);
      requireNonNull(operand);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }
}
