package com.mpl.parser;

import static com.google.common.base.Preconditions.checkState;

import com.mpl.formula.Formula;
import com.mpl.formula.Formula.AgentTerm;
import com.mpl.formula.Formula.Prop;
import com.mpl.grammar.EpistemicParser;
import com.mpl.grammar.EpistemicParserBaseVisitor;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.ErrorNode;

/**
 * Builds a {@link Formula} from the parse tree. Agent lists are only accepted as left operand of
 * the group operators, a knowledge operator needs a single agent on its left.
 */
public class FormulaParser extends EpistemicParserBaseVisitor<Formula> {
  public static Formula parse(String formula) {
    return ParseUtil.parse(formula, new FormulaParser());
  }

  @Override
  public Formula visitFormula(EpistemicParser.FormulaContext ctx) {
    checkState(ctx.getChildCount() == 2);
    return operand(ctx.root);
  }

  @Override
  public Formula visitNested(EpistemicParser.NestedContext ctx) {
    checkState(ctx.getChildCount() == 3);
    return visit(ctx.nested);
  }

  @Override
  public Formula visitVariable(EpistemicParser.VariableContext ctx) {
    return new Prop(ctx.variable.getText());
  }

  @Override
  public Formula visitGroup(EpistemicParser.GroupContext ctx) {
    checkState(ctx.getChildCount() == 3);
    return new Formula.Group(agent(ctx.left), agentTerm(ctx.right));
  }

  @Override
  public Formula visitUnaryOperation(EpistemicParser.UnaryOperationContext ctx) {
    checkState(ctx.getChildCount() == 2);
    Formula inner = operand(ctx.inner);
    return switch (ctx.op.getType()) {
      case EpistemicParser.NOT -> new Formula.Neg(inner);
      case EpistemicParser.NEC -> new Formula.Nec(inner);
      case EpistemicParser.POSS -> new Formula.Poss(inner);
      default -> throw new ParseCancellationException("Unsupported operator " + ctx.op.getText());
    };
  }

  @Override
  public Formula visitConjunction(EpistemicParser.ConjunctionContext ctx) {
    checkState(ctx.getChildCount() == 3);
    return new Formula.Conj(operand(ctx.left), operand(ctx.right));
  }

  @Override
  public Formula visitDisjunction(EpistemicParser.DisjunctionContext ctx) {
    checkState(ctx.getChildCount() == 3);
    return new Formula.Disj(operand(ctx.left), operand(ctx.right));
  }

  @Override
  public Formula visitImplication(EpistemicParser.ImplicationContext ctx) {
    checkState(ctx.getChildCount() == 3);
    return new Formula.Impl(operand(ctx.left), operand(ctx.right));
  }

  @Override
  public Formula visitBinaryOperation(EpistemicParser.BinaryOperationContext ctx) {
    checkState(ctx.getChildCount() == 3);
    Formula right = operand(ctx.right);
    return switch (ctx.op.getType()) {
      case EpistemicParser.EQUIV -> new Formula.Equi(operand(ctx.left), right);
      case EpistemicParser.KNOW -> new Formula.Know(agent(ctx.left), right);
      case EpistemicParser.EVERYONE -> new Formula.EveryoneKnows(agentTerm(ctx.left), right);
      case EpistemicParser.DISTRIBUTED -> new Formula.Distributed(agentTerm(ctx.left), right);
      case EpistemicParser.COMMON -> new Formula.Common(agentTerm(ctx.left), right);
      default -> throw new ParseCancellationException("Unsupported operator " + ctx.op.getText());
    };
  }

  @Override
  public Formula visitErrorNode(ErrorNode node) {
    throw new ParseCancellationException();
  }

  private Formula operand(ParserRuleContext ctx) {
    Formula formula = visit(ctx);
    if (formula instanceof Formula.Group) {
      throw new ParseCancellationException("Agent list %s outside of a group operator".formatted(ctx.getText()));
    }
    return formula;
  }

  private Prop agent(ParserRuleContext ctx) {
    if (visit(ctx) instanceof Prop agent) {
      return agent;
    }
    throw new ParseCancellationException("Expected an agent, got " + ctx.getText());
  }

  private AgentTerm agentTerm(ParserRuleContext ctx) {
    if (visit(ctx) instanceof AgentTerm group) {
      return group;
    }
    throw new ParseCancellationException("Expected an agent or a list of agents, got " + ctx.getText());
  }
}
