package com.mpl.output;

import com.mpl.formula.Formula;
import com.mpl.formula.FormulaVisitor;
import com.mpl.formula.Operator;

/**
 * Writes a formula in the canonical text syntax. Binary operators are always parenthesized, agent
 * lists never are, so the result parses back to the same tree.
 */
public final class FormulaWriter implements FormulaVisitor<String> {
  private static final FormulaWriter INSTANCE = new FormulaWriter();

  private FormulaWriter() {}

  public static String toAscii(Formula formula) {
    return formula.accept(INSTANCE);
  }

  private String unary(Operator operator, Formula operand) {
    return operator.symbol() + operand.accept(this);
  }

  private String binary(Operator operator, Formula left, Formula right) {
    return "(" + left.accept(this) + operator.asciiToken() + right.accept(this) + ")";
  }

  @Override
  public String visit(Formula.Prop prop) {
    return prop.name();
  }

  @Override
  public String visit(Formula.Neg neg) {
    return unary(Operator.NEG, neg.operand());
  }

  @Override
  public String visit(Formula.Nec nec) {
    return unary(Operator.NEC, nec.operand());
  }

  @Override
  public String visit(Formula.Poss poss) {
    return unary(Operator.POSS, poss.operand());
  }

  @Override
  public String visit(Formula.Conj conj) {
    return binary(Operator.CONJ, conj.left(), conj.right());
  }

  @Override
  public String visit(Formula.Disj disj) {
    return binary(Operator.DISJ, disj.left(), disj.right());
  }

  @Override
  public String visit(Formula.Impl impl) {
    return binary(Operator.IMPL, impl.left(), impl.right());
  }

  @Override
  public String visit(Formula.Equi equi) {
    return binary(Operator.EQUI, equi.left(), equi.right());
  }

  @Override
  public String visit(Formula.Know know) {
    return binary(Operator.KNOW, know.agent(), know.operand());
  }

  @Override
  public String visit(Formula.Group group) {
    return group.agent().name() + Operator.GROUP.asciiToken() + group.rest().accept(this);
  }

  @Override
  public String visit(Formula.EveryoneKnows everyoneKnows) {
    return binary(Operator.EVERYONE, everyoneKnows.group(), everyoneKnows.operand());
  }

  @Override
  public String visit(Formula.Distributed distributed) {
    return binary(Operator.DISTRIBUTED, distributed.group(), distributed.operand());
  }

  @Override
  public String visit(Formula.Common common) {
    return binary(Operator.COMMON, common.group(), common.operand());
  }
}
