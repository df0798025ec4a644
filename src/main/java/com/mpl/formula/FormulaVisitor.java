package com.mpl.formula;

public interface FormulaVisitor<R> {
  R visit(Formula.Prop prop);

  R visit(Formula.Neg neg);

  R visit(Formula.Nec nec);

  R visit(Formula.Poss poss);

  R visit(Formula.Conj conj);

  R visit(Formula.Disj disj);

  R visit(Formula.Impl impl);

  R visit(Formula.Equi equi);

  R visit(Formula.Know know);

  R visit(Formula.Group group);

  R visit(Formula.EveryoneKnows everyoneKnows);

  R visit(Formula.Distributed distributed);

  R visit(Formula.Common common);
}
