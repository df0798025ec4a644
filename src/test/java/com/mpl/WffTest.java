package com.mpl;

import static org.assertj.core.api.Assertions.assertThat;

import com.mpl.formula.Formula;
import com.mpl.formula.Formula.Prop;
import com.mpl.output.Notation;
import org.junit.jupiter.api.Test;

class WffTest {
  @Test
  void parsedFormulaCarriesAllRepresentations() {
    Wff wff = Wff.parse("a ? ~p & q");

    assertThat(wff.formula()).isEqualTo(
        new Formula.Know(new Prop("a"), new Formula.Conj(new Formula.Neg(new Prop("p")), new Prop("q"))));
    assertThat(wff.ascii()).isEqualTo("(a ? (~p & q))");
    assertThat(wff.latex()).isEqualTo("(a\\mathrel{K}(\\lnot{}p\\land{}q))");
    assertThat(wff.unicode()).isEqualTo("(a K (¬p ∧ q))");
    assertThat(wff.format(Notation.UNICODE)).isEqualTo(wff.unicode());
  }

  @Test
  void wffFromTreeEqualsParsedWff() {
    Wff wff = Wff.of(new Formula.Nec(new Formula.Disj(new Prop("p"), new Prop("q"))));

    assertThat(wff.ascii()).isEqualTo("[](p | q)");
    assertThat(wff).isEqualTo(Wff.parse(wff.ascii())).hasSameHashCodeAs(Wff.parse("[](p|q)"));
  }
}
