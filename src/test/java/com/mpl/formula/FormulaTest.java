package com.mpl.formula;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mpl.formula.Formula.Group;
import com.mpl.formula.Formula.Prop;
import org.junit.jupiter.api.Test;

class FormulaTest {
  @Test
  void singleAgentIsAGroupOfOne() {
    assertThat(new Prop("a").agents()).containsExactly("a");
  }

  @Test
  void groupKeepsFirstOccurrenceOrder() {
    Group group = new Group(new Prop("b"), new Group(new Prop("a"), new Group(new Prop("b"), new Prop("c"))));
    assertThat(group.agents()).containsExactly("b", "a", "c");
  }

  @Test
  void nodesRejectMissingParts() {
    assertThatThrownBy(() -> new Prop("")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Formula.Conj(new Prop("p"), null)).isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> new Formula.Know(null, new Prop("p"))).isInstanceOf(NullPointerException.class);
  }

  @Test
  void operatorTableOrdersLongerSymbolsFirst() {
    var operators = Operator.bySymbolLength();
    assertThat(operators.indexOf(Operator.EQUI)).isLessThan(operators.indexOf(Operator.IMPL));
    assertThat(operators.indexOf(Operator.COMMON)).isLessThan(operators.indexOf(Operator.KNOW));
    assertThat(Operator.CONJ.precedence()).isGreaterThan(Operator.DISJ.precedence());
    assertThat(Operator.KNOW.associativity()).isEqualTo(Operator.Associativity.RIGHT);
    assertThat(Operator.NEG.associativity()).isEqualTo(Operator.Associativity.NONE);
    assertThat(Operator.KNOW.key()).isEqualTo("know");
    assertThat(Operator.GROUP.arity()).isEqualTo(2);
  }
}
