package com.mpl.output;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class NotationTest {
  @Test
  void asciiIsUnchanged() {
    assertThat(Notation.ASCII.apply("(~p & (a ? []q))")).isEqualTo("(~p & (a ? []q))");
  }

  @Test
  void latexReplacesOperators() {
    assertThat(Notation.LATEX.apply("(~p & (a ? []q))"))
        .isEqualTo("(\\lnot{}p\\land{}(a\\mathrel{K}\\Box{}q))");
    assertThat(Notation.LATEX.apply("((p <-> <>q) | (p -> q))"))
        .isEqualTo("((p\\leftrightarrow{}\\Diamond{}q)\\lor{}(p\\rightarrow{}q))");
    assertThat(Notation.LATEX.apply("(a,b ?C (a ?E p))"))
        .isEqualTo("(a,b\\mathrel{C}(a\\mathrel{E}p))");
    assertThat(Notation.LATEX.apply("(a,b ?D p)")).isEqualTo("(a,b\\mathrel{D}p)");
  }

  @Test
  void unicodeReplacesOperators() {
    assertThat(Notation.UNICODE.apply("(~p & (a ? []q))")).isEqualTo("(¬p ∧ (a K □q))");
    assertThat(Notation.UNICODE.apply("((p <-> <>q) | (p -> q))")).isEqualTo("((p ↔ ◊q) ∨ (p → q))");
    assertThat(Notation.UNICODE.apply("(a,b ?C (c ?D p))")).isEqualTo("(a,b C (c D p))");
  }
}
