package com.mpl;

import static java.util.Objects.requireNonNull;

import com.mpl.formula.Formula;
import com.mpl.output.FormulaWriter;
import com.mpl.output.Notation;
import com.mpl.parser.FormulaParser;

/**
 * A well-formed formula together with its textual representations.
 */
public final class Wff {
  private final Formula formula;
  private final String ascii;
  private final String latex;
  private final String unicode;

  private Wff(Formula formula) {
    this.formula = requireNonNull(formula);
    this.ascii = FormulaWriter.toAscii(formula);
    this.latex = Notation.LATEX.apply(ascii);
    this.unicode = Notation.UNICODE.apply(ascii);
  }

  public static Wff of(Formula formula) {
    return new Wff(formula);
  }

  /**
   * @throws IllegalArgumentException if the text is not a well-formed formula
   */
  public static Wff parse(String ascii) {
    return new Wff(FormulaParser.parse(ascii));
  }

  public Formula formula() {
    return formula;
  }

  public String ascii() {
    return ascii;
  }

  public String latex() {
    return latex;
  }

  public String unicode() {
    return unicode;
  }

  public String format(Notation notation) {
    return switch (notation) {
      case ASCII -> ascii;
      case LATEX -> latex;
      case UNICODE -> unicode;
    };
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Wff that && formula.equals(that.formula));
  }

  @Override
  public int hashCode() {
    return formula.hashCode();
  }

  @Override
  public String toString() {
    return ascii;
  }
}
