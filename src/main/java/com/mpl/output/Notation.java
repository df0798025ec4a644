package com.mpl.output;

import com.mpl.formula.Operator;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * Target notations for canonical formula text. The conversions are plain symbol substitutions.
 */
public enum Notation {
  ASCII,
  LATEX,
  UNICODE;

  public String apply(String ascii) {
    return switch (this) {
      case ASCII -> ascii;
      case LATEX -> substitute(ascii, Operator::asciiToken, Operator::latex);
      case UNICODE -> substitute(ascii, Operator::symbol, Operator::unicode);
    };
  }

  // LaTeX commands replace the padded token, Unicode symbols keep the padding of the text
  private static String substitute(String ascii, Function<Operator, String> source,
      Function<Operator, String> replacement) {
    String result = ascii;
    for (Operator operator : Operator.bySymbolLength()) {
      @Nullable
      String target = replacement.apply(operator);
      if (target != null) {
        result = result.replace(source.apply(operator), target);
      }
    }
    return result;
  }
}
