package com.mpl.formula;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import javax.annotation.Nullable;

/**
 * The operator table of the formula syntax. Precedence is higher for tighter binding; all binary
 * operators associate to the right.
 */
public enum Operator {
  GROUP(",", "group", 2, 5, null, null),
  NEG("~", "neg", 1, 4, "\\lnot{}", "¬"),
  NEC("[]", "nec", 1, 4, "\\Box{}", "□"),
  POSS("<>", "poss", 1, 4, "\\Diamond{}", "◊"),
  CONJ("&", "conj", 2, 3, "\\land{}", "∧"),
  DISJ("|", "disj", 2, 2, "\\lor{}", "∨"),
  IMPL("->", "impl", 2, 1, "\\rightarrow{}", "→"),
  EQUI("<->", "equi", 2, 0, "\\leftrightarrow{}", "↔"),
  KNOW("?", "know", 2, 0, "\\mathrel{K}", "K"),
  EVERYONE("?E", "everyone", 2, 0, "\\mathrel{E}", "E"),
  DISTRIBUTED("?D", "distributed", 2, 0, "\\mathrel{D}", "D"),
  COMMON("?C", "common", 2, 0, "\\mathrel{C}", "C");

  public enum Associativity {
    RIGHT,
    NONE
  }

  private static final List<Operator> BY_SYMBOL_LENGTH = Arrays.stream(values())
      .sorted(Comparator.comparingInt((Operator o) -> o.symbol.length()).reversed())
      .toList();

  private final String symbol;
  private final String key;
  private final int arity;
  private final int precedence;
  @Nullable
  private final String latex;
  @Nullable
  private final String unicode;

  Operator(String symbol, String key, int arity, int precedence, @Nullable String latex, @Nullable String unicode) {
    this.symbol = symbol;
    this.key = key;
    this.arity = arity;
    this.precedence = precedence;
    this.latex = latex;
    this.unicode = unicode;
  }

  public String symbol() {
    return symbol;
  }

  public String key() {
    return key;
  }

  public int arity() {
    return arity;
  }

  public int precedence() {
    return precedence;
  }

  public Associativity associativity() {
    return arity == 1 ? Associativity.NONE : Associativity.RIGHT;
  }

  /** How the operator appears in canonical text, binary operators other than the group are padded. */
  public String asciiToken() {
    return arity == 2 && this != GROUP ? " " + symbol + " " : symbol;
  }

  @Nullable
  public String latex() {
    return latex;
  }

  @Nullable
  public String unicode() {
    return unicode;
  }

  /** Operators ordered so that no symbol is replaced before a longer symbol containing it. */
  public static List<Operator> bySymbolLength() {
    return BY_SYMBOL_LENGTH;
  }
}
