package com.mpl.evaluation;

public class InvalidFormulaException extends EvaluationException {
  public InvalidFormulaException(String message) {
    super(message);
  }
}
