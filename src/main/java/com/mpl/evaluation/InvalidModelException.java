package com.mpl.evaluation;

public class InvalidModelException extends EvaluationException {
  public InvalidModelException(String message) {
    super(message);
  }
}
