package com.mpl.evaluation;

public class InvalidWffException extends EvaluationException {
  public InvalidWffException(String message) {
    super(message);
  }
}
