package com.mpl.evaluation;

/**
 * Raised when a formula cannot be evaluated. Evaluation never recovers from it.
 */
public class EvaluationException extends RuntimeException {
  public EvaluationException(String message) {
    super(message);
  }
}
