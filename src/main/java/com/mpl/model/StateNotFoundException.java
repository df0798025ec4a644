package com.mpl.model;

public class StateNotFoundException extends RuntimeException {
  private final int state;

  public StateNotFoundException(int state) {
    super("State %d not found".formatted(state));
    this.state = state;
  }

  public int state() {
    return state;
  }
}
