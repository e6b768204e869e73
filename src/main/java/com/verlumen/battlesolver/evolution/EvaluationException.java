package com.verlumen.battlesolver.evolution;

import com.verlumen.battlesolver.army.Army;

/** The battle simulator failed while evaluating an army. The run cannot continue. */
public final class EvaluationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient Army army;

  public EvaluationException(Army army, Throwable cause) {
    super("Simulation failed for " + army, cause);
    this.army = army;
  }

  public EvaluationException(String message, Throwable cause) {
    super(message, cause);
    this.army = null;
  }

  /** The army whose simulation failed, if known. */
  public Army army() {
    return army;
  }
}
