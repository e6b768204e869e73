package com.verlumen.battlesolver.fitness;

/** Result of one simulated battle, seen from the searching side. */
public enum BattleOutcome {
  WIN,
  LOSS,
  /** The battle ran out of time. Ranked exactly like a loss. */
  TIMEOUT;

  public boolean isWin() {
    return this == WIN;
  }
}
