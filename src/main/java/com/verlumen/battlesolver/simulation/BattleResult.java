package com.verlumen.battlesolver.simulation;

import com.google.auto.value.AutoValue;
import com.verlumen.battlesolver.fitness.BattleOutcome;

/** What the simulator reports after a battle between an ally and an enemy army. */
@AutoValue
public abstract class BattleResult {
  public static BattleResult create(
      BattleOutcome outcome, double allyRemainingHealth, double enemyRemainingHealth) {
    return new AutoValue_BattleResult(outcome, allyRemainingHealth, enemyRemainingHealth);
  }

  public abstract BattleOutcome outcome();

  public abstract double allyRemainingHealth();

  public abstract double enemyRemainingHealth();
}
