package com.verlumen.battlesolver.balance;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.fitness.BattleGrades;
import java.util.Optional;

/** One battle of a balance overview: an enemy army and, when the battle has them, its grades. */
@AutoValue
public abstract class BalanceBattle {
  /** Starting army budget of battles without grades. */
  static final int DEFAULT_TARGET_COST = 900;

  public static BalanceBattle create(String id, Army enemy) {
    return create(id, enemy, Optional.empty());
  }

  public static BalanceBattle create(String id, Army enemy, BattleGrades grades) {
    return create(id, enemy, Optional.of(grades));
  }

  private static BalanceBattle create(String id, Army enemy, Optional<BattleGrades> grades) {
    checkArgument(!id.isEmpty(), "A battle needs an id");
    checkArgument(!enemy.isEmpty(), "Battle %s has no enemies", id);
    return new AutoValue_BalanceBattle(id, enemy, grades);
  }

  public abstract String id();

  public abstract Army enemy();

  public abstract Optional<BattleGrades> grades();

  /** The D cutoff of graded battles, {@value #DEFAULT_TARGET_COST} otherwise. */
  public int targetCost() {
    return grades().map(BattleGrades::dCutoff).orElse(DEFAULT_TARGET_COST);
  }
}
