package com.verlumen.battlesolver.fitness;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Point cutoffs a winning army is graded against. Grades play no part in ordering. */
@AutoValue
public abstract class BattleGrades {
  public static BattleGrades create(int aCutoff, int bCutoff, int cCutoff, int dCutoff) {
    checkArgument(
        aCutoff <= bCutoff && bCutoff <= cCutoff && cCutoff <= dCutoff,
        "Cutoffs must be ascending: %s, %s, %s, %s",
        aCutoff,
        bCutoff,
        cCutoff,
        dCutoff);
    return new AutoValue_BattleGrades(aCutoff, bCutoff, cCutoff, dCutoff);
  }

  public abstract int aCutoff();

  public abstract int bCutoff();

  public abstract int cCutoff();

  public abstract int dCutoff();

  public Grade grade(Fitness fitness) {
    return grade(fitness.outcome(), fitness.points());
  }

  public Grade grade(BattleOutcome outcome, int points) {
    if (!outcome.isWin()) {
      return Grade.FAILED;
    }
    if (points < aCutoff()) {
      return Grade.S;
    } else if (points == aCutoff()) {
      return Grade.A;
    } else if (points <= bCutoff()) {
      return Grade.B;
    } else if (points <= cCutoff()) {
      return Grade.C;
    } else if (points <= dCutoff()) {
      return Grade.D;
    }
    return Grade.F;
  }
}
