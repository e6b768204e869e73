package com.verlumen.battlesolver.fitness;

import com.google.auto.value.AutoValue;
import java.util.Comparator;

/**
 * Outcome summary of one battle. Ordered by outcome class first, then by rules that depend on
 * the outcome:
 *
 * <ul>
 *   <li>a win beats every non-win;
 *   <li>between wins, fewer points used is better, then more remaining own health;
 *   <li>between non-wins, less remaining enemy health is better, then fewer points used.
 * </ul>
 *
 * <p>{@link BattleOutcome#TIMEOUT} and {@link BattleOutcome#LOSS} are interchangeable for
 * ordering. Greater compares better.
 */
@AutoValue
public abstract class Fitness implements Comparable<Fitness> {
  private static final Comparator<Fitness> WINS =
      Comparator.comparingInt(Fitness::points)
          .reversed()
          .thenComparingDouble(Fitness::teamHealth);

  private static final Comparator<Fitness> NON_WINS =
      Comparator.comparingDouble(Fitness::enemyHealth)
          .reversed()
          .thenComparing(Comparator.comparingInt(Fitness::points).reversed());

  /** Natural ordering, best last. */
  public static final Comparator<Fitness> ORDER =
      (a, b) -> {
        boolean aWins = a.outcome().isWin();
        boolean bWins = b.outcome().isWin();
        if (aWins != bWins) {
          return aWins ? 1 : -1;
        }
        return aWins ? WINS.compare(a, b) : NON_WINS.compare(a, b);
      };

  public static Fitness create(
      BattleOutcome outcome, int points, double teamHealth, double enemyHealth) {
    return new AutoValue_Fitness(outcome, points, teamHealth, enemyHealth);
  }

  public abstract BattleOutcome outcome();

  /** Points spent on the evaluated army. */
  public abstract int points();

  /** Health the searching side had left when the battle ended. */
  public abstract double teamHealth();

  /** Health the opposing side had left when the battle ended. */
  public abstract double enemyHealth();

  public boolean isWin() {
    return outcome().isWin();
  }

  public boolean isBetterThan(Fitness other) {
    return compareTo(other) > 0;
  }

  @Override
  public int compareTo(Fitness other) {
    return ORDER.compare(this, other);
  }
}
