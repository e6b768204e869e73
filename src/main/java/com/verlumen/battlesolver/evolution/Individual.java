package com.verlumen.battlesolver.evolution;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSortedMultiset;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.UnitType;
import com.verlumen.battlesolver.army.UnitValues;
import com.verlumen.battlesolver.fitness.Fitness;
import com.verlumen.battlesolver.simulation.BattleResult;
import com.verlumen.battlesolver.simulation.BattleSimulator;
import com.verlumen.battlesolver.simulation.SimulationContext;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An army together with its fitness against one enemy army. The fitness is written once, by the
 * first evaluation, and every later read returns that same value. Equality is by army only.
 */
public final class Individual {
  private final Army army;
  private final int points;
  private final AtomicReference<Evaluation> evaluation;

  private Individual(Army army, int points, Evaluation evaluation) {
    this.army = army;
    this.points = points;
    this.evaluation = new AtomicReference<>(evaluation);
  }

  /** Creates an unevaluated individual. */
  public static Individual create(Army army, UnitValues unitValues) {
    checkNotNull(army, "army");
    return new Individual(army, army.points(unitValues), null);
  }

  /**
   * Returns an independent copy holding the same army and, if present, the same evaluation. Both
   * are immutable values, so nothing done to the copy can reach this individual.
   */
  public Individual copy() {
    return new Individual(army, points, evaluation.get());
  }

  public Army army() {
    return army;
  }

  public int points() {
    return points;
  }

  public ImmutableSortedMultiset<UnitType> category() {
    return army.category();
  }

  public String shortDescription() {
    return army.shortDescription();
  }

  public boolean isEvaluated() {
    return evaluation.get() != null;
  }

  /** The fitness, or empty while this individual has not been evaluated. */
  public Optional<Fitness> evaluatedFitness() {
    return Optional.ofNullable(evaluation.get()).map(Evaluation::fitness);
  }

  /**
   * Returns the fitness.
   *
   * @throws IllegalStateException if this individual has not been evaluated yet
   */
  public Fitness fitness() {
    Evaluation current = evaluation.get();
    checkState(current != null, "Fitness read before evaluation of %s", army);
    return current.fitness();
  }

  /**
   * Simulates this army against {@code enemy} on first call and memoizes the result.
   *
   * @throws IllegalStateException if this individual was already evaluated against another enemy
   */
  public Fitness evaluate(
      Army enemy, BattleSimulator simulator, SimulationContext context, Duration timeout) {
    Evaluation current = evaluation.get();
    if (current != null) {
      checkEnemy(current, enemy);
      return current.fitness();
    }
    BattleResult result = simulator.simulate(context, army, enemy, timeout);
    checkState(result != null, "Simulator returned no result for %s", army);
    Fitness fitness =
        Fitness.create(
            result.outcome(),
            points,
            result.allyRemainingHealth(),
            result.enemyRemainingHealth());
    if (evaluation.compareAndSet(null, Evaluation.create(enemy, fitness))) {
      return fitness;
    }
    Evaluation winner = evaluation.get();
    checkEnemy(winner, enemy);
    return winner.fitness();
  }

  /**
   * Fails if this individual carries a fitness computed against a different enemy.
   *
   * @throws IllegalStateException on an enemy mismatch
   */
  void checkEvaluatedAgainst(Army enemy) {
    Evaluation current = evaluation.get();
    if (current != null) {
      checkEnemy(current, enemy);
    }
  }

  /**
   * Takes over the evaluation of {@code evaluated}, another individual holding the same army.
   *
   * @throws IllegalStateException if the armies differ, {@code evaluated} has no fitness yet, or
   *     this individual already holds a fitness against another enemy
   */
  void adoptEvaluation(Individual evaluated) {
    checkState(
        army.equals(evaluated.army), "Cannot adopt the fitness of %s for %s", evaluated.army, army);
    Evaluation source = evaluated.evaluation.get();
    checkState(source != null, "%s has no fitness to adopt", evaluated.army);
    if (!evaluation.compareAndSet(null, source)) {
      checkEnemy(evaluation.get(), source.enemy());
    }
  }

  private void checkEnemy(Evaluation current, Army enemy) {
    checkState(
        current.enemy().equals(enemy),
        "%s was evaluated against %s and cannot be re-evaluated against %s",
        army,
        current.enemy(),
        enemy);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Individual)) {
      return false;
    }
    return army.equals(((Individual) o).army);
  }

  @Override
  public int hashCode() {
    return army.hashCode();
  }

  @Override
  public String toString() {
    Evaluation current = evaluation.get();
    return shortDescription()
        + " ("
        + points
        + " points, "
        + (current == null ? "unevaluated" : current.fitness())
        + ")";
  }

  @AutoValue
  abstract static class Evaluation {
    static Evaluation create(Army enemy, Fitness fitness) {
      return new AutoValue_Individual_Evaluation(enemy, fitness);
    }

    abstract Army enemy();

    abstract Fitness fitness();
  }
}
