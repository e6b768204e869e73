package com.verlumen.battlesolver.evolution;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Optional;

/** Where a run of generations ended up. */
@AutoValue
public abstract class EvolutionResult {
  static EvolutionResult create(
      Population population,
      Optional<Individual> best,
      int generations,
      boolean timedOut,
      boolean stoppedEarly) {
    return new AutoValue_EvolutionResult(population, best, generations, timedOut, stoppedEarly);
  }

  /** The last generation reached. Unevaluated only if the run timed out before evaluating it. */
  public abstract Population population();

  /** Fittest individual seen during the run; empty if nothing was evaluated. */
  public abstract Optional<Individual> best();

  /** Completed generations, not counting the initial population. */
  public abstract int generations();

  public abstract boolean timedOut();

  public abstract boolean stoppedEarly();

  /** Cheapest distinct winning compositions of the last generation. */
  public ImmutableList<Individual> bestIndividuals() {
    return population().isEvaluated() && !population().isEmpty()
        ? population().bestIndividuals()
        : best().map(ImmutableList::of).orElse(ImmutableList.of());
  }
}
