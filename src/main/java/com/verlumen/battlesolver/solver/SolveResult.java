package com.verlumen.battlesolver.solver;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.battlesolver.evolution.Individual;
import com.verlumen.battlesolver.evolution.PopulationSummary;
import com.verlumen.battlesolver.fitness.Grade;
import java.util.Optional;

/** What a search found. A timed-out search still reports its best individual so far. */
@AutoValue
public abstract class SolveResult {
  static SolveResult create(
      Optional<Individual> best,
      ImmutableList<Individual> bestIndividuals,
      Optional<Grade> grade,
      int generations,
      boolean timedOut,
      Optional<PopulationSummary> summary) {
    return new AutoValue_SolveResult(
        best, bestIndividuals, grade, generations, timedOut, summary);
  }

  public abstract Optional<Individual> best();

  /** Cheapest distinct winning compositions, or the single best when nothing wins. */
  public abstract ImmutableList<Individual> bestIndividuals();

  /** Grade of the best individual, when the request carried grade cutoffs. */
  public abstract Optional<Grade> grade();

  public abstract int generations();

  public abstract boolean timedOut();

  /** Summary of the final population, absent if it was never evaluated. */
  public abstract Optional<PopulationSummary> summary();

  public boolean isWin() {
    return best().map(individual -> individual.fitness().isWin()).orElse(false);
  }
}
