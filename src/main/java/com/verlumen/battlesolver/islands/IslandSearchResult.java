package com.verlumen.battlesolver.islands;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.battlesolver.evolution.Individual;
import java.util.Optional;

/** Outcome of an island-coordinated search. */
@AutoValue
public abstract class IslandSearchResult {
  static IslandSearchResult create(
      Optional<Individual> globalBest,
      ImmutableMap<Integer, Individual> islandBests,
      ImmutableList<Individual> bestIndividuals,
      int epochsCompleted,
      int generations,
      boolean timedOut) {
    return new AutoValue_IslandSearchResult(
        globalBest, islandBests, bestIndividuals, epochsCompleted, generations, timedOut);
  }

  /** Fittest individual across all islands; empty if nothing was evaluated. */
  public abstract Optional<Individual> globalBest();

  /** Best individual of each island that evaluated anything, keyed by island id. */
  public abstract ImmutableMap<Integer, Individual> islandBests();

  /** Cheapest distinct winners gathered from every island's final population. */
  public abstract ImmutableList<Individual> bestIndividuals();

  public abstract int epochsCompleted();

  /** Generations run per island, summed over completed and partial epochs. */
  public abstract int generations();

  public abstract boolean timedOut();
}
