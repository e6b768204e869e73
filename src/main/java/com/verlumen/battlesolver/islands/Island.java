package com.verlumen.battlesolver.islands;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.verlumen.battlesolver.evolution.EvolutionResult;
import com.verlumen.battlesolver.evolution.EvolutionRunner;
import com.verlumen.battlesolver.evolution.EvolutionStrategy;
import com.verlumen.battlesolver.evolution.Individual;
import com.verlumen.battlesolver.evolution.Population;
import com.verlumen.battlesolver.evolution.RunLimits;
import java.util.Optional;

/**
 * One independently evolving population and the strategy that owns its mutation rates.
 *
 * <p>An island is only touched by one thread at a time: its own worker during an epoch, then the
 * coordinator at the epoch boundary.
 */
public final class Island {
  private final int id;
  private final EvolutionStrategy strategy;
  private Population population;
  private Individual best;

  public Island(int id, Population population, EvolutionStrategy strategy) {
    this.id = id;
    this.population = checkNotNull(population, "population");
    this.strategy = checkNotNull(strategy, "strategy");
  }

  public int id() {
    return id;
  }

  public EvolutionStrategy strategy() {
    return strategy;
  }

  public Population population() {
    return population;
  }

  /** Best individual this island has produced so far, empty before its first evaluation. */
  public Optional<Individual> best() {
    return Optional.ofNullable(best);
  }

  EvolutionResult runEpoch(EvolutionRunner runner, RunLimits limits) {
    EvolutionResult result = runner.run(population, strategy, limits);
    population = result.population();
    result
        .best()
        .filter(candidate -> best == null || candidate.fitness().isBetterThan(best.fitness()))
        .ifPresent(candidate -> best = candidate);
    return result;
  }

  /** Current best of the population, for migration. Requires an evaluated population. */
  Individual currentBest() {
    return population.best();
  }

  void receive(Individual migrant) {
    population = population.withAdded(ImmutableList.of(migrant));
  }

  @Override
  public String toString() {
    return "Island " + id;
  }
}
