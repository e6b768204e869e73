package com.verlumen.battlesolver.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Random;

/** Samples {@code size} individuals with replacement and keeps the fittest. */
public final class TournamentSelector implements Selector {
  private final int size;

  public TournamentSelector(int size) {
    checkArgument(size > 0, "Tournament size must be positive: %s", size);
    this.size = size;
  }

  @Override
  public Individual select(Population population, Random random) {
    checkArgument(!population.isEmpty(), "Cannot select from an empty population");
    Individual winner = null;
    for (int i = 0; i < size; i++) {
      Individual contender = population.individuals().get(random.nextInt(population.size()));
      if (winner == null || contender.fitness().isBetterThan(winner.fitness())) {
        winner = contender;
      }
    }
    return winner;
  }

  @Override
  public String toString() {
    return "TournamentSelector(" + size + ")";
  }
}
