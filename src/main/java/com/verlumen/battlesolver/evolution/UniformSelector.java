package com.verlumen.battlesolver.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Random;

/** Every individual is equally likely to be picked. */
public final class UniformSelector implements Selector {
  @Override
  public Individual select(Population population, Random random) {
    checkArgument(!population.isEmpty(), "Cannot select from an empty population");
    return population.individuals().get(random.nextInt(population.size()));
  }

  @Override
  public String toString() {
    return "UniformSelector";
  }
}
