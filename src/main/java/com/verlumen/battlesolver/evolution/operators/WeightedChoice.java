package com.verlumen.battlesolver.evolution.operators;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import java.util.Random;

/** Roulette-wheel selection over parallel lists of options and non-negative weights. */
public final class WeightedChoice {
  /**
   * Picks one option with probability proportional to its weight. If every weight is zero the
   * choice is uniform.
   */
  public static <T> T choose(List<T> options, double[] weights, Random random) {
    checkArgument(!options.isEmpty(), "No options to choose from");
    checkArgument(
        options.size() == weights.length,
        "%s options but %s weights",
        options.size(),
        weights.length);
    double total = 0;
    for (double weight : weights) {
      checkArgument(weight >= 0 && !Double.isNaN(weight), "Invalid weight %s", weight);
      total += weight;
    }
    if (total == 0) {
      return options.get(random.nextInt(options.size()));
    }
    double target = random.nextDouble() * total;
    for (int i = 0; i < weights.length; i++) {
      target -= weights[i];
      if (target < 0) {
        return options.get(i);
      }
    }
    // Rounding can leave target at a tiny positive value; fall back to the last weighted option.
    for (int i = weights.length - 1; i >= 0; i--) {
      if (weights[i] > 0) {
        return options.get(i);
      }
    }
    throw new AssertionError("unreachable");
  }

  private WeightedChoice() {}
}
