package com.verlumen.battlesolver.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multiset;
import com.verlumen.battlesolver.evolution.operators.Mutation;
import com.verlumen.battlesolver.evolution.operators.WeightedChoice;
import java.util.Arrays;
import java.util.Random;

/**
 * Selection weights of the registered mutations. Starts uniform and is adapted after each
 * generation from how often each mutation produced a child fitter than its parent.
 *
 * <p>Mutations are keyed by identity, so two instances of one operator class with different
 * settings are tracked separately. Not thread-safe; owned by a single {@link EvolutionStrategy}.
 */
public final class MutationRates {
  private final ImmutableList<Mutation> mutations;
  private final double[] weights;

  MutationRates(ImmutableList<Mutation> mutations) {
    checkArgument(!mutations.isEmpty(), "At least one mutation is required");
    this.mutations = mutations;
    this.weights = new double[mutations.size()];
    Arrays.fill(weights, 1.0 / mutations.size());
  }

  ImmutableList<Mutation> mutations() {
    return mutations;
  }

  Mutation choose(Random random) {
    return WeightedChoice.choose(mutations, weights, random);
  }

  ImmutableList<Mutation> choose(int count, Random random) {
    ImmutableList.Builder<Mutation> chosen = ImmutableList.builder();
    for (int i = 0; i < count; i++) {
      chosen.add(choose(random));
    }
    return chosen.build();
  }

  /**
   * Scales each weight by {@code 1 + adaptationRate * (successes - failures) / (trials + 1)}.
   * Mutations with no trials keep their weight.
   */
  void adapt(Multiset<Mutation> successes, Multiset<Mutation> trials, double adaptationRate) {
    for (int i = 0; i < mutations.size(); i++) {
      Mutation mutation = mutations.get(i);
      int tried = trials.count(mutation);
      int succeeded = successes.count(mutation);
      int failed = tried - succeeded;
      weights[i] *= 1 + adaptationRate * (succeeded - failed) / (tried + 1.0);
    }
  }

  public double weightOf(Mutation mutation) {
    for (int i = 0; i < mutations.size(); i++) {
      if (mutations.get(i) == mutation) {
        return weights[i];
      }
    }
    throw new IllegalArgumentException("Unregistered mutation " + mutation);
  }

  /** Current weights in registration order. */
  public ImmutableMap<String, Double> snapshot() {
    ImmutableMap.Builder<String, Double> snapshot = ImmutableMap.builder();
    for (int i = 0; i < mutations.size(); i++) {
      snapshot.put(i + ":" + mutations.get(i), weights[i]);
    }
    return snapshot.buildOrThrow();
  }

  @Override
  public String toString() {
    return "MutationRates" + snapshot();
  }
}
