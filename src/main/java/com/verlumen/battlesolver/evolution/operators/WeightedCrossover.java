package com.verlumen.battlesolver.evolution.operators;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.battlesolver.army.Army;
import java.util.Map;
import java.util.Random;

/** Delegates each call to one of several crossovers, picked by weight. */
public final class WeightedCrossover implements Crossover {
  private final ImmutableList<Crossover> crossovers;
  private final double[] weights;

  public WeightedCrossover(Map<? extends Crossover, Double> weightedCrossovers) {
    ImmutableMap<Crossover, Double> copy = ImmutableMap.copyOf(weightedCrossovers);
    checkArgument(!copy.isEmpty(), "WeightedCrossover needs at least one crossover");
    this.crossovers = copy.keySet().asList();
    this.weights = copy.values().stream().mapToDouble(Double::doubleValue).toArray();
  }

  /** Spatial, type-bucketed and single-point crossover with equal weight. */
  public static WeightedCrossover standard() {
    return new WeightedCrossover(
        ImmutableMap.of(
            new SpatialCrossover(), 1.0,
            new TypeBucketCrossover(), 1.0,
            new SinglePointCrossover(), 1.0));
  }

  @Override
  public ArmyPair apply(Army first, Army second, Random random) {
    return WeightedChoice.choose(crossovers, weights, random).apply(first, second, random);
  }

  @Override
  public String toString() {
    return name() + crossovers;
  }
}
