package com.verlumen.battlesolver.evolution;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.ArmyGenerator;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

/** The individuals of one generation. Rebuilt every generation rather than grown in place. */
public final class Population {
  /** Orders evaluated individuals by fitness, best last. */
  public static final Comparator<Individual> BY_FITNESS =
      Comparator.comparing(Individual::fitness);

  private final ImmutableList<Individual> individuals;

  private Population(ImmutableList<Individual> individuals) {
    this.individuals = individuals;
  }

  public static Population of(Iterable<Individual> individuals) {
    return new Population(ImmutableList.copyOf(individuals));
  }

  public static Population of(Individual... individuals) {
    return of(Arrays.asList(individuals));
  }

  /**
   * Builds {@code size} unevaluated individuals, each a random army costing between {@code
   * targetCost - maxDecrease} and {@code targetCost} points.
   */
  public static Population random(
      int size, int targetCost, int maxDecrease, ArmyGenerator generator, Random random) {
    checkArgument(size > 0, "size must be positive: %s", size);
    checkArgument(
        targetCost > maxDecrease,
        "targetCost %s must exceed maxDecrease %s so that armies are never empty",
        targetCost,
        maxDecrease);
    ImmutableList.Builder<Individual> individuals = ImmutableList.builder();
    for (int i = 0; i < size; i++) {
      Army army = Army.of(generator.randomArmy(targetCost, maxDecrease, random));
      individuals.add(Individual.create(army, generator.unitValues()));
    }
    return new Population(individuals.build());
  }

  public ImmutableList<Individual> individuals() {
    return individuals;
  }

  public int size() {
    return individuals.size();
  }

  public boolean isEmpty() {
    return individuals.isEmpty();
  }

  public boolean isEvaluated() {
    return individuals.stream().allMatch(Individual::isEvaluated);
  }

  /**
   * Evaluates every individual that has no fitness yet. Individuals already carrying a fitness are
   * left alone, so calling this twice is harmless.
   */
  public Population evaluate(Army enemy, PopulationEvaluator evaluator, int workerCount) {
    evaluator.evaluate(individuals, enemy, workerCount);
    return this;
  }

  /** Returns a new population holding these individuals plus {@code others} not already here. */
  public Population withAdded(Iterable<Individual> others) {
    Set<Individual> seen = new HashSet<>(individuals);
    ImmutableList.Builder<Individual> combined =
        ImmutableList.<Individual>builder().addAll(individuals);
    for (Individual other : others) {
      if (seen.add(other)) {
        combined.add(other);
      }
    }
    return new Population(combined.build());
  }

  /** Individuals from best to worst. Requires an evaluated population. */
  public ImmutableList<Individual> sortedByFitness() {
    checkEvaluated();
    return individuals.stream().sorted(BY_FITNESS.reversed()).collect(toImmutableList());
  }

  /** The individual with the greatest fitness. */
  public Individual best() {
    checkState(!individuals.isEmpty(), "Empty population has no best individual");
    checkEvaluated();
    return individuals.stream().max(BY_FITNESS).get();
  }

  /**
   * Returns the cheapest winning individuals, one per composition, most remaining health first.
   * Individuals whose unit counts match one already returned are skipped even when their
   * positions differ. When nothing wins, returns the single best individual.
   */
  public ImmutableList<Individual> bestIndividuals() {
    Individual best = best();
    if (!best.fitness().isWin()) {
      return ImmutableList.of(best);
    }
    int bestPoints = best.fitness().points();
    Set<String> descriptions = new HashSet<>();
    return individuals.stream()
        .filter(individual -> individual.fitness().isWin())
        .filter(individual -> individual.fitness().points() == bestPoints)
        .sorted(
            Comparator.comparingDouble((Individual individual) -> individual.fitness().teamHealth())
                .reversed())
        .filter(individual -> descriptions.add(individual.shortDescription()))
        .collect(toImmutableList());
  }

  public PopulationSummary summary() {
    checkEvaluated();
    return PopulationSummary.of(this);
  }

  private void checkEvaluated() {
    for (Individual individual : individuals) {
      checkState(
          individual.isEvaluated(), "Population contains unevaluated %s", individual.army());
    }
  }

  @Override
  public String toString() {
    return "Population" + individuals;
  }
}
