package com.verlumen.battlesolver.balance;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableMap.toImmutableMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.ArmyGenerator;
import com.verlumen.battlesolver.army.Placement;
import com.verlumen.battlesolver.army.UnitType;
import com.verlumen.battlesolver.army.UnitValues;
import java.util.Comparator;
import java.util.Random;

/** Armies of one budget competing against each other, highest rated first. */
public final class EloPopulation {
  static final Comparator<RatedArmy> BY_RATING = Comparator.comparingDouble(RatedArmy::rating);

  private final ImmutableList<RatedArmy> armies;

  private EloPopulation(ImmutableList<RatedArmy> armies) {
    this.armies = armies;
  }

  public static EloPopulation of(Iterable<RatedArmy> armies) {
    ImmutableList<RatedArmy> sorted =
        ImmutableList.sortedCopyOf(BY_RATING.reversed(), armies);
    checkArgument(!sorted.isEmpty(), "An Elo population needs at least one army");
    return new EloPopulation(sorted);
  }

  /** Builds {@code size} freshly rated random armies. */
  public static EloPopulation random(
      int size, int targetCost, int maxDecrease, ArmyGenerator generator, Random random) {
    checkArgument(size > 0, "size must be positive: %s", size);
    ImmutableList.Builder<RatedArmy> armies = ImmutableList.builder();
    for (int i = 0; i < size; i++) {
      armies.add(RatedArmy.create(Army.of(generator.randomArmy(targetCost, maxDecrease, random))));
    }
    return of(armies.build());
  }

  public ImmutableList<RatedArmy> armies() {
    return armies;
  }

  public int size() {
    return armies.size();
  }

  public RatedArmy best() {
    return armies.get(0);
  }

  public RatedArmy worst() {
    return armies.get(armies.size() - 1);
  }

  public double medianRating() {
    int middle = armies.size() / 2;
    if (armies.size() % 2 == 1) {
      return armies.get(middle).rating();
    }
    return (armies.get(middle - 1).rating() + armies.get(middle).rating()) / 2;
  }

  public ImmutableList<RatedArmy> best(int count) {
    return armies.stream().limit(count).collect(toImmutableList());
  }

  /** Units of each type across the population. */
  public ImmutableMultiset<UnitType> unitCounts() {
    return armies.stream()
        .flatMap(rated -> rated.army().placements().stream())
        .map(Placement::unitType)
        .collect(ImmutableMultiset.toImmutableMultiset());
  }

  /**
   * Fraction of all points in the population spent on each unit type, in unit type order. The
   * fractions sum to one.
   */
  public ImmutableMap<UnitType, Double> unitTypeShares(UnitValues unitValues) {
    ImmutableMultiset<UnitType> counts = unitCounts();
    double total = 0;
    for (Multiset.Entry<UnitType> entry : counts.entrySet()) {
      total += (double) entry.getCount() * unitValues.valueOf(entry.getElement());
    }
    double totalPoints = total;
    return counts.elementSet().stream()
        .sorted()
        .collect(
            toImmutableMap(
                type -> type,
                type -> counts.count(type) * unitValues.valueOf(type) / totalPoints));
  }
}
