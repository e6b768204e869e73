package com.verlumen.battlesolver.army;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Source of random legal units, positions and whole armies. Holds no mutable state; every call
 * draws from the {@link Random} it is handed.
 */
public final class ArmyGenerator {
  private static final int MAX_RANDOM_ARMY_STEPS = 10_000;
  private static final int MAX_EXACT_ATTEMPTS = 20;

  private final ImmutableList<UnitType> allowedUnitTypes;
  private final UnitValues unitValues;
  private final PlacementArea placementArea;

  public ArmyGenerator(
      Iterable<UnitType> allowedUnitTypes, UnitValues unitValues, PlacementArea placementArea) {
    this.allowedUnitTypes = ImmutableList.copyOf(allowedUnitTypes);
    checkArgument(!this.allowedUnitTypes.isEmpty(), "At least one unit type must be allowed");
    this.allowedUnitTypes.forEach(unitValues::valueOf);
    this.unitValues = unitValues;
    this.placementArea = placementArea;
  }

  /** A generator over every unit type the cost table knows. */
  public static ArmyGenerator create(UnitValues unitValues, PlacementArea placementArea) {
    return new ArmyGenerator(unitValues.unitTypes(), unitValues, placementArea);
  }

  public ImmutableList<UnitType> allowedUnitTypes() {
    return allowedUnitTypes;
  }

  public UnitValues unitValues() {
    return unitValues;
  }

  public PlacementArea placementArea() {
    return placementArea;
  }

  public UnitType randomUnitType(Random random) {
    return allowedUnitTypes.get(random.nextInt(allowedUnitTypes.size()));
  }

  public Position randomPosition(Random random) {
    return placementArea.randomPosition(random);
  }

  public Placement randomPlacement(Random random) {
    return Placement.create(randomUnitType(random), randomPosition(random));
  }

  /**
   * Builds a random army costing between {@code targetCost - maxDecrease} and {@code targetCost}
   * points by adding random units while under budget and dropping random units while over it.
   *
   * @throws IllegalArgumentException if the cost window cannot be reached
   */
  public ImmutableList<Placement> randomArmy(int targetCost, int maxDecrease, Random random) {
    checkArgument(maxDecrease >= 0, "maxDecrease must be non-negative: %s", maxDecrease);
    List<Placement> placements = new ArrayList<>();
    int cost = 0;
    for (int step = 0; step < MAX_RANDOM_ARMY_STEPS; step++) {
      if (targetCost - maxDecrease <= cost && cost <= targetCost) {
        return ImmutableList.copyOf(placements);
      }
      if (cost > targetCost) {
        Placement removed = placements.remove(random.nextInt(placements.size()));
        cost -= unitValues.valueOf(removed.unitType());
      } else {
        Placement added = randomPlacement(random);
        placements.add(added);
        cost += unitValues.valueOf(added.unitType());
      }
    }
    throw new IllegalArgumentException(
        String.format(
            "Could not build an army costing between %d and %d points from %s",
            targetCost - maxDecrease, targetCost, allowedUnitTypes));
  }

  /**
   * Tries to build a random army costing exactly {@code targetCost} points. Returns empty when a
   * bounded number of random fills all miss the target.
   */
  public Optional<ImmutableList<Placement>> exactArmy(int targetCost, Random random) {
    checkArgument(targetCost >= 0, "targetCost must be non-negative: %s", targetCost);
    for (int attempt = 0; attempt < MAX_EXACT_ATTEMPTS; attempt++) {
      Optional<ImmutableList<Placement>> filled = fillExactly(targetCost, random);
      if (filled.isPresent()) {
        return filled;
      }
    }
    return Optional.empty();
  }

  private Optional<ImmutableList<Placement>> fillExactly(int targetCost, Random random) {
    ImmutableList.Builder<Placement> placements = ImmutableList.builder();
    int remaining = targetCost;
    while (remaining > 0) {
      int budget = remaining;
      ImmutableList<UnitType> affordable =
          allowedUnitTypes.stream()
              .filter(unitType -> unitValues.valueOf(unitType) > 0)
              .filter(unitType -> unitValues.valueOf(unitType) <= budget)
              .collect(toImmutableList());
      if (affordable.isEmpty()) {
        return Optional.empty();
      }
      UnitType unitType = affordable.get(random.nextInt(affordable.size()));
      placements.add(Placement.create(unitType, randomPosition(random)));
      remaining -= unitValues.valueOf(unitType);
    }
    return Optional.of(placements.build());
  }
}
