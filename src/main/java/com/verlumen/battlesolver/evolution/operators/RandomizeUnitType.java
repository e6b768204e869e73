package com.verlumen.battlesolver.evolution.operators;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.ArmyGenerator;
import com.verlumen.battlesolver.army.Placement;
import com.verlumen.battlesolver.army.UnitType;
import com.verlumen.battlesolver.army.UnitValues;
import java.util.Random;

/**
 * Swaps the type of one random unit for a different type that costs no more than the original
 * and at most {@code maxDecrease} points less. Returns the army unchanged when no such type
 * exists.
 */
public final class RandomizeUnitType implements Mutation {
  private final ArmyGenerator generator;
  private final int maxDecrease;

  public RandomizeUnitType(ArmyGenerator generator, int maxDecrease) {
    checkArgument(maxDecrease >= 0, "maxDecrease must be non-negative: %s", maxDecrease);
    this.generator = generator;
    this.maxDecrease = maxDecrease;
  }

  @Override
  public Army apply(Army army, Random random) {
    Placements.checkNonEmpty(army, name());
    int index = random.nextInt(army.size());
    Placement placement = army.get(index);
    UnitValues unitValues = generator.unitValues();
    int currentValue = unitValues.valueOf(placement.unitType());
    ImmutableList<UnitType> options =
        generator.allowedUnitTypes().stream()
            .filter(unitType -> unitType != placement.unitType())
            .filter(unitType -> unitValues.valueOf(unitType) <= currentValue)
            .filter(unitType -> unitValues.valueOf(unitType) >= currentValue - maxDecrease)
            .collect(toImmutableList());
    if (options.isEmpty()) {
      return army;
    }
    UnitType replacement = options.get(random.nextInt(options.size()));
    return Placements.replace(army, index, placement.withUnitType(replacement));
  }

  @Override
  public String toString() {
    return name() + "(maxDecrease=" + maxDecrease + ")";
  }
}
