package com.verlumen.battlesolver.evolution.operators;

import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.ArmyGenerator;
import java.util.Random;

/** Moves one random unit to a fresh random legal position. */
public final class RandomizeUnitPosition implements Mutation {
  private final ArmyGenerator generator;

  public RandomizeUnitPosition(ArmyGenerator generator) {
    this.generator = generator;
  }

  @Override
  public Army apply(Army army, Random random) {
    Placements.checkNonEmpty(army, name());
    int index = random.nextInt(army.size());
    return Placements.replace(
        army, index, army.get(index).withPosition(generator.randomPosition(random)));
  }

  @Override
  public String toString() {
    return name();
  }
}
