package com.verlumen.battlesolver.evolution.operators;

import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.ArmyGenerator;
import com.verlumen.battlesolver.army.Placement;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/** Inserts one random unit at a random legal position. */
public final class AddRandomUnit implements Mutation {
  private final ArmyGenerator generator;

  public AddRandomUnit(ArmyGenerator generator) {
    this.generator = generator;
  }

  @Override
  public Army apply(Army army, Random random) {
    Placements.checkNonEmpty(army, name());
    List<Placement> placements = new ArrayList<>(army.placements());
    placements.add(random.nextInt(placements.size() + 1), generator.randomPlacement(random));
    return Army.of(placements);
  }

  @Override
  public String toString() {
    return name();
  }
}
