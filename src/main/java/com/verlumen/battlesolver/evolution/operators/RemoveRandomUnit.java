package com.verlumen.battlesolver.evolution.operators;

import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.Placement;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/** Deletes one random unit. An army of a single unit is returned unchanged. */
public final class RemoveRandomUnit implements Mutation {
  @Override
  public Army apply(Army army, Random random) {
    Placements.checkNonEmpty(army, name());
    if (army.size() == 1) {
      return army;
    }
    List<Placement> placements = new ArrayList<>(army.placements());
    placements.remove(random.nextInt(placements.size()));
    return Army.of(placements);
  }

  @Override
  public String toString() {
    return name();
  }
}
