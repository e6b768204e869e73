package com.verlumen.battlesolver.evolution.operators;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.Placement;
import java.util.ArrayList;
import java.util.List;

/** List helpers shared by the operators. */
final class Placements {
  static void checkNonEmpty(Army army, String operator) {
    checkArgument(!army.isEmpty(), "%s cannot be applied to an empty army", operator);
  }

  static Army replace(Army army, int index, Placement replacement) {
    List<Placement> placements = new ArrayList<>(army.placements());
    placements.set(index, replacement);
    return Army.of(placements);
  }

  private Placements() {}
}
