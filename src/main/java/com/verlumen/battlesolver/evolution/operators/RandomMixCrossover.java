package com.verlumen.battlesolver.evolution.operators;

import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.Placement;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/** Sends every placement of either parent to one of the two children with equal probability. */
public final class RandomMixCrossover extends RetryingCrossover {
  @Override
  ArmyPair recombine(Army first, Army second, Random random) {
    List<Placement> firstChild = new ArrayList<>();
    List<Placement> secondChild = new ArrayList<>();
    for (Army parent : new Army[] {first, second}) {
      for (Placement placement : parent.placements()) {
        (random.nextBoolean() ? firstChild : secondChild).add(placement);
      }
    }
    return ArmyPair.of(Army.of(firstChild), Army.of(secondChild));
  }
}
