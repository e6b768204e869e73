package com.verlumen.battlesolver.evolution.operators;

import com.verlumen.battlesolver.army.Army;
import java.util.Random;

/** Recombines two parent armies into two children. */
@FunctionalInterface
public interface Crossover {
  /**
   * Returns two children built from the placements of both parents. When either parent is empty,
   * both children are the other parent.
   */
  ArmyPair apply(Army first, Army second, Random random);

  default String name() {
    return getClass().getSimpleName();
  }
}
