package com.verlumen.battlesolver.evolution.operators;

import com.google.auto.value.AutoValue;
import com.verlumen.battlesolver.army.Army;

/** The two children of a crossover. */
@AutoValue
public abstract class ArmyPair {
  public static ArmyPair of(Army first, Army second) {
    return new AutoValue_ArmyPair(first, second);
  }

  public abstract Army first();

  public abstract Army second();

  public boolean bothNonEmpty() {
    return !first().isEmpty() && !second().isEmpty();
  }
}
