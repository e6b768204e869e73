package com.verlumen.battlesolver.evolution.operators;

import com.verlumen.battlesolver.army.Army;
import java.util.Random;

/**
 * Base for crossovers that may produce an empty child. Recombination is retried a bounded number
 * of times; if a child is still empty after that, it receives one random unit of a parent.
 */
abstract class RetryingCrossover implements Crossover {
  static final int MAX_ATTEMPTS = 10;

  @Override
  public final ArmyPair apply(Army first, Army second, Random random) {
    if (first.isEmpty() || second.isEmpty()) {
      Army source = first.isEmpty() ? second : first;
      return ArmyPair.of(source, source);
    }
    ArmyPair children = recombine(first, second, random);
    for (int attempt = 1; attempt < MAX_ATTEMPTS && !children.bothNonEmpty(); attempt++) {
      children = recombine(first, second, random);
    }
    if (children.bothNonEmpty()) {
      return children;
    }
    return ArmyPair.of(
        fillIfEmpty(children.first(), first, random),
        fillIfEmpty(children.second(), second, random));
  }

  /** One recombination attempt. Both parents are non-empty. */
  abstract ArmyPair recombine(Army first, Army second, Random random);

  private static Army fillIfEmpty(Army child, Army parent, Random random) {
    if (!child.isEmpty()) {
      return child;
    }
    return Army.of(parent.get(random.nextInt(parent.size())));
  }

  @Override
  public String toString() {
    return name();
  }
}
