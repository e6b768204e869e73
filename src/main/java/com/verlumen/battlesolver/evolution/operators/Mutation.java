package com.verlumen.battlesolver.evolution.operators;

import com.verlumen.battlesolver.army.Army;
import java.util.Random;

/**
 * Derives a new army from an existing one. Implementations are immutable and draw all randomness
 * from the {@link Random} passed in, so a seeded random source replays the same result.
 *
 * <p>Given a non-empty army, a mutation must return a non-empty army.
 */
@FunctionalInterface
public interface Mutation {
  Army apply(Army army, Random random);

  /** Label used in logs and diagnostics. */
  default String name() {
    return getClass().getSimpleName();
  }
}
