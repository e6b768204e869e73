package com.verlumen.battlesolver.evolution;

import java.util.Random;

/** Picks a parent from the current generation. */
@FunctionalInterface
public interface Selector {
  Individual select(Population population, Random random);
}
