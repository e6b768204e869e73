package com.verlumen.battlesolver.solver;

/** Defaults for search settings that callers leave unset. */
final class SearchConstants {
  static final int DEFAULT_PARENTS_PER_GENERATION = 10;
  static final int DEFAULT_CHILDREN_PER_GENERATION = 10;
  static final double DEFAULT_ADAPTATION_RATE = 0.1;
  static final int DEFAULT_MUTATIONS_PER_CHILD = 1;
  static final double DEFAULT_CROSSOVER_RATE = 0.0;
  static final int DEFAULT_GENERATIONS = 100;
  static final int DEFAULT_EARLY_STOPPING_GENERATIONS = 0;
  static final int DEFAULT_BATTLE_TIMEOUT_SECONDS = 120;
  static final int DEFAULT_OPTIMIZATION_TIMEOUT_SECONDS = 600;
  static final int DEFAULT_ISLANDS = 4;
  static final int DEFAULT_EPOCHS = 3;
  static final int DEFAULT_GENERATIONS_PER_EPOCH = 15;
  static final int DEFAULT_MAX_DECREASE = 100;

  static final double SMALL_POSITION_NOISE = 10;
  static final double LARGE_POSITION_NOISE = 100;
  static final double ALLY_POSITION_NOISE = 20;

  private SearchConstants() {}
}
