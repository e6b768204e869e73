package com.verlumen.battlesolver.evolution;

/** Observes each evaluated generation of a run. Called on the thread running the search. */
@FunctionalInterface
public interface GenerationListener {
  GenerationListener NONE = (generation, population) -> {};

  /**
   * @param generation zero for the initial population, then one per completed step
   * @param population the evaluated generation
   */
  void onGeneration(int generation, Population population);
}
