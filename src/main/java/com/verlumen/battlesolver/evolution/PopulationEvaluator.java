package com.verlumen.battlesolver.evolution;

import com.verlumen.battlesolver.army.Army;
import java.util.Collection;

/** Sets the fitness of a batch of individuals against one enemy army. */
public interface PopulationEvaluator {
  /**
   * Evaluates every individual that has no fitness yet, spreading the work over at most {@code
   * workerCount} workers, and returns once all of them carry a fitness.
   *
   * @throws EvaluationException if the simulator fails for any individual
   * @throws IllegalStateException if an individual was evaluated against a different enemy
   */
  void evaluate(Collection<Individual> individuals, Army enemy, int workerCount);
}
