package com.verlumen.battlesolver.evolution;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import java.time.Duration;
import java.util.Optional;

/**
 * Drives an {@link EvolutionStrategy} for a number of generations. A run that exceeds its
 * wall-clock timeout stops between generations and returns the best individual found so far;
 * running out of time is not an error.
 */
public final class EvolutionRunner {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Ticker ticker;

  @Inject
  public EvolutionRunner() {
    this(Ticker.systemTicker());
  }

  public EvolutionRunner(Ticker ticker) {
    this.ticker = ticker;
  }

  public EvolutionResult run(Population initial, EvolutionStrategy strategy, RunLimits limits) {
    return run(initial, strategy, limits, GenerationListener.NONE);
  }

  public EvolutionResult run(
      Population initial,
      EvolutionStrategy strategy,
      RunLimits limits,
      GenerationListener listener) {
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    if (isExpired(stopwatch, limits)) {
      logger.atWarning().log("Timed out before evaluating the initial population");
      return EvolutionResult.create(initial, Optional.empty(), 0, true, false);
    }

    Population population = strategy.evaluate(initial);
    listener.onGeneration(0, population);
    Individual best = population.best();
    int sinceImprovement = 0;

    for (int generation = 1; generation <= limits.maxGenerations(); generation++) {
      if (isExpired(stopwatch, limits)) {
        logger.atWarning().log(
            "Timed out after %d generations (%s); best so far %s",
            generation - 1,
            stopwatch,
            best);
        return EvolutionResult.create(population, Optional.of(best), generation - 1, true, false);
      }

      population = strategy.evolve(population);
      listener.onGeneration(generation, population);

      Individual generationBest = population.best();
      if (generationBest.fitness().isBetterThan(best.fitness())) {
        best = generationBest;
        sinceImprovement = 0;
      } else {
        sinceImprovement++;
      }

      if (limits.earlyStoppingGenerations() > 0
          && sinceImprovement >= limits.earlyStoppingGenerations()) {
        logger.atInfo().log(
            "No improvement for %d generations, stopping after generation %d",
            sinceImprovement,
            generation);
        return EvolutionResult.create(population, Optional.of(best), generation, false, true);
      }
    }
    logger.atInfo().log(
        "Finished %d generations in %s; best %s", limits.maxGenerations(), stopwatch, best);
    return EvolutionResult.create(
        population, Optional.of(best), limits.maxGenerations(), false, false);
  }

  private static boolean isExpired(Stopwatch stopwatch, RunLimits limits) {
    Optional<Duration> timeout = limits.timeout();
    return timeout.isPresent() && stopwatch.elapsed().compareTo(timeout.get()) >= 0;
  }
}
