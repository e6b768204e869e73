package com.verlumen.battlesolver.evolution;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.Multimaps;
import com.google.common.flogger.FluentLogger;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.simulation.BattleResult;
import com.verlumen.battlesolver.simulation.BattleSimulator;
import com.verlumen.battlesolver.simulation.SimulationContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Splits unevaluated individuals into one batch per worker and runs the batches on an executor.
 * Every batch opens its own {@link SimulationContext}, so workers never share simulation state.
 * Individuals holding equal armies are simulated once and share the resulting fitness.
 */
public final class ParallelPopulationEvaluator implements PopulationEvaluator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final BattleSimulator simulator;
  private final ExecutorService executor;
  private final Duration battleTimeout;

  public ParallelPopulationEvaluator(
      BattleSimulator simulator, ExecutorService executor, Duration battleTimeout) {
    this.simulator = simulator;
    this.executor = executor;
    this.battleTimeout = battleTimeout;
  }

  @Override
  public void evaluate(Collection<Individual> individuals, Army enemy, int workerCount) {
    checkArgument(workerCount > 0, "workerCount must be positive: %s", workerCount);
    individuals.forEach(individual -> individual.checkEvaluatedAgainst(enemy));
    ListMultimap<Army, Individual> pendingByArmy =
        MultimapBuilder.linkedHashKeys().arrayListValues().build();
    for (Individual individual : individuals) {
      if (!individual.isEvaluated()) {
        pendingByArmy.put(individual.army(), individual);
      }
    }
    if (pendingByArmy.isEmpty()) {
      return;
    }

    ImmutableList<Individual> pending =
        Multimaps.asMap(pendingByArmy).values().stream()
            .map(group -> group.get(0))
            .collect(toImmutableList());
    simulate(pending, enemy, workerCount);
    for (List<Individual> group : Multimaps.asMap(pendingByArmy).values()) {
      Individual simulated = group.get(0);
      for (Individual individual : group.subList(1, group.size())) {
        if (individual != simulated) {
          individual.adoptEvaluation(simulated);
        }
      }
    }
  }

  private void simulate(ImmutableList<Individual> pending, Army enemy, int workerCount) {
    if (pending.size() == 1 || workerCount == 1) {
      evaluateBatch(pending, enemy);
      return;
    }

    int batchSize = (pending.size() + workerCount - 1) / workerCount;
    List<Callable<Void>> batches = new ArrayList<>();
    for (List<Individual> batch : Lists.partition(pending, batchSize)) {
      batches.add(
          () -> {
            evaluateBatch(batch, enemy);
            return null;
          });
    }
    logger.atFine().log(
        "Evaluating %d individuals in %d batches", pending.size(), batches.size());
    await(batches);
  }

  private void evaluateBatch(List<Individual> batch, Army enemy) {
    try (SimulationContext context = simulator.newContext()) {
      for (Individual individual : batch) {
        individual.evaluate(enemy, this::simulateGuarded, context, battleTimeout);
      }
    }
  }

  /** Runs one battle, wrapping any failure of the simulator with the army that caused it. */
  private BattleResult simulateGuarded(
      SimulationContext context, Army ally, Army enemy, Duration timeout) {
    try {
      return simulator.simulate(context, ally, enemy, timeout);
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("Simulation failed for %s", ally);
      throw new EvaluationException(ally, e);
    }
  }

  private void await(List<Callable<Void>> batches) {
    List<Future<Void>> futures;
    try {
      futures = executor.invokeAll(batches);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EvaluationException("Interrupted while waiting for evaluations", e);
    }
    for (Future<Void> future : futures) {
      try {
        future.get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new EvaluationException("Interrupted while waiting for evaluations", e);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
          throw (RuntimeException) cause;
        }
        throw new EvaluationException("Evaluation worker failed", cause);
      }
    }
  }
}
