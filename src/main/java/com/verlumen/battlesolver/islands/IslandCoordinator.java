package com.verlumen.battlesolver.islands;

import static com.google.common.base.Preconditions.checkArgument;
import static io.jenetics.stat.MinMax.toMinMax;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.verlumen.battlesolver.evolution.EvaluationException;
import com.verlumen.battlesolver.evolution.EvolutionResult;
import com.verlumen.battlesolver.evolution.EvolutionRunner;
import com.verlumen.battlesolver.evolution.Individual;
import com.verlumen.battlesolver.evolution.Population;
import com.verlumen.battlesolver.evolution.RunLimits;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs several islands side by side and exchanges best individuals between them at epoch
 * boundaries.
 *
 * <p>Every island runs its epoch as one task on {@code islandExecutor}. Evaluation inside an
 * island goes through that island's own evaluator, so {@code islandExecutor} must not be the
 * executor the evaluators submit to, or island tasks could starve their own evaluations.
 */
public final class IslandCoordinator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ImmutableList<Island> islands;
  private final ExecutorService islandExecutor;
  private final EvolutionRunner runner;
  private final Random random;
  private final Ticker ticker;

  public IslandCoordinator(
      List<Island> islands, ExecutorService islandExecutor, EvolutionRunner runner, Random random) {
    this(islands, islandExecutor, runner, random, Ticker.systemTicker());
  }

  public IslandCoordinator(
      List<Island> islands,
      ExecutorService islandExecutor,
      EvolutionRunner runner,
      Random random,
      Ticker ticker) {
    checkArgument(!islands.isEmpty(), "At least one island is required");
    long enemies = islands.stream().map(island -> island.strategy().enemy()).distinct().count();
    checkArgument(enemies == 1, "All islands must fight the same enemy");
    long ids = islands.stream().map(Island::id).distinct().count();
    checkArgument(ids == islands.size(), "Island ids must be distinct");
    this.islands = ImmutableList.copyOf(islands);
    this.islandExecutor = islandExecutor;
    this.runner = runner;
    this.random = random;
    this.ticker = ticker;
  }

  public ImmutableList<Island> islands() {
    return islands;
  }

  /**
   * Runs {@code epochs} epochs of {@code generationsPerEpoch} generations on every island,
   * migrating after each completed epoch. When {@code timeout} runs out the current epoch ends
   * early on every island and the search returns what it has.
   */
  public IslandSearchResult run(int epochs, int generationsPerEpoch, Optional<Duration> timeout) {
    checkArgument(epochs > 0, "epochs must be positive: %s", epochs);
    checkArgument(
        generationsPerEpoch > 0, "generationsPerEpoch must be positive: %s", generationsPerEpoch);
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    int generations = 0;
    int epochsCompleted = 0;
    boolean timedOut = false;

    for (int epoch = 0; epoch < epochs && !timedOut; epoch++) {
      Optional<Duration> remaining = timeout.map(total -> remaining(total, stopwatch));
      RunLimits limits = RunLimits.create(generationsPerEpoch, remaining, 0);
      ImmutableList<EvolutionResult> results = runEpoch(limits);

      generations += results.stream().mapToInt(EvolutionResult::generations).max().orElse(0);
      timedOut = results.stream().anyMatch(EvolutionResult::timedOut);
      if (timedOut) {
        logger.atWarning().log("Island search timed out during epoch %d", epoch + 1);
        break;
      }
      epochsCompleted++;
      if (islands.size() > 1) {
        migrate();
      }
      logger.atInfo().log(
          "Epoch %d of %d done after %s; best %s",
          epochsCompleted,
          epochs,
          stopwatch,
          globalBest().map(Individual::toString).orElse("none"));
    }

    return IslandSearchResult.create(
        globalBest(), islandBests(), bestIndividuals(), epochsCompleted, generations, timedOut);
  }

  /**
   * For every island picks one other island at random and adds a copy of that island's best
   * individual to the recipient. Bests are read before any island receives a migrant.
   */
  void migrate() {
    ImmutableList<Individual> bests =
        islands.stream().map(Island::currentBest).collect(ImmutableList.toImmutableList());
    for (int recipient = 0; recipient < islands.size(); recipient++) {
      int source = random.nextInt(islands.size() - 1);
      if (source >= recipient) {
        source++;
      }
      Individual migrant = bests.get(source).copy();
      islands.get(recipient).receive(migrant);
      logger.atFine().log(
          "Migrated %s from %s to %s", migrant, islands.get(source), islands.get(recipient));
    }
  }

  private ImmutableList<EvolutionResult> runEpoch(RunLimits limits) {
    List<Callable<EvolutionResult>> tasks = new ArrayList<>();
    for (Island island : islands) {
      tasks.add(() -> island.runEpoch(runner, limits));
    }
    List<Future<EvolutionResult>> futures;
    try {
      futures = islandExecutor.invokeAll(tasks);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EvaluationException("Interrupted while running islands", e);
    }
    ImmutableList.Builder<EvolutionResult> results = ImmutableList.builder();
    for (Future<EvolutionResult> future : futures) {
      try {
        results.add(future.get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new EvaluationException("Interrupted while running islands", e);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
          throw (RuntimeException) cause;
        }
        throw new EvaluationException("Island failed", cause);
      }
    }
    return results.build();
  }

  private Optional<Individual> globalBest() {
    Individual max =
        islands.stream()
            .map(Island::best)
            .flatMap(Optional::stream)
            .collect(toMinMax(Population.BY_FITNESS))
            .max();
    return Optional.ofNullable(max);
  }

  private ImmutableMap<Integer, Individual> islandBests() {
    ImmutableMap.Builder<Integer, Individual> bests = ImmutableMap.builder();
    for (Island island : islands) {
      island.best().ifPresent(best -> bests.put(island.id(), best));
    }
    return bests.buildOrThrow();
  }

  private ImmutableList<Individual> bestIndividuals() {
    Set<Individual> merged = new LinkedHashSet<>();
    for (Island island : islands) {
      if (island.population().isEvaluated()) {
        merged.addAll(island.population().individuals());
      }
    }
    if (merged.isEmpty()) {
      return globalBest().map(ImmutableList::of).orElse(ImmutableList.of());
    }
    return Population.of(merged).bestIndividuals();
  }

  private static Duration remaining(Duration total, Stopwatch stopwatch) {
    Duration left = total.minus(stopwatch.elapsed());
    return left.isNegative() ? Duration.ZERO : left;
  }
}
