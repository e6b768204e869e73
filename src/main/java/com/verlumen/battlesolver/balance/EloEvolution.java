package com.verlumen.battlesolver.balance;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.flogger.FluentLogger;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.evolution.EvaluationException;
import com.verlumen.battlesolver.evolution.operators.Mutation;
import com.verlumen.battlesolver.fitness.BattleOutcome;
import com.verlumen.battlesolver.simulation.BattleResult;
import com.verlumen.battlesolver.simulation.BattleSimulator;
import com.verlumen.battlesolver.simulation.SimulationContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Evolves armies of equal budget against each other rather than against one fixed enemy. The
 * surviving population shows which units the current balance favors.
 *
 * <p>Each generation mutates tournament-selected parents into unrated children, plays random
 * child-versus-survivor matches, updates both Elo ratings after every match and keeps the
 * highest rated armies.
 */
public final class EloEvolution {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final EloParameters parameters;
  private final ImmutableList<Mutation> mutations;
  private final BattleSimulator simulator;
  private final ExecutorService executor;
  private final Duration battleTimeout;
  private final Random random;

  public EloEvolution(
      EloParameters parameters,
      List<? extends Mutation> mutations,
      BattleSimulator simulator,
      ExecutorService executor,
      Duration battleTimeout,
      Random random) {
    checkArgument(!mutations.isEmpty(), "At least one mutation is required");
    this.parameters = parameters;
    this.mutations = ImmutableList.copyOf(mutations);
    this.simulator = simulator;
    this.executor = executor;
    this.battleTimeout = battleTimeout;
    this.random = random;
  }

  /** Expected score of a player rated {@code rating} against one rated {@code opponentRating}. */
  static double expectedScore(double rating, double opponentRating) {
    return 1 / (1 + Math.pow(10, (opponentRating - rating) / 400));
  }

  static double score(BattleOutcome outcome) {
    switch (outcome) {
      case WIN:
        return 1.0;
      case LOSS:
        return 0.0;
      case TIMEOUT:
        return 0.5;
    }
    throw new AssertionError(outcome);
  }

  public EloPopulation evolve(EloPopulation population) {
    List<RatedArmy> children = new ArrayList<>();
    for (int i = 0; i < parameters.childrenPerGeneration(); i++) {
      RatedArmy parent = selectParent(population);
      Mutation mutation = mutations.get(random.nextInt(mutations.size()));
      Army child = mutation.apply(parent.army(), random);
      if (child.isEmpty()) {
        throw new IllegalStateException(
            mutation.name() + " produced an empty army from " + parent.army());
      }
      children.add(RatedArmy.create(child));
    }

    List<Match> matches = new ArrayList<>();
    for (int i = 0; i < parameters.matchesPerGeneration(); i++) {
      matches.add(
          new Match(
              children.get(random.nextInt(children.size())),
              population.armies().get(random.nextInt(population.size()))));
    }
    List<BattleOutcome> outcomes = play(matches);
    for (int i = 0; i < matches.size(); i++) {
      updateRatings(matches.get(i).challenger(), matches.get(i).defender(), outcomes.get(i));
    }

    List<RatedArmy> all = new ArrayList<>(population.armies());
    all.addAll(children);
    all.sort(EloPopulation.BY_RATING.reversed());
    EloPopulation next =
        EloPopulation.of(all.subList(0, Math.min(all.size(), parameters.parentsPerGeneration())));
    logger.atFine().log(
        "Played %d matches; ratings best %.1f, median %.1f, worst %.1f",
        matches.size(),
        next.best().rating(),
        next.medianRating(),
        next.worst().rating());
    return next;
  }

  void updateRatings(RatedArmy challenger, RatedArmy defender, BattleOutcome outcome) {
    double expected = expectedScore(challenger.rating(), defender.rating());
    double actual = score(outcome);
    double change = parameters.kFactor() * (actual - expected);
    challenger.record(actual, change);
    defender.record(1 - actual, -change);
  }

  private RatedArmy selectParent(EloPopulation population) {
    RatedArmy best = null;
    for (int i = 0; i < parameters.tournamentSize(); i++) {
      RatedArmy competitor = population.armies().get(random.nextInt(population.size()));
      if (best == null || competitor.rating() > best.rating()) {
        best = competitor;
      }
    }
    return best;
  }

  private List<BattleOutcome> play(List<Match> matches) {
    if (matches.size() <= 1 || parameters.workerCount() == 1) {
      return playBatch(matches);
    }
    int batchSize = (matches.size() + parameters.workerCount() - 1) / parameters.workerCount();
    List<Callable<List<BattleOutcome>>> batches = new ArrayList<>();
    for (List<Match> batch : Lists.partition(matches, batchSize)) {
      batches.add(() -> playBatch(batch));
    }
    List<BattleOutcome> outcomes = new ArrayList<>();
    try {
      for (Future<List<BattleOutcome>> future : executor.invokeAll(batches)) {
        outcomes.addAll(future.get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EvaluationException("Interrupted while playing matches", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new EvaluationException("Match worker failed", cause);
    }
    return outcomes;
  }

  private List<BattleOutcome> playBatch(List<Match> batch) {
    List<BattleOutcome> outcomes = new ArrayList<>();
    try (SimulationContext context = simulator.newContext()) {
      for (Match match : batch) {
        Army ally = match.challenger().army();
        try {
          BattleResult result =
              simulator.simulate(context, ally, match.defender().army(), battleTimeout);
          outcomes.add(result.outcome());
        } catch (RuntimeException e) {
          logger.atSevere().withCause(e).log("Match failed for %s", ally);
          throw new EvaluationException(ally, e);
        }
      }
    }
    return outcomes;
  }

  private record Match(RatedArmy challenger, RatedArmy defender) {}
}
