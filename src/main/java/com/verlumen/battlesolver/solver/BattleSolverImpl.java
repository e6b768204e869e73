package com.verlumen.battlesolver.solver;

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.ArmyGenerator;
import com.verlumen.battlesolver.army.PlacementArea;
import com.verlumen.battlesolver.army.UnitValues;
import com.verlumen.battlesolver.balance.BalanceBattle;
import com.verlumen.battlesolver.balance.BalanceOverview;
import com.verlumen.battlesolver.evolution.EvolutionResult;
import com.verlumen.battlesolver.evolution.EvolutionRunner;
import com.verlumen.battlesolver.evolution.EvolutionStrategy;
import com.verlumen.battlesolver.evolution.Individual;
import com.verlumen.battlesolver.evolution.Population;
import com.verlumen.battlesolver.evolution.PopulationEvaluator;
import com.verlumen.battlesolver.evolution.PopulationSummary;
import com.verlumen.battlesolver.evolution.RunLimits;
import com.verlumen.battlesolver.evolution.operators.WeightedCrossover;
import com.verlumen.battlesolver.fitness.Grade;
import com.verlumen.battlesolver.islands.Island;
import com.verlumen.battlesolver.islands.IslandCoordinator;
import com.verlumen.battlesolver.islands.IslandSearchResult;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

final class BattleSolverImpl implements BattleSolver {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final PopulationEvaluator evaluator;
  private final UnitValues unitValues;
  private final PlacementArea placementArea;
  private final SearchConfig config;
  private final EvolutionRunner runner;

  @Inject
  BattleSolverImpl(
      PopulationEvaluator evaluator,
      UnitValues unitValues,
      PlacementArea placementArea,
      SearchConfig config,
      EvolutionRunner runner) {
    this.evaluator = evaluator;
    this.unitValues = unitValues;
    this.placementArea = placementArea;
    this.config = config;
    this.runner = runner;
  }

  @Override
  public SolveResult solve(SolveRequest request) {
    Random random = newRandom();
    ArmyGenerator generator = ArmyGenerator.create(unitValues, placementArea);
    Population initial = initialPopulation(request, generator, random);
    EvolutionStrategy strategy = newStrategy(request, generator, config.workers(), random);
    RunLimits limits =
        RunLimits.create(
            config.generations(),
            config.optimizationTimeout(),
            config.earlyStoppingGenerations());

    logger.atInfo().log(
        "Searching for an army against %s, target cost %d",
        request.enemy().shortDescription(),
        request.targetCost());
    EvolutionResult result =
        runner.run(
            initial,
            strategy,
            limits,
            (generation, population) ->
                logger.atFine().log("Generation %d best %s", generation, lazy(population::best)));

    Optional<PopulationSummary> summary =
        result.population().isEvaluated()
            ? Optional.of(result.population().summary())
            : Optional.empty();
    return toResult(
        request,
        result.best(),
        result.bestIndividuals(),
        result.generations(),
        result.timedOut(),
        summary);
  }

  @Override
  public SolveResult solveWithIslands(SolveRequest request) {
    Random random = newRandom();
    ArmyGenerator generator = ArmyGenerator.create(unitValues, placementArea);
    List<Island> islands = new ArrayList<>();
    for (int id = 0; id < config.islands(); id++) {
      Random islandRandom = new Random(random.nextLong());
      islands.add(
          new Island(
              id,
              initialPopulation(request, generator, islandRandom),
              newStrategy(request, generator, config.workersPerIsland(), islandRandom)));
    }

    ExecutorService islandExecutor =
        Executors.newFixedThreadPool(
            config.islands(),
            new ThreadFactoryBuilder().setNameFormat("island-%d").setDaemon(true).build());
    try {
      IslandCoordinator coordinator =
          new IslandCoordinator(islands, islandExecutor, runner, new Random(random.nextLong()));
      logger.atInfo().log(
          "Searching with %d islands against %s, target cost %d",
          islands.size(),
          request.enemy().shortDescription(),
          request.targetCost());
      IslandSearchResult result =
          coordinator.run(
              config.epochs(), config.generationsPerEpoch(), config.optimizationTimeout());
      return toResult(
          request,
          result.globalBest(),
          result.bestIndividuals(),
          result.generations(),
          result.timedOut(),
          mergedSummary(islands));
    } finally {
      islandExecutor.shutdownNow();
    }
  }

  @Override
  public BalanceOverview balanceOverview(Iterable<BalanceBattle> battles) {
    Random random = newRandom();
    ArmyGenerator generator = ArmyGenerator.create(unitValues, placementArea);
    return BalanceOverview.create(
        battles,
        enemy ->
            newStrategy(
                enemy,
                SearchConstants.DEFAULT_MAX_DECREASE,
                /* allowUnitAddition= */ false,
                generator,
                config.workers(),
                random),
        generator,
        SearchConstants.DEFAULT_MAX_DECREASE,
        random);
  }

  private Population initialPopulation(
      SolveRequest request, ArmyGenerator generator, Random random) {
    Population population =
        Population.random(
            config.parentsPerGeneration(),
            request.targetCost(),
            request.maxDecrease(),
            generator,
            random);
    ImmutableList.Builder<Individual> seeds = ImmutableList.builder();
    for (Army army : request.seedArmies()) {
      seeds.add(Individual.create(army, unitValues));
    }
    return population.withAdded(seeds.build());
  }

  private EvolutionStrategy newStrategy(
      SolveRequest request, ArmyGenerator generator, int workerCount, Random random) {
    return newStrategy(
        request.enemy(),
        request.maxDecrease(),
        request.allowUnitAddition(),
        generator,
        workerCount,
        random);
  }

  private EvolutionStrategy newStrategy(
      Army enemy,
      int maxDecrease,
      boolean allowUnitAddition,
      ArmyGenerator generator,
      int workerCount,
      Random random) {
    EvolutionStrategy.Builder strategy =
        EvolutionStrategy.builder()
            .setParameters(config.evolutionParameters(workerCount))
            .addMutations(StandardOperators.mutations(generator, maxDecrease, allowUnitAddition))
            .setSelector(StandardOperators.selector(config.tournamentSize()))
            .setEvaluator(evaluator)
            .setEnemy(enemy)
            .setUnitValues(unitValues)
            .setRandom(random);
    if (config.crossoverRate() > 0) {
      strategy.setCrossover(WeightedCrossover.standard());
    }
    return strategy.build();
  }

  private Random newRandom() {
    return config.seed().map(Random::new).orElseGet(Random::new);
  }

  private static Optional<PopulationSummary> mergedSummary(List<Island> islands) {
    Set<Individual> merged = new LinkedHashSet<>();
    for (Island island : islands) {
      if (island.population().isEvaluated()) {
        merged.addAll(island.population().individuals());
      }
    }
    return merged.isEmpty()
        ? Optional.empty()
        : Optional.of(Population.of(merged).summary());
  }

  private static SolveResult toResult(
      SolveRequest request,
      Optional<Individual> best,
      ImmutableList<Individual> bestIndividuals,
      int generations,
      boolean timedOut,
      Optional<PopulationSummary> summary) {
    Optional<Grade> grade =
        request
            .grades()
            .flatMap(grades -> best.map(individual -> grades.grade(individual.fitness())));
    best.ifPresentOrElse(
        individual ->
            logger.atInfo().log(
                "Best army %s, grade %s", individual, grade.map(Grade::name).orElse("none")),
        () -> logger.atWarning().log("Search ended before any army was evaluated"));
    return SolveResult.create(best, bestIndividuals, grade, generations, timedOut, summary);
  }
}
