package com.verlumen.battlesolver.balance;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.flogger.FluentLogger;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.ArmyGenerator;
import com.verlumen.battlesolver.army.Placement;
import com.verlumen.battlesolver.army.UnitType;
import com.verlumen.battlesolver.evolution.EvolutionStrategy;
import com.verlumen.battlesolver.evolution.Individual;
import com.verlumen.battlesolver.evolution.Population;
import com.verlumen.battlesolver.fitness.Grade;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;

/**
 * Evolves one population per battle, each against that battle's enemy, and reports which units
 * the best solutions across all battles rely on.
 *
 * <p>Every call to {@link #step} advances all populations by one generation. Not thread-safe.
 */
public final class BalanceOverview {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ImmutableList<Front> fronts;
  private int generation;

  private BalanceOverview(ImmutableList<Front> fronts) {
    this.fronts = fronts;
  }

  /**
   * Builds and evaluates a random starting population for every battle, at the battle's {@link
   * BalanceBattle#targetCost()}.
   *
   * @param strategies creates the strategy that evolves armies against the given enemy
   */
  public static BalanceOverview create(
      Iterable<BalanceBattle> battles,
      Function<Army, EvolutionStrategy> strategies,
      ArmyGenerator generator,
      int maxDecrease,
      Random random) {
    ImmutableList.Builder<Front> fronts = ImmutableList.builder();
    Set<String> ids = new HashSet<>();
    for (BalanceBattle battle : battles) {
      checkArgument(ids.add(battle.id()), "Duplicate battle id %s", battle.id());
      EvolutionStrategy strategy = strategies.apply(battle.enemy());
      checkArgument(
          strategy.enemy().equals(battle.enemy()),
          "Strategy for battle %s fights another enemy",
          battle.id());
      Population population =
          Population.random(
              strategy.parameters().parentsPerGeneration(),
              battle.targetCost(),
              maxDecrease,
              generator,
              random);
      fronts.add(new Front(battle, strategy, strategy.evaluate(population)));
      logger.atFine().log("Initialized population for %s", battle.id());
    }
    ImmutableList<Front> built = fronts.build();
    checkArgument(!built.isEmpty(), "A balance overview needs at least one battle");
    logger.atInfo().log("Balance overview over %d battles", built.size());
    return new BalanceOverview(built);
  }

  /** Completed calls to {@link #step}. */
  public int generation() {
    return generation;
  }

  /** The current population of the battle with {@code id}. */
  public Population population(String id) {
    return fronts.stream()
        .filter(front -> front.battle.id().equals(id))
        .findFirst()
        .map(front -> front.population)
        .orElseThrow(() -> new IllegalArgumentException("Unknown battle " + id));
  }

  /** Evolves every battle's population by one generation and reports the result. */
  public BalanceReport step() {
    for (Front front : fronts) {
      front.population = front.strategy.evolve(front.population);
    }
    generation++;
    BalanceReport report = report();
    logger.atInfo().log(
        "Generation %d: grades %s, ungraded %d, units by usage %s",
        generation,
        report.gradeDistribution(),
        report.ungraded(),
        lazy(report::unitTypesByUsage));
    return report;
  }

  /** Best solutions of the current generation. */
  public BalanceReport report() {
    ImmutableMap.Builder<String, Individual> bestByBattle = ImmutableMap.builder();
    ImmutableMultiset.Builder<UnitType> bestUnits = ImmutableMultiset.builder();
    ImmutableMultiset.Builder<UnitType> enemyUnits = ImmutableMultiset.builder();
    ImmutableMultiset.Builder<Grade> grades = ImmutableMultiset.builder();
    int ungraded = 0;
    for (Front front : fronts) {
      Individual best = front.population.bestIndividuals().get(0);
      bestByBattle.put(front.battle.id(), best);
      best.army().placements().stream().map(Placement::unitType).forEach(bestUnits::add);
      front.battle.enemy().placements().stream().map(Placement::unitType).forEach(enemyUnits::add);
      if (front.battle.grades().isPresent()) {
        grades.add(front.battle.grades().get().grade(best.fitness()));
      } else {
        ungraded++;
      }
    }
    return BalanceReport.create(
        generation,
        bestByBattle.buildOrThrow(),
        bestUnits.build(),
        enemyUnits.build(),
        grades.build(),
        ungraded);
  }

  private static final class Front {
    final BalanceBattle battle;
    final EvolutionStrategy strategy;
    Population population;

    Front(BalanceBattle battle, EvolutionStrategy strategy, Population population) {
      this.battle = battle;
      this.strategy = strategy;
      this.population = population;
    }
  }
}
