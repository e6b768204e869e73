package com.verlumen.battlesolver.balance;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import com.google.common.util.concurrent.MoreExecutors;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.UnitType;
import com.verlumen.battlesolver.evolution.EvolutionParameters;
import com.verlumen.battlesolver.evolution.EvolutionStrategy;
import com.verlumen.battlesolver.evolution.Individual;
import com.verlumen.battlesolver.evolution.ParallelPopulationEvaluator;
import com.verlumen.battlesolver.evolution.PopulationEvaluator;
import com.verlumen.battlesolver.evolution.operators.PerturbPosition;
import com.verlumen.battlesolver.evolution.operators.RandomizeUnitType;
import com.verlumen.battlesolver.evolution.operators.RemoveRandomUnit;
import com.verlumen.battlesolver.evolution.operators.ReplaceSubarmy;
import com.verlumen.battlesolver.fitness.BattleGrades;
import com.verlumen.battlesolver.fitness.Grade;
import com.verlumen.battlesolver.testing.CostThresholdSimulator;
import com.verlumen.battlesolver.testing.TestArmies;
import java.time.Duration;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BalanceOverviewTest {
  private static final Army ARCHER_ENEMY = TestArmies.archers(2, -300);
  private static final BattleGrades ZOMBIE_GRADES = BattleGrades.create(300, 400, 500, 600);
  private static final BattleGrades ARCHER_GRADES = BattleGrades.create(200, 300, 450, 650);

  private final CostThresholdSimulator simulator =
      new CostThresholdSimulator(TestArmies.UNIT_VALUES, 500);
  private final PopulationEvaluator evaluator =
      new ParallelPopulationEvaluator(
          simulator, MoreExecutors.newDirectExecutorService(), Duration.ofSeconds(120));
  private final Random random = new Random(31);

  private EvolutionStrategy strategy(Army enemy) {
    return EvolutionStrategy.builder()
        .setParameters(
            EvolutionParameters.builder()
                .setParentsPerGeneration(10)
                .setChildrenPerGeneration(10)
                .build())
        .addMutations(
            ImmutableList.of(
                new RemoveRandomUnit(),
                new PerturbPosition(10),
                new ReplaceSubarmy(TestArmies.GENERATOR),
                new RandomizeUnitType(TestArmies.GENERATOR, 100)))
        .setEvaluator(evaluator)
        .setEnemy(enemy)
        .setUnitValues(TestArmies.UNIT_VALUES)
        .setRandom(random)
        .build();
  }

  private BalanceOverview overview(BalanceBattle... battles) {
    return BalanceOverview.create(
        ImmutableList.copyOf(battles), this::strategy, TestArmies.GENERATOR, 100, random);
  }

  @Test
  public void create_evaluatesOnePopulationPerBattleAtTargetCost() {
    BalanceOverview overview =
        overview(
            BalanceBattle.create("zombies", TestArmies.ENEMY, ZOMBIE_GRADES),
            BalanceBattle.create("archers", ARCHER_ENEMY));

    assertThat(overview.generation()).isEqualTo(0);
    for (Individual individual : overview.population("zombies").individuals()) {
      assertThat(individual.isEvaluated()).isTrue();
      assertThat(individual.points()).isIn(Range.closed(500, 600));
    }
    for (Individual individual : overview.population("archers").individuals()) {
      assertThat(individual.points()).isIn(Range.closed(800, 900));
    }
  }

  @Test
  public void step_twoBattles_bestSolutionsWinAndAreGraded() {
    BalanceOverview overview =
        overview(
            BalanceBattle.create("zombies", TestArmies.ENEMY, ZOMBIE_GRADES),
            BalanceBattle.create("archers", ARCHER_ENEMY, ARCHER_GRADES));

    BalanceReport report = null;
    for (int i = 0; i < 20; i++) {
      report = overview.step();
    }

    assertThat(report.generation()).isEqualTo(20);
    assertThat(report.bestByBattle().keySet()).containsExactly("zombies", "archers").inOrder();
    for (Individual best : report.bestByBattle().values()) {
      assertThat(best.fitness().isWin()).isTrue();
      assertThat(best.points()).isAtMost(500);
    }
    assertThat(report.gradeDistribution()).hasSize(2);
    assertThat(report.gradeDistribution()).containsNoneOf(Grade.F, Grade.FAILED);
    assertThat(report.ungraded()).isEqualTo(0);
  }

  @Test
  public void report_countsUnitsOfBestSolutionsAndEnemies() {
    BalanceOverview overview =
        overview(
            BalanceBattle.create("zombies", TestArmies.ENEMY),
            BalanceBattle.create("archers", ARCHER_ENEMY));

    BalanceReport report = overview.report();

    assertThat(report.enemyUnitCounts().count(UnitType.CORE_ARCHER)).isEqualTo(2);
    assertThat(report.enemyUnitCounts().count(UnitType.ZOMBIE_TANK)).isEqualTo(1);
    assertThat(report.enemyUnitCounts().count(UnitType.ZOMBIE_BASIC_ZOMBIE)).isEqualTo(1);
    int bestUnits =
        report.bestByBattle().values().stream().mapToInt(best -> best.army().size()).sum();
    assertThat(report.bestSolutionUnitCounts()).hasSize(bestUnits);
    assertThat(report.ungraded()).isEqualTo(2);
    assertThat(report.gradeDistribution()).isEmpty();
    assertThat(report.unitTypesByUsage()).hasSize(UnitType.values().length);
    UnitType mostUsed = report.unitTypesByUsage().get(0);
    for (UnitType type : UnitType.values()) {
      assertThat(report.bestSolutionUnitCounts().count(mostUsed))
          .isAtLeast(report.bestSolutionUnitCounts().count(type));
    }
  }

  @Test
  public void report_losingBestSolution_isGradedFailed() {
    BalanceOverview overview =
        overview(
            BalanceBattle.create(
                "hard", TestArmies.ENEMY, BattleGrades.create(700, 800, 900, 1000)));

    BalanceReport report = overview.report();

    assertThat(report.gradeDistribution()).containsExactly(Grade.FAILED);
  }

  @Test
  public void create_duplicateBattleIds_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            overview(
                BalanceBattle.create("same", TestArmies.ENEMY),
                BalanceBattle.create("same", ARCHER_ENEMY)));
  }

  @Test
  public void population_unknownBattle_throws() {
    BalanceOverview overview = overview(BalanceBattle.create("zombies", TestArmies.ENEMY));

    assertThrows(IllegalArgumentException.class, () -> overview.population("missing"));
  }
}
