package com.verlumen.battlesolver.evolution;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.fitness.BattleOutcome;
import com.verlumen.battlesolver.simulation.BattleResult;
import com.verlumen.battlesolver.simulation.BattleSimulator;
import com.verlumen.battlesolver.simulation.SimulationContext;
import com.verlumen.battlesolver.testing.CostThresholdSimulator;
import com.verlumen.battlesolver.testing.TestArmies;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParallelPopulationEvaluatorTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(120);

  private final ExecutorService executor = Executors.newFixedThreadPool(4);

  @After
  public void tearDown() {
    executor.shutdownNow();
  }

  private static List<Individual> individuals(int count) {
    List<Individual> individuals = new ArrayList<>();
    for (int i = 1; i <= count; i++) {
      individuals.add(Individual.create(TestArmies.archers(i), TestArmies.UNIT_VALUES));
    }
    return individuals;
  }

  @Test
  public void evaluate_manyWorkers_evaluatesEveryIndividual() {
    CostThresholdSimulator simulator = new CostThresholdSimulator(TestArmies.UNIT_VALUES, 500);
    List<Individual> individuals = individuals(13);

    new ParallelPopulationEvaluator(simulator, executor, TIMEOUT)
        .evaluate(individuals, TestArmies.ENEMY, 4);

    assertThat(simulator.battles()).isEqualTo(13);
    for (Individual individual : individuals) {
      assertThat(individual.fitness().isWin()).isEqualTo(individual.points() <= 500);
    }
  }

  @Test
  public void evaluate_skipsEvaluatedIndividuals() {
    CostThresholdSimulator simulator = new CostThresholdSimulator(TestArmies.UNIT_VALUES, 500);
    ParallelPopulationEvaluator evaluator =
        new ParallelPopulationEvaluator(simulator, executor, TIMEOUT);
    List<Individual> individuals = individuals(6);

    evaluator.evaluate(individuals.subList(0, 3), TestArmies.ENEMY, 2);
    evaluator.evaluate(individuals, TestArmies.ENEMY, 2);

    assertThat(simulator.battles()).isEqualTo(6);
  }

  @Test
  public void evaluate_givesEachBatchItsOwnContext() {
    AtomicInteger opened = new AtomicInteger();
    AtomicInteger closed = new AtomicInteger();
    Set<SimulationContext> used = ConcurrentHashMap.newKeySet();
    BattleSimulator simulator =
        new BattleSimulator() {
          @Override
          public BattleResult simulate(
              SimulationContext context, Army ally, Army enemy, Duration timeout) {
            used.add(context);
            return BattleResult.create(BattleOutcome.LOSS, 0, 10);
          }

          @Override
          public SimulationContext newContext() {
            opened.incrementAndGet();
            return closed::incrementAndGet;
          }
        };

    new ParallelPopulationEvaluator(simulator, executor, TIMEOUT)
        .evaluate(individuals(8), TestArmies.ENEMY, 4);

    assertThat(opened.get()).isEqualTo(4);
    assertThat(closed.get()).isEqualTo(4);
    assertThat(used).hasSize(4);
  }

  @Test
  public void evaluate_simulatorFailure_throwsEvaluationExceptionNamingArmy() {
    Army failing = TestArmies.archers(3);
    BattleSimulator simulator =
        (context, ally, enemy, timeout) -> {
          if (ally.equals(failing)) {
            throw new IllegalArgumentException("unknown unit");
          }
          return BattleResult.create(BattleOutcome.WIN, 1, 0);
        };

    EvaluationException thrown =
        assertThrows(
            EvaluationException.class,
            () ->
                new ParallelPopulationEvaluator(simulator, executor, TIMEOUT)
                    .evaluate(individuals(5), TestArmies.ENEMY, 3));

    assertThat(thrown.army()).isEqualTo(failing);
    assertThat(thrown).hasCauseThat().isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void evaluate_separateIndividualsWithEqualArmies_evaluatesEveryInstance() {
    CostThresholdSimulator simulator = new CostThresholdSimulator(TestArmies.UNIT_VALUES, 500);
    Individual first = Individual.create(TestArmies.archers(3), TestArmies.UNIT_VALUES);
    Individual second = Individual.create(TestArmies.archers(3), TestArmies.UNIT_VALUES);
    Population population = Population.of(ImmutableList.of(first, second, first.copy()));

    Population evaluated =
        population.evaluate(
            TestArmies.ENEMY,
            new ParallelPopulationEvaluator(simulator, executor, TIMEOUT),
            2);

    assertThat(evaluated.isEvaluated()).isTrue();
    assertThat(first.isEvaluated()).isTrue();
    assertThat(second.isEvaluated()).isTrue();
    assertThat(second.fitness()).isEqualTo(first.fitness());
    assertThat(simulator.battles()).isEqualTo(1);
  }

  @Test
  public void evaluate_sameInstanceListedTwice_simulatesOnce() {
    CostThresholdSimulator simulator = new CostThresholdSimulator(TestArmies.UNIT_VALUES, 500);
    Individual individual = Individual.create(TestArmies.archers(2), TestArmies.UNIT_VALUES);

    new ParallelPopulationEvaluator(simulator, executor, TIMEOUT)
        .evaluate(ImmutableList.of(individual, individual), TestArmies.ENEMY, 2);

    assertThat(individual.isEvaluated()).isTrue();
    assertThat(simulator.battles()).isEqualTo(1);
  }

  @Test
  public void evaluate_simulatorThrowsIllegalState_throwsEvaluationExceptionNamingArmy() {
    Army failing = TestArmies.archers(2);
    BattleSimulator simulator =
        (context, ally, enemy, timeout) -> {
          if (ally.equals(failing)) {
            throw new IllegalStateException("world not loaded");
          }
          return BattleResult.create(BattleOutcome.LOSS, 0, 10);
        };

    EvaluationException thrown =
        assertThrows(
            EvaluationException.class,
            () ->
                new ParallelPopulationEvaluator(simulator, executor, TIMEOUT)
                    .evaluate(individuals(4), TestArmies.ENEMY, 1));

    assertThat(thrown.army()).isEqualTo(failing);
    assertThat(thrown).hasCauseThat().isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void evaluate_individualEvaluatedAgainstOtherEnemy_throws() {
    CostThresholdSimulator simulator = new CostThresholdSimulator(TestArmies.UNIT_VALUES, 500);
    ParallelPopulationEvaluator evaluator =
        new ParallelPopulationEvaluator(simulator, executor, TIMEOUT);
    ImmutableList<Individual> individuals = ImmutableList.copyOf(individuals(2));
    evaluator.evaluate(individuals, TestArmies.ENEMY, 1);

    assertThrows(
        IllegalStateException.class,
        () -> evaluator.evaluate(individuals, TestArmies.archers(1, -300), 1));
  }
}
