package com.verlumen.battlesolver.evolution;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMultiset;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.UnitType;
import com.verlumen.battlesolver.evolution.operators.MoveNextToAlly;
import com.verlumen.battlesolver.evolution.operators.Mutation;
import com.verlumen.battlesolver.evolution.operators.PerturbPosition;
import com.verlumen.battlesolver.evolution.operators.RandomMixCrossover;
import com.verlumen.battlesolver.evolution.operators.RandomizeUnitPosition;
import com.verlumen.battlesolver.evolution.operators.RandomizeUnitType;
import com.verlumen.battlesolver.evolution.operators.RemoveRandomUnit;
import com.verlumen.battlesolver.evolution.operators.ReplaceSubarmy;
import com.verlumen.battlesolver.testing.CostThresholdSimulator;
import com.verlumen.battlesolver.testing.TestArmies;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class EvolutionStrategyTest {
  private final CostThresholdSimulator simulator =
      new CostThresholdSimulator(TestArmies.UNIT_VALUES, 500);
  private final PopulationEvaluator evaluator =
      new ParallelPopulationEvaluator(
          simulator, MoreExecutors.newDirectExecutorService(), Duration.ofSeconds(120));
  private final Random random = new Random(2024);

  private static ImmutableList<Mutation> standardMutations() {
    return ImmutableList.of(
        new RemoveRandomUnit(),
        new PerturbPosition(10),
        new PerturbPosition(100),
        new RandomizeUnitPosition(TestArmies.GENERATOR),
        new ReplaceSubarmy(TestArmies.GENERATOR),
        new RandomizeUnitType(TestArmies.GENERATOR, 100),
        new MoveNextToAlly(20));
  }

  private EvolutionStrategy.Builder strategy(EvolutionParameters parameters) {
    return EvolutionStrategy.builder()
        .setParameters(parameters)
        .addMutations(standardMutations())
        .setEvaluator(evaluator)
        .setEnemy(TestArmies.ENEMY)
        .setUnitValues(TestArmies.UNIT_VALUES)
        .setRandom(random);
  }

  private static EvolutionParameters parameters(int parents, int children) {
    return EvolutionParameters.builder()
        .setParentsPerGeneration(parents)
        .setChildrenPerGeneration(children)
        .build();
  }

  private Population startingPopulation() {
    return Population.random(10, 700, 100, TestArmies.GENERATOR, random);
  }

  @Test
  public void evolve_keepsParentsPerGeneration() {
    EvolutionStrategy strategy = strategy(parameters(10, 10)).build();

    Population next = strategy.evolve(startingPopulation());

    assertThat(next.size()).isEqualTo(10);
    assertThat(next.isEvaluated()).isTrue();
    assertThat(strategy.generation()).isEqualTo(1);
  }

  @Test
  public void evolve_bestNeverGetsWorse() {
    EvolutionStrategy strategy = strategy(parameters(10, 10)).build();
    Population population = strategy.evaluate(startingPopulation());

    for (int generation = 0; generation < 10; generation++) {
      Population next = strategy.evolve(population);

      assertThat(next.best().fitness()).isAtLeast(population.best().fitness());
      population = next;
    }
  }

  @Test
  public void evolve_categoryCapOne_keepsDistinctCompositions() {
    EvolutionParameters parameters =
        parameters(10, 20).toBuilder().setCategoryCap(1).build();
    EvolutionStrategy strategy = strategy(parameters).build();
    Population population = startingPopulation();

    for (int generation = 0; generation < 5; generation++) {
      population = strategy.evolve(population);

      List<ImmutableSortedMultiset<UnitType>> categories =
          population.individuals().stream()
              .map(Individual::category)
              .collect(Collectors.toList());
      assertThat(categories).containsNoDuplicates();
    }
  }

  @Test
  public void evolve_stubOracle_convergesUnderThreshold(
      @TestParameter({"2024", "7", "42", "1234", "98765"}) long seed) {
    Random seeded = new Random(seed);
    EvolutionStrategy strategy = strategy(parameters(10, 10)).setRandom(seeded).build();
    Population population =
        strategy.evaluate(Population.random(10, 700, 100, TestArmies.GENERATOR, seeded));
    assertThat(population.individuals().stream().mapToInt(Individual::points).min().getAsInt())
        .isAtLeast(600);

    for (int generation = 0; generation < 20; generation++) {
      population = strategy.evolve(population);
    }

    assertThat(population.best().fitness().isWin()).isTrue();
    assertThat(population.best().points()).isAtMost(500);
  }

  @Test
  public void evolve_adaptsMutationRates() {
    EvolutionStrategy strategy = strategy(parameters(10, 10)).build();
    ImmutableList<Double> before = strategy.mutationRates().snapshot().values().asList();

    strategy.evolve(startingPopulation());

    assertThat(strategy.mutationRates().snapshot().values().asList()).isNotEqualTo(before);
  }

  @Test
  public void evolve_withCrossover_keepsParentsPerGeneration() {
    EvolutionParameters parameters =
        parameters(10, 10).toBuilder().setCrossoverRate(0.5).build();
    EvolutionStrategy strategy =
        strategy(parameters).setCrossover(new RandomMixCrossover()).build();

    Population next = strategy.evolve(startingPopulation());

    assertThat(next.size()).isEqualTo(10);
  }

  @Test
  public void evolve_mutationReturnsEmptyArmy_throwsNamingOperator() {
    Mutation broken = (army, random) -> Army.empty();
    EvolutionStrategy strategy =
        EvolutionStrategy.builder()
            .setParameters(parameters(5, 5))
            .addMutation(broken)
            .setEvaluator(evaluator)
            .setEnemy(TestArmies.ENEMY)
            .setUnitValues(TestArmies.UNIT_VALUES)
            .setRandom(random)
            .build();

    IllegalStateException thrown =
        assertThrows(
            IllegalStateException.class,
            () -> strategy.evolve(Population.random(5, 700, 100, TestArmies.GENERATOR, random)));

    assertThat(thrown).hasMessageThat().contains("empty army");
  }

  @Test
  public void build_crossoverRateWithoutCrossover_throws() {
    EvolutionParameters parameters =
        parameters(10, 10).toBuilder().setCrossoverRate(0.5).build();

    assertThrows(IllegalArgumentException.class, () -> strategy(parameters).build());
  }

  @Test
  public void parameters_adaptationRateOutOfRange_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            EvolutionParameters.builder()
                .setParentsPerGeneration(10)
                .setChildrenPerGeneration(10)
                .setAdaptationRate(1.5)
                .build());
  }
}
