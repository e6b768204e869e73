package com.verlumen.battlesolver.solver;

import com.google.auto.value.AutoValue;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.battlesolver.evolution.ParallelPopulationEvaluator;
import com.verlumen.battlesolver.evolution.PopulationEvaluator;
import com.verlumen.battlesolver.simulation.BattleSimulator;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Binds {@link BattleSolver} and its evaluation machinery. Callers bind their own {@link
 * BattleSimulator}, {@link com.verlumen.battlesolver.army.UnitValues} and {@link
 * com.verlumen.battlesolver.army.PlacementArea}.
 */
@AutoValue
public abstract class BattleSolverModule extends AbstractModule {
  public static BattleSolverModule create(SearchConfig searchConfig) {
    return new AutoValue_BattleSolverModule(searchConfig);
  }

  abstract SearchConfig searchConfig();

  @Override
  protected void configure() {
    bind(BattleSolver.class).to(BattleSolverImpl.class);
  }

  @Provides
  SearchConfig provideSearchConfig() {
    return searchConfig();
  }

  @Provides
  @Singleton
  ExecutorService provideEvaluationExecutor() {
    return Executors.newFixedThreadPool(
        searchConfig().workers(),
        new ThreadFactoryBuilder().setNameFormat("evaluation-%d").setDaemon(true).build());
  }

  @Provides
  @Singleton
  PopulationEvaluator providePopulationEvaluator(
      BattleSimulator simulator, ExecutorService executor) {
    return new ParallelPopulationEvaluator(simulator, executor, searchConfig().battleTimeout());
  }
}
