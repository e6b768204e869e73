package com.verlumen.battlesolver.solver;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.verlumen.battlesolver.evolution.EvolutionParameters;
import java.time.Duration;
import java.util.Optional;

/** Settings shared by every search a {@link BattleSolver} runs. */
@AutoValue
public abstract class SearchConfig {
  public abstract int parentsPerGeneration();

  public abstract int childrenPerGeneration();

  /** Zero leaves diversity unconstrained. */
  public abstract int categoryCap();

  public abstract double adaptationRate();

  public abstract int mutationsPerChild();

  public abstract double crossoverRate();

  /** One means uniform parent selection. */
  public abstract int tournamentSize();

  /** Generations of a single-population search. */
  public abstract int generations();

  /** Zero disables early stopping. */
  public abstract int earlyStoppingGenerations();

  /** Evaluation workers shared by the whole search, islands included. */
  public abstract int workers();

  public abstract Duration battleTimeout();

  public abstract Optional<Duration> optimizationTimeout();

  public abstract int islands();

  public abstract int epochs();

  public abstract int generationsPerEpoch();

  public abstract Optional<Long> seed();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_SearchConfig.Builder()
        .setParentsPerGeneration(SearchConstants.DEFAULT_PARENTS_PER_GENERATION)
        .setChildrenPerGeneration(SearchConstants.DEFAULT_CHILDREN_PER_GENERATION)
        .setCategoryCap(0)
        .setAdaptationRate(SearchConstants.DEFAULT_ADAPTATION_RATE)
        .setMutationsPerChild(SearchConstants.DEFAULT_MUTATIONS_PER_CHILD)
        .setCrossoverRate(SearchConstants.DEFAULT_CROSSOVER_RATE)
        .setTournamentSize(1)
        .setGenerations(SearchConstants.DEFAULT_GENERATIONS)
        .setEarlyStoppingGenerations(SearchConstants.DEFAULT_EARLY_STOPPING_GENERATIONS)
        .setWorkers(Runtime.getRuntime().availableProcessors())
        .setBattleTimeout(Duration.ofSeconds(SearchConstants.DEFAULT_BATTLE_TIMEOUT_SECONDS))
        .setOptimizationTimeout(
            Duration.ofSeconds(SearchConstants.DEFAULT_OPTIMIZATION_TIMEOUT_SECONDS))
        .setIslands(SearchConstants.DEFAULT_ISLANDS)
        .setEpochs(SearchConstants.DEFAULT_EPOCHS)
        .setGenerationsPerEpoch(SearchConstants.DEFAULT_GENERATIONS_PER_EPOCH);
  }

  /** Strategy parameters for a search that has {@code workerCount} evaluation workers. */
  EvolutionParameters evolutionParameters(int workerCount) {
    return EvolutionParameters.builder()
        .setParentsPerGeneration(parentsPerGeneration())
        .setChildrenPerGeneration(childrenPerGeneration())
        .setCategoryCap(categoryCap())
        .setAdaptationRate(adaptationRate())
        .setMutationsPerChild(mutationsPerChild())
        .setCrossoverRate(crossoverRate())
        .setWorkerCount(workerCount)
        .build();
  }

  /** Workers each island may use; the shared ceiling split evenly, at least one each. */
  int workersPerIsland() {
    return Math.max(1, workers() / islands());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setParentsPerGeneration(int parentsPerGeneration);

    public abstract Builder setChildrenPerGeneration(int childrenPerGeneration);

    public abstract Builder setCategoryCap(int categoryCap);

    public abstract Builder setAdaptationRate(double adaptationRate);

    public abstract Builder setMutationsPerChild(int mutationsPerChild);

    public abstract Builder setCrossoverRate(double crossoverRate);

    public abstract Builder setTournamentSize(int tournamentSize);

    public abstract Builder setGenerations(int generations);

    public abstract Builder setEarlyStoppingGenerations(int earlyStoppingGenerations);

    public abstract Builder setWorkers(int workers);

    public abstract Builder setBattleTimeout(Duration battleTimeout);

    public abstract Builder setOptimizationTimeout(Duration optimizationTimeout);

    public abstract Builder setOptimizationTimeout(Optional<Duration> optimizationTimeout);

    public abstract Builder setIslands(int islands);

    public abstract Builder setEpochs(int epochs);

    public abstract Builder setGenerationsPerEpoch(int generationsPerEpoch);

    public abstract Builder setSeed(Long seed);

    public abstract Builder setSeed(Optional<Long> seed);

    abstract SearchConfig autoBuild();

    public SearchConfig build() {
      SearchConfig config = autoBuild();
      // Strategy settings are validated by EvolutionParameters.
      config.evolutionParameters(1);
      checkArgument(config.tournamentSize() > 0, "tournamentSize must be positive");
      checkArgument(config.generations() >= 0, "generations must be non-negative");
      checkArgument(
          config.earlyStoppingGenerations() >= 0, "earlyStoppingGenerations must be non-negative");
      checkArgument(config.workers() > 0, "workers must be positive: %s", config.workers());
      checkArgument(!config.battleTimeout().isNegative(), "battleTimeout must not be negative");
      checkArgument(config.islands() > 0, "islands must be positive: %s", config.islands());
      checkArgument(config.epochs() > 0, "epochs must be positive: %s", config.epochs());
      checkArgument(config.generationsPerEpoch() > 0, "generationsPerEpoch must be positive");
      return config;
    }
  }
}
