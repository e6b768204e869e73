package com.verlumen.battlesolver.balance;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Tuning knobs of an {@link EloEvolution}. */
@AutoValue
public abstract class EloParameters {
  static final double DEFAULT_K_FACTOR = 32.0;
  static final int DEFAULT_TOURNAMENT_SIZE = 1;

  public abstract int parentsPerGeneration();

  public abstract int childrenPerGeneration();

  /** Matches between a new and an existing army played each generation. */
  public abstract int matchesPerGeneration();

  /** Largest rating change one match can cause. */
  public abstract double kFactor();

  /** Armies compared per parent draw; the highest rated of them becomes the parent. */
  public abstract int tournamentSize();

  public abstract int workerCount();

  public static Builder builder() {
    return new AutoValue_EloParameters.Builder()
        .setKFactor(DEFAULT_K_FACTOR)
        .setTournamentSize(DEFAULT_TOURNAMENT_SIZE)
        .setWorkerCount(1);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setParentsPerGeneration(int parentsPerGeneration);

    public abstract Builder setChildrenPerGeneration(int childrenPerGeneration);

    public abstract Builder setMatchesPerGeneration(int matchesPerGeneration);

    public abstract Builder setKFactor(double kFactor);

    public abstract Builder setTournamentSize(int tournamentSize);

    public abstract Builder setWorkerCount(int workerCount);

    abstract EloParameters autoBuild();

    public EloParameters build() {
      EloParameters parameters = autoBuild();
      checkArgument(parameters.parentsPerGeneration() > 0, "parentsPerGeneration must be positive");
      checkArgument(
          parameters.childrenPerGeneration() > 0, "childrenPerGeneration must be positive");
      checkArgument(
          parameters.matchesPerGeneration() >= 0, "matchesPerGeneration must be non-negative");
      checkArgument(parameters.kFactor() > 0, "kFactor must be positive: %s", parameters.kFactor());
      checkArgument(parameters.tournamentSize() > 0, "tournamentSize must be positive");
      checkArgument(parameters.workerCount() > 0, "workerCount must be positive");
      return parameters;
    }
  }
}
