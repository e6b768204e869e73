package com.verlumen.battlesolver.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Tuning knobs of one {@link EvolutionStrategy}. */
@AutoValue
public abstract class EvolutionParameters {
  static final double DEFAULT_ADAPTATION_RATE = 0.1;
  static final int DEFAULT_MUTATIONS_PER_CHILD = 1;
  static final double DEFAULT_CROSSOVER_RATE = 0.0;
  static final int DEFAULT_WORKER_COUNT = 1;

  /** Size of each generation after selection. */
  public abstract int parentsPerGeneration();

  /** Number of new distinct children bred per generation. */
  public abstract int childrenPerGeneration();

  /** How strongly mutation weights react to one generation's success rates, in [0, 1]. */
  public abstract double adaptationRate();

  /** Most individuals of one composition allowed into the next generation. */
  public abstract int categoryCap();

  /** Mutations applied in sequence to produce one child. */
  public abstract int mutationsPerChild();

  /** Probability of recombining two parents before mutating. Zero disables crossover. */
  public abstract double crossoverRate();

  /** Evaluation workers available to this strategy. */
  public abstract int workerCount();

  public abstract Builder toBuilder();

  /**
   * Starts a builder. {@code categoryCap} defaults to {@code parentsPerGeneration}, which leaves
   * diversity unconstrained.
   */
  public static Builder builder() {
    return new AutoValue_EvolutionParameters.Builder()
        .setAdaptationRate(DEFAULT_ADAPTATION_RATE)
        .setMutationsPerChild(DEFAULT_MUTATIONS_PER_CHILD)
        .setCrossoverRate(DEFAULT_CROSSOVER_RATE)
        .setWorkerCount(DEFAULT_WORKER_COUNT)
        .setCategoryCap(0);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setParentsPerGeneration(int parentsPerGeneration);

    public abstract Builder setChildrenPerGeneration(int childrenPerGeneration);

    public abstract Builder setAdaptationRate(double adaptationRate);

    /** Zero means "same as parentsPerGeneration". */
    public abstract Builder setCategoryCap(int categoryCap);

    public abstract Builder setMutationsPerChild(int mutationsPerChild);

    public abstract Builder setCrossoverRate(double crossoverRate);

    public abstract Builder setWorkerCount(int workerCount);

    abstract int parentsPerGeneration();

    abstract int categoryCap();

    abstract EvolutionParameters autoBuild();

    public EvolutionParameters build() {
      if (categoryCap() == 0) {
        setCategoryCap(parentsPerGeneration());
      }
      EvolutionParameters parameters = autoBuild();
      checkArgument(
          parameters.parentsPerGeneration() > 0,
          "parentsPerGeneration must be positive: %s",
          parameters.parentsPerGeneration());
      checkArgument(
          parameters.childrenPerGeneration() > 0,
          "childrenPerGeneration must be positive: %s",
          parameters.childrenPerGeneration());
      checkArgument(
          parameters.adaptationRate() >= 0 && parameters.adaptationRate() <= 1,
          "adaptationRate must be in [0, 1]: %s",
          parameters.adaptationRate());
      checkArgument(
          parameters.categoryCap() > 0,
          "categoryCap must be positive: %s",
          parameters.categoryCap());
      checkArgument(
          parameters.mutationsPerChild() > 0,
          "mutationsPerChild must be positive: %s",
          parameters.mutationsPerChild());
      checkArgument(
          parameters.crossoverRate() >= 0 && parameters.crossoverRate() <= 1,
          "crossoverRate must be in [0, 1]: %s",
          parameters.crossoverRate());
      checkArgument(
          parameters.workerCount() > 0,
          "workerCount must be positive: %s",
          parameters.workerCount());
      return parameters;
    }
  }
}
