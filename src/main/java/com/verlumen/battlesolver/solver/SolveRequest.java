package com.verlumen.battlesolver.solver;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.fitness.BattleGrades;
import java.util.Optional;

/** One army search: who to beat and how many points the starting armies may cost. */
@AutoValue
public abstract class SolveRequest {
  public abstract Army enemy();

  /** Most points a random starting army may cost. */
  public abstract int targetCost();

  /** Random starting armies cost at least {@code targetCost - maxDecrease}. */
  public abstract int maxDecrease();

  /** Armies added to the starting population next to the random ones. */
  public abstract ImmutableList<Army> seedArmies();

  /** Grade cutoffs of the battle, when it has them. */
  public abstract Optional<BattleGrades> grades();

  /** Whether children may grow by adding random units. */
  public abstract boolean allowUnitAddition();

  public static Builder builder() {
    return new AutoValue_SolveRequest.Builder()
        .setMaxDecrease(SearchConstants.DEFAULT_MAX_DECREASE)
        .setSeedArmies(ImmutableList.of())
        .setAllowUnitAddition(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setEnemy(Army enemy);

    public abstract Builder setTargetCost(int targetCost);

    public abstract Builder setMaxDecrease(int maxDecrease);

    public abstract Builder setSeedArmies(Iterable<Army> seedArmies);

    public abstract Builder setGrades(BattleGrades grades);

    public abstract Builder setAllowUnitAddition(boolean allowUnitAddition);

    abstract SolveRequest autoBuild();

    public SolveRequest build() {
      SolveRequest request = autoBuild();
      checkArgument(!request.enemy().isEmpty(), "The enemy army is empty");
      checkArgument(
          request.maxDecrease() >= 0,
          "maxDecrease must be non-negative: %s",
          request.maxDecrease());
      checkArgument(
          request.targetCost() > request.maxDecrease(),
          "targetCost %s must exceed maxDecrease %s",
          request.targetCost(),
          request.maxDecrease());
      checkArgument(
          request.seedArmies().stream().noneMatch(Army::isEmpty), "Seed armies must not be empty");
      return request;
    }
  }
}
