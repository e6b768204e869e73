package com.verlumen.battlesolver.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.time.Duration;
import java.util.Optional;

/** When a run of generations stops. */
@AutoValue
public abstract class RunLimits {
  public static RunLimits of(int maxGenerations) {
    return create(maxGenerations, Optional.empty(), 0);
  }

  /**
   * @param maxGenerations generations to run at most
   * @param timeout wall-clock budget for the whole run, if any
   * @param earlyStoppingGenerations stop after this many generations without a better best
   *     individual; zero disables early stopping
   */
  public static RunLimits create(
      int maxGenerations, Optional<Duration> timeout, int earlyStoppingGenerations) {
    checkArgument(maxGenerations >= 0, "maxGenerations must be non-negative: %s", maxGenerations);
    checkArgument(
        earlyStoppingGenerations >= 0,
        "earlyStoppingGenerations must be non-negative: %s",
        earlyStoppingGenerations);
    timeout.ifPresent(
        duration -> checkArgument(!duration.isNegative(), "Negative timeout %s", duration));
    return new AutoValue_RunLimits(maxGenerations, timeout, earlyStoppingGenerations);
  }

  public abstract int maxGenerations();

  public abstract Optional<Duration> timeout();

  public abstract int earlyStoppingGenerations();

  public RunLimits withTimeout(Duration timeout) {
    return create(maxGenerations(), Optional.of(timeout), earlyStoppingGenerations());
  }
}
