package com.verlumen.battlesolver.testing;

import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.UnitValues;
import com.verlumen.battlesolver.fitness.BattleOutcome;
import com.verlumen.battlesolver.simulation.BattleResult;
import com.verlumen.battlesolver.simulation.BattleSimulator;
import com.verlumen.battlesolver.simulation.SimulationContext;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wins whenever the ally army costs at most a threshold, with health {@code 100 - points / 10}.
 * More expensive armies lose against an enemy left at full health.
 */
public final class CostThresholdSimulator implements BattleSimulator {
  private final UnitValues unitValues;
  private final int threshold;
  private final AtomicInteger battles = new AtomicInteger();

  public CostThresholdSimulator(UnitValues unitValues, int threshold) {
    this.unitValues = unitValues;
    this.threshold = threshold;
  }

  public int battles() {
    return battles.get();
  }

  @Override
  public BattleResult simulate(
      SimulationContext context, Army ally, Army enemy, Duration timeout) {
    battles.incrementAndGet();
    int points = ally.points(unitValues);
    if (points <= threshold) {
      return BattleResult.create(BattleOutcome.WIN, 100 - points / 10.0, 0);
    }
    return BattleResult.create(BattleOutcome.LOSS, 0, 100);
  }
}
