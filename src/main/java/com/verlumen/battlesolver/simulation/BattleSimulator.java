package com.verlumen.battlesolver.simulation;

import com.verlumen.battlesolver.army.Army;
import java.time.Duration;

/**
 * The battle simulator the search engine consults but does not implement.
 *
 * <p>Implementations must tolerate concurrent calls as long as each call receives a context
 * obtained from {@link #newContext()} by the calling worker. Results are expected to be
 * deterministic, or close to it, for identical inputs; nothing here enforces that.
 */
@FunctionalInterface
public interface BattleSimulator {
  /**
   * Runs one battle.
   *
   * @param context worker-private simulation state
   * @param ally the army being searched for
   * @param enemy the fixed opposing army
   * @param timeout simulated time after which the battle counts as a timeout
   */
  BattleResult simulate(SimulationContext context, Army ally, Army enemy, Duration timeout);

  /** Opens fresh simulation state for one worker. */
  default SimulationContext newContext() {
    return SimulationContext.STATELESS;
  }
}
