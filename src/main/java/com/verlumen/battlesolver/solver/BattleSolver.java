package com.verlumen.battlesolver.solver;

import com.verlumen.battlesolver.balance.BalanceBattle;
import com.verlumen.battlesolver.balance.BalanceOverview;

/** Searches for the cheapest army that defeats a given enemy. */
public interface BattleSolver {
  /** Evolves one population against the request's enemy. */
  SolveResult solve(SolveRequest request);

  /** Evolves several islands with periodic migration against the request's enemy. */
  SolveResult solveWithIslands(SolveRequest request);

  /**
   * Starts a balance overview that evolves one population per battle. Call {@link
   * BalanceOverview#step()} to advance it.
   */
  BalanceOverview balanceOverview(Iterable<BalanceBattle> battles);
}
