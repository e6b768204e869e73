package com.verlumen.battlesolver.solver;

import com.google.common.collect.ImmutableList;
import com.verlumen.battlesolver.army.ArmyGenerator;
import com.verlumen.battlesolver.evolution.Selector;
import com.verlumen.battlesolver.evolution.TournamentSelector;
import com.verlumen.battlesolver.evolution.UniformSelector;
import com.verlumen.battlesolver.evolution.operators.AddRandomUnit;
import com.verlumen.battlesolver.evolution.operators.MoveNextToAlly;
import com.verlumen.battlesolver.evolution.operators.Mutation;
import com.verlumen.battlesolver.evolution.operators.PerturbPosition;
import com.verlumen.battlesolver.evolution.operators.RandomizeUnitPosition;
import com.verlumen.battlesolver.evolution.operators.RandomizeUnitType;
import com.verlumen.battlesolver.evolution.operators.RemoveRandomUnit;
import com.verlumen.battlesolver.evolution.operators.ReplaceSubarmy;

/** The operator set every search starts from. */
final class StandardOperators {
  /** Fresh mutation instances for one strategy. */
  static ImmutableList<Mutation> mutations(
      ArmyGenerator generator, int maxDecrease, boolean allowUnitAddition) {
    ImmutableList.Builder<Mutation> mutations =
        ImmutableList.<Mutation>builder()
            .add(new RemoveRandomUnit())
            .add(new PerturbPosition(SearchConstants.SMALL_POSITION_NOISE))
            .add(new PerturbPosition(SearchConstants.LARGE_POSITION_NOISE))
            .add(new RandomizeUnitPosition(generator))
            .add(new ReplaceSubarmy(generator))
            .add(new RandomizeUnitType(generator, maxDecrease))
            .add(new MoveNextToAlly(SearchConstants.ALLY_POSITION_NOISE));
    if (allowUnitAddition) {
      mutations.add(new AddRandomUnit(generator));
    }
    return mutations.build();
  }

  static Selector selector(int tournamentSize) {
    return tournamentSize > 1 ? new TournamentSelector(tournamentSize) : new UniformSelector();
  }

  private StandardOperators() {}
}
