package com.verlumen.battlesolver.evolution.operators;

import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.Placement;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Cuts each parent at a random index and swaps the tails: the first child is the head of the
 * first parent plus the tail of the second, and the other way round.
 */
public final class SinglePointCrossover extends RetryingCrossover {
  @Override
  ArmyPair recombine(Army first, Army second, Random random) {
    int firstCut = random.nextInt(first.size() + 1);
    int secondCut = random.nextInt(second.size() + 1);
    List<Placement> firstChild = new ArrayList<>(first.placements().subList(0, firstCut));
    firstChild.addAll(second.placements().subList(secondCut, second.size()));
    List<Placement> secondChild = new ArrayList<>(second.placements().subList(0, secondCut));
    secondChild.addAll(first.placements().subList(firstCut, first.size()));
    return ArmyPair.of(Army.of(firstChild), Army.of(secondChild));
  }
}
