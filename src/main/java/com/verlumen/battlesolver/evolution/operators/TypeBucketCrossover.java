package com.verlumen.battlesolver.evolution.operators;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;
import com.google.common.collect.Sets;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.Placement;
import com.verlumen.battlesolver.army.UnitType;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;

/**
 * Groups each parent's units by type and hands whole groups to the children. For every type
 * present in either parent a coin decides whether the groups stay with their own side or swap.
 */
public final class TypeBucketCrossover extends RetryingCrossover {
  @Override
  ArmyPair recombine(Army first, Army second, Random random) {
    ImmutableListMultimap<UnitType, Placement> firstGroups =
        Multimaps.index(first.placements(), Placement::unitType);
    ImmutableListMultimap<UnitType, Placement> secondGroups =
        Multimaps.index(second.placements(), Placement::unitType);

    List<Placement> firstChild = new ArrayList<>();
    List<Placement> secondChild = new ArrayList<>();
    EnumSet<UnitType> unitTypes = EnumSet.noneOf(UnitType.class);
    unitTypes.addAll(Sets.union(firstGroups.keySet(), secondGroups.keySet()));
    for (UnitType unitType : unitTypes) {
      if (random.nextBoolean()) {
        firstChild.addAll(firstGroups.get(unitType));
        secondChild.addAll(secondGroups.get(unitType));
      } else {
        secondChild.addAll(firstGroups.get(unitType));
        firstChild.addAll(secondGroups.get(unitType));
      }
    }
    return ArmyPair.of(Army.of(firstChild), Army.of(secondChild));
  }
}
