package com.verlumen.battlesolver.evolution.operators;

import com.google.common.collect.ImmutableList;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.ArmyGenerator;
import com.verlumen.battlesolver.army.Placement;
import com.verlumen.battlesolver.army.UnitValues;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Discards a random share of the army and spends the freed points on a fresh random sub-army, so
 * the result always costs exactly as much as the input.
 *
 * <p>When no random fill hits the freed budget exactly, the discarded unit types are redeployed
 * at new random positions instead.
 */
public final class ReplaceSubarmy implements Mutation {
  private final ArmyGenerator generator;

  public ReplaceSubarmy(ArmyGenerator generator) {
    this.generator = generator;
  }

  @Override
  public Army apply(Army army, Random random) {
    Placements.checkNonEmpty(army, name());
    List<Placement> shuffled = new ArrayList<>(army.placements());
    Collections.shuffle(shuffled, random);
    int keep = random.nextInt(shuffled.size());
    List<Placement> kept = shuffled.subList(0, keep);
    List<Placement> discarded = shuffled.subList(keep, shuffled.size());

    UnitValues unitValues = generator.unitValues();
    int freedPoints = 0;
    for (Placement placement : discarded) {
      freedPoints += unitValues.valueOf(placement.unitType());
    }

    ImmutableList<Placement> replacement =
        generator
            .exactArmy(freedPoints, random)
            .filter(subArmy -> !subArmy.isEmpty() || !kept.isEmpty())
            .orElseGet(() -> redeploy(discarded, random));

    List<Placement> result = new ArrayList<>(kept);
    result.addAll(replacement);
    return Army.of(result);
  }

  private ImmutableList<Placement> redeploy(List<Placement> discarded, Random random) {
    ImmutableList.Builder<Placement> redeployed = ImmutableList.builder();
    for (Placement placement : discarded) {
      redeployed.add(placement.withPosition(generator.randomPosition(random)));
    }
    return redeployed.build();
  }

  @Override
  public String toString() {
    return name();
  }
}
