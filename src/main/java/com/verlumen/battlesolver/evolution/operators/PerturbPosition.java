package com.verlumen.battlesolver.evolution.operators;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.Placement;
import java.util.Random;

/** Jitters the position of one random unit with independent Gaussian noise on each axis. */
public final class PerturbPosition implements Mutation {
  private final double noiseScale;

  public PerturbPosition(double noiseScale) {
    checkArgument(noiseScale > 0, "noiseScale must be positive: %s", noiseScale);
    this.noiseScale = noiseScale;
  }

  @Override
  public Army apply(Army army, Random random) {
    Placements.checkNonEmpty(army, name());
    int index = random.nextInt(army.size());
    Placement placement = army.get(index);
    return Placements.replace(
        army,
        index,
        placement.withPosition(
            placement
                .position()
                .translate(random.nextGaussian() * noiseScale, random.nextGaussian() * noiseScale)));
  }

  @Override
  public String toString() {
    return name() + "(noiseScale=" + noiseScale + ")";
  }
}
