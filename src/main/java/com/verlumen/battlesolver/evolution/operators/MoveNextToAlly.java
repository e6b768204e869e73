package com.verlumen.battlesolver.evolution.operators;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.Placement;
import com.verlumen.battlesolver.army.Position;
import java.util.Random;

/**
 * Moves one random unit to a Gaussian offset around another random unit, which may be the same
 * one. The new position keeps at least {@link #MIN_DISTANCE} from the anchor.
 */
public final class MoveNextToAlly implements Mutation {
  static final double MIN_DISTANCE = 10;
  private static final int MAX_DRAWS = 1_000;

  private final double noiseScale;

  public MoveNextToAlly(double noiseScale) {
    checkArgument(noiseScale > 0, "noiseScale must be positive: %s", noiseScale);
    this.noiseScale = noiseScale;
  }

  @Override
  public Army apply(Army army, Random random) {
    Placements.checkNonEmpty(army, name());
    int moved = random.nextInt(army.size());
    Position anchor = army.get(random.nextInt(army.size())).position();
    Placement placement = army.get(moved);
    return Placements.replace(army, moved, placement.withPosition(nextTo(anchor, random)));
  }

  private Position nextTo(Position anchor, Random random) {
    for (int draw = 0; draw < MAX_DRAWS; draw++) {
      Position candidate =
          anchor.translate(random.nextGaussian() * noiseScale, random.nextGaussian() * noiseScale);
      if (candidate.distanceTo(anchor) >= MIN_DISTANCE) {
        return candidate;
      }
    }
    double angle = random.nextDouble() * 2 * Math.PI;
    return anchor.translate(MIN_DISTANCE * Math.cos(angle), MIN_DISTANCE * Math.sin(angle));
  }

  @Override
  public String toString() {
    return name() + "(noiseScale=" + noiseScale + ")";
  }
}
