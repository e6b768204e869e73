package com.verlumen.battlesolver.evolution.operators;

import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.Placement;
import com.verlumen.battlesolver.army.Position;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.BiPredicate;

/**
 * Splits both parents by the line through their two centroids. Units of the first parent below
 * the line go to the first child and the rest to the second; the second parent is split the
 * opposite way. When the centroids share an x coordinate, each parent is instead split by the
 * vertical line through its own centroid.
 */
public final class SpatialCrossover extends RetryingCrossover {
  @Override
  ArmyPair recombine(Army first, Army second, Random random) {
    Position firstCenter = first.centroid();
    Position secondCenter = second.centroid();
    List<Placement> firstChild = new ArrayList<>();
    List<Placement> secondChild = new ArrayList<>();

    BiPredicate<Position, Position> belowOrLeft;
    if (firstCenter.x() == secondCenter.x()) {
      belowOrLeft = (position, ownCenter) -> position.x() < ownCenter.x();
    } else {
      double slope =
          (secondCenter.y() - firstCenter.y()) / (secondCenter.x() - firstCenter.x());
      double intercept = firstCenter.y() - slope * firstCenter.x();
      belowOrLeft = (position, ownCenter) -> position.y() < slope * position.x() + intercept;
    }

    for (Placement placement : first.placements()) {
      (belowOrLeft.test(placement.position(), firstCenter) ? firstChild : secondChild)
          .add(placement);
    }
    for (Placement placement : second.placements()) {
      (belowOrLeft.test(placement.position(), secondCenter) ? secondChild : firstChild)
          .add(placement);
    }
    return ArmyPair.of(Army.of(firstChild), Army.of(secondChild));
  }
}
