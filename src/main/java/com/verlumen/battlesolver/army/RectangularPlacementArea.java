package com.verlumen.battlesolver.army;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.util.Random;

/** Axis-aligned placement region, bounds inclusive. */
@AutoValue
public abstract class RectangularPlacementArea implements PlacementArea {
  public static RectangularPlacementArea create(double minX, double minY, double maxX, double maxY) {
    checkArgument(minX <= maxX, "minX %s > maxX %s", minX, maxX);
    checkArgument(minY <= maxY, "minY %s > maxY %s", minY, maxY);
    return new AutoValue_RectangularPlacementArea(minX, minY, maxX, maxY);
  }

  public abstract double minX();

  public abstract double minY();

  public abstract double maxX();

  public abstract double maxY();

  @Override
  public boolean contains(Position position) {
    return position.x() >= minX()
        && position.x() <= maxX()
        && position.y() >= minY()
        && position.y() <= maxY();
  }

  @Override
  public Position randomPosition(Random random) {
    return Position.create(
        minX() + random.nextDouble() * (maxX() - minX()),
        minY() + random.nextDouble() * (maxY() - minY()));
  }
}
