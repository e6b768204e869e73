package com.verlumen.battlesolver.army;

import com.google.auto.value.AutoValue;
import java.util.Comparator;

/** A point on the battlefield. */
@AutoValue
public abstract class Position implements Comparable<Position> {
  private static final Comparator<Position> ORDER =
      Comparator.comparingDouble(Position::x).thenComparingDouble(Position::y);

  public static Position create(double x, double y) {
    return new AutoValue_Position(x, y);
  }

  public abstract double x();

  public abstract double y();

  public double distanceTo(Position other) {
    return Math.hypot(x() - other.x(), y() - other.y());
  }

  public Position translate(double dx, double dy) {
    return create(x() + dx, y() + dy);
  }

  @Override
  public int compareTo(Position other) {
    return ORDER.compare(this, other);
  }
}
