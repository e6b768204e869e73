package com.verlumen.battlesolver.army;

import com.google.auto.value.AutoValue;
import java.util.Comparator;

/** One unit of a given type standing at a given position. */
@AutoValue
public abstract class Placement implements Comparable<Placement> {
  private static final Comparator<Placement> ORDER =
      Comparator.comparing(Placement::unitType).thenComparing(Placement::position);

  public static Placement create(UnitType unitType, Position position) {
    return new AutoValue_Placement(unitType, position);
  }

  public static Placement create(UnitType unitType, double x, double y) {
    return create(unitType, Position.create(x, y));
  }

  public abstract UnitType unitType();

  public abstract Position position();

  public Placement withPosition(Position position) {
    return create(unitType(), position);
  }

  public Placement withUnitType(UnitType unitType) {
    return create(unitType, position());
  }

  @Override
  public int compareTo(Placement other) {
    return ORDER.compare(this, other);
  }
}
