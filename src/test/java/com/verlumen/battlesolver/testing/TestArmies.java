package com.verlumen.battlesolver.testing;

import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.ArmyGenerator;
import com.verlumen.battlesolver.army.Placement;
import com.verlumen.battlesolver.army.RectangularPlacementArea;
import com.verlumen.battlesolver.army.UnitType;
import com.verlumen.battlesolver.army.UnitValues;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/** Armies and generators shared by tests. */
public final class TestArmies {
  public static final UnitValues UNIT_VALUES = UnitValues.defaults();
  public static final RectangularPlacementArea AREA =
      RectangularPlacementArea.create(-400, 0, 400, 300);
  public static final ArmyGenerator GENERATOR = ArmyGenerator.create(UNIT_VALUES, AREA);

  public static final Army ENEMY =
      Army.of(
          Placement.create(UnitType.ZOMBIE_TANK, 0, -200),
          Placement.create(UnitType.ZOMBIE_BASIC_ZOMBIE, 50, -150));

  /** {@code count} archers in a row, 100 points each. */
  public static Army archers(int count) {
    return archers(count, 0);
  }

  public static Army archers(int count, double y) {
    List<Placement> placements = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      placements.add(Placement.create(UnitType.CORE_ARCHER, i * 30, y));
    }
    return Army.of(placements);
  }

  /** A random army of {@code size} random placements. */
  public static Army randomArmy(int size, Random random) {
    List<Placement> placements = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      placements.add(GENERATOR.randomPlacement(random));
    }
    return Army.of(placements);
  }

  private TestArmies() {}
}
