package com.verlumen.battlesolver.army;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;

/**
 * Point cost of each unit type. The table belongs to the game, not to the search engine; it is
 * supplied alongside the battle simulator.
 */
public interface UnitValues {
  /**
   * Returns the point cost of one unit of the given type.
   *
   * @throws IllegalArgumentException if the table has no cost for the type
   */
  int valueOf(UnitType unitType);

  /** Unit types this table prices, in declaration order. */
  ImmutableSet<UnitType> unitTypes();

  static UnitValues of(Map<UnitType, Integer> values) {
    ImmutableMap<UnitType, Integer> table = ImmutableMap.copyOf(values);
    table.forEach(
        (unitType, value) ->
            checkArgument(value >= 0, "Negative cost %s for %s", value, unitType));
    return new UnitValues() {
      @Override
      public int valueOf(UnitType unitType) {
        Integer value = table.get(unitType);
        checkArgument(value != null, "No point value for unit type %s", unitType);
        return value;
      }

      @Override
      public ImmutableSet<UnitType> unitTypes() {
        return table.keySet();
      }

      @Override
      public String toString() {
        return "UnitValues" + table;
      }
    };
  }

  /** The game's stock cost table. */
  static UnitValues defaults() {
    return of(
        ImmutableMap.<UnitType, Integer>builder()
            .put(UnitType.CORE_ARCHER, 100)
            .put(UnitType.CORE_BARBARIAN, 300)
            .put(UnitType.CORE_CAVALRY, 100)
            .put(UnitType.CORE_DUELIST, 200)
            .put(UnitType.CORE_SWORDSMAN, 100)
            .put(UnitType.CORE_WIZARD, 300)
            .put(UnitType.CRUSADER_BANNER_BEARER, 100)
            .put(UnitType.CRUSADER_BLACK_KNIGHT, 300)
            .put(UnitType.CRUSADER_CATAPULT, 300)
            .put(UnitType.CRUSADER_CLERIC, 200)
            .put(UnitType.CRUSADER_COMMANDER, 200)
            .put(UnitType.CRUSADER_CROSSBOWMAN, 200)
            .put(UnitType.CRUSADER_DEFENDER, 100)
            .put(UnitType.CRUSADER_GOLD_KNIGHT, 300)
            .put(UnitType.CRUSADER_GUARDIAN_ANGEL, 100)
            .put(UnitType.CRUSADER_LONGBOWMAN, 200)
            .put(UnitType.CRUSADER_PALADIN, 300)
            .put(UnitType.CRUSADER_PIKEMAN, 100)
            .put(UnitType.CRUSADER_RED_KNIGHT, 200)
            .put(UnitType.CRUSADER_SOLDIER, 150)
            .put(UnitType.WEREBEAR, 100)
            .put(UnitType.ZOMBIE_BASIC_ZOMBIE, 50)
            .put(UnitType.ZOMBIE_JUMPER, 200)
            .put(UnitType.ZOMBIE_SPITTER, 200)
            .put(UnitType.ZOMBIE_TANK, 300)
            .buildOrThrow());
  }
}
