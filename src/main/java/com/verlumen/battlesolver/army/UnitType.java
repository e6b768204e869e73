package com.verlumen.battlesolver.army;

/** Unit roster available to armies. Point costs live in {@link UnitValues}, not here. */
public enum UnitType {
  CORE_ARCHER,
  CORE_BARBARIAN,
  CORE_CAVALRY,
  CORE_DUELIST,
  CORE_SWORDSMAN,
  CORE_WIZARD,
  CRUSADER_BANNER_BEARER,
  CRUSADER_BLACK_KNIGHT,
  CRUSADER_CATAPULT,
  CRUSADER_CLERIC,
  CRUSADER_COMMANDER,
  CRUSADER_CROSSBOWMAN,
  CRUSADER_DEFENDER,
  CRUSADER_GOLD_KNIGHT,
  CRUSADER_GUARDIAN_ANGEL,
  CRUSADER_LONGBOWMAN,
  CRUSADER_PALADIN,
  CRUSADER_PIKEMAN,
  CRUSADER_RED_KNIGHT,
  CRUSADER_SOLDIER,
  WEREBEAR,
  ZOMBIE_BASIC_ZOMBIE,
  ZOMBIE_JUMPER,
  ZOMBIE_SPITTER,
  ZOMBIE_TANK
}
