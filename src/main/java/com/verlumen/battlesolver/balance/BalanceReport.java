package com.verlumen.battlesolver.balance;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import com.verlumen.battlesolver.army.UnitType;
import com.verlumen.battlesolver.evolution.Individual;
import com.verlumen.battlesolver.fitness.Grade;
import java.util.Arrays;
import java.util.Comparator;

/** Unit usage and grades across the best solutions of every battle, at one generation. */
@AutoValue
public abstract class BalanceReport {
  static BalanceReport create(
      int generation,
      ImmutableMap<String, Individual> bestByBattle,
      ImmutableMultiset<UnitType> bestSolutionUnitCounts,
      ImmutableMultiset<UnitType> enemyUnitCounts,
      ImmutableMultiset<Grade> gradeDistribution,
      int ungraded) {
    return new AutoValue_BalanceReport(
        generation,
        bestByBattle,
        bestSolutionUnitCounts,
        enemyUnitCounts,
        gradeDistribution,
        ungraded);
  }

  public abstract int generation();

  /** Best solution of each battle, keyed by battle id in battle order. */
  public abstract ImmutableMap<String, Individual> bestByBattle();

  /** Units placed across the best solution of every battle. */
  public abstract ImmutableMultiset<UnitType> bestSolutionUnitCounts();

  /** Units placed across the enemy armies of every battle. */
  public abstract ImmutableMultiset<UnitType> enemyUnitCounts();

  /** Grades of the best solutions of graded battles. */
  public abstract ImmutableMultiset<Grade> gradeDistribution();

  /** Battles without grades. */
  public abstract int ungraded();

  /** Every unit type, most used in best solutions first. Ties keep unit type order. */
  public ImmutableList<UnitType> unitTypesByUsage() {
    return Arrays.stream(UnitType.values())
        .sorted(
            Comparator.comparingInt((UnitType type) -> bestSolutionUnitCounts().count(type))
                .reversed())
        .collect(toImmutableList());
  }
}
