package com.verlumen.battlesolver.evolution;

import static io.jenetics.stat.DoubleMoments.toDoubleMoments;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMultiset;
import com.verlumen.battlesolver.army.Placement;
import com.verlumen.battlesolver.army.UnitType;
import com.verlumen.battlesolver.fitness.BattleOutcome;
import io.jenetics.stat.DoubleMoments;

/** Outcome counts and unit-type makeup of an evaluated population. */
@AutoValue
public abstract class PopulationSummary {
  static PopulationSummary of(Population population) {
    ImmutableMultiset<BattleOutcome> outcomes =
        population.individuals().stream()
            .map(individual -> individual.fitness().outcome())
            .collect(ImmutableMultiset.toImmutableMultiset());
    DoubleMoments winningPoints =
        population.individuals().stream()
            .filter(individual -> individual.fitness().isWin())
            .collect(toDoubleMoments(individual -> individual.fitness().points()));
    DoubleMoments losingEnemyHealth =
        population.individuals().stream()
            .filter(individual -> !individual.fitness().isWin())
            .collect(toDoubleMoments(individual -> individual.fitness().enemyHealth()));
    ImmutableMultiset<UnitType> unitCounts =
        population.individuals().stream()
            .flatMap(individual -> individual.army().placements().stream())
            .map(Placement::unitType)
            .collect(ImmutableMultiset.toImmutableMultiset());
    return new AutoValue_PopulationSummary(
        population.size(),
        outcomes.count(BattleOutcome.WIN),
        outcomes.count(BattleOutcome.LOSS),
        outcomes.count(BattleOutcome.TIMEOUT),
        winningPoints,
        losingEnemyHealth,
        unitCounts);
  }

  public abstract int size();

  public abstract int wins();

  public abstract int losses();

  public abstract int timeouts();

  /** Point cost moments over winning individuals. Count is zero when nothing wins. */
  public abstract DoubleMoments winningPoints();

  /** Remaining enemy health moments over individuals that did not win. */
  public abstract DoubleMoments losingEnemyHealth();

  /** How many units of each type appear across the whole population. */
  public abstract ImmutableMultiset<UnitType> unitCounts();
}
