package com.verlumen.battlesolver.evolution.operators;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.Placement;
import com.verlumen.battlesolver.army.UnitType;
import com.verlumen.battlesolver.testing.TestArmies;
import java.util.Random;
import java.util.function.Supplier;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class MutationsTest {
  enum MutationKind {
    ADD_RANDOM_UNIT(() -> new AddRandomUnit(TestArmies.GENERATOR)),
    REMOVE_RANDOM_UNIT(RemoveRandomUnit::new),
    RANDOMIZE_UNIT_POSITION(() -> new RandomizeUnitPosition(TestArmies.GENERATOR)),
    RANDOMIZE_UNIT_TYPE(() -> new RandomizeUnitType(TestArmies.GENERATOR, 100)),
    PERTURB_POSITION(() -> new PerturbPosition(10)),
    REPLACE_SUBARMY(() -> new ReplaceSubarmy(TestArmies.GENERATOR)),
    MOVE_NEXT_TO_ALLY(() -> new MoveNextToAlly(20)),
    CHAIN(
        () ->
            new MutationChain(
                ImmutableList.of(new RemoveRandomUnit(), new PerturbPosition(100))));

    final Supplier<Mutation> factory;

    MutationKind(Supplier<Mutation> factory) {
      this.factory = factory;
    }
  }

  private final Random random = new Random(11);

  @Test
  public void apply_nonEmptyArmy_returnsNonEmptyArmy(@TestParameter MutationKind kind) {
    Mutation mutation = kind.factory.get();
    for (int i = 0; i < 1000; i++) {
      Army army = TestArmies.randomArmy(1 + random.nextInt(20), random);

      Army mutated = mutation.apply(army, random);

      assertThat(mutated.isEmpty()).isFalse();
    }
  }

  @Test
  public void apply_emptyArmy_throws(@TestParameter MutationKind kind) {
    Mutation mutation = kind.factory.get();

    assertThrows(IllegalArgumentException.class, () -> mutation.apply(Army.empty(), random));
  }

  @Test
  public void removeRandomUnit_singleUnit_returnsArmyUnchanged() {
    Army army = TestArmies.archers(1);

    assertThat(new RemoveRandomUnit().apply(army, random)).isEqualTo(army);
  }

  @Test
  public void removeRandomUnit_dropsExactlyOneUnit() {
    Army army = TestArmies.archers(5);

    assertThat(new RemoveRandomUnit().apply(army, random).size()).isEqualTo(4);
  }

  @Test
  public void addRandomUnit_addsExactlyOneUnit() {
    Army army = TestArmies.archers(3);

    Army mutated = new AddRandomUnit(TestArmies.GENERATOR).apply(army, random);

    assertThat(mutated.size()).isEqualTo(4);
    assertThat(mutated.placements()).containsAtLeastElementsIn(army.placements());
  }

  @Test
  public void replaceSubarmy_preservesPoints() {
    ReplaceSubarmy mutation = new ReplaceSubarmy(TestArmies.GENERATOR);
    for (int i = 0; i < 1000; i++) {
      Army army = TestArmies.randomArmy(1 + random.nextInt(20), random);

      Army mutated = mutation.apply(army, random);

      assertThat(mutated.points(TestArmies.UNIT_VALUES))
          .isEqualTo(army.points(TestArmies.UNIT_VALUES));
    }
  }

  @Test
  public void randomizeUnitType_staysWithinCostWindow() {
    RandomizeUnitType mutation = new RandomizeUnitType(TestArmies.GENERATOR, 100);
    for (int i = 0; i < 500; i++) {
      Army army = TestArmies.randomArmy(1, random);
      int before = army.points(TestArmies.UNIT_VALUES);

      int after = mutation.apply(army, random).points(TestArmies.UNIT_VALUES);

      assertThat(after).isAtMost(before);
      assertThat(after).isAtLeast(before - 100);
    }
  }

  @Test
  public void randomizeUnitType_changesType() {
    Army army = TestArmies.archers(1);

    Army mutated = new RandomizeUnitType(TestArmies.GENERATOR, 100).apply(army, random);

    assertThat(mutated.get(0).unitType()).isNotEqualTo(UnitType.CORE_ARCHER);
    assertThat(mutated.get(0).position()).isEqualTo(army.get(0).position());
  }

  @Test
  public void perturbPosition_keepsUnitTypes() {
    Army army = TestArmies.randomArmy(6, random);

    Army mutated = new PerturbPosition(10).apply(army, random);

    assertThat(mutated.category()).isEqualTo(army.category());
  }

  @Test
  public void moveNextToAlly_keepsMinimumDistanceFromAnchor() {
    Army army =
        Army.of(
            Placement.create(UnitType.CORE_ARCHER, 0, 0),
            Placement.create(UnitType.CORE_WIZARD, 200, 200));

    Army mutated = new MoveNextToAlly(1).apply(army, random);

    assertThat(mutated.category()).isEqualTo(army.category());
    assertThat(mutated.get(0).position().distanceTo(mutated.get(1).position()))
        .isAtLeast(MoveNextToAlly.MIN_DISTANCE);
  }
}
