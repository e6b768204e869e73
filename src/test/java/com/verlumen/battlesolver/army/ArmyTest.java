package com.verlumen.battlesolver.army;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.verlumen.battlesolver.testing.TestArmies;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ArmyTest {
  private static final Placement ARCHER = Placement.create(UnitType.CORE_ARCHER, 10, 20);
  private static final Placement WIZARD = Placement.create(UnitType.CORE_WIZARD, -5, 40);
  private static final Placement SECOND_ARCHER = Placement.create(UnitType.CORE_ARCHER, 30, 20);

  @Test
  public void of_permutedPlacements_areEqual() {
    Random random = new Random(7);
    for (int trial = 0; trial < 100; trial++) {
      List<Placement> placements = new ArrayList<>(TestArmies.randomArmy(8, random).placements());
      List<Placement> shuffled = new ArrayList<>(placements);
      Collections.shuffle(shuffled, random);

      Army army = Army.of(placements);
      Army permuted = Army.of(shuffled);

      assertThat(permuted).isEqualTo(army);
      assertThat(permuted.hashCode()).isEqualTo(army.hashCode());
      assertThat(permuted.placements()).containsExactlyElementsIn(army.placements()).inOrder();
    }
  }

  @Test
  public void of_differentPositions_areNotEqual() {
    Army army = Army.of(ARCHER, WIZARD);
    Army moved = Army.of(ARCHER, WIZARD.withPosition(Position.create(0, 0)));

    assertThat(moved).isNotEqualTo(army);
    assertThat(moved.category()).isEqualTo(army.category());
  }

  @Test
  public void shortDescription_countsUnitsByType() {
    Army army = Army.of(WIZARD, ARCHER, SECOND_ARCHER);

    assertThat(army.shortDescription()).isEqualTo("2 CORE_ARCHER, 1 CORE_WIZARD");
  }

  @Test
  public void points_sumsUnitValues() {
    Army army = Army.of(WIZARD, ARCHER, SECOND_ARCHER);

    assertThat(army.points(UnitValues.defaults())).isEqualTo(500);
  }

  @Test
  public void points_unknownUnitType_throws() {
    UnitValues archersOnly = UnitValues.of(ImmutableMap.of(UnitType.CORE_ARCHER, 100));

    assertThrows(IllegalArgumentException.class, () -> Army.of(WIZARD).points(archersOnly));
  }

  @Test
  public void centroid_averagesPositions() {
    Position centroid = Army.of(ARCHER, SECOND_ARCHER).centroid();

    assertThat(centroid).isEqualTo(Position.create(20, 20));
  }

  @Test
  public void centroid_emptyArmy_throws() {
    assertThrows(IllegalStateException.class, () -> Army.empty().centroid());
  }
}
