package com.verlumen.battlesolver.army;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.Streams;
import java.util.Arrays;
import java.util.Comparator;

/**
 * A candidate army: the placements of every unit, kept sorted so that two armies built from the
 * same placements in any order are equal and hash alike.
 */
@AutoValue
public abstract class Army {
  private static final Army EMPTY = new AutoValue_Army(ImmutableList.of());

  public static Army of(Iterable<Placement> placements) {
    return new AutoValue_Army(
        Streams.stream(placements).sorted().collect(toImmutableList()));
  }

  public static Army of(Placement... placements) {
    return of(Arrays.asList(placements));
  }

  public static Army empty() {
    return EMPTY;
  }

  /** Placements in canonical order. */
  public abstract ImmutableList<Placement> placements();

  public int size() {
    return placements().size();
  }

  public boolean isEmpty() {
    return placements().isEmpty();
  }

  public Placement get(int index) {
    return placements().get(index);
  }

  /**
   * The composition shape of this army: how many units of each type it holds, regardless of
   * where they stand.
   */
  @Memoized
  public ImmutableSortedMultiset<UnitType> category() {
    return placements().stream()
        .map(Placement::unitType)
        .collect(ImmutableSortedMultiset.toImmutableSortedMultiset(Comparator.naturalOrder()));
  }

  /** Renders the category, e.g. {@code "2 CORE_ARCHER, 1 CORE_WIZARD"}. */
  public String shortDescription() {
    return Joiner.on(", ")
        .join(
            category().entrySet().stream()
                .map(entry -> entry.getCount() + " " + entry.getElement())
                .iterator());
  }

  public int points(UnitValues unitValues) {
    int total = 0;
    for (Multiset.Entry<UnitType> entry : category().entrySet()) {
      total += unitValues.valueOf(entry.getElement()) * entry.getCount();
    }
    return total;
  }

  /** Mean position of all units. Only defined for non-empty armies. */
  public Position centroid() {
    if (isEmpty()) {
      throw new IllegalStateException("Empty army has no centroid");
    }
    double x = 0;
    double y = 0;
    for (Placement placement : placements()) {
      x += placement.position().x();
      y += placement.position().y();
    }
    return Position.create(x / size(), y / size());
  }

  @Override
  public final String toString() {
    return "Army{" + shortDescription() + " " + placements() + "}";
  }
}
