package com.verlumen.battlesolver.balance;

import static com.google.common.base.Preconditions.checkNotNull;

import com.verlumen.battlesolver.army.Army;

/**
 * An army with an Elo rating and its match record. Ratings change only on the thread running
 * {@link EloEvolution#evolve}, after all matches of a generation have been simulated.
 */
public final class RatedArmy {
  static final double INITIAL_RATING = 1000.0;

  private final Army army;
  private double rating;
  private int wins;
  private int losses;
  private int draws;

  RatedArmy(Army army, double rating) {
    this.army = checkNotNull(army, "army");
    this.rating = rating;
  }

  public static RatedArmy create(Army army) {
    return new RatedArmy(army, INITIAL_RATING);
  }

  public Army army() {
    return army;
  }

  public double rating() {
    return rating;
  }

  public int wins() {
    return wins;
  }

  public int losses() {
    return losses;
  }

  public int draws() {
    return draws;
  }

  public int matchesPlayed() {
    return wins + losses + draws;
  }

  /** Records one match with the given score (1 win, 0 loss, 0.5 draw) and rating change. */
  void record(double score, double ratingChange) {
    if (score == 1.0) {
      wins++;
    } else if (score == 0.0) {
      losses++;
    } else {
      draws++;
    }
    rating += ratingChange;
  }

  @Override
  public String toString() {
    return String.format(
        "%s (rating %.1f, W/L/D %d/%d/%d)",
        army.shortDescription(), rating, wins, losses, draws);
  }
}
