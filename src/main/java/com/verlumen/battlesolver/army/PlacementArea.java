package com.verlumen.battlesolver.army;

import java.util.Random;

/** The region of the battlefield where the searching side may place its units. */
public interface PlacementArea {
  boolean contains(Position position);

  /** Draws a position uniformly from the legal region. */
  Position randomPosition(Random random);
}
