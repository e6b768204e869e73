package com.verlumen.battlesolver.fitness;

/** Letter grade of a solution, best first. */
public enum Grade {
  S,
  A,
  B,
  C,
  D,
  F,
  FAILED
}
