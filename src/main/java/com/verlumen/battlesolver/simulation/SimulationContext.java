package com.verlumen.battlesolver.simulation;

/**
 * Isolated simulation state owned by a single evaluation worker. A context is never shared
 * between threads; each worker opens its own and closes it when its batch is done.
 */
public interface SimulationContext extends AutoCloseable {
  /** A context for simulators that keep no per-worker state. */
  SimulationContext STATELESS = () -> {};

  @Override
  void close();
}
