package com.verlumen.battlesolver.evolution.operators;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.battlesolver.army.Army;
import java.util.Random;

/** Applies several mutations one after another. */
public final class MutationChain implements Mutation {
  private final ImmutableList<Mutation> mutations;

  public MutationChain(Iterable<? extends Mutation> mutations) {
    this.mutations = ImmutableList.copyOf(mutations);
    checkArgument(!this.mutations.isEmpty(), "MutationChain needs at least one mutation");
  }

  @Override
  public Army apply(Army army, Random random) {
    Army result = army;
    for (Mutation mutation : mutations) {
      result = mutation.apply(result, random);
    }
    return result;
  }

  @Override
  public String toString() {
    return name() + mutations;
  }
}
