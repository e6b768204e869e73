package com.verlumen.battlesolver.evolution;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMultiset;
import com.google.common.collect.Multiset;
import com.google.common.flogger.FluentLogger;
import com.verlumen.battlesolver.army.Army;
import com.verlumen.battlesolver.army.UnitType;
import com.verlumen.battlesolver.army.UnitValues;
import com.verlumen.battlesolver.evolution.operators.Crossover;
import com.verlumen.battlesolver.evolution.operators.Mutation;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Self-adaptive (μ+λ) evolution against a fixed enemy army.
 *
 * <p>Each call to {@link #evolve} breeds distinct children from uniformly or otherwise selected
 * parents using mutations drawn by weight, evaluates parents and children together, keeps the
 * fittest under a per-composition cap, and finally rescales the mutation weights by their
 * success in this generation. The strategy has no terminal state; callers decide how many
 * generations to run.
 *
 * <p>Not thread-safe. One instance belongs to one search, or one island.
 */
public final class EvolutionStrategy {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Breeding draws allowed per missing slot before a generation gives up on filling up. */
  static final int MAX_DRAWS_PER_SLOT = 100;

  private final EvolutionParameters parameters;
  private final MutationRates mutationRates;
  private final Optional<Crossover> crossover;
  private final Selector selector;
  private final PopulationEvaluator evaluator;
  private final Army enemy;
  private final UnitValues unitValues;
  private final Random random;
  private int generation;

  private EvolutionStrategy(Builder builder) {
    this.parameters = checkNotNull(builder.parameters, "parameters");
    this.mutationRates = new MutationRates(builder.mutations.build());
    this.crossover = Optional.ofNullable(builder.crossover);
    this.selector = builder.selector;
    this.evaluator = checkNotNull(builder.evaluator, "evaluator");
    this.enemy = checkNotNull(builder.enemy, "enemy");
    this.unitValues = checkNotNull(builder.unitValues, "unitValues");
    this.random = builder.random;
    checkArgument(
        parameters.crossoverRate() == 0 || crossover.isPresent(),
        "crossoverRate %s requires a crossover",
        parameters.crossoverRate());
  }

  public static Builder builder() {
    return new Builder();
  }

  public EvolutionParameters parameters() {
    return parameters;
  }

  public MutationRates mutationRates() {
    return mutationRates;
  }

  public Army enemy() {
    return enemy;
  }

  /** Number of completed calls to {@link #evolve}. */
  public int generation() {
    return generation;
  }

  /** Evaluates any unevaluated member of {@code population} against this strategy's enemy. */
  public Population evaluate(Population population) {
    return population.evaluate(enemy, evaluator, parameters.workerCount());
  }

  /**
   * Produces the next generation from {@code population}.
   *
   * @throws IllegalStateException if an operator returns an empty army
   * @throws EvaluationException if the simulator fails
   */
  public Population evolve(Population population) {
    checkArgument(!population.isEmpty(), "Cannot evolve an empty population");
    evaluate(population);

    List<Trial> trials = new ArrayList<>();
    Set<Individual> candidates = breed(population, trials);
    Population combined = evaluate(Population.of(candidates));
    Population next = select(combined);
    adaptRates(trials);

    generation++;
    logger.atFine().log(
        "Generation %d: %d candidates, %d selected, best %s, rates %s",
        generation,
        combined.size(),
        next.size(),
        lazy(next::best),
        mutationRates);
    return next;
  }

  private Set<Individual> breed(Population population, List<Trial> trials) {
    int target = parameters.parentsPerGeneration() + parameters.childrenPerGeneration();
    Set<Individual> candidates = new LinkedHashSet<>(population.individuals());
    int maxDraws = target * MAX_DRAWS_PER_SLOT;
    for (int draw = 0; draw < maxDraws && candidates.size() < target; draw++) {
      Individual parent = selector.select(population, random);
      Army army = parent.army();
      if (crossover.isPresent() && random.nextDouble() < parameters.crossoverRate()) {
        Individual mate = selector.select(population, random);
        army = crossover.get().apply(army, mate.army(), random).first();
        checkOperatorResult(army, crossover.get().name(), parent.army());
      }
      ImmutableList<Mutation> applied =
          mutationRates.choose(parameters.mutationsPerChild(), random);
      for (Mutation mutation : applied) {
        Army before = army;
        army = mutation.apply(before, random);
        checkOperatorResult(army, mutation.name(), before);
      }
      Individual child = Individual.create(army, unitValues);
      if (candidates.add(child)) {
        for (Mutation mutation : applied) {
          trials.add(new Trial(mutation, parent, child));
        }
      }
    }
    if (candidates.size() < target) {
      logger.atWarning().log(
          "Only %d of %d candidates after %d draws; continuing with a smaller generation",
          candidates.size(),
          target,
          maxDraws);
    }
    return candidates;
  }

  private Population select(Population combined) {
    List<Individual> selected = new ArrayList<>();
    Multiset<ImmutableSortedMultiset<UnitType>> categoryCounts = HashMultiset.create();
    for (Individual individual : combined.sortedByFitness()) {
      if (categoryCounts.count(individual.category()) < parameters.categoryCap()) {
        selected.add(individual);
        categoryCounts.add(individual.category());
        if (selected.size() >= parameters.parentsPerGeneration()) {
          break;
        }
      }
    }
    return Population.of(selected);
  }

  private void adaptRates(List<Trial> trials) {
    Multiset<Mutation> successes = HashMultiset.create();
    Multiset<Mutation> counts = HashMultiset.create();
    for (Trial trial : trials) {
      counts.add(trial.mutation());
      if (trial.child().fitness().isBetterThan(trial.parent().fitness())) {
        successes.add(trial.mutation());
      }
    }
    mutationRates.adapt(successes, counts, parameters.adaptationRate());
  }

  private static void checkOperatorResult(Army result, String operator, Army input) {
    checkState(
        result != null && !result.isEmpty(),
        "%s produced an empty army from %s",
        operator,
        input);
  }

  private record Trial(Mutation mutation, Individual parent, Individual child) {}

  /** Assembles an {@link EvolutionStrategy}. */
  public static final class Builder {
    private EvolutionParameters parameters;
    private final ImmutableList.Builder<Mutation> mutations = ImmutableList.builder();
    private Crossover crossover;
    private Selector selector = new UniformSelector();
    private PopulationEvaluator evaluator;
    private Army enemy;
    private UnitValues unitValues;
    private Random random = new Random();

    private Builder() {}

    public Builder setParameters(EvolutionParameters parameters) {
      this.parameters = parameters;
      return this;
    }

    public Builder addMutation(Mutation mutation) {
      mutations.add(mutation);
      return this;
    }

    public Builder addMutations(Iterable<? extends Mutation> mutations) {
      this.mutations.addAll(mutations);
      return this;
    }

    public Builder setCrossover(Crossover crossover) {
      this.crossover = crossover;
      return this;
    }

    public Builder setSelector(Selector selector) {
      this.selector = checkNotNull(selector);
      return this;
    }

    public Builder setEvaluator(PopulationEvaluator evaluator) {
      this.evaluator = evaluator;
      return this;
    }

    public Builder setEnemy(Army enemy) {
      this.enemy = enemy;
      return this;
    }

    public Builder setUnitValues(UnitValues unitValues) {
      this.unitValues = unitValues;
      return this;
    }

    public Builder setRandom(Random random) {
      this.random = checkNotNull(random);
      return this;
    }

    public EvolutionStrategy build() {
      return new EvolutionStrategy(this);
    }
  }
}
