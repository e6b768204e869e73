package com.verlumen.battlesolver.solver;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.inject.Provider;
import java.time.Duration;
import java.util.Optional;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/** Builds a {@link SearchConfig} from command-line style arguments. */
@AutoValue
public abstract class SearchConfigArguments implements Provider<SearchConfig> {
  public static SearchConfigArguments create(ImmutableList<String> args) {
    return new AutoValue_SearchConfigArguments(args);
  }

  abstract ImmutableList<String> args();

  /**
   * Parses the arguments.
   *
   * @throws IllegalArgumentException if the arguments cannot be parsed or describe an invalid
   *     configuration
   */
  @Override
  public SearchConfig get() {
    Namespace namespace;
    try {
      namespace = createParser().parseArgs(args().toArray(new String[0]));
    } catch (ArgumentParserException e) {
      throw new IllegalArgumentException("Unable to parse arguments.", e);
    }
    SearchConfig.Builder config =
        SearchConfig.builder()
            .setParentsPerGeneration(namespace.getInt("parentsPerGeneration"))
            .setChildrenPerGeneration(namespace.getInt("childrenPerGeneration"))
            .setCategoryCap(namespace.getInt("categoryCap"))
            .setAdaptationRate(namespace.getDouble("adaptationRate"))
            .setMutationsPerChild(namespace.getInt("mutationsPerChild"))
            .setCrossoverRate(namespace.getDouble("crossoverRate"))
            .setTournamentSize(namespace.getInt("tournamentSize"))
            .setGenerations(namespace.getInt("generations"))
            .setEarlyStoppingGenerations(namespace.getInt("earlyStoppingGenerations"))
            .setWorkers(namespace.getInt("workers"))
            .setBattleTimeout(Duration.ofSeconds(namespace.getInt("battleTimeoutSeconds")))
            .setIslands(namespace.getInt("islands"))
            .setEpochs(namespace.getInt("epochs"))
            .setGenerationsPerEpoch(namespace.getInt("generationsPerEpoch"));

    int optimizationTimeoutSeconds = namespace.getInt("optimizationTimeoutSeconds");
    if (optimizationTimeoutSeconds > 0) {
      config.setOptimizationTimeout(Duration.ofSeconds(optimizationTimeoutSeconds));
    } else {
      config.setOptimizationTimeout(Optional.empty());
    }
    Long seed = namespace.getLong("seed");
    if (seed != null) {
      config.setSeed(seed);
    }
    return config.build();
  }

  private static ArgumentParser createParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("BattleSolver")
            .build()
            .defaultHelp(true)
            .description("Settings for the evolutionary army search");

    // Strategy
    parser
        .addArgument("--parentsPerGeneration")
        .type(Integer.class)
        .setDefault(SearchConstants.DEFAULT_PARENTS_PER_GENERATION)
        .help("Individuals kept after each generation");
    parser
        .addArgument("--childrenPerGeneration")
        .type(Integer.class)
        .setDefault(SearchConstants.DEFAULT_CHILDREN_PER_GENERATION)
        .help("Distinct children bred per generation");
    parser
        .addArgument("--categoryCap")
        .type(Integer.class)
        .setDefault(0)
        .help("Most survivors sharing one unit composition, 0 for no limit");
    parser
        .addArgument("--adaptationRate")
        .type(Double.class)
        .setDefault(SearchConstants.DEFAULT_ADAPTATION_RATE)
        .help("How fast mutation weights follow their success rates");
    parser
        .addArgument("--mutationsPerChild")
        .type(Integer.class)
        .setDefault(SearchConstants.DEFAULT_MUTATIONS_PER_CHILD)
        .help("Mutations applied to produce one child");
    parser
        .addArgument("--crossoverRate")
        .type(Double.class)
        .setDefault(SearchConstants.DEFAULT_CROSSOVER_RATE)
        .help("Probability of recombining two parents before mutation");
    parser
        .addArgument("--tournamentSize")
        .type(Integer.class)
        .setDefault(1)
        .help("Parent selection tournament size, 1 for uniform selection");

    // Run control
    parser
        .addArgument("--generations")
        .type(Integer.class)
        .setDefault(SearchConstants.DEFAULT_GENERATIONS)
        .help("Generations of a single-population search");
    parser
        .addArgument("--earlyStoppingGenerations")
        .type(Integer.class)
        .setDefault(SearchConstants.DEFAULT_EARLY_STOPPING_GENERATIONS)
        .help("Stop after this many generations without improvement, 0 to disable");
    parser
        .addArgument("--workers")
        .type(Integer.class)
        .setDefault(Runtime.getRuntime().availableProcessors())
        .help("Evaluation workers");
    parser
        .addArgument("--battleTimeoutSeconds")
        .type(Integer.class)
        .setDefault(SearchConstants.DEFAULT_BATTLE_TIMEOUT_SECONDS)
        .help("Simulated seconds before a battle counts as a timeout");
    parser
        .addArgument("--optimizationTimeoutSeconds")
        .type(Integer.class)
        .setDefault(SearchConstants.DEFAULT_OPTIMIZATION_TIMEOUT_SECONDS)
        .help("Wall-clock budget of one search, 0 for none");
    parser
        .addArgument("--seed")
        .type(Long.class)
        .help("Random seed; unseeded when absent");

    // Islands
    parser
        .addArgument("--islands")
        .type(Integer.class)
        .setDefault(SearchConstants.DEFAULT_ISLANDS)
        .help("Islands of an island search");
    parser
        .addArgument("--epochs")
        .type(Integer.class)
        .setDefault(SearchConstants.DEFAULT_EPOCHS)
        .help("Migration rounds of an island search");
    parser
        .addArgument("--generationsPerEpoch")
        .type(Integer.class)
        .setDefault(SearchConstants.DEFAULT_GENERATIONS_PER_EPOCH)
        .help("Generations each island runs between migrations");

    return parser;
  }
}
