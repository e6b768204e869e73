package com.verlumen.battlesolver.solver;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SearchConfigArgumentsTest {
  @Test
  public void get_noArguments_usesDefaults() {
    SearchConfig config = SearchConfigArguments.create(ImmutableList.of()).get();

    assertThat(config.parentsPerGeneration())
        .isEqualTo(SearchConstants.DEFAULT_PARENTS_PER_GENERATION);
    assertThat(config.childrenPerGeneration())
        .isEqualTo(SearchConstants.DEFAULT_CHILDREN_PER_GENERATION);
    assertThat(config.adaptationRate()).isEqualTo(SearchConstants.DEFAULT_ADAPTATION_RATE);
    assertThat(config.battleTimeout()).isEqualTo(Duration.ofSeconds(120));
    assertThat(config.optimizationTimeout()).hasValue(Duration.ofSeconds(600));
    assertThat(config.seed()).isEmpty();
  }

  @Test
  public void get_parsesEveryFlag() {
    SearchConfig config =
        SearchConfigArguments.create(
                ImmutableList.of(
                    "--parentsPerGeneration", "30",
                    "--childrenPerGeneration", "40",
                    "--categoryCap", "3",
                    "--adaptationRate", "0.25",
                    "--mutationsPerChild", "2",
                    "--crossoverRate", "0.5",
                    "--tournamentSize", "4",
                    "--generations", "250",
                    "--earlyStoppingGenerations", "5",
                    "--workers", "6",
                    "--battleTimeoutSeconds", "90",
                    "--optimizationTimeoutSeconds", "0",
                    "--islands", "3",
                    "--epochs", "7",
                    "--generationsPerEpoch", "11",
                    "--seed", "1234"))
            .get();

    assertThat(config.parentsPerGeneration()).isEqualTo(30);
    assertThat(config.childrenPerGeneration()).isEqualTo(40);
    assertThat(config.categoryCap()).isEqualTo(3);
    assertThat(config.adaptationRate()).isEqualTo(0.25);
    assertThat(config.mutationsPerChild()).isEqualTo(2);
    assertThat(config.crossoverRate()).isEqualTo(0.5);
    assertThat(config.tournamentSize()).isEqualTo(4);
    assertThat(config.generations()).isEqualTo(250);
    assertThat(config.earlyStoppingGenerations()).isEqualTo(5);
    assertThat(config.workers()).isEqualTo(6);
    assertThat(config.battleTimeout()).isEqualTo(Duration.ofSeconds(90));
    assertThat(config.optimizationTimeout()).isEmpty();
    assertThat(config.islands()).isEqualTo(3);
    assertThat(config.epochs()).isEqualTo(7);
    assertThat(config.generationsPerEpoch()).isEqualTo(11);
    assertThat(config.seed()).hasValue(1234L);
    assertThat(config.workersPerIsland()).isEqualTo(2);
  }

  @Test
  public void get_unknownFlag_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> SearchConfigArguments.create(ImmutableList.of("--population", "5")).get());
  }

  @Test
  public void get_invalidValue_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> SearchConfigArguments.create(ImmutableList.of("--adaptationRate", "2.0")).get());
  }
}
