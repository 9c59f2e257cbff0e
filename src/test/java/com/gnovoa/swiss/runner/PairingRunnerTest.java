package com.gnovoa.swiss.runner;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.swiss.model.ByeType;
import com.gnovoa.swiss.model.Pairing;
import com.gnovoa.swiss.model.PointTable;
import com.gnovoa.swiss.rosters.InMemoryPairingStore;
import com.gnovoa.swiss.rosters.IntentionalByeRounds;
import com.gnovoa.swiss.rosters.PairingRow;
import com.gnovoa.swiss.rosters.PlayerRow;
import com.gnovoa.swiss.rosters.StoredPairing;
import com.gnovoa.swiss.schedule.BursteinSystem;
import com.gnovoa.swiss.schedule.ColorAllocator;
import com.gnovoa.swiss.schedule.DutchSystem;
import com.gnovoa.swiss.schedule.PairingSystemType;
import com.gnovoa.swiss.schedule.TiebreakCalculator;
import com.gnovoa.swiss.trf.FideCompliance;
import com.gnovoa.swiss.trf.PairingOutputFormatter;
import com.gnovoa.swiss.trf.RankCalculator;
import com.gnovoa.swiss.trf.TrfParser;
import com.gnovoa.swiss.trf.TrfWriter;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PairingRunnerTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private InMemoryPairingStore store;
  private PairingRunner runner;

  @BeforeEach
  void setUp() throws Exception {
    store = new InMemoryPairingStore(mapper);
    try (InputStream in = getClass().getResourceAsStream("/fixtures/club-snapshot.json")) {
      store.load("club", in);
    }
    runner = runner(new PairingProperties(null, null, 0, 0, null, null, null));
  }

  @Test
  @DisplayName("Should pair round three with a requested bye and store ids")
  void pairsFromStore() {
    PairingOutcome outcome = runner.generatePairings(
        PairingRequest.of("club", 3).withSection("Open").withExpectedRounds(5).withTrf());

    assertThat(outcome.success()).isTrue();
    assertThat(outcome.pairings()).containsExactly(
        new StoredPairing("p-dev", "p-anna", false, null, 1, "Open"),
        new StoredPairing("p-cleo", "p-eve", false, null, 2, "Open"),
        new StoredPairing("p-ben", null, true, "half_point_bye", 3, "Open"));
    assertThat(outcome.metadata().activePlayers()).isEqualTo(5);
    assertThat(outcome.metadata().byes()).isEqualTo(1);
    assertThat(outcome.metadata().system()).isEqualTo(PairingSystemType.DUTCH);
    assertThat(outcome.trfPairings()).isEqualTo("3\n4 1\n3 5\n2 0");
    assertThat(outcome.trfSnapshot()).startsWith("XXR 5\r\n001    1Anna");
  }

  @Test
  @DisplayName("Five players in round one: the lowest rated gets the bye")
  void oddRoundOne() {
    for (int i = 1; i <= 5; i++) {
      store.addPlayer("new", new PlayerRow("id-" + i, "Player " + i, 2000 - i * 100, "active", "Open", null));
    }

    PairingOutcome outcome = runner.generatePairings(PairingRequest.of("new", 1).withSection("Open"));

    assertThat(outcome.success()).isTrue();
    assertThat(outcome.pairings()).hasSize(3);
    assertThat(outcome.pairings()).filteredOn(StoredPairing::isBye).singleElement()
        .satisfies(bye -> {
          assertThat(bye.whitePlayerId()).isEqualTo("id-5");
          assertThat(bye.byeType()).isEqualTo("bye");
        });
    assertThat(outcome.trfSnapshot()).isNull();
  }

  @Test
  @DisplayName("Board numbers start at the configured board")
  void startingBoard() {
    PairingRunner offset = runner(new PairingProperties("burstein", "Main", 10, 5, null, null, null));

    PairingOutcome outcome = offset.generatePairings(PairingRequest.of("club", 3));

    assertThat(outcome.success()).isTrue();
    assertThat(outcome.metadata().system()).isEqualTo(PairingSystemType.BURSTEIN);
    assertThat(outcome.pairings()).extracting(StoredPairing::board).startsWith(10, 11);
    assertThat(outcome.pairings()).extracting(StoredPairing::section).containsOnly("Main");
  }

  @Test
  void requestOverridesSystem() {
    PairingOutcome outcome = runner.generatePairings(
        PairingRequest.of("club", 3).withSection("Open").withSystem(PairingSystemType.BURSTEIN));

    assertThat(outcome.success()).isTrue();
    assertThat(outcome.metadata().system()).isEqualTo(PairingSystemType.BURSTEIN);
    assertThat(outcome.pairings()).hasSize(3);
  }

  @Test
  @DisplayName("Two players who met in round one cannot be paired again")
  void unsatisfiableRound() {
    store.addPlayer("duo", new PlayerRow("a", "A", 1500, "active", "Open", null));
    store.addPlayer("duo", new PlayerRow("b", "B", 1400, "active", "Open", null));
    store.addPairing("duo", new PairingRow("a", "b", "1-0", 1, "Open", 1, null));

    PairingOutcome outcome = runner.generatePairings(PairingRequest.of("duo", 2));

    assertThat(outcome.success()).isFalse();
    assertThat(outcome.errorKind()).isEqualTo(PairingOutcome.ErrorKind.UNSATISFIABLE_PAIRING);
    assertThat(outcome.pairings()).isEmpty();
  }

  @Test
  void malformedHistory() {
    store.addPlayer("bad", new PlayerRow("a", "A", 1500, "active", "Open", null));
    store.addPairing("bad", new PairingRow("a", "ghost", "1-0", 1, "Open", 1, null));

    PairingOutcome outcome = runner.generatePairings(PairingRequest.of("bad", 2));

    assertThat(outcome.errorKind()).isEqualTo(PairingOutcome.ErrorKind.MALFORMED_HISTORY);
    assertThat(outcome.errorMessage()).contains("ghost");
  }

  @Test
  void negativeRatingIsMalformed() {
    store.addPlayer("neg", new PlayerRow("a", "A", 1500, "active", "Open", null));
    store.addPlayer("neg", new PlayerRow("b", "B", -20, "active", "Open", null));

    PairingOutcome outcome = runner.generatePairings(PairingRequest.of("neg", 1));

    assertThat(outcome.success()).isFalse();
    assertThat(outcome.errorKind()).isEqualTo(PairingOutcome.ErrorKind.MALFORMED_HISTORY);
    assertThat(outcome.errorMessage()).contains("negative rating");
  }

  @Test
  void formatLimit() {
    store.addPlayer("gm", new PlayerRow("a", "A", 12000, "active", "Open", null));

    PairingOutcome outcome = runner.generatePairings(PairingRequest.of("gm", 1));

    assertThat(outcome.errorKind()).isEqualTo(PairingOutcome.ErrorKind.FORMAT_LIMIT);
  }

  @Test
  void invalidRequest() {
    PairingOutcome outcome = runner.generatePairings(PairingRequest.of("club", 0));

    assertThat(outcome.success()).isFalse();
    assertThat(outcome.errorKind()).isEqualTo(PairingOutcome.ErrorKind.INVALID_REQUEST);
  }

  @Test
  @DisplayName("A custom point table reaches the TRF snapshot")
  void customPointsInSnapshot() {
    PairingOutcome outcome = runner.generatePairings(PairingRequest.of("club", 3)
        .withSection("Open").withPoints(PointTable.DEFAULT.withWin(12)).withTrf());

    assertThat(outcome.trfSnapshot()).contains("BBW   12").contains(" 2.4    1");
  }

  @Test
  @DisplayName("Should pair the next round of a TRF file")
  void pairsTrfFile() throws Exception {
    String content;
    try (InputStream in = getClass().getResourceAsStream("/fixtures/spring-open.trf")) {
      content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    List<Pairing> pairings = runner.pairTrf(new TrfParser().parse(content), PairingSystemType.DUTCH);

    assertThat(pairings).containsExactly(
        new Pairing(3, 2, null, 1, "Open"),
        new Pairing(1, null, ByeType.BYE, 2, "Open"));
  }

  private PairingRunner runner(PairingProperties props) {
    ColorAllocator colors = new ColorAllocator();
    RankCalculator ranks = new RankCalculator();
    return new PairingRunner(
        store,
        new HistoryReconstructor(new IntentionalByeRounds(mapper), ranks),
        List.of(new DutchSystem(colors), new BursteinSystem(colors, new TiebreakCalculator())),
        new FideCompliance(colors),
        new TrfWriter(ranks),
        new PairingOutputFormatter(),
        props);
  }
}
