package com.gnovoa.swiss.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.swiss.rosters.InMemoryPairingStore;
import com.gnovoa.swiss.rosters.IntentionalByeRounds;
import com.gnovoa.swiss.schedule.ColorAllocator;
import com.gnovoa.swiss.schedule.DutchSystem;
import com.gnovoa.swiss.trf.FideCompliance;
import com.gnovoa.swiss.trf.PairingOutputFormatter;
import com.gnovoa.swiss.trf.RankCalculator;
import com.gnovoa.swiss.trf.TrfParser;
import com.gnovoa.swiss.trf.TrfWriter;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TrfBootstrapTest {

  @TempDir Path dir;

  @Test
  @DisplayName("Should pair the configured TRF file and write the JaVaFo block")
  void pairsConfiguredFile() throws Exception {
    Path input = dir.resolve("spring-open.trf");
    try (InputStream in = getClass().getResourceAsStream("/fixtures/spring-open.trf")) {
      Files.copy(in, input);
    }
    Path output = dir.resolve("round3.txt");

    bootstrap(new PairingProperties.Trf(input.toString(), output.toString())).onReady();

    assertThat(Files.readString(output, StandardCharsets.UTF_8)).isEqualTo("2\n3 2\n1 0\n");
  }

  @Test
  void doesNothingWithoutInput() {
    Path output = dir.resolve("never.txt");

    bootstrap(new PairingProperties.Trf(" ", output.toString())).onReady();

    assertThat(output).doesNotExist();
  }

  @Test
  void missingFileFails() {
    TrfBootstrap bootstrap = bootstrap(new PairingProperties.Trf(null, null));

    assertThatThrownBy(() -> bootstrap.pairFile(dir.resolve("missing.trf")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("missing.trf");
  }

  private static TrfBootstrap bootstrap(PairingProperties.Trf trf) {
    PairingProperties props = new PairingProperties("dutch", "Open", 1, 0, null, null, trf);
    ObjectMapper mapper = new ObjectMapper();
    ColorAllocator colors = new ColorAllocator();
    RankCalculator ranks = new RankCalculator();
    PairingOutputFormatter formatter = new PairingOutputFormatter();
    PairingRunner runner = new PairingRunner(
        new InMemoryPairingStore(mapper),
        new HistoryReconstructor(new IntentionalByeRounds(mapper), ranks),
        List.of(new DutchSystem(colors)),
        new FideCompliance(colors),
        new TrfWriter(ranks),
        formatter,
        props);
    return new TrfBootstrap(props, new TrfParser(), runner, formatter);
  }
}
