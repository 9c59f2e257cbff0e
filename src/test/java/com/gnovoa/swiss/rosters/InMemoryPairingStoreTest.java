package com.gnovoa.swiss.rosters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryPairingStoreTest {

  private InMemoryPairingStore store;

  @BeforeEach
  void setUp() throws Exception {
    store = new InMemoryPairingStore(new ObjectMapper());
    try (InputStream in = getClass().getResourceAsStream("/fixtures/club-snapshot.json")) {
      store.load("club", in);
    }
  }

  @Test
  @DisplayName("Should return active players of the section only")
  void activePlayers() {
    List<PlayerRow> open = store.activePlayers("club", "Open");

    assertThat(open).extracting(PlayerRow::id)
        .containsExactly("p-anna", "p-ben", "p-cleo", "p-dev", "p-eve");
    assertThat(store.activePlayers("club", null)).hasSize(6);
    assertThat(store.activePlayers("other", "Open")).isEmpty();
  }

  @Test
  @DisplayName("Should return earlier rounds in round and board order")
  void pairingsBefore() {
    List<PairingRow> history = store.pairingsBefore("club", 3, "Open");

    assertThat(history).hasSize(6);
    assertThat(history).extracting(PairingRow::round).containsExactly(1, 1, 1, 2, 2, 2);
    assertThat(history).extracting(PairingRow::board).containsExactly(1, 2, 3, 1, 2, 3);
    assertThat(store.pairingsBefore("club", 2, "Open")).hasSize(3);
  }

  @Test
  void addsRowsProgrammatically() {
    store.addPlayer("fresh", new PlayerRow("x", "X", 1500, null, null, null));
    store.addPairing("fresh", new PairingRow("x", null, "1-0", 1, null, 1, "bye"));

    assertThat(store.activePlayers("fresh", "Open")).hasSize(1);
    assertThat(store.pairingsBefore("fresh", 2, "Open")).singleElement().matches(PairingRow::isBye);
  }

  @Test
  void rejectsInvalidSnapshot() {
    InputStream broken = new ByteArrayInputStream("{\"players\": [".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> store.load("bad", broken)).isInstanceOf(IllegalStateException.class);
  }
}
