package com.gnovoa.swiss.rosters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IntentionalByeRoundsTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final IntentionalByeRounds byeRounds = new IntentionalByeRounds(mapper);

  @Test
  @DisplayName("Should accept every shape the store produces")
  void normalisesAllShapes() throws Exception {
    assertThat(byeRounds.normalize(mapper.readTree("[3, 1]"))).containsExactly(1, 3);
    assertThat(byeRounds.normalize(mapper.readTree("2"))).containsExactly(2);
    assertThat(byeRounds.normalize(mapper.readTree("\"[1,4]\""))).containsExactly(1, 4);
    assertThat(byeRounds.normalize(mapper.readTree("\"4, 5\""))).containsExactly(4, 5);
    assertThat(byeRounds.normalize("6")).containsExactly(6);
  }

  @Test
  void emptyValuesMeanNoByes() throws Exception {
    assertThat(byeRounds.normalize(mapper.readTree("null"))).isEmpty();
    assertThat(byeRounds.normalize((String) null)).isEmpty();
    assertThat(byeRounds.normalize("  ")).isEmpty();
    assertThat(byeRounds.normalize(mapper.readTree("[]"))).isEmpty();
  }

  @Test
  @DisplayName("Should reject anything that is not a list of positive rounds")
  void rejectsGarbage() {
    assertThatThrownBy(() -> byeRounds.normalize("two")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> byeRounds.normalize("[1,")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> byeRounds.normalize("0")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> byeRounds.normalize(mapper.readTree("{\"round\": 1}")))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
