package com.gnovoa.swiss.trf;

import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.swiss.model.Player;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RankCalculatorTest {

  @Test
  @DisplayName("Score first, rating second, input order for full ties")
  void ranks() {
    Player a = player(1, 1800, 10);
    Player b = player(2, 2000, 10);
    Player c = player(3, 2200, 5);
    Player d = player(4, 1800, 10);

    assertThat(new RankCalculator().computeRanks(List.of(a, b, c, d)))
        .containsEntry(2, 0)
        .containsEntry(1, 1)
        .containsEntry(4, 2)
        .containsEntry(3, 3);
  }

  private static Player player(int id, int rating, int score) {
    Player p = new Player(id, "P" + id, rating);
    p.setScoreWithoutAcceleration(score);
    return p;
  }
}
