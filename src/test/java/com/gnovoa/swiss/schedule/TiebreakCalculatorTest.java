package com.gnovoa.swiss.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.swiss.model.Color;
import com.gnovoa.swiss.model.Match;
import com.gnovoa.swiss.model.MatchScore;
import com.gnovoa.swiss.model.Player;
import com.gnovoa.swiss.model.PointTable;
import com.gnovoa.swiss.model.Tournament;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TiebreakCalculatorTest {

  private final TiebreakCalculator calculator = new TiebreakCalculator();

  @Test
  @DisplayName("Should sum opponent scores for Buchholz and Sonneborn-Berger")
  void opponentScores() {
    Tournament t = DutchSystemTest.tournament(2, 2000, 1900, 1800, 1700);
    DutchSystemTest.game(t, 1, 3, MatchScore.WIN);
    DutchSystemTest.game(t, 2, 4, MatchScore.DRAW);
    DutchSystemTest.game(t, 2, 1, MatchScore.LOSS);
    DutchSystemTest.game(t, 3, 4, MatchScore.WIN);
    DutchSystemTest.refresh(t);

    TiebreakScores first = calculator.compute(t, t.player(1));
    TiebreakScores second = calculator.compute(t, t.player(2));

    assertThat(first).isEqualTo(new TiebreakScores(20, 15.0, 15, 0));
    assertThat(second).isEqualTo(new TiebreakScores(5, 2.5, 25, 0));
  }

  @Test
  @DisplayName("Median drops the best and the worst opponent after round two")
  void medianAfterThreeRounds() {
    Tournament t = new Tournament(3, 5, PointTable.DEFAULT, Color.WHITE);
    Player p = t.addPlayer(new Player(1, "Anna", 2000));
    p.addMatch(Match.unpaired(1, MatchScore.LOSS));
    p.addMatch(Match.unpaired(1, MatchScore.DRAW));
    p.addMatch(Match.forfeit(9, Color.WHITE, MatchScore.WIN));

    assertThat(calculator.buchholz(t, p)).isEqualTo(15);
    assertThat(calculator.median(t, p)).isEqualTo(5);
    assertThat(calculator.adjustedScore(t, p)).isEqualTo(15);
  }

  @Test
  @DisplayName("Virtual opponent of a pairing-allocated bye depends on the bye value")
  void virtualOpponentOfBye() {
    Match bye = Match.pairingAllocatedBye(1, MatchScore.WIN);

    assertThat(score(PointTable.DEFAULT, bye)).isEqualTo(10);
    assertThat(score(PointTable.DEFAULT.withPairingAllocatedBye(5), bye)).isEqualTo(5);
    assertThat(score(PointTable.DEFAULT.withPairingAllocatedBye(0), bye)).isEqualTo(10);
    assertThat(score(PointTable.DEFAULT, Match.unpaired(1, MatchScore.WIN))).isZero();
    assertThat(score(PointTable.DEFAULT, Match.unpaired(1, MatchScore.LOSS))).isEqualTo(10);
  }

  private int score(PointTable table, Match match) {
    Tournament t = new Tournament(1, 5, table, Color.WHITE);
    Player p = t.addPlayer(new Player(1, "Anna", 2000));
    return calculator.virtualOpponentScore(t, p, match);
  }
}
