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

class CompatibilityTest {

  @Test
  @DisplayName("Forbidden pairs are incompatible in both directions")
  void forbiddenEitherWay() {
    Tournament t = new Tournament(0, 5, PointTable.DEFAULT, Color.WHITE);
    Player a = t.addPlayer(new Player(1, "A", 2000));
    Player b = t.addPlayer(new Player(2, "B", 1900));
    a.forbid(2);

    assertThat(Compatibility.isCompatible(a, b, t)).isFalse();
    assertThat(Compatibility.isCompatible(b, a, t)).isFalse();
  }

  @Test
  @DisplayName("Same absolute colour preference blocks the pairing")
  void sameAbsolutePreferenceConflicts() {
    Tournament t = new Tournament(2, 5, PointTable.DEFAULT, Color.WHITE);
    Player a = whiteTwice(t, 1, MatchScore.LOSS);
    Player b = whiteTwice(t, 2, MatchScore.LOSS);

    assertThat(Compatibility.sameAbsolutePreference(a, b)).isTrue();
    assertThat(Compatibility.hasColorConflict(a, b, t)).isTrue();
    assertThat(Compatibility.isCompatible(a, b, t)).isFalse();
  }

  @Test
  @DisplayName("The colour rule does not apply in the last round")
  void lastRoundIsExempt() {
    Tournament t = new Tournament(2, 3, PointTable.DEFAULT, Color.WHITE);
    Player a = whiteTwice(t, 1, MatchScore.LOSS);
    Player b = whiteTwice(t, 2, MatchScore.LOSS);

    assertThat(Compatibility.isCompatible(a, b, t)).isTrue();
  }

  @Test
  @DisplayName("The colour rule does not apply between top scorers")
  void topScorersAreExempt() {
    Tournament t = new Tournament(2, 5, PointTable.DEFAULT, Color.WHITE);
    Player a = whiteTwice(t, 1, MatchScore.WIN);
    Player b = whiteTwice(t, 2, MatchScore.WIN);

    assertThat(a.scoreWithoutAcceleration()).isGreaterThan(t.topScoreThreshold());
    assertThat(Compatibility.isCompatible(a, b, t)).isTrue();
  }

  private static Player whiteTwice(Tournament t, int id, MatchScore score) {
    Player p = t.addPlayer(new Player(id, "P" + id, 2000));
    p.addMatch(Match.played(10 + id, Color.WHITE, score));
    p.addMatch(Match.played(20 + id, Color.WHITE, score));
    t.recomputeScores();
    p.updateColorPreferences();
    return p;
  }
}
