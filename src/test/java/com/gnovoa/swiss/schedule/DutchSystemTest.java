package com.gnovoa.swiss.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.swiss.exception.UnsatisfiablePairingException;
import com.gnovoa.swiss.model.ByeType;
import com.gnovoa.swiss.model.Color;
import com.gnovoa.swiss.model.Match;
import com.gnovoa.swiss.model.MatchScore;
import com.gnovoa.swiss.model.Pairing;
import com.gnovoa.swiss.model.Player;
import com.gnovoa.swiss.model.PointTable;
import com.gnovoa.swiss.model.Tournament;
import com.gnovoa.swiss.trf.RankCalculator;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DutchSystemTest {

  private final DutchSystem dutch = new DutchSystem(new ColorAllocator());

  @Test
  @DisplayName("Five players in round one: two boards and a bye for the lowest rated")
  void oddRoundOne() {
    Tournament t = tournament(0, 2000, 1900, 1800, 1700, 1600);

    List<Pairing> pairings = dutch.computeMatching(t);

    assertThat(pairings).containsExactly(
        Pairing.game(1, 3), Pairing.game(2, 4), Pairing.bye(5, ByeType.BYE));
  }

  @Test
  @DisplayName("Even roster covers every player exactly once")
  void evenRosterIsComplete() {
    Tournament t = tournament(0, 2400, 2300, 2200, 2100, 2000, 1900, 1800, 1700);

    List<Pairing> pairings = dutch.computeMatching(t);

    assertThat(pairings).hasSize(4).noneMatch(Pairing::isBye);
    assertThat(coveredIds(pairings)).containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6, 7, 8);
    assertThat(pairings).contains(Pairing.game(1, 5), Pairing.game(2, 6));
  }

  @Test
  @DisplayName("Player with white in rounds one and two gets black in round three")
  void repeatedWhiteGetsBlack() {
    Tournament t = tournament(2, 2400, 2300, 2200, 2100, 2000, 1900, 1800, 1700);
    game(t, 1, 5, MatchScore.WIN);
    game(t, 6, 2, MatchScore.WIN);
    game(t, 3, 7, MatchScore.WIN);
    game(t, 8, 4, MatchScore.WIN);
    game(t, 1, 6, MatchScore.WIN);
    game(t, 2, 5, MatchScore.WIN);
    game(t, 7, 3, MatchScore.WIN);
    game(t, 4, 8, MatchScore.WIN);
    refresh(t);

    assertThat(t.player(1).colorPreference()).isEqualTo(Color.BLACK);

    List<Pairing> pairings = dutch.computeMatching(t);

    assertThat(coveredIds(pairings)).containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6, 7, 8);
    Pairing board = pairings.stream().filter(p -> p.involves(1)).findFirst().orElseThrow();
    assertThat(board.blackId()).isEqualTo(1);
    assertNoRepeats(t, pairings);
  }

  @Test
  @DisplayName("A player who already had the bye does not get another one")
  void byeGoesToSomeoneElse() {
    Tournament t = tournament(1, 2000, 1900, 1800);
    game(t, 1, 2, MatchScore.WIN);
    t.player(3).addMatch(Match.pairingAllocatedBye(3, MatchScore.WIN));
    refresh(t);

    List<Pairing> pairings = dutch.computeMatching(t);

    assertThat(pairings).containsExactly(Pairing.game(3, 1), Pairing.bye(2, ByeType.BYE));
  }

  @Test
  @DisplayName("A bottom player with two byes already does not get a third while others had none")
  void byeMovesUpWhenLastGroupHadByes() {
    Tournament t = new Tournament(2, 5, PointTable.DEFAULT.withPairingAllocatedBye(0), Color.WHITE);
    for (int i = 1; i <= 5; i++) t.addPlayer(new Player(i, "P" + i, 2100 - i * 100));
    game(t, 1, 3, MatchScore.DRAW);
    game(t, 4, 2, MatchScore.DRAW);
    t.player(5).addMatch(Match.pairingAllocatedBye(5, MatchScore.WIN));
    game(t, 4, 1, MatchScore.DRAW);
    game(t, 2, 3, MatchScore.DRAW);
    t.player(5).addMatch(Match.pairingAllocatedBye(5, MatchScore.DRAW));
    refresh(t);

    assertThat(t.player(5).scoreWithoutAcceleration()).isEqualTo(5);
    assertThat(t.player(5).byeCount()).isEqualTo(2);

    List<Pairing> pairings = dutch.computeMatching(t);

    assertThat(pairings).hasSize(3);
    assertThat(coveredIds(pairings)).containsExactlyInAnyOrder(1, 2, 3, 4, 5);
    Pairing bye = pairings.stream().filter(Pairing::isBye).findFirst().orElseThrow();
    assertThat(bye.whiteId()).isNotEqualTo(5);
    assertThat(bye.byeType()).isEqualTo(ByeType.BYE);
    assertNoRepeats(t, pairings);
  }

  @Test
  @DisplayName("Requested byes leave the pool as half-point byes")
  void requestedByeIsHalfPoint() {
    Tournament t = tournament(0, 2000, 1900, 1800, 1700);
    t.player(4).addIntentionalByeRound(1);

    List<Pairing> pairings = dutch.computeMatching(t);

    assertThat(pairings).containsExactlyInAnyOrder(
        Pairing.game(1, 2), Pairing.bye(3, ByeType.BYE), Pairing.bye(4, ByeType.HALF_POINT_BYE));
  }

  @Test
  @DisplayName("A stuck score group falls back to the certified matching")
  void fallsBackToCertifiedMatching() {
    Tournament t = tournament(0, 2500, 2400, 2300, 2200, 2100, 2000);
    forbid(t, 2, 5);
    forbid(t, 2, 6);
    forbid(t, 2, 3);

    List<Pairing> pairings = dutch.computeMatching(t);

    assertThat(pairings).hasSize(3);
    assertThat(coveredIds(pairings)).containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6);
    for (Pairing p : pairings) {
      assertThat(t.player(p.whiteId()).isForbidden(p.blackId())).isFalse();
    }
  }

  @Test
  @DisplayName("Two players who already met cannot be paired again")
  void unsatisfiableRoundRaises() {
    Tournament t = tournament(1, 2000, 1900);
    game(t, 1, 2, MatchScore.DRAW);
    refresh(t);

    assertThatThrownBy(() -> dutch.computeMatching(t))
        .isInstanceOf(UnsatisfiablePairingException.class)
        .hasMessageContaining("round 2");
  }

  static Tournament tournament(int playedRounds, int... ratings) {
    Tournament t = new Tournament(playedRounds, 5, PointTable.DEFAULT, Color.WHITE);
    for (int i = 0; i < ratings.length; i++) {
      t.addPlayer(new Player(i + 1, "P" + (i + 1), ratings[i]));
    }
    refresh(t);
    return t;
  }

  static void game(Tournament t, int white, int black, MatchScore whiteScore) {
    t.player(white).addMatch(Match.played(black, Color.WHITE, whiteScore));
    t.player(black).addMatch(Match.played(white, Color.BLACK, whiteScore.invert()));
    forbid(t, white, black);
  }

  static void forbid(Tournament t, int a, int b) {
    t.player(a).forbid(b);
    t.player(b).forbid(a);
  }

  static void refresh(Tournament t) {
    t.recomputeScores();
    new RankCalculator().computeRanks(t.players()).forEach((id, rank) -> t.player(id).setRankIndex(rank));
    t.updatePlayerData();
  }

  static List<Integer> coveredIds(List<Pairing> pairings) {
    List<Integer> ids = new ArrayList<>();
    for (Pairing p : pairings) {
      ids.add(p.whiteId());
      if (!p.isBye()) ids.add(p.blackId());
    }
    return ids;
  }

  private static void assertNoRepeats(Tournament t, List<Pairing> pairings) {
    for (Pairing p : pairings) {
      if (p.isBye()) continue;
      assertThat(t.player(p.whiteId()).matches()).noneMatch(m -> m.opponent() == p.blackId());
    }
  }
}
