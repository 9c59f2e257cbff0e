package com.gnovoa.swiss.schedule;

import static com.gnovoa.swiss.schedule.DutchSystemTest.game;
import static com.gnovoa.swiss.schedule.DutchSystemTest.refresh;
import static com.gnovoa.swiss.schedule.DutchSystemTest.tournament;
import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.swiss.model.ByeType;
import com.gnovoa.swiss.model.Color;
import com.gnovoa.swiss.model.Match;
import com.gnovoa.swiss.model.MatchScore;
import com.gnovoa.swiss.model.Pairing;
import com.gnovoa.swiss.model.Player;
import com.gnovoa.swiss.model.PointTable;
import com.gnovoa.swiss.model.Tournament;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BursteinSystemTest {

  private final BursteinSystem burstein = new BursteinSystem(new ColorAllocator(), new TiebreakCalculator());

  @Test
  @DisplayName("Round one pairs like the Dutch system and gives the bye to the last player")
  void oddRoundOne() {
    Tournament t = tournament(0, 2000, 1900, 1800, 1700, 1600);

    List<Pairing> pairings = burstein.computeMatching(t);

    assertThat(burstein.type()).isEqualTo(PairingSystemType.BURSTEIN);
    assertThat(pairings).containsExactly(
        Pairing.game(1, 3), Pairing.game(2, 4), Pairing.bye(5, ByeType.BYE));
  }

  @Test
  @DisplayName("Sonneborn-Berger orders players with equal scores")
  void ordersByTiebreaks() {
    Tournament t = tournament(1, 2000, 1900, 1800);
    game(t, 1, 2, MatchScore.WIN);
    t.player(3).addMatch(Match.pairingAllocatedBye(3, MatchScore.WIN));
    refresh(t);

    List<Player> ordered = burstein.order(t, t.activePlayers());

    assertThat(ordered).extracting(Player::id).containsExactly(3, 1, 2);
  }

  @Test
  @DisplayName("The bye skips a bottom player who already scored a point without playing")
  void byeSkipsUnplayedWinner() {
    Tournament t = new Tournament(1, 5, PointTable.DEFAULT.withPairingAllocatedBye(0), Color.WHITE);
    t.addPlayer(new Player(1, "P1", 2000));
    t.addPlayer(new Player(2, "P2", 1900));
    t.addPlayer(new Player(3, "P3", 1800));
    game(t, 1, 2, MatchScore.DRAW);
    t.player(3).addMatch(Match.pairingAllocatedBye(3, MatchScore.WIN));
    refresh(t);

    List<Pairing> pairings = burstein.computeMatching(t);

    assertThat(pairings).containsExactly(Pairing.game(3, 1), Pairing.bye(2, ByeType.BYE));
  }
}
