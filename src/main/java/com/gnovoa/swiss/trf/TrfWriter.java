package com.gnovoa.swiss.trf;

import com.gnovoa.swiss.exception.FormatLimitException;
import com.gnovoa.swiss.model.Color;
import com.gnovoa.swiss.model.Match;
import com.gnovoa.swiss.model.Player;
import com.gnovoa.swiss.model.PointTable;
import com.gnovoa.swiss.model.Tournament;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link Tournament} snapshot as TRF16 in the layout of {@link PlayerLineLayout}.
 *
 * <p>Output order: optional {@code 012} seed line, {@code XXR} while rounds remain, player
 * lines, a blank line, {@code BBx} lines plus a blank line when the point table is not the
 * default, then {@code XXA} lines for players with a non-zero acceleration. Lines end with
 * CRLF.
 */
public final class TrfWriter {

    public static final String LINE_END = "\r\n";

    static final int MAX_ID = 9999;
    static final int MAX_RATING = 9999;
    static final int MAX_POINTS = 999;

    private final RankCalculator ranks;

    public TrfWriter(RankCalculator ranks) {
        this.ranks = ranks;
    }

    public String write(Tournament tournament) {
        return write(tournament, null);
    }

    /**
     * @param seed written on the {@code 012} line when not null
     * @throws FormatLimitException when an id, rating or point value does not fit its field
     */
    public String write(Tournament tournament, String seed) {
        List<String> lines = new ArrayList<>();
        if (seed != null) lines.add("012 " + seed);
        if (tournament.playedRounds() < tournament.expectedRounds()) lines.add("XXR " + tournament.expectedRounds());

        Map<Integer, Integer> rankById = ranks.computeRanks(tournament.players());
        for (Player p : tournament.players()) {
            lines.add(playerLine(tournament, p, rankById.get(p.id())));
        }
        lines.add("");

        List<String> overrides = pointOverrideLines(tournament.points());
        if (!overrides.isEmpty()) {
            lines.addAll(overrides);
            lines.add("");
        }

        for (Player p : tournament.players()) {
            if (p.accelerations().stream().anyMatch(a -> a != 0)) lines.add(accelerationLine(p));
        }

        return String.join(LINE_END, lines) + LINE_END;
    }

    String playerLine(Tournament tournament, Player player, int rank) {
        checkLimit("player id", player.id(), MAX_ID, "The output format only supports player ids up to 9999");
        checkLimit("rating of player " + player.id(), player.rating(), MAX_RATING,
                "The output format only supports ratings up to 9999");
        checkLimit("score of player " + player.id(), player.scoreWithoutAcceleration(), MAX_POINTS,
                "The output format does not support scores above 99.9");

        StringBuilder line = new StringBuilder(PlayerLineLayout.RECORD_TYPE);
        line.append(PlayerLineLayout.ID.format(Integer.toString(player.id())));
        line.append(PlayerLineLayout.NAME.format(player.name()));
        line.append(String.format("%04d", player.id()));
        line.append(PlayerLineLayout.TITLE.format(PlayerLineLayout.TITLE_TEXT));
        line.append(PlayerLineLayout.ID_REPEATED.format(Integer.toString(player.id())));
        line.append(PlayerLineLayout.RATING.format(Integer.toString(player.rating())));
        line.append(PlayerLineLayout.GUTTER.format(""));
        line.append(PlayerLineLayout.POINTS.format(decimal(player.scoreWithoutAcceleration())));
        line.append(PlayerLineLayout.RANK.format(Integer.toString(rank + 1)));

        for (Match m : player.matches()) line.append(gameBlock(player, m));
        return line.toString();
    }

    private String gameBlock(Player player, Match match) {
        GameCode code = GameCode.of(match, player.id());
        String opponent;
        String color;
        if (code.againstOpponent()) {
            opponent = PlayerLineLayout.GAME_OPPONENT.format(Integer.toString(match.opponent()));
            color = match.color() == Color.WHITE ? "w" : match.color() == Color.BLACK ? "b" : PlayerLineLayout.NO_COLOR;
        } else {
            opponent = PlayerLineLayout.NO_OPPONENT;
            color = PlayerLineLayout.NO_COLOR;
        }
        return "  " + opponent + " " + color + " " + code.symbol();
    }

    /**
     * {@code BBW}/{@code BBD} when anything but the bye value differs from the default,
     * {@code BBL}/{@code BBZ}/{@code BBF} when a losing value differs, {@code BBU} when the
     * bye is not worth a win.
     */
    List<String> pointOverrideLines(PointTable points) {
        List<String> lines = new ArrayList<>();
        if (points.isDefault()) return lines;

        for (PointOverride o : PointOverride.values()) {
            checkLimit(o.name(), o.valueOf(points), MAX_POINTS, "The output format does not support scores above 99.9");
        }

        PointTable def = PointTable.DEFAULT;
        boolean lossesChanged = points.loss() != def.loss()
                || points.zeroPointBye() != def.zeroPointBye()
                || points.forfeitLoss() != def.forfeitLoss();
        if (lossesChanged || points.win() != def.win() || points.draw() != def.draw()) {
            lines.add(overrideLine(PointOverride.BBW, points));
            lines.add(overrideLine(PointOverride.BBD, points));
        }
        if (lossesChanged) {
            lines.add(overrideLine(PointOverride.BBL, points));
            lines.add(overrideLine(PointOverride.BBZ, points));
            lines.add(overrideLine(PointOverride.BBF, points));
        }
        if (points.win() != points.pairingAllocatedBye()) {
            lines.add(overrideLine(PointOverride.BBU, points));
        }
        return lines;
    }

    private static String overrideLine(PointOverride override, PointTable points) {
        return override.name() + " " + String.format("%4d", override.valueOf(points));
    }

    private static String accelerationLine(Player player) {
        StringBuilder line = new StringBuilder("XXA ").append(String.format("%4d", player.id()));
        for (int value : player.accelerations()) {
            checkLimit("acceleration of player " + player.id(), value, MAX_POINTS,
                    "The output format does not support scores above 99.9");
            line.append(String.format("%5s", decimal(value)));
        }
        return line.toString();
    }

    /** 15 to "1.5". */
    static String decimal(int tenths) {
        String sign = tenths < 0 ? "-" : "";
        int abs = Math.abs(tenths);
        return sign + (abs / 10) + "." + (abs % 10);
    }

    private static void checkLimit(String entity, long value, long limit, String message) {
        if (value > limit) throw new FormatLimitException(entity, value, limit, message);
    }
}
