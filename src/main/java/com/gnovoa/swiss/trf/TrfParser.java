package com.gnovoa.swiss.trf;

import com.gnovoa.swiss.exception.TrfParseException;
import com.gnovoa.swiss.model.Color;
import com.gnovoa.swiss.model.Match;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads TRF16 text (JaVaFo flavour) into a {@link TrfDocument}.
 *
 * <p>Understood records: {@code 012} seed line, {@code 001} player lines in the layout of
 * {@link PlayerLineLayout}, {@code XXR XXZ XXF XXA XXC XXB XXV XXS} extensions and
 * {@code BBW BBD BBL BBZ BBF BBU} point overrides. Anything else is skipped.
 */
public final class TrfParser {

    private static final Logger log = LoggerFactory.getLogger(TrfParser.class);

    private static final int ACCELERATION_OFFSET = 8;
    private static final int ACCELERATION_WIDTH = 5;

    public TrfDocument parse(String content) {
        String seedLine = null;
        List<TrfPlayer> players = new ArrayList<>();
        ScoringSystem scoring = ScoringSystem.defaultSystem();
        TrfExtensions.Builder extensions = TrfExtensions.builder();

        String[] lines = content.split("\r?\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int lineNumber = i + 1;
            if (line.isBlank()) continue;

            if (line.startsWith("012")) {
                seedLine = line.length() > 4 ? line.substring(4).trim() : "";
            } else if (line.startsWith("001")) {
                players.add(parsePlayerLine(lineNumber, line));
            } else if (line.startsWith("XXS")) {
                scoring = parseScoring(lineNumber, line, scoring);
            } else if (line.startsWith("XX")) {
                parseExtension(lineNumber, line, extensions);
            } else if (PointOverride.isOverrideLine(line)) {
                PointOverride override = PointOverride.valueOf(line.substring(0, 3));
                extensions.override(override, parseInt(lineNumber, line, line.substring(3).trim(), override.name()));
            } else {
                log.debug("Skipping TRF line {}: {}", lineNumber, line);
            }
        }

        return new TrfDocument(seedLine, players, scoring, extensions.build());
    }

    TrfPlayer parsePlayerLine(int lineNumber, String line) {
        if (line.length() < PlayerLineLayout.GAMES_OFFSET) {
            throw new TrfParseException(lineNumber, line,
                    "player line needs at least " + PlayerLineLayout.GAMES_OFFSET + " columns");
        }

        int id = parseInt(lineNumber, line, PlayerLineLayout.ID.read(line), "id");
        String name = PlayerLineLayout.NAME.read(line);
        String ratingText = PlayerLineLayout.RATING.read(line);
        int rating = ratingText.isEmpty() ? 0 : parseInt(lineNumber, line, ratingText, "rating");
        String pointsText = PlayerLineLayout.POINTS.read(line);
        int points = pointsText.isEmpty() ? 0 : parseTenths(lineNumber, line, pointsText, "points");
        String rankText = PlayerLineLayout.RANK.read(line);
        int rank = rankText.isEmpty() ? 0 : parseInt(lineNumber, line, rankText, "rank");

        List<Match> matches = new ArrayList<>();
        for (int round = 0; PlayerLineLayout.gameOffset(round) < line.length(); round++) {
            int offset = PlayerLineLayout.gameOffset(round);
            String block = line.substring(offset, Math.min(offset + PlayerLineLayout.GAME_WIDTH, line.length()));
            if (block.isBlank()) break;
            if (block.length() < PlayerLineLayout.GAME_WIDTH) {
                throw new TrfParseException(lineNumber, line, "incomplete block for round " + (round + 1));
            }
            matches.add(parseGame(lineNumber, line, id, block));
        }

        return new TrfPlayer(id, name, rating, points, rank, matches);
    }

    private Match parseGame(int lineNumber, String line, int ownerId, String block) {
        String resultText = PlayerLineLayout.GAME_RESULT.read(block);
        GameCode code = resultText.length() == 1
                ? GameCode.fromSymbol(resultText.charAt(0)).orElse(null)
                : null;
        if (code == null) throw new TrfParseException(lineNumber, line, "unknown result code '" + resultText + "'");

        int opponent = parseInt(lineNumber, line, PlayerLineLayout.GAME_OPPONENT.read(block), "opponent");
        if (!code.againstOpponent()) return code.toMatch(ownerId, ownerId, Color.NONE);
        if (opponent == 0) return byeWithoutOpponent(lineNumber, line, ownerId, code);

        Color color = switch (PlayerLineLayout.GAME_COLOR.read(block)) {
            case "w" -> Color.WHITE;
            case "b" -> Color.BLACK;
            case "-", "" -> Color.NONE;
            default -> throw new TrfParseException(lineNumber, line,
                    "unknown colour code '" + PlayerLineLayout.GAME_COLOR.read(block) + "'");
        };
        return code.toMatch(ownerId, opponent, color);
    }

    /** Other programs write {@code 0000 - +} and friends for rounds without an opponent. */
    private Match byeWithoutOpponent(int lineNumber, String line, int ownerId, GameCode code) {
        GameCode bye = switch (code) {
            case FORFEIT_WIN, WIN -> GameCode.FULL_POINT_BYE;
            case DRAW, UNPLAYED_DRAW -> GameCode.HALF_POINT_BYE;
            case FORFEIT_LOSS, LOSS -> GameCode.ZERO_POINT_BYE;
            default -> throw new TrfParseException(lineNumber, line, "result " + code.symbol() + " needs an opponent");
        };
        return bye.toMatch(ownerId, ownerId, Color.NONE);
    }

    private void parseExtension(int lineNumber, String line, TrfExtensions.Builder extensions) {
        String[] tokens = line.trim().split("\\s+");
        String tag = tokens[0];
        switch (tag) {
            case "XXR" -> {
                if (tokens.length < 2) throw new TrfParseException(lineNumber, line, "XXR needs a round count");
                extensions.totalRounds(parseInt(lineNumber, line, tokens[1], "rounds"));
            }
            case "XXZ" -> {
                for (int t = 1; t < tokens.length; t++) extensions.absent(parseInt(lineNumber, line, tokens[t], "player id"));
            }
            case "XXF" -> {
                List<Integer> ids = new ArrayList<>();
                for (int t = 1; t < tokens.length; t++) ids.add(parseInt(lineNumber, line, tokens[t], "player id"));
                if (ids.size() < 2) throw new TrfParseException(lineNumber, line, "XXF needs at least two player ids");
                extensions.forbid(ids);
            }
            case "XXA" -> parseAcceleration(lineNumber, line, extensions);
            case "XXC" -> extensions.checklist(restOf(tokens));
            case "XXB" -> extensions.buildNumber(tokens.length > 1 ? parseInt(lineNumber, line, tokens[1], "build") : null);
            case "XXV" -> extensions.releaseNumber(restOf(tokens));
            default -> log.debug("Ignoring unknown extension {} on line {}", tag, lineNumber);
        }
    }

    /** {@code XXA iiii} followed by five-column values in points, one per round. */
    private void parseAcceleration(int lineNumber, String line, TrfExtensions.Builder extensions) {
        if (line.length() < ACCELERATION_OFFSET) throw new TrfParseException(lineNumber, line, "XXA line too short");
        int id = parseInt(lineNumber, line, line.substring(4, ACCELERATION_OFFSET).trim(), "player id");

        List<Integer> values = new ArrayList<>();
        for (int offset = ACCELERATION_OFFSET; offset < line.length(); offset += ACCELERATION_WIDTH) {
            String chunk = line.substring(offset, Math.min(offset + ACCELERATION_WIDTH, line.length())).trim();
            values.add(chunk.isEmpty() ? 0 : parseTenths(lineNumber, line, chunk, "acceleration"));
        }
        extensions.acceleration(id, values);
    }

    /** Accepts {@code CODE=value} as well as {@code CODE value} pairs; values are in points. */
    private ScoringSystem parseScoring(int lineNumber, String line, ScoringSystem scoring) {
        String[] tokens = line.trim().split("\\s+");
        ScoringSystem result = scoring;
        int t = 1;
        while (t < tokens.length) {
            String codeText;
            String valueText;
            int eq = tokens[t].indexOf('=');
            if (eq >= 0) {
                codeText = tokens[t].substring(0, eq);
                valueText = tokens[t].substring(eq + 1);
                t++;
            } else {
                if (t + 1 >= tokens.length) throw new TrfParseException(lineNumber, line, "XXS code " + tokens[t] + " has no value");
                codeText = tokens[t];
                valueText = tokens[t + 1];
                t += 2;
            }
            ScoringCode code;
            try {
                code = ScoringCode.valueOf(codeText.toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new TrfParseException(lineNumber, line, "unknown scoring code '" + codeText + "'");
            }
            result = result.with(code, parseTenths(lineNumber, line, valueText, code.name()));
        }
        return result;
    }

    private static String restOf(String[] tokens) {
        return tokens.length > 1 ? String.join(" ", List.of(tokens).subList(1, tokens.length)) : "";
    }

    private static int parseInt(int lineNumber, String line, String text, String what) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new TrfParseException(lineNumber, line, "invalid " + what + " '" + text + "'");
        }
    }

    /** "1.5" to 15. */
    private static int parseTenths(int lineNumber, String line, String text, String what) {
        try {
            return new BigDecimal(text.trim()).movePointRight(1).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new TrfParseException(lineNumber, line, "invalid " + what + " '" + text + "'");
        }
    }
}
