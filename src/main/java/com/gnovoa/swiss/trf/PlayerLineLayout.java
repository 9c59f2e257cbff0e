package com.gnovoa.swiss.trf;

import java.util.List;

/**
 * Column layout of a {@code 001} player line as written by this engine.
 *
 * <p>Columns 0-87 hold the fixed fields below; from column 88 on, each round takes a
 * ten-column block: two blanks, opponent (4), blank, colour, blank, result code.
 */
public final class PlayerLineLayout {

    public static final String RECORD_TYPE = "001 ";

    public static final TrfField ID = TrfField.number("id", 4, 4);
    public static final TrfField NAME = TrfField.text("name", 8, 10);
    public static final TrfField FIDE_ID = TrfField.number("fide id", 18, 4);
    public static final TrfField TITLE = TrfField.text("title", 22, 6);
    public static final TrfField ID_REPEATED = TrfField.number("id", 28, 4);
    public static final TrfField RATING = TrfField.number("rating", 32, 19);
    public static final TrfField GUTTER = TrfField.text("gutter", 51, 28);
    public static final TrfField POINTS = TrfField.number("points", 79, 4);
    public static final TrfField RANK = TrfField.number("rank", 83, 5);

    public static final List<TrfField> FIXED_FIELDS =
            List.of(ID, NAME, FIDE_ID, TITLE, ID_REPEATED, RATING, GUTTER, POINTS, RANK);

    public static final int GAMES_OFFSET = 88;
    public static final int GAME_WIDTH = 10;

    /** Fields inside one round block, relative to the block start. */
    public static final TrfField GAME_OPPONENT = TrfField.number("opponent", 2, 4);
    public static final TrfField GAME_COLOR = TrfField.text("colour", 7, 1);
    public static final TrfField GAME_RESULT = TrfField.text("result", 9, 1);

    public static final String TITLE_TEXT = "Player";
    public static final String NO_OPPONENT = "0000";
    public static final String NO_COLOR = "-";

    private PlayerLineLayout() {}

    public static int gameOffset(int roundIndex) {
        return GAMES_OFFSET + roundIndex * GAME_WIDTH;
    }
}
