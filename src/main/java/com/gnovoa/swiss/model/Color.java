package com.gnovoa.swiss.model;

/** Piece colour played in a game, or {@link #NONE} for byes and "no preference". */
public enum Color {
    WHITE,
    BLACK,
    NONE;

    public Color invert() {
        return switch (this) {
            case WHITE -> BLACK;
            case BLACK -> WHITE;
            case NONE -> NONE;
        };
    }
}
