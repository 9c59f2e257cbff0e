package com.gnovoa.swiss.model;

public enum MatchScore {
    LOSS,
    DRAW,
    WIN;

    public MatchScore invert() {
        return switch (this) {
            case LOSS -> WIN;
            case WIN -> LOSS;
            case DRAW -> DRAW;
        };
    }
}
