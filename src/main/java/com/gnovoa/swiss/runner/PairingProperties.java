package com.gnovoa.swiss.runner;

import com.gnovoa.swiss.model.Color;
import com.gnovoa.swiss.model.PointTable;
import com.gnovoa.swiss.schedule.PairingSystemType;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine defaults, bound from {@code pairing.*}.
 *
 * @param system default pairing system ({@code dutch} or {@code burstein})
 * @param section section tag written on generated pairings when the request has none
 * @param startingBoard number of the first board
 * @param expectedRounds total rounds when the request does not say
 * @param points scoring table in points (1.0, 0.5, ...)
 * @param initialColor colour of the top board in round one
 * @param trf TRF file to pair at startup
 */
@ConfigurationProperties(prefix = "pairing")
public record PairingProperties(
        String system,
        String section,
        int startingBoard,
        int expectedRounds,
        Points points,
        String initialColor,
        Trf trf
) {

    public PairingProperties {
        if (system == null || system.isBlank()) system = PairingSystemType.DUTCH.code();
        if (section == null || section.isBlank()) section = "Open";
        if (startingBoard < 1) startingBoard = 1;
        if (points == null) points = new Points(null, null, null, null, null, null);
        if (initialColor == null || initialColor.isBlank()) initialColor = "white";
        if (trf == null) trf = new Trf(null, null);
    }

    public PairingSystemType systemType() {
        return PairingSystemType.fromCode(system);
    }

    public Color initialColorValue() {
        return "black".equalsIgnoreCase(initialColor.trim()) ? Color.BLACK : Color.WHITE;
    }

    public record Points(
            Double win,
            Double draw,
            Double loss,
            Double zeroPointBye,
            Double forfeitLoss,
            Double pairingAllocatedBye
    ) {

        /** Unset entries fall back to the FIDE defaults. */
        public PointTable toPointTable() {
            PointTable d = PointTable.DEFAULT;
            return new PointTable(
                    tenths(win, d.win()),
                    tenths(draw, d.draw()),
                    tenths(loss, d.loss()),
                    tenths(zeroPointBye, d.zeroPointBye()),
                    tenths(forfeitLoss, d.forfeitLoss()),
                    tenths(pairingAllocatedBye, d.pairingAllocatedBye()));
        }

        private static int tenths(Double points, int fallback) {
            return points == null ? fallback : (int) Math.round(points * 10);
        }
    }

    /**
     * @param input TRF file paired once the application is ready; nothing happens when unset
     * @param output file receiving the JaVaFo pairing block; logged when unset
     */
    public record Trf(String input, String output) {}
}
