package com.gnovoa.swiss.trf;

/**
 * One fixed-width column range of a TRF line.
 *
 * @param name label used in parse errors
 * @param offset 0-based start column
 * @param width number of columns
 * @param rightAligned numbers are right aligned, text left aligned
 */
public record TrfField(String name, int offset, int width, boolean rightAligned) {

    public static TrfField text(String name, int offset, int width) {
        return new TrfField(name, offset, width, false);
    }

    public static TrfField number(String name, int offset, int width) {
        return new TrfField(name, offset, width, true);
    }

    public int end() {
        return offset + width;
    }

    /** Pads {@code value} to the field width; text is cut, numbers must fit. */
    public String format(String value) {
        String v = value == null ? "" : value;
        if (v.length() > width) {
            if (rightAligned) throw new IllegalArgumentException(name + " value '" + v + "' exceeds " + width + " columns");
            v = v.substring(0, width);
        }
        String pad = " ".repeat(width - v.length());
        return rightAligned ? pad + v : v + pad;
    }

    /** @return trimmed content, empty when the line ends before the field. */
    public String read(String line) {
        if (line.length() <= offset) return "";
        return line.substring(offset, Math.min(end(), line.length())).trim();
    }

    public boolean fitsIn(String line) {
        return line.length() >= end();
    }
}
