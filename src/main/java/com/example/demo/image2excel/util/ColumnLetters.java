package com.example.demo.image2excel.util;

/**
 * Spreadsheet column addressing: bijective base-26 over {@code A..Z}.
 *
 * 1 -> "A", 26 -> "Z", 27 -> "AA", 52 -> "AZ", 53 -> "BA", 702 -> "ZZ", 703 -> "AAA".
 * There is no letter for zero, so a remainder of 0 is read as 26 with a borrow from the quotient.
 */
public final class ColumnLetters {

    private static final int RADIX = 26;

    private ColumnLetters() {
    }

    /**
     * Letters for a 1-based column number.
     *
     * @param column column number, at least 1
     * @return column letters, e.g. "C" for 3
     */
    public static String of(int column) {
        if (column <= 0) {
            throw new IllegalArgumentException("Column number must be at least 1: " + column);
        }

        StringBuilder letters = new StringBuilder();
        int remaining = column;
        while (remaining > 0) {
            int remainder = remaining % RADIX;
            remaining = remaining / RADIX;
            if (remainder == 0) {
                remainder = RADIX;
                remaining--;
            }
            letters.append((char) ('A' + remainder - 1));
        }
        return letters.reverse().toString();
    }

    /**
     * Letters for columns 1..width, element {@code j - 1} holding column {@code j}.
     * Computed once per run and shared read-only by all row workers.
     */
    public static String[] range(int width) {
        String[] letters = new String[width];
        for (int j = 1; j <= width; j++) {
            letters[j - 1] = of(j);
        }
        return letters;
    }
}
