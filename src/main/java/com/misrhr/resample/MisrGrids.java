package com.misrhr.resample;

public class MisrGrids {
    // Grid dimensions are given as [columns, rows], Mat stores them as rows x cols
    public static final int HR_COLUMNS = 2048;
    public static final int HR_ROWS = 512;
    public static final int LR_COLUMNS = 512;
    public static final int LR_ROWS = 128;

    // Linear factor per axis, one low-resolution cell covers FACTOR x FACTOR high-resolution cells
    public static final int FACTOR = 4;
    public static final int WINDOW_SIZE = FACTOR * FACTOR;

    private MisrGrids() {
    }

    public static boolean isHighResolution(int columns, int rows) {
        return columns == HR_COLUMNS && rows == HR_ROWS;
    }

    public static boolean isLowResolution(int columns, int rows) {
        return columns == LR_COLUMNS && rows == LR_ROWS;
    }

    public static String describe(int columns, int rows) {
        return "[" + columns + ", " + rows + "]";
    }
}
