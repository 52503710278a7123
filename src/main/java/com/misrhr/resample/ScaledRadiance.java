package com.misrhr.resample;

import com.misrhr.exception.ErrorKind;
import com.misrhr.exception.MisrHrException;

/**
 * Scaled radiances are stored as unsigned 16-bit words with the 2-bit RDQI in the low bits.
 */
public class ScaledRadiance {
    public static final int MAX_USABLE = 65506;
    public static final int OBSCURED = 65511;
    public static final int EDGE = 65515;
    public static final int BAD = 65523;

    public static final int MAX_FLAG = 3;
    public static final int MAX_RADIANCE = 0xFFFF >> 2;

    private ScaledRadiance() {
    }

    public static boolean isUsable(int value) {
        return value > 0 && value <= MAX_USABLE;
    }

    public static int radianceOf(int value) {
        return value >> 2;
    }

    public static int flagOf(int value) {
        return value - (radianceOf(value) << 2);
    }

    public static int pack(int radiance, int flag) {
        if (flag < 0 || flag > MAX_FLAG) {
            throw new MisrHrException(ErrorKind.INVALID_ARGUMENT, "RDQI flag " + flag + " outside [0, 3]");
        }
        if (radiance < 0 || radiance > MAX_RADIANCE) {
            throw new MisrHrException(ErrorKind.INVALID_ARGUMENT,
                    "scaled radiance " + radiance + " outside [0, " + MAX_RADIANCE + "]");
        }
        return (radiance << 2) + flag;
    }
}
