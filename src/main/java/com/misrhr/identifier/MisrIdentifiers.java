package com.misrhr.identifier;

import com.misrhr.exception.ErrorKind;
import com.misrhr.exception.MisrHrException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Range checks and string conversions for PATH, ORBIT and BLOCK numbers.
 * String forms carry a one-letter prefix and a zero-padded number: P168, O068050, B110.
 */
public class MisrIdentifiers {
    public static final int MIN_PATH = 1;
    public static final int MAX_PATH = 233;
    // first orbit of the MISR science mission (February 2000)
    public static final int MIN_ORBIT = 995;
    public static final int MAX_ORBIT = 999999;
    public static final int MIN_BLOCK = 1;
    public static final int MAX_BLOCK = 180;

    private static final Pattern PATH_PATTERN = Pattern.compile("[Pp]?(\\d{1,3})");
    private static final Pattern ORBIT_PATTERN = Pattern.compile("[Oo]?(\\d{1,6})");
    private static final Pattern BLOCK_PATTERN = Pattern.compile("[Bb]?(\\d{1,3})");

    private MisrIdentifiers() {
    }

    public static int checkPath(int path) {
        return checkRange("PATH", path, MIN_PATH, MAX_PATH);
    }

    public static int checkOrbit(int orbit) {
        return checkRange("ORBIT", orbit, MIN_ORBIT, MAX_ORBIT);
    }

    public static int checkBlock(int block) {
        return checkRange("BLOCK", block, MIN_BLOCK, MAX_BLOCK);
    }

    public static String pathToString(int path) {
        return String.format("P%03d", checkPath(path));
    }

    public static String orbitToString(int orbit) {
        return String.format("O%06d", checkOrbit(orbit));
    }

    public static String blockToString(int block) {
        return String.format("B%03d", checkBlock(block));
    }

    public static int parsePath(String text) {
        return checkPath(parse("PATH", text, PATH_PATTERN));
    }

    public static int parseOrbit(String text) {
        return checkOrbit(parse("ORBIT", text, ORBIT_PATTERN));
    }

    public static int parseBlock(String text) {
        return checkBlock(parse("BLOCK", text, BLOCK_PATTERN));
    }

    private static int parse(String what, String text, Pattern pattern) {
        if (text == null) {
            throw new MisrHrException(ErrorKind.INVALID_IDENTIFIER, what + " string is null");
        }
        Matcher m = pattern.matcher(text.trim());
        if (!m.matches()) {
            throw new MisrHrException(ErrorKind.INVALID_IDENTIFIER, "malformed " + what + " '" + text + "'");
        }
        return Integer.parseInt(m.group(1));
    }

    private static int checkRange(String what, int value, int min, int max) {
        if (value < min || value > max) {
            throw new MisrHrException(ErrorKind.INVALID_IDENTIFIER,
                    what + " " + value + " outside [" + min + ", " + max + "]");
        }
        return value;
    }
}
