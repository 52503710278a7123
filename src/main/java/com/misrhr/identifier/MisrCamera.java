package com.misrhr.identifier;

import com.misrhr.exception.ErrorKind;
import com.misrhr.exception.MisrHrException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;

/**
 * The nine MISR cameras, in along-track order from the most forward to the most aft.
 */
@Getter
@AllArgsConstructor
public enum MisrCamera {
    DF("DF", 70.5, -1),
    CF("CF", 60.0, -1),
    BF("BF", 45.6, -1),
    AF("AF", 26.1, -1),
    AN("AN", 0.0, 0),
    AA("AA", 26.1, 1),
    BA("BA", 45.6, 1),
    CA("CA", 60.0, 1),
    DA("DA", 70.5, 1);

    private final String code;
    // nominal view zenith angle in degrees
    private final double viewAngle;
    // -1 forward, 0 nadir, +1 aft
    private final int direction;

    public boolean isNadir() {
        return direction == 0;
    }

    public static MisrCamera fromCode(String code) {
        if (code != null) {
            String wanted = code.trim().toUpperCase(Locale.ROOT);
            for (MisrCamera camera : values()) {
                if (camera.code.equals(wanted)) return camera;
            }
        }
        throw new MisrHrException(ErrorKind.INVALID_IDENTIFIER, "invalid MISR camera '" + code + "'");
    }
}
