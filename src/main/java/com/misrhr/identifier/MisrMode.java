package com.misrhr.identifier;

import com.misrhr.exception.ErrorKind;
import com.misrhr.exception.MisrHrException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;

/**
 * Acquisition mode. In Local Mode every channel is delivered at full resolution.
 */
@Getter
@AllArgsConstructor
public enum MisrMode {
    GM("GM", "Global Mode"),
    LM("LM", "Local Mode");

    private final String code;
    private final String description;

    public static MisrMode fromCode(String code) {
        if (code != null) {
            String wanted = code.trim().toUpperCase(Locale.ROOT);
            for (MisrMode mode : values()) {
                if (mode.code.equals(wanted)) return mode;
            }
        }
        throw new MisrHrException(ErrorKind.INVALID_IDENTIFIER, "invalid MISR mode '" + code + "'");
    }
}
