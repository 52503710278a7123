package com.misrhr.identifier;

import com.misrhr.exception.ErrorKind;
import com.misrhr.exception.MisrHrException;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum MisrBand {
    BLUE("Blue", 446.4),
    GREEN("Green", 557.5),
    RED("Red", 671.7),
    NIR("NIR", 866.4);

    private final String label;
    // band centre wavelength in nm
    private final double wavelength;

    public static MisrBand fromName(String name) {
        if (name != null) {
            String wanted = name.trim();
            for (MisrBand band : values()) {
                if (band.label.equalsIgnoreCase(wanted)) return band;
            }
        }
        throw new MisrHrException(ErrorKind.INVALID_IDENTIFIER, "invalid MISR band '" + name + "'");
    }
}
