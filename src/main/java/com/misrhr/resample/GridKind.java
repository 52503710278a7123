package com.misrhr.resample;

import com.misrhr.exception.ErrorKind;
import com.misrhr.exception.MisrHrException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;

import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * Semantic nature of the values held by a MISR grid. Selects the aggregation rule
 * used by {@link Downsampler} and fixes the element types the grid may have.
 */
@Getter
@AllArgsConstructor
public enum GridKind {
    RDQI("RDQI", new String[]{"RDQI"}),
    MASK("Mask", new String[]{"Mask"}),
    SCALED_RADIANCE_WITH_FLAG("ScaledRadianceWithFlag",
            new String[]{"ScaledRadianceWithFlag", "Scaled radiance with flag"}),
    RADIANCE("Radiance", new String[]{"Radiance"}),
    REFLECTANCE_FACTOR("ReflectanceFactor",
            new String[]{"ReflectanceFactor", "Reflectance factor", "BRF"});

    private final String label;
    private final String[] aliases;

    /**
     * @return true when a grid of the given Mat depth may carry values of this kind.
     */
    public boolean acceptsDepth(int depth) {
        switch (this) {
            case RDQI:
            case MASK:
                return depth == CV_8U;
            case SCALED_RADIANCE_WITH_FLAG:
                return depth == CV_16U;
            default:
                return depth == CV_32F || depth == CV_64F;
        }
    }

    public static GridKind fromName(String name) {
        if (name == null) {
            throw new MisrHrException(ErrorKind.UNRECOGNIZED_KIND, "grid kind is null");
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        for (GridKind kind : values()) {
            for (String alias : kind.aliases) {
                if (alias.toLowerCase(Locale.ROOT).equals(wanted)) return kind;
            }
        }
        throw new MisrHrException(ErrorKind.UNRECOGNIZED_KIND, "unknown grid kind '" + name + "'");
    }

    @Override
    public String toString() {
        return label;
    }
}
