package com.misrhr.specs;

import com.misrhr.identifier.MisrBand;
import com.misrhr.identifier.MisrCamera;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One camera/band combination, for instance AN_Red.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class MisrChannel {
    private final MisrCamera camera;
    private final MisrBand band;

    public String getName() {
        return camera.getCode() + "_" + band.getLabel();
    }

    @Override
    public String toString() {
        return getName();
    }
}
