package com.misrhr.API;

import com.misrhr.identifier.MisrBand;
import com.misrhr.identifier.MisrCamera;
import com.misrhr.identifier.MisrMode;
import com.misrhr.resample.Downsampler;
import com.misrhr.resample.GridChecks;
import com.misrhr.resample.GridKind;
import com.misrhr.resample.MisrGrids;
import com.misrhr.resample.Upsampler;
import com.misrhr.specs.MisrSpecs;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Entry point of the resampling core for the processing pipeline.
 */
@Slf4j
@Service
public class ResamplingService {

    @Autowired
    private Upsampler upsampler;

    @Autowired
    private Downsampler downsampler;

    public Mat upsample(Mat grid) {
        return upsampler.upsample(grid);
    }

    public Mat downsample(Mat grid, GridKind kind) {
        return downsampler.downsample(grid, kind);
    }

    public Mat downsample(Mat grid, String kindName) {
        return downsampler.downsample(grid, kindName);
    }

    /**
     * Brings one channel to the 275 m grid. Channels already delivered at full resolution
     * in this mode are copied, the others are replicated from the 1100 m grid.
     */
    public Mat toHighResolution(Mat grid, MisrCamera camera, MisrBand band, MisrMode mode) {
        if (MisrSpecs.isFullResolution(mode, camera, band)) {
            GridChecks.requireGrid(grid);
            GridChecks.requireShape(grid, MisrGrids.HR_COLUMNS, MisrGrids.HR_ROWS);
            log.debug("{}_{} is full resolution in {}, copying", camera.getCode(), band.getLabel(), mode.getCode());
            Mat copy = new Mat();
            grid.copyTo(copy);
            return copy;
        }
        return upsampler.upsample(grid);
    }

    public Mat toLowResolution(Mat grid, GridKind kind) {
        return downsampler.downsample(grid, kind);
    }
}
