package com.misrhr.API;

import com.misrhr.exception.ErrorKind;
import com.misrhr.identifier.MisrBand;
import com.misrhr.identifier.MisrCamera;
import com.misrhr.identifier.MisrMode;
import com.misrhr.resample.GridKind;
import com.misrhr.resample.MisrGrids;
import com.misrhr.resample.GridFixtures;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.bytedeco.opencv.global.opencv_core.*;

@SpringJUnitConfig(MisrHrConfig.class)
class ResamplingServiceTest {

    @Autowired
    private ResamplingService resamplingService;

    @Test
    void reducedResolutionChannelIsUpsampled() {
        Mat grid = GridFixtures.lowResolution(CV_16UC1, 0);
        GridFixtures.set(grid, 2, 1, 4321);

        Mat result = resamplingService.toHighResolution(grid, MisrCamera.DF, MisrBand.BLUE, MisrMode.GM);

        assertThat(result.cols()).isEqualTo(MisrGrids.HR_COLUMNS);
        assertThat(GridFixtures.get(result, 11, 7)).isEqualTo(4321.0);
    }

    @Test
    void fullResolutionChannelIsCopied() {
        Mat grid = GridFixtures.highResolution(CV_16UC1, 17);

        Mat result = resamplingService.toHighResolution(grid, MisrCamera.BA, MisrBand.RED, MisrMode.GM);
        GridFixtures.set(result, 0, 0, 99);

        assertThat(GridFixtures.sameContent(result, grid)).isFalse();
        assertThat(GridFixtures.get(grid, 0, 0)).isEqualTo(17.0);
        assertThat(GridFixtures.get(result, 2047, 511)).isEqualTo(17.0);
    }

    @Test
    void fullResolutionChannelMustHaveHighResolutionShape() {
        Mat grid = GridFixtures.lowResolution(CV_16UC1, 0);
        GridFixtures.assertRejected(() -> resamplingService.toHighResolution(grid, MisrCamera.AN, MisrBand.NIR, MisrMode.LM),
                ErrorKind.SHAPE_MISMATCH);
    }

    @Test
    void toLowResolutionDownsamples() {
        Mat grid = GridFixtures.highResolution(CV_8UC1, 2);
        GridFixtures.setWindow(grid, 4, 4, 3);

        Mat result = resamplingService.toLowResolution(grid, GridKind.RDQI);

        assertThat(result.rows()).isEqualTo(MisrGrids.LR_ROWS);
        assertThat(GridFixtures.get(result, 4, 4)).isEqualTo(3.0);
        assertThat(GridFixtures.get(result, 5, 4)).isEqualTo(2.0);
    }

    @Test
    void namedKindIsPassedThrough() {
        Mat grid = GridFixtures.highResolution(CV_32FC1, 0.0);
        GridFixtures.assertRejected(() -> resamplingService.downsample(grid, "Cloud"), ErrorKind.UNRECOGNIZED_KIND);
        assertThat(resamplingService.downsample(grid, "Radiance").type()).isEqualTo(CV_32FC1);
    }
}
