package com.misrhr.resample;

import com.misrhr.exception.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.indexer.Indexer;
import org.bytedeco.opencv.opencv_core.Mat;

import static com.misrhr.resample.MisrGrids.*;

/**
 * Expands a low-resolution grid (512 x 128) to the high-resolution grid (2048 x 512)
 * by nearest-neighbour replication: every input cell fills a 4x4 block unchanged.
 * No interpolation takes place, so downsampling the result is not an identity.
 */
@Slf4j
public class Upsampler {

    public Mat upsample(Mat grid) {
        GridChecks.requireGrid(grid);
        int depth = grid.depth();
        if (!GridChecks.isNumericDepth(depth)) {
            throw GridChecks.reject(ErrorKind.INVALID_ARGUMENT,
                    "unsupported element type " + GridChecks.depthName(depth));
        }
        GridChecks.requireShape(grid, LR_COLUMNS, LR_ROWS);

        Mat result = new Mat(HR_ROWS, HR_COLUMNS, grid.type());
        Indexer in = grid.createIndexer();
        Indexer out = result.createIndexer();

        long[] position = new long[2];
        for (int y = 0; y < LR_ROWS; y++) {
            for (int x = 0; x < LR_COLUMNS; x++) {
                double value = in.getDouble(y, x);
                for (int dy = 0; dy < FACTOR; dy++) {
                    position[0] = (long) y * FACTOR + dy;
                    for (int dx = 0; dx < FACTOR; dx++) {
                        position[1] = (long) x * FACTOR + dx;
                        out.putDouble(position, value);
                    }
                }
            }
        }
        in.release();
        out.release();

        log.debug("Upsampled {} grid {} -> {}", GridChecks.depthName(depth),
                describe(LR_COLUMNS, LR_ROWS), describe(HR_COLUMNS, HR_ROWS));
        return result;
    }
}
