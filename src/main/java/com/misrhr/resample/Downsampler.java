package com.misrhr.resample;

import com.misrhr.exception.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.indexer.Indexer;
import org.bytedeco.opencv.opencv_core.Mat;

import static com.misrhr.resample.MisrGrids.*;
import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * Reduces a high-resolution grid (2048 x 512) to the low-resolution grid (512 x 128).
 * Each output cell is computed from one non-overlapping 4x4 window with the rule
 * of the declared {@link GridKind}; see {@link WindowAggregation}.
 */
@Slf4j
public class Downsampler {

    public Mat downsample(Mat grid, String kindName) {
        requireElementType(grid);
        return downsample(grid, GridKind.fromName(kindName));
    }

    public Mat downsample(Mat grid, GridKind kind) {
        int depth = requireElementType(grid);
        if (kind == null) {
            throw GridChecks.reject(ErrorKind.UNRECOGNIZED_KIND, "grid kind is null");
        }
        if (!kind.acceptsDepth(depth)) {
            throw GridChecks.reject(ErrorKind.TYPE_KIND_MISMATCH,
                    "kind " + kind + " cannot be held by a " + GridChecks.depthName(depth) + " grid");
        }
        GridChecks.requireShape(grid, HR_COLUMNS, HR_ROWS);

        Mat result = new Mat(LR_ROWS, LR_COLUMNS, grid.type());
        Indexer in = grid.createIndexer();
        Indexer out = result.createIndexer();

        double[] window = new double[WINDOW_SIZE];
        long[] position = new long[2];
        for (int j = 0; j < LR_ROWS; j++) {
            for (int i = 0; i < LR_COLUMNS; i++) {
                int k = 0;
                for (int dy = 0; dy < FACTOR; dy++) {
                    for (int dx = 0; dx < FACTOR; dx++) {
                        window[k++] = in.getDouble((long) j * FACTOR + dy, (long) i * FACTOR + dx);
                    }
                }
                position[0] = j;
                position[1] = i;
                out.putDouble(position, WindowAggregation.aggregate(kind, window));
            }
        }
        in.release();
        out.release();

        log.debug("Downsampled {} grid as {} {} -> {}", GridChecks.depthName(depth), kind,
                describe(HR_COLUMNS, HR_ROWS), describe(LR_COLUMNS, LR_ROWS));
        return result;
    }

    private static int requireElementType(Mat grid) {
        GridChecks.requireGrid(grid);
        int depth = grid.depth();
        if (depth != CV_8U && depth != CV_16U && depth != CV_32F && depth != CV_64F) {
            throw GridChecks.reject(ErrorKind.INVALID_ARGUMENT,
                    "element type " + GridChecks.depthName(depth) + " is not byte, uint16 or floating-point");
        }
        return depth;
    }
}
