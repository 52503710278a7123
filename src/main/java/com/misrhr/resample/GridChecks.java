package com.misrhr.resample;

import com.misrhr.exception.ErrorKind;
import com.misrhr.exception.MisrHrException;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.*;

@Slf4j
public class GridChecks {

    private GridChecks() {
    }

    public static void requireGrid(Mat grid) {
        if (grid == null || grid.isNull()) {
            throw reject(ErrorKind.INVALID_ARGUMENT, "grid is null");
        }
        if (grid.empty()) {
            throw reject(ErrorKind.INVALID_ARGUMENT, "grid is empty");
        }
        if (grid.dims() != 2 || grid.channels() != 1) {
            throw reject(ErrorKind.INVALID_ARGUMENT,
                    "expected a 2-D single-channel grid, got dims=" + grid.dims() + " channels=" + grid.channels());
        }
    }

    public static boolean isNumericDepth(int depth) {
        return depth == CV_8U || depth == CV_8S || depth == CV_16U || depth == CV_16S
                || depth == CV_32S || depth == CV_32F || depth == CV_64F;
    }

    public static void requireShape(Mat grid, int columns, int rows) {
        if (grid.cols() != columns || grid.rows() != rows) {
            throw reject(ErrorKind.SHAPE_MISMATCH, "expected " + MisrGrids.describe(columns, rows)
                    + ", got " + MisrGrids.describe(grid.cols(), grid.rows()));
        }
    }

    public static MisrHrException reject(ErrorKind kind, String message) {
        log.debug("Rejected grid ({}): {}", kind, message);
        return new MisrHrException(kind, message);
    }

    public static String depthName(int depth) {
        if (depth == CV_8U) return "8U";
        if (depth == CV_8S) return "8S";
        if (depth == CV_16U) return "16U";
        if (depth == CV_16S) return "16S";
        if (depth == CV_32S) return "32S";
        if (depth == CV_32F) return "32F";
        if (depth == CV_64F) return "64F";
        return "depth " + depth;
    }
}
