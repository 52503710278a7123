package com.misrhr.exception;

/**
 * Which precondition a rejected call violated.
 */
public enum ErrorKind {
    // wrong element type, null or non-grid input
    INVALID_ARGUMENT,
    // grid present but with the wrong dimensions
    SHAPE_MISMATCH,
    // downsample kind outside the closed set of grid kinds
    UNRECOGNIZED_KIND,
    // kind declared for a grid whose element type cannot carry it
    TYPE_KIND_MISMATCH,
    // PATH, ORBIT, BLOCK, CAMERA, BAND or MODE out of range or malformed
    INVALID_IDENTIFIER
}
