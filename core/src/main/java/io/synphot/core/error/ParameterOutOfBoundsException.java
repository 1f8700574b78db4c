package io.synphot.core.error;

/** Thrown when a catalog parameter is outside the grid or a grid cell has no valid flux. */
public final class ParameterOutOfBoundsException extends SynphotException {

    private static final long serialVersionUID = 1L;

    public ParameterOutOfBoundsException(String message, String grid) {
        super(message, ErrorKind.PARAMETER_OUT_OF_BOUNDS, grid);
    }
}
