package com.rapidnpe;

public class FloorplanException extends RuntimeException {
    private final ErrorKind errorKind;

    public FloorplanException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public static FloorplanException of(BuildResult result) {
        assert !result.isSuccess();
        switch (result.getErrorKind()) {
            case INVALID_EXPRESSION:
                return new InvalidExpressionException(result.getMessage());
            case CELL_NOT_FOUND:
                return new CellNotFoundException(result.getMessage());
            default:
                return new FloorplanException(result.getErrorKind(), result.getMessage());
        }
    }
}
