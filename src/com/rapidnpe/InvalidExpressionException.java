package com.rapidnpe;

public class InvalidExpressionException extends FloorplanException {
    public InvalidExpressionException(String message) {
        super(ErrorKind.INVALID_EXPRESSION, message);
    }
}
