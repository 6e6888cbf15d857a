package com.rapidnpe;

public enum ErrorKind {
    INVALID_EXPRESSION,
    CELL_NOT_FOUND;
}
