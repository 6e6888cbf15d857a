package com.rapidnpe;

public class CellNotFoundException extends FloorplanException {
    public CellNotFoundException(String message) {
        super(ErrorKind.CELL_NOT_FOUND, message);
    }
}
