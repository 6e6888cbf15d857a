package com.rapidnpe;

public enum CutDirection {
    VERTICAL('V'),
    HORIZONTAL('H');

    private final char symbol;

    private CutDirection(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    public static boolean isOperatorSymbol(char symbol) {
        return symbol == VERTICAL.symbol || symbol == HORIZONTAL.symbol;
    }

    public static CutDirection fromSymbol(char symbol) {
        for (CutDirection direction : values()) {
            if (direction.symbol == symbol) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown cut operator: " + symbol);
    }
}
