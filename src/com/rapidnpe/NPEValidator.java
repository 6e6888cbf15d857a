package com.rapidnpe;

/**
 * Checks that a string is a Normalized Polish Expression: no operand used twice, no identical
 * adjacent operators and the balloting property (operands outnumber operators on every prefix,
 * by exactly one at the end).
 */
public class NPEValidator {

    private NPEValidator() {
    }

    public static boolean isValid(String npe) {
        return validate(npe) == null;
    }

    /**
     * @return null if the expression is valid, the reason of the first violation otherwise
     */
    public static String validate(String npe) {
        if (npe == null) {
            return "expression is null";
        }

        int operands = 0;
        int operators = 0;
        for (int i = 0; i < npe.length(); i++) {
            char symbol = npe.charAt(i);
            if (CutDirection.isOperatorSymbol(symbol)) {
                if (i + 1 < npe.length() && npe.charAt(i + 1) == symbol) {
                    return "repeated operator " + symbol + " at position " + i;
                }
                operators++;
            } else {
                if (npe.indexOf(symbol, i + 1) != -1) {
                    return "operand " + symbol + " appears more than once";
                }
                operands++;
            }

            if (operands <= operators) {
                return "balloting property violated at position " + i;
            }
        }

        if (operators != operands - 1) {
            return String.format("expected %d operators for %d operands, found %d", operands - 1, operands, operators);
        }
        return null;
    }
}
