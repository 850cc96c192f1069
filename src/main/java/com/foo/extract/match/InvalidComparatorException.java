package com.foo.extract.match;

import lombok.Getter;

@Getter
public class InvalidComparatorException extends ExtractConfigurationException {

    private final Operator operator;
    private final CellValue operand;

    public InvalidComparatorException(Operator operator, CellValue operand, String reason) {
        super("Invalid comparator %s %s: %s".formatted(operator, operand.toDisplayString(), reason));
        this.operator = operator;
        this.operand = operand;
    }

    public InvalidComparatorException(Operator operator, CellValue operand, String reason, Throwable cause) {
        super(null, "Invalid comparator %s %s: %s".formatted(operator, operand.toDisplayString(), reason), cause);
        this.operator = operator;
        this.operand = operand;
    }
}
