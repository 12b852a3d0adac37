package com.godzilla.ast;

import java.math.BigDecimal;

public record NumericLiteral(
    int start,
    int end,
    SourceLocation loc,
    double value,
    Extra extra     // Can be null
) implements Literal {

    /**
     * The literal as written when the document kept it ({@code 0x1F}, {@code 1e3}),
     * otherwise the shortest plain rendering of the value.
     */
    public String text() {
        if (extra != null && extra.raw() != null && !extra.raw().isEmpty()) {
            return extra.raw();
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public String type() {
        return "NumericLiteral";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
