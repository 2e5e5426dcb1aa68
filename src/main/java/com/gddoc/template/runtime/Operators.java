package com.gddoc.template.runtime;

import java.util.ArrayList;
import java.util.List;

import com.gddoc.template.SourcePosition;
import com.gddoc.template.TemplateTypeException;

/**
 * Arithmetic, concatenation and membership operators.
 */
final class Operators {

    private Operators() {
    }

    static Value binary(String op, Value left, Value right, SourcePosition position) throws TemplateTypeException {
        if ("~".equals(op)) {
            return new StringValue(left.asText() + right.asText());
        }
        if ("+".equals(op)) {
            if (left instanceof StringValue && right instanceof StringValue) {
                return new StringValue(left.asText() + right.asText());
            }
            if (left instanceof ListValue && right instanceof ListValue) {
                List<Value> joined = new ArrayList<>(((ListValue) left).items());
                joined.addAll(((ListValue) right).items());
                return new ListValue(joined);
            }
        }
        if (!(left instanceof NumberValue) || !(right instanceof NumberValue)) {
            throw new TemplateTypeException(op, "unsupported operand kinds " + left.kind() + " and " + right.kind(),
                    position);
        }
        return arithmetic(op, (NumberValue) left, (NumberValue) right, position);
    }

    static Value negate(Value operand, SourcePosition position) throws TemplateTypeException {
        if (!(operand instanceof NumberValue)) {
            throw new TemplateTypeException("-", "cannot negate " + operand.kind(), position);
        }
        NumberValue number = (NumberValue) operand;
        if (!number.isIntegral()) {
            return new NumberValue(-number.doubleValue());
        }
        try {
            return new NumberValue(Math.negateExact(number.longValue()));
        } catch (ArithmeticException e) {
            throw new TemplateTypeException("-", "integer overflow", position);
        }
    }

    static boolean contains(Value container, Value item, String op, SourcePosition position)
            throws TemplateTypeException {
        if (container.isNone()) {
            return false;
        }
        if (container instanceof StringValue) {
            if (!(item instanceof StringValue)) {
                throw new TemplateTypeException(op, "left operand must be a string, got " + item.kind(), position);
            }
            return ((StringValue) container).value().contains(((StringValue) item).value());
        }
        if (container instanceof ListValue) {
            for (Value element : ((ListValue) container).items()) {
                if (Values.equal(element, item)) {
                    return true;
                }
            }
            return false;
        }
        if (container instanceof RecordValue) {
            return item instanceof StringValue
                    && ((RecordValue) container).fields().containsKey(((StringValue) item).value());
        }
        throw new TemplateTypeException(op, container.kind() + " is not a container", position);
    }

    private static Value arithmetic(String op, NumberValue left, NumberValue right, SourcePosition position)
            throws TemplateTypeException {
        boolean integral = left.isIntegral() && right.isIntegral();
        if ("/".equals(op) || "//".equals(op) || "%".equals(op)) {
            requireNonZero(op, right, position);
        }
        try {
            return switch (op) {
                case "+" -> integral ? new NumberValue(Math.addExact(left.longValue(), right.longValue()))
                        : new NumberValue(left.doubleValue() + right.doubleValue());
                case "-" -> integral ? new NumberValue(Math.subtractExact(left.longValue(), right.longValue()))
                        : new NumberValue(left.doubleValue() - right.doubleValue());
                case "*" -> integral ? new NumberValue(Math.multiplyExact(left.longValue(), right.longValue()))
                        : new NumberValue(left.doubleValue() * right.doubleValue());
                case "/" -> new NumberValue(left.doubleValue() / right.doubleValue());
                case "//" -> integral ? new NumberValue(floorDivExact(left.longValue(), right.longValue()))
                        : new NumberValue(Math.floor(left.doubleValue() / right.doubleValue()));
                case "%" -> integral ? new NumberValue(Math.floorMod(left.longValue(), right.longValue()))
                        : new NumberValue(left.doubleValue()
                                - right.doubleValue() * Math.floor(left.doubleValue() / right.doubleValue()));
                default -> throw new TemplateTypeException(op, "unknown operator", position);
            };
        } catch (ArithmeticException e) {
            throw new TemplateTypeException(op, "integer overflow", position);
        }
    }

    private static long floorDivExact(long dividend, long divisor) {
        if (dividend == Long.MIN_VALUE && divisor == -1) {
            throw new ArithmeticException("long overflow");
        }
        return Math.floorDiv(dividend, divisor);
    }

    private static void requireNonZero(String op, NumberValue divisor, SourcePosition position)
            throws TemplateTypeException {
        if (divisor.doubleValue() == 0.0) {
            throw new TemplateTypeException(op, "division by zero", position);
        }
    }
}
