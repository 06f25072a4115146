package com.exprtree.eval;

import com.exprtree.ast.Numbers;
import com.exprtree.ast.Operator;
import com.exprtree.exception.DivisionByZeroException;

import java.math.BigInteger;

/**
 * Numeric promotion rules for the four operators.
 * <p>
 * {@code + - *} stay integral when both operands are integers and widen to
 * {@link Double} otherwise. Integer operations are carried out exactly in {@link BigInteger}
 * and the result is narrowed back to {@link Long} when it fits, so they never overflow.
 * {@code /} always produces a {@link Double}, even for exact integer quotients.
 * <p>
 * {@link Operator} is closed, so the switch below covers every value. An operator outside
 * the four can never reach it: {@link Operator#fromSymbol(char)} and
 * {@link Operator#fromTokenType} raise
 * {@link com.exprtree.exception.InvariantViolationException} for anything else.
 */
final class Arithmetic {

    private Arithmetic() {
    }

    static Number apply(Operator op, Number left, Number right) {
        return switch (op) {
            case PLUS -> add(left, right);
            case MINUS -> subtract(left, right);
            case STAR -> multiply(left, right);
            case SLASH -> divide(left, right);
        };
    }

    static Number add(Number left, Number right) {
        if (bothIntegral(left, right)) {
            return Numbers.narrow(Numbers.toBigInteger(left).add(Numbers.toBigInteger(right)));
        }
        return left.doubleValue() + right.doubleValue();
    }

    static Number subtract(Number left, Number right) {
        if (bothIntegral(left, right)) {
            return Numbers.narrow(Numbers.toBigInteger(left).subtract(Numbers.toBigInteger(right)));
        }
        return left.doubleValue() - right.doubleValue();
    }

    static Number multiply(Number left, Number right) {
        if (bothIntegral(left, right)) {
            return Numbers.narrow(Numbers.toBigInteger(left).multiply(Numbers.toBigInteger(right)));
        }
        return left.doubleValue() * right.doubleValue();
    }

    static Double divide(Number left, Number right) {
        if (isZero(right)) {
            throw new DivisionByZeroException("Division by zero: " + left + " / " + right);
        }
        return left.doubleValue() / right.doubleValue();
    }

    static boolean isZero(Number value) {
        if (value instanceof BigInteger) {
            return ((BigInteger) value).signum() == 0;
        }
        if (value instanceof Long) {
            return value.longValue() == 0L;
        }
        // -0.0 == 0.0 holds for primitives
        return value.doubleValue() == 0.0;
    }

    private static boolean bothIntegral(Number left, Number right) {
        return Numbers.isIntegral(left) && Numbers.isIntegral(right);
    }
}
