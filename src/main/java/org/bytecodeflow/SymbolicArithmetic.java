package org.bytecodeflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Set;

/**
 * Best-effort constant folding. Numeric scalars are evaluated with Java
 * arithmetic ({@code long} with overflow checks, {@code double} otherwise);
 * every other combination, and every evaluation failure, yields display text.
 */
final class SymbolicArithmetic {

    private static final Logger log = LoggerFactory.getLogger(SymbolicArithmetic.class);

    private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "//", "%", "**");
    private static final Set<String> COMPARISON = Set.of("<", "<=", "==", "!=", ">", ">=");

    // longs beyond this magnitude do not convert to double exactly
    private static final long EXACT_DOUBLE_LIMIT = 1L << 53;
    private static final MathContext QUOTIENT_CONTEXT = new MathContext(40);

    private SymbolicArithmetic() {}

    static SymbolicValue binary(String op, SymbolicValue left, SymbolicValue right) {
        String symbol = normalizeBinary(op);
        if (ARITHMETIC.contains(symbol) && bothNumeric(left, right)) {
            try {
                return fold(symbol, (SymbolicValue.Concrete) left, (SymbolicValue.Concrete) right);
            } catch (ArithmeticException e) {
                log.debug("cannot fold {} {} {}: {}", left, symbol, right, e.getMessage());
            }
        }
        return symbolic(left, op, right);
    }

    static SymbolicValue compare(String op, SymbolicValue left, SymbolicValue right) {
        String symbol = normalizeCompare(op);
        if (COMPARISON.contains(symbol) && bothNumeric(left, right)) {
            return SymbolicValue.of(compareNumbers(symbol,
                    (Number) ((SymbolicValue.Concrete) left).value(),
                    (Number) ((SymbolicValue.Concrete) right).value()));
        }
        return symbolic(left, symbol, right);
    }

    static SymbolicValue negate(SymbolicValue v) {
        if (v instanceof SymbolicValue.Concrete c) {
            try {
                if (c.value() instanceof Long l) return SymbolicValue.of(Math.negateExact(l));
                if (c.value() instanceof Double d) return SymbolicValue.of(-d);
            } catch (ArithmeticException e) {
                log.debug("cannot negate {}: {}", v, e.getMessage());
            }
        }
        return SymbolicValue.placeholder("(-" + v.display() + ")");
    }

    static SymbolicValue not(SymbolicValue v) {
        if (v instanceof SymbolicValue.Concrete c) {
            Object x = c.value();
            if (x == null) return SymbolicValue.of(true);
            if (x instanceof Boolean b) return SymbolicValue.of(!b);
            if (x instanceof Long l) return SymbolicValue.of(l == 0L);
            if (x instanceof Double d) return SymbolicValue.of(d == 0.0);
            if (x instanceof String s) return SymbolicValue.of(s.isEmpty());
        }
        if (v instanceof SymbolicValue.Composite c) {
            return SymbolicValue.of(c.elements().isEmpty());
        }
        return SymbolicValue.placeholder("(not " + v.display() + ")");
    }

    /* =========================
     *   internal helpers
     * ========================= */

    private static SymbolicValue symbolic(SymbolicValue left, String op, SymbolicValue right) {
        return SymbolicValue.placeholder("(" + left.display() + " " + op + " " + right.display() + ")");
    }

    private static boolean bothNumeric(SymbolicValue a, SymbolicValue b) {
        return a instanceof SymbolicValue.Concrete ca && ca.isNumeric()
                && b instanceof SymbolicValue.Concrete cb && cb.isNumeric();
    }

    /** In-place forms ({@code +=}, {@code //=}, ...) fold as their plain operator. */
    static String normalizeBinary(String op) {
        if (op == null) return "";
        String s = op.trim();
        if (s.length() > 1 && s.endsWith("=") && !COMPARISON.contains(s)) {
            return s.substring(0, s.length() - 1);
        }
        return s;
    }

    /** Unwraps the {@code bool(>)} display some decoders use for comparisons. */
    static String normalizeCompare(String op) {
        if (op == null) return "cmp";
        String s = op.trim();
        if (s.startsWith("bool(") && s.endsWith(")")) s = s.substring(5, s.length() - 1).trim();
        return s.isEmpty() ? "cmp" : s;
    }

    private static SymbolicValue fold(String op, SymbolicValue.Concrete left, SymbolicValue.Concrete right) {
        if (left.value() instanceof Long a && right.value() instanceof Long b) {
            return foldLong(op, a, b);
        }
        double a = ((Number) left.value()).doubleValue();
        double b = ((Number) right.value()).doubleValue();
        return foldDouble(op, a, b);
    }

    private static SymbolicValue foldLong(String op, long a, long b) {
        switch (op) {
            case "+": return SymbolicValue.of(Math.addExact(a, b));
            case "-": return SymbolicValue.of(Math.subtractExact(a, b));
            case "*": return SymbolicValue.of(Math.multiplyExact(a, b));
            case "/":
                if (b == 0) throw new ArithmeticException("division by zero");
                return SymbolicValue.of(trueDivide(a, b));
            case "//": return SymbolicValue.of(Math.floorDiv(a, b));
            case "%": return SymbolicValue.of(Math.floorMod(a, b));
            case "**":
                if (b < 0) return foldDouble(op, a, b);
                return SymbolicValue.of(power(a, b));
            default:
                throw new ArithmeticException("unsupported operator " + op);
        }
    }

    private static SymbolicValue foldDouble(String op, double a, double b) {
        double r;
        switch (op) {
            case "+": r = a + b; break;
            case "-": r = a - b; break;
            case "*": r = a * b; break;
            case "/":
                if (b == 0.0) throw new ArithmeticException("division by zero");
                r = a / b;
                break;
            case "//":
                if (b == 0.0) throw new ArithmeticException("division by zero");
                r = floorDivide(a, b);
                break;
            case "%":
                if (b == 0.0) throw new ArithmeticException("modulo by zero");
                r = floorModulo(a, b);
                break;
            case "**":
                if (a == 0.0 && b < 0) throw new ArithmeticException("zero to a negative power");
                r = Math.pow(a, b);
                break;
            default:
                throw new ArithmeticException("unsupported operator " + op);
        }
        if (Double.isNaN(r)) throw new ArithmeticException("result is not a number");
        return SymbolicValue.of(r);
    }

    /** Correctly rounded {@code a / b}; operands past 2^53 go through BigDecimal. */
    static double trueDivide(long a, long b) {
        if (Math.abs(a) <= EXACT_DOUBLE_LIMIT && Math.abs(b) <= EXACT_DOUBLE_LIMIT) {
            return (double) a / (double) b;
        }
        return new BigDecimal(a).divide(new BigDecimal(b), QUOTIENT_CONTEXT).doubleValue();
    }

    /** {@code a ** b} for {@code b >= 0}; throws when the result cannot be a long. */
    static long power(long a, long b) {
        if (b == 0 || a == 1) return 1L;
        if (a == 0) return 0L;
        if (a == -1) return (b & 1) == 0 ? 1L : -1L;
        // |a| >= 2^(bits-1), so the result has at least (bits-1)*b magnitude bits
        int bits = 64 - Long.numberOfLeadingZeros(Math.abs(a));
        if (b > 63 || (bits - 1) * b > 63) throw new ArithmeticException("long overflow");
        return BigInteger.valueOf(a).pow((int) b).longValueExact();
    }

    /* float floor division and modulo, rounded the way CPython's float_divmod does */

    static double floorModulo(double a, double b) {
        double mod = a % b;
        if (mod != 0.0) {
            if ((b < 0) != (mod < 0)) mod += b;
        } else {
            mod = Math.copySign(0.0, b);
        }
        return mod;
    }

    static double floorDivide(double a, double b) {
        double mod = a % b;
        double div = (a - mod) / b;
        if (mod != 0.0 && (b < 0) != (mod < 0)) div -= 1.0;
        if (div == 0.0) return Math.copySign(0.0, a / b);
        double floor = Math.floor(div);
        if (div - floor > 0.5) floor += 1.0;
        return floor;
    }

    private static boolean compareNumbers(String op, Number a, Number b) {
        if (a instanceof Long x && b instanceof Long y) {
            int c = Long.compare(x, y);
            switch (op) {
                case "<": return c < 0;
                case "<=": return c <= 0;
                case "==": return c == 0;
                case "!=": return c != 0;
                case ">": return c > 0;
                default: return c >= 0;
            }
        }
        // primitive operators: -0.0 equals 0.0, NaN compares unequal to everything
        double x = a.doubleValue();
        double y = b.doubleValue();
        switch (op) {
            case "<": return x < y;
            case "<=": return x <= y;
            case "==": return x == y;
            case "!=": return x != y;
            case ">": return x > y;
            default: return x >= y;
        }
    }
}
