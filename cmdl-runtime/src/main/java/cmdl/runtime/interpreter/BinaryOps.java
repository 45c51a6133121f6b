package cmdl.runtime.interpreter;

import cmdl.runtime.CmdlBoolean;
import cmdl.runtime.CmdlException;
import cmdl.runtime.CmdlNumber;
import cmdl.runtime.CmdlText;
import cmdl.runtime.CmdlValue;

import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;

/**
 * 二元与一元运算的实现。
 *
 * <p>数字和布尔参与算术（布尔视为 1 / 0）；两个整数的 {@code + - * %} 得到整数，
 * 溢出报错；{@code /} 总是得到实数。失败抛出 {@link CmdlException}，
 * 由 {@link ExpressionEvaluator} 包装为 {@link ExpressionException}。</p>
 */
public final class BinaryOps {

    private BinaryOps() {}

    // ============ 数值类型提升 ============

    /** 两边都是整数时走 longOp，否则走 doubleOp */
    static CmdlNumber numericPromote(CmdlValue left, CmdlValue right,
                                     LongBinaryOperator longOp,
                                     DoubleBinaryOperator doubleOp) {
        CmdlNumber l = left.toNumber();
        CmdlNumber r = right.toNumber();
        if (l.isInteger() && r.isInteger()) {
            try {
                return CmdlNumber.of(longOp.applyAsLong(l.longValue(), r.longValue()));
            } catch (ArithmeticException e) {
                throw new CmdlException("integer overflow", e);
            }
        }
        return CmdlNumber.of(doubleOp.applyAsDouble(l.doubleValue(), r.doubleValue()));
    }

    // ============ 算术操作 ============

    public static CmdlValue add(CmdlValue left, CmdlValue right) {
        if (left.isText() && right.isText()) {
            return CmdlText.of(((CmdlText) left).getValue() + ((CmdlText) right).getValue());
        }
        requireNumeric("+", left, right);
        return numericPromote(left, right, Math::addExact, (a, b) -> a + b);
    }

    public static CmdlValue sub(CmdlValue left, CmdlValue right) {
        requireNumeric("-", left, right);
        return numericPromote(left, right, Math::subtractExact, (a, b) -> a - b);
    }

    public static CmdlValue mul(CmdlValue left, CmdlValue right) {
        requireNumeric("*", left, right);
        return numericPromote(left, right, Math::multiplyExact, (a, b) -> a * b);
    }

    public static CmdlValue div(CmdlValue left, CmdlValue right) {
        requireNumeric("/", left, right);
        if (right.toNumber().isZero()) {
            throw new CmdlException("division by zero");
        }
        return CmdlNumber.of(left.toNumber().doubleValue() / right.toNumber().doubleValue());
    }

    /** 取模结果与除数同号 */
    public static CmdlValue mod(CmdlValue left, CmdlValue right) {
        requireNumeric("%", left, right);
        if (right.toNumber().isZero()) {
            throw new CmdlException("modulo by zero");
        }
        return numericPromote(left, right, Math::floorMod, (a, b) -> {
            double m = a % b;
            return (m != 0 && (m < 0) != (b < 0)) ? m + b : m;
        });
    }

    public static CmdlValue negate(CmdlValue operand) {
        if (!operand.isNumeric()) {
            throw new CmdlException("bad operand type for unary -: " + operand.getTypeName());
        }
        CmdlNumber n = operand.toNumber();
        if (n.isInteger()) {
            try {
                return CmdlNumber.of(Math.negateExact(n.longValue()));
            } catch (ArithmeticException e) {
                throw new CmdlException("integer overflow", e);
            }
        }
        return CmdlNumber.of(-n.doubleValue());
    }

    public static CmdlValue plus(CmdlValue operand) {
        if (!operand.isNumeric()) {
            throw new CmdlException("bad operand type for unary +: " + operand.getTypeName());
        }
        return operand.toNumber();
    }

    // ============ 比较操作 ============

    /** 不同类型（数字与文本）永不相等 */
    public static boolean valuesEqual(CmdlValue left, CmdlValue right) {
        if (left.isNumeric() && right.isNumeric()) {
            return compareNumbers(left.toNumber(), right.toNumber()) == 0
                    && !isNaN(left) && !isNaN(right);
        }
        if (left.isText() && right.isText()) {
            return left.equals(right);
        }
        return false;
    }

    public static CmdlBoolean compare(String symbol, CmdlValue left, CmdlValue right) {
        int c;
        if (left.isNumeric() && right.isNumeric()) {
            if (isNaN(left) || isNaN(right)) {
                return CmdlBoolean.FALSE;
            }
            c = compareNumbers(left.toNumber(), right.toNumber());
        } else if (left.isText() && right.isText()) {
            c = ((CmdlText) left).getValue().compareTo(((CmdlText) right).getValue());
        } else {
            throw new CmdlException("'" + symbol + "' not supported between "
                    + left.getTypeName() + " and " + right.getTypeName());
        }
        switch (symbol) {
            case "<":  return CmdlBoolean.of(c < 0);
            case ">":  return CmdlBoolean.of(c > 0);
            case "<=": return CmdlBoolean.of(c <= 0);
            case ">=": return CmdlBoolean.of(c >= 0);
            default:
                throw new IllegalArgumentException("Not an ordering operator: " + symbol);
        }
    }

    private static int compareNumbers(CmdlNumber l, CmdlNumber r) {
        if (l.isInteger() && r.isInteger()) {
            return Long.compare(l.longValue(), r.longValue());
        }
        double a = l.doubleValue();
        double b = r.doubleValue();
        return a < b ? -1 : (a > b ? 1 : 0);
    }

    private static boolean isNaN(CmdlValue v) {
        return v.isNumber() && !((CmdlNumber) v).isInteger() && Double.isNaN(((CmdlNumber) v).doubleValue());
    }

    private static void requireNumeric(String symbol, CmdlValue left, CmdlValue right) {
        if (!left.isNumeric() || !right.isNumeric()) {
            throw new CmdlException("unsupported operand types for " + symbol + ": "
                    + left.getTypeName() + " and " + right.getTypeName());
        }
    }
}
