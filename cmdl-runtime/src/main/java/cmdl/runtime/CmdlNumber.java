package cmdl.runtime;

import java.math.BigDecimal;

/**
 * 数字值：整数（long）或实数（double）
 */
public final class CmdlNumber extends CmdlValue {

    // 小整数缓存
    private static final int CACHE_LOW = -128;
    private static final int CACHE_HIGH = 1024;
    private static final CmdlNumber[] CACHE = new CmdlNumber[CACHE_HIGH - CACHE_LOW + 1];
    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new CmdlNumber(CACHE_LOW + i, 0.0, true);
        }
    }

    public static final CmdlNumber ZERO = of(0);

    /** 获取整数实例，优先从缓存取 */
    public static CmdlNumber of(long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new CmdlNumber(value, 0.0, true);
    }

    public static CmdlNumber of(double value) {
        return new CmdlNumber(0L, value, false);
    }

    private final long longValue;
    private final double doubleValue;
    private final boolean integer;

    private CmdlNumber(long longValue, double doubleValue, boolean integer) {
        this.longValue = longValue;
        this.doubleValue = doubleValue;
        this.integer = integer;
    }

    public boolean isInteger() {
        return integer;
    }

    public long longValue() {
        return integer ? longValue : (long) doubleValue;
    }

    public double doubleValue() {
        return integer ? longValue : doubleValue;
    }

    /** 是否为零 */
    public boolean isZero() {
        return integer ? longValue == 0 : doubleValue == 0.0;
    }

    @Override
    public String getTypeName() {
        return "number";
    }

    @Override
    public Object toJavaValue() {
        if (integer) {
            return longValue;
        }
        return doubleValue;
    }

    @Override
    public boolean isTruthy() {
        return !isZero();
    }

    @Override
    public boolean isNumber() {
        return true;
    }

    @Override
    public CmdlNumber toNumber() {
        return this;
    }

    /**
     * 整数输出为数字本身；实数总带小数部分（{@code 3.0}）。
     * 十进制指数小于 -4 或不小于 16 的实数用科学计数法，
     * 指数带符号且至少两位（{@code 1e+16}、{@code 1.5e-05}）。
     */
    @Override
    public String asDisplayString() {
        if (integer) {
            return Long.toString(longValue);
        }
        if (Double.isNaN(doubleValue)) {
            return "nan";
        }
        if (Double.isInfinite(doubleValue)) {
            return doubleValue > 0 ? "inf" : "-inf";
        }
        if (doubleValue == 0.0) {
            return Math.copySign(1.0, doubleValue) < 0 ? "-0.0" : "0.0";
        }
        // 最短往返表示的有效数字和首位数字的十进制指数
        BigDecimal decimal = new BigDecimal(Double.toString(doubleValue)).stripTrailingZeros();
        String digits = decimal.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - decimal.scale();
        String sign = doubleValue < 0 ? "-" : "";
        if (exponent >= -4 && exponent < 16) {
            String plain = decimal.abs().toPlainString();
            return sign + (plain.indexOf('.') < 0 ? plain + ".0" : plain);
        }
        StringBuilder sb = new StringBuilder(sign).append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? '-' : '+');
        int magnitude = Math.abs(exponent);
        if (magnitude < 10) {
            sb.append('0');
        }
        return sb.append(magnitude).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CmdlNumber)) return false;
        CmdlNumber other = (CmdlNumber) o;
        if (integer && other.integer) {
            return longValue == other.longValue;
        }
        return doubleValue() == other.doubleValue();
    }

    @Override
    public int hashCode() {
        double d = doubleValue();
        if (d == Math.rint(d) && !Double.isInfinite(d)) {
            return Long.hashCode(longValue());
        }
        return Double.hashCode(d);
    }
}
