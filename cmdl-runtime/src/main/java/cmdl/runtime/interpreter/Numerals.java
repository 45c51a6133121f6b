package cmdl.runtime.interpreter;

import cmdl.runtime.CmdlNumber;
import cmdl.runtime.CmdlText;
import cmdl.runtime.CmdlValue;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 数字文本的识别与转换
 *
 * <p>不含小数点和指数的数字文本得到整数，其余得到实数：
 * {@code "5"} → 5，{@code "1.5"} → 1.5，{@code "1e3"} → 1000.0。</p>
 */
public final class Numerals {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern REAL = Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");
    private static final Pattern SPECIAL = Pattern.compile("[+-]?(?:inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    private Numerals() {}

    /** 文本（忽略首尾空白）是否为数字 */
    public static boolean isNumber(String text) {
        if (text == null) {
            return false;
        }
        String s = text.trim();
        return REAL.matcher(s).matches() || SPECIAL.matcher(s).matches();
    }

    /** 值是否可当作数字使用：数字、布尔，或内容为数字的文本 */
    public static boolean isNumeric(CmdlValue value) {
        if (value == null) {
            return false;
        }
        if (value.isNumeric()) {
            return true;
        }
        return value.isText() && isNumber(((CmdlText) value).getValue());
    }

    /**
     * 解析数字文本
     *
     * @throws NumberFormatException 不是数字
     */
    public static CmdlNumber parse(String text) {
        String s = text.trim();
        if (INTEGER.matcher(s).matches()) {
            try {
                return CmdlNumber.of(Long.parseLong(s));
            } catch (NumberFormatException overflow) {
                return CmdlNumber.of(Double.parseDouble(s));
            }
        }
        if (REAL.matcher(s).matches()) {
            return CmdlNumber.of(Double.parseDouble(s));
        }
        if (SPECIAL.matcher(s).matches()) {
            String lower = s.toLowerCase(Locale.ROOT);
            boolean negative = lower.startsWith("-");
            if (lower.endsWith("nan")) {
                return CmdlNumber.of(Double.NaN);
            }
            return CmdlNumber.of(negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
        }
        throw new NumberFormatException("Not a number: " + text);
    }

    /**
     * 值的数字视图
     *
     * @throws NumberFormatException 文本不是数字
     * @throws cmdl.runtime.CmdlException 其他非数值类型
     */
    public static CmdlNumber toNumber(CmdlValue value) {
        if (value.isText()) {
            return parse(((CmdlText) value).getValue());
        }
        return value.toNumber();
    }
}
