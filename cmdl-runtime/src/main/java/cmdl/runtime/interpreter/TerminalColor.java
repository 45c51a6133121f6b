package cmdl.runtime.interpreter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 终端前景色：具名颜色、24 位 RGB 或恢复默认。
 */
public final class TerminalColor {

    public enum Kind { NAMED, RGB, RESET }

    private static final Map<String, Integer> ANSI_CODES;
    static {
        Map<String, Integer> codes = new LinkedHashMap<>();
        codes.put("black", 30);
        codes.put("red", 31);
        codes.put("green", 32);
        codes.put("yellow", 33);
        codes.put("blue", 34);
        codes.put("purple", 35);
        codes.put("magenta", 35);
        codes.put("cyan", 36);
        codes.put("white", 37);
        codes.put("brown", 33);
        codes.put("orange", 33);
        codes.put("pink", 95);
        ANSI_CODES = Collections.unmodifiableMap(codes);
    }

    private static final Pattern RGB_PATTERN = Pattern.compile(
            "rgb\\(\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*\\)",
            Pattern.CASE_INSENSITIVE);

    public static final TerminalColor RESET = new TerminalColor(Kind.RESET, null, 0, 0, 0);

    private final Kind kind;
    private final String name;
    private final int red;
    private final int green;
    private final int blue;

    private TerminalColor(Kind kind, String name, int red, int green, int blue) {
        this.kind = kind;
        this.name = name;
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

    /**
     * 解析 {@code color} 语句的参数。未识别的颜色名得到 {@link #RESET}。
     */
    public static TerminalColor parse(String spec) {
        String s = spec == null ? "" : spec.trim();
        Matcher m = RGB_PATTERN.matcher(s);
        if (m.lookingAt()) {
            return rgb(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
        }
        return named(s);
    }

    public static TerminalColor named(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        if (!ANSI_CODES.containsKey(key)) {
            return RESET;
        }
        return new TerminalColor(Kind.NAMED, key, 0, 0, 0);
    }

    /** 分量截断到 0–255 */
    public static TerminalColor rgb(int red, int green, int blue) {
        return new TerminalColor(Kind.RGB, null, clamp(red), clamp(green), clamp(blue));
    }

    private static int clamp(int component) {
        return Math.max(0, Math.min(255, component));
    }

    public Kind getKind() {
        return kind;
    }

    /** 具名颜色的小写名称，其他为 null */
    public String getName() {
        return name;
    }

    public int getRed() {
        return red;
    }

    public int getGreen() {
        return green;
    }

    public int getBlue() {
        return blue;
    }

    /** ANSI 转义序列 */
    public String toAnsi() {
        switch (kind) {
            case NAMED:
                return "\u001b[" + ANSI_CODES.get(name) + "m";
            case RGB:
                return "\u001b[38;2;" + red + ";" + green + ";" + blue + "m";
            default:
                return "\u001b[0m";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TerminalColor)) return false;
        TerminalColor other = (TerminalColor) o;
        return kind == other.kind && red == other.red && green == other.green
                && blue == other.blue && java.util.Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(kind, name, red, green, blue);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NAMED: return name;
            case RGB:   return "rgb(" + red + "," + green + "," + blue + ")";
            default:    return "reset";
        }
    }
}
