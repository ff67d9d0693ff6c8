package assess;

import java.math.BigDecimal;

final class Numbers {

    private Numbers() {}

    /** 10.0 -> "10", 2.5 -> "2.5" */
    static String plain(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return String.valueOf(v);
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }

    static double nz(Double d) {
        return d == null ? 0.0 : d;
    }
}
