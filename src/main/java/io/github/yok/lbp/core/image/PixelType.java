package io.github.yok.lbp.core.image;

/**
 * 単一チャネル画像の画素型（要素型）を表す列挙型です。
 *
 * <p>
 * 対応する型はこの列挙で閉じており、これ以外の型は扱いません。 符号なし型は同じビット幅の Java プリミティブに格納し、読み出し時にマスクします。
 * </p>
 */
public enum PixelType {

    /**
     * 符号付き 8 ビット整数です。
     */
    INT8(true, Byte.MIN_VALUE, Byte.MAX_VALUE),

    /**
     * 符号なし 8 ビット整数です。
     */
    UINT8(true, 0, 0xFF),

    /**
     * 符号付き 16 ビット整数です。
     */
    INT16(true, Short.MIN_VALUE, Short.MAX_VALUE),

    /**
     * 符号なし 16 ビット整数です。
     */
    UINT16(true, 0, 0xFFFF),

    /**
     * 符号付き 32 ビット整数です。
     */
    INT32(true, Integer.MIN_VALUE, Integer.MAX_VALUE),

    /**
     * 32 ビット浮動小数点数です。
     */
    FLOAT32(false, -Float.MAX_VALUE, Float.MAX_VALUE),

    /**
     * 64 ビット浮動小数点数です。
     */
    FLOAT64(false, -Double.MAX_VALUE, Double.MAX_VALUE);

    /**
     * 整数型かどうかです。
     */
    private final boolean integral;

    /**
     * 表現できる最小値です。
     */
    private final double minValue;

    /**
     * 表現できる最大値です。
     */
    private final double maxValue;

    PixelType(boolean integral, double minValue, double maxValue) {
        this.integral = integral;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    /**
     * 整数型かどうかを返します。
     *
     * @return 整数型の場合は true です
     */
    public boolean isIntegral() {
        return integral;
    }

    /**
     * 表現できる最小値を返します。
     *
     * @return 最小値です
     */
    public double minValue() {
        return minValue;
    }

    /**
     * 表現できる最大値を返します。
     *
     * @return 最大値です
     */
    public double maxValue() {
        return maxValue;
    }

    /**
     * 値がこの型で表現できる範囲に入っているかを返します。
     *
     * @param value 値です
     * @return 範囲内の場合は true です
     */
    public boolean inRange(double value) {
        return value >= minValue && value <= maxValue;
    }
}
