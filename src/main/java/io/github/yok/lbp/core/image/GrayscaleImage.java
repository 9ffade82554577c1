package io.github.yok.lbp.core.image;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;
import lombok.Getter;

/**
 * 単一チャネルの 2 次元画像（行列）を表す不変クラスです。
 *
 * <p>
 * 画素は行優先（{@code index = row * cols + col}）で、画素型に対応したプリミティブ配列に保持します。 入力画像だけでなく、LBP
 * 演算子が出力する記述子マップもこのクラスで表します。
 * </p>
 */
@Getter
public final class GrayscaleImage {

    /**
     * 行数です。
     */
    private final int rows;

    /**
     * 列数です。
     */
    private final int cols;

    /**
     * 画素型です。
     */
    private final PixelType pixelType;

    /**
     * 画素配列です（画素型に応じて byte[]、short[]、int[]、float[]、double[] のいずれかです）。
     */
    @Getter(lombok.AccessLevel.NONE)
    private final Object data;

    private GrayscaleImage(int rows, int cols, PixelType pixelType, Object data, int length) {
        checkArgument(rows >= 0 && cols >= 0, "rows/cols は 0 以上が必要です: %sx%s", rows, cols);
        checkArgument(length == rows * cols, "画素数が rows*cols と一致しません: length=%s, rows*cols=%s",
                length, rows * cols);
        this.rows = rows;
        this.cols = cols;
        this.pixelType = pixelType;
        this.data = data;
    }

    /**
     * 符号付き 8 ビット画像を生成します。
     *
     * @param rows 行数です
     * @param cols 列数です
     * @param pixels 行優先の画素配列です（コピーして保持します）
     * @return 画像です
     */
    public static GrayscaleImage ofInt8(int rows, int cols, byte[] pixels) {
        return new GrayscaleImage(rows, cols, PixelType.INT8, pixels.clone(), pixels.length);
    }

    /**
     * 符号なし 8 ビット画像を生成します。
     *
     * <p>
     * 各値は 0 以上 255 以下が必要です。
     * </p>
     *
     * @param rows 行数です
     * @param cols 列数です
     * @param pixels 行優先の画素配列です
     * @return 画像です
     * @throws IllegalArgumentException 範囲外の値を含む場合に発生します
     */
    public static GrayscaleImage ofUint8(int rows, int cols, int[] pixels) {
        byte[] packed = new byte[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            checkArgument(PixelType.UINT8.inRange(pixels[i]), "UINT8 の範囲外です: index=%s, value=%s",
                    i, pixels[i]);
            packed[i] = (byte) pixels[i];
        }
        return new GrayscaleImage(rows, cols, PixelType.UINT8, packed, packed.length);
    }

    /**
     * 符号付き 16 ビット画像を生成します。
     *
     * @param rows 行数です
     * @param cols 列数です
     * @param pixels 行優先の画素配列です（コピーして保持します）
     * @return 画像です
     */
    public static GrayscaleImage ofInt16(int rows, int cols, short[] pixels) {
        return new GrayscaleImage(rows, cols, PixelType.INT16, pixels.clone(), pixels.length);
    }

    /**
     * 符号なし 16 ビット画像を生成します。
     *
     * @param rows 行数です
     * @param cols 列数です
     * @param pixels 行優先の画素配列です（各値は 0 以上 65535 以下）
     * @return 画像です
     * @throws IllegalArgumentException 範囲外の値を含む場合に発生します
     */
    public static GrayscaleImage ofUint16(int rows, int cols, int[] pixels) {
        short[] packed = new short[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            checkArgument(PixelType.UINT16.inRange(pixels[i]),
                    "UINT16 の範囲外です: index=%s, value=%s", i, pixels[i]);
            packed[i] = (short) pixels[i];
        }
        return new GrayscaleImage(rows, cols, PixelType.UINT16, packed, packed.length);
    }

    /**
     * 符号付き 32 ビット画像を生成します。
     *
     * @param rows 行数です
     * @param cols 列数です
     * @param pixels 行優先の画素配列です（コピーして保持します）
     * @return 画像です
     */
    public static GrayscaleImage ofInt32(int rows, int cols, int[] pixels) {
        return new GrayscaleImage(rows, cols, PixelType.INT32, pixels.clone(), pixels.length);
    }

    /**
     * 32 ビット浮動小数点画像を生成します。
     *
     * @param rows 行数です
     * @param cols 列数です
     * @param pixels 行優先の画素配列です（コピーして保持します）
     * @return 画像です
     */
    public static GrayscaleImage ofFloat32(int rows, int cols, float[] pixels) {
        return new GrayscaleImage(rows, cols, PixelType.FLOAT32, pixels.clone(), pixels.length);
    }

    /**
     * 64 ビット浮動小数点画像を生成します。
     *
     * @param rows 行数です
     * @param cols 列数です
     * @param pixels 行優先の画素配列です（コピーして保持します）
     * @return 画像です
     */
    public static GrayscaleImage ofFloat64(int rows, int cols, double[] pixels) {
        return new GrayscaleImage(rows, cols, PixelType.FLOAT64, pixels.clone(), pixels.length);
    }

    /**
     * 指定した画素型で、すべて 0 の画像を生成します。
     *
     * @param rows 行数です（0 以上）
     * @param cols 列数です（0 以上）
     * @param pixelType 画素型です
     * @return 画像です
     */
    public static GrayscaleImage zeros(int rows, int cols, PixelType pixelType) {
        checkArgument(rows >= 0 && cols >= 0, "rows/cols は 0 以上が必要です: %sx%s", rows, cols);
        int n = rows * cols;
        switch (pixelType) {
            case INT8:
            case UINT8:
                return new GrayscaleImage(rows, cols, pixelType, new byte[n], n);
            case INT16:
            case UINT16:
                return new GrayscaleImage(rows, cols, pixelType, new short[n], n);
            case INT32:
                return new GrayscaleImage(rows, cols, pixelType, new int[n], n);
            case FLOAT32:
                return new GrayscaleImage(rows, cols, pixelType, new float[n], n);
            case FLOAT64:
                return new GrayscaleImage(rows, cols, pixelType, new double[n], n);
            default:
                throw new UnsupportedPixelTypeException("zeros", pixelType);
        }
    }

    /**
     * 画素数を返します。
     *
     * @return 画素数（rows * cols）です
     */
    public int size() {
        return rows * cols;
    }

    /**
     * 画素を 1 つも持たないかを返します。
     *
     * @return 行数または列数が 0 の場合は true です
     */
    public boolean isEmpty() {
        return rows == 0 || cols == 0;
    }

    /**
     * 画素値を double で返します（符号なし型はマスクした値です）。
     *
     * @param row 行です
     * @param col 列です
     * @return 画素値です
     */
    public double getAsDouble(int row, int col) {
        checkIndex(row, col);
        return valueAt(row * cols + col);
    }

    /**
     * 行優先インデックスの画素値を double で返します。
     *
     * @param index 行優先インデックスです
     * @return 画素値です
     */
    double valueAt(int index) {
        switch (pixelType) {
            case INT8:
                return ((byte[]) data)[index];
            case UINT8:
                return ((byte[]) data)[index] & 0xFF;
            case INT16:
                return ((short[]) data)[index];
            case UINT16:
                return ((short[]) data)[index] & 0xFFFF;
            case INT32:
                return ((int[]) data)[index];
            case FLOAT32:
                return ((float[]) data)[index];
            case FLOAT64:
                return ((double[]) data)[index];
            default:
                throw new UnsupportedPixelTypeException("valueAt", pixelType);
        }
    }

    /**
     * 内部の画素配列を返します（パッケージ内の読み取り専用アクセス用です）。
     */
    Object rawData() {
        return data;
    }

    /**
     * 全画素を double 配列（行優先）にコピーして返します。
     *
     * @return 画素値の配列です
     */
    public double[] toDoubleArray() {
        double[] out = new double[size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = valueAt(i);
        }
        return out;
    }

    private void checkIndex(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException(
                    "画素位置が範囲外です: (" + row + ", " + col + ") / " + rows + "x" + cols);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GrayscaleImage)) {
            return false;
        }
        GrayscaleImage other = (GrayscaleImage) o;
        return rows == other.rows && cols == other.cols && pixelType == other.pixelType
                && Arrays.deepEquals(new Object[] {data}, new Object[] {other.data});
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * rows + cols) + pixelType.hashCode())
                + Arrays.deepHashCode(new Object[] {data});
    }

    @Override
    public String toString() {
        return "GrayscaleImage(" + rows + "x" + cols + ", " + pixelType + ")";
    }
}
