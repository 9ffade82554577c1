package io.github.yok.lbp.core.descriptor;

import io.github.yok.lbp.core.image.GrayscaleImage;
import io.github.yok.lbp.core.image.PixelReader;
import io.github.yok.lbp.core.image.PixelReaders;
import io.github.yok.lbp.core.image.PixelType;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 円形近傍（半径 r、近傍数 P）の拡張 LBP を計算するクラスです。
 *
 * <p>
 * 各サンプル点の補間値が中心画素より大きい場合、または差の絶対値が float のマシンイプシロン未満の場合に、 サンプル点 n のビットを立てます。 出力は INT32
 * のコードマップで、上下左右 r 画素ずつ縮みます。
 * </p>
 */
public final class ExtendedLbp implements TextureDescriptor {

    /**
     * 32 ビット浮動小数点のマシンイプシロンです（FLT_EPSILON）。
     */
    static final float FLOAT_EPSILON = Math.ulp(1.0f);

    /**
     * 対応する画素型です。
     */
    private static final Set<PixelType> SUPPORTED =
            Collections.unmodifiableSet(EnumSet.allOf(PixelType.class));

    /**
     * サンプル点と補間重みです。
     */
    private final CircularSampling sampling;

    /**
     * 半径 1、近傍数 8 の拡張 LBP を生成します。
     */
    public ExtendedLbp() {
        this(1, 8);
    }

    /**
     * 拡張 LBP を生成します。
     *
     * @param radius 半径です（1 以上）
     * @param neighbors 近傍数です（1 以上 30 以下）
     * @throws IllegalArgumentException radius/neighbors が範囲外の場合に発生します
     */
    public ExtendedLbp(int radius, int neighbors) {
        this.sampling = new CircularSampling(radius, neighbors, CircularSampling.THRESHOLD_LAYOUT);
    }

    @Override
    public GrayscaleImage describe(GrayscaleImage image) {
        PixelReader src = PixelReaders.of(image, SUPPORTED, "ExtendedLbp");
        boolean doublePrecision = image.getPixelType() == PixelType.FLOAT64;

        int radius = sampling.radius();
        int neighbors = sampling.neighbors();
        int rows = image.getRows();
        int cols = image.getCols();
        int outRows = Math.max(rows - 2 * radius, 0);
        int outCols = Math.max(cols - 2 * radius, 0);

        int[] codes = new int[outRows * outCols];
        for (int i = radius; i < rows - radius; i++) {
            for (int j = radius; j < cols - radius; j++) {
                double center = src.read(i * cols + j);
                int code = 0;
                for (int n = 0; n < neighbors; n++) {
                    float t = sampling.sample(src, cols, i, j, n, doublePrecision);
                    if (isSet(t, center, doublePrecision)) {
                        code |= 1 << n;
                    }
                }
                codes[(i - radius) * outCols + (j - radius)] = code;
            }
        }
        return GrayscaleImage.ofInt32(outRows, outCols, codes);
    }

    /**
     * サンプル値が中心値より大きいか、ほぼ等しい場合に true を返します。
     */
    private static boolean isSet(float t, double center, boolean doublePrecision) {
        if (doublePrecision) {
            return t > center || Math.abs(t - center) < FLOAT_EPSILON;
        }
        float c = (float) center;
        return t > c || Math.abs(t - c) < FLOAT_EPSILON;
    }

    @Override
    public int border() {
        return sampling.radius();
    }

    @Override
    public int numPatterns() {
        return 1 << sampling.neighbors();
    }

    /**
     * 半径を返します。
     *
     * @return 半径です
     */
    public int getRadius() {
        return sampling.radius();
    }

    /**
     * 近傍数を返します。
     *
     * @return 近傍数です
     */
    public int getNeighbors() {
        return sampling.neighbors();
    }

    @Override
    public String toString() {
        return "ExtendedLbp(radius=" + getRadius() + ", neighbors=" + getNeighbors() + ")";
    }
}
