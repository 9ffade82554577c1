package io.github.yok.lbp.core.descriptor;

import io.github.yok.lbp.core.image.GrayscaleImage;
import io.github.yok.lbp.core.image.PixelReader;
import io.github.yok.lbp.core.image.PixelReaders;
import io.github.yok.lbp.core.image.PixelType;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 円形近傍の補間値の分散を計算する分散 LBP（VAR、量子化なし）です。
 *
 * <p>
 * 画素ごとに P 個の補間値の平均と偏差平方和を 1 パス（Welford 法）で更新し、最後に {@code P-1} で割ります。
 * 出力はしきい値コードではなく FLOAT32 のテクスチャエネルギーマップで、上下左右 r 画素ずつ縮みます。 P が 1 の場合は 0 を返します。
 * </p>
 *
 * <p>
 * Pietikäinen, M., Hadid, A., Zhao, G. and Ahonen, T. (2011), "Computer Vision Using Local
 * Binary Patterns", Springer.
 * </p>
 */
public final class VarianceLbp implements TextureDescriptor {

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
     * 半径 1、近傍数 8 の分散 LBP を生成します。
     */
    public VarianceLbp() {
        this(1, 8);
    }

    /**
     * 分散 LBP を生成します。
     *
     * @param radius 半径です（1 以上）
     * @param neighbors 近傍数です（1 以上 30 以下）
     * @throws IllegalArgumentException radius/neighbors が範囲外の場合に発生します
     */
    public VarianceLbp(int radius, int neighbors) {
        this.sampling = new CircularSampling(radius, neighbors, CircularSampling.VARIANCE_LAYOUT);
    }

    @Override
    public GrayscaleImage describe(GrayscaleImage image) {
        PixelReader src = PixelReaders.of(image, SUPPORTED, "VarianceLbp");
        boolean doublePrecision = image.getPixelType() == PixelType.FLOAT64;

        int radius = sampling.radius();
        int neighbors = sampling.neighbors();
        int rows = image.getRows();
        int cols = image.getCols();
        int outRows = Math.max(rows - 2 * radius, 0);
        int outCols = Math.max(cols - 2 * radius, 0);

        float[] variance = new float[outRows * outCols];
        if (neighbors < 2) {
            return GrayscaleImage.ofFloat32(outRows, outCols, variance);
        }

        for (int i = radius; i < rows - radius; i++) {
            for (int j = radius; j < cols - radius; j++) {
                float mean = 0.0f;
                float m2 = 0.0f;
                for (int n = 0; n < neighbors; n++) {
                    float t = sampling.sample(src, cols, i, j, n, doublePrecision);
                    float delta = t - mean;
                    mean = (float) (mean + delta / (1.0 * (n + 1)));
                    m2 = m2 + delta * (t - mean);
                }
                variance[(i - radius) * outCols + (j - radius)] =
                        (float) (m2 / (1.0 * (neighbors - 1)));
            }
        }
        return GrayscaleImage.ofFloat32(outRows, outCols, variance);
    }

    @Override
    public int border() {
        return sampling.radius();
    }

    /**
     * 連続値マップのため 0 を返します。
     *
     * @return 0 です
     */
    @Override
    public int numPatterns() {
        return 0;
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
        return "VarianceLbp(radius=" + getRadius() + ", neighbors=" + getNeighbors() + ")";
    }
}
