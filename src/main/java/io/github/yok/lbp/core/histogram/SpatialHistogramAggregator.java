package io.github.yok.lbp.core.histogram;

import static com.google.common.base.Preconditions.checkArgument;

import io.github.yok.lbp.core.image.GrayscaleImage;
import io.github.yok.lbp.core.image.PixelReader;
import io.github.yok.lbp.core.image.PixelReaders;
import io.github.yok.lbp.core.image.PixelType;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import lombok.Getter;

/**
 * 記述子マップを格子状のセルに分け、セルごとのヒストグラムを連結して特徴ベクトルにするクラスです。
 *
 * <p>
 * セル幅は {@code floor(cols / gridX)}、セル高さは {@code floor(rows / gridY)} で、左上から敷き詰めます。
 * 割り切れずに余った右端・下端の行列は使いません。 セルは行優先（1 行目を左から右、次に 2 行目…）の順に連結します。
 * </p>
 *
 * <p>
 * ビンは {@code [0, numPatterns-1]} の整数コードごとに 1 つです。 浮動小数点マップは {@code floor(value)}
 * のビンに数え、範囲外の値は数えません。
 * </p>
 */
@Getter
public final class SpatialHistogramAggregator {

    /**
     * 対応する記述子マップの画素型です（FLOAT64 は対象外です）。
     */
    private static final Set<PixelType> SUPPORTED = Collections.unmodifiableSet(
            EnumSet.of(PixelType.INT8, PixelType.UINT8, PixelType.INT16, PixelType.UINT16,
                    PixelType.INT32, PixelType.FLOAT32));

    /**
     * パターン数（セルあたりのビン数）です。
     */
    private final int numPatterns;

    /**
     * 横方向のセル数です。
     */
    private final int gridX;

    /**
     * 縦方向のセル数です。
     */
    private final int gridY;

    /**
     * セルのヒストグラムを画素数で割る（L1 正規化）かどうかです。
     */
    private final boolean normalized;

    /**
     * 8×8 格子・正規化ありの集約器を生成します。
     *
     * @param numPatterns パターン数です（1 以上）
     */
    public SpatialHistogramAggregator(int numPatterns) {
        this(numPatterns, 8, 8, true);
    }

    /**
     * 集約器を生成します。
     *
     * @param numPatterns パターン数です（1 以上）
     * @param gridX 横方向のセル数です（1 以上）
     * @param gridY 縦方向のセル数です（1 以上）
     * @param normalized セルのヒストグラムを正規化するかどうかです
     * @throws IllegalArgumentException 引数が範囲外の場合に発生します
     */
    public SpatialHistogramAggregator(int numPatterns, int gridX, int gridY, boolean normalized) {
        checkArgument(numPatterns >= 1, "numPatterns は 1 以上が必要です: %s", numPatterns);
        checkArgument(gridX >= 1, "gridX は 1 以上が必要です: %s", gridX);
        checkArgument(gridY >= 1, "gridY は 1 以上が必要です: %s", gridY);
        checkArgument((long) gridX * gridY * numPatterns <= Integer.MAX_VALUE,
                "特徴ベクトル長が大きすぎます: gridX=%s, gridY=%s, numPatterns=%s", gridX, gridY,
                numPatterns);
        this.numPatterns = numPatterns;
        this.gridX = gridX;
        this.gridY = gridY;
        this.normalized = normalized;
    }

    /**
     * 特徴ベクトルの長さ（{@code gridX * gridY * numPatterns}）を返します。
     *
     * @return 特徴ベクトルの長さです
     */
    public int featureLength() {
        return gridX * gridY * numPatterns;
    }

    /**
     * 記述子マップから空間ヒストグラム（特徴ベクトル）を計算します。
     *
     * @param descriptorMap 記述子マップです（null 不可）
     * @return 長さ {@link #featureLength()} の特徴ベクトルです（空のマップではすべて 0）
     * @throws IllegalArgumentException descriptorMap が null の場合に発生します
     * @throws io.github.yok.lbp.core.image.UnsupportedPixelTypeException 画素型に対応していない場合に発生します
     */
    public double[] aggregate(GrayscaleImage descriptorMap) {
        PixelReader src = PixelReaders.of(descriptorMap, SUPPORTED, "SpatialHistogramAggregator");

        double[] feature = new double[featureLength()];
        if (descriptorMap.isEmpty()) {
            return feature;
        }

        int cols = descriptorMap.getCols();
        int width = cols / gridX;
        int height = descriptorMap.getRows() / gridY;
        int cellSize = width * height;
        boolean integral = descriptorMap.getPixelType().isIntegral();

        int offset = 0;
        for (int gy = 0; gy < gridY; gy++) {
            for (int gx = 0; gx < gridX; gx++) {
                for (int r = gy * height; r < (gy + 1) * height; r++) {
                    for (int c = gx * width; c < (gx + 1) * width; c++) {
                        double raw = src.read(r * cols + c);
                        double v = integral ? raw : Math.floor(raw);
                        if (v >= 0 && v < numPatterns) {
                            feature[offset + (int) v] += 1.0;
                        }
                    }
                }
                if (normalized && cellSize > 0) {
                    for (int b = 0; b < numPatterns; b++) {
                        feature[offset + b] /= cellSize;
                    }
                }
                offset += numPatterns;
            }
        }
        return feature;
    }
}
