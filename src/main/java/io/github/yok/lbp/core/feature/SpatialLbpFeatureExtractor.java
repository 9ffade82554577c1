package io.github.yok.lbp.core.feature;

import io.github.yok.lbp.core.descriptor.TextureDescriptor;
import io.github.yok.lbp.core.histogram.SpatialHistogramAggregator;
import io.github.yok.lbp.core.image.GrayscaleImage;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * 画像 → 記述子マップ → 空間ヒストグラム、の順で特徴ベクトルを作るクラスです。
 */
@Getter
public final class SpatialLbpFeatureExtractor {

    /**
     * テクスチャ記述子です。
     */
    private final TextureDescriptor descriptor;

    /**
     * 空間ヒストグラムの集約器です。
     */
    private final SpatialHistogramAggregator aggregator;

    /**
     * 記述子のパターン数をビン数とする特徴抽出器を生成します。
     *
     * @param descriptor テクスチャ記述子です（null 不可、パターン数が 1 以上のもの）
     * @param gridX 横方向のセル数です
     * @param gridY 縦方向のセル数です
     * @param normalized セルのヒストグラムを正規化するかどうかです
     * @throws IllegalArgumentException 記述子が null、またはパターン数を持たない場合に発生します
     */
    public SpatialLbpFeatureExtractor(TextureDescriptor descriptor, int gridX, int gridY,
            boolean normalized) {
        this(descriptor, 0, gridX, gridY, normalized);
    }

    /**
     * 特徴抽出器を生成します。
     *
     * @param descriptor テクスチャ記述子です（null 不可）
     * @param numPatterns ビン数です（0 以下の場合は記述子のパターン数を使います）
     * @param gridX 横方向のセル数です
     * @param gridY 縦方向のセル数です
     * @param normalized セルのヒストグラムを正規化するかどうかです
     * @throws IllegalArgumentException 記述子が null、またはビン数が決まらない場合に発生します
     */
    public SpatialLbpFeatureExtractor(TextureDescriptor descriptor, int numPatterns, int gridX,
            int gridY, boolean normalized) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor は null 不可です");
        }
        int bins = numPatterns > 0 ? numPatterns : descriptor.numPatterns();
        if (bins <= 0) {
            throw new IllegalArgumentException(
                    descriptor + " はパターン数を持たないため、numPatterns を指定してください");
        }
        this.descriptor = descriptor;
        this.aggregator = new SpatialHistogramAggregator(bins, gridX, gridY, normalized);
    }

    /**
     * 画像から特徴ベクトルを作ります。
     *
     * @param image 入力画像です
     * @return 長さ {@link #featureLength()} の特徴ベクトルです
     */
    public double[] extract(GrayscaleImage image) {
        return aggregator.aggregate(descriptor.describe(image));
    }

    /**
     * 画像の一覧から特徴ベクトルの一覧を作ります。
     *
     * @param images 入力画像の一覧です
     * @return 入力と同じ順の特徴ベクトルの一覧です
     */
    public List<double[]> extractAll(List<GrayscaleImage> images) {
        if (images == null) {
            throw new IllegalArgumentException("images は null 不可です");
        }
        List<double[]> features = new ArrayList<>(images.size());
        for (GrayscaleImage image : images) {
            features.add(extract(image));
        }
        return features;
    }

    /**
     * 特徴ベクトルの長さを返します。
     *
     * @return 特徴ベクトルの長さです
     */
    public int featureLength() {
        return aggregator.featureLength();
    }
}
