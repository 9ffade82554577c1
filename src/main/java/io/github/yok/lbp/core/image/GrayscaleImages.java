package io.github.yok.lbp.core.image;

import java.util.EnumSet;

/**
 * {@link GrayscaleImage} の補助処理をまとめたクラスです。
 */
public final class GrayscaleImages {

    private GrayscaleImages() {}

    /**
     * 画像を最小値 0・最大値 255 に線形伸張した UINT8 画像に変換します。
     *
     * <p>
     * 分散 LBP のような連続値マップを可視化・保存するときに使います。 全画素が同じ値の場合はすべて 0 になります。
     * </p>
     *
     * @param image 変換元の画像です（null 不可）
     * @return UINT8 画像です
     */
    public static GrayscaleImage normalizeToUint8(GrayscaleImage image) {
        PixelReader src = PixelReaders.of(image, EnumSet.allOf(PixelType.class), "normalizeToUint8");
        int n = image.size();

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            double v = src.read(i);
            min = Math.min(min, v);
            max = Math.max(max, v);
        }

        int[] out = new int[n];
        double range = max - min;
        if (range > 0.0) {
            for (int i = 0; i < n; i++) {
                out[i] = (int) Math.round((src.read(i) - min) * 255.0 / range);
            }
        }
        return GrayscaleImage.ofUint8(image.getRows(), image.getCols(), out);
    }
}
