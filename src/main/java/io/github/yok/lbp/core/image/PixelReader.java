package io.github.yok.lbp.core.image;

/**
 * 画像の画素値を行優先インデックスで読み出すインタフェースです。
 *
 * <p>
 * 画素型ごとの特殊化は {@link PixelReaders} が選択します。
 * </p>
 */
@FunctionalInterface
public interface PixelReader {

    /**
     * 行優先インデックスの画素値を返します。
     *
     * @param index 行優先インデックスです（{@code row * cols + col}）
     * @return 画素値です（符号なし型はマスク済みです）
     */
    double read(int index);
}
