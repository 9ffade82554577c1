package io.github.yok.lbp.core.descriptor;

import io.github.yok.lbp.core.image.GrayscaleImage;

/**
 * グレースケール画像から記述子マップを計算するテクスチャ記述子のインタフェースです。
 *
 * <p>
 * 実装は状態を持たない純粋関数です。 出力マップは入力画像の上下左右から {@link #border()} 画素ずつ縮んだ大きさになります。
 * </p>
 */
public interface TextureDescriptor {

    /**
     * 記述子マップを計算します。
     *
     * @param image 入力画像です（null 不可）
     * @return 記述子マップです（{@code rows - 2*border} × {@code cols - 2*border}、負になる場合は 0）
     * @throws IllegalArgumentException image が null の場合に発生します
     * @throws io.github.yok.lbp.core.image.UnsupportedPixelTypeException 画素型に対応していない場合に発生します
     */
    GrayscaleImage describe(GrayscaleImage image);

    /**
     * 片側あたりで削られる境界の画素数を返します。
     *
     * @return 境界の画素数です
     */
    int border();

    /**
     * 出力コードが取り得る値の個数（ヒストグラムのビン数）を返します。
     *
     * @return パターン数です（連続値マップを出力する記述子は 0 です）
     */
    int numPatterns();
}
