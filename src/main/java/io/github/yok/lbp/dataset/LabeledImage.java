package io.github.yok.lbp.dataset;

import io.github.yok.lbp.core.image.GrayscaleImage;
import lombok.Value;

/**
 * ラベル付きのグレースケール画像です。
 */
@Value
public class LabeledImage {

    /**
     * クラスラベルです。
     */
    int label;

    /**
     * 画像です。
     */
    GrayscaleImage image;
}
