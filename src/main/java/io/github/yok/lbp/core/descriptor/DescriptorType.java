package io.github.yok.lbp.core.descriptor;

/**
 * 設定から選択できるテクスチャ記述子の種類です。
 */
public enum DescriptorType {

    /**
     * 3×3 のオリジナル LBP です（radius/neighbors は使いません）。
     */
    ORIGINAL {
        @Override
        public TextureDescriptor create(int radius, int neighbors) {
            return new OriginalLbp();
        }
    },

    /**
     * 円形近傍の拡張 LBP です。
     */
    EXTENDED {
        @Override
        public TextureDescriptor create(int radius, int neighbors) {
            return new ExtendedLbp(radius, neighbors);
        }
    },

    /**
     * 分散 LBP です。
     */
    VARIANCE {
        @Override
        public TextureDescriptor create(int radius, int neighbors) {
            return new VarianceLbp(radius, neighbors);
        }
    };

    /**
     * 記述子を生成します。
     *
     * @param radius 半径です
     * @param neighbors 近傍数です
     * @return 記述子です
     * @throws IllegalArgumentException radius/neighbors が範囲外の場合に発生します
     */
    public abstract TextureDescriptor create(int radius, int neighbors);
}
