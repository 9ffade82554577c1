package io.github.yok.lbp.core.descriptor;

import static com.google.common.base.Preconditions.checkArgument;

import io.github.yok.lbp.core.image.PixelReader;

/**
 * 半径 r の円周上に等角度で並ぶ P 個のサンプル点と、その双線形補間の重みを保持するクラスです。
 *
 * <p>
 * サンプル点 n の相対座標 (x, y) から {@code floor}/{@code ceil} で周囲 4 格子点を決め、小数部 (tx, ty) から重み
 * {@code w1=(1-tx)(1-ty), w2=tx(1-ty), w3=(1-tx)ty, w4=tx*ty} を作ります。 演算は 32 ビット浮動小数点で行います。
 * </p>
 */
final class CircularSampling {

    /**
     * 近傍数の上限です（コードと 2^P のパターン数が int に収まる範囲）。
     */
    static final int MAX_NEIGHBORS = 30;

    /**
     * 半径です。
     */
    private final int radius;

    /**
     * 近傍数です。
     */
    private final int neighbors;

    /**
     * floor(x) です。
     */
    private final int[] fx;

    /**
     * floor(y) です。
     */
    private final int[] fy;

    /**
     * ceil(x) です。
     */
    private final int[] cx;

    /**
     * ceil(y) です。
     */
    private final int[] cy;

    /**
     * 左上 (fy, fx) の重みです。
     */
    private final float[] w1;

    /**
     * 右上 (fy, cx) の重みです。
     */
    private final float[] w2;

    /**
     * 左下 (cy, fx) の重みです。
     */
    private final float[] w3;

    /**
     * 右下 (cy, cx) の重みです。
     */
    private final float[] w4;

    /**
     * サンプル点の相対座標を決める関数です。
     */
    @FunctionalInterface
    interface PointLayout {

        /**
         * 角度 theta の点の座標を {x, y} で返します。
         */
        double[] pointAt(int radius, double theta);
    }

    /**
     * しきい値 LBP の配置です（n=0 が真下 (0, r)、x = -r sinθ, y = r cosθ）。
     */
    static final PointLayout THRESHOLD_LAYOUT =
            (r, theta) -> new double[] {-r * Math.sin(theta), r * Math.cos(theta)};

    /**
     * 分散 LBP の配置です（n=0 が右 (r, 0)、x = r cosθ, y = -r sinθ）。
     */
    static final PointLayout VARIANCE_LAYOUT =
            (r, theta) -> new double[] {r * Math.cos(theta), -r * Math.sin(theta)};

    /**
     * サンプル点と重みを事前計算します。
     *
     * @param radius 半径です（1 以上）
     * @param neighbors 近傍数です（1 以上 {@link #MAX_NEIGHBORS} 以下）
     * @param layout サンプル点の配置です
     * @throws IllegalArgumentException radius/neighbors が範囲外の場合に発生します
     */
    CircularSampling(int radius, int neighbors, PointLayout layout) {
        checkArgument(radius >= 1, "radius は 1 以上が必要です: %s", radius);
        checkArgument(neighbors >= 1 && neighbors <= MAX_NEIGHBORS,
                "neighbors は 1 以上 %s 以下が必要です: %s", MAX_NEIGHBORS, neighbors);
        this.radius = radius;
        this.neighbors = neighbors;
        this.fx = new int[neighbors];
        this.fy = new int[neighbors];
        this.cx = new int[neighbors];
        this.cy = new int[neighbors];
        this.w1 = new float[neighbors];
        this.w2 = new float[neighbors];
        this.w3 = new float[neighbors];
        this.w4 = new float[neighbors];

        for (int n = 0; n < neighbors; n++) {
            double theta = 2.0 * Math.PI * n / (float) neighbors;
            double[] p = layout.pointAt(radius, theta);
            float x = (float) p[0];
            float y = (float) p[1];

            fx[n] = (int) Math.floor(x);
            fy[n] = (int) Math.floor(y);
            cx[n] = (int) Math.ceil(x);
            cy[n] = (int) Math.ceil(y);

            float tx = x - fx[n];
            float ty = y - fy[n];

            w1[n] = (1 - tx) * (1 - ty);
            w2[n] = tx * (1 - ty);
            w3[n] = (1 - tx) * ty;
            w4[n] = tx * ty;
        }
    }

    int radius() {
        return radius;
    }

    int neighbors() {
        return neighbors;
    }

    /**
     * 画素 (row, col) を中心としたサンプル点 n の補間値を返します。
     *
     * <p>
     * 64 ビット浮動小数点画像では積和を double で行い、結果を float に丸めます。 それ以外の型は float で積和します。
     * </p>
     *
     * @param src 画素読み出しです
     * @param cols 画像の列数です
     * @param row 中心の行です
     * @param col 中心の列です
     * @param n サンプル点の番号です
     * @param doublePrecision 画素が 64 ビット浮動小数点かどうかです
     * @return 補間値です
     */
    float sample(PixelReader src, int cols, int row, int col, int n, boolean doublePrecision) {
        double p1 = src.read((row + fy[n]) * cols + (col + fx[n]));
        double p2 = src.read((row + fy[n]) * cols + (col + cx[n]));
        double p3 = src.read((row + cy[n]) * cols + (col + fx[n]));
        double p4 = src.read((row + cy[n]) * cols + (col + cx[n]));
        if (doublePrecision) {
            return (float) (w1[n] * p1 + w2[n] * p2 + w3[n] * p3 + w4[n] * p4);
        }
        return w1[n] * (float) p1 + w2[n] * (float) p2 + w3[n] * (float) p3 + w4[n] * (float) p4;
    }
}
