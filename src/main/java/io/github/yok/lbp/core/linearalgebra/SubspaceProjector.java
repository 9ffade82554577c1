package io.github.yok.lbp.core.linearalgebra;

import static com.google.common.base.Preconditions.checkArgument;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 基底行列と平均ベクトルによる線形射影・再構成を行うクラスです。
 *
 * <p>
 * 基底の学習方法（LDA など）には依存しません。 サンプルは行ベクトル（1 行 = 1 サンプル）で、基底は列が基底ベクトルの {@code D×K}
 * 行列です。 入力行列は変更しません。
 * </p>
 *
 * <p>
 * 平均ベクトルの要素数がサンプル次元と一致しない場合（null を含む）は、中心化・平均の加算を行いません。
 * </p>
 */
public final class SubspaceProjector {

    private SubspaceProjector() {}

    /**
     * サンプルを部分空間へ射影します（{@code Y = (X - mean) W}）。
     *
     * @param basis 基底行列 W（D×K）です
     * @param mean 平均ベクトルです（要素数 D の場合のみ中心化に使います。null 可）
     * @param data サンプル行列 X（N×D）です
     * @return 射影結果 Y（N×K）です
     * @throws IllegalArgumentException 次元が合わない場合に発生します
     */
    public static DMatrixRMaj project(DMatrixRMaj basis, DMatrixRMaj mean, DMatrixRMaj data) {
        checkArgument(basis != null && data != null, "basis/data は null 不可です");
        checkArgument(data.numCols == basis.numRows, "サンプル次元と基底の行数が一致しません: %s != %s",
                data.numCols, basis.numRows);

        int n = data.numRows;
        int d = data.numCols;

        DMatrixRMaj x = data.copy();
        if (mean != null && mean.getNumElements() == d) {
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < d; j++) {
                    x.unsafe_set(i, j, x.unsafe_get(i, j) - mean.get(j));
                }
            }
        }

        DMatrixRMaj y = new DMatrixRMaj(n, basis.numCols);
        CommonOps_DDRM.mult(x, basis, y);
        return y;
    }

    /**
     * 部分空間の座標から元の空間へ再構成します（{@code X = Y W^T + mean}）。
     *
     * @param basis 基底行列 W（D×K）です
     * @param mean 平均ベクトルです（要素数 D の場合のみ加算します。null 可）
     * @param coords 座標行列 Y（N×K）です
     * @return 再構成結果 X（N×D）です
     * @throws IllegalArgumentException 次元が合わない場合に発生します
     */
    public static DMatrixRMaj reconstruct(DMatrixRMaj basis, DMatrixRMaj mean,
            DMatrixRMaj coords) {
        checkArgument(basis != null && coords != null, "basis/coords は null 不可です");
        checkArgument(coords.numCols == basis.numCols, "座標次元と基底の列数が一致しません: %s != %s",
                coords.numCols, basis.numCols);

        int n = coords.numRows;
        int d = basis.numRows;

        DMatrixRMaj x = new DMatrixRMaj(n, d);
        CommonOps_DDRM.multTransB(coords, basis, x);

        if (mean != null && mean.getNumElements() == d) {
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < d; j++) {
                    x.unsafe_set(i, j, x.unsafe_get(i, j) + mean.get(j));
                }
            }
        }
        return x;
    }
}
