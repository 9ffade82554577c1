package io.github.yok.lbp.core.linearalgebra;

import lombok.extern.slf4j.Slf4j;
import org.ejml.data.Complex_F64;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.NormOps_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

/**
 * EJML を用いて、一般の実正方行列の固有分解を行うクラスです。
 *
 * <p>
 * 固有値は EJML が返した順のまま返します。 固有ベクトルはユークリッドノルム 1 に揃えます。 複素固有値は実部のみを返し、対応する固有ベクトル列は 0 とします
 * （Fisher LDA の {@code Sw^-1 Sb} は理論上すべて実固有値で、複素対は数値誤差で生じる 0 付近の固有値に限られます）。
 * </p>
 */
@Slf4j
public final class EjmlEigenDecompositionBackend implements EigenDecompositionBackend {

    /**
     * 実正方行列を固有分解します。
     *
     * @param matrix 実正方行列です（変更しません）
     * @return 固有分解結果です（並び順は EJML の出力順です）
     * @throws IllegalArgumentException matrix が null、または正方でない場合に発生します
     * @throws IllegalStateException 固有分解に失敗した場合に発生します
     */
    @Override
    public EigenDecompositionResult decompose(DMatrixRMaj matrix) {
        if (matrix == null) {
            throw new IllegalArgumentException("matrix は null 不可です");
        }
        if (matrix.numRows != matrix.numCols) {
            throw new IllegalArgumentException(
                    "正方行列が必要です: " + matrix.numRows + "x" + matrix.numCols);
        }

        int dim = matrix.numRows;

        // 一般（非対称）行列の固有分解器を生成します。
        EigenDecomposition_F64<DMatrixRMaj> decomposition =
                DecompositionFactory_DDRM.eig(dim, true, false);

        // 入力を壊さないようにコピーを渡します。
        if (!decomposition.decompose(matrix.copy())) {
            throw new IllegalStateException("固有分解に失敗しました（EJML）");
        }

        double[] eigenvalues = new double[dim];
        DMatrixRMaj eigenvectors = new DMatrixRMaj(dim, dim);
        int complexCount = 0;

        for (int col = 0; col < dim; col++) {
            Complex_F64 value = decomposition.getEigenvalue(col);
            eigenvalues[col] = value.getReal();

            // 複素固有値の場合、EJML は固有ベクトルを返しません（null）。
            DMatrixRMaj vec = decomposition.getEigenVector(col);
            if (vec == null) {
                complexCount++;
                continue;
            }

            double norm = NormOps_DDRM.normF(vec);
            double scale = norm > 0.0 ? 1.0 / norm : 0.0;
            for (int row = 0; row < dim; row++) {
                eigenvectors.set(row, col, vec.get(row, 0) * scale);
            }
        }

        if (complexCount > 0) {
            log.warn("複素固有値が{}個ありました。実部のみを使い、固有ベクトルは0とします。次元={}", complexCount, dim);
        }

        return new EigenDecompositionResult(eigenvalues, eigenvectors);
    }
}
