package io.github.yok.lbp.core.linearalgebra;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 実正方行列の固有分解を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用するライブラリを差し替えやすくするための境界です。 固有対の並び順は規定しません。 並べ替えと本数の選択は呼び出し側の責務です。
 * </p>
 */
public interface EigenDecompositionBackend {

    /**
     * 実正方行列（対称とは限りません）を固有分解します。
     *
     * @param matrix 実正方行列です（変更しません）
     * @return 固有分解結果です（並び順は不定です）
     * @throws IllegalArgumentException matrix が null、または正方でない場合に発生します
     * @throws IllegalStateException 固有分解に失敗した場合に発生します
     */
    EigenDecompositionResult decompose(DMatrixRMaj matrix);

    /**
     * 固有分解の結果（固有値・固有ベクトル）を保持するクラスです。
     *
     * <p>
     * 固有ベクトル行列は「列が固有ベクトル」で、列 k が {@code eigenvalues[k]} に対応します。
     * </p>
     */
    @Value
    class EigenDecompositionResult {

        /**
         * 固有値配列です。
         */
        double[] eigenvalues;

        /**
         * 固有ベクトル行列です（列が固有ベクトルです）。
         */
        DMatrixRMaj eigenvectors;
    }
}
