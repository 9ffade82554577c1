package io.github.yok.lbp.out;

import io.github.yok.lbp.core.subspace.FisherDiscriminantAnalyzer;
import org.ejml.data.DMatrixRMaj;

/**
 * 学習した判別部分空間を出力する処理のインタフェースです。
 */
public interface SubspaceWriter {

    /**
     * 固有値・固有ベクトルと、学習サンプルの射影結果を出力します。
     *
     * @param analyzer 計算済みの LDA です
     * @param labels 学習サンプルのラベルです
     * @param projections 学習サンプルの射影結果（N×K）です
     */
    void write(FisherDiscriminantAnalyzer analyzer, int[] labels, DMatrixRMaj projections);
}
