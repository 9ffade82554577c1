package io.github.yok.lbp.core.linearalgebra;

import java.util.List;
import org.ejml.data.DMatrixRMaj;

/**
 * サンプル列と行列の変換をまとめたクラスです。
 */
public final class Matrices {

    private Matrices() {}

    /**
     * サンプルを 1 行ずつ積んだ N×D 行列を作ります。
     *
     * @param samples サンプルの一覧です（空の場合は 0×0 行列を返します）
     * @return 行列です
     * @throws IllegalArgumentException null、または長さの異なるサンプルを含む場合に発生します
     */
    public static DMatrixRMaj asRowMatrix(List<double[]> samples) {
        int d = commonDimension(samples);
        int n = samples.size();
        DMatrixRMaj data = new DMatrixRMaj(n, d);
        for (int i = 0; i < n; i++) {
            double[] xi = samples.get(i);
            for (int j = 0; j < d; j++) {
                data.unsafe_set(i, j, xi[j]);
            }
        }
        return data;
    }

    /**
     * サンプルを 1 列ずつ並べた D×N 行列を作ります。
     *
     * @param samples サンプルの一覧です（空の場合は 0×0 行列を返します）
     * @return 行列です
     * @throws IllegalArgumentException null、または長さの異なるサンプルを含む場合に発生します
     */
    public static DMatrixRMaj asColumnMatrix(List<double[]> samples) {
        int d = commonDimension(samples);
        int n = samples.size();
        DMatrixRMaj data = new DMatrixRMaj(d, n);
        for (int i = 0; i < n; i++) {
            double[] xi = samples.get(i);
            for (int j = 0; j < d; j++) {
                data.unsafe_set(j, i, xi[j]);
            }
        }
        return data;
    }

    private static int commonDimension(List<double[]> samples) {
        if (samples == null) {
            throw new IllegalArgumentException("samples は null 不可です");
        }
        if (samples.isEmpty()) {
            return 0;
        }
        int d = -1;
        for (int i = 0; i < samples.size(); i++) {
            double[] xi = samples.get(i);
            if (xi == null) {
                throw new IllegalArgumentException("samples に null が含まれています: index=" + i);
            }
            if (d < 0) {
                d = xi.length;
            } else if (xi.length != d) {
                throw new IllegalArgumentException(
                        "サンプルの次元が揃っていません: index=" + i + ", length=" + xi.length + ", expected=" + d);
            }
        }
        return d;
    }
}
