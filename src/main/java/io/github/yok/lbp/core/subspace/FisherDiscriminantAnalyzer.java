package io.github.yok.lbp.core.subspace;

import io.github.yok.lbp.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.lbp.core.linearalgebra.EigenDecompositionBackend.EigenDecompositionResult;
import io.github.yok.lbp.core.linearalgebra.EjmlEigenDecompositionBackend;
import io.github.yok.lbp.core.linearalgebra.Matrices;
import io.github.yok.lbp.core.linearalgebra.SingularMatrixException;
import io.github.yok.lbp.core.linearalgebra.SubspaceProjector;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.UtilEjml;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;

/**
 * Fisher の判別基準による線形判別分析（LDA）を行うクラスです。
 *
 * <p>
 * ラベル付きサンプルからクラス内散布行列 Sw とクラス間散布行列 Sb を作り、{@code Sw^-1 Sb} の固有ベクトルを
 * 固有値の降順に並べて、先頭から成分数ぶんを基底として保持します。
 * </p>
 *
 * <p>
 * {@link #compute} が成功するまで基底（固有ベクトル）と固有値は存在しません。 その間に射影・再構成・取得を呼ぶと
 * {@link IllegalStateException} が発生します。 {@code compute} は失敗時に以前の状態を変更しません。
 * 同じインスタンスへの {@code compute} の同時呼び出しは呼び出し側で直列化してください。
 * </p>
 */
@Slf4j
public final class FisherDiscriminantAnalyzer {

    /**
     * サンプルが行（1 行 = 1 サンプル）として並んでいるかどうかです。
     */
    @Getter
    private final boolean dataAsRow;

    /**
     * 要求された成分数です（0 以下はクラス数 - 1 を意味します）。
     */
    @Getter
    private final int requestedComponents;

    /**
     * 固有分解バックエンドです。
     */
    private final EigenDecompositionBackend eigenBackend;

    /**
     * 固有ベクトル（列が基底ベクトル、固有値の降順）です。 未計算の間は null です。
     */
    private DMatrixRMaj eigenvectors;

    /**
     * 固有値（降順）です。 未計算の間は null です。
     */
    private double[] eigenvalues;

    /**
     * 学習に使った異なるラベルの値（昇順）です。 未計算の間は null です。
     */
    private int[] classLabels;

    /**
     * 成分数を自動決定し、サンプルを行として扱う LDA を生成します。
     */
    public FisherDiscriminantAnalyzer() {
        this(0, true);
    }

    /**
     * EJML の固有分解を使う LDA を生成します。
     *
     * @param numComponents 成分数です（0 以下、またはクラス数 - 1 を超える場合はクラス数 - 1）
     * @param dataAsRow サンプルが行として並んでいる場合は true です
     */
    public FisherDiscriminantAnalyzer(int numComponents, boolean dataAsRow) {
        this(numComponents, dataAsRow, new EjmlEigenDecompositionBackend());
    }

    /**
     * LDA を生成します。
     *
     * @param numComponents 成分数です（0 以下、またはクラス数 - 1 を超える場合はクラス数 - 1）
     * @param dataAsRow サンプルが行として並んでいる場合は true です
     * @param eigenBackend 固有分解バックエンドです（null 不可）
     * @throws IllegalArgumentException eigenBackend が null の場合に発生します
     */
    public FisherDiscriminantAnalyzer(int numComponents, boolean dataAsRow,
            EigenDecompositionBackend eigenBackend) {
        if (eigenBackend == null) {
            throw new IllegalArgumentException("eigenBackend は null 不可です");
        }
        this.requestedComponents = numComponents;
        this.dataAsRow = dataAsRow;
        this.eigenBackend = eigenBackend;
    }

    /**
     * LDA を生成し、与えたサンプルとラベルで直ちに計算します。
     *
     * @param samples サンプル行列です
     * @param labels サンプルごとのラベルです
     * @param numComponents 成分数です
     * @param dataAsRow サンプルが行として並んでいる場合は true です
     */
    public FisherDiscriminantAnalyzer(DMatrixRMaj samples, int[] labels, int numComponents,
            boolean dataAsRow) {
        this(numComponents, dataAsRow);
        compute(samples, labels);
    }

    /**
     * サンプル配列の一覧から判別基底を計算します。
     *
     * <p>
     * 各サンプルは同じ長さの特徴ベクトルです。 向き（行/列）の設定に従って行列に積んでから {@link #compute(DMatrixRMaj, int[])}
     * を呼びます。
     * </p>
     *
     * @param samples サンプルの一覧です
     * @param labels サンプルごとのラベルです
     */
    public void compute(List<double[]> samples, int[] labels) {
        DMatrixRMaj data = dataAsRow ? Matrices.asRowMatrix(samples) : Matrices.asColumnMatrix(samples);
        compute(data, labels);
    }

    /**
     * サンプル行列とラベルから判別基底を計算します。
     *
     * @param samples サンプル行列です（行向きなら N×D、列向きなら D×N。変更しません）
     * @param labels サンプルごとのラベルです（連続・0 始まりである必要はありません）
     * @throws IllegalArgumentException 引数が null、サンプル数とラベル数が異なる、またはクラスが 2 未満の場合に発生します
     * @throws SingularMatrixException クラス内散布行列 Sw が数値的に特異（ランク落ち）な場合に発生します
     * @throws IllegalStateException 固有分解に失敗した場合、または実固有ベクトルが成分数に足りない場合に発生します
     */
    public void compute(DMatrixRMaj samples, int[] labels) {
        if (samples == null) {
            throw new IllegalArgumentException("samples は null 不可です");
        }
        if (labels == null) {
            throw new IllegalArgumentException("labels は null 不可です");
        }

        // 行向きに揃えたコピーを作ります（以降は 1 行 = 1 サンプル）。
        DMatrixRMaj data = dataAsRow ? samples.copy() : CommonOps_DDRM.transpose(samples, null);
        int n = data.numRows;
        int d = data.numCols;

        if (labels.length != n) {
            throw new IllegalArgumentException(
                    "サンプル数とラベル数が一致しません: samples=" + n + ", labels=" + labels.length);
        }
        if (d == 0) {
            throw new IllegalArgumentException("特徴次元が 0 のサンプルは扱えません");
        }

        // ラベルを昇順の順位 0..C-1 に写像します。
        int[] distinct = Arrays.stream(labels).distinct().sorted().toArray();
        int c = distinct.length;
        if (c < 2) {
            throw new IllegalArgumentException("LDA には 2 種類以上のラベルが必要です: classes=" + c);
        }
        int[] mapped = new int[n];
        for (int i = 0; i < n; i++) {
            mapped[i] = Arrays.binarySearch(distinct, labels[i]);
        }

        if (n < d) {
            log.warn("サンプル数が特徴次元より少ないため、クラス内散布行列が特異になる可能性があります。N={}、D={}", n, d);
        }

        int numComponents = resolveComponentCount(c, d);

        long t0 = System.nanoTime();
        log.info("LDAを開始します。N={}、D={}、クラス数={}、成分数={}", n, d, c, numComponents);

        // 全体平均とクラスごとの平均・サンプル数を求めます。
        double[] meanTotal = new double[d];
        List<ClassStatistics> classes = new ArrayList<>(c);
        for (int k = 0; k < c; k++) {
            classes.add(new ClassStatistics(d));
        }
        for (int i = 0; i < n; i++) {
            ClassStatistics cls = classes.get(mapped[i]);
            for (int j = 0; j < d; j++) {
                double v = data.unsafe_get(i, j);
                meanTotal[j] += v;
                cls.mean[j] += v;
            }
            cls.count++;
        }
        for (int j = 0; j < d; j++) {
            meanTotal[j] /= n;
        }
        for (ClassStatistics cls : classes) {
            for (int j = 0; j < d; j++) {
                cls.mean[j] /= cls.count;
            }
        }

        // 各サンプルから自クラスの平均を引きます。
        for (int i = 0; i < n; i++) {
            double[] mean = classes.get(mapped[i]).mean;
            for (int j = 0; j < d; j++) {
                data.unsafe_set(i, j, data.unsafe_get(i, j) - mean[j]);
            }
        }

        // クラス内散布行列 Sw = Xc^T Xc
        DMatrixRMaj sw = new DMatrixRMaj(d, d);
        CommonOps_DDRM.multTransA(data, data, sw);

        // クラス間散布行列 Sb = Σ (μc - μ)(μc - μ)^T（クラスのサンプル数で重み付けしません）
        DMatrixRMaj sb = new DMatrixRMaj(d, d);
        double[] diff = new double[d];
        for (ClassStatistics cls : classes) {
            for (int j = 0; j < d; j++) {
                diff[j] = cls.mean[j] - meanTotal[j];
            }
            for (int r = 0; r < d; r++) {
                for (int s = 0; s < d; s++) {
                    sb.unsafe_set(r, s, sb.unsafe_get(r, s) + diff[r] * diff[s]);
                }
            }
        }

        log.debug("散布行列を計算しました。Sw={}x{}、Sb={}x{}", sw.numRows, sw.numCols, sb.numRows,
                sb.numCols);

        ensureWellConditioned(sw);

        DMatrixRMaj swInv = new DMatrixRMaj(d, d);
        if (!CommonOps_DDRM.invert(sw, swInv) || MatrixFeatures_DDRM.hasUncountable(swInv)) {
            throw new SingularMatrixException("クラス内散布行列 Sw が特異のため逆行列を計算できません: D=" + d);
        }

        // M = Sw^-1 Sb
        DMatrixRMaj m = new DMatrixRMaj(d, d);
        CommonOps_DDRM.mult(swInv, sb, m);

        EigenDecompositionResult eigen = eigenBackend.decompose(m);
        double[] values = eigen.getEigenvalues();
        DMatrixRMaj vectors = eigen.getEigenvectors();
        if (values == null || vectors == null || values.length != d || vectors.numRows != d
                || vectors.numCols != d) {
            throw new IllegalStateException("固有分解の結果の大きさが不正です: D=" + d);
        }

        // 固有ベクトルが 0 の列（複素固有対）は実固有対の後ろに回します。
        boolean[] usable = new boolean[d];
        for (int col = 0; col < d; col++) {
            usable[col] = hasNonZeroColumn(vectors, col);
        }

        // 固有値の降順に並べ替え（同値は元の順序を保ちます）、先頭から成分数ぶんを残します。
        int[] order = argsortDescending(values, usable);
        double[] sortedValues = new double[numComponents];
        DMatrixRMaj sortedVectors = new DMatrixRMaj(d, numComponents);
        for (int newCol = 0; newCol < numComponents; newCol++) {
            int oldCol = order[newCol];
            if (!usable[oldCol]) {
                throw new IllegalStateException("実固有ベクトルが成分数に足りません: 成分数=" + numComponents
                        + "、有効な固有ベクトル=" + newCol);
            }
            sortedValues[newCol] = values[oldCol];
            for (int row = 0; row < d; row++) {
                sortedVectors.unsafe_set(row, newCol, vectors.unsafe_get(row, oldCol));
            }
        }

        // ここまで成功した場合のみ状態を更新します。
        this.eigenvalues = sortedValues;
        this.eigenvectors = sortedVectors;
        this.classLabels = distinct;

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("LDAが完了しました。所要時間={}ms、先頭固有値={}", elapsedMs,
                numComponents > 0 ? fmt5(sortedValues[0]) : "-");
    }

    /**
     * 有効な成分数を決めます。
     *
     * <p>
     * 要求が 0 以下、またはクラス数 - 1 を超える場合はクラス数 - 1 を使います。 さらに特徴次元を超えることはできないため、次元で頭打ちにします。
     * </p>
     */
    private int resolveComponentCount(int classCount, int dimension) {
        int k = (requestedComponents <= 0 || requestedComponents > classCount - 1)
                ? classCount - 1
                : requestedComponents;
        if (k > dimension) {
            log.warn("成分数が特徴次元を超えるため、次元に合わせます。成分数={}、D={}", k, dimension);
            k = dimension;
        }
        return k;
    }

    /**
     * サンプルを判別部分空間へ射影します。
     *
     * <p>
     * 射影時には平均を引きません（中心化は学習時にクラスごとに済んでいます）。
     * </p>
     *
     * @param samples サンプル行列です（向きは生成時の設定に従います）
     * @return 射影結果（N×K）です
     * @throws IllegalStateException 未計算の場合に発生します
     */
    public DMatrixRMaj project(DMatrixRMaj samples) {
        ensureComputed();
        return SubspaceProjector.project(eigenvectors, null, orient(samples));
    }

    /**
     * 判別部分空間の座標から元の空間へ再構成します。
     *
     * @param coords 座標行列です（向きは生成時の設定に従います）
     * @return 再構成結果（N×D）です
     * @throws IllegalStateException 未計算の場合に発生します
     */
    public DMatrixRMaj reconstruct(DMatrixRMaj coords) {
        ensureComputed();
        return SubspaceProjector.reconstruct(eigenvectors, null, orient(coords));
    }

    /**
     * 基底（列が固有ベクトル、固有値の降順）のコピーを返します。
     *
     * @return D×K の基底行列です
     * @throws IllegalStateException 未計算の場合に発生します
     */
    public DMatrixRMaj getEigenvectors() {
        ensureComputed();
        return eigenvectors.copy();
    }

    /**
     * 固有値（降順）のコピーを返します。
     *
     * @return 長さ K の固有値配列です
     * @throws IllegalStateException 未計算の場合に発生します
     */
    public double[] getEigenvalues() {
        ensureComputed();
        return eigenvalues.clone();
    }

    /**
     * 有効な成分数（基底の列数）を返します。
     *
     * @return 成分数です
     * @throws IllegalStateException 未計算の場合に発生します
     */
    public int getNumComponents() {
        ensureComputed();
        return eigenvalues.length;
    }

    /**
     * 学習に使った異なるラベルの値を昇順で返します（配列の位置が内部のクラス番号です）。
     *
     * @return ラベル値の配列です
     * @throws IllegalStateException 未計算の場合に発生します
     */
    public int[] getClassLabels() {
        ensureComputed();
        return classLabels.clone();
    }

    /**
     * 計算済みかどうかを返します。
     *
     * @return {@link #compute} が成功済みの場合は true です
     */
    public boolean isComputed() {
        return eigenvectors != null;
    }

    private void ensureComputed() {
        if (!isComputed()) {
            throw new IllegalStateException("LDA は未計算です。先に compute を呼んでください");
        }
    }

    private DMatrixRMaj orient(DMatrixRMaj src) {
        if (src == null) {
            throw new IllegalArgumentException("入力行列は null 不可です");
        }
        return dataAsRow ? src : CommonOps_DDRM.transpose(src, null);
    }

    /**
     * クラス内散布行列 Sw が数値的に正則であることを確認します。
     *
     * <p>
     * 最小特異値が {@code D * 最大特異値 * eps} 以下の場合は、ランク落ちとみなします。 例えばサンプル数からクラス数を引いた値が次元より小さい場合や、
     * 正規化ヒストグラムのように各サンプルの成分和が一定の場合です。
     * </p>
     *
     * @param sw クラス内散布行列です（変更しません）
     * @throws SingularMatrixException ランク落ちの場合に発生します
     */
    private static void ensureWellConditioned(DMatrixRMaj sw) {
        int d = sw.numRows;
        SingularValueDecomposition_F64<DMatrixRMaj> svd =
                DecompositionFactory_DDRM.svd(d, d, false, false, true);
        if (!svd.decompose(sw.copy())) {
            throw new SingularMatrixException("クラス内散布行列 Sw の特異値分解に失敗しました: D=" + d);
        }

        double[] sv = svd.getSingularValues();
        int count = svd.numberOfSingularValues();
        double max = 0.0;
        double min = Double.POSITIVE_INFINITY;
        for (int i = 0; i < count; i++) {
            max = Math.max(max, sv[i]);
            min = Math.min(min, sv[i]);
        }

        double tolerance = d * max * UtilEjml.EPS;
        if (!(max > 0.0) || !(min > tolerance)) {
            int rank = 0;
            for (int i = 0; i < count; i++) {
                if (sv[i] > tolerance) {
                    rank++;
                }
            }
            throw new SingularMatrixException("クラス内散布行列 Sw がランク落ちしています: D=" + d + ", rank=" + rank
                    + "（サンプル数 - クラス数 が次元未満、または特徴の成分和が一定の可能性があります）");
        }
        log.debug("Sw の条件数={}", fmt5(max / min));
    }

    private static boolean hasNonZeroColumn(DMatrixRMaj vectors, int col) {
        for (int row = 0; row < vectors.numRows; row++) {
            if (vectors.unsafe_get(row, col) != 0.0) {
                return true;
            }
        }
        return false;
    }

    /**
     * 配列を降順ソートしたときのインデックス順（argsort）を返します。 同値の要素は元の順序を保ちます。
     *
     * @param values 対象配列です
     * @return 降順のインデックス配列です
     */
    static int[] argsortDescending(double[] values) {
        boolean[] usable = new boolean[values.length];
        Arrays.fill(usable, true);
        return argsortDescending(values, usable);
    }

    /**
     * 有効な要素を先に、それぞれの中では値の降順に並べたインデックス順を返します。 同順位の要素は元の順序を保ちます。
     *
     * @param values 対象配列です
     * @param usable 要素ごとの有効フラグです（values と同じ長さ）
     * @return インデックス配列です
     */
    static int[] argsortDescending(double[] values, boolean[] usable) {
        Integer[] indices = new Integer[values.length];
        for (int i = 0; i < values.length; i++) {
            indices[i] = i;
        }

        // Arrays.sort(Object[]) は安定ソートです。
        Arrays.sort(indices, (i, j) -> usable[i] != usable[j]
                ? Boolean.compare(usable[j], usable[i])
                : Double.compare(values[j], values[i]));

        int[] order = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            order[i] = indices[i];
        }
        return order;
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }

    /**
     * クラスごとの平均ベクトルとサンプル数です。
     */
    private static final class ClassStatistics {

        private final double[] mean;

        private int count;

        ClassStatistics(int dimension) {
            this.mean = new double[dimension];
        }
    }
}
