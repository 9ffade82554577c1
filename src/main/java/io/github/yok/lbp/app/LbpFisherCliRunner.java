package io.github.yok.lbp.app;

import io.github.yok.lbp.core.feature.SpatialLbpFeatureExtractor;
import io.github.yok.lbp.core.linearalgebra.Matrices;
import io.github.yok.lbp.core.subspace.FisherDiscriminantAnalyzer;
import io.github.yok.lbp.dataset.CsvSampleReader;
import io.github.yok.lbp.dataset.LabeledImage;
import io.github.yok.lbp.out.SubspaceWriter;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.ejml.data.DMatrixRMaj;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で lbp-fisher を実行するクラスです。
 *
 * <p>
 * ラベル付き画像を読み込み、LBP 空間ヒストグラム特徴を作って Fisher LDA を計算し、固有値・固有ベクトル・射影結果を出力します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class LbpFisherCliRunner implements CommandLineRunner {

    /**
     * lbp-fisher の設定値（lbp.*）です。
     */
    private final LbpFisherProperties properties;

    /**
     * サンプル CSV の読み込みロジックです。
     */
    private final CsvSampleReader sampleReader;

    /**
     * 特徴抽出器です。
     */
    private final SpatialLbpFeatureExtractor featureExtractor;

    /**
     * Fisher LDA です。
     */
    private final FisherDiscriminantAnalyzer analyzer;

    /**
     * 結果出力ロジックです。
     */
    private final SubspaceWriter subspaceWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== lbp-fisher start: LBP features + Fisher LDA ===");
        System.out.print(properties.toMultilineString());

        String samplesPath = properties.getInput().getSamples();
        if (samplesPath == null || samplesPath.isEmpty()) {
            throw new IllegalStateException("input.samples は必須です（サンプル CSV のパスを指定してください）");
        }

        List<LabeledImage> samples = sampleReader.read(Paths.get(samplesPath));
        if (samples.isEmpty()) {
            throw new IllegalStateException("サンプルが 1 件もありません: " + samplesPath);
        }

        // 特徴抽出
        List<double[]> features = new ArrayList<>(samples.size());
        int[] labels = new int[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            LabeledImage s = samples.get(i);
            features.add(featureExtractor.extract(s.getImage()));
            labels[i] = s.getLabel();
        }
        System.out.println("特徴抽出: 件数=" + features.size() + ", 次元="
                + featureExtractor.featureLength() + ", 記述子=" + featureExtractor.getDescriptor());

        // LDA
        analyzer.compute(features, labels);
        DMatrixRMaj data = analyzer.isDataAsRow() ? Matrices.asRowMatrix(features)
                : Matrices.asColumnMatrix(features);
        DMatrixRMaj projections = analyzer.project(data);

        subspaceWriter.write(analyzer, labels, projections);

        double[] eigenvalues = analyzer.getEigenvalues();
        StringBuilder sb = new StringBuilder();
        for (int k = 0; k < eigenvalues.length; k++) {
            if (k > 0) {
                sb.append(", ");
            }
            sb.append(fmt5(eigenvalues[k]));
        }
        System.out.println("結果: 成分数=" + analyzer.getNumComponents() + ", 固有値=[" + sb + "]");
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
