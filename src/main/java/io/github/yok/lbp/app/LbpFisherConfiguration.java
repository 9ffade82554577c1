package io.github.yok.lbp.app;

import io.github.yok.lbp.core.descriptor.TextureDescriptor;
import io.github.yok.lbp.core.feature.SpatialLbpFeatureExtractor;
import io.github.yok.lbp.core.linearalgebra.EigenDecompositionBackend;
import io.github.yok.lbp.core.linearalgebra.EjmlEigenDecompositionBackend;
import io.github.yok.lbp.core.subspace.FisherDiscriminantAnalyzer;
import io.github.yok.lbp.dataset.CsvSampleReader;
import io.github.yok.lbp.out.CsvSubspaceWriter;
import io.github.yok.lbp.out.SubspaceWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * LBP 特徴抽出 + Fisher LDA の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class LbpFisherConfiguration {

    /**
     * lbp-fisher の設定値（lbp.*）です。
     */
    private final LbpFisherProperties p;

    /**
     * テクスチャ記述子を生成します。
     *
     * @return テクスチャ記述子です
     */
    @Bean
    public TextureDescriptor textureDescriptor() {
        LbpFisherProperties.Descriptor d = p.getDescriptor();
        return d.getType().create(d.getRadius(), d.getNeighbors());
    }

    /**
     * 空間ヒストグラム特徴の抽出器を生成します。
     *
     * @param descriptor テクスチャ記述子です
     * @return 特徴抽出器です
     */
    @Bean
    public SpatialLbpFeatureExtractor featureExtractor(TextureDescriptor descriptor) {
        LbpFisherProperties.Histogram h = p.getHistogram();
        return new SpatialLbpFeatureExtractor(descriptor, h.getNumPatterns(), h.getGridX(),
                h.getGridY(), h.isNormalized());
    }

    /**
     * 固有分解バックエンドを生成します。
     *
     * @return 固有分解バックエンドです
     */
    @Bean
    public EigenDecompositionBackend eigenDecompositionBackend() {
        return new EjmlEigenDecompositionBackend();
    }

    /**
     * Fisher LDA を生成します（未計算の状態です）。
     *
     * @param eigen 固有分解バックエンドです
     * @return LDA です
     */
    @Bean
    public FisherDiscriminantAnalyzer fisherDiscriminantAnalyzer(EigenDecompositionBackend eigen) {
        LbpFisherProperties.Lda l = p.getLda();
        return new FisherDiscriminantAnalyzer(l.getNumComponents(), l.isDataAsRow(), eigen);
    }

    /**
     * サンプル CSV の読み込みロジックを生成します。
     *
     * @return 読み込みロジックです
     */
    @Bean
    public CsvSampleReader csvSampleReader() {
        return new CsvSampleReader();
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public SubspaceWriter subspaceWriter() {
        return new CsvSubspaceWriter(p.getOutput().getDir());
    }
}
