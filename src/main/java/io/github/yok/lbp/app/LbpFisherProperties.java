package io.github.yok.lbp.app;

import io.github.yok.lbp.core.descriptor.DescriptorType;
import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * lbp-fisher の設定値（lbp.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "lbp")
public class LbpFisherProperties {

    /**
     * テクスチャ記述子の設定です。
     */
    @Valid
    private Descriptor descriptor = new Descriptor();

    /**
     * 空間ヒストグラムの設定です。
     */
    @Valid
    private Histogram histogram = new Histogram();

    /**
     * LDA の設定です。
     */
    private Lda lda = new Lda();

    /**
     * 入力設定です。
     */
    private Input input = new Input();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "lbp")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Descriptor d = getDescriptor();
        Histogram h = getHistogram();
        Lda l = getLda();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "descriptor",
                // type: 記述子の種類（ORIGINAL/EXTENDED/VARIANCE）
                "type", d.getType(),
                // radius: 円形近傍の半径
                "radius", d.getRadius(),
                // neighbors: 円形近傍のサンプル点数
                "neighbors", d.getNeighbors());

        appendSection(sb, nl, "histogram",
                // gridX/gridY: セル分割数
                "gridX", h.getGridX(), "gridY", h.getGridY(),
                // normalized: セルごとの L1 正規化
                "normalized", h.isNormalized(),
                // numPatterns: ビン数（0 は記述子に合わせる）
                "numPatterns", h.getNumPatterns());

        appendSection(sb, nl, "lda",
                // numComponents: 成分数（0 はクラス数 - 1）
                "numComponents", l.getNumComponents(),
                // dataAsRow: サンプルを行として扱うか
                "dataAsRow", l.isDataAsRow());

        appendSection(sb, nl, "input", "samples", getInput().getSamples());
        appendSection(sb, nl, "output", "dir", getOutput().getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Descriptor {

        /**
         * 記述子の種類です。
         */
        @NotNull
        private DescriptorType type = DescriptorType.EXTENDED;

        /**
         * 円形近傍の半径です（ORIGINAL では使いません）。
         */
        @Min(1)
        private int radius = 1;

        /**
         * 円形近傍のサンプル点数です（ORIGINAL では使いません）。
         */
        @Min(1)
        @Max(30)
        private int neighbors = 8;
    }

    @Data
    public static class Histogram {

        /**
         * 横方向のセル数です。
         */
        @Min(1)
        private int gridX = 8;

        /**
         * 縦方向のセル数です。
         */
        @Min(1)
        private int gridY = 8;

        /**
         * セルのヒストグラムを画素数で割るかどうかです。
         */
        private boolean normalized = true;

        /**
         * ビン数です。
         *
         * <p>
         * 0 の場合は記述子のパターン数を使います。 VARIANCE では 1 以上の指定が必要です。
         * </p>
         */
        @Min(0)
        private int numPatterns = 0;
    }

    @Data
    public static class Lda {

        /**
         * 成分数です（0 以下はクラス数 - 1）。
         */
        private int numComponents = 0;

        /**
         * サンプルを行として扱うかどうかです。
         */
        private boolean dataAsRow = true;
    }

    @Data
    public static class Input {

        /**
         * ラベル付きサンプル CSV のパスです。
         */
        private String samples;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
