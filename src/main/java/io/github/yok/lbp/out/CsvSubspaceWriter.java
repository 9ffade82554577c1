package io.github.yok.lbp.out;

import io.github.yok.lbp.core.subspace.FisherDiscriminantAnalyzer;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.ejml.data.DMatrixRMaj;

/**
 * 判別部分空間を CSV に出力するクラスです。
 *
 * <ul>
 * <li>{@code lda_eigenvalues.csv}（index, eigenvalue）</li>
 * <li>{@code lda_eigenvectors.csv}（row, c0, c1, ...）</li>
 * <li>{@code lda_projections.csv}（label, y0, y1, ...）</li>
 * </ul>
 */
public final class CsvSubspaceWriter implements SubspaceWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "lda";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException outputDir が空の場合に発生します
     */
    public CsvSubspaceWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 固有値・固有ベクトルと、学習サンプルの射影結果を出力します。
     *
     * @param analyzer 計算済みの LDA です
     * @param labels 学習サンプルのラベルです
     * @param projections 学習サンプルの射影結果（N×K）です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 未計算、または出力に失敗した場合に発生します
     */
    @Override
    public void write(FisherDiscriminantAnalyzer analyzer, int[] labels,
            DMatrixRMaj projections) {
        if (analyzer == null) {
            throw new IllegalArgumentException("analyzer は null 不可です");
        }
        if (labels == null || projections == null) {
            throw new IllegalArgumentException("labels/projections は null 不可です");
        }
        if (labels.length != projections.numRows) {
            throw new IllegalArgumentException("ラベル数と射影結果の行数が一致しません: labels=" + labels.length
                    + ", rows=" + projections.numRows);
        }

        double[] eigenvalues = analyzer.getEigenvalues();
        DMatrixRMaj eigenvectors = analyzer.getEigenvectors();

        try {
            Files.createDirectories(outputDir);
            writeEigenvalues(eigenvalues);
            writeEigenvectors(eigenvectors);
            writeProjections(labels, projections);
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    private void writeEigenvalues(double[] eigenvalues) throws IOException {
        Path file = outputDir.resolve(buildFileName("eigenvalues"));
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("index", "eigenvalue").build().print(w)) {
            for (int k = 0; k < eigenvalues.length; k++) {
                pr.printRecord(k, eigenvalues[k]);
            }
        }
    }

    private void writeEigenvectors(DMatrixRMaj eigenvectors) throws IOException {
        Path file = outputDir.resolve(buildFileName("eigenvectors"));
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader(columnHeader("row", "c", eigenvectors.numCols)).build()
                        .print(w)) {
            for (int row = 0; row < eigenvectors.numRows; row++) {
                List<Object> rec = new ArrayList<>(eigenvectors.numCols + 1);
                rec.add(row);
                for (int col = 0; col < eigenvectors.numCols; col++) {
                    rec.add(eigenvectors.get(row, col));
                }
                pr.printRecord(rec);
            }
        }
    }

    private void writeProjections(int[] labels, DMatrixRMaj projections) throws IOException {
        Path file = outputDir.resolve(buildFileName("projections"));
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader(columnHeader("label", "y", projections.numCols)).build()
                        .print(w)) {
            for (int i = 0; i < projections.numRows; i++) {
                List<Object> rec = new ArrayList<>(projections.numCols + 1);
                rec.add(labels[i]);
                for (int k = 0; k < projections.numCols; k++) {
                    rec.add(projections.get(i, k));
                }
                pr.printRecord(rec);
            }
        }
    }

    /**
     * 先頭列名と、連番付きの列名を並べたヘッダを作ります（例: row, c0, c1）。
     */
    private static String[] columnHeader(String first, String prefix, int count) {
        String[] header = new String[count + 1];
        header[0] = first;
        for (int k = 0; k < count; k++) {
            header[k + 1] = prefix + k;
        }
        return header;
    }

    /**
     * 命名規約に従ってファイル名を作成します（例: {@code lda_eigenvalues.csv}）。
     */
    private static String buildFileName(String kind) {
        return FILE_HEAD + "_" + kind + ".csv";
    }
}
