package io.github.yok.lbp.dataset;

import io.github.yok.lbp.core.image.GrayscaleImage;
import io.github.yok.lbp.core.image.PixelType;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * ラベル付きの 8 ビットグレースケール画像を CSV から読み込むクラスです。
 *
 * <p>
 * 1 レコードが 1 画像で、列は {@code label,rows,cols,p0,p1,...} です（画素は行優先、0 以上 255 以下）。 {@code #}
 * で始まる行はコメントとして読み飛ばします。
 * </p>
 */
@Slf4j
public final class CsvSampleReader {

    /**
     * 画素より前の固定列数（label, rows, cols）です。
     */
    private static final int HEADER_COLUMNS = 3;

    /**
     * CSV 形式です。
     */
    private static final CSVFormat FORMAT = CSVFormat.Builder.create(CSVFormat.DEFAULT)
            .setCommentMarker('#').setIgnoreEmptyLines(true).setTrim(true).build();

    /**
     * ファイルからラベル付き画像を読み込みます。
     *
     * @param file CSV ファイルです
     * @return 読み込んだ順のラベル付き画像です
     * @throws IllegalArgumentException レコードの形式が不正な場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    public List<LabeledImage> read(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file は null 不可です");
        }
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<LabeledImage> samples = read(r);
            log.info("サンプルを読み込みました。件数={}、ファイル={}", samples.size(), file);
            return samples;
        } catch (IOException e) {
            throw new IllegalStateException("CSV の読み込みに失敗しました: " + file, e);
        }
    }

    /**
     * Reader からラベル付き画像を読み込みます。
     *
     * <p>
     * reader のクローズは呼び出し側の責務です。 {@link CSVParser} を閉じると reader も閉じられるため、パーサはクローズせずに手放します
     * （パーサ自身は reader 以外の資源を持ちません）。
     * </p>
     *
     * @param reader 入力です（クローズしません）
     * @return 読み込んだ順のラベル付き画像です
     * @throws IOException 読み込みに失敗した場合に発生します
     * @throws IllegalArgumentException レコードの形式が不正な場合に発生します
     */
    public List<LabeledImage> read(Reader reader) throws IOException {
        List<LabeledImage> samples = new ArrayList<>();
        // reader を閉じないよう、パーサは try-with-resources にしません。
        CSVParser parser = FORMAT.parse(reader);
        for (CSVRecord record : parser) {
            samples.add(toLabeledImage(record));
        }
        return samples;
    }

    /**
     * 1 レコードをラベル付き画像に変換します。
     */
    private static LabeledImage toLabeledImage(CSVRecord record) {
        long no = record.getRecordNumber();
        if (record.size() < HEADER_COLUMNS) {
            throw new IllegalArgumentException("列数が不足しています: record=" + no);
        }

        int label = parseInt(record.get(0), "label", no);
        int rows = parseInt(record.get(1), "rows", no);
        int cols = parseInt(record.get(2), "cols", no);
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException(
                    "rows/cols は 0 以上が必要です: record=" + no + ", " + rows + "x" + cols);
        }

        int expected = rows * cols;
        int actual = record.size() - HEADER_COLUMNS;
        if (actual != expected) {
            throw new IllegalArgumentException("画素数が rows*cols と一致しません: record=" + no
                    + ", pixels=" + actual + ", rows*cols=" + expected);
        }

        int[] pixels = new int[expected];
        for (int i = 0; i < expected; i++) {
            int v = parseInt(record.get(HEADER_COLUMNS + i), "pixel", no);
            if (!PixelType.UINT8.inRange(v)) {
                throw new IllegalArgumentException(
                        "画素値は 0 以上 255 以下が必要です: record=" + no + ", index=" + i + ", value=" + v);
            }
            pixels[i] = v;
        }
        return new LabeledImage(label, GrayscaleImage.ofUint8(rows, cols, pixels));
    }

    private static int parseInt(String s, String name, long recordNumber) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    name + " が整数ではありません: record=" + recordNumber + ", value=" + s, e);
        }
    }
}
