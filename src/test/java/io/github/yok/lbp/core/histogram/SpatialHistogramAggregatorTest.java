package io.github.yok.lbp.core.histogram;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.lbp.core.image.GrayscaleImage;
import io.github.yok.lbp.core.image.UnsupportedPixelTypeException;
import org.junit.jupiter.api.Test;

class SpatialHistogramAggregatorTest {

    @Test
    void emptyMapGivesZeroVectorOfFullLength() {
        SpatialHistogramAggregator agg = new SpatialHistogramAggregator(59, 3, 2, true);
        double[] feature = agg.aggregate(GrayscaleImage.ofInt32(0, 0, new int[0]));

        assertEquals(3 * 2 * 59, feature.length);
        for (double v : feature) {
            assertEquals(0.0, v);
        }
    }

    @Test
    void cellsAreConcatenatedInRowMajorOrder() {
        int[] codes = {
                0, 0, 1, 1,
                0, 0, 1, 1,
                2, 2, 3, 3,
                2, 2, 3, 0};
        SpatialHistogramAggregator agg = new SpatialHistogramAggregator(4, 2, 2, false);
        double[] feature = agg.aggregate(GrayscaleImage.ofUint8(4, 4, codes));

        assertArrayEquals(new double[] {
                4, 0, 0, 0,
                0, 4, 0, 0,
                0, 0, 4, 0,
                1, 0, 0, 3}, feature);
    }

    @Test
    void normalizedCellsSumToOne() {
        int[] codes = new int[6 * 6];
        for (int i = 0; i < codes.length; i++) {
            codes[i] = (i * 7) % 10;
        }
        SpatialHistogramAggregator agg = new SpatialHistogramAggregator(10, 3, 2, true);
        double[] feature = agg.aggregate(GrayscaleImage.ofInt32(6, 6, codes));

        for (int cell = 0; cell < 6; cell++) {
            double sum = 0.0;
            for (int b = 0; b < 10; b++) {
                sum += feature[cell * 10 + b];
            }
            assertEquals(1.0, sum, 1e-12);
        }
    }

    @Test
    void unnormalizedCellsSumToPixelCount() {
        int[] codes = new int[6 * 9];
        for (int i = 0; i < codes.length; i++) {
            codes[i] = i % 4;
        }
        SpatialHistogramAggregator agg = new SpatialHistogramAggregator(4, 3, 2, false);
        double[] feature = agg.aggregate(GrayscaleImage.ofInt32(6, 9, codes));

        for (int cell = 0; cell < 6; cell++) {
            double sum = 0.0;
            for (int b = 0; b < 4; b++) {
                sum += feature[cell * 4 + b];
            }
            // セルは 3×3
            assertEquals(9.0, sum);
        }
    }

    @Test
    void remainderRowsAndColumnsAreDropped() {
        // 5×5 を 2×2 に分けるとセルは 2×2。最終行・最終列の 1 は数えない
        int[] codes = {
                0, 0, 0, 0, 1,
                0, 0, 0, 0, 1,
                0, 0, 0, 0, 1,
                0, 0, 0, 0, 1,
                1, 1, 1, 1, 1};
        SpatialHistogramAggregator agg = new SpatialHistogramAggregator(2, 2, 2, false);
        double[] feature = agg.aggregate(GrayscaleImage.ofUint8(5, 5, codes));

        assertArrayEquals(new double[] {4, 0, 4, 0, 4, 0, 4, 0}, feature);
    }

    @Test
    void floatMapsAreBinnedByFloorAndOutOfRangeValuesIgnored() {
        float[] values = {0.2f, 1.9f, 2.5f, -1.0f};
        SpatialHistogramAggregator agg = new SpatialHistogramAggregator(2, 1, 1, false);
        double[] feature = agg.aggregate(GrayscaleImage.ofFloat32(2, 2, values));

        assertArrayEquals(new double[] {1, 1}, feature);
    }

    @Test
    void doublePrecisionMapsAreNotSupported() {
        SpatialHistogramAggregator agg = new SpatialHistogramAggregator(4);

        assertThrows(UnsupportedPixelTypeException.class,
                () -> agg.aggregate(GrayscaleImage.ofFloat64(2, 2, new double[4])));
    }

    @Test
    void malformedGridIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new SpatialHistogramAggregator(4, 0, 2, true));
        assertThrows(IllegalArgumentException.class,
                () -> new SpatialHistogramAggregator(4, 2, -1, true));
        assertThrows(IllegalArgumentException.class,
                () -> new SpatialHistogramAggregator(0, 2, 2, true));
    }
}
