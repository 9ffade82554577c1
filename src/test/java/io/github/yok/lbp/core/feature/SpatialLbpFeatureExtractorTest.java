package io.github.yok.lbp.core.feature;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.lbp.core.descriptor.ExtendedLbp;
import io.github.yok.lbp.core.descriptor.OriginalLbp;
import io.github.yok.lbp.core.descriptor.VarianceLbp;
import io.github.yok.lbp.core.image.GrayscaleImage;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class SpatialLbpFeatureExtractorTest {

    private static GrayscaleImage constant(int rows, int cols, int value) {
        int[] pixels = new int[rows * cols];
        Arrays.fill(pixels, value);
        return GrayscaleImage.ofUint8(rows, cols, pixels);
    }

    @Test
    void constantImageFillsTopBinOfEveryCell() {
        SpatialLbpFeatureExtractor extractor =
                new SpatialLbpFeatureExtractor(new OriginalLbp(), 2, 2, true);
        double[] feature = extractor.extract(constant(10, 10, 128));

        assertEquals(4 * 256, feature.length);
        assertEquals(4 * 256, extractor.featureLength());
        for (int cell = 0; cell < 4; cell++) {
            for (int b = 0; b < 256; b++) {
                assertEquals(b == 255 ? 1.0 : 0.0, feature[cell * 256 + b]);
            }
        }
    }

    @Test
    void binCountDefaultsToDescriptorPatterns() {
        SpatialLbpFeatureExtractor extractor =
                new SpatialLbpFeatureExtractor(new ExtendedLbp(1, 4), 3, 3, false);

        assertEquals(16, extractor.getAggregator().getNumPatterns());
        assertEquals(9 * 16, extractor.featureLength());
    }

    @Test
    void explicitBinCountOverridesDescriptor() {
        SpatialLbpFeatureExtractor extractor =
                new SpatialLbpFeatureExtractor(new VarianceLbp(), 64, 2, 2, false);
        double[] feature = extractor.extract(constant(6, 6, 30));

        // 平坦な画像の分散は 0 なので各セルの bin 0 に 4 画素
        assertEquals(4 * 64, feature.length);
        assertEquals(4.0, feature[0]);
        assertEquals(4.0, feature[64]);
    }

    @Test
    void varianceWithoutBinCountIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new SpatialLbpFeatureExtractor(new VarianceLbp(), 8, 8, true));
        assertThrows(IllegalArgumentException.class,
                () -> new SpatialLbpFeatureExtractor(null, 8, 8, true));
    }

    @Test
    void extractAllKeepsInputOrder() {
        SpatialLbpFeatureExtractor extractor =
                new SpatialLbpFeatureExtractor(new OriginalLbp(), 1, 1, false);
        int[] ramp = new int[9];
        for (int i = 0; i < ramp.length; i++) {
            ramp[i] = i * 10;
        }
        List<double[]> features = extractor.extractAll(Arrays.asList(
                constant(3, 3, 5), GrayscaleImage.ofUint8(3, 3, ramp)));

        assertEquals(2, features.size());
        assertEquals(1.0, features.get(0)[255]);
        // 中心 40 以上は E(50), SE(80), S(70), SW(60) → ビット 4,3,2,1
        assertEquals(1.0, features.get(1)[30]);
    }
}
