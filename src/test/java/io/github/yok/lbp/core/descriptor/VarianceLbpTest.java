package io.github.yok.lbp.core.descriptor;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.yok.lbp.core.image.GrayscaleImage;
import io.github.yok.lbp.core.image.PixelType;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class VarianceLbpTest {

    @Test
    void outputShrinksByRadiusOnEachSide() {
        VarianceLbp var = new VarianceLbp(3, 12);
        GrayscaleImage map = var.describe(GrayscaleImage.ofUint8(10, 8, new int[80]));

        assertEquals(4, map.getRows());
        assertEquals(2, map.getCols());
        assertEquals(PixelType.FLOAT32, map.getPixelType());
        assertEquals(0, var.numPatterns());
    }

    @Test
    void flatNeighborhoodHasZeroVariance() {
        int[] pixels = new int[7 * 7];
        Arrays.fill(pixels, 77);
        GrayscaleImage map = new VarianceLbp(2, 16).describe(GrayscaleImage.ofUint8(7, 7, pixels));

        for (int r = 0; r < map.getRows(); r++) {
            for (int c = 0; c < map.getCols(); c++) {
                assertEquals(0.0, map.getAsDouble(r, c), 1e-6);
            }
        }
    }

    @Test
    void sampleVarianceOfFourNeighbors() {
        // n=0:E, n=1:N, n=2:W, n=3:S → 40, 60, 10, 50（平均 40、偏差平方和 1400）
        int[] pixels = {
                0, 60, 0,
                10, 99, 40,
                0, 50, 0};
        GrayscaleImage map = new VarianceLbp(1, 4).describe(GrayscaleImage.ofUint8(3, 3, pixels));

        assertEquals(1400.0 / 3.0, map.getAsDouble(0, 0), 1e-3);
    }

    @Test
    void uniformOffsetDoesNotChangeVariance() {
        int rows = 6;
        int cols = 6;
        float[] base = new float[rows * cols];
        float[] shifted = new float[rows * cols];
        for (int i = 0; i < base.length; i++) {
            base[i] = (i * 37) % 23;
            shifted[i] = base[i] + 100.0f;
        }
        VarianceLbp var = new VarianceLbp(1, 8);
        GrayscaleImage a = var.describe(GrayscaleImage.ofFloat32(rows, cols, base));
        GrayscaleImage b = var.describe(GrayscaleImage.ofFloat32(rows, cols, shifted));

        for (int r = 0; r < a.getRows(); r++) {
            for (int c = 0; c < a.getCols(); c++) {
                assertEquals(a.getAsDouble(r, c), b.getAsDouble(r, c), 1e-2);
            }
        }
    }

    @Test
    void singleNeighborGivesZero() {
        int[] pixels = {1, 2, 3, 4, 5, 6, 7, 8, 9};
        GrayscaleImage map = new VarianceLbp(1, 1).describe(GrayscaleImage.ofUint8(3, 3, pixels));

        assertEquals(0.0, map.getAsDouble(0, 0));
    }
}
