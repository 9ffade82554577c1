package io.github.yok.lbp.core.descriptor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.lbp.core.image.GrayscaleImage;
import io.github.yok.lbp.core.image.PixelType;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class ExtendedLbpTest {

    @Test
    void outputShrinksByRadiusOnEachSide() {
        ExtendedLbp lbp = new ExtendedLbp(2, 8);
        GrayscaleImage map = lbp.describe(GrayscaleImage.ofUint8(7, 9, new int[63]));

        assertEquals(3, map.getRows());
        assertEquals(5, map.getCols());
        assertEquals(PixelType.INT32, map.getPixelType());
        assertEquals(2, lbp.border());
        assertEquals(256, lbp.numPatterns());
    }

    @Test
    void nearEqualityCountsAsSet() {
        double[] pixels = new double[5 * 5];
        Arrays.fill(pixels, 0.25);
        GrayscaleImage map = new ExtendedLbp(1, 8).describe(GrayscaleImage.ofFloat64(5, 5, pixels));

        for (int r = 0; r < map.getRows(); r++) {
            for (int c = 0; c < map.getCols(); c++) {
                assertEquals(255.0, map.getAsDouble(r, c));
            }
        }
    }

    @Test
    void fourNeighborsSampleSouthWestNorthEastInBitOrder() {
        // bit0=S, bit1=W, bit2=N, bit3=E
        int[] pixels = {
                0, 60, 0,
                10, 50, 40,
                0, 50, 0};
        GrayscaleImage map = new ExtendedLbp(1, 4).describe(GrayscaleImage.ofUint8(3, 3, pixels));

        assertEquals(1, map.getRows());
        assertEquals(1, map.getCols());
        // S(=50) と N(60) が立つ
        assertEquals(5.0, map.getAsDouble(0, 0));
    }

    @Test
    void interpolatedSamplesAreComparedStrictly() {
        // 中心 100、周囲は 99。補間値はすべて 100 未満なので、どのビットも立たない
        int[] pixels = new int[9];
        Arrays.fill(pixels, 99);
        pixels[4] = 100;
        GrayscaleImage map = new ExtendedLbp(1, 8).describe(GrayscaleImage.ofUint8(3, 3, pixels));

        assertEquals(0.0, map.getAsDouble(0, 0));
    }

    @Test
    void defaultsAreRadiusOneEightNeighbors() {
        ExtendedLbp lbp = new ExtendedLbp();

        assertEquals(1, lbp.getRadius());
        assertEquals(8, lbp.getNeighbors());
    }

    @Test
    void invalidParametersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExtendedLbp(0, 8));
        assertThrows(IllegalArgumentException.class, () -> new ExtendedLbp(1, 0));
        assertThrows(IllegalArgumentException.class, () -> new ExtendedLbp(1, 31));
    }
}
