package io.github.yok.lbp.core.image;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import org.junit.jupiter.api.Test;

class GrayscaleImageTest {

    @Test
    void unsignedTypesAreReadWithoutSignExtension() {
        GrayscaleImage u8 = GrayscaleImage.ofUint8(1, 2, new int[] {255, 128});
        GrayscaleImage u16 = GrayscaleImage.ofUint16(1, 1, new int[] {65535});
        GrayscaleImage s8 = GrayscaleImage.ofInt8(1, 1, new byte[] {-1});

        assertEquals(255.0, u8.getAsDouble(0, 0));
        assertEquals(128.0, u8.getAsDouble(0, 1));
        assertEquals(65535.0, u16.getAsDouble(0, 0));
        assertEquals(-1.0, s8.getAsDouble(0, 0));
    }

    @Test
    void pixelsAreStoredRowMajor() {
        GrayscaleImage img = GrayscaleImage.ofInt32(2, 3, new int[] {1, 2, 3, 4, 5, 6});

        assertEquals(6.0, img.getAsDouble(1, 2));
        assertEquals(4.0, img.getAsDouble(1, 0));
        assertArrayEquals(new double[] {1, 2, 3, 4, 5, 6}, img.toDoubleArray());
    }

    @Test
    void sourceArrayIsCopied() {
        float[] pixels = {1.5f, 2.5f};
        GrayscaleImage img = GrayscaleImage.ofFloat32(1, 2, pixels);
        pixels[0] = 99.0f;

        assertEquals(1.5, img.getAsDouble(0, 0));
    }

    @Test
    void shapeAndRangeAreValidated() {
        assertThrows(IllegalArgumentException.class,
                () -> GrayscaleImage.ofInt32(2, 2, new int[3]));
        assertThrows(IllegalArgumentException.class,
                () -> GrayscaleImage.ofUint8(1, 1, new int[] {256}));
        assertThrows(IllegalArgumentException.class,
                () -> GrayscaleImage.ofUint16(1, 1, new int[] {-1}));
        assertThrows(IndexOutOfBoundsException.class,
                () -> GrayscaleImage.zeros(2, 2, PixelType.INT8).getAsDouble(2, 0));
    }

    @Test
    void zerosAndEmptiness() {
        GrayscaleImage z = GrayscaleImage.zeros(3, 0, PixelType.FLOAT64);

        assertTrue(z.isEmpty());
        assertEquals(0, z.size());
        assertEquals(PixelType.FLOAT64, z.getPixelType());
        assertEquals(0.0, GrayscaleImage.zeros(2, 2, PixelType.UINT16).getAsDouble(1, 1));
    }

    @Test
    void equalityComparesTypeShapeAndPixels() {
        GrayscaleImage a = GrayscaleImage.ofUint8(1, 2, new int[] {1, 2});
        GrayscaleImage b = GrayscaleImage.ofUint8(1, 2, new int[] {1, 2});

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, GrayscaleImage.ofUint8(2, 1, new int[] {1, 2}));
        assertNotEquals(a, GrayscaleImage.ofInt8(1, 2, new byte[] {1, 2}));
    }

    @Test
    void readerRejectsUnsupportedType() {
        GrayscaleImage img = GrayscaleImage.zeros(1, 1, PixelType.FLOAT64);

        UnsupportedPixelTypeException e = assertThrows(UnsupportedPixelTypeException.class,
                () -> PixelReaders.of(img, EnumSet.of(PixelType.UINT8), "test"));
        assertEquals(PixelType.FLOAT64, e.getPixelType());
        assertThrows(IllegalArgumentException.class,
                () -> PixelReaders.of(null, EnumSet.allOf(PixelType.class), "test"));
    }

    @Test
    void normalizeStretchesToFullByteRange() {
        GrayscaleImage img = GrayscaleImage.ofFloat64(1, 3, new double[] {-1.0, 0.0, 1.0});
        GrayscaleImage out = GrayscaleImages.normalizeToUint8(img);

        assertEquals(PixelType.UINT8, out.getPixelType());
        assertArrayEquals(new double[] {0, 128, 255}, out.toDoubleArray());

        GrayscaleImage flat = GrayscaleImages.normalizeToUint8(
                GrayscaleImage.ofInt16(1, 2, new short[] {7, 7}));
        assertArrayEquals(new double[] {0, 0}, flat.toDoubleArray());
    }

    @Test
    void pixelTypeRangesMatchStorage() {
        assertTrue(PixelType.UINT8.inRange(255));
        assertFalse(PixelType.UINT8.inRange(256));
        assertFalse(PixelType.UINT16.inRange(-1));
        assertTrue(PixelType.INT8.inRange(-128));
        assertFalse(PixelType.INT8.inRange(128));
        assertEquals(65535.0, PixelType.UINT16.maxValue());
        assertEquals(Integer.MIN_VALUE, PixelType.INT32.minValue());
        assertTrue(PixelType.INT16.isIntegral());
        assertFalse(PixelType.FLOAT32.isIntegral());
    }
}
