package io.github.yok.lbp.core.image;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 画素型から {@link PixelReader} の特殊化を選ぶディスパッチ表です。
 *
 * <p>
 * 演算ごとに対応する画素型の集合を渡し、集合外の型は {@link UnsupportedPixelTypeException} で拒否します。
 * 空の結果を返して黙って終わることはありません。
 * </p>
 */
public final class PixelReaders {

    /**
     * 画素型 → 読み出し特殊化の表です。
     */
    private static final Map<PixelType, Function<Object, PixelReader>> TABLE;

    static {
        Map<PixelType, Function<Object, PixelReader>> t = new EnumMap<>(PixelType.class);
        t.put(PixelType.INT8, data -> {
            byte[] a = (byte[]) data;
            return i -> a[i];
        });
        t.put(PixelType.UINT8, data -> {
            byte[] a = (byte[]) data;
            return i -> a[i] & 0xFF;
        });
        t.put(PixelType.INT16, data -> {
            short[] a = (short[]) data;
            return i -> a[i];
        });
        t.put(PixelType.UINT16, data -> {
            short[] a = (short[]) data;
            return i -> a[i] & 0xFFFF;
        });
        t.put(PixelType.INT32, data -> {
            int[] a = (int[]) data;
            return i -> a[i];
        });
        t.put(PixelType.FLOAT32, data -> {
            float[] a = (float[]) data;
            return i -> a[i];
        });
        t.put(PixelType.FLOAT64, data -> {
            double[] a = (double[]) data;
            return i -> a[i];
        });
        TABLE = Collections.unmodifiableMap(t);
    }

    private PixelReaders() {}

    /**
     * 画像の画素型に対応する読み出し特殊化を返します。
     *
     * @param image 画像です（null 不可）
     * @param supported 呼び出し元の演算が対応する画素型の集合です
     * @param operation エラーメッセージに使う演算名です
     * @return 画素読み出しです
     * @throws IllegalArgumentException image が null の場合に発生します
     * @throws UnsupportedPixelTypeException 画素型が supported に含まれない場合に発生します
     */
    public static PixelReader of(GrayscaleImage image, Set<PixelType> supported,
            String operation) {
        if (image == null) {
            throw new IllegalArgumentException(operation + ": image は null 不可です");
        }
        PixelType type = image.getPixelType();
        Function<Object, PixelReader> factory = supported.contains(type) ? TABLE.get(type) : null;
        if (factory == null) {
            throw new UnsupportedPixelTypeException(operation, type);
        }
        return factory.apply(image.rawData());
    }
}
