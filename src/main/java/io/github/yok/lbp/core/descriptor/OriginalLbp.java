package io.github.yok.lbp.core.descriptor;

import io.github.yok.lbp.core.image.GrayscaleImage;
import io.github.yok.lbp.core.image.PixelReader;
import io.github.yok.lbp.core.image.PixelReaders;
import io.github.yok.lbp.core.image.PixelType;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 3×3 近傍のオリジナル LBP を計算するクラスです。
 *
 * <p>
 * 中心画素以上の近傍に 1 を立て、ビット順は NW=7, N=6, NE=5, E=4, SE=3, S=2, SW=1, W=0 で固定です。 出力は UINT8
 * のコードマップで、上下左右 1 画素ずつ縮みます。
 * </p>
 *
 * <p>
 * Ahonen T, Hadid A. and Pietikäinen M. "Face description with local binary patterns:
 * Application to face recognition." IEEE TPAMI, 28(12):2037-2041.
 * </p>
 */
public final class OriginalLbp implements TextureDescriptor {

    /**
     * 対応する画素型です。
     */
    private static final Set<PixelType> SUPPORTED =
            Collections.unmodifiableSet(EnumSet.allOf(PixelType.class));

    /**
     * 近傍の行オフセットです（ビット 7 から 0 の順）。
     */
    private static final int[] DY = {-1, -1, -1, 0, 1, 1, 1, 0};

    /**
     * 近傍の列オフセットです（ビット 7 から 0 の順）。
     */
    private static final int[] DX = {-1, 0, 1, 1, 1, 0, -1, -1};

    @Override
    public GrayscaleImage describe(GrayscaleImage image) {
        PixelReader src = PixelReaders.of(image, SUPPORTED, "OriginalLbp");

        int rows = image.getRows();
        int cols = image.getCols();
        int outRows = Math.max(rows - 2, 0);
        int outCols = Math.max(cols - 2, 0);

        int[] codes = new int[outRows * outCols];
        for (int i = 1; i < rows - 1; i++) {
            for (int j = 1; j < cols - 1; j++) {
                double center = src.read(i * cols + j);
                int code = 0;
                for (int k = 0; k < 8; k++) {
                    double neighbor = src.read((i + DY[k]) * cols + (j + DX[k]));
                    code |= (neighbor >= center ? 1 : 0) << (7 - k);
                }
                codes[(i - 1) * outCols + (j - 1)] = code;
            }
        }
        return GrayscaleImage.ofUint8(outRows, outCols, codes);
    }

    @Override
    public int border() {
        return 1;
    }

    @Override
    public int numPatterns() {
        return 256;
    }

    @Override
    public String toString() {
        return "OriginalLbp";
    }
}
