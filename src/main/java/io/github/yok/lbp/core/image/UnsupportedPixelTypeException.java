package io.github.yok.lbp.core.image;

/**
 * 演算が対応していない画素型の画像を受け取ったときに発生する例外です。
 */
public class UnsupportedPixelTypeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 対応していない画素型です（null の場合があります）。
     */
    private final PixelType pixelType;

    /**
     * 例外を生成します。
     *
     * @param operation 演算名です
     * @param pixelType 対応していない画素型です
     */
    public UnsupportedPixelTypeException(String operation, PixelType pixelType) {
        super(operation + " は画素型 " + pixelType + " に対応していません");
        this.pixelType = pixelType;
    }

    /**
     * 対応していない画素型を返します。
     *
     * @return 画素型です
     */
    public PixelType getPixelType() {
        return pixelType;
    }
}
