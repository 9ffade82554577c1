package io.github.yok.lbp.core.linearalgebra;

/**
 * 逆行列が必要な行列が特異（逆行列を持たない）だった場合に発生する例外です。
 *
 * <p>
 * 正則化などの代替処理は行いません。
 * </p>
 */
public class SingularMatrixException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public SingularMatrixException(String message) {
        super(message);
    }
}
