package io.github.yok.ptycho.core.scan;

/**
 * 走査パターン（走査位置の集合）を表すインタフェースです。
 *
 * <p>
 * ソルバ側は走査の具体形状を意識せず、位置数・各位置のビュー原点・走査グループ番号のみを利用します。
 * </p>
 */
public interface ScanPattern {

    /**
     * 走査位置の数を返します。
     *
     * @return 走査位置の数です
     */
    int positionCount();

    /**
     * 走査位置に対応するビュー左上の行座標（オブジェクト格子上）を返します。
     *
     * @param position 走査位置番号です（0 以上 positionCount 未満）
     * @return 行座標です
     */
    int rowOffsetOf(int position);

    /**
     * 走査位置に対応するビュー左上の列座標（オブジェクト格子上）を返します。
     *
     * @param position 走査位置番号です（0 以上 positionCount 未満）
     * @return 列座標です
     */
    int colOffsetOf(int position);

    /**
     * 走査位置が属する走査グループ番号を返します。
     *
     * <p>
     * プローブを走査グループごとに持つ場合、このグループ番号がプローブインスタンス番号になります。
     * </p>
     *
     * @param position 走査位置番号です（0 以上 positionCount 未満）
     * @return 走査グループ番号です（0 以上）
     */
    int scanIdOf(int position);

    /**
     * 走査グループ数を返します。
     *
     * @return 走査グループ数です
     */
    int scanGroupCount();
}
