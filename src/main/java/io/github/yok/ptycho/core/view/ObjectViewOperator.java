package io.github.yok.ptycho.core.view;

import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.Block;
import io.github.yok.ptycho.core.block.BlockCache;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;

/**
 * 共有オブジェクト配列と、走査位置ごとのプローブサイズの部分配列（ビュー）を相互に写すインタフェースです。
 *
 * <p>
 * 取り出し（gather）と、その逆操作である加算書き戻し（scatter-add）を提供します。 サブピクセル補間などの差し替えを想定した境界です。
 * </p>
 */
public interface ObjectViewOperator {

    /**
     * ブロック内の各走査位置のビューをオブジェクトから取り出します。
     *
     * @param object オブジェクトです
     * @param block ブロックです
     * @param cache ビュー位置を保持するキャッシュです
     * @return 位置ごとのビュー（奥行き = ブロック内の位置数）です
     */
    ComplexStack gather(ZMatrixRMaj object, Block block, BlockCache cache);

    /**
     * ブロック内の各走査位置のビューを、オブジェクト格子の更新量・照明量へ加算します。
     *
     * <p>
     * 重なり合う領域は上書きせず加算します。
     * </p>
     *
     * @param update 複素更新量の加算先です
     * @param illumination 照明量の加算先です
     * @param patches 位置ごとの複素パッチです
     * @param weights 位置ごとの照明重み（{@code |P|^2}）です
     * @param block ブロックです
     * @param cache ビュー位置を保持するキャッシュです
     */
    void scatterAdd(ZMatrixRMaj update, DMatrixRMaj illumination, ComplexStack patches,
            DMatrixRMaj[] weights, Block block, BlockCache cache);
}
