package io.github.yok.ptycho.core.view;

import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.Block;
import io.github.yok.ptycho.core.block.BlockCache;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;

/**
 * 整数ピクセルの位置（ビュー左上座標）でビューを切り出し・書き戻すクラスです。
 */
public final class IntegerShiftViewOperator implements ObjectViewOperator {

    @Override
    public ComplexStack gather(ZMatrixRMaj object, Block block, BlockCache cache) {
        int h = cache.getViewHeight();
        int w = cache.getViewWidth();
        ComplexStack views = new ComplexStack(h, w, block.size());

        for (int k = 0; k < block.size(); k++) {
            int pos = block.positionAt(k);
            int r0 = cache.rowOffsetOf(pos);
            int c0 = cache.colOffsetOf(pos);
            checkInside(object, r0, c0, h, w, pos);

            ZMatrixRMaj view = views.slice(k);
            for (int r = 0; r < h; r++) {
                // 1 行分（実部・虚部の組 w 個）をまとめてコピーします。
                int src = 2 * ((r0 + r) * object.numCols + c0);
                System.arraycopy(object.data, src, view.data, 2 * r * w, 2 * w);
            }
        }
        return views;
    }

    @Override
    public void scatterAdd(ZMatrixRMaj update, DMatrixRMaj illumination, ComplexStack patches,
            DMatrixRMaj[] weights, Block block, BlockCache cache) {
        if (patches.depth() != block.size() || weights.length != block.size()) {
            throw new IllegalArgumentException("パッチ数とブロック内の位置数が一致しません: patches="
                    + patches.depth() + ", weights=" + weights.length + ", block=" + block.size());
        }
        int h = cache.getViewHeight();
        int w = cache.getViewWidth();

        for (int k = 0; k < block.size(); k++) {
            int pos = block.positionAt(k);
            int r0 = cache.rowOffsetOf(pos);
            int c0 = cache.colOffsetOf(pos);
            checkInside(update, r0, c0, h, w, pos);

            ZMatrixRMaj patch = patches.slice(k);
            DMatrixRMaj weight = weights[k];
            for (int r = 0; r < h; r++) {
                for (int c = 0; c < w; c++) {
                    int dst = (r0 + r) * update.numCols + (c0 + c);
                    int src = r * w + c;
                    update.data[2 * dst] += patch.data[2 * src];
                    update.data[2 * dst + 1] += patch.data[2 * src + 1];
                    illumination.data[dst] += weight.data[src];
                }
            }
        }
    }

    /**
     * ビューがオブジェクト格子の内側に収まることを検証します。
     */
    private static void checkInside(ZMatrixRMaj object, int r0, int c0, int h, int w, int pos) {
        if (r0 < 0 || c0 < 0 || r0 + h > object.numRows || c0 + w > object.numCols) {
            throw new IllegalArgumentException("ビューがオブジェクトの範囲外です: position=" + pos + ", offset=("
                    + r0 + "," + c0 + "), view=" + h + "x" + w + ", object=" + object.numRows + "x"
                    + object.numCols);
        }
    }
}
