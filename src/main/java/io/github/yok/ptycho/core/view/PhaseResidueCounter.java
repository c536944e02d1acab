package io.github.yok.ptycho.core.view;

import io.github.yok.ptycho.core.block.BlockCache;
import org.ejml.data.ZMatrixRMaj;

/**
 * オブジェクトの位相特異点（residue）を数えるクラスです。
 *
 * <p>
 * 隣接 2x2 画素を {@code (r,c) → (r,c+1) → (r+1,c+1) → (r+1,c)} の順に一周したときの位相差（それぞれ
 * {@code (-π, π]} に折り返したもの）の和を {@code 2π} で割った値が 0.1 を超える画素を数えます。
 * </p>
 */
public final class PhaseResidueCounter {

    /**
     * 特異点とみなす巻き数のしきい値です。
     */
    static final double THRESHOLD = 0.1;

    private PhaseResidueCounter() {}

    /**
     * 走査で覆われた領域（ビュー位置の外接矩形）内の正の位相特異点を数えます。
     *
     * @param object オブジェクトです
     * @param cache ブロックキャッシュです
     * @return 特異点数です
     */
    public static int countInScannedRegion(ZMatrixRMaj object, BlockCache cache) {
        int rowMin = Integer.MAX_VALUE;
        int colMin = Integer.MAX_VALUE;
        int rowMax = Integer.MIN_VALUE;
        int colMax = Integer.MIN_VALUE;
        for (int pos = 0; pos < cache.positionCount(); pos++) {
            rowMin = Math.min(rowMin, cache.rowOffsetOf(pos));
            colMin = Math.min(colMin, cache.colOffsetOf(pos));
            rowMax = Math.max(rowMax, cache.rowOffsetOf(pos) + cache.getViewHeight());
            colMax = Math.max(colMax, cache.colOffsetOf(pos) + cache.getViewWidth());
        }
        int r0 = Math.max(0, rowMin);
        int c0 = Math.max(0, colMin);
        return count(object, r0, c0, Math.min(object.numRows, rowMax) - r0,
                Math.min(object.numCols, colMax) - c0);
    }

    /**
     * 指定矩形内の正の位相特異点を数えます。
     *
     * @param object オブジェクトです
     * @param row0 矩形左上の行です
     * @param col0 矩形左上の列です
     * @param rows 矩形の行数です
     * @param cols 矩形の列数です
     * @return 特異点数です
     * @throws IllegalArgumentException 矩形がオブジェクトからはみ出す場合に発生します
     */
    public static int count(ZMatrixRMaj object, int row0, int col0, int rows, int cols) {
        if (row0 < 0 || col0 < 0 || rows < 0 || cols < 0 || row0 + rows > object.numRows
                || col0 + cols > object.numCols) {
            throw new IllegalArgumentException("矩形がオブジェクトの範囲外です: (" + row0 + "," + col0
                    + ") " + rows + "x" + cols);
        }
        int count = 0;
        for (int r = row0; r < row0 + rows - 1; r++) {
            for (int c = col0; c < col0 + cols - 1; c++) {
                double a = phase(object, r, c);
                double b = phase(object, r, c + 1);
                double d = phase(object, r + 1, c + 1);
                double e = phase(object, r + 1, c);
                double winding = (wrap(b - a) + wrap(d - b) + wrap(e - d) + wrap(a - e))
                        / (2.0 * Math.PI);
                if (winding > THRESHOLD) {
                    count++;
                }
            }
        }
        return count;
    }

    private static double phase(ZMatrixRMaj m, int r, int c) {
        return Math.atan2(m.getImag(r, c), m.getReal(r, c));
    }

    private static double wrap(double angle) {
        double w = angle % (2.0 * Math.PI);
        if (w > Math.PI) {
            w -= 2.0 * Math.PI;
        } else if (w <= -Math.PI) {
            w += 2.0 * Math.PI;
        }
        return w;
    }
}
