package io.github.yok.ptycho.core.constraint;

import java.util.Optional;
import org.ejml.data.DMatrixRMaj;

/**
 * 振幅拘束の緩和重み {@code w} を画素ごとに与えるクラスです。
 *
 * <p>
 * {@code w = 0} で測定振幅へ完全に置き換え、{@code w = 1} で予測振幅をそのまま残します。
 * 有効画素マスク {@code m}（1 = 有効）がある場合は
 * {@code w = base + (min(base, pfftRelaxation) − base)·m} とし、有効画素は {@code pfftRelaxation}、
 * 無効画素は基準値 {@code base}（= 1）になります。マスクがない場合は全画素 {@code pfftRelaxation} です。
 * </p>
 */
public final class RelaxationMask {

    /**
     * マスク緩和の基準値です（段階的にマスクを緩める拡張用で、現在は 1 固定です）。
     */
    public static final double BASE_RELAXATION = 1.0;

    /**
     * 全画素共通の重みです（{@link #perPixel} が null の場合に使用します）。
     */
    private final double uniform;

    /**
     * 位置ごと・画素ごとの重みです（null の場合は一様）。
     */
    private final DMatrixRMaj[] perPixel;

    private RelaxationMask(double uniform, DMatrixRMaj[] perPixel) {
        this.uniform = uniform;
        this.perPixel = perPixel;
    }

    /**
     * 有効画素マスクと緩和パラメータから重みを作ります。
     *
     * @param validityMask 位置ごとの有効画素マスクです（空の場合は一様）
     * @param pfftRelaxation 緩和パラメータです
     * @return 緩和重みです
     */
    public static RelaxationMask of(Optional<DMatrixRMaj[]> validityMask,
            double pfftRelaxation) {
        if (validityMask.isEmpty()) {
            return new RelaxationMask(pfftRelaxation, null);
        }
        double base = BASE_RELAXATION;
        double slope = Math.min(base, pfftRelaxation) - base;

        DMatrixRMaj[] masks = validityMask.get();
        DMatrixRMaj[] weights = new DMatrixRMaj[masks.length];
        for (int k = 0; k < masks.length; k++) {
            DMatrixRMaj m = masks[k];
            DMatrixRMaj w = new DMatrixRMaj(m.numRows, m.numCols);
            for (int i = 0; i < m.data.length; i++) {
                w.data[i] = base + slope * m.data[i];
            }
            weights[k] = w;
        }
        return new RelaxationMask(Double.NaN, weights);
    }

    /**
     * 走査位置 k・画素 i の重みを返します。
     *
     * @param k ブロック内の位置番号です
     * @param i 画素番号（行優先）です
     * @return 重みです
     */
    public double weightAt(int k, int i) {
        return perPixel == null ? uniform : perPixel[k].data[i];
    }

    /**
     * 全画素で一様な重みかどうかを返します。
     *
     * @return 一様な場合は true です
     */
    public boolean isUniform() {
        return perPixel == null;
    }
}
