package io.github.yok.ptycho.core.view;

import io.github.yok.ptycho.core.array.ComplexArrays;
import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.Block;
import io.github.yok.ptycho.core.block.BlockCache;
import io.github.yok.ptycho.core.block.ProbeSelection;
import io.github.yok.ptycho.core.block.ProbeSelectionPolicy;
import io.github.yok.ptycho.core.state.ModeAccess;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * オブジェクトモードごとの照明上限値（全走査位置の {@code |P|^2} をオブジェクト格子へ加算した値の最大値）を求めます。
 *
 * <p>
 * オブジェクト更新の分母に加える下駄 {@code δ = 上限値 × 1e-4} の基準になります。オブジェクトモード数を超えるプローブモードは、
 * オブジェクト更新と同じく最後のオブジェクトモードの照明へ加算します。
 * </p>
 */
@RequiredArgsConstructor
public final class IlluminationCeilingEstimator {

    /**
     * ビューの書き戻しを行うコンポーネントです。
     */
    private final ObjectViewOperator views;

    /**
     * プローブインスタンスの選択規則です。
     */
    private final ProbeSelectionPolicy selectionPolicy;

    /**
     * 照明上限値を計算し、キャッシュへ反映します。
     *
     * @param cache ブロックキャッシュです
     * @param probes プローブモードの一覧です
     * @param objectHeight オブジェクトの行数です
     * @param objectWidth オブジェクトの列数です
     * @param objectModes オブジェクトモード数です
     * @return オブジェクトモードごとの照明上限値です
     */
    public double[] refresh(BlockCache cache, List<ComplexStack> probes, int objectHeight,
            int objectWidth, int objectModes) {
        DMatrixRMaj[] illumination = new DMatrixRMaj[objectModes];
        for (int lo = 0; lo < objectModes; lo++) {
            illumination[lo] = new DMatrixRMaj(objectHeight, objectWidth);
        }
        ZMatrixRMaj discardedUpdate = new ZMatrixRMaj(objectHeight, objectWidth);

        // 余剰のプローブモードは最後のオブジェクトモードへ加算されます。
        int modeCount = Math.max(probes.size(), objectModes);
        for (int ll = 0; ll < modeCount; ll++) {
            int lo = ModeAccess.clamp(ll, objectModes);
            for (Block block : cache.getBlocks()) {
                ProbeSelection selection = selectionPolicy.select(block, ll);
                ComplexStack probe =
                        selection.select(ModeAccess.modeAt(probes, ll), block.size());
                DMatrixRMaj[] weights = new DMatrixRMaj[block.size()];
                for (int k = 0; k < block.size(); k++) {
                    weights[k] = ComplexArrays.abs2(probe.slice(k));
                }
                ComplexStack zeros =
                        new ComplexStack(cache.getViewHeight(), cache.getViewWidth(), block.size());
                views.scatterAdd(discardedUpdate, illumination[lo], zeros, weights, block, cache);
            }
        }

        double[] ceilings = new double[objectModes];
        for (int lo = 0; lo < objectModes; lo++) {
            ceilings[lo] = CommonOps_DDRM.elementMax(illumination[lo]);
        }
        cache.refreshMaxIllumination(ceilings);
        return ceilings;
    }
}
