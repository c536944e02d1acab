package io.github.yok.ptycho.core.data;

import io.github.yok.ptycho.core.array.ComplexArrays;
import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.Block;
import io.github.yok.ptycho.core.block.BlockCache;
import io.github.yok.ptycho.core.block.ProbeSelection;
import io.github.yok.ptycho.core.block.ProbeSelectionPolicy;
import io.github.yok.ptycho.core.propagation.FourierPropagator;
import io.github.yok.ptycho.core.state.ModeAccess;
import io.github.yok.ptycho.core.state.ReconstructionState;
import io.github.yok.ptycho.core.view.ObjectViewOperator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 既知のオブジェクトとプローブから、各走査位置の回折振幅を計算するクラスです。
 *
 * <p>
 * 強度はモードごとの非干渉和 {@code I = Σ_modes |F(O_mode ⊙ P_mode)|^2} とし、振幅 {@code sqrt(I)} を返します。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class DiffractionSimulator {

    /**
     * ビューの取り出しを行うコンポーネントです。
     */
    private final ObjectViewOperator views;

    /**
     * 伝搬モデルです。
     */
    private final FourierPropagator propagator;

    /**
     * プローブインスタンスの選択規則です。
     */
    private final ProbeSelectionPolicy selectionPolicy;

    /**
     * 回折振幅を計算します。
     *
     * @param truth 真のオブジェクト・プローブです
     * @param cache ブロックキャッシュです
     * @return 走査位置ごとの回折振幅です
     */
    public DMatrixRMaj[] simulate(ReconstructionState truth, BlockCache cache) {
        int modeCount = Math.max(truth.probeModeCount(), truth.objectModeCount());
        DMatrixRMaj[] modulus = new DMatrixRMaj[cache.positionCount()];

        for (Block block : cache.getBlocks()) {
            DMatrixRMaj[] intensity = new DMatrixRMaj[block.size()];
            for (int k = 0; k < block.size(); k++) {
                intensity[k] = new DMatrixRMaj(cache.getViewHeight(), cache.getViewWidth());
            }
            for (int ll = 0; ll < modeCount; ll++) {
                ComplexStack objectViews =
                        views.gather(ModeAccess.modeAt(truth.objects(), ll), block, cache);
                ProbeSelection selection = selectionPolicy.select(block, ll);
                ComplexStack probe =
                        selection.select(ModeAccess.modeAt(truth.probes(), ll), block.size());

                ComplexStack exitWave = objectViews.times(probe);
                ComplexStack farField =
                        propagator.forward(exitWave, ModeAccess.modeAt(truth.modes(), ll));
                for (int k = 0; k < block.size(); k++) {
                    ComplexArrays.addAbs2(farField.slice(k), intensity[k]);
                }
            }
            for (int k = 0; k < block.size(); k++) {
                DMatrixRMaj amp = intensity[k];
                for (int i = 0; i < amp.data.length; i++) {
                    amp.data[i] = Math.sqrt(amp.data[i]);
                }
                modulus[block.positionAt(k)] = amp;
            }
        }
        log.info("回折パターンを計算しました。走査位置数={}、モード数={}", modulus.length, modeCount);
        return modulus;
    }
}
