package io.github.yok.ptycho.core.solver;

import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.Block;
import io.github.yok.ptycho.core.block.BlockCache;
import io.github.yok.ptycho.core.block.ProbeSelection;
import io.github.yok.ptycho.core.block.ProbeSelectionPolicy;
import io.github.yok.ptycho.core.propagation.FourierPropagator;
import io.github.yok.ptycho.core.propagation.PropagationMode;
import io.github.yok.ptycho.core.residency.ArrayResidency;
import io.github.yok.ptycho.core.state.ExitWaveCell;
import io.github.yok.ptycho.core.state.ExitWaveState;
import io.github.yok.ptycho.core.state.ModeAccess;
import io.github.yok.ptycho.core.state.ReconstructionState;
import io.github.yok.ptycho.core.view.ObjectViewOperator;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * ブロックごとに出射波を計算し、Difference-Map の混合場を検出器面へ伝搬するコンポーネントです。
 *
 * <p>
 * {@link #project} で {@code ψ = O ⊙ P} と {@code Ψ = (1+γ)ψ − γψ'} を作り、振幅拘束の後に
 * {@link #commit} で逆伝搬と {@code ψ'} の更新を行います。
 * </p>
 */
@Getter
public final class ExitWaveEngine {

    /**
     * オブジェクトのビュー抽出を行うコンポーネントです。
     */
    private final ObjectViewOperator views;

    /**
     * 伝搬演算子です。
     */
    private final FourierPropagator propagator;

    /**
     * プローブインスタンスの選択規則です。
     */
    private final ProbeSelectionPolicy selectionPolicy;

    /**
     * 配列の配置先を切り替えるコンポーネントです。
     */
    private final ArrayResidency residency;

    /**
     * 配列を演算装置上に置いたままにするかどうかです。
     */
    private final boolean keepOnDevice;

    /**
     * 出射波エンジンを生成します。
     *
     * @param views ビュー抽出コンポーネントです（null 不可）
     * @param propagator 伝搬演算子です（null 不可）
     * @param selectionPolicy プローブ選択規則です（null 不可）
     * @param residency 配置先切り替えコンポーネントです（null 不可）
     * @param keepOnDevice 配列を演算装置上に置いたままにするかどうかです
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public ExitWaveEngine(ObjectViewOperator views, FourierPropagator propagator,
            ProbeSelectionPolicy selectionPolicy, ArrayResidency residency, boolean keepOnDevice) {
        if (views == null) {
            throw new IllegalArgumentException("views は null 不可です");
        }
        if (propagator == null) {
            throw new IllegalArgumentException("propagator は null 不可です");
        }
        if (selectionPolicy == null) {
            throw new IllegalArgumentException("selectionPolicy は null 不可です");
        }
        if (residency == null) {
            throw new IllegalArgumentException("residency は null 不可です");
        }
        this.views = views;
        this.propagator = propagator;
        this.selectionPolicy = selectionPolicy;
        this.residency = residency;
        this.keepOnDevice = keepOnDevice;
    }

    /**
     * 1 ブロック分の射影を計算し、混合場を検出器面へ伝搬します。
     *
     * <p>
     * 未初期化のセルは、その場で計算した {@code ψ} で初期化します（このとき {@code Ψ = ψ} になります）。
     * </p>
     *
     * @param state 再構成状態です
     * @param block 対象ブロックです
     * @param cache ブロックキャッシュです
     * @param exitWaves 出射波状態です
     * @return 射影結果です
     */
    public BlockProjection project(ReconstructionState state, Block block, BlockCache cache,
            ExitWaveState exitWaves) {
        int modeCount = exitWaves.modeCount();
        List<ComplexStack> projections = new ArrayList<>(modeCount);
        List<ComplexStack> dashes = new ArrayList<>(modeCount);
        List<ComplexStack> farFields = new ArrayList<>(modeCount);

        for (int ll = 0; ll < modeCount; ll++) {
            ComplexStack psi = exitWave(state, block, cache, ll);

            ExitWaveCell cell = exitWaves.get(ll, block.getIndex());
            if (!cell.isInitialized()) {
                cell = ExitWaveCell.of(psi.copy());
                exitWaves.set(ll, block.getIndex(), cell);
            }
            ComplexStack dash = toDevice(cell.field());

            ComplexStack mixed =
                    DifferenceMapKernels.extrapolate(DifferenceMapKernels.GAMMA, psi, dash);
            farFields.add(propagator.forward(mixed, modeOf(state, ll)));
            projections.add(psi);
            dashes.add(dash);
        }
        return new BlockProjection(block, projections, dashes, farFields);
    }

    /**
     * 振幅拘束後の場を逆伝搬し、{@code ψ' ← ψ' + β(Ψ_back − ψ)} で出射波状態を更新します。
     *
     * @param state 再構成状態です
     * @param projection {@link #project} の結果です
     * @param constrained モードごとの振幅拘束後の場です
     * @param exitWaves 出射波状態です
     */
    public void commit(ReconstructionState state, BlockProjection projection,
            List<ComplexStack> constrained, ExitWaveState exitWaves) {
        if (constrained.size() != projection.modeCount()) {
            throw new IllegalArgumentException("拘束後の場のモード数が一致しません: " + constrained.size()
                    + " vs " + projection.modeCount());
        }
        int blockIndex = projection.getBlock().getIndex();
        for (int ll = 0; ll < projection.modeCount(); ll++) {
            ComplexStack back = propagator.backward(constrained.get(ll), modeOf(state, ll));
            ComplexStack updated = DifferenceMapKernels.updateExitWave(
                    projection.getExitWaves().get(ll), DifferenceMapKernels.BETA, back,
                    projection.getProjections().get(ll));
            exitWaves.set(ll, blockIndex, ExitWaveCell.of(toHost(updated)));
        }
    }

    /**
     * モード ll の出射波 {@code O ⊙ P} を計算します（存在しないモードは最後のモードで代用します）。
     *
     * @param state 再構成状態です
     * @param block 対象ブロックです
     * @param cache ブロックキャッシュです
     * @param ll モード番号です
     * @return 出射波です
     */
    public ComplexStack exitWave(ReconstructionState state, Block block, BlockCache cache,
            int ll) {
        ComplexStack objectViews =
                views.gather(ModeAccess.modeAt(state.objects(), ll), block, cache);
        ProbeSelection selection = selectionPolicy.select(block, ll);
        ComplexStack probe =
                selection.select(ModeAccess.modeAt(state.probes(), ll), block.size());
        return objectViews.times(probe);
    }

    /**
     * 演算装置へ移します（常駐設定の場合は何もしません）。
     *
     * @param array 対象です
     * @return 移動後の配列です
     */
    ComplexStack toDevice(ComplexStack array) {
        return keepOnDevice ? array : residency.toDevice(array);
    }

    /**
     * ホストへ戻します（常駐設定の場合は何もしません）。
     *
     * @param array 対象です
     * @return 移動後の配列です
     */
    ComplexStack toHost(ComplexStack array) {
        return keepOnDevice ? array : residency.toHost(array);
    }

    private static PropagationMode modeOf(ReconstructionState state, int ll) {
        return ModeAccess.modeAt(state.modes(), ll);
    }
}
