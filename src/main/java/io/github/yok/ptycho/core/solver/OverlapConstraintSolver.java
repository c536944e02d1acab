package io.github.yok.ptycho.core.solver;

import io.github.yok.ptycho.app.PtychoProperties;
import io.github.yok.ptycho.core.array.ComplexArrays;
import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.Block;
import io.github.yok.ptycho.core.block.BlockCache;
import io.github.yok.ptycho.core.block.ProbeSelection;
import io.github.yok.ptycho.core.block.ProbeSelectionPolicy;
import io.github.yok.ptycho.core.state.BlockContribution;
import io.github.yok.ptycho.core.state.ExitWaveState;
import io.github.yok.ptycho.core.state.ModeAccess;
import io.github.yok.ptycho.core.state.OverlapAccumulator;
import io.github.yok.ptycho.core.state.ReconstructionState;
import io.github.yok.ptycho.core.view.ObjectViewOperator;
import io.github.yok.ptycho.core.view.PhaseResidueCounter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;

/**
 * 実空間のオーバーラップ拘束を反復的に解くクラスです。
 *
 * <p>
 * 1 回の繰り返しでは、全ブロックの寄与を {@link OverlapAccumulator} に畳み込み、 その後に一度だけプローブとオブジェクトを更新します。
 * 繰り返しは最大 {@value #MAX_REPETITIONS} 回で、プローブの相対変化量が {@value #MIN_CHANGE} を下回れば打ち切ります。
 * </p>
 */
@Getter
@Slf4j
public final class OverlapConstraintSolver {

    /**
     * 1 外側反復あたりの繰り返し回数の上限です。
     */
    public static final int MAX_REPETITIONS = 10;

    /**
     * 打ち切りに用いるプローブの相対変化量のしきい値です。
     */
    public static final double MIN_CHANGE = 0.01;

    private final ObjectViewOperator views;

    private final ProbeSelectionPolicy selectionPolicy;

    private final ExitWaveEngine engine;

    private final UpdateApplier applier;

    /**
     * プローブ更新を開始する反復番号です。
     */
    private final int probeChangeStart;

    /**
     * オブジェクト更新を開始する反復番号です。
     */
    private final int objectChangeStart;

    /**
     * 収束判定を行う最小の繰り返し回数です。
     */
    private final int minRepetitions;

    /**
     * 判定対象外の繰り返しでもプローブ変化量を計測するかどうかです。
     */
    private final boolean alwaysMeasureProbeChange;

    /**
     * オーバーラップ拘束ソルバを生成します。
     *
     * @param views ビュー操作です（null 不可）
     * @param selectionPolicy プローブ選択規則です（null 不可）
     * @param engine 出射波エンジンです（null 不可）
     * @param applier 更新の反映コンポーネントです（null 不可）
     * @param dm Difference-Map 設定です（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public OverlapConstraintSolver(ObjectViewOperator views, ProbeSelectionPolicy selectionPolicy,
            ExitWaveEngine engine, UpdateApplier applier, PtychoProperties.Dm dm) {
        if (views == null) {
            throw new IllegalArgumentException("views は null 不可です");
        }
        if (selectionPolicy == null) {
            throw new IllegalArgumentException("selectionPolicy は null 不可です");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine は null 不可です");
        }
        if (applier == null) {
            throw new IllegalArgumentException("applier は null 不可です");
        }
        if (dm == null) {
            throw new IllegalArgumentException("dm は null 不可です");
        }
        if (dm.getOverlap() == null) {
            throw new IllegalArgumentException("dm.overlap は null 不可です");
        }
        if (dm.getProbeChangeStart() < 1) {
            throw new IllegalArgumentException(
                    "dm.probeChangeStart は 1 以上が必要です: " + dm.getProbeChangeStart());
        }
        if (dm.getObjectChangeStart() < 1) {
            throw new IllegalArgumentException(
                    "dm.objectChangeStart は 1 以上が必要です: " + dm.getObjectChangeStart());
        }
        this.views = views;
        this.selectionPolicy = selectionPolicy;
        this.engine = engine;
        this.applier = applier;
        this.probeChangeStart = dm.getProbeChangeStart();
        this.objectChangeStart = dm.getObjectChangeStart();
        this.minRepetitions = 1 + (dm.isKeepOnDevice() ? 1 : 0);
        this.alwaysMeasureProbeChange = dm.getOverlap().isAlwaysMeasureProbeChange();
    }

    /**
     * オーバーラップ拘束を解き、プローブとオブジェクトを更新します。
     *
     * @param state 再構成状態です（更新します）
     * @param cache ブロックキャッシュです
     * @param exitWaves 出射波状態です（全セル初期化済みが必要です）
     * @param iter 外側反復番号です
     * @return 実行結果です
     */
    public OverlapSolveResult solve(ReconstructionState state, BlockCache cache,
            ExitWaveState exitWaves, int iter) {
        boolean updateProbe = iter >= probeChangeStart;
        boolean updateObject = iter >= objectChangeStart;
        boolean convergenceTest = iter > probeChangeStart;

        double[] probeNorms = instanceNorms(state.probe(0));

        OverlapAccumulator last = null;
        double lastChange = Double.NaN;
        boolean converged = false;
        int repetitions = 0;

        for (int rep = 1; rep <= MAX_REPETITIONS; rep++) {
            repetitions = rep;
            ComplexStack probe0 = state.probe(0);

            last = accumulate(state, cache, exitWaves, iter);

            if (updateProbe) {
                applier.applyProbes(state, last);
            }
            if (updateObject) {
                applier.applyObjects(state, last, cache);
            }

            if (!convergenceTest) {
                continue;
            }
            boolean eligible = rep >= minRepetitions;
            if (eligible || alwaysMeasureProbeChange) {
                lastChange = relativeChange(state.probe(0), probe0, probeNorms);
                log.debug("オーバーラップ拘束 {} 回目：プローブ変化量={}%", rep,
                        String.format(Locale.ROOT, "%.2f", lastChange * 100.0));
            }
            if (eligible && lastChange < MIN_CHANGE) {
                converged = true;
                break;
            }
        }

        if (convergenceTest && !converged) {
            log.warn("オーバーラップ拘束が上限 {} 回で収束しませんでした。反復={}、プローブ変化量={}", MAX_REPETITIONS,
                    iter, String.format(Locale.ROOT, "%.5f", lastChange));
        } else {
            log.info("オーバーラップ拘束を終了しました。反復={}、繰り返し={}、プローブ変化量={}", iter, repetitions,
                    String.format(Locale.ROOT, "%.5f", lastChange));
        }
        if (updateObject && log.isDebugEnabled()) {
            for (int lo = 0; lo < state.objectModeCount(); lo++) {
                log.debug("オブジェクトモード {} の位相特異点数：{}", lo,
                        PhaseResidueCounter.countInScannedRegion(state.object(lo), cache));
            }
        }
        return new OverlapSolveResult(repetitions, lastChange, converged, last);
    }

    /**
     * 全ブロックの寄与を畳み込んだ累積器を返します。状態は変更しません。
     *
     * @param state 再構成状態です
     * @param cache ブロックキャッシュです（ブロックの処理順を決めます）
     * @param exitWaves 出射波状態です
     * @param iter 外側反復番号です
     * @return 累積器です
     */
    public OverlapAccumulator accumulate(ReconstructionState state, BlockCache cache,
            ExitWaveState exitWaves, int iter) {
        OverlapAccumulator acc = OverlapAccumulator.zeros(state);
        for (Block block : cache.getBlocks()) {
            acc.absorb(contribute(state, block, cache, exitWaves, iter), views, cache);
        }
        return acc;
    }

    /**
     * 1 ブロック分の寄与を計算します。
     *
     * @param state 再構成状態です
     * @param block 対象ブロックです
     * @param cache ブロックキャッシュです
     * @param exitWaves 出射波状態です
     * @param iter 外側反復番号です
     * @return ブロックの寄与です
     * @throws IllegalStateException 出射波が未初期化の場合に発生します
     */
    public BlockContribution contribute(ReconstructionState state, Block block, BlockCache cache,
            ExitWaveState exitWaves, int iter) {
        int modeCount = exitWaves.modeCount();
        List<ProbeSelection> selections = selectionPolicy.selectAll(block, modeCount);

        List<ComplexStack> dashes = new ArrayList<>(modeCount);
        for (int ll = 0; ll < modeCount; ll++) {
            dashes.add(engine.toDevice(exitWaves.get(ll, block.getIndex()).field()));
        }

        List<ComplexStack> objectViews = new ArrayList<>(state.objectModeCount());
        for (int lo = 0; lo < state.objectModeCount(); lo++) {
            objectViews.add(views.gather(state.object(lo), block, cache));
        }

        List<BlockContribution.ProbeTerm> probeTerms = Collections.emptyList();
        if (iter >= probeChangeStart) {
            probeTerms = new ArrayList<>(state.probeModeCount());
            for (int lp = 0; lp < state.probeModeCount(); lp++) {
                probeTerms.add(probeTerm(lp, dashes.get(lp), ModeAccess.modeAt(objectViews, lp),
                        selections.get(lp)));
            }
        }

        List<BlockContribution.ObjectTerm> objectTerms = Collections.emptyList();
        if (iter >= objectChangeStart) {
            objectTerms = new ArrayList<>(modeCount);
            for (int ll = 0; ll < modeCount; ll++) {
                ComplexStack probe = selections.get(ll)
                        .select(ModeAccess.modeAt(state.probes(), ll), block.size());
                objectTerms.add(objectTerm(ModeAccess.clamp(ll, state.objectModeCount()),
                        dashes.get(ll), probe));
            }
        }

        for (int ll = 0; ll < modeCount; ll++) {
            engine.toHost(dashes.get(ll));
        }
        return new BlockContribution(block, probeTerms, objectTerms);
    }

    /**
     * {@code ψ' ⊙ conj(O)} と {@code |O|^2} を、共有プローブなら 1 つのインスタンスへ、そうでなければ位置ごとのインスタンスへ振り分けます。
     */
    private static BlockContribution.ProbeTerm probeTerm(int mode, ComplexStack dash,
            ComplexStack objectViews, ProbeSelection selection) {
        ComplexStack update = dash.timesConjugate(objectViews);
        int positions = dash.depth();

        if (selection.isShared()) {
            ZMatrixRMaj sum = new ZMatrixRMaj(dash.height(), dash.width());
            DMatrixRMaj illum = new DMatrixRMaj(dash.height(), dash.width());
            for (int k = 0; k < positions; k++) {
                ComplexArrays.addEquals(sum, update.slice(k));
                ComplexArrays.addAbs2(objectViews.slice(k), illum);
            }
            return new BlockContribution.ProbeTerm(mode, new int[] {selection.instanceAt(0)},
                    new ZMatrixRMaj[] {sum}, new DMatrixRMaj[] {illum});
        }

        int[] instances = new int[positions];
        ZMatrixRMaj[] updates = new ZMatrixRMaj[positions];
        DMatrixRMaj[] illums = new DMatrixRMaj[positions];
        for (int k = 0; k < positions; k++) {
            instances[k] = selection.instanceAt(k);
            updates[k] = update.slice(k);
            illums[k] = ComplexArrays.abs2(objectViews.slice(k));
        }
        return new BlockContribution.ProbeTerm(mode, instances, updates, illums);
    }

    /**
     * {@code ψ' ⊙ conj(P)} と {@code |P|^2} をオブジェクトモードへの寄与にします。
     */
    private static BlockContribution.ObjectTerm objectTerm(int objectMode, ComplexStack dash,
            ComplexStack probe) {
        ComplexStack patches = dash.timesConjugate(probe);
        DMatrixRMaj[] weights = new DMatrixRMaj[probe.depth()];
        for (int k = 0; k < probe.depth(); k++) {
            weights[k] = ComplexArrays.abs2(probe.slice(k));
        }
        return new BlockContribution.ObjectTerm(objectMode, patches, weights);
    }

    /**
     * インスタンスごとの {@code ‖P_new − P_0‖ / ‖P_ref‖} の最大値を返します。
     */
    static double relativeChange(ComplexStack current, ComplexStack previous, double[] norms) {
        double max = 0.0;
        for (int i = 0; i < current.depth(); i++) {
            double d = ComplexArrays.distance(current.slice(i), previous.slice(i)) / norms[i];
            if (d > max || Double.isNaN(d)) {
                max = d;
            }
        }
        return max;
    }

    private static double[] instanceNorms(ComplexStack probe) {
        double[] norms = new double[probe.depth()];
        for (int i = 0; i < probe.depth(); i++) {
            norms[i] = ComplexArrays.norm(probe.slice(i));
        }
        return norms;
    }

    /**
     * オーバーラップ拘束の実行結果です。
     */
    @Value
    public static class OverlapSolveResult {

        /**
         * 実行した繰り返し回数です。
         */
        int repetitions;

        /**
         * 最後に計測したプローブの相対変化量です（計測していない場合は NaN）。
         */
        double lastProbeChange;

        /**
         * しきい値を下回って打ち切ったかどうかです。
         */
        boolean converged;

        /**
         * 最後の繰り返しで使った累積器です。
         */
        OverlapAccumulator lastAccumulator;
    }
}
