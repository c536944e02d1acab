package io.github.yok.ptycho.core.solver;

import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.Block;
import io.github.yok.ptycho.core.block.BlockCache;
import io.github.yok.ptycho.core.data.DiffractionDataSource;
import io.github.yok.ptycho.core.solver.OverlapConstraintSolver.OverlapSolveResult;
import io.github.yok.ptycho.core.state.ExitWaveState;
import io.github.yok.ptycho.core.state.FourierErrorHistory;
import io.github.yok.ptycho.core.state.ReconstructionState;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Value;

/**
 * Difference-Map の外側反復 1 回分を実行するクラスです。
 *
 * <p>
 * {@link DifferenceMapPhase} の順に、キャリブレーション、出射波更新、オーバーラップ拘束を実行します。
 * </p>
 */
@Getter
public final class DifferenceMapSolver {

    private final ExitWaveEngine engine;

    private final ModulusConstraintStage modulusStage;

    private final ProbeAmplitudeCalibrator calibrator;

    private final OverlapConstraintSolver overlapSolver;

    /**
     * DM ソルバを生成します。
     *
     * @param engine 出射波エンジンです（null 不可）
     * @param modulusStage 振幅拘束段です（null 不可）
     * @param calibrator プローブ振幅の補正です（null 不可）
     * @param overlapSolver オーバーラップ拘束ソルバです（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public DifferenceMapSolver(ExitWaveEngine engine, ModulusConstraintStage modulusStage,
            ProbeAmplitudeCalibrator calibrator, OverlapConstraintSolver overlapSolver) {
        if (engine == null) {
            throw new IllegalArgumentException("engine は null 不可です");
        }
        if (modulusStage == null) {
            throw new IllegalArgumentException("modulusStage は null 不可です");
        }
        if (calibrator == null) {
            throw new IllegalArgumentException("calibrator は null 不可です");
        }
        if (overlapSolver == null) {
            throw new IllegalArgumentException("overlapSolver は null 不可です");
        }
        this.engine = engine;
        this.modulusStage = modulusStage;
        this.calibrator = calibrator;
        this.overlapSolver = overlapSolver;
    }

    /**
     * 外側反復 iter を 1 回実行します。
     *
     * @param state 再構成状態です（更新します）
     * @param cache ブロックキャッシュです
     * @param data 測定データです
     * @param exitWaves 出射波状態です（呼び出しをまたいで保持します）
     * @param history フーリエ誤差の履歴です
     * @param iter 外側反復番号です（0 以上）
     * @return 実行結果です
     */
    public StepResult step(ReconstructionState state, BlockCache cache, DiffractionDataSource data,
            ExitWaveState exitWaves, FourierErrorHistory history, int iter) {
        if (state == null || cache == null || data == null || exitWaves == null
                || history == null) {
            throw new IllegalArgumentException("state/cache/data/exitWaves/history は null 不可です");
        }
        if (exitWaves.blockCount() != cache.blockCount()) {
            throw new IllegalArgumentException("出射波状態とブロックキャッシュのブロック数が一致しません: "
                    + exitWaves.blockCount() + " vs " + cache.blockCount());
        }
        int modeCount = Math.max(state.probeModeCount(), state.objectModeCount());
        if (exitWaves.modeCount() != modeCount) {
            throw new IllegalArgumentException("出射波状態のモード数が再構成状態と一致しません: "
                    + exitWaves.modeCount() + " vs " + modeCount);
        }

        List<DifferenceMapPhase> visited = new ArrayList<>(2);
        double scale = Double.NaN;
        OverlapSolveResult overlap = null;

        DifferenceMapPhase phase = DifferenceMapPhase.entryOf(iter);
        while (phase != null) {
            visited.add(phase);
            switch (phase) {
                case CALIBRATE:
                    scale = calibrator.calibrate(state, cache, data, exitWaves);
                    break;
                case DM_UPDATE:
                    updateExitWaves(state, cache, data, exitWaves, history, iter);
                    break;
                case OVERLAP_SOLVE:
                    overlap = overlapSolver.solve(state, cache, exitWaves, iter);
                    break;
                default:
                    throw new IllegalStateException("未知の段階です: " + phase);
            }
            phase = phase.next();
        }
        return new StepResult(iter, visited, scale, overlap);
    }

    /**
     * 全ブロックについて射影・振幅拘束・差分ステップを実行します。
     */
    private void updateExitWaves(ReconstructionState state, BlockCache cache,
            DiffractionDataSource data, ExitWaveState exitWaves, FourierErrorHistory history,
            int iter) {
        for (Block block : cache.getBlocks()) {
            BlockProjection projection = engine.project(state, block, cache, exitWaves);
            List<ComplexStack> constrained = modulusStage.constrain(data, block,
                    projection.getFarFields(), iter, history);
            engine.commit(state, projection, constrained, exitWaves);
        }
    }

    /**
     * 外側反復 1 回分の実行結果です。
     */
    @Value
    public static class StepResult {

        /**
         * 外側反復番号です。
         */
        int iteration;

        /**
         * 実行した段階（実行順）です。
         */
        List<DifferenceMapPhase> phases;

        /**
         * キャリブレーションでプローブに掛けた倍率です（キャリブレーション以外は NaN）。
         */
        double calibrationScale;

        /**
         * オーバーラップ拘束の結果です（キャリブレーション反復では null）。
         */
        OverlapSolveResult overlap;

        public boolean isCalibration() {
            return phases.contains(DifferenceMapPhase.CALIBRATE);
        }
    }
}
