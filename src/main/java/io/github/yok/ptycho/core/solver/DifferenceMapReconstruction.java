package io.github.yok.ptycho.core.solver;

import io.github.yok.ptycho.core.block.BlockCache;
import io.github.yok.ptycho.core.data.DiffractionDataSource;
import io.github.yok.ptycho.core.solver.DifferenceMapSolver.StepResult;
import io.github.yok.ptycho.core.state.ExitWaveState;
import io.github.yok.ptycho.core.state.FourierErrorHistory;
import io.github.yok.ptycho.core.state.ReconstructionState;
import io.github.yok.ptycho.core.view.IlluminationCeilingEstimator;
import java.util.Locale;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * 反復 0（キャリブレーション）から最終反復まで Difference-Map を実行するドライバです。
 *
 * <p>
 * 出射波状態とフーリエ誤差の履歴を反復をまたいで保持します。照明上限値はキャリブレーション直後と
 * {@value #CEILING_REFRESH_INTERVAL} 反復ごとに更新します。
 * </p>
 */
@Getter
@Slf4j
public final class DifferenceMapReconstruction {

    /**
     * 照明上限値を更新する反復間隔です。
     */
    public static final int CEILING_REFRESH_INTERVAL = 10;

    private final DifferenceMapSolver solver;

    private final IlluminationCeilingEstimator ceilingEstimator;

    /**
     * 最終反復番号です。
     */
    private final int numberOfIterations;

    /**
     * ドライバを生成します。
     *
     * @param solver DM ソルバです（null 不可）
     * @param ceilingEstimator 照明上限値の推定です（null 不可）
     * @param numberOfIterations 最終反復番号です（0 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public DifferenceMapReconstruction(DifferenceMapSolver solver,
            IlluminationCeilingEstimator ceilingEstimator, int numberOfIterations) {
        if (solver == null) {
            throw new IllegalArgumentException("solver は null 不可です");
        }
        if (ceilingEstimator == null) {
            throw new IllegalArgumentException("ceilingEstimator は null 不可です");
        }
        if (numberOfIterations < 0) {
            throw new IllegalArgumentException(
                    "dm.numberIterations は 0 以上が必要です: " + numberOfIterations);
        }
        this.solver = solver;
        this.ceilingEstimator = ceilingEstimator;
        this.numberOfIterations = numberOfIterations;
    }

    /**
     * 再構成を実行します。
     *
     * @param state 初期状態です（更新します）
     * @param cache ブロックキャッシュです
     * @param data 測定データです
     * @return 実行結果です
     */
    public ReconstructionResult run(ReconstructionState state, BlockCache cache,
            DiffractionDataSource data) {
        if (data.positionCount() != cache.positionCount()) {
            throw new IllegalArgumentException("測定データとブロックキャッシュの走査位置数が一致しません: "
                    + data.positionCount() + " vs " + cache.positionCount());
        }
        long t0 = System.nanoTime();

        int modeCount = Math.max(state.probeModeCount(), state.objectModeCount());
        ExitWaveState exitWaves = new ExitWaveState(modeCount, cache.blockCount());
        FourierErrorHistory history =
                new FourierErrorHistory(numberOfIterations, cache.positionCount());

        log.info("Difference-Map を開始します。最終反復={}、ブロック数={}、走査位置数={}、モード数={}",
                numberOfIterations, cache.blockCount(), cache.positionCount(), modeCount);

        double calibrationScale = Double.NaN;
        int convergedSolves = 0;
        for (int iter = 0; iter <= numberOfIterations; iter++) {
            StepResult step = solver.step(state, cache, data, exitWaves, history, iter);
            if (step.isCalibration()) {
                calibrationScale = step.getCalibrationScale();
            } else if (step.getOverlap() != null && step.getOverlap().isConverged()) {
                convergedSolves++;
            }

            if (iter % CEILING_REFRESH_INTERVAL == 0) {
                refreshCeilings(state, cache);
            }
            if (history.isRecorded(iter)) {
                log.info("反復 {} / {}：フーリエ誤差（平均）={}", iter, numberOfIterations,
                        fmt5(history.mean(iter)));
            }
        }

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("Difference-Map を終了しました。所要時間={}ms、最終フーリエ誤差={}、オーバーラップ拘束の収束回数={}",
                elapsedMs, fmt5(history.mean(numberOfIterations)), convergedSolves);
        return new ReconstructionResult(state, history, calibrationScale, convergedSolves);
    }

    private void refreshCeilings(ReconstructionState state, BlockCache cache) {
        double[] ceilings = ceilingEstimator.refresh(cache, state.probes(),
                state.object(0).numRows, state.object(0).numCols, state.objectModeCount());
        if (log.isDebugEnabled()) {
            StringBuilder sb = new StringBuilder();
            for (double c : ceilings) {
                sb.append(' ').append(fmt5(c));
            }
            log.debug("照明上限値を更新しました:{}", sb);
        }
    }

    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }

    /**
     * 再構成の実行結果です。
     */
    @Value
    public static class ReconstructionResult {

        /**
         * 最終状態です。
         */
        ReconstructionState state;

        /**
         * フーリエ誤差の履歴です。
         */
        FourierErrorHistory history;

        /**
         * キャリブレーションの倍率です。
         */
        double calibrationScale;

        /**
         * オーバーラップ拘束がしきい値で打ち切られた反復数です。
         */
        int convergedOverlapSolves;
    }
}
