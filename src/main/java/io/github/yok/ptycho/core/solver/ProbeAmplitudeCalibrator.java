package io.github.yok.ptycho.core.solver;

import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.Block;
import io.github.yok.ptycho.core.block.BlockCache;
import io.github.yok.ptycho.core.data.DiffractionDataSource;
import io.github.yok.ptycho.core.state.ExitWaveState;
import io.github.yok.ptycho.core.state.ProbeAmplitudeCorrection;
import io.github.yok.ptycho.core.state.ReconstructionState;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 反復 0 でプローブの振幅を測定強度に合わせるコンポーネントです。
 */
@Slf4j
@RequiredArgsConstructor
public final class ProbeAmplitudeCalibrator {

    private final ExitWaveEngine engine;

    private final ModulusConstraintStage modulusStage;

    /**
     * 全ブロックの強度総和を累積します。状態は変更しません（出射波状態は空に戻します）。
     *
     * @param state 再構成状態です
     * @param cache ブロックキャッシュです
     * @param data 測定データです
     * @param exitWaves 出射波状態です
     * @return 累積した強度総和です
     */
    public ProbeAmplitudeCorrection measure(ReconstructionState state, BlockCache cache,
            DiffractionDataSource data, ExitWaveState exitWaves) {
        ProbeAmplitudeCorrection correction = ProbeAmplitudeCorrection.EMPTY;
        for (Block block : cache.getBlocks()) {
            BlockProjection projection = engine.project(state, block, cache, exitWaves);
            correction = modulusStage.accumulateIntensity(data, block,
                    projection.getFarFields(), correction);
            exitWaves.clearBlock(block.getIndex());
        }
        return correction;
    }

    /**
     * プローブ振幅を補正し、出射波状態を空に戻します。
     *
     * @param state 再構成状態です（プローブを更新します）
     * @param cache ブロックキャッシュです
     * @param data 測定データです
     * @param exitWaves 出射波状態です
     * @return プローブに掛けた倍率です
     * @throws IllegalStateException 予測強度の総和が 0 などで倍率が求まらない場合に発生します
     */
    public double calibrate(ReconstructionState state, BlockCache cache,
            DiffractionDataSource data, ExitWaveState exitWaves) {
        ProbeAmplitudeCorrection correction = measure(state, cache, data, exitWaves);
        double scale = correction.scaleFactor();

        for (int lp = 0; lp < state.probeModeCount(); lp++) {
            ComplexStack scaled = state.probe(lp).copy();
            scaled.scale(scale);
            state.replaceProbe(lp, scaled);
        }
        exitWaves.clear();

        log.info("プローブ振幅を補正しました。倍率={}（測定強度={}、予測強度={}）",
                String.format(Locale.ROOT, "%.5g", scale),
                String.format(Locale.ROOT, "%.5g", correction.getMeasuredIntensity()),
                String.format(Locale.ROOT, "%.5g", correction.getPredictedIntensity()));
        return scale;
    }
}
