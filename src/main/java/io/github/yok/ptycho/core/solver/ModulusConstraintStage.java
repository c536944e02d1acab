package io.github.yok.ptycho.core.solver;

import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.Block;
import io.github.yok.ptycho.core.constraint.ErrorReportingSchedule;
import io.github.yok.ptycho.core.constraint.FourierErrorMetric;
import io.github.yok.ptycho.core.constraint.ModulusConstraint;
import io.github.yok.ptycho.core.constraint.ReciprocalModel;
import io.github.yok.ptycho.core.constraint.RelaxationMask;
import io.github.yok.ptycho.core.data.DiffractionDataSource;
import io.github.yok.ptycho.core.state.FourierErrorHistory;
import io.github.yok.ptycho.core.state.ProbeAmplitudeCorrection;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;

/**
 * 検出器面で振幅拘束を適用する段です。
 *
 * <p>
 * キャリブレーション反復では拘束を適用せず、測定強度と予測強度の総和だけを累積します。
 * </p>
 */
@Getter
public final class ModulusConstraintStage {

    /**
     * 振幅拘束の実装です。
     */
    private final ModulusConstraint constraint;

    /**
     * フーリエ誤差の計算方法です。
     */
    private final FourierErrorMetric errorMetric;

    /**
     * フーリエ誤差を記録する反復の判定です。
     */
    private final ErrorReportingSchedule schedule;

    /**
     * 振幅拘束の緩和パラメータです。
     */
    private final double pfftRelaxation;

    /**
     * 振幅拘束段を生成します。
     *
     * @param constraint 振幅拘束です（null 不可）
     * @param errorMetric フーリエ誤差の計算方法です（null 不可）
     * @param schedule 記録スケジュールです（null 不可）
     * @param pfftRelaxation 緩和パラメータです（[0, 1]）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public ModulusConstraintStage(ModulusConstraint constraint, FourierErrorMetric errorMetric,
            ErrorReportingSchedule schedule, double pfftRelaxation) {
        if (constraint == null) {
            throw new IllegalArgumentException("constraint は null 不可です");
        }
        if (errorMetric == null) {
            throw new IllegalArgumentException("errorMetric は null 不可です");
        }
        if (schedule == null) {
            throw new IllegalArgumentException("schedule は null 不可です");
        }
        if (!(pfftRelaxation >= 0.0 && pfftRelaxation <= 1.0)) {
            throw new IllegalArgumentException(
                    "dm.pfftRelaxation は [0, 1] が必要です: " + pfftRelaxation);
        }
        this.constraint = constraint;
        this.errorMetric = errorMetric;
        this.schedule = schedule;
        this.pfftRelaxation = pfftRelaxation;
    }

    /**
     * 1 ブロック分の測定強度 {@code Σ|modF|^2} と予測強度 {@code Σ|aPsi|^2} を加えます。
     *
     * @param data 測定データです
     * @param block 対象ブロックです
     * @param farFields モードごとの検出器面の場です
     * @param correction これまでの累積値です
     * @return 加算後の累積値です
     */
    public ProbeAmplitudeCorrection accumulateIntensity(DiffractionDataSource data, Block block,
            List<ComplexStack> farFields, ProbeAmplitudeCorrection correction) {
        DMatrixRMaj[] modF = data.modulus(block);
        DMatrixRMaj[] aPsi = ReciprocalModel.amplitude(farFields);
        return correction.plus(sumOfSquares(modF), sumOfSquares(aPsi));
    }

    /**
     * 振幅拘束を適用した場を返します。
     *
     * <p>
     * 記録対象の反復では、拘束の前に位置ごとのフーリエ誤差を履歴へ書き込みます。
     * </p>
     *
     * @param data 測定データです
     * @param block 対象ブロックです
     * @param farFields モードごとの検出器面の場です
     * @param iter 外側反復番号です
     * @param history フーリエ誤差の履歴です
     * @return モードごとの拘束後の場です
     */
    public List<ComplexStack> constrain(DiffractionDataSource data, Block block,
            List<ComplexStack> farFields, int iter, FourierErrorHistory history) {
        DMatrixRMaj[] modF = data.modulus(block);
        DMatrixRMaj[] aPsi = ReciprocalModel.amplitude(farFields);
        Optional<DMatrixRMaj[]> validity = data.validityMask(block);

        if (schedule.shouldRecord(iter)) {
            double[] errors = errorMetric.compute(modF, aPsi, validity);
            history.record(iter, block.getPositions(), errors);
        }

        RelaxationMask mask = RelaxationMask.of(validity, pfftRelaxation);
        return constraint.apply(modF, aPsi, farFields, mask);
    }

    private static double sumOfSquares(DMatrixRMaj[] arrays) {
        double sum = 0.0;
        for (DMatrixRMaj a : arrays) {
            for (double v : a.data) {
                sum += v * v;
            }
        }
        return sum;
    }
}
