package io.github.yok.ptycho.core.state;

import lombok.Value;

/**
 * キャリブレーション反復で累積する強度の総和の組です。
 *
 * <p>
 * 測定強度の総和 {@code Σ|modF|^2} と予測強度の総和 {@code Σ|aPsi|^2} を保持し、
 * プローブの倍率 {@code sqrt(Σ|modF|^2 / Σ|aPsi|^2)} を与えます。
 * </p>
 */
@Value
public class ProbeAmplitudeCorrection {

    /**
     * 累積前の初期値です。
     */
    public static final ProbeAmplitudeCorrection EMPTY = new ProbeAmplitudeCorrection(0.0, 0.0);

    /**
     * 測定強度の総和です。
     */
    double measuredIntensity;

    /**
     * 予測強度の総和です。
     */
    double predictedIntensity;

    /**
     * 1 ブロック分の強度を加えた新しい値を返します。
     *
     * @param measured ブロックの測定強度の総和です
     * @param predicted ブロックの予測強度の総和です
     * @return 加算後の値です
     */
    public ProbeAmplitudeCorrection plus(double measured, double predicted) {
        return new ProbeAmplitudeCorrection(measuredIntensity + measured,
                predictedIntensity + predicted);
    }

    /**
     * プローブに掛ける倍率を返します。
     *
     * @return 倍率です
     * @throws IllegalStateException 予測強度の総和が 0、または倍率が有限値でない場合に発生します
     */
    public double scaleFactor() {
        if (!(predictedIntensity > 0.0)) {
            throw new IllegalStateException(
                    "予測強度の総和が 0 のためプローブ振幅を補正できません: predicted=" + predictedIntensity);
        }
        double scale = Math.sqrt(measuredIntensity / predictedIntensity);
        if (!Double.isFinite(scale) || scale <= 0.0) {
            throw new IllegalStateException("プローブ振幅の補正倍率が不正です: measured=" + measuredIntensity
                    + ", predicted=" + predictedIntensity + ", scale=" + scale);
        }
        return scale;
    }
}
