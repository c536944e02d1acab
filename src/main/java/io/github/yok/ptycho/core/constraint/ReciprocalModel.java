package io.github.yok.ptycho.core.constraint;

import io.github.yok.ptycho.core.array.ComplexArrays;
import io.github.yok.ptycho.core.array.ComplexStack;
import java.util.List;
import org.ejml.data.DMatrixRMaj;

/**
 * 検出器面での予測振幅を計算するクラスです。
 *
 * <p>
 * 非干渉モードは強度で足し合わせます: {@code aPsi = sqrt(Σ_modes |Ψ_mode|^2)}。
 * </p>
 */
public final class ReciprocalModel {

    private ReciprocalModel() {}

    /**
     * 走査位置ごとの予測振幅を返します。
     *
     * @param farFields モードごとの検出器面の場（奥行き = 位置数）です
     * @return 位置ごとの予測振幅です
     */
    public static DMatrixRMaj[] amplitude(List<ComplexStack> farFields) {
        if (farFields == null || farFields.isEmpty()) {
            throw new IllegalArgumentException("farFields は 1 つ以上が必要です");
        }
        ComplexStack first = farFields.get(0);
        DMatrixRMaj[] out = new DMatrixRMaj[first.depth()];
        for (int k = 0; k < first.depth(); k++) {
            DMatrixRMaj intensity = new DMatrixRMaj(first.height(), first.width());
            for (ComplexStack field : farFields) {
                ComplexArrays.addAbs2(field.slice(k), intensity);
            }
            for (int i = 0; i < intensity.data.length; i++) {
                intensity.data[i] = Math.sqrt(intensity.data[i]);
            }
            out[k] = intensity;
        }
        return out;
    }
}
