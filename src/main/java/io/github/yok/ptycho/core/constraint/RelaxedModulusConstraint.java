package io.github.yok.ptycho.core.constraint;

import io.github.yok.ptycho.core.array.ComplexStack;
import java.util.ArrayList;
import java.util.List;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;

/**
 * 緩和付きの振幅拘束です。
 *
 * <p>
 * 各画素で {@code R = (1 − w)·modF/(aPsi + ε) + w} を求め、全モードの場に同じ {@code R} を掛けます。
 * 非干渉モードの強度比は保たれます。
 * </p>
 */
public final class RelaxedModulusConstraint implements ModulusConstraint {

    /**
     * 予測振幅が 0 の画素での除算を避けるための下駄です。
     */
    private static final double AMPLITUDE_FLOOR = 1e-9;

    @Override
    public List<ComplexStack> apply(DMatrixRMaj[] modulus, DMatrixRMaj[] predicted,
            List<ComplexStack> farFields, RelaxationMask mask) {
        if (modulus.length != predicted.length) {
            throw new IllegalArgumentException("測定振幅と予測振幅の位置数が一致しません: " + modulus.length
                    + " vs " + predicted.length);
        }

        // 位置ごとの補正係数 R（全モード共通）
        double[][] ratio = new double[modulus.length][];
        for (int k = 0; k < modulus.length; k++) {
            double[] modF = modulus[k].data;
            double[] aPsi = predicted[k].data;
            double[] r = new double[modF.length];
            for (int i = 0; i < r.length; i++) {
                double w = mask.weightAt(k, i);
                r[i] = (1.0 - w) * modF[i] / (aPsi[i] + AMPLITUDE_FLOOR) + w;
            }
            ratio[k] = r;
        }

        List<ComplexStack> out = new ArrayList<>(farFields.size());
        for (ComplexStack field : farFields) {
            ComplexStack constrained = field.copy();
            for (int k = 0; k < constrained.depth(); k++) {
                ZMatrixRMaj s = constrained.slice(k);
                double[] r = ratio[k];
                for (int i = 0; i < r.length; i++) {
                    s.data[2 * i] *= r[i];
                    s.data[2 * i + 1] *= r[i];
                }
            }
            out.add(constrained);
        }
        return out;
    }
}
