package io.github.yok.ptycho.core.constraint;

import java.util.Optional;
import org.ejml.data.DMatrixRMaj;

/**
 * 有効画素における {@code (aPsi − modF)^2} の平均を残差とする {@link FourierErrorMetric} です。
 */
public final class MeanSquaredFourierError implements FourierErrorMetric {

    @Override
    public double[] compute(DMatrixRMaj[] modulus, DMatrixRMaj[] predicted,
            Optional<DMatrixRMaj[]> validityMask) {
        double[] errors = new double[modulus.length];
        for (int k = 0; k < modulus.length; k++) {
            double[] modF = modulus[k].data;
            double[] aPsi = predicted[k].data;
            double[] valid = validityMask.isPresent() ? validityMask.get()[k].data : null;

            double sum = 0.0;
            double count = 0.0;
            for (int i = 0; i < modF.length; i++) {
                double v = valid == null ? 1.0 : valid[i];
                double d = aPsi[i] - modF[i];
                sum += v * d * d;
                count += v;
            }
            // 有効画素がない位置は 0 とします。
            errors[k] = count > 0.0 ? sum / count : 0.0;
        }
        return errors;
    }
}
