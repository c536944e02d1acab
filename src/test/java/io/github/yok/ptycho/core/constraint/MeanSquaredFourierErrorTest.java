package io.github.yok.ptycho.core.constraint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Optional;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class MeanSquaredFourierErrorTest {

    private final MeanSquaredFourierError metric = new MeanSquaredFourierError();

    @Test
    void averagesOverAllPixelsWithoutMask() {
        DMatrixRMaj[] modulus = {new DMatrixRMaj(new double[][] {{1.0, 2.0}})};
        DMatrixRMaj[] predicted = {new DMatrixRMaj(new double[][] {{2.0, 4.0}})};

        double[] e = metric.compute(modulus, predicted, Optional.empty());

        assertThat(e).hasSize(1);
        assertThat(e[0]).isCloseTo(2.5, within(1e-12));
    }

    @Test
    void maskedPixelsAreIgnored() {
        DMatrixRMaj[] modulus = {new DMatrixRMaj(new double[][] {{1.0, 2.0}})};
        DMatrixRMaj[] predicted = {new DMatrixRMaj(new double[][] {{2.0, 4.0}})};
        DMatrixRMaj[] mask = {new DMatrixRMaj(new double[][] {{1.0, 0.0}})};

        assertThat(metric.compute(modulus, predicted, Optional.of(mask))[0]).isEqualTo(1.0);
    }

    @Test
    void fullyMaskedPositionReportsZero() {
        DMatrixRMaj[] modulus = {new DMatrixRMaj(new double[][] {{1.0}})};
        DMatrixRMaj[] predicted = {new DMatrixRMaj(new double[][] {{5.0}})};
        DMatrixRMaj[] mask = {new DMatrixRMaj(new double[][] {{0.0}})};

        assertThat(metric.compute(modulus, predicted, Optional.of(mask))[0]).isZero();
    }
}
