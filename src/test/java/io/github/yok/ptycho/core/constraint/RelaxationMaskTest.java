package io.github.yok.ptycho.core.constraint;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class RelaxationMaskTest {

    @Test
    void absentMaskRelaxesEveryPixelUniformly() {
        RelaxationMask mask = RelaxationMask.of(Optional.empty(), 0.05);

        assertThat(mask.isUniform()).isTrue();
        assertThat(mask.weightAt(3, 17)).isEqualTo(0.05);
    }

    @Test
    void invalidPixelsKeepThePredictedField() {
        DMatrixRMaj valid = new DMatrixRMaj(new double[][] {{1.0, 0.0}});

        RelaxationMask mask = RelaxationMask.of(Optional.of(new DMatrixRMaj[] {valid}), 0.25);

        assertThat(mask.isUniform()).isFalse();
        assertThat(mask.weightAt(0, 0)).isEqualTo(0.25);
        assertThat(mask.weightAt(0, 1)).isEqualTo(RelaxationMask.BASE_RELAXATION);
    }
}
