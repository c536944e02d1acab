package io.github.yok.ptycho.core.constraint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.ptycho.core.array.ComplexStack;
import java.util.List;
import java.util.Optional;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class RelaxedModulusConstraintTest {

    private final RelaxedModulusConstraint constraint = new RelaxedModulusConstraint();

    private static ComplexStack field(double re, double im) {
        ComplexStack s = new ComplexStack(1, 2, 1);
        s.slice(0).set(0, 0, re, im);
        s.slice(0).set(0, 1, re, im);
        return s;
    }

    @Test
    void unrelaxedConstraintReplacesAmplitudeAndKeepsPhase() {
        List<ComplexStack> far = List.of(field(3.0, 4.0));
        DMatrixRMaj[] predicted = ReciprocalModel.amplitude(far);
        DMatrixRMaj[] modulus = {new DMatrixRMaj(new double[][] {{10.0, 10.0}})};

        List<ComplexStack> out = constraint.apply(modulus, predicted, far,
                RelaxationMask.of(Optional.empty(), 0.0));

        assertThat(out.get(0).slice(0).getReal(0, 0)).isCloseTo(6.0, within(1e-8));
        assertThat(out.get(0).slice(0).getImag(0, 0)).isCloseTo(8.0, within(1e-8));
        assertThat(far.get(0).slice(0).getReal(0, 0)).isEqualTo(3.0);
    }

    @Test
    void incoherentModesShareOneCorrection() {
        // |F|^2 = 9 + 16 = 25、測定振幅 10 なので両モードとも 2 倍になります。
        List<ComplexStack> far = List.of(field(3.0, 0.0), field(0.0, 4.0));
        DMatrixRMaj[] predicted = ReciprocalModel.amplitude(far);
        DMatrixRMaj[] modulus = {new DMatrixRMaj(new double[][] {{10.0, 10.0}})};

        List<ComplexStack> out = constraint.apply(modulus, predicted, far,
                RelaxationMask.of(Optional.empty(), 0.0));

        assertThat(predicted[0].get(0, 0)).isCloseTo(5.0, within(1e-12));
        assertThat(out.get(0).slice(0).getReal(0, 0)).isCloseTo(6.0, within(1e-8));
        assertThat(out.get(1).slice(0).getImag(0, 0)).isCloseTo(8.0, within(1e-8));
    }

    @Test
    void maskedPixelIsLeftUnchanged() {
        List<ComplexStack> far = List.of(field(3.0, 4.0));
        DMatrixRMaj[] predicted = ReciprocalModel.amplitude(far);
        DMatrixRMaj[] modulus = {new DMatrixRMaj(new double[][] {{10.0, 10.0}})};
        DMatrixRMaj valid = new DMatrixRMaj(new double[][] {{1.0, 0.0}});

        List<ComplexStack> out = constraint.apply(modulus, predicted, far,
                RelaxationMask.of(Optional.of(new DMatrixRMaj[] {valid}), 0.0));

        assertThat(out.get(0).slice(0).getReal(0, 0)).isCloseTo(6.0, within(1e-8));
        assertThat(out.get(0).slice(0).getReal(0, 1)).isEqualTo(3.0);
        assertThat(out.get(0).slice(0).getImag(0, 1)).isEqualTo(4.0);
    }

    @Test
    void relaxationBlendsTowardsPrediction() {
        List<ComplexStack> far = List.of(field(3.0, 4.0));
        DMatrixRMaj[] predicted = ReciprocalModel.amplitude(far);
        DMatrixRMaj[] modulus = {new DMatrixRMaj(new double[][] {{10.0, 10.0}})};

        List<ComplexStack> out = constraint.apply(modulus, predicted, far,
                RelaxationMask.of(Optional.empty(), 0.5));

        // R = 0.5 * 2 + 0.5 = 1.5
        assertThat(out.get(0).slice(0).getReal(0, 0)).isCloseTo(4.5, within(1e-8));
    }

    @Test
    void positionCountMismatchIsRejected() {
        List<ComplexStack> far = List.of(field(1.0, 0.0));
        DMatrixRMaj[] two = {new DMatrixRMaj(1, 2), new DMatrixRMaj(1, 2)};

        assertThatThrownBy(() -> constraint.apply(two, ReciprocalModel.amplitude(far), far,
                RelaxationMask.of(Optional.empty(), 0.0)))
                        .isInstanceOf(IllegalArgumentException.class);
    }
}
