package io.github.yok.ptycho.core.propagation;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.yok.ptycho.core.array.ComplexStack;
import org.junit.jupiter.api.Test;

class CircularProbeSupportTest {

    private static ComplexStack ones(int size) {
        ComplexStack s = new ComplexStack(size, size, 2);
        for (int k = 0; k < 2; k++) {
            for (int r = 0; r < size; r++) {
                for (int c = 0; c < size; c++) {
                    s.slice(k).set(r, c, 1.0, 1.0);
                }
            }
        }
        return s;
    }

    @Test
    void pixelsOutsideRadiusAreZeroedOnEveryInstance() {
        ComplexStack probe = ones(9);

        ComplexStack out = new CircularProbeSupport().apply(probe, new PropagationMode(0, 2.0));

        for (int k = 0; k < 2; k++) {
            assertThat(out.slice(k).getReal(4, 4)).isEqualTo(1.0);
            assertThat(out.slice(k).getReal(4, 6)).isEqualTo(1.0);
            assertThat(out.slice(k).getReal(0, 0)).isEqualTo(0.0);
            assertThat(out.slice(k).getImag(6, 6)).isEqualTo(0.0);
        }
        assertThat(probe.slice(0).getReal(0, 0)).isEqualTo(1.0);
    }

    @Test
    void nonPositiveRadiusLeavesProbeUnchanged() {
        ComplexStack probe = ones(5);

        ComplexStack out = new CircularProbeSupport().apply(probe, new PropagationMode(0, 0.0));

        assertThat(out).isNotSameAs(probe);
        assertThat(out.slice(1).getReal(0, 0)).isEqualTo(1.0);
    }
}
