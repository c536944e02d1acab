package io.github.yok.ptycho.core.array;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ComplexStackTest {

    @Test
    void copyIsDeep() {
        ComplexStack s = new ComplexStack(2, 2, 2);
        s.slice(1).set(0, 0, 1.0, 1.0);

        ComplexStack c = s.copy();
        c.slice(1).set(0, 0, 9.0, 9.0);

        assertThat(s.slice(1).getReal(0, 0)).isEqualTo(1.0);
        assertThat(c.sameShape(s)).isTrue();
    }

    @Test
    void timesConjugateWorksSliceBySlice() {
        ComplexStack a = new ComplexStack(1, 1, 2);
        ComplexStack b = new ComplexStack(1, 1, 2);
        a.slice(0).set(0, 0, 0.0, 1.0);
        b.slice(0).set(0, 0, 0.0, 1.0);
        a.slice(1).set(0, 0, 2.0, 0.0);
        b.slice(1).set(0, 0, 3.0, 0.0);

        ComplexStack p = a.timesConjugate(b);

        assertThat(p.slice(0).getReal(0, 0)).isEqualTo(1.0);
        assertThat(p.slice(0).getImag(0, 0)).isEqualTo(0.0);
        assertThat(p.slice(1).getReal(0, 0)).isEqualTo(6.0);
    }

    @Test
    void wrapSharesSlices() {
        ComplexStack s = new ComplexStack(2, 2, 1);
        ComplexStack wrapped = ComplexStack.wrap(s.slice(0), s.slice(0));

        assertThat(wrapped.depth()).isEqualTo(2);
        assertThat(wrapped.slice(1)).isSameAs(s.slice(0));
    }

    @Test
    void mismatchedOrMissingOperandIsRejected() {
        ComplexStack s = new ComplexStack(2, 2, 1);

        assertThatThrownBy(() -> s.times(new ComplexStack(2, 2, 2)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> s.times(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
