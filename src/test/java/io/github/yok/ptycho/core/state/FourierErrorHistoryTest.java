package io.github.yok.ptycho.core.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class FourierErrorHistoryTest {

    @Test
    void unrecordedIterationsStayNaN() {
        FourierErrorHistory h = new FourierErrorHistory(3, 4);

        assertThat(h.iterationCapacity()).isEqualTo(4);
        assertThat(h.isRecorded(2)).isFalse();
        assertThat(h.mean(2)).isNaN();
        for (double e : h.at(2)) {
            assertThat(e).isNaN();
        }
    }

    @Test
    void meanCoversRecordedPositionsOnly() {
        FourierErrorHistory h = new FourierErrorHistory(3, 4);

        h.record(1, new int[] {0, 2}, new double[] {1.0, 3.0});

        assertThat(h.isRecorded(1)).isTrue();
        assertThat(h.mean(1)).isEqualTo(2.0);
        assertThat(h.at(1)[2]).isEqualTo(3.0);
        assertThat(h.at(1)[1]).isNaN();
    }

    @Test
    void returnedRowIsACopy() {
        FourierErrorHistory h = new FourierErrorHistory(1, 1);
        h.record(1, new int[] {0}, new double[] {5.0});

        h.at(1)[0] = 0.0;

        assertThat(h.at(1)[0]).isEqualTo(5.0);
    }

    @Test
    void lengthMismatchIsRejected() {
        FourierErrorHistory h = new FourierErrorHistory(1, 2);

        assertThatThrownBy(() -> h.record(1, new int[] {0, 1}, new double[] {1.0}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
