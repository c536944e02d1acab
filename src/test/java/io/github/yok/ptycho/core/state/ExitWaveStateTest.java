package io.github.yok.ptycho.core.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.ptycho.core.array.ComplexStack;
import org.junit.jupiter.api.Test;

class ExitWaveStateTest {

    @Test
    void cellsStartUninitialized() {
        ExitWaveState s = new ExitWaveState(2, 3);

        assertThat(s.initializedCount()).isZero();
        assertThat(s.get(1, 2).isInitialized()).isFalse();
        assertThatThrownBy(() -> s.get(0, 0).field()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void storedCellReturnsItsField() {
        ComplexStack stored = new ComplexStack(2, 2, 1);
        ExitWaveState s = new ExitWaveState(1, 1);

        s.set(0, 0, ExitWaveCell.of(stored));

        assertThat(s.get(0, 0).isInitialized()).isTrue();
        assertThat(s.get(0, 0).field()).isSameAs(stored);
        assertThatThrownBy(() -> ExitWaveCell.of(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clearBlockResetsOneBlockForAllModes() {
        ExitWaveState s = new ExitWaveState(2, 2);
        for (int ll = 0; ll < 2; ll++) {
            for (int b = 0; b < 2; b++) {
                s.set(ll, b, ExitWaveCell.of(new ComplexStack(2, 2, 1)));
            }
        }

        s.clearBlock(0);

        assertThat(s.initializedCount()).isEqualTo(2);
        assertThat(s.get(1, 0).isInitialized()).isFalse();
        assertThat(s.get(1, 1).isInitialized()).isTrue();

        s.clear();
        assertThat(s.initializedCount()).isZero();
    }

    @Test
    void nonPositiveDimensionsAreRejected() {
        assertThatThrownBy(() -> new ExitWaveState(0, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
