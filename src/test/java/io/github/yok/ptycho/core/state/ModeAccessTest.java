package io.github.yok.ptycho.core.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ModeAccessTest {

    @Test
    void indicesBeyondLastModeReuseLastMode() {
        List<String> modes = List.of("a", "b");

        assertThat(ModeAccess.modeAt(modes, 0)).isEqualTo("a");
        assertThat(ModeAccess.modeAt(modes, 1)).isEqualTo("b");
        assertThat(ModeAccess.modeAt(modes, 5)).isEqualTo("b");
        assertThat(ModeAccess.clamp(3, 1)).isZero();
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThatThrownBy(() -> ModeAccess.clamp(-1, 2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ModeAccess.clamp(0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
