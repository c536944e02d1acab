package io.github.yok.ptycho.core.scan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RasterScanPatternTest {

    @Test
    void offsetsFollowRowMajorOrder() {
        RasterScanPattern p = new RasterScanPattern(2, 3, 5, 1);

        assertThat(p.positionCount()).isEqualTo(6);
        assertThat(p.rowOffsetOf(4)).isEqualTo(5);
        assertThat(p.colOffsetOf(4)).isEqualTo(5);
        assertThat(p.colOffsetOf(2)).isEqualTo(10);
        assertThat(p.objectHeight(8)).isEqualTo(13);
        assertThat(p.objectWidth(8)).isEqualTo(18);
    }

    @Test
    void rowsAreSplitIntoScanGroups() {
        RasterScanPattern p = new RasterScanPattern(4, 2, 1, 2);

        assertThat(p.scanIdOf(0)).isZero();
        assertThat(p.scanIdOf(3)).isZero();
        assertThat(p.scanIdOf(4)).isEqualTo(1);
        assertThat(p.scanIdOf(7)).isEqualTo(1);
        assertThat(p.scanGroupCount()).isEqualTo(2);
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThatThrownBy(() -> new RasterScanPattern(0, 1, 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RasterScanPattern(2, 2, -1, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RasterScanPattern(2, 2, 1, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
