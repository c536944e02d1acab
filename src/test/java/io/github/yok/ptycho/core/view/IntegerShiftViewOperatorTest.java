package io.github.yok.ptycho.core.view;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.Block;
import io.github.yok.ptycho.core.block.BlockCache;
import java.util.List;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.Test;

class IntegerShiftViewOperatorTest {

    private final IntegerShiftViewOperator views = new IntegerShiftViewOperator();

    private final Block block = new Block(0, new int[] {0, 1}, new int[] {0, 0});

    private final BlockCache cache = new BlockCache(List.of(block), new int[] {0, 1},
            new int[] {0, 2}, 2, 2, new double[] {0.0});

    private static ZMatrixRMaj indexed(int h, int w) {
        ZMatrixRMaj m = new ZMatrixRMaj(h, w);
        for (int r = 0; r < h; r++) {
            for (int c = 0; c < w; c++) {
                m.set(r, c, r * 10 + c, -(r * 10 + c));
            }
        }
        return m;
    }

    @Test
    void gatherCopiesWindowAtEachOffset() {
        ComplexStack v = views.gather(indexed(4, 5), block, cache);

        assertThat(v.depth()).isEqualTo(2);
        assertThat(v.slice(0).getReal(1, 1)).isEqualTo(11.0);
        assertThat(v.slice(1).getReal(0, 0)).isEqualTo(12.0);
        assertThat(v.slice(1).getImag(1, 1)).isEqualTo(-23.0);
    }

    @Test
    void scatterAddSumsOverlappingPatches() {
        ZMatrixRMaj update = new ZMatrixRMaj(4, 5);
        DMatrixRMaj illumination = new DMatrixRMaj(4, 5);
        ComplexStack patches = new ComplexStack(2, 2, 2);
        DMatrixRMaj[] weights = {new DMatrixRMaj(2, 2), new DMatrixRMaj(2, 2)};
        for (int k = 0; k < 2; k++) {
            for (int i = 0; i < 4; i++) {
                patches.slice(k).data[2 * i] = 1.0;
                weights[k].data[i] = 0.5;
            }
        }
        BlockCache overlapping = new BlockCache(List.of(block), new int[] {0, 1},
                new int[] {0, 1}, 2, 2, new double[] {0.0});

        views.scatterAdd(update, illumination, patches, weights, block, overlapping);

        assertThat(update.getReal(1, 1)).isEqualTo(2.0);
        assertThat(update.getReal(0, 0)).isEqualTo(1.0);
        assertThat(update.getReal(3, 3)).isEqualTo(0.0);
        assertThat(illumination.get(1, 1)).isEqualTo(1.0);
        assertThat(illumination.get(2, 2)).isEqualTo(0.5);
    }

    @Test
    void viewOutsideObjectIsRejected() {
        assertThatThrownBy(() -> views.gather(indexed(2, 3), block, cache))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
