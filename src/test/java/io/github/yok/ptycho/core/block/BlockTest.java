package io.github.yok.ptycho.core.block;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class BlockTest {

    @Test
    void callerArraysAreCopied() {
        int[] positions = {4, 5};
        int[] scanIds = {1, 1};
        Block block = new Block(0, positions, scanIds);

        positions[0] = 9;
        scanIds[1] = 2;
        block.getPositions()[1] = 7;
        block.getScanIds()[0] = 3;

        assertThat(block.getPositions()).containsExactly(4, 5);
        assertThat(block.getScanIds()).containsExactly(1, 1);
        assertThat(block.positionAt(1)).isEqualTo(5);
        assertThat(block.hasSingleScanId()).isTrue();
    }

    @Test
    void emptyBlockIsRejected() {
        assertThatThrownBy(() -> new Block(0, new int[0], new int[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void scanIdsMustMatchPositions() {
        assertThatThrownBy(() -> new Block(0, new int[] {0, 1}, new int[] {0}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Block(0, new int[] {0}, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cacheOffsetsCannotBeModifiedThroughGetters() {
        Block block = new Block(0, new int[] {0, 1}, new int[] {0, 0});
        int[] rows = {0, 2};
        BlockCache cache =
                new BlockCache(List.of(block), rows, new int[] {0, 3}, 2, 2, new double[] {1.0});

        rows[1] = 8;
        cache.getRowOffsets()[1] = 9;
        cache.getColOffsets()[1] = 9;

        assertThat(cache.rowOffsetOf(1)).isEqualTo(2);
        assertThat(cache.colOffsetOf(1)).isEqualTo(3);
        assertThat(cache.getRowOffsets()).containsExactly(0, 2);
    }
}
