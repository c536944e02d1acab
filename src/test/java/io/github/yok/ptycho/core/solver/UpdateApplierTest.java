package io.github.yok.ptycho.core.solver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.Block;
import io.github.yok.ptycho.core.block.BlockCache;
import io.github.yok.ptycho.core.propagation.CircularProbeSupport;
import io.github.yok.ptycho.core.state.BlockContribution;
import io.github.yok.ptycho.core.state.OverlapAccumulator;
import io.github.yok.ptycho.core.state.ReconstructionState;
import io.github.yok.ptycho.core.view.IntegerShiftViewOperator;
import java.util.Collections;
import java.util.List;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.junit.jupiter.api.Test;

class UpdateApplierTest {

    @Test
    void zeroInertiaKeepsNoMemoryOfOldObject() {
        ZMatrixRMaj object = SolverFixtures.constant(2, 2, 7.0, -3.0);
        ZMatrixRMaj update = SolverFixtures.constant(2, 2, 1.0, 0.5);
        DMatrixRMaj illum = new DMatrixRMaj(2, 2);
        illum.data = new double[] {0.0, 1.0, 2.0, 4.0};
        double delta = 0.25;

        ZMatrixRMaj result = UpdateApplier.updateObject(object, update, illum, delta, 0.0);

        for (int i = 0; i < illum.data.length; i++) {
            assertThat(result.data[2 * i]).isEqualTo(1.0 / (illum.data[i] + delta));
            assertThat(result.data[2 * i + 1]).isEqualTo(0.5 / (illum.data[i] + delta));
        }
    }

    @Test
    void unitInertiaLeavesObjectUnchanged() {
        ZMatrixRMaj object = SolverFixtures.constant(2, 2, 7.0, -3.0);
        ZMatrixRMaj update = SolverFixtures.constant(2, 2, 1.0, 0.5);
        DMatrixRMaj illum = new DMatrixRMaj(2, 2);

        ZMatrixRMaj result = UpdateApplier.updateObject(object, update, illum, 0.1, 1.0);

        assertThat(result.data).containsExactly(object.data);
    }

    @Test
    void probeUpdateAppliesSupportToFirstModeOnly() {
        int size = 9;
        ReconstructionState state = SolverFixtures.state(SolverFixtures.constant(size, size, 1, 0),
                SolverFixtures.constantStack(size, size, 1, 1.0, 0.0), 2.0);
        OverlapAccumulator acc = OverlapAccumulator.zeros(state);

        Block block = SolverFixtures.block(0, new int[] {0}, new int[] {0});
        BlockCache cache = SolverFixtures.cache(List.of(block), new int[] {0}, new int[] {0}, size,
                1, 1.0);
        ZMatrixRMaj update = SolverFixtures.constant(size, size, 2.0, 0.0);
        DMatrixRMaj illum = new DMatrixRMaj(size, size);
        CommonOps_DDRM.fill(illum, 1.0);
        acc.absorb(new BlockContribution(block,
                List.of(new BlockContribution.ProbeTerm(0, new int[] {0},
                        new ZMatrixRMaj[] {update}, new DMatrixRMaj[] {illum})),
                Collections.emptyList()), new IntegerShiftViewOperator(), cache);

        UpdateApplier applier = new UpdateApplier(new CircularProbeSupport(), 0.0, 0.0);
        applier.applyProbes(state, acc);

        ComplexStack probe = state.probe(0);
        // 中心は update/(illum+ε)、角は支持領域の外なので 0 です。
        assertThat(probe.slice(0).getReal(4, 4)).isEqualTo(2.0 / (1.0 + 1e-6));
        assertThat(probe.slice(0).getReal(0, 0)).isEqualTo(0.0);
        for (double v : probe.slice(0).data) {
            assertThat(v).isFinite();
        }
    }

    @Test
    void objectUpdateRequiresIlluminationCeiling() {
        ReconstructionState state = SolverFixtures.state(SolverFixtures.constant(3, 3, 1, 0),
                SolverFixtures.constantStack(3, 3, 1, 1.0, 0.0), 0.0);
        Block block = SolverFixtures.block(0, new int[] {0}, new int[] {0});
        BlockCache cache =
                SolverFixtures.cache(List.of(block), new int[] {0}, new int[] {0}, 3, 1, 0.0);

        UpdateApplier applier = new UpdateApplier(new CircularProbeSupport(), 0.5, 0.5);

        assertThatThrownBy(
                () -> applier.applyObjects(state, OverlapAccumulator.zeros(state), cache))
                        .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void inertiaOutsideUnitIntervalIsRejected() {
        assertThatThrownBy(() -> new UpdateApplier(new CircularProbeSupport(), 1.5, 0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dm.probeInertia");
    }
}
