package io.github.yok.ptycho.core.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.Block;
import io.github.yok.ptycho.core.block.BlockCache;
import io.github.yok.ptycho.core.block.ProbeSelectionPolicy;
import io.github.yok.ptycho.core.propagation.FarFieldFourierPropagator;
import io.github.yok.ptycho.core.propagation.PropagationMode;
import io.github.yok.ptycho.core.state.ReconstructionState;
import io.github.yok.ptycho.core.view.IntegerShiftViewOperator;
import java.util.List;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;
import org.junit.jupiter.api.Test;

class DiffractionSimulatorTest {

    private final DiffractionSimulator simulator = new DiffractionSimulator(
            new IntegerShiftViewOperator(), new FarFieldFourierPropagator(),
            new ProbeSelectionPolicy(true));

    private static ComplexStack flatProbe(double amplitude) {
        ComplexStack p = new ComplexStack(4, 4, 1);
        CommonOps_ZDRM.fill(p.slice(0), amplitude, 0.0);
        return p;
    }

    @Test
    void modulusConservesEnergyPerPosition() {
        ZMatrixRMaj object = new ZMatrixRMaj(4, 6);
        CommonOps_ZDRM.fill(object, 0.0, 0.5);
        ReconstructionState truth = new ReconstructionState(List.of(object),
                List.of(flatProbe(2.0)), List.of(new PropagationMode(0, 0.0)));
        Block block = new Block(0, new int[] {0, 1}, new int[] {0, 0});
        BlockCache cache = new BlockCache(List.of(block), new int[] {0, 0}, new int[] {0, 2}, 4,
                4, new double[] {0.0});

        DMatrixRMaj[] modulus = simulator.simulate(truth, cache);

        assertThat(modulus).hasSize(2);
        // |O P|^2 = 1 が 16 画素、フーリエ面では直流成分に集まります。
        assertThat(modulus[1].get(0, 0)).isCloseTo(4.0, within(1e-12));
        assertThat(sumOfSquares(modulus[0])).isCloseTo(16.0, within(1e-10));
    }

    @Test
    void incoherentModesAddInIntensity() {
        ZMatrixRMaj object = new ZMatrixRMaj(4, 4);
        CommonOps_ZDRM.fill(object, 1.0, 0.0);
        ReconstructionState truth = new ReconstructionState(List.of(object),
                List.of(flatProbe(3.0), flatProbe(4.0)),
                List.of(new PropagationMode(0, 0.0), new PropagationMode(1, 0.0)));
        Block block = new Block(0, new int[] {0}, new int[] {0});
        BlockCache cache = new BlockCache(List.of(block), new int[] {0}, new int[] {0}, 4, 4,
                new double[] {0.0});

        DMatrixRMaj[] modulus = simulator.simulate(truth, cache);

        // sqrt((3*4)^2 + (4*4)^2) = 20
        assertThat(modulus[0].get(0, 0)).isCloseTo(20.0, within(1e-10));
    }

    private static double sumOfSquares(DMatrixRMaj m) {
        double s = 0.0;
        for (double v : m.data) {
            s += v * v;
        }
        return s;
    }
}
