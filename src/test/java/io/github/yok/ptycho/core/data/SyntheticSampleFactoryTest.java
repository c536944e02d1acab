package io.github.yok.ptycho.core.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.ptycho.app.PtychoProperties;
import io.github.yok.ptycho.core.block.BlockCache;
import io.github.yok.ptycho.core.block.BlockCacheFactory;
import io.github.yok.ptycho.core.block.ProbeSelectionPolicy;
import io.github.yok.ptycho.core.propagation.FarFieldFourierPropagator;
import io.github.yok.ptycho.core.scan.RasterScanPattern;
import io.github.yok.ptycho.core.state.ReconstructionState;
import io.github.yok.ptycho.core.view.IntegerShiftViewOperator;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SyntheticSampleFactoryTest {

    private PtychoProperties properties;

    private RasterScanPattern pattern;

    @BeforeEach
    void setUp() {
        properties = new PtychoProperties();
        properties.getScan().setRows(2);
        properties.getScan().setCols(3);
        properties.getScan().setStep(4);
        properties.getProbe().setSize(8);
        properties.getProbe().setSupportRadius(3.0);
        properties.getProbe().setGaussianSigma(2.0);
        properties.getSimulation().setFeatures(5);
        properties.getSimulation().setPhotons(1.0e4);
        pattern = new RasterScanPattern(2, 3, 4, 1);
    }

    @Test
    void groundTruthIsReproducibleForSeed() {
        ReconstructionState a = new SyntheticSampleFactory(properties, pattern).groundTruth();
        ReconstructionState b = new SyntheticSampleFactory(properties, pattern).groundTruth();

        assertThat(a.object(0).data).containsExactly(b.object(0).data);
        assertThat(a.object(0).numRows).isEqualTo(12);
        assertThat(a.object(0).numCols).isEqualTo(16);
        assertThat(a.probeModeCount()).isEqualTo(1);
    }

    @Test
    void objectAmplitudeStaysWithinAbsorptionRange() {
        ReconstructionState truth = new SyntheticSampleFactory(properties, pattern).groundTruth();
        double absorption = properties.getSimulation().getAbsorption();

        double[] d = truth.object(0).data;
        for (int i = 0; i < d.length / 2; i++) {
            double amplitude = Math.hypot(d[2 * i], d[2 * i + 1]);
            assertThat(amplitude).isBetween(1.0 - absorption - 1e-12, 1.0 + 1e-12);
        }
        assertThat(truth.probe(0).slice(0).getReal(0, 0)).isZero();
    }

    @Test
    void measurementIsScaledToPhotonCount() {
        SyntheticSampleFactory factory = new SyntheticSampleFactory(properties, pattern);
        ReconstructionState truth = factory.groundTruth();
        BlockCache cache = new BlockCacheFactory(4).create(pattern, 8, 8, 1);
        DiffractionSimulator simulator = new DiffractionSimulator(new IntegerShiftViewOperator(),
                new FarFieldFourierPropagator(), new ProbeSelectionPolicy(true));

        InMemoryDiffractionData data = factory.measure(simulator, truth, cache);

        assertThat(data.positionCount()).isEqualTo(6);
        double total = 0.0;
        for (int pos = 0; pos < 6; pos++) {
            DMatrixRMaj m = data.modulus(cache.getBlocks().get(pos / 4))[pos % 4];
            for (double v : m.data) {
                total += v * v;
            }
        }
        assertThat(total / 6).isCloseTo(1.0e4, within(1e-6));
    }
}
