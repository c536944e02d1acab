package io.github.yok.ptycho.core.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.ptycho.app.PtychoProperties;
import io.github.yok.ptycho.core.scan.RasterScanPattern;
import org.junit.jupiter.api.Test;

class GaussianProbeInitializerTest {

    private static PtychoProperties properties(int probeModes, int objectModes, boolean share) {
        PtychoProperties p = new PtychoProperties();
        p.getProbe().setSize(8);
        p.getProbe().setGaussianSigma(2.0);
        p.getProbe().setSupportRadius(3.0);
        p.getModel().setProbeModes(probeModes);
        p.getModel().setObjectModes(objectModes);
        p.getModel().setShareProbe(share);
        return p;
    }

    @Test
    void objectCoversScanAndStartsTransparent() {
        RasterScanPattern pattern = new RasterScanPattern(3, 2, 4, 1);

        ReconstructionState s = new GaussianProbeInitializer(properties(1, 2, true), pattern)
                .create();

        assertThat(s.objectModeCount()).isEqualTo(2);
        assertThat(s.object(1).numRows).isEqualTo(16);
        assertThat(s.object(1).numCols).isEqualTo(12);
        assertThat(s.object(0).getReal(5, 5)).isEqualTo(1.0);
        assertThat(s.object(0).getImag(5, 5)).isZero();
        assertThat(s.modes()).hasSize(2);
        assertThat(s.modes().get(1).getSupportRadius()).isEqualTo(3.0);
    }

    @Test
    void unsharedProbeHasOneInstancePerScanGroup() {
        RasterScanPattern pattern = new RasterScanPattern(4, 2, 4, 2);

        ReconstructionState s = new GaussianProbeInitializer(properties(2, 1, false), pattern)
                .create();

        assertThat(s.probe(0).depth()).isEqualTo(2);
        assertThat(s.probe(1).depth()).isEqualTo(1);
    }

    @Test
    void higherModeIsWeakAndAntisymmetric() {
        assertThat(GaussianProbeInitializer.probe(8, 2.0, 0, 1).slice(0).getReal(3, 3))
                .isCloseTo(Math.exp(-0.5 / 8.0), within(1e-12));

        double left = GaussianProbeInitializer.probe(8, 2.0, 1, 1).slice(0).getReal(3, 2);
        double right = GaussianProbeInitializer.probe(8, 2.0, 1, 1).slice(0).getReal(3, 5);
        assertThat(left).isNegative();
        assertThat(right).isCloseTo(-left, within(1e-12));
        assertThat(right).isLessThan(GaussianProbeInitializer.HIGHER_MODE_WEIGHT);
    }
}
