package io.github.yok.ptycho.core.solver;

import io.github.yok.ptycho.app.PtychoProperties;
import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.Block;
import io.github.yok.ptycho.core.block.BlockCache;
import io.github.yok.ptycho.core.block.ProbeSelectionPolicy;
import io.github.yok.ptycho.core.constraint.ErrorReportingSchedule;
import io.github.yok.ptycho.core.constraint.MeanSquaredFourierError;
import io.github.yok.ptycho.core.constraint.RelaxedModulusConstraint;
import io.github.yok.ptycho.core.propagation.CircularProbeSupport;
import io.github.yok.ptycho.core.propagation.FourierPropagator;
import io.github.yok.ptycho.core.propagation.PropagationMode;
import io.github.yok.ptycho.core.residency.HeapArrayResidency;
import io.github.yok.ptycho.core.state.ReconstructionState;
import io.github.yok.ptycho.core.view.IntegerShiftViewOperator;
import io.github.yok.ptycho.core.view.ObjectViewOperator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.CommonOps_ZDRM;

/**
 * ソルバのテストで使う小さな部品をまとめたクラスです。
 */
final class SolverFixtures {

    private SolverFixtures() {}

    /**
     * 入力のコピーをそのまま返す伝搬演算子です。
     */
    static final FourierPropagator IDENTITY = new FourierPropagator() {
        @Override
        public ComplexStack forward(ComplexStack field, PropagationMode mode) {
            return field.copy();
        }

        @Override
        public ComplexStack backward(ComplexStack field, PropagationMode mode) {
            return field.copy();
        }
    };

    static Block block(int index, int[] positions, int[] scanIds) {
        return new Block(index, positions, scanIds);
    }

    static BlockCache cache(List<Block> blocks, int[] rows, int[] cols, int view,
            int objectModes, double ceiling) {
        double[] max = new double[objectModes];
        Arrays.fill(max, ceiling);
        return new BlockCache(blocks, rows, cols, view, view, max);
    }

    static ZMatrixRMaj constant(int h, int w, double re, double im) {
        ZMatrixRMaj m = new ZMatrixRMaj(h, w);
        CommonOps_ZDRM.fill(m, re, im);
        return m;
    }

    static ComplexStack constantStack(int h, int w, int depth, double re, double im) {
        ComplexStack s = new ComplexStack(h, w, depth);
        for (int k = 0; k < depth; k++) {
            CommonOps_ZDRM.fill(s.slice(k), re, im);
        }
        return s;
    }

    static ComplexStack gaussian(int size, double sigma, double amplitude) {
        ComplexStack probe = new ComplexStack(size, size, 1);
        double c = (size - 1) / 2.0;
        for (int r = 0; r < size; r++) {
            for (int col = 0; col < size; col++) {
                double d2 = (r - c) * (r - c) + (col - c) * (col - c);
                probe.slice(0).set(r, col, amplitude * Math.exp(-d2 / (2.0 * sigma * sigma)),
                        0.0);
            }
        }
        return probe;
    }

    static ReconstructionState state(ZMatrixRMaj object, ComplexStack probe,
            double supportRadius) {
        List<ZMatrixRMaj> objects = new ArrayList<>();
        objects.add(object);
        List<ComplexStack> probes = new ArrayList<>();
        probes.add(probe);
        List<PropagationMode> modes = new ArrayList<>();
        modes.add(new PropagationMode(0, supportRadius));
        return new ReconstructionState(objects, probes, modes);
    }

    static PtychoProperties.Dm dm(double probeInertia, double objectInertia, int objectChangeStart,
            boolean keepOnDevice) {
        PtychoProperties.Dm dm = new PtychoProperties.Dm();
        dm.setNumberIterations(5);
        dm.setPfftRelaxation(0.0);
        dm.setProbeInertia(probeInertia);
        dm.setObjectInertia(objectInertia);
        dm.setProbeChangeStart(1);
        dm.setObjectChangeStart(objectChangeStart);
        dm.setKeepOnDevice(keepOnDevice);
        dm.setReportError(true);
        return dm;
    }

    static ExitWaveEngine engine(FourierPropagator propagator, boolean shareProbe,
            boolean keepOnDevice) {
        return new ExitWaveEngine(new IntegerShiftViewOperator(), propagator,
                new ProbeSelectionPolicy(shareProbe), new HeapArrayResidency(), keepOnDevice);
    }

    static ModulusConstraintStage modulusStage(double pfft, int numberIterations) {
        return new ModulusConstraintStage(new RelaxedModulusConstraint(),
                new MeanSquaredFourierError(), new ErrorReportingSchedule(true, numberIterations),
                pfft);
    }

    static OverlapConstraintSolver overlapSolver(ExitWaveEngine engine, boolean shareProbe,
            PtychoProperties.Dm dm) {
        ObjectViewOperator views = engine.getViews();
        UpdateApplier applier = new UpdateApplier(new CircularProbeSupport(),
                dm.getProbeInertia(), dm.getObjectInertia());
        return new OverlapConstraintSolver(views, new ProbeSelectionPolicy(shareProbe), engine,
                applier, dm);
    }

    static DifferenceMapSolver solver(FourierPropagator propagator, PtychoProperties.Dm dm) {
        ExitWaveEngine engine = engine(propagator, true, dm.isKeepOnDevice());
        ModulusConstraintStage stage =
                modulusStage(dm.getPfftRelaxation(), dm.getNumberIterations());
        return new DifferenceMapSolver(engine, stage, new ProbeAmplitudeCalibrator(engine, stage),
                overlapSolver(engine, true, dm));
    }

    static DMatrixRMaj ones(int h, int w) {
        DMatrixRMaj m = new DMatrixRMaj(h, w);
        CommonOps_DDRM.fill(m, 1.0);
        return m;
    }
}
