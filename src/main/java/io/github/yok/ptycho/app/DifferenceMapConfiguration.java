package io.github.yok.ptycho.app;

import io.github.yok.ptycho.core.block.BlockCacheFactory;
import io.github.yok.ptycho.core.block.ProbeSelectionPolicy;
import io.github.yok.ptycho.core.constraint.ErrorReportingSchedule;
import io.github.yok.ptycho.core.constraint.FourierErrorMetric;
import io.github.yok.ptycho.core.constraint.MeanSquaredFourierError;
import io.github.yok.ptycho.core.constraint.ModulusConstraint;
import io.github.yok.ptycho.core.constraint.RelaxedModulusConstraint;
import io.github.yok.ptycho.core.data.DiffractionSimulator;
import io.github.yok.ptycho.core.data.SyntheticSampleFactory;
import io.github.yok.ptycho.core.propagation.CircularProbeSupport;
import io.github.yok.ptycho.core.propagation.FarFieldFourierPropagator;
import io.github.yok.ptycho.core.propagation.FourierPropagator;
import io.github.yok.ptycho.core.propagation.ProbeSupportConstraint;
import io.github.yok.ptycho.core.residency.ArrayResidency;
import io.github.yok.ptycho.core.residency.HeapArrayResidency;
import io.github.yok.ptycho.core.scan.RasterScanPattern;
import io.github.yok.ptycho.core.solver.DifferenceMapReconstruction;
import io.github.yok.ptycho.core.solver.DifferenceMapSolver;
import io.github.yok.ptycho.core.solver.ExitWaveEngine;
import io.github.yok.ptycho.core.solver.ModulusConstraintStage;
import io.github.yok.ptycho.core.solver.OverlapConstraintSolver;
import io.github.yok.ptycho.core.solver.ProbeAmplitudeCalibrator;
import io.github.yok.ptycho.core.solver.UpdateApplier;
import io.github.yok.ptycho.core.state.GaussianProbeInitializer;
import io.github.yok.ptycho.core.state.ReconstructionStateInitializer;
import io.github.yok.ptycho.core.view.IlluminationCeilingEstimator;
import io.github.yok.ptycho.core.view.IntegerShiftViewOperator;
import io.github.yok.ptycho.core.view.ObjectViewOperator;
import io.github.yok.ptycho.out.CsvResultWriter;
import io.github.yok.ptycho.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * ラスター走査 + 遠方場伝搬 + Difference-Map 解法の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class DifferenceMapConfiguration {

    /**
     * dm-ptycho-solver の設定値（ptycho.*）です。
     */
    private final PtychoProperties p;

    /**
     * 走査パターンを生成します。
     *
     * @return 走査パターンです
     */
    @Bean
    public RasterScanPattern rasterScanPattern() {
        PtychoProperties.Scan s = p.getScan();
        return new RasterScanPattern(s.getRows(), s.getCols(), s.getStep(), s.getScanGroups());
    }

    /**
     * ブロックキャッシュの生成ロジックを生成します。
     *
     * @return ブロックキャッシュの生成ロジックです
     */
    @Bean
    public BlockCacheFactory blockCacheFactory() {
        return new BlockCacheFactory(p.getBlocks().getSize());
    }

    /**
     * プローブインスタンスの選択規則を生成します。
     *
     * @return 選択規則です
     */
    @Bean
    public ProbeSelectionPolicy probeSelectionPolicy() {
        return new ProbeSelectionPolicy(p.getModel().isShareProbe());
    }

    /**
     * オブジェクトのビュー操作を生成します。
     *
     * @return ビュー操作です
     */
    @Bean
    public ObjectViewOperator objectViewOperator() {
        return new IntegerShiftViewOperator();
    }

    /**
     * 伝搬演算子を生成します。
     *
     * @return 伝搬演算子です
     */
    @Bean
    public FourierPropagator fourierPropagator() {
        return new FarFieldFourierPropagator();
    }

    /**
     * プローブの支持領域拘束を生成します。
     *
     * @return 支持領域拘束です
     */
    @Bean
    public ProbeSupportConstraint probeSupportConstraint() {
        return new CircularProbeSupport();
    }

    /**
     * 配列の配置先切り替えを生成します。
     *
     * @return 配置先切り替えです
     */
    @Bean
    public ArrayResidency arrayResidency() {
        return new HeapArrayResidency();
    }

    /**
     * 再構成状態の初期値生成ロジックを生成します。
     *
     * @param pattern 走査パターンです
     * @return 初期値生成ロジックです
     */
    @Bean
    public ReconstructionStateInitializer reconstructionStateInitializer(
            RasterScanPattern pattern) {
        return new GaussianProbeInitializer(p, pattern);
    }

    /**
     * 照明上限値の推定を生成します。
     *
     * @param views ビュー操作です
     * @param policy プローブ選択規則です
     * @return 照明上限値の推定です
     */
    @Bean
    public IlluminationCeilingEstimator illuminationCeilingEstimator(ObjectViewOperator views,
            ProbeSelectionPolicy policy) {
        return new IlluminationCeilingEstimator(views, policy);
    }

    /**
     * 出射波エンジンを生成します。
     *
     * @param views ビュー操作です
     * @param propagator 伝搬演算子です
     * @param policy プローブ選択規則です
     * @param residency 配置先切り替えです
     * @return 出射波エンジンです
     */
    @Bean
    public ExitWaveEngine exitWaveEngine(ObjectViewOperator views, FourierPropagator propagator,
            ProbeSelectionPolicy policy, ArrayResidency residency) {
        return new ExitWaveEngine(views, propagator, policy, residency,
                p.getDm().isKeepOnDevice());
    }

    /**
     * 振幅拘束段を生成します。
     *
     * @return 振幅拘束段です
     */
    @Bean
    public ModulusConstraintStage modulusConstraintStage() {
        PtychoProperties.Dm dm = p.getDm();
        ModulusConstraint constraint = new RelaxedModulusConstraint();
        FourierErrorMetric metric = new MeanSquaredFourierError();
        ErrorReportingSchedule schedule =
                new ErrorReportingSchedule(dm.isReportError(), dm.getNumberIterations());
        return new ModulusConstraintStage(constraint, metric, schedule, dm.getPfftRelaxation());
    }

    /**
     * プローブ振幅の補正を生成します。
     *
     * @param engine 出射波エンジンです
     * @param stage 振幅拘束段です
     * @return プローブ振幅の補正です
     */
    @Bean
    public ProbeAmplitudeCalibrator probeAmplitudeCalibrator(ExitWaveEngine engine,
            ModulusConstraintStage stage) {
        return new ProbeAmplitudeCalibrator(engine, stage);
    }

    /**
     * オーバーラップ拘束ソルバを生成します。
     *
     * @param views ビュー操作です
     * @param policy プローブ選択規則です
     * @param engine 出射波エンジンです
     * @param support プローブの支持領域拘束です
     * @return オーバーラップ拘束ソルバです
     */
    @Bean
    public OverlapConstraintSolver overlapConstraintSolver(ObjectViewOperator views,
            ProbeSelectionPolicy policy, ExitWaveEngine engine, ProbeSupportConstraint support) {
        PtychoProperties.Dm dm = p.getDm();
        UpdateApplier applier =
                new UpdateApplier(support, dm.getProbeInertia(), dm.getObjectInertia());
        return new OverlapConstraintSolver(views, policy, engine, applier, dm);
    }

    /**
     * DM ソルバを生成します。
     *
     * @param engine 出射波エンジンです
     * @param stage 振幅拘束段です
     * @param calibrator プローブ振幅の補正です
     * @param overlapSolver オーバーラップ拘束ソルバです
     * @return DM ソルバです
     */
    @Bean
    public DifferenceMapSolver differenceMapSolver(ExitWaveEngine engine,
            ModulusConstraintStage stage, ProbeAmplitudeCalibrator calibrator,
            OverlapConstraintSolver overlapSolver) {
        return new DifferenceMapSolver(engine, stage, calibrator, overlapSolver);
    }

    /**
     * 反復ドライバを生成します。
     *
     * @param solver DM ソルバです
     * @param estimator 照明上限値の推定です
     * @return 反復ドライバです
     */
    @Bean
    public DifferenceMapReconstruction differenceMapReconstruction(DifferenceMapSolver solver,
            IlluminationCeilingEstimator estimator) {
        return new DifferenceMapReconstruction(solver, estimator,
                p.getDm().getNumberIterations());
    }

    /**
     * 測定データのシミュレーションを生成します。
     *
     * <p>
     * 真の状態はプローブを 1 つだけ持つため、共有プローブとして選択します。
     * </p>
     *
     * @param views ビュー操作です
     * @param propagator 伝搬演算子です
     * @return シミュレーションです
     */
    @Bean
    public DiffractionSimulator diffractionSimulator(ObjectViewOperator views,
            FourierPropagator propagator) {
        return new DiffractionSimulator(views, propagator, new ProbeSelectionPolicy(true));
    }

    /**
     * 真の状態と測定データの生成ロジックを生成します。
     *
     * @param pattern 走査パターンです
     * @return 生成ロジックです
     */
    @Bean
    public SyntheticSampleFactory syntheticSampleFactory(RasterScanPattern pattern) {
        return new SyntheticSampleFactory(p, pattern);
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
