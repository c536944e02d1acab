package io.github.yok.ptycho.core.solver;

import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.BlockCache;
import io.github.yok.ptycho.core.propagation.ProbeSupportConstraint;
import io.github.yok.ptycho.core.state.ModeAccess;
import io.github.yok.ptycho.core.state.OverlapAccumulator;
import io.github.yok.ptycho.core.state.ReconstructionState;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;

/**
 * 累積した更新量をプローブ・オブジェクトへ反映するコンポーネントです。
 *
 * <p>
 * プローブは {@code update / (illum + 1e-6)}、オブジェクトは {@code update / (illum + δ)}
 * （δ = 照明上限値 × 1e-4）で正規化し、慣性付きで旧値と混合します。 最初のプローブモードにのみ支持領域の拘束を適用します。
 * </p>
 */
public final class UpdateApplier {

    private final ProbeSupportConstraint support;

    private final double probeInertia;

    private final double objectInertia;

    /**
     * 更新の反映コンポーネントを生成します。
     *
     * @param support プローブの支持領域拘束です（null 不可）
     * @param probeInertia プローブ更新の慣性です（[0, 1]）
     * @param objectInertia オブジェクト更新の慣性です（[0, 1]）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public UpdateApplier(ProbeSupportConstraint support, double probeInertia,
            double objectInertia) {
        if (support == null) {
            throw new IllegalArgumentException("support は null 不可です");
        }
        if (!(probeInertia >= 0.0 && probeInertia <= 1.0)) {
            throw new IllegalArgumentException("dm.probeInertia は [0, 1] が必要です: " + probeInertia);
        }
        if (!(objectInertia >= 0.0 && objectInertia <= 1.0)) {
            throw new IllegalArgumentException(
                    "dm.objectInertia は [0, 1] が必要です: " + objectInertia);
        }
        this.support = support;
        this.probeInertia = probeInertia;
        this.objectInertia = objectInertia;
    }

    /**
     * 全プローブモードを更新します。
     *
     * @param state 再構成状態です
     * @param acc 累積器です
     */
    public void applyProbes(ReconstructionState state, OverlapAccumulator acc) {
        for (int lp = 0; lp < state.probeModeCount(); lp++) {
            state.replaceProbe(lp, updateProbe(state, acc, lp));
        }
    }

    /**
     * 全オブジェクトモードを更新します。
     *
     * @param state 再構成状態です
     * @param acc 累積器です
     * @param cache 照明上限値を保持するブロックキャッシュです
     * @throws IllegalStateException 照明上限値が正でない場合に発生します
     */
    public void applyObjects(ReconstructionState state, OverlapAccumulator acc,
            BlockCache cache) {
        for (int lo = 0; lo < state.objectModeCount(); lo++) {
            double ceiling = cache.maxIlluminationOf(lo);
            if (!(ceiling > 0.0) || !Double.isFinite(ceiling)) {
                throw new IllegalStateException(
                        "照明上限値が未計算または不正です: mode=" + lo + ", maxIllumination=" + ceiling);
            }
            ZMatrixRMaj updated = updateObject(state.object(lo), acc.objectUpdate(lo),
                    acc.objectIllumination(lo),
                    ceiling * DifferenceMapKernels.OBJECT_ILLUMINATION_FLOOR_RATIO,
                    objectInertia);
            state.replaceObject(lo, updated);
        }
    }

    /**
     * プローブモード lp の更新後の値を返します。
     *
     * @param state 再構成状態です
     * @param acc 累積器です
     * @param lp プローブモード番号です
     * @return 更新後のプローブです
     */
    ComplexStack updateProbe(ReconstructionState state, OverlapAccumulator acc, int lp) {
        ComplexStack old = state.probe(lp);
        ComplexStack update = acc.probeUpdate(lp);

        ZMatrixRMaj[] fresh = new ZMatrixRMaj[old.depth()];
        for (int i = 0; i < old.depth(); i++) {
            fresh[i] = DifferenceMapKernels.normalize(update.slice(i),
                    acc.probeIllumination(lp, i), DifferenceMapKernels.PROBE_ILLUMINATION_FLOOR);
        }
        ComplexStack estimate = ComplexStack.wrap(fresh);
        if (lp == 0) {
            estimate = support.apply(estimate, ModeAccess.modeAt(state.modes(), lp));
        }

        ZMatrixRMaj[] blended = new ZMatrixRMaj[old.depth()];
        for (int i = 0; i < old.depth(); i++) {
            blended[i] = DifferenceMapKernels.blend(probeInertia, old.slice(i), estimate.slice(i));
        }
        return ComplexStack.wrap(blended);
    }

    /**
     * {@code inertia·object + (1−inertia)·update/(illumination+delta)} を返します。
     *
     * @param object 旧オブジェクトです
     * @param update 複素更新量です
     * @param illumination 照明量です
     * @param delta 分母の下駄です
     * @param inertia 慣性です
     * @return 更新後のオブジェクトです
     */
    static ZMatrixRMaj updateObject(ZMatrixRMaj object, ZMatrixRMaj update,
            DMatrixRMaj illumination, double delta, double inertia) {
        ZMatrixRMaj fresh = DifferenceMapKernels.normalize(update, illumination, delta);
        return DifferenceMapKernels.blend(inertia, object, fresh);
    }

    public double getProbeInertia() {
        return probeInertia;
    }

    public double getObjectInertia() {
        return objectInertia;
    }
}
