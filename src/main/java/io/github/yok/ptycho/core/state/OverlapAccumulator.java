package io.github.yok.ptycho.core.state;

import io.github.yok.ptycho.core.array.ComplexArrays;
import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.BlockCache;
import io.github.yok.ptycho.core.view.ObjectViewOperator;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * オーバーラップ拘束の 1 パスで、全ブロックの寄与を合算する累積器です。
 *
 * <p>
 * パスの開始時に {@link #zeros} で生成し、ブロックごとの {@link BlockContribution} を
 * {@link #absorb} で加算した後、オブジェクト・プローブの更新で一度だけ消費します。 加算は可換なので、ブロックの処理順に依存しません。
 * </p>
 */
public final class OverlapAccumulator {

    /**
     * オブジェクトモードごとの複素更新量です。
     */
    private final ZMatrixRMaj[] objectUpdate;

    /**
     * オブジェクトモードごとの照明量です。
     */
    private final DMatrixRMaj[] objectIllumination;

    /**
     * プローブモードごとの複素更新量（インスタンスごと）です。
     */
    private final ComplexStack[] probeUpdate;

    /**
     * プローブモードごとの照明量（[モード][インスタンス]）です。
     */
    private final DMatrixRMaj[][] probeIllumination;

    private OverlapAccumulator(ZMatrixRMaj[] objectUpdate, DMatrixRMaj[] objectIllumination,
            ComplexStack[] probeUpdate, DMatrixRMaj[][] probeIllumination) {
        this.objectUpdate = objectUpdate;
        this.objectIllumination = objectIllumination;
        this.probeUpdate = probeUpdate;
        this.probeIllumination = probeIllumination;
    }

    /**
     * 再構成状態と同じ形状の、ゼロ初期化された累積器を生成します。
     *
     * @param state 再構成状態です
     * @return 累積器です
     */
    public static OverlapAccumulator zeros(ReconstructionState state) {
        int objectModes = state.objectModeCount();
        int probeModes = state.probeModeCount();

        ZMatrixRMaj[] objectUpdate = new ZMatrixRMaj[objectModes];
        DMatrixRMaj[] objectIllumination = new DMatrixRMaj[objectModes];
        for (int lo = 0; lo < objectModes; lo++) {
            ZMatrixRMaj o = state.object(lo);
            objectUpdate[lo] = new ZMatrixRMaj(o.numRows, o.numCols);
            objectIllumination[lo] = new DMatrixRMaj(o.numRows, o.numCols);
        }

        ComplexStack[] probeUpdate = new ComplexStack[probeModes];
        DMatrixRMaj[][] probeIllumination = new DMatrixRMaj[probeModes][];
        for (int lp = 0; lp < probeModes; lp++) {
            ComplexStack p = state.probe(lp);
            probeUpdate[lp] = new ComplexStack(p.height(), p.width(), p.depth());
            probeIllumination[lp] = new DMatrixRMaj[p.depth()];
            for (int i = 0; i < p.depth(); i++) {
                probeIllumination[lp][i] = new DMatrixRMaj(p.height(), p.width());
            }
        }
        return new OverlapAccumulator(objectUpdate, objectIllumination, probeUpdate,
                probeIllumination);
    }

    /**
     * 1 ブロック分の寄与を加算します。
     *
     * @param contribution ブロックの寄与です
     * @param views オブジェクトへの書き戻しを行うコンポーネントです
     * @param cache ビュー位置を保持するキャッシュです
     */
    public void absorb(BlockContribution contribution, ObjectViewOperator views,
            BlockCache cache) {
        for (BlockContribution.ProbeTerm term : contribution.getProbeTerms()) {
            int mode = term.getMode();
            for (int i = 0; i < term.getInstances().length; i++) {
                int instance = term.getInstances()[i];
                ComplexArrays.addEquals(probeUpdate[mode].slice(instance), term.getUpdates()[i]);
                CommonOps_DDRM.addEquals(probeIllumination[mode][instance],
                        term.getIlluminations()[i]);
            }
        }
        for (BlockContribution.ObjectTerm term : contribution.getObjectTerms()) {
            int lo = term.getObjectMode();
            views.scatterAdd(objectUpdate[lo], objectIllumination[lo], term.getPatches(),
                    term.getWeights(), contribution.getBlock(), cache);
        }
    }

    public ZMatrixRMaj objectUpdate(int objectMode) {
        return objectUpdate[objectMode];
    }

    public DMatrixRMaj objectIllumination(int objectMode) {
        return objectIllumination[objectMode];
    }

    public ComplexStack probeUpdate(int probeMode) {
        return probeUpdate[probeMode];
    }

    public DMatrixRMaj probeIllumination(int probeMode, int instance) {
        return probeIllumination[probeMode][instance];
    }

    public int objectModeCount() {
        return objectUpdate.length;
    }

    public int probeModeCount() {
        return probeUpdate.length;
    }
}
