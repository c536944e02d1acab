package io.github.yok.ptycho.core.state;

import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.propagation.PropagationMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.ejml.data.ZMatrixRMaj;

/**
 * 再構成の状態（オブジェクト・プローブ・モード記述子）を保持するクラスです。
 *
 * <p>
 * オブジェクトはモードごとの複素 2 次元配列、プローブはモードごとの複素 3 次元配列（高さ × 幅 × インスタンス）です。
 * 更新はオーバーラップ拘束の 1 パスの最後にのみ行います。
 * </p>
 */
public final class ReconstructionState {

    /**
     * オブジェクトモードの一覧です。
     */
    private final List<ZMatrixRMaj> objects;

    /**
     * プローブモードの一覧です。
     */
    private final List<ComplexStack> probes;

    /**
     * モードごとの伝搬記述子です。
     */
    private final List<PropagationMode> modes;

    /**
     * 再構成状態を生成します。
     *
     * @param objects オブジェクトモードの一覧です（1 つ以上、形状は一致が必要です）
     * @param probes プローブモードの一覧です（1 つ以上、高さ・幅は一致が必要です）
     * @param modes モードごとの伝搬記述子です（1 つ以上）
     * @throws IllegalArgumentException 引数が空、または形状が一致しない場合に発生します
     */
    public ReconstructionState(List<ZMatrixRMaj> objects, List<ComplexStack> probes,
            List<PropagationMode> modes) {
        if (objects == null || objects.isEmpty()) {
            throw new IllegalArgumentException("objects は 1 つ以上が必要です");
        }
        if (probes == null || probes.isEmpty()) {
            throw new IllegalArgumentException("probes は 1 つ以上が必要です");
        }
        if (modes == null || modes.isEmpty()) {
            throw new IllegalArgumentException("modes は 1 つ以上が必要です");
        }
        ZMatrixRMaj o0 = objects.get(0);
        for (ZMatrixRMaj o : objects) {
            if (o.numRows != o0.numRows || o.numCols != o0.numCols) {
                throw new IllegalArgumentException("オブジェクトモードの形状が一致しません");
            }
        }
        ComplexStack p0 = probes.get(0);
        for (ComplexStack p : probes) {
            if (p.height() != p0.height() || p.width() != p0.width()) {
                throw new IllegalArgumentException("プローブモードの形状が一致しません");
            }
        }
        this.objects = new ArrayList<>(objects);
        this.probes = new ArrayList<>(probes);
        this.modes = List.copyOf(modes);
    }

    public int objectModeCount() {
        return objects.size();
    }

    public int probeModeCount() {
        return probes.size();
    }

    public ZMatrixRMaj object(int mode) {
        return objects.get(mode);
    }

    public ComplexStack probe(int mode) {
        return probes.get(mode);
    }

    /**
     * オブジェクトモードの一覧を返します（読み取り専用）。
     *
     * @return オブジェクトモードの一覧です
     */
    public List<ZMatrixRMaj> objects() {
        return Collections.unmodifiableList(objects);
    }

    /**
     * プローブモードの一覧を返します（読み取り専用）。
     *
     * @return プローブモードの一覧です
     */
    public List<ComplexStack> probes() {
        return Collections.unmodifiableList(probes);
    }

    public List<PropagationMode> modes() {
        return modes;
    }

    /**
     * オブジェクトモードを差し替えます。
     *
     * @param mode モード番号です
     * @param object 新しいオブジェクトです
     */
    public void replaceObject(int mode, ZMatrixRMaj object) {
        objects.set(mode, object);
    }

    /**
     * プローブモードを差し替えます。
     *
     * @param mode モード番号です
     * @param probe 新しいプローブです
     */
    public void replaceProbe(int mode, ComplexStack probe) {
        probes.set(mode, probe);
    }
}
