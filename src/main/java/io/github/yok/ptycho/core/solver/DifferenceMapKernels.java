package io.github.yok.ptycho.core.solver;

import io.github.yok.ptycho.core.array.ComplexArrays;
import io.github.yok.ptycho.core.array.ComplexStack;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;

/**
 * Difference-Map の要素ごとの更新式をまとめたクラスです。
 *
 * <p>
 * いずれも入力を変更せず、新しい配列を返します。
 * </p>
 */
public final class DifferenceMapKernels {

    /**
     * 実空間の混合係数 γ です。
     */
    public static final double GAMMA = 1.0;

    /**
     * 差分ステップの係数 β です。
     */
    public static final double BETA = 1.0;

    /**
     * プローブ更新の分母に加える下駄です。
     */
    public static final double PROBE_ILLUMINATION_FLOOR = 1e-6;

    /**
     * オブジェクト更新の分母に加える下駄の、照明上限値に対する比です。
     */
    public static final double OBJECT_ILLUMINATION_FLOOR_RATIO = 1e-4;

    private DifferenceMapKernels() {}

    /**
     * 実空間の混合 {@code Ψ = (1+γ)·ψ − γ·ψ'} を計算します。
     *
     * @param gamma 混合係数 γ です
     * @param psi 現在の射影 ψ です
     * @param psiDash 固定点変数 ψ' です
     * @return 混合後の場 Ψ です
     */
    public static ComplexStack extrapolate(double gamma, ComplexStack psi, ComplexStack psiDash) {
        checkSameShape(psi, psiDash);
        ComplexStack out = psi.copy();
        for (int k = 0; k < out.depth(); k++) {
            double[] o = out.slice(k).data;
            double[] d = psiDash.slice(k).data;
            for (int i = 0; i < o.length; i++) {
                o[i] = (1.0 + gamma) * o[i] - gamma * d[i];
            }
        }
        return out;
    }

    /**
     * 差分ステップ {@code ψ' ← ψ' + β·(Ψ_back − ψ)} を計算します。
     *
     * @param psiDash 固定点変数 ψ' です
     * @param beta 係数 β です
     * @param constrained 振幅拘束後に逆伝搬した場 Ψ_back です
     * @param psi 拘束前の射影 ψ です
     * @return 更新後の ψ' です
     */
    public static ComplexStack updateExitWave(ComplexStack psiDash, double beta,
            ComplexStack constrained, ComplexStack psi) {
        checkSameShape(psiDash, constrained);
        checkSameShape(psiDash, psi);
        ComplexStack out = psiDash.copy();
        for (int k = 0; k < out.depth(); k++) {
            double[] o = out.slice(k).data;
            double[] c = constrained.slice(k).data;
            double[] p = psi.slice(k).data;
            for (int i = 0; i < o.length; i++) {
                o[i] = o[i] + beta * (c[i] - p[i]);
            }
        }
        return out;
    }

    /**
     * 照明で正規化した更新値 {@code update / (illumination + floor)} を返します。
     *
     * @param update 複素更新量です
     * @param illumination 照明量です
     * @param floor 分母の下駄です
     * @return 正規化した値です
     */
    public static ZMatrixRMaj normalize(ZMatrixRMaj update, DMatrixRMaj illumination,
            double floor) {
        if (update.numRows != illumination.numRows || update.numCols != illumination.numCols) {
            throw new IllegalArgumentException("更新量と照明量の形状が一致しません");
        }
        ZMatrixRMaj out = new ZMatrixRMaj(update.numRows, update.numCols);
        for (int i = 0; i < illumination.data.length; i++) {
            double denom = illumination.data[i] + floor;
            out.data[2 * i] = update.data[2 * i] / denom;
            out.data[2 * i + 1] = update.data[2 * i + 1] / denom;
        }
        return out;
    }

    /**
     * 慣性付きの混合 {@code inertia·old + (1−inertia)·fresh} を返します。
     *
     * @param inertia 慣性です
     * @param old 旧値です
     * @param fresh 新しい推定値です
     * @return 混合後の値です
     */
    public static ZMatrixRMaj blend(double inertia, ZMatrixRMaj old, ZMatrixRMaj fresh) {
        ComplexArrays.checkSameShape(old, fresh);
        ZMatrixRMaj out = new ZMatrixRMaj(old.numRows, old.numCols);
        for (int i = 0; i < out.data.length; i++) {
            out.data[i] = inertia * old.data[i] + (1.0 - inertia) * fresh.data[i];
        }
        return out;
    }

    private static void checkSameShape(ComplexStack a, ComplexStack b) {
        if (!a.sameShape(b)) {
            throw new IllegalArgumentException("3 次元配列の形状が一致しません");
        }
    }
}
