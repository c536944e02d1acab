package io.github.yok.ptycho.core.array;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.NormOps_ZDRM;

/**
 * 複素配列（{@link ZMatrixRMaj}）に対する要素ごとの演算をまとめたユーティリティです。
 *
 * <p>
 * データは実部・虚部を交互に並べた行優先配列（{@code data[2*i]} が実部、{@code data[2*i+1]} が虚部）として扱います。
 * </p>
 */
public final class ComplexArrays {

    private ComplexArrays() {}

    /**
     * 形状が一致することを検証します。
     *
     * @param a 配列です
     * @param b 配列です
     * @throws IllegalArgumentException 形状が一致しない場合に発生します
     */
    public static void checkSameShape(ZMatrixRMaj a, ZMatrixRMaj b) {
        if (a.numRows != b.numRows || a.numCols != b.numCols) {
            throw new IllegalArgumentException("配列の形状が一致しません: " + a.numRows + "x" + a.numCols
                    + " vs " + b.numRows + "x" + b.numCols);
        }
    }

    /**
     * 要素ごとの積 {@code a ⊙ b} を新しい配列として返します。
     *
     * @param a 左辺です
     * @param b 右辺です
     * @return 要素積です
     */
    public static ZMatrixRMaj multiply(ZMatrixRMaj a, ZMatrixRMaj b) {
        checkSameShape(a, b);
        ZMatrixRMaj out = new ZMatrixRMaj(a.numRows, a.numCols);
        int n = a.getNumElements();
        for (int i = 0; i < n; i++) {
            int re = 2 * i;
            int im = re + 1;
            double ar = a.data[re];
            double ai = a.data[im];
            double br = b.data[re];
            double bi = b.data[im];
            out.data[re] = ar * br - ai * bi;
            out.data[im] = ar * bi + ai * br;
        }
        return out;
    }

    /**
     * 要素ごとの積 {@code a ⊙ conj(b)} を新しい配列として返します。
     *
     * @param a 左辺です
     * @param b 共役を取る右辺です
     * @return 要素積です
     */
    public static ZMatrixRMaj multiplyConjugate(ZMatrixRMaj a, ZMatrixRMaj b) {
        checkSameShape(a, b);
        ZMatrixRMaj out = new ZMatrixRMaj(a.numRows, a.numCols);
        int n = a.getNumElements();
        for (int i = 0; i < n; i++) {
            int re = 2 * i;
            int im = re + 1;
            double ar = a.data[re];
            double ai = a.data[im];
            double br = b.data[re];
            double bi = -b.data[im];
            out.data[re] = ar * br - ai * bi;
            out.data[im] = ar * bi + ai * br;
        }
        return out;
    }

    /**
     * 強度 {@code |a|^2} を実数配列として返します。
     *
     * @param a 入力です
     * @return 強度です
     */
    public static DMatrixRMaj abs2(ZMatrixRMaj a) {
        DMatrixRMaj out = new DMatrixRMaj(a.numRows, a.numCols);
        addAbs2(a, out);
        return out;
    }

    /**
     * 強度 {@code |a|^2} を実数配列へ加算します（in-place）。
     *
     * @param a 入力です
     * @param acc 加算先です
     */
    public static void addAbs2(ZMatrixRMaj a, DMatrixRMaj acc) {
        if (a.numRows != acc.numRows || a.numCols != acc.numCols) {
            throw new IllegalArgumentException("配列の形状が一致しません: " + a.numRows + "x" + a.numCols
                    + " vs " + acc.numRows + "x" + acc.numCols);
        }
        int n = a.getNumElements();
        for (int i = 0; i < n; i++) {
            double re = a.data[2 * i];
            double im = a.data[2 * i + 1];
            acc.data[i] += re * re + im * im;
        }
    }

    /**
     * {@code acc += a} を計算します（in-place）。
     *
     * @param acc 加算先です
     * @param a 加算する値です
     */
    public static void addEquals(ZMatrixRMaj acc, ZMatrixRMaj a) {
        checkSameShape(acc, a);
        int len = 2 * a.getNumElements();
        for (int i = 0; i < len; i++) {
            acc.data[i] += a.data[i];
        }
    }

    /**
     * 全要素を実数倍します（in-place）。
     *
     * @param a 対象です
     * @param factor 倍率です
     */
    public static void scale(ZMatrixRMaj a, double factor) {
        int len = 2 * a.getNumElements();
        for (int i = 0; i < len; i++) {
            a.data[i] *= factor;
        }
    }

    /**
     * フロベニウスノルム {@code sqrt(Σ|a|^2)} を返します。
     *
     * @param a 対象です
     * @return ノルムです
     */
    public static double norm(ZMatrixRMaj a) {
        return NormOps_ZDRM.normF(a);
    }

    /**
     * 差のフロベニウスノルム {@code ‖a − b‖} を返します。
     *
     * @param a 左辺です
     * @param b 右辺です
     * @return 差のノルムです
     */
    public static double distance(ZMatrixRMaj a, ZMatrixRMaj b) {
        checkSameShape(a, b);
        double sum = 0.0;
        int len = 2 * a.getNumElements();
        for (int i = 0; i < len; i++) {
            double d = a.data[i] - b.data[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }
}
