package io.github.yok.ptycho.core.array;

import org.ejml.data.ZMatrixRMaj;

/**
 * 同じ形状（height × width）の複素 2 次元配列を奥行き方向に積み重ねた 3 次元配列です。
 *
 * <p>
 * プローブ（高さ × 幅 × プローブインスタンス）や、ブロック内の各走査位置に対応する
 * 射影・出射波（高さ × 幅 × 走査位置）を表します。各スライスは EJML の {@link ZMatrixRMaj}
 * （実部・虚部を交互に並べた行優先配列）です。
 * </p>
 */
public final class ComplexStack {

    /**
     * スライスの行数です。
     */
    private final int height;

    /**
     * スライスの列数です。
     */
    private final int width;

    /**
     * 奥行き方向に並んだスライスです。
     */
    private final ZMatrixRMaj[] slices;

    /**
     * ゼロ初期化された 3 次元配列を生成します。
     *
     * @param height 行数です（1 以上）
     * @param width 列数です（1 以上）
     * @param depth 奥行きです（1 以上）
     * @throws IllegalArgumentException サイズが 1 未満の場合に発生します
     */
    public ComplexStack(int height, int width, int depth) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException(
                    "height/width は 1 以上が必要です: " + height + "x" + width);
        }
        if (depth <= 0) {
            throw new IllegalArgumentException("depth は 1 以上が必要です: " + depth);
        }
        this.height = height;
        this.width = width;
        this.slices = new ZMatrixRMaj[depth];
        for (int k = 0; k < depth; k++) {
            slices[k] = new ZMatrixRMaj(height, width);
        }
    }

    private ComplexStack(ZMatrixRMaj[] slices) {
        this.height = slices[0].numRows;
        this.width = slices[0].numCols;
        this.slices = slices;
    }

    /**
     * 既存のスライスを（コピーせずに）束ねて 3 次元配列にします。
     *
     * @param slices スライスです（1 枚以上、形状はすべて一致が必要です）
     * @return 3 次元配列です
     * @throws IllegalArgumentException スライスが空、null を含む、または形状が一致しない場合に発生します
     */
    public static ComplexStack wrap(ZMatrixRMaj... slices) {
        if (slices == null || slices.length == 0) {
            throw new IllegalArgumentException("slices は 1 枚以上が必要です");
        }
        for (ZMatrixRMaj s : slices) {
            if (s == null) {
                throw new IllegalArgumentException("slices に null が含まれています");
            }
            if (s.numRows != slices[0].numRows || s.numCols != slices[0].numCols) {
                throw new IllegalArgumentException("スライスの形状が一致しません: " + s.numRows + "x"
                        + s.numCols + " vs " + slices[0].numRows + "x" + slices[0].numCols);
            }
        }
        return new ComplexStack(slices.clone());
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    /**
     * 奥行き（スライス枚数）を返します。
     *
     * @return 奥行きです
     */
    public int depth() {
        return slices.length;
    }

    /**
     * k 番目のスライスを返します（コピーではありません）。
     *
     * @param k スライス番号です（0 以上 depth 未満）
     * @return スライスです
     */
    public ZMatrixRMaj slice(int k) {
        return slices[k];
    }

    /**
     * 指定したスライスと形状が一致するかどうかを返します。
     *
     * @param other 比較対象です
     * @return 高さ・幅・奥行きがすべて一致する場合は true です
     */
    public boolean sameShape(ComplexStack other) {
        return other != null && other.height == height && other.width == width
                && other.slices.length == slices.length;
    }

    /**
     * 全スライスを深くコピーした 3 次元配列を返します。
     *
     * @return コピーです
     */
    public ComplexStack copy() {
        ZMatrixRMaj[] copied = new ZMatrixRMaj[slices.length];
        for (int k = 0; k < slices.length; k++) {
            copied[k] = slices[k].copy();
        }
        return new ComplexStack(copied);
    }

    /**
     * スライスごとの要素積 {@code this ⊙ other} を新しい配列として返します。
     *
     * @param other 右辺です（形状一致が必要です）
     * @return 要素積です
     * @throws IllegalArgumentException 形状が一致しない場合に発生します
     */
    public ComplexStack times(ComplexStack other) {
        checkShape(other);
        ZMatrixRMaj[] out = new ZMatrixRMaj[slices.length];
        for (int k = 0; k < slices.length; k++) {
            out[k] = ComplexArrays.multiply(slices[k], other.slices[k]);
        }
        return new ComplexStack(out);
    }

    /**
     * スライスごとの要素積 {@code this ⊙ conj(other)} を新しい配列として返します。
     *
     * @param other 共役を取る右辺です（形状一致が必要です）
     * @return 要素積です
     * @throws IllegalArgumentException 形状が一致しない場合に発生します
     */
    public ComplexStack timesConjugate(ComplexStack other) {
        checkShape(other);
        ZMatrixRMaj[] out = new ZMatrixRMaj[slices.length];
        for (int k = 0; k < slices.length; k++) {
            out[k] = ComplexArrays.multiplyConjugate(slices[k], other.slices[k]);
        }
        return new ComplexStack(out);
    }

    private void checkShape(ComplexStack other) {
        if (other == null) {
            throw new IllegalArgumentException("other は null 不可です");
        }
        if (!sameShape(other)) {
            throw new IllegalArgumentException("3 次元配列の形状が一致しません: " + height + "x" + width
                    + "x" + slices.length + " vs " + other.height + "x" + other.width + "x"
                    + other.slices.length);
        }
    }

    /**
     * 全要素を実数倍します（in-place）。
     *
     * @param factor 倍率です
     */
    public void scale(double factor) {
        for (ZMatrixRMaj s : slices) {
            ComplexArrays.scale(s, factor);
        }
    }
}
