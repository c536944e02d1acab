package io.github.yok.ptycho.core.block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * 事前計算したブロック分割と、ビュー位置・照明統計を保持するクラスです。
 *
 * <p>
 * 構造（ブロック分割とビュー位置）は生成後に変化しません。照明の上限値（オブジェクトモードごとの
 * {@code Σ|P|^2} の最大値）のみ、協調コンポーネントによって更新されることがあります。
 * </p>
 */
@Getter
public final class BlockCache {

    /**
     * ブロックの一覧です。
     */
    private final List<Block> blocks;

    /**
     * 走査位置ごとのビュー左上の行座標です。
     */
    @Getter(AccessLevel.NONE)
    private final int[] rowOffsets;

    /**
     * 走査位置ごとのビュー左上の列座標です。
     */
    @Getter(AccessLevel.NONE)
    private final int[] colOffsets;

    /**
     * ビュー（= プローブ）の行数です。
     */
    private final int viewHeight;

    /**
     * ビュー（= プローブ）の列数です。
     */
    private final int viewWidth;

    /**
     * オブジェクトモードごとの照明上限値です。
     */
    @Getter(AccessLevel.NONE)
    private double[] maxIllumination;

    /**
     * ブロックキャッシュを生成します。
     *
     * @param blocks ブロックの一覧です
     * @param rowOffsets 走査位置ごとの行座標です
     * @param colOffsets 走査位置ごとの列座標です
     * @param viewHeight ビューの行数です
     * @param viewWidth ビューの列数です
     * @param maxIllumination オブジェクトモードごとの照明上限値です
     * @throws IllegalArgumentException 配列長が一致しない場合に発生します
     */
    public BlockCache(List<Block> blocks, int[] rowOffsets, int[] colOffsets, int viewHeight,
            int viewWidth, double[] maxIllumination) {
        if (blocks == null || blocks.isEmpty()) {
            throw new IllegalArgumentException("blocks は 1 つ以上が必要です");
        }
        if (rowOffsets.length != colOffsets.length) {
            throw new IllegalArgumentException("rowOffsets と colOffsets の長さが一致しません: "
                    + rowOffsets.length + " vs " + colOffsets.length);
        }
        this.blocks = List.copyOf(blocks);
        this.rowOffsets = rowOffsets.clone();
        this.colOffsets = colOffsets.clone();
        this.viewHeight = viewHeight;
        this.viewWidth = viewWidth;
        this.maxIllumination = maxIllumination.clone();
    }

    /**
     * ブロック数を返します。
     *
     * @return ブロック数です
     */
    public int blockCount() {
        return blocks.size();
    }

    public int[] getRowOffsets() {
        return rowOffsets.clone();
    }

    public int[] getColOffsets() {
        return colOffsets.clone();
    }

    /**
     * 走査位置 pos のビュー左上の行座標を返します。
     *
     * @param pos 走査位置番号です
     * @return 行座標です
     */
    public int rowOffsetOf(int pos) {
        return rowOffsets[pos];
    }

    /**
     * 走査位置 pos のビュー左上の列座標を返します。
     *
     * @param pos 走査位置番号です
     * @return 列座標です
     */
    public int colOffsetOf(int pos) {
        return colOffsets[pos];
    }

    /**
     * 走査位置の総数を返します。
     *
     * @return 走査位置数です
     */
    public int positionCount() {
        return rowOffsets.length;
    }

    /**
     * オブジェクトモード ll の照明上限値を返します。
     *
     * @param objectMode オブジェクトモード番号です
     * @return 照明上限値です
     */
    public double maxIlluminationOf(int objectMode) {
        return maxIllumination[objectMode];
    }

    /**
     * 照明上限値を差し替えます。
     *
     * @param maxIllumination オブジェクトモードごとの照明上限値です
     */
    public void refreshMaxIllumination(double[] maxIllumination) {
        this.maxIllumination = maxIllumination.clone();
    }

    /**
     * ブロックの順序を逆にしたキャッシュを返します（照明統計は共有しません）。
     *
     * @return 逆順のキャッシュです
     */
    public BlockCache reversed() {
        List<Block> copy = new ArrayList<>(blocks);
        Collections.reverse(copy);
        return new BlockCache(copy, rowOffsets, colOffsets, viewHeight, viewWidth,
                maxIllumination);
    }
}
