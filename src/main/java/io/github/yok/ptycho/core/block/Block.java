package io.github.yok.ptycho.core.block;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

/**
 * 同時に処理する走査位置のまとまり（ブロック）です。
 *
 * <p>
 * {@code positions[k]} と {@code scanIds[k]} は同じ走査位置を表します。 全走査位置はいずれか 1 つのブロックにのみ属します。
 * </p>
 */
@Value
public class Block {

    /**
     * ブロック番号です（0 始まり）。
     */
    int index;

    /**
     * ブロックに含まれる走査位置番号です。
     */
    @Getter(AccessLevel.NONE)
    int[] positions;

    /**
     * 各走査位置の走査グループ番号です。
     */
    @Getter(AccessLevel.NONE)
    int[] scanIds;

    /**
     * ブロックを生成します。
     *
     * @param index ブロック番号です（0 以上）
     * @param positions 走査位置番号です（1 つ以上）
     * @param scanIds 走査グループ番号です（positions と同じ長さ）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public Block(int index, int[] positions, int[] scanIds) {
        if (index < 0) {
            throw new IllegalArgumentException("index は 0 以上が必要です: " + index);
        }
        if (positions == null || positions.length == 0) {
            throw new IllegalArgumentException("positions は 1 つ以上が必要です");
        }
        if (scanIds == null || scanIds.length != positions.length) {
            throw new IllegalArgumentException("scanIds の長さが positions と一致しません");
        }
        this.index = index;
        this.positions = positions.clone();
        this.scanIds = scanIds.clone();
    }

    /**
     * 走査位置番号のコピーを返します。
     *
     * @return 走査位置番号です
     */
    public int[] getPositions() {
        return positions.clone();
    }

    /**
     * 走査グループ番号のコピーを返します。
     *
     * @return 走査グループ番号です
     */
    public int[] getScanIds() {
        return scanIds.clone();
    }

    public int positionAt(int k) {
        return positions[k];
    }

    public int scanIdAt(int k) {
        return scanIds[k];
    }

    /**
     * ブロック内の走査位置数を返します。
     *
     * @return 走査位置数です
     */
    public int size() {
        return positions.length;
    }

    /**
     * ブロック内の全走査位置が同じ走査グループに属するかどうかを返します。
     *
     * @return 単一グループの場合は true です
     */
    public boolean hasSingleScanId() {
        for (int id : scanIds) {
            if (id != scanIds[0]) {
                return false;
            }
        }
        return true;
    }
}
