package io.github.yok.ptycho.core.state;

import java.util.Arrays;

/**
 * Difference-Map の固定点変数 {@code ψ'} を (モード, ブロック) の行列として保持するクラスです。
 *
 * <p>
 * 外側反復の呼び出しをまたいで呼び出し側が保持します。キャリブレーション反復の後はすべてのセルが未初期化に戻ります。
 * </p>
 */
public final class ExitWaveState {

    /**
     * セル行列（[モード][ブロック]）です。
     */
    private final ExitWaveCell[][] cells;

    /**
     * すべて未初期化の出射波状態を生成します。
     *
     * @param modeCount モード数（max(プローブモード数, オブジェクトモード数)）です（1 以上）
     * @param blockCount ブロック数です（1 以上）
     * @throws IllegalArgumentException 引数が 1 未満の場合に発生します
     */
    public ExitWaveState(int modeCount, int blockCount) {
        if (modeCount <= 0 || blockCount <= 0) {
            throw new IllegalArgumentException(
                    "modeCount/blockCount は 1 以上が必要です: " + modeCount + "x" + blockCount);
        }
        this.cells = new ExitWaveCell[modeCount][blockCount];
        clear();
    }

    public int modeCount() {
        return cells.length;
    }

    public int blockCount() {
        return cells[0].length;
    }

    /**
     * セルを返します。
     *
     * @param mode モード番号です
     * @param block ブロック番号です
     * @return セルです
     */
    public ExitWaveCell get(int mode, int block) {
        return cells[mode][block];
    }

    /**
     * セルを差し替えます。
     *
     * @param mode モード番号です
     * @param block ブロック番号です
     * @param cell 新しいセルです（null 不可）
     */
    public void set(int mode, int block, ExitWaveCell cell) {
        if (cell == null) {
            throw new IllegalArgumentException("cell は null 不可です");
        }
        cells[mode][block] = cell;
    }

    /**
     * 指定ブロックの全モードのセルを未初期化に戻します。
     *
     * @param block ブロック番号です
     */
    public void clearBlock(int block) {
        for (ExitWaveCell[] row : cells) {
            row[block] = ExitWaveCell.uninitialized();
        }
    }

    /**
     * すべてのセルを未初期化に戻します。
     */
    public void clear() {
        for (ExitWaveCell[] row : cells) {
            Arrays.fill(row, ExitWaveCell.uninitialized());
        }
    }

    /**
     * 初期化済みのセル数を返します。
     *
     * @return 初期化済みセル数です
     */
    public int initializedCount() {
        int count = 0;
        for (ExitWaveCell[] row : cells) {
            for (ExitWaveCell c : row) {
                if (c.isInitialized()) {
                    count++;
                }
            }
        }
        return count;
    }
}
