package io.github.yok.ptycho.core.scan;

/**
 * 2 次元のラスタ走査（等間隔の格子状走査）を表すクラスです。
 *
 * <p>
 * 位置番号の変換は {@code position = row * cols + col} です。 走査グループは行方向に等分して割り当てます。
 * </p>
 */
public final class RasterScanPattern implements ScanPattern {

    /**
     * 行方向の走査点数です。
     */
    private final int rows;

    /**
     * 列方向の走査点数です。
     */
    private final int cols;

    /**
     * 走査間隔（ピクセル）です。
     */
    private final int step;

    /**
     * 走査グループ数です。
     */
    private final int scanGroups;

    /**
     * ラスタ走査を生成します。
     *
     * @param rows 行方向の走査点数です（1 以上）
     * @param cols 列方向の走査点数です（1 以上）
     * @param step 走査間隔です（0 以上、0 の場合は全位置が同じビューになります）
     * @param scanGroups 走査グループ数です（1 以上 rows 以下）
     * @throws IllegalArgumentException 引数が範囲外の場合に発生します
     */
    public RasterScanPattern(int rows, int cols, int step, int scanGroups) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("rows/cols は 1 以上が必要です: " + rows + "x" + cols);
        }
        if (step < 0) {
            throw new IllegalArgumentException("step は 0 以上が必要です: " + step);
        }
        if (scanGroups <= 0 || scanGroups > rows) {
            throw new IllegalArgumentException("scanGroups は 1 以上 rows 以下が必要です: " + scanGroups);
        }
        this.rows = rows;
        this.cols = cols;
        this.step = step;
        this.scanGroups = scanGroups;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int step() {
        return step;
    }

    @Override
    public int positionCount() {
        return rows * cols;
    }

    @Override
    public int rowOffsetOf(int position) {
        return (position / cols) * step;
    }

    @Override
    public int colOffsetOf(int position) {
        return (position % cols) * step;
    }

    @Override
    public int scanIdOf(int position) {
        int row = position / cols;
        return (row * scanGroups) / rows;
    }

    @Override
    public int scanGroupCount() {
        return scanGroups;
    }

    /**
     * プローブサイズのビューをすべて収めるのに必要なオブジェクトの行数を返します。
     *
     * @param probeHeight プローブの行数です
     * @return オブジェクトの行数です
     */
    public int objectHeight(int probeHeight) {
        return (rows - 1) * step + probeHeight;
    }

    /**
     * プローブサイズのビューをすべて収めるのに必要なオブジェクトの列数を返します。
     *
     * @param probeWidth プローブの列数です
     * @return オブジェクトの列数です
     */
    public int objectWidth(int probeWidth) {
        return (cols - 1) * step + probeWidth;
    }
}
