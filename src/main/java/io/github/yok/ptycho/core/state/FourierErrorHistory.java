package io.github.yok.ptycho.core.state;

import java.util.Arrays;

/**
 * 外側反復ごと・走査位置ごとのフーリエ誤差の履歴です。
 *
 * <p>
 * 記録していない (反復, 位置) は NaN のままです。
 * </p>
 */
public final class FourierErrorHistory {

    /**
     * 誤差（[反復][走査位置]）です。
     */
    private final double[][] errors;

    /**
     * 空の履歴を生成します。
     *
     * @param numberOfIterations 最終反復番号です（反復 0 から numberOfIterations までを保持します）
     * @param positionCount 走査位置数です
     */
    public FourierErrorHistory(int numberOfIterations, int positionCount) {
        if (numberOfIterations < 0 || positionCount <= 0) {
            throw new IllegalArgumentException("numberOfIterations は 0 以上、positionCount は 1 以上が必要です: "
                    + numberOfIterations + ", " + positionCount);
        }
        this.errors = new double[numberOfIterations + 1][positionCount];
        for (double[] row : errors) {
            Arrays.fill(row, Double.NaN);
        }
    }

    /**
     * 反復 iter の各走査位置の誤差を記録します。
     *
     * @param iter 反復番号です
     * @param positions 走査位置番号です
     * @param values 位置ごとの誤差です
     */
    public void record(int iter, int[] positions, double[] values) {
        if (positions.length != values.length) {
            throw new IllegalArgumentException(
                    "positions と values の長さが一致しません: " + positions.length + " vs " + values.length);
        }
        for (int k = 0; k < positions.length; k++) {
            errors[iter][positions[k]] = values[k];
        }
    }

    /**
     * 反復 iter の誤差を返します（コピー）。
     *
     * @param iter 反復番号です
     * @return 位置ごとの誤差です
     */
    public double[] at(int iter) {
        return errors[iter].clone();
    }

    /**
     * 反復 iter に記録があるかどうかを返します。
     *
     * @param iter 反復番号です
     * @return 1 位置でも記録がある場合は true です
     */
    public boolean isRecorded(int iter) {
        for (double v : errors[iter]) {
            if (!Double.isNaN(v)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 反復 iter の誤差の平均（記録済みの位置のみ）を返します。
     *
     * @param iter 反復番号です
     * @return 平均値です（記録がない場合は NaN）
     */
    public double mean(int iter) {
        double sum = 0.0;
        int count = 0;
        for (double v : errors[iter]) {
            if (!Double.isNaN(v)) {
                sum += v;
                count++;
            }
        }
        return count > 0 ? sum / count : Double.NaN;
    }

    public int iterationCapacity() {
        return errors.length;
    }

    public int positionCount() {
        return errors[0].length;
    }
}
