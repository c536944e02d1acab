package io.github.yok.ptycho.core.constraint;

/**
 * フーリエ誤差を記録する反復を決めるクラスです。
 *
 * <p>
 * 最初の 20 反復は毎回、その後は {@code min(20, 2^floor(2 + iter/50))} 反復ごとに記録します。 最終反復は常に記録し、反復 0
 * （キャリブレーション）は記録しません。
 * </p>
 */
public final class ErrorReportingSchedule {

    /**
     * 毎回記録する反復数の上限です。
     */
    private static final int DENSE_ITERATIONS = 20;

    /**
     * 記録間隔の上限です。
     */
    private static final int MAX_INTERVAL = 20;

    /**
     * 誤差の記録を有効にするかどうかです。
     */
    private final boolean enabled;

    /**
     * 最終反復番号です。
     */
    private final int numberOfIterations;

    /**
     * 記録スケジュールを生成します。
     *
     * @param enabled 誤差の記録を有効にするかどうかです
     * @param numberOfIterations 最終反復番号です
     */
    public ErrorReportingSchedule(boolean enabled, int numberOfIterations) {
        this.enabled = enabled;
        this.numberOfIterations = numberOfIterations;
    }

    /**
     * 反復 iter で誤差を記録するかどうかを返します。
     *
     * @param iter 反復番号です
     * @return 記録する場合は true です
     */
    public boolean shouldRecord(int iter) {
        if (iter <= 0) {
            return false;
        }
        if (iter == numberOfIterations) {
            return true;
        }
        return enabled && (iter < DENSE_ITERATIONS || iter % intervalAt(iter) == 0);
    }

    /**
     * 反復 iter での記録間隔を返します。
     *
     * @param iter 反復番号です
     * @return 記録間隔です
     */
    static int intervalAt(int iter) {
        int exponent = 2 + iter / 50;
        if (exponent >= 5) {
            return MAX_INTERVAL;
        }
        return Math.min(MAX_INTERVAL, 1 << exponent);
    }
}
