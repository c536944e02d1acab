package io.github.yok.ptycho.core.solver;

/**
 * 外側反復 1 回の中の段階です。
 *
 * <p>
 * 反復 0 は {@link #CALIBRATE} のみで終わります。 反復 1 以降は {@link #DM_UPDATE} の後に必ず {@link #OVERLAP_SOLVE}
 * を実行します。
 * </p>
 */
public enum DifferenceMapPhase {

    /**
     * プローブ振幅のキャリブレーションです。
     */
    CALIBRATE,

    /**
     * 全ブロックの出射波更新（射影・振幅拘束・差分ステップ）です。
     */
    DM_UPDATE,

    /**
     * オーバーラップ拘束の反復解法です。
     */
    OVERLAP_SOLVE;

    /**
     * 反復 iter の最初の段階を返します。
     *
     * @param iter 外側反復番号です（0 以上）
     * @return 最初の段階です
     */
    public static DifferenceMapPhase entryOf(int iter) {
        if (iter < 0) {
            throw new IllegalArgumentException("iter は 0 以上が必要です: " + iter);
        }
        return iter == 0 ? CALIBRATE : DM_UPDATE;
    }

    /**
     * 次の段階を返します。
     *
     * @return 次の段階です。最後の段階の場合は null です
     */
    public DifferenceMapPhase next() {
        switch (this) {
            case DM_UPDATE:
                return OVERLAP_SOLVE;
            case CALIBRATE:
            case OVERLAP_SOLVE:
            default:
                return null;
        }
    }
}
