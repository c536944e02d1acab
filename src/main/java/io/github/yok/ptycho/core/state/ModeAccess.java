package io.github.yok.ptycho.core.state;

import java.util.List;

/**
 * モード数が異なる列（オブジェクトモード・プローブモード・伝搬記述子）へのアクセスを統一するユーティリティです。
 *
 * <p>
 * 最後のモードを超える番号は、最後のモードに丸めます。
 * </p>
 */
public final class ModeAccess {

    private ModeAccess() {}

    /**
     * {@code sequence[min(mode, size-1)]} を返します。
     *
     * @param <T> 要素型です
     * @param sequence モード列です（空不可）
     * @param mode モード番号です（0 以上）
     * @return 丸めたモード番号の要素です
     * @throws IllegalArgumentException 列が空、またはモード番号が負の場合に発生します
     */
    public static <T> T modeAt(List<T> sequence, int mode) {
        return sequence.get(clamp(mode, sequence.size()));
    }

    /**
     * モード番号を {@code [0, count-1]} に丸めます。
     *
     * @param mode モード番号です（0 以上）
     * @param count モード数です（1 以上）
     * @return 丸めたモード番号です
     */
    public static int clamp(int mode, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("モード数は 1 以上が必要です: " + count);
        }
        if (mode < 0) {
            throw new IllegalArgumentException("モード番号は 0 以上が必要です: " + mode);
        }
        return Math.min(mode, count - 1);
    }
}
