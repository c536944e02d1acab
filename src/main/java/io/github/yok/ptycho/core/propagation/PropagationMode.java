package io.github.yok.ptycho.core.propagation;

import lombok.Value;

/**
 * モードごとの伝搬・拘束条件の記述子です。
 */
@Value
public class PropagationMode {

    /**
     * モード番号です。
     */
    int index;

    /**
     * 実空間のプローブ支持領域（円形）の半径（ピクセル）です。0 以下の場合は支持領域拘束を行いません。
     */
    double supportRadius;

    /**
     * 支持領域拘束を行うかどうかを返します。
     *
     * @return 半径が正の場合は true です
     */
    public boolean hasSupport() {
        return supportRadius > 0.0;
    }
}
