package io.github.yok.ptycho.core.propagation;

import io.github.yok.ptycho.core.array.ComplexStack;

/**
 * 試料面と検出器面の間の光学伝搬を提供するインタフェースです。
 *
 * <p>
 * 遠方場（FFT）・近接場などの伝搬モデルを差し替えるための境界です。 {@link #backward} は {@link #forward} の随伴です。
 * </p>
 */
public interface FourierPropagator {

    /**
     * 試料面の場を検出器面へ伝搬します。入力は変更しません。
     *
     * @param field 試料面の場（奥行き = 位置数）です
     * @param mode モード記述子です
     * @return 検出器面の場です
     */
    ComplexStack forward(ComplexStack field, PropagationMode mode);

    /**
     * 検出器面の場を試料面へ逆伝搬します。入力は変更しません。
     *
     * @param field 検出器面の場（奥行き = 位置数）です
     * @param mode モード記述子です
     * @return 試料面の場です
     */
    ComplexStack backward(ComplexStack field, PropagationMode mode);
}
