package io.github.yok.ptycho.core.propagation;

import io.github.yok.ptycho.core.array.ComplexStack;

/**
 * プローブに支持領域などの拘束を適用するインタフェースです。
 */
public interface ProbeSupportConstraint {

    /**
     * 拘束を適用したプローブを返します。入力は変更しません。
     *
     * @param probe プローブ（高さ × 幅 × インスタンス）です
     * @param mode モード記述子です
     * @return 拘束後のプローブです
     */
    ComplexStack apply(ComplexStack probe, PropagationMode mode);
}
