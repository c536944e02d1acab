package io.github.yok.ptycho.core.constraint;

import io.github.yok.ptycho.core.array.ComplexStack;
import java.util.List;
import org.ejml.data.DMatrixRMaj;

/**
 * 検出器面の場の振幅を測定振幅へ置き換える（位相は保つ）射影のインタフェースです。
 *
 * <p>
 * ノイズモデル（振幅の置き換え方）を差し替えるための境界です。
 * </p>
 */
public interface ModulusConstraint {

    /**
     * 振幅拘束を適用した場を返します。入力は変更しません。
     *
     * @param modulus 位置ごとの測定振幅です
     * @param predicted 位置ごとの予測振幅です
     * @param farFields モードごとの検出器面の場です
     * @param mask 緩和重みです
     * @return モードごとの拘束後の場です
     */
    List<ComplexStack> apply(DMatrixRMaj[] modulus, DMatrixRMaj[] predicted,
            List<ComplexStack> farFields, RelaxationMask mask);
}
