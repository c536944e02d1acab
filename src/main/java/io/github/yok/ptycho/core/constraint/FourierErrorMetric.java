package io.github.yok.ptycho.core.constraint;

import java.util.Optional;
import org.ejml.data.DMatrixRMaj;

/**
 * 走査位置ごとのフーリエ面の残差を計算するインタフェースです。
 */
public interface FourierErrorMetric {

    /**
     * 位置ごとの残差を返します。
     *
     * @param modulus 位置ごとの測定振幅です
     * @param predicted 位置ごとの予測振幅です
     * @param validityMask 位置ごとの有効画素マスクです（空の場合は全画素有効）
     * @return 位置ごとの残差です
     */
    double[] compute(DMatrixRMaj[] modulus, DMatrixRMaj[] predicted,
            Optional<DMatrixRMaj[]> validityMask);
}
