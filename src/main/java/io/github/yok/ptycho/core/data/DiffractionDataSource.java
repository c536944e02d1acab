package io.github.yok.ptycho.core.data;

import io.github.yok.ptycho.core.block.Block;
import java.util.Optional;
import org.ejml.data.DMatrixRMaj;

/**
 * 測定した回折パターン（振幅）と検出器マスクへのアクセスを提供するインタフェースです。
 */
public interface DiffractionDataSource {

    /**
     * ブロック内の各走査位置の測定振幅 {@code modF = sqrt(I)} を返します。
     *
     * @param block ブロックです
     * @return 位置ごとの測定振幅です
     */
    DMatrixRMaj[] modulus(Block block);

    /**
     * ブロック内の各走査位置の有効画素マスク（1 = 有効、0 = 無効）を返します。
     *
     * @param block ブロックです
     * @return 位置ごとのマスクです。マスクを持たない場合は空です
     */
    Optional<DMatrixRMaj[]> validityMask(Block block);

    /**
     * 走査位置の総数を返します。
     *
     * @return 走査位置数です
     */
    int positionCount();
}
