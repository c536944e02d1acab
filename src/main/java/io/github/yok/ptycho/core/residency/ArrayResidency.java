package io.github.yok.ptycho.core.residency;

import io.github.yok.ptycho.core.array.ComplexStack;

/**
 * 配列を演算装置（アクセラレータ）のメモリとホストメモリの間で移動するインタフェースです。
 *
 * <p>
 * 移動は同期的に行います。演算装置のメモリ不足などの失敗は呼び出し側へそのまま伝播します。
 * </p>
 */
public interface ArrayResidency {

    /**
     * 配列を演算装置のメモリへ移動します。
     *
     * @param array 配列です
     * @return 演算装置上の配列です
     */
    ComplexStack toDevice(ComplexStack array);

    /**
     * 配列をホストメモリへ戻します。
     *
     * @param array 配列です
     * @return ホスト上の配列です
     */
    ComplexStack toHost(ComplexStack array);
}
