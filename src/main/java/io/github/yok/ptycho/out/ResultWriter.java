package io.github.yok.ptycho.out;

import io.github.yok.ptycho.core.scan.RasterScanPattern;
import io.github.yok.ptycho.core.solver.DifferenceMapReconstruction;

/**
 * 再構成結果を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * 再構成結果（オブジェクト・プローブ・フーリエ誤差の履歴）を出力します。
     *
     * @param result 再構成結果です
     * @param pattern 走査パターンです（メタ情報に使います）
     */
    void write(DifferenceMapReconstruction.ReconstructionResult result, RasterScanPattern pattern);
}
