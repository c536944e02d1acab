package io.github.yok.ptycho.core.data;

import io.github.yok.ptycho.core.block.Block;
import java.util.Optional;
import org.ejml.data.DMatrixRMaj;

/**
 * 測定振幅をすべてメモリ上に保持する {@link DiffractionDataSource} です。
 *
 * <p>
 * 有効画素マスクは全走査位置で共通の 1 枚を持つか、持たないかのいずれかです。生成時と取得時にコピーするため、
 * 呼び出し側から測定データは変更できません。
 * </p>
 */
public final class InMemoryDiffractionData implements DiffractionDataSource {

    /**
     * 走査位置ごとの測定振幅です。
     */
    private final DMatrixRMaj[] modulus;

    /**
     * 共通の有効画素マスクです（null の場合はマスクなし）。
     */
    private final DMatrixRMaj validityMask;

    /**
     * 測定データを生成します。
     *
     * @param modulus 走査位置ごとの測定振幅です（1 つ以上、形状は一致が必要です）
     * @param validityMask 共通の有効画素マスクです（null 可）
     * @throws IllegalArgumentException 形状が一致しない、または振幅が負の場合に発生します
     */
    public InMemoryDiffractionData(DMatrixRMaj[] modulus, DMatrixRMaj validityMask) {
        if (modulus == null || modulus.length == 0) {
            throw new IllegalArgumentException("modulus は 1 つ以上が必要です");
        }
        DMatrixRMaj m0 = modulus[0];
        for (int i = 0; i < modulus.length; i++) {
            DMatrixRMaj m = modulus[i];
            if (m.numRows != m0.numRows || m.numCols != m0.numCols) {
                throw new IllegalArgumentException("測定振幅の形状が一致しません: position=" + i);
            }
            for (double v : m.data) {
                if (v < 0.0) {
                    throw new IllegalArgumentException("測定振幅に負の値が含まれています: position=" + i);
                }
            }
        }
        if (validityMask != null
                && (validityMask.numRows != m0.numRows || validityMask.numCols != m0.numCols)) {
            throw new IllegalArgumentException("マスクの形状が測定振幅と一致しません");
        }
        this.modulus = new DMatrixRMaj[modulus.length];
        for (int i = 0; i < modulus.length; i++) {
            this.modulus[i] = modulus[i].copy();
        }
        this.validityMask = validityMask == null ? null : validityMask.copy();
    }

    @Override
    public DMatrixRMaj[] modulus(Block block) {
        DMatrixRMaj[] out = new DMatrixRMaj[block.size()];
        for (int k = 0; k < block.size(); k++) {
            out[k] = modulus[block.positionAt(k)].copy();
        }
        return out;
    }

    @Override
    public Optional<DMatrixRMaj[]> validityMask(Block block) {
        if (validityMask == null) {
            return Optional.empty();
        }
        DMatrixRMaj[] out = new DMatrixRMaj[block.size()];
        for (int k = 0; k < block.size(); k++) {
            out[k] = validityMask.copy();
        }
        return Optional.of(out);
    }

    @Override
    public int positionCount() {
        return modulus.length;
    }
}
