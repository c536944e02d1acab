package io.github.yok.ptycho.core.solver;

import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.Block;
import java.util.List;
import lombok.Value;

/**
 * 1 ブロック分の射影結果です。
 *
 * <p>
 * モードごとに、拘束前の射影 {@code ψ}、固定点変数 {@code ψ'}、検出器面へ伝搬した混合場 {@code F[Ψ]} を保持します。
 * ブロックの処理が終われば破棄します。
 * </p>
 */
@Value
public class BlockProjection {

    /**
     * 対象ブロックです。
     */
    Block block;

    /**
     * モードごとの射影 {@code ψ = O ⊙ P} です。
     */
    List<ComplexStack> projections;

    /**
     * モードごとの固定点変数 {@code ψ'} です。
     */
    List<ComplexStack> exitWaves;

    /**
     * モードごとの検出器面の場です。
     */
    List<ComplexStack> farFields;

    public int modeCount() {
        return projections.size();
    }
}
