package io.github.yok.ptycho.core.state;

import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.Block;
import java.util.List;
import lombok.Value;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;

/**
 * 1 ブロック分のオーバーラップ拘束への寄与（プローブ・オブジェクトの更新量と照明量）です。
 *
 * <p>
 * ブロックごとに新しく生成し、{@link OverlapAccumulator#absorb} で加算されます。 生成後は変更しません。
 * </p>
 */
@Value
public class BlockContribution {

    /**
     * 寄与元のブロックです。
     */
    Block block;

    /**
     * プローブモードごとの寄与です（プローブ更新を行わない反復では空です）。
     */
    List<ProbeTerm> probeTerms;

    /**
     * モードごとのオブジェクトへの寄与です（オブジェクト更新を行わない反復では空です）。
     */
    List<ObjectTerm> objectTerms;

    /**
     * 1 プローブモード分の寄与です。
     *
     * <p>
     * {@code instances[i]} 番目のプローブインスタンスへ {@code updates[i]}, {@code illuminations[i]} を加算します。
     * </p>
     */
    @Value
    public static class ProbeTerm {

        /**
         * プローブモード番号です。
         */
        int mode;

        /**
         * 加算先のインスタンス番号です。
         */
        int[] instances;

        /**
         * {@code Σ ψ' ⊙ conj(O)} です。
         */
        ZMatrixRMaj[] updates;

        /**
         * {@code Σ |O|^2} です。
         */
        DMatrixRMaj[] illuminations;
    }

    /**
     * 1 モード分のオブジェクトへの寄与です。
     */
    @Value
    public static class ObjectTerm {

        /**
         * 加算先のオブジェクトモード番号です。
         */
        int objectMode;

        /**
         * 位置ごとの {@code ψ' ⊙ conj(P)} です。
         */
        ComplexStack patches;

        /**
         * 位置ごとの {@code |P|^2} です。
         */
        DMatrixRMaj[] weights;
    }
}
