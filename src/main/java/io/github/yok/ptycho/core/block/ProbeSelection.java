package io.github.yok.ptycho.core.block;

import com.google.common.base.Preconditions;
import io.github.yok.ptycho.core.array.ComplexStack;
import java.util.Arrays;
import org.ejml.data.ZMatrixRMaj;

/**
 * ブロック内の各走査位置で使用するプローブインスタンスの選択結果です。
 *
 * <p>
 * 次の 2 通りのみを取ります。
 * </p>
 * <ul>
 * <li>{@link SharedInstance}: ブロック内の全位置が 1 つのインスタンスを共有します</li>
 * <li>{@link PerGroupInstance}: 位置ごとに走査グループ番号のインスタンスを使用します</li>
 * </ul>
 */
public abstract class ProbeSelection {

    private ProbeSelection() {}

    /**
     * 全位置で 1 つのインスタンスを共有する選択を生成します。
     *
     * @param instance インスタンス番号です（0 以上）
     * @return 選択結果です
     */
    public static ProbeSelection shared(int instance) {
        return new SharedInstance(instance);
    }

    /**
     * 位置ごとにインスタンスを選ぶ選択を生成します。
     *
     * @param instances 位置ごとのインスタンス番号です
     * @return 選択結果です
     */
    public static ProbeSelection perGroup(int[] instances) {
        return new PerGroupInstance(instances);
    }

    /**
     * ブロック内 k 番目の位置で使用するインスタンス番号を返します。
     *
     * @param k ブロック内の位置番号です
     * @return インスタンス番号です
     */
    public abstract int instanceAt(int k);

    /**
     * 単一インスタンスを共有するかどうかを返します。
     *
     * @return 共有する場合は true です
     */
    public abstract boolean isShared();

    /**
     * プローブから、ブロック内の各位置に対応するスライスを取り出します。
     *
     * <p>
     * 返却値の奥行きはブロック内の位置数です。スライスはコピーせず参照を並べます（共有時は同じスライスが並びます）。
     * </p>
     *
     * @param probe プローブ（高さ × 幅 × インスタンス）です
     * @param positions ブロック内の位置数です
     * @return 位置ごとのプローブです
     * @throws IndexOutOfBoundsException インスタンス番号がプローブの奥行きを超える場合に発生します
     */
    public ComplexStack select(ComplexStack probe, int positions) {
        ZMatrixRMaj[] slices = new ZMatrixRMaj[positions];
        for (int k = 0; k < positions; k++) {
            int instance = Preconditions.checkElementIndex(instanceAt(k), probe.depth(),
                    "プローブインスタンス番号");
            slices[k] = probe.slice(instance);
        }
        return ComplexStack.wrap(slices);
    }

    /**
     * 全位置で 1 つのインスタンスを共有する選択です。
     */
    public static final class SharedInstance extends ProbeSelection {

        private final int instance;

        private SharedInstance(int instance) {
            Preconditions.checkArgument(instance >= 0, "instance は 0 以上が必要です: %s", instance);
            this.instance = instance;
        }

        @Override
        public int instanceAt(int k) {
            return instance;
        }

        @Override
        public boolean isShared() {
            return true;
        }

        @Override
        public String toString() {
            return "SharedInstance[" + instance + "]";
        }
    }

    /**
     * 位置ごとに走査グループのインスタンスを使用する選択です。
     */
    public static final class PerGroupInstance extends ProbeSelection {

        private final int[] instances;

        private PerGroupInstance(int[] instances) {
            Preconditions.checkNotNull(instances, "instances が null です。");
            this.instances = instances.clone();
        }

        @Override
        public int instanceAt(int k) {
            return instances[k];
        }

        @Override
        public boolean isShared() {
            return false;
        }

        @Override
        public String toString() {
            return "PerGroupInstance" + Arrays.toString(instances);
        }
    }
}
