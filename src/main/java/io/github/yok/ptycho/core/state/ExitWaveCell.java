package io.github.yok.ptycho.core.state;

import io.github.yok.ptycho.core.array.ComplexStack;

/**
 * (モード, ブロック) ごとに保持する出射波推定値（{@code ψ'}）の 1 セルです。
 *
 * <p>
 * 未初期化（{@link #uninitialized()}）か、出射波を保持する状態（{@link #of(ComplexStack)}）のいずれかです。
 * </p>
 */
public abstract class ExitWaveCell {

    private static final ExitWaveCell UNINITIALIZED = new Uninitialized();

    private ExitWaveCell() {}

    /**
     * 未初期化のセルを返します。
     *
     * @return 未初期化セルです
     */
    public static ExitWaveCell uninitialized() {
        return UNINITIALIZED;
    }

    /**
     * 出射波を保持するセルを返します。
     *
     * @param field 出射波（奥行き = ブロック内の位置数）です
     * @return セルです
     */
    public static ExitWaveCell of(ComplexStack field) {
        if (field == null) {
            throw new IllegalArgumentException("field は null 不可です");
        }
        return new Field(field);
    }

    /**
     * 出射波を保持しているかどうかを返します。
     *
     * @return 保持している場合は true です
     */
    public abstract boolean isInitialized();

    /**
     * 保持している出射波を返します。
     *
     * @return 出射波です
     * @throws IllegalStateException 未初期化の場合に発生します
     */
    public abstract ComplexStack field();

    private static final class Uninitialized extends ExitWaveCell {

        @Override
        public boolean isInitialized() {
            return false;
        }

        @Override
        public ComplexStack field() {
            throw new IllegalStateException("出射波が未初期化です");
        }

        @Override
        public String toString() {
            return "Uninitialized";
        }
    }

    private static final class Field extends ExitWaveCell {

        private final ComplexStack field;

        private Field(ComplexStack field) {
            this.field = field;
        }

        @Override
        public boolean isInitialized() {
            return true;
        }

        @Override
        public ComplexStack field() {
            return field;
        }

        @Override
        public String toString() {
            return "Field[" + field.height() + "x" + field.width() + "x" + field.depth() + "]";
        }
    }
}
