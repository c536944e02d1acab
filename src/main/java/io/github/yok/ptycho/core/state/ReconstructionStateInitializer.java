package io.github.yok.ptycho.core.state;

/**
 * 再構成状態の初期値を生成するインターフェースです。
 */
public interface ReconstructionStateInitializer {

    /**
     * 初期化済みの再構成状態を生成します。
     *
     * @return 初期化済みの再構成状態です
     */
    ReconstructionState create();
}
