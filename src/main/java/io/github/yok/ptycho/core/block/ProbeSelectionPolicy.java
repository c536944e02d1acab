package io.github.yok.ptycho.core.block;

import java.util.ArrayList;
import java.util.List;

/**
 * ブロックとモード番号から、使用するプローブインスタンスを決めるクラスです。
 *
 * <p>
 * 決定規則は次の通りです。
 * </p>
 * <ol>
 * <li>プローブを全走査で共有する設定、または 2 番目以降のモード（非干渉モードは常に共有）の場合はインスタンス 0</li>
 * <li>ブロック内の全位置が同じ走査グループの場合は、そのグループ番号のインスタンス</li>
 * <li>それ以外は位置ごとのグループ番号のインスタンス</li>
 * </ol>
 */
public final class ProbeSelectionPolicy {

    /**
     * プローブを全走査で共有するかどうかです。
     */
    private final boolean shareProbe;

    /**
     * 選択規則を生成します。
     *
     * @param shareProbe プローブを全走査で共有するかどうかです
     */
    public ProbeSelectionPolicy(boolean shareProbe) {
        this.shareProbe = shareProbe;
    }

    /**
     * ブロックとモード番号に対する選択結果を返します。
     *
     * @param block ブロックです
     * @param mode モード番号です（0 始まり）
     * @return 選択結果です
     */
    public ProbeSelection select(Block block, int mode) {
        if (shareProbe || mode > 0) {
            return ProbeSelection.shared(0);
        }
        if (block.hasSingleScanId()) {
            return ProbeSelection.shared(block.scanIdAt(0));
        }
        return ProbeSelection.perGroup(block.getScanIds());
    }

    /**
     * ブロックに対して、モード 0 から modeCount-1 までの選択結果をまとめて返します。
     *
     * @param block ブロックです
     * @param modeCount モード数です
     * @return モードごとの選択結果です
     */
    public List<ProbeSelection> selectAll(Block block, int modeCount) {
        List<ProbeSelection> out = new ArrayList<>(modeCount);
        for (int ll = 0; ll < modeCount; ll++) {
            out.add(select(block, ll));
        }
        return out;
    }

    public boolean isShareProbe() {
        return shareProbe;
    }
}
