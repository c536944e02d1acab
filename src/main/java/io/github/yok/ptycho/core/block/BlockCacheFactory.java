package io.github.yok.ptycho.core.block;

import io.github.yok.ptycho.core.scan.ScanPattern;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * 走査パターンを、メモリ使用量を抑えるための連続したブロックに分割するクラスです。
 *
 * <p>
 * 走査位置を番号順に {@code blockSize} 個ずつまとめます（最後のブロックは端数になります）。
 * 照明上限値はここでは 0 で初期化し、{@code IlluminationCeilingEstimator} が更新します。
 * </p>
 */
@Slf4j
public final class BlockCacheFactory {

    /**
     * 1 ブロックあたりの最大走査位置数です。
     */
    private final int blockSize;

    /**
     * ブロック分割を生成します。
     *
     * @param blockSize 1 ブロックあたりの最大走査位置数です（1 以上）
     * @throws IllegalArgumentException blockSize が 1 未満の場合に発生します
     */
    public BlockCacheFactory(int blockSize) {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("blocks.size は 1 以上が必要です: " + blockSize);
        }
        this.blockSize = blockSize;
    }

    /**
     * 走査パターンからブロックキャッシュを生成します。
     *
     * @param pattern 走査パターンです
     * @param viewHeight ビュー（プローブ）の行数です
     * @param viewWidth ビュー（プローブ）の列数です
     * @param objectModes オブジェクトモード数です
     * @return ブロックキャッシュです
     */
    public BlockCache create(ScanPattern pattern, int viewHeight, int viewWidth,
            int objectModes) {
        int n = pattern.positionCount();
        int[] rowOffsets = new int[n];
        int[] colOffsets = new int[n];
        for (int i = 0; i < n; i++) {
            rowOffsets[i] = pattern.rowOffsetOf(i);
            colOffsets[i] = pattern.colOffsetOf(i);
        }

        List<Block> blocks = new ArrayList<>();
        for (int start = 0; start < n; start += blockSize) {
            int end = Math.min(n, start + blockSize);
            int[] positions = new int[end - start];
            int[] scanIds = new int[end - start];
            for (int i = start; i < end; i++) {
                positions[i - start] = i;
                scanIds[i - start] = pattern.scanIdOf(i);
            }
            blocks.add(new Block(blocks.size(), positions, scanIds));
        }

        log.info("ブロック分割を作成しました。走査位置数={}、ブロック数={}、ブロックサイズ={}", n, blocks.size(),
                blockSize);

        double[] maxIllumination = new double[objectModes];
        Arrays.fill(maxIllumination, 0.0);
        return new BlockCache(blocks, rowOffsets, colOffsets, viewHeight, viewWidth,
                maxIllumination);
    }
}
