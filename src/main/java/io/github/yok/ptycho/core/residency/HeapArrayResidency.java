package io.github.yok.ptycho.core.residency;

import io.github.yok.ptycho.core.array.ComplexStack;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * JVM ヒープ上でのみ演算する場合の {@link ArrayResidency} です。
 *
 * <p>
 * 移動は参照をそのまま返します。移動回数のみ数えます。
 * </p>
 */
@Slf4j
public final class HeapArrayResidency implements ArrayResidency {

    /**
     * 演算装置への移動回数です。
     */
    private final AtomicLong uploads = new AtomicLong();

    /**
     * ホストへの移動回数です。
     */
    private final AtomicLong downloads = new AtomicLong();

    @Override
    public ComplexStack toDevice(ComplexStack array) {
        long n = uploads.incrementAndGet();
        if (log.isDebugEnabled()) {
            log.debug("配列を演算装置へ移動しました。回数={}、形状={}x{}x{}", n, array.height(), array.width(),
                    array.depth());
        }
        return array;
    }

    @Override
    public ComplexStack toHost(ComplexStack array) {
        long n = downloads.incrementAndGet();
        if (log.isDebugEnabled()) {
            log.debug("配列をホストへ戻しました。回数={}、形状={}x{}x{}", n, array.height(), array.width(),
                    array.depth());
        }
        return array;
    }

    public long uploadCount() {
        return uploads.get();
    }

    public long downloadCount() {
        return downloads.get();
    }
}
