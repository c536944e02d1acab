package io.github.yok.ptycho.core.propagation;

import io.github.yok.ptycho.core.array.ComplexStack;
import org.ejml.data.ZMatrixRMaj;

/**
 * 配列中心を中心とする円の外側を 0 にする実空間支持領域拘束です。
 *
 * <p>
 * 半径はモード記述子の {@link PropagationMode#getSupportRadius()} を用います。半径が 0 以下なら何もしません。
 * </p>
 */
public final class CircularProbeSupport implements ProbeSupportConstraint {

    @Override
    public ComplexStack apply(ComplexStack probe, PropagationMode mode) {
        ComplexStack out = probe.copy();
        if (mode == null || !mode.hasSupport()) {
            return out;
        }
        int h = probe.height();
        int w = probe.width();
        double cy = (h - 1) / 2.0;
        double cx = (w - 1) / 2.0;
        double r2 = mode.getSupportRadius() * mode.getSupportRadius();

        for (int k = 0; k < out.depth(); k++) {
            ZMatrixRMaj s = out.slice(k);
            for (int r = 0; r < h; r++) {
                for (int c = 0; c < w; c++) {
                    double dy = r - cy;
                    double dx = c - cx;
                    if (dy * dy + dx * dx > r2) {
                        s.set(r, c, 0.0, 0.0);
                    }
                }
            }
        }
        return out;
    }
}
