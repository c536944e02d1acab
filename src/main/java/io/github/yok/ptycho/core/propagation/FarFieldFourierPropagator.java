package io.github.yok.ptycho.core.propagation;

import io.github.yok.ptycho.core.array.ComplexArrays;
import io.github.yok.ptycho.core.array.ComplexStack;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.ejml.data.ZMatrixRMaj;
import org.jtransforms.fft.DoubleFFT_2D;

/**
 * JTransforms の 2 次元 FFT を用いた遠方場（フラウンホーファー）伝搬です。
 *
 * <p>
 * ユニタリな正規化（{@code 1/sqrt(height*width)}）を用いるため、逆伝搬は順伝搬の随伴かつ逆変換になり、 全強度が保存されます。
 * EJML の複素配列と JTransforms の複素 1 次元配列はともに「実部・虚部を交互に並べた行優先」なので、そのまま変換できます。
 * </p>
 */
public final class FarFieldFourierPropagator implements FourierPropagator {

    /**
     * 形状ごとの FFT プランです。
     */
    private final Map<String, DoubleFFT_2D> plans = new ConcurrentHashMap<>();

    @Override
    public ComplexStack forward(ComplexStack field, PropagationMode mode) {
        return transform(field, true);
    }

    @Override
    public ComplexStack backward(ComplexStack field, PropagationMode mode) {
        return transform(field, false);
    }

    /**
     * 全スライスを FFT / 逆 FFT したコピーを返します。
     *
     * @param field 入力です
     * @param forward 順変換の場合は true です
     * @return 変換結果です
     */
    private ComplexStack transform(ComplexStack field, boolean forward) {
        int h = field.height();
        int w = field.width();
        DoubleFFT_2D fft = plans.computeIfAbsent(h + "x" + w, k -> new DoubleFFT_2D(h, w));
        double norm = 1.0 / Math.sqrt((double) h * w);

        ComplexStack out = field.copy();
        for (int k = 0; k < out.depth(); k++) {
            ZMatrixRMaj s = out.slice(k);
            if (forward) {
                fft.complexForward(s.data);
            } else {
                fft.complexInverse(s.data, false);
            }
            ComplexArrays.scale(s, norm);
        }
        return out;
    }
}
