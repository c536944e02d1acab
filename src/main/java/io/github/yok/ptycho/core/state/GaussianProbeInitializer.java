package io.github.yok.ptycho.core.state;

import io.github.yok.ptycho.app.PtychoProperties;
import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.propagation.PropagationMode;
import io.github.yok.ptycho.core.scan.RasterScanPattern;
import java.util.ArrayList;
import java.util.List;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;

/**
 * 一様なオブジェクトとガウス型プローブから再構成を始める初期値生成です。
 *
 * <ul>
 * <li>オブジェクト: 全モードとも 1（透過率 1、位相 0）</li>
 * <li>プローブ: 最初のモードは中心のガウス分布です。プローブを共有しない場合は走査グループごとに同じ値のインスタンスを持ちます</li>
 * <li>2 番目以降のプローブモード: 1 次の Hermite-Gauss 形を {@value #HIGHER_MODE_WEIGHT} 倍したものです</li>
 * </ul>
 */
public final class GaussianProbeInitializer implements ReconstructionStateInitializer {

    /**
     * 2 番目以降のプローブモードの振幅比です。
     */
    static final double HIGHER_MODE_WEIGHT = 0.1;

    private final PtychoProperties properties;

    private final RasterScanPattern pattern;

    /**
     * 初期値生成器を作成します。
     *
     * @param properties 設定です
     * @param pattern 走査パターンです（オブジェクトの大きさを決めます）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public GaussianProbeInitializer(PtychoProperties properties, RasterScanPattern pattern) {
        if (properties == null) {
            throw new IllegalArgumentException("properties は null 不可です");
        }
        if (pattern == null) {
            throw new IllegalArgumentException("pattern は null 不可です");
        }
        this.properties = properties;
        this.pattern = pattern;
    }

    @Override
    public ReconstructionState create() {
        PtychoProperties.Model m = properties.getModel();
        PtychoProperties.Probe p = properties.getProbe();
        int size = p.getSize();
        int objectHeight = pattern.objectHeight(size);
        int objectWidth = pattern.objectWidth(size);

        List<ZMatrixRMaj> objects = new ArrayList<>(m.getObjectModes());
        for (int lo = 0; lo < m.getObjectModes(); lo++) {
            ZMatrixRMaj object = new ZMatrixRMaj(objectHeight, objectWidth);
            CommonOps_ZDRM.fill(object, 1.0, 0.0);
            objects.add(object);
        }

        List<ComplexStack> probes = new ArrayList<>(m.getProbeModes());
        for (int lp = 0; lp < m.getProbeModes(); lp++) {
            int instances = (lp == 0 && !m.isShareProbe()) ? pattern.scanGroupCount() : 1;
            probes.add(probe(size, p.getGaussianSigma(), lp, instances));
        }

        return new ReconstructionState(objects, probes, modes(properties));
    }

    /**
     * モードごとの伝搬記述子を作成します（支持領域は全モード共通の半径です）。
     *
     * @param properties 設定です
     * @return 伝搬記述子の一覧です
     */
    public static List<PropagationMode> modes(PtychoProperties properties) {
        int count = Math.max(properties.getModel().getProbeModes(),
                properties.getModel().getObjectModes());
        List<PropagationMode> modes = new ArrayList<>(count);
        for (int ll = 0; ll < count; ll++) {
            modes.add(new PropagationMode(ll, properties.getProbe().getSupportRadius()));
        }
        return modes;
    }

    /**
     * ガウス型プローブを作成します。
     *
     * @param size 一辺の画素数です
     * @param sigma ガウス幅です
     * @param mode モード番号です（0 は基本形、1 以上は 1 次の形）
     * @param instances インスタンス数です
     * @return プローブです
     */
    static ComplexStack probe(int size, double sigma, int mode, int instances) {
        ComplexStack probe = new ComplexStack(size, size, instances);
        double c = (size - 1) / 2.0;
        for (int k = 0; k < instances; k++) {
            ZMatrixRMaj s = probe.slice(k);
            for (int r = 0; r < size; r++) {
                for (int col = 0; col < size; col++) {
                    double dy = r - c;
                    double dx = col - c;
                    double g = Math.exp(-(dx * dx + dy * dy) / (2.0 * sigma * sigma));
                    if (mode > 0) {
                        g *= HIGHER_MODE_WEIGHT * dx / sigma;
                    }
                    s.set(r, col, g, 0.0);
                }
            }
        }
        return probe;
    }
}
