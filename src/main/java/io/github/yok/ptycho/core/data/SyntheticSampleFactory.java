package io.github.yok.ptycho.core.data;

import io.github.yok.ptycho.app.PtychoProperties;
import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.block.BlockCache;
import io.github.yok.ptycho.core.scan.RasterScanPattern;
import io.github.yok.ptycho.core.state.GaussianProbeInitializer;
import io.github.yok.ptycho.core.state.ReconstructionState;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;

/**
 * 再構成の動作確認に使う、真のオブジェクト・プローブと測定データを作るクラスです。
 *
 * <p>
 * オブジェクトは乱数で配置したガウス状の斑点（位相と吸収）からなる弱い位相物体です。 プローブは円形開口で切ったガウス分布で、
 * 走査位置あたりの総光子数が設定値になるように測定振幅を規格化します。
 * </p>
 */
@Slf4j
public final class SyntheticSampleFactory {

    /**
     * 斑点の幅の最小値（ピクセル）です。
     */
    private static final double MIN_FEATURE_WIDTH = 1.5;

    /**
     * 斑点の幅の最大値（ピクセル）です。
     */
    private static final double MAX_FEATURE_WIDTH = 4.0;

    private final PtychoProperties properties;

    private final RasterScanPattern pattern;

    /**
     * 生成器を作成します。
     *
     * @param properties 設定です
     * @param pattern 走査パターンです
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public SyntheticSampleFactory(PtychoProperties properties, RasterScanPattern pattern) {
        if (properties == null) {
            throw new IllegalArgumentException("properties は null 不可です");
        }
        if (pattern == null) {
            throw new IllegalArgumentException("pattern は null 不可です");
        }
        this.properties = properties;
        this.pattern = pattern;
    }

    /**
     * 真の状態を作成します（1 オブジェクトモード、1 プローブモード）。
     *
     * @return 真の状態です
     */
    public ReconstructionState groundTruth() {
        PtychoProperties.Simulation s = properties.getSimulation();
        PtychoProperties.Probe p = properties.getProbe();
        int size = p.getSize();
        int h = pattern.objectHeight(size);
        int w = pattern.objectWidth(size);

        double[] blobs = new double[h * w];
        Random random = new Random(s.getSeed());
        for (int f = 0; f < s.getFeatures(); f++) {
            double cy = random.nextDouble() * h;
            double cx = random.nextDouble() * w;
            double width = MIN_FEATURE_WIDTH
                    + random.nextDouble() * (MAX_FEATURE_WIDTH - MIN_FEATURE_WIDTH);
            for (int r = 0; r < h; r++) {
                for (int c = 0; c < w; c++) {
                    double d2 = (r - cy) * (r - cy) + (c - cx) * (c - cx);
                    blobs[r * w + c] += Math.exp(-d2 / (2.0 * width * width));
                }
            }
        }

        ZMatrixRMaj object = new ZMatrixRMaj(h, w);
        for (int i = 0; i < blobs.length; i++) {
            double b = Math.min(1.0, blobs[i]);
            double amplitude = 1.0 - s.getAbsorption() * b;
            double phase = s.getPhaseContrast() * b;
            object.data[2 * i] = amplitude * Math.cos(phase);
            object.data[2 * i + 1] = amplitude * Math.sin(phase);
        }

        ComplexStack probe = new ComplexStack(size, size, 1);
        double c0 = (size - 1) / 2.0;
        double sigma = p.getGaussianSigma();
        double radius = p.getSupportRadius();
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                double d2 = (r - c0) * (r - c0) + (c - c0) * (c - c0);
                if (radius > 0.0 && d2 > radius * radius) {
                    continue;
                }
                // 弱い 2 次位相（デフォーカス相当）を与えます。
                double phase = 0.5 * d2 / (sigma * sigma);
                double g = Math.exp(-d2 / (2.0 * sigma * sigma));
                probe.slice(0).set(r, c, g * Math.cos(phase), g * Math.sin(phase));
            }
        }

        List<ZMatrixRMaj> objects = new ArrayList<>(1);
        objects.add(object);
        List<ComplexStack> probes = new ArrayList<>(1);
        probes.add(probe);
        return new ReconstructionState(objects, probes,
                GaussianProbeInitializer.modes(properties).subList(0, 1));
    }

    /**
     * 真の状態から測定データを作成します。
     *
     * @param simulator 回折パターンの計算です
     * @param truth 真の状態です
     * @param cache ブロックキャッシュです
     * @return 測定データです（マスクなし）
     */
    public InMemoryDiffractionData measure(DiffractionSimulator simulator,
            ReconstructionState truth, BlockCache cache) {
        DMatrixRMaj[] modulus = simulator.simulate(truth, cache);

        double total = 0.0;
        for (DMatrixRMaj m : modulus) {
            for (double v : m.data) {
                total += v * v;
            }
        }
        double mean = total / modulus.length;
        if (!(mean > 0.0)) {
            throw new IllegalStateException("シミュレーションした強度が 0 です");
        }
        double factor = Math.sqrt(properties.getSimulation().getPhotons() / mean);
        for (DMatrixRMaj m : modulus) {
            for (int i = 0; i < m.data.length; i++) {
                m.data[i] *= factor;
            }
        }
        log.info("測定データを作成しました。走査位置数={}、位置あたりの光子数={}", modulus.length,
                String.format(Locale.ROOT, "%.3g", properties.getSimulation().getPhotons()));
        return new InMemoryDiffractionData(modulus, null);
    }
}
