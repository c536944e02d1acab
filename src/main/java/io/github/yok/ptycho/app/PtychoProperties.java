package io.github.yok.ptycho.app;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * dm-ptycho-solver の設定値（ptycho.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "ptycho")
public class PtychoProperties {

    /**
     * 走査設定です。
     */
    @Valid
    private Scan scan = new Scan();

    /**
     * プローブ設定です。
     */
    @Valid
    private Probe probe = new Probe();

    /**
     * モード設定です。
     */
    @Valid
    private Model model = new Model();

    /**
     * ブロック分割設定です。
     */
    @Valid
    private Blocks blocks = new Blocks();

    /**
     * Difference-Map 設定です。
     */
    @Valid
    private Dm dm = new Dm();

    /**
     * 測定データのシミュレーション設定です。
     */
    @Valid
    private Simulation simulation = new Simulation();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "ptycho")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Scan sc = getScan();
        Probe p = getProbe();
        Model m = getModel();
        Blocks b = getBlocks();
        Dm d = getDm();
        Simulation si = getSimulation();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "scan",
                // rows: 行方向の走査点数
                "rows", sc.getRows(),
                // cols: 列方向の走査点数
                "cols", sc.getCols(),
                // step: 走査間隔（ピクセル）
                "step", sc.getStep(),
                // scanGroups: 走査グループ数（プローブを共有しない場合のインスタンス数）
                "scanGroups", sc.getScanGroups());

        appendSection(sb, nl, "probe",
                // size: プローブ（= 検出器）の一辺の画素数
                "size", p.getSize(),
                // supportRadius: 実空間支持領域の半径
                "supportRadius", p.getSupportRadius(),
                // gaussianSigma: 初期プローブのガウス幅
                "gaussianSigma", p.getGaussianSigma());

        appendSection(sb, nl, "model",
                // probeModes: プローブモード数
                "probeModes", m.getProbeModes(),
                // objectModes: オブジェクトモード数
                "objectModes", m.getObjectModes(),
                // shareProbe: 全走査でプローブを共有するかどうか
                "shareProbe", m.isShareProbe());

        appendSection(sb, nl, "blocks",
                // size: 1 ブロックあたりの最大走査位置数
                "size", b.getSize());

        appendSection(sb, nl, "dm",
                // numberIterations: 外側反復の最終反復番号
                "numberIterations", d.getNumberIterations(),
                // pfftRelaxation: 振幅拘束の緩和パラメータ
                "pfftRelaxation", d.getPfftRelaxation(),
                // probeInertia: プローブ更新の慣性
                "probeInertia", d.getProbeInertia(),
                // objectInertia: オブジェクト更新の慣性
                "objectInertia", d.getObjectInertia(),
                // probeChangeStart: プローブ更新を開始する反復
                "probeChangeStart", d.getProbeChangeStart(),
                // objectChangeStart: オブジェクト更新を開始する反復
                "objectChangeStart", d.getObjectChangeStart(),
                // keepOnDevice: 配列を演算装置上に置いたままにするかどうか
                "keepOnDevice", d.isKeepOnDevice(),
                // reportError: フーリエ誤差を記録するかどうか
                "reportError", d.isReportError(),
                // overlap.alwaysMeasureProbeChange: 判定対象外の反復でもプローブ変化量を計測するかどうか
                "overlap.alwaysMeasureProbeChange", d.getOverlap().isAlwaysMeasureProbeChange());

        appendSection(sb, nl, "simulation",
                // seed: 乱数シード
                "seed", si.getSeed(),
                // phaseContrast: 真のオブジェクトの位相コントラスト（rad）
                "phaseContrast", si.getPhaseContrast(),
                // absorption: 真のオブジェクトの吸収
                "absorption", si.getAbsorption(),
                // features: 真のオブジェクトに置く構造の数
                "features", si.getFeatures(),
                // photons: 走査位置あたりの総光子数
                "photons", si.getPhotons());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * <pre>
     *   section:
     *     key: value
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Scan {

        /**
         * 行方向の走査点数です。
         */
        @Min(1)
        private int rows = 6;

        /**
         * 列方向の走査点数です。
         */
        @Min(1)
        private int cols = 6;

        /**
         * 走査間隔（ピクセル）です。
         */
        @Min(0)
        private int step = 6;

        /**
         * 走査グループ数です。
         */
        @Min(1)
        private int scanGroups = 1;
    }

    @Data
    public static class Probe {

        /**
         * プローブ（= 検出器）の一辺の画素数です。
         */
        @Min(2)
        private int size = 32;

        /**
         * 実空間支持領域の半径（ピクセル）です。0 以下で無効です。
         */
        private double supportRadius = 12.0;

        /**
         * 初期プローブのガウス幅（ピクセル）です。
         */
        @DecimalMin(value = "0.0", inclusive = false)
        private double gaussianSigma = 5.0;
    }

    @Data
    public static class Model {

        /**
         * プローブモード数です。
         */
        @Min(1)
        private int probeModes = 1;

        /**
         * オブジェクトモード数です。
         */
        @Min(1)
        private int objectModes = 1;

        /**
         * 全走査でプローブを共有するかどうかです。
         *
         * <p>
         * false の場合、最初のプローブモードは走査グループごとのインスタンスを持ちます。
         * </p>
         */
        private boolean shareProbe = true;
    }

    @Data
    public static class Blocks {

        /**
         * 1 ブロックあたりの最大走査位置数です。
         */
        @Min(1)
        private int size = 12;
    }

    @Data
    public static class Dm {

        /**
         * 外側反復の最終反復番号です（反復 0 はキャリブレーション）。
         */
        @Min(0)
        private int numberIterations = 60;

        /**
         * 振幅拘束の緩和パラメータです（0 で完全な置き換え）。
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double pfftRelaxation = 0.05;

        /**
         * プローブ更新の慣性です（0 で旧値を残さない、1 で更新しない）。
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double probeInertia = 0.3;

        /**
         * オブジェクト更新の慣性です（0 で旧値を残さない、1 で更新しない）。
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double objectInertia = 0.1;

        /**
         * プローブ更新を開始する反復番号です。
         */
        @Min(1)
        private int probeChangeStart = 1;

        /**
         * オブジェクト更新を開始する反復番号です。
         */
        @Min(1)
        private int objectChangeStart = 1;

        /**
         * 配列を演算装置上に置いたままにするかどうかです。
         */
        private boolean keepOnDevice = false;

        /**
         * フーリエ誤差を記録するかどうかです（最終反復は常に記録します）。
         */
        private boolean reportError = true;

        /**
         * オーバーラップ拘束ソルバの設定です。
         */
        @Valid
        private Overlap overlap = new Overlap();

        @Data
        public static class Overlap {

            /**
             * 収束判定の対象外の繰り返し（最初の繰り返しなど）でも、プローブの変化量を計測してログに出すかどうかです。
             */
            private boolean alwaysMeasureProbeChange = false;
        }
    }

    @Data
    public static class Simulation {

        /**
         * 乱数シードです。
         */
        private long seed = 42L;

        /**
         * 真のオブジェクトの位相コントラスト（rad）です。
         */
        private double phaseContrast = 0.8;

        /**
         * 真のオブジェクトの吸収（0 以上 1 未満）です。
         */
        @DecimalMin("0.0")
        @DecimalMax(value = "1.0", inclusive = false)
        private double absorption = 0.2;

        /**
         * 真のオブジェクトに置く構造（ガウス状の斑点）の数です。
         */
        @Min(0)
        private int features = 24;

        /**
         * 走査位置あたりの総光子数です。
         */
        @DecimalMin(value = "0.0", inclusive = false)
        private double photons = 1.0e6;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotBlank
        private String dir = "./out";
    }
}
