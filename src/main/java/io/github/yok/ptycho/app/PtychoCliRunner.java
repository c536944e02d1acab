package io.github.yok.ptycho.app;

import io.github.yok.ptycho.core.block.BlockCache;
import io.github.yok.ptycho.core.block.BlockCacheFactory;
import io.github.yok.ptycho.core.data.DiffractionSimulator;
import io.github.yok.ptycho.core.data.InMemoryDiffractionData;
import io.github.yok.ptycho.core.data.SyntheticSampleFactory;
import io.github.yok.ptycho.core.scan.RasterScanPattern;
import io.github.yok.ptycho.core.solver.DifferenceMapReconstruction;
import io.github.yok.ptycho.core.state.ReconstructionState;
import io.github.yok.ptycho.core.state.ReconstructionStateInitializer;
import io.github.yok.ptycho.out.ResultWriter;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で dm-ptycho-solver を実行するクラスです。
 *
 * <p>
 * 真の試料から測定データを作り、一様なオブジェクトとガウス型プローブから Difference-Map で再構成します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class PtychoCliRunner implements CommandLineRunner {

    /**
     * dm-ptycho-solver の設定値（ptycho.*）です。
     */
    private final PtychoProperties properties;

    private final RasterScanPattern pattern;

    private final BlockCacheFactory blockCacheFactory;

    private final SyntheticSampleFactory sampleFactory;

    private final DiffractionSimulator simulator;

    /**
     * 再構成状態の初期値生成ロジックです。
     */
    private final ReconstructionStateInitializer stateInitializer;

    private final DifferenceMapReconstruction reconstruction;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== dm-ptycho-solver start: difference-map reconstruction ===");
        System.out.print(properties.toMultilineString());

        int size = properties.getProbe().getSize();
        BlockCache cache = blockCacheFactory.create(pattern, size, size,
                properties.getModel().getObjectModes());

        // 真の試料と測定データ（真の試料は 1 モードなのでキャッシュを別に作ります）
        ReconstructionState truth = sampleFactory.groundTruth();
        BlockCache truthCache = blockCacheFactory.create(pattern, size, size, 1);
        InMemoryDiffractionData data = sampleFactory.measure(simulator, truth, truthCache);

        ReconstructionState state = stateInitializer.create();
        DifferenceMapReconstruction.ReconstructionResult result =
                reconstruction.run(state, cache, data);

        resultWriter.write(result, pattern);

        int last = properties.getDm().getNumberIterations();
        System.out.println("結果: calibrationScale=" + fmt5(result.getCalibrationScale())
                + ", fourierError(last)=" + fmt5(result.getHistory().mean(last))
                + ", convergedOverlapSolves=" + result.getConvergedOverlapSolves());
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
