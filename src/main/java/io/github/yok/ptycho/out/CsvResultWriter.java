package io.github.yok.ptycho.out;

import io.github.yok.ptycho.core.array.ComplexStack;
import io.github.yok.ptycho.core.scan.RasterScanPattern;
import io.github.yok.ptycho.core.solver.DifferenceMapReconstruction;
import io.github.yok.ptycho.core.state.FourierErrorHistory;
import io.github.yok.ptycho.core.state.ReconstructionState;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.ejml.data.ZMatrixRMaj;

/**
 * 再構成結果を CSV に出力するクラスです。
 *
 * <ul>
 * <li>{@code ptycho_object_mode=0.csv}（row, col, amplitude, phase）</li>
 * <li>{@code ptycho_probe_mode=0.csv}（row, col, instance, amplitude, phase）</li>
 * <li>{@code ptycho_fourierError.csv}（記録のある反復のみ）</li>
 * <li>{@code ptycho_meta.csv}（モード数・走査条件・倍率など）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "ptycho";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 再構成結果を出力します。
     *
     * @param result 再構成結果です
     * @param pattern 走査パターンです
     * @throws IllegalArgumentException 引数が null の場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(DifferenceMapReconstruction.ReconstructionResult result,
            RasterScanPattern pattern) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
        if (pattern == null) {
            throw new IllegalArgumentException("pattern は null 不可です");
        }
        ReconstructionState state = result.getState();

        try {
            Files.createDirectories(outputDir);

            for (int lo = 0; lo < state.objectModeCount(); lo++) {
                writeObjectCsv(state.object(lo), lo);
            }
            for (int lp = 0; lp < state.probeModeCount(); lp++) {
                writeProbeCsv(state.probe(lp), lp);
            }
            writeFourierErrorCsv(result.getHistory());
            writeMetaCsv(result, pattern);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    private void writeObjectCsv(ZMatrixRMaj object, int mode) throws IOException {
        Path file = outputDir.resolve(FILE_HEAD + "_object_mode=" + mode + ".csv");

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("row", "col", "amplitude", "phase").build().print(w)) {

            for (int r = 0; r < object.numRows; r++) {
                for (int c = 0; c < object.numCols; c++) {
                    int i = r * object.numCols + c;
                    double re = object.data[2 * i];
                    double im = object.data[2 * i + 1];
                    pr.printRecord(r, c, Math.hypot(re, im), Math.atan2(im, re));
                }
            }
        }
    }

    private void writeProbeCsv(ComplexStack probe, int mode) throws IOException {
        Path file = outputDir.resolve(FILE_HEAD + "_probe_mode=" + mode + ".csv");

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("row", "col", "instance", "amplitude", "phase").build()
                        .print(w)) {

            for (int k = 0; k < probe.depth(); k++) {
                ZMatrixRMaj s = probe.slice(k);
                for (int r = 0; r < s.numRows; r++) {
                    for (int c = 0; c < s.numCols; c++) {
                        int i = r * s.numCols + c;
                        double re = s.data[2 * i];
                        double im = s.data[2 * i + 1];
                        pr.printRecord(r, c, k, Math.hypot(re, im), Math.atan2(im, re));
                    }
                }
            }
        }
    }

    /**
     * フーリエ誤差の履歴を出力します（記録のある反復・位置のみ）。
     *
     * @param history 履歴です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeFourierErrorCsv(FourierErrorHistory history) throws IOException {
        Path file = outputDir.resolve(FILE_HEAD + "_fourierError.csv");

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("iteration", "position", "error").build().print(w)) {

            for (int iter = 0; iter < history.iterationCapacity(); iter++) {
                if (!history.isRecorded(iter)) {
                    continue;
                }
                double[] errors = history.at(iter);
                for (int pos = 0; pos < errors.length; pos++) {
                    if (!Double.isNaN(errors[pos])) {
                        pr.printRecord(iter, pos, errors[pos]);
                    }
                }
            }
        }
    }

    private void writeMetaCsv(DifferenceMapReconstruction.ReconstructionResult result,
            RasterScanPattern pattern) throws IOException {
        Path file = outputDir.resolve(FILE_HEAD + "_meta.csv");
        ReconstructionState state = result.getState();
        FourierErrorHistory history = result.getHistory();
        int last = history.iterationCapacity() - 1;

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("scan.rows", pattern.rows());
            pr.printRecord("scan.cols", pattern.cols());
            pr.printRecord("scan.step", pattern.step());
            pr.printRecord("scan.positions", pattern.positionCount());

            pr.printRecord("objectModes", state.objectModeCount());
            pr.printRecord("probeModes", state.probeModeCount());
            pr.printRecord("objectHeight", state.object(0).numRows);
            pr.printRecord("objectWidth", state.object(0).numCols);
            pr.printRecord("probeSize", state.probe(0).height());

            pr.printRecord("iterations", last);
            pr.printRecord("calibrationScale", result.getCalibrationScale());
            pr.printRecord("convergedOverlapSolves", result.getConvergedOverlapSolves());
            pr.printRecord("fourierError.last", history.mean(last));
        }
    }
}
