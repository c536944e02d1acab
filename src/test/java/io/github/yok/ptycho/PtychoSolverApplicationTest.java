package io.github.yok.ptycho;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.yok.ptycho.app.PtychoProperties;
import io.github.yok.ptycho.core.solver.DifferenceMapReconstruction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {"ptycho.scan.rows=2", "ptycho.scan.cols=2", "ptycho.scan.step=4",
        "ptycho.probe.size=8", "ptycho.probe.support-radius=3.5",
        "ptycho.probe.gaussian-sigma=2.0", "ptycho.blocks.size=3",
        "ptycho.dm.number-iterations=3", "ptycho.simulation.features=4",
        "ptycho.simulation.photons=1.0e4", "ptycho.output.dir=target/test-out/app"})
class PtychoSolverApplicationTest {

    @Autowired
    private PtychoProperties properties;

    @Autowired
    private DifferenceMapReconstruction reconstruction;

    @Test
    void contextBindsPropertiesAndRunsCli() {
        assertThat(properties.getProbe().getSize()).isEqualTo(8);
        assertThat(reconstruction.getNumberOfIterations()).isEqualTo(3);

        Path out = Paths.get("target/test-out/app");
        assertThat(Files.exists(out.resolve("ptycho_object_mode=0.csv"))).isTrue();
        assertThat(Files.exists(out.resolve("ptycho_probe_mode=0.csv"))).isTrue();
        assertThat(Files.exists(out.resolve("ptycho_fourierError.csv"))).isTrue();
        assertThat(Files.exists(out.resolve("ptycho_meta.csv"))).isTrue();
    }
}
