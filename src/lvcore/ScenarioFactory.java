package lvcore;

import lvcore.config.BalancingConfig;
import lvcore.config.BalancingConfigBuilder;
import lvcore.io.MeterGroupCsvLoader;
import lvcore.model.MeterGroup;
import lvcore.model.MeterGroupFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public final class ScenarioFactory {

    private ScenarioFactory() {}

    public static List<MeterGroup> load(String path) throws IOException {
        List<MeterGroup> groups = new MeterGroupCsvLoader().load(Path.of(path));
        if (groups.isEmpty()) {
            throw new IllegalStateException("No meter groups in " + path);
        }
        return groups;
    }

    /**
     * Пример: жилой дом с магазинами и офисами.
     */
    public static List<MeterGroup> sampleGroups() {
        MeterGroupFactory f = new MeterGroupFactory();
        return List.of(
                f.create(1, "C1", 35, 30),
                f.create(2, "C2", 25, 70),
                f.create(3, "C1", 30, 50),
                f.create(4, "C6", 15, 100),
                f.create(5, "C3", 20, 40),
                f.create(6, "C7", 18, 50)
        );
    }

    public static BalancingConfig defaultConfig() {
        return new BalancingConfigBuilder()
                .setConsolidationEnabled(false)
                .build();
    }
}
