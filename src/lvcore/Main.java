package lvcore;

import lvcore.config.BalancingConfig;
import lvcore.config.BalancingConfigBuilder;
import lvcore.config.TransformerCatalog;
import lvcore.connection.ConnectionResolver;
import lvcore.connection.FinalConnection;
import lvcore.engine.DistributionEngine;
import lvcore.engine.DistributionResults;
import lvcore.io.DistributionReportPrinter;
import lvcore.model.MeterGroup;

import java.util.List;

/**
 * Запуск: {@code Main [groups.csv] [--consolidate]}.
 * Без файла считается встроенный пример из {@link ScenarioFactory#sampleGroups()}.
 */
public class Main {

    public static void main(String[] args) {

        String groupsPath = null;
        boolean consolidate = false;
        for (String arg : args) {
            if ("--consolidate".equals(arg)) {
                consolidate = true;
            } else {
                groupsPath = arg;
            }
        }

        try {
            // 1) входные данные
            List<MeterGroup> groups = groupsPath != null
                    ? ScenarioFactory.load(groupsPath)
                    : ScenarioFactory.sampleGroups();

            // 2) конфиг
            BalancingConfig cfg = BalancingConfigBuilder.from(ScenarioFactory.defaultConfig())
                    .setConsolidationEnabled(consolidate)
                    .build();

            // 3) балансировка и подключения
            DistributionEngine engine = new DistributionEngine(cfg, TransformerCatalog.defaultCatalog());
            DistributionResults results = engine.performBalancedDistribution(groups);
            List<FinalConnection> connections = new ConnectionResolver()
                    .calculateFinalConnections(results.getTransformers());

            DistributionReportPrinter.printSummary(results, System.out);
            DistributionReportPrinter.printTransformers(results.getTransformers(), System.out);
            System.out.println();
            DistributionReportPrinter.printConnections(connections, System.out);

        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }
}
