package lvcore.connection;

import lvcore.config.DistributionConstants;

/**
 * Выбор конфигурации подключения по CDL (фиксированные пороги).
 */
public final class ConnectionConfigs {

    private ConnectionConfigs() {}

    // ============================================================
    // DP (распределительный щит)
    // ============================================================

    public static final double DP_SINGLE_70_MAX = 108.0;
    public static final double DP_SINGLE_185_MAX = 184.0;
    public static final double DP_DOUBLE_70_MAX = 216.0;

    public static final String CABLE_70 = "70 mm²";
    public static final String CABLE_185 = "185 mm²";
    public static final String CABLE_300 = "300 mm²";

    public static final String DP_MAIN_FEEDER = "1x 300 mm²";
    public static final String SS_MAIN_FEEDER = "Direct Feeder";

    /**
     * ≤108 А: 1×70; ≤184 А: 1×185; ≤216 А: 2×70; выше: 2×185.
     */
    public static ConnectionConfig dpConfig(double cdl) {
        if (cdl <= DP_SINGLE_70_MAX) {
            return new ConnectionConfig(FeedSource.DP, 1, 1, CABLE_70, DP_MAIN_FEEDER);
        }
        if (cdl <= DP_SINGLE_185_MAX) {
            return new ConnectionConfig(FeedSource.DP, 1, 1, CABLE_185, DP_MAIN_FEEDER);
        }
        if (cdl <= DP_DOUBLE_70_MAX) {
            return new ConnectionConfig(FeedSource.DP, 2, 2, CABLE_70, DP_MAIN_FEEDER);
        }
        return new ConnectionConfig(FeedSource.DP, 2, 2, CABLE_185, DP_MAIN_FEEDER);
    }

    // ============================================================
    // SS (прямое питание от подстанции)
    // ============================================================

    /**
     * Один кабель 300 мм² на каждые 248 А; предохранителей столько же, сколько кабелей.
     */
    public static ConnectionConfig ssConfig(double cdl) {
        double perCable = DistributionConstants.SS_CABLE_CAPACITY;
        int cables;
        if (cdl <= perCable) {
            cables = 1;
        } else if (cdl <= 2 * perCable) {
            cables = 2;
        } else {
            cables = (int) Math.ceil(cdl / perCable);
        }
        return new ConnectionConfig(FeedSource.SS, cables, cables, CABLE_300, SS_MAIN_FEEDER);
    }
}
