package lvcore.engine;

import lvcore.model.IndividualMeter;
import lvcore.model.MeterGroup;
import lvcore.model.MeterId;

import java.util.ArrayList;
import java.util.List;

/**
 * Разворачивает группы счётчиков в отдельные счётчики с id "{group.id}_{index}".
 * Группы с count <= 0 должны быть отклонены до вызова.
 */
public final class MeterExpander {

    private MeterExpander() {}

    public static List<IndividualMeter> expand(List<MeterGroup> groups) {
        int total = 0;
        for (MeterGroup g : groups) {
            total += Math.max(0, g.getCount());
        }

        List<IndividualMeter> out = new ArrayList<>(total);
        for (MeterGroup g : groups) {
            for (int i = 0; i < g.getCount(); i++) {
                out.add(new IndividualMeter(MeterId.whole(g.getId() + "_" + i), g, g.getCdlPerMeter()));
            }
        }
        return out;
    }
}
