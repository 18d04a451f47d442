package nl.bytesoflife.natalchart.house;

import nl.bytesoflife.natalchart.model.ChartAngles;
import nl.bytesoflife.natalchart.model.HouseCusp;
import nl.bytesoflife.natalchart.model.HouseSystem;

import java.util.List;

/**
 * Cusps and angles for one chart, plus which system actually produced them.
 *
 * @param fallbackReason why the requested system was replaced, null when it was not
 */
public record HouseComputation(List<HouseCusp> cusps,
                               ChartAngles angles,
                               HouseSystem requested,
                               HouseSystem used,
                               boolean fallbackOccurred,
                               String fallbackReason) {

    public HouseComputation {
        if (cusps == null || cusps.size() != 12) {
            throw new IllegalArgumentException("Exactly 12 cusps required");
        }
        cusps = List.copyOf(cusps);
    }

    public HouseCusp cusp(int number) {
        return cusps.get(number - 1);
    }
}
