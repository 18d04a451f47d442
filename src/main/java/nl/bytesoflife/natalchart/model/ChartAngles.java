package nl.bytesoflife.natalchart.model;

public record ChartAngles(AnglePoint ascendant, AnglePoint midheaven,
                          AnglePoint descendant, AnglePoint imumCoeli) {

    public ChartAngles {
        if (ascendant == null || midheaven == null || descendant == null || imumCoeli == null) {
            throw new IllegalArgumentException("All four chart angles are required");
        }
    }

    public AnglePoint get(ChartAngle angle) {
        return switch (angle) {
            case ASCENDANT -> ascendant;
            case MIDHEAVEN -> midheaven;
            case DESCENDANT -> descendant;
            case IMUM_COELI -> imumCoeli;
        };
    }
}
