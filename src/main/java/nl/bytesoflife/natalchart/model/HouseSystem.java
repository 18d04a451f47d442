package nl.bytesoflife.natalchart.model;

import java.util.Map;

public enum HouseSystem {
    PLACIDUS,
    KOCH,
    EQUAL,
    WHOLE_SIGN,
    CAMPANUS,
    REGIOMONTANUS,
    PORPHYRY,
    TOPOCENTRIC,
    MORINUS;

    private static final Map<String, HouseSystem> NAMES = Map.ofEntries(
            Map.entry("placidus", PLACIDUS),
            Map.entry("koch", KOCH),
            Map.entry("equal", EQUAL),
            Map.entry("whole_sign", WHOLE_SIGN),
            Map.entry("whole-sign", WHOLE_SIGN),
            Map.entry("campanus", CAMPANUS),
            Map.entry("regiomontanus", REGIOMONTANUS),
            Map.entry("porphyry", PORPHYRY),
            Map.entry("topocentric", TOPOCENTRIC),
            Map.entry("morinus", MORINUS)
    );

    public static HouseSystem fromName(String name) {
        HouseSystem system = NAMES.get(name.toLowerCase());
        if (system == null) {
            throw new IllegalArgumentException("Unknown house system: " + name);
        }
        return system;
    }

    /** Systems whose cusps come from a semi-arc and can be undefined at polar latitudes. */
    public boolean isSemiArcBased() {
        return this == PLACIDUS || this == KOCH;
    }
}
