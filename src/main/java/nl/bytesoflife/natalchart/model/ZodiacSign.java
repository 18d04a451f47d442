package nl.bytesoflife.natalchart.model;

public enum ZodiacSign {
    ARIES("Aries", "♈", Element.FIRE, Modality.CARDINAL),
    TAURUS("Taurus", "♉", Element.EARTH, Modality.FIXED),
    GEMINI("Gemini", "♊", Element.AIR, Modality.MUTABLE),
    CANCER("Cancer", "♋", Element.WATER, Modality.CARDINAL),
    LEO("Leo", "♌", Element.FIRE, Modality.FIXED),
    VIRGO("Virgo", "♍", Element.EARTH, Modality.MUTABLE),
    LIBRA("Libra", "♎", Element.AIR, Modality.CARDINAL),
    SCORPIO("Scorpio", "♏", Element.WATER, Modality.FIXED),
    SAGITTARIUS("Sagittarius", "♐", Element.FIRE, Modality.MUTABLE),
    CAPRICORN("Capricorn", "♑", Element.EARTH, Modality.CARDINAL),
    AQUARIUS("Aquarius", "♒", Element.AIR, Modality.FIXED),
    PISCES("Pisces", "♓", Element.WATER, Modality.MUTABLE);

    public enum Element { FIRE, EARTH, AIR, WATER }

    public enum Modality { CARDINAL, FIXED, MUTABLE }

    private static final ZodiacSign[] BY_INDEX = values();

    private final String displayName;
    private final String glyph;
    private final Element element;
    private final Modality modality;

    ZodiacSign(String displayName, String glyph, Element element, Modality modality) {
        this.displayName = displayName;
        this.glyph = glyph;
        this.element = element;
        this.modality = modality;
    }

    public String getDisplayName() { return displayName; }
    public String getGlyph() { return glyph; }
    public Element getElement() { return element; }
    public Modality getModality() { return modality; }

    /** Zero-based position in the zodiac, 0 = Aries. */
    public int index() {
        return ordinal();
    }

    /** Longitude where this sign begins. */
    public double startLongitude() {
        return ordinal() * 30.0;
    }

    public ZodiacSign opposite() {
        return BY_INDEX[(ordinal() + 6) % 12];
    }

    public static ZodiacSign fromIndex(int index) {
        return BY_INDEX[Math.floorMod(index, 12)];
    }

    public static ZodiacSign fromName(String name) {
        for (ZodiacSign sign : BY_INDEX) {
            if (sign.name().equalsIgnoreCase(name) || sign.displayName.equalsIgnoreCase(name)) {
                return sign;
            }
        }
        throw new IllegalArgumentException("Unknown zodiac sign: " + name);
    }
}
