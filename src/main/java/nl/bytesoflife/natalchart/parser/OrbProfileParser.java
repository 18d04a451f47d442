package nl.bytesoflife.natalchart.parser;

import nl.bytesoflife.natalchart.aspect.AspectDefinition;
import nl.bytesoflife.natalchart.aspect.OrbProfile;
import nl.bytesoflife.natalchart.aspect.PairCategory;
import nl.bytesoflife.natalchart.model.AspectQuality;
import nl.bytesoflife.natalchart.model.AspectType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Parses orb profile files:
 * <pre>
 * (version 1)
 * (profile "default")
 * (aspect conjunction (angle 0) (orb 8) (quality neutral))
 * (pair_factor outer 0.75)
 * </pre>
 * {@code angle} and {@code quality} may be omitted and default to the aspect type's own values.
 * Unknown top-level tags are rejected.
 */
public class OrbProfileParser {

    public OrbProfile parse(InputStream in) throws IOException {
        return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }

    public OrbProfile parse(String content) {
        List<SNode> nodes = new SExpressionParser().parse(content);

        String name = null;
        int version = 1;
        List<AspectDefinition> definitions = new ArrayList<>();
        Map<PairCategory, Double> factors = new EnumMap<>(PairCategory.class);

        for (SNode node : nodes) {
            if (!(node instanceof SNode.SList list)) continue;
            switch (list.tag()) {
                case "version" -> version = parseInt(list, 1);
                case "profile" -> name = requireAtom(list, 1);
                case "aspect" -> definitions.add(parseAspect(list));
                case "pair_factor" -> factors.put(
                        PairCategory.fromName(requireAtom(list, 1)), parseDouble(list, 2));
                default -> throw new IllegalArgumentException("Unknown orb profile entry: " + list);
            }
        }
        if (name == null) {
            throw new IllegalArgumentException("Orb profile has no (profile \"name\") entry");
        }
        return new OrbProfile(name, version, definitions, factors);
    }

    private AspectDefinition parseAspect(SNode.SList list) {
        AspectType type = AspectType.fromName(requireAtom(list, 1));
        double angle = type.getExactAngle();
        Double orb = null;
        AspectQuality quality = defaultQuality(type);

        for (int i = 2; i < list.size(); i++) {
            if (list.children().get(i) instanceof SNode.SList sub) {
                switch (sub.tag()) {
                    case "angle" -> angle = parseDouble(sub, 1);
                    case "orb" -> orb = parseDouble(sub, 1);
                    case "quality" -> quality = AspectQuality.fromName(requireAtom(sub, 1));
                    default -> throw new IllegalArgumentException("Unknown aspect attribute: " + sub);
                }
            }
        }
        if (orb == null) {
            throw new IllegalArgumentException("Aspect " + type + " has no orb: " + list);
        }
        if (angle != type.getExactAngle()) {
            throw new IllegalArgumentException("Aspect " + type + " must have angle "
                    + type.getExactAngle() + ", got " + angle);
        }
        return new AspectDefinition(type, angle, orb, quality);
    }

    static AspectQuality defaultQuality(AspectType type) {
        return switch (type) {
            case CONJUNCTION -> AspectQuality.NEUTRAL;
            case SEXTILE, TRINE -> AspectQuality.SOFT;
            case SQUARE, OPPOSITION -> AspectQuality.HARD;
            case SEMISQUARE, SESQUIQUADRATE, QUINCUNX -> AspectQuality.MINOR;
        };
    }

    private static String requireAtom(SNode.SList list, int index) {
        String value = list.atom(index);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Missing value at position " + index + " in " + list);
        }
        return value;
    }

    private static double parseDouble(SNode.SList list, int index) {
        String value = requireAtom(list, index);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: '" + value + "' in " + list, e);
        }
    }

    private static int parseInt(SNode.SList list, int index) {
        String value = requireAtom(list, index);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: '" + value + "' in " + list, e);
        }
    }
}
