package nl.bytesoflife.natalchart.parser;

import nl.bytesoflife.natalchart.aspect.OrbProfile;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Orb profiles bundled as classpath resources, loaded on first use.
 */
public class BuiltinOrbProfiles {

    public static final String DEFAULT = "default";
    public static final String TRADITIONAL = "traditional";

    private static volatile OrbProfile cachedDefault;
    private static volatile OrbProfile cachedTraditional;

    private BuiltinOrbProfiles() {
    }

    public static OrbProfile defaultProfile() {
        if (cachedDefault == null) {
            synchronized (BuiltinOrbProfiles.class) {
                if (cachedDefault == null) {
                    cachedDefault = load("/orb-profiles/default.orbs");
                }
            }
        }
        return cachedDefault;
    }

    /** Ptolemaic aspects only, with wider luminary orbs. */
    public static OrbProfile traditional() {
        if (cachedTraditional == null) {
            synchronized (BuiltinOrbProfiles.class) {
                if (cachedTraditional == null) {
                    cachedTraditional = load("/orb-profiles/traditional.orbs");
                }
            }
        }
        return cachedTraditional;
    }

    public static Map<String, OrbProfile> all() {
        return Map.of(DEFAULT, defaultProfile(), TRADITIONAL, traditional());
    }

    public static OrbProfile byName(String name) {
        OrbProfile profile = all().get(name.toLowerCase());
        if (profile == null) {
            throw new IllegalArgumentException("Unknown built-in orb profile: " + name);
        }
        return profile;
    }

    private static OrbProfile load(String resource) {
        try (InputStream is = BuiltinOrbProfiles.class.getResourceAsStream(resource)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + resource);
            return new OrbProfileParser().parse(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load orb profile " + resource, e);
        }
    }
}
