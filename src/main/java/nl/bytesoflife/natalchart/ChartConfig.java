package nl.bytesoflife.natalchart;

import nl.bytesoflife.natalchart.aspect.OrbProfile;
import nl.bytesoflife.natalchart.model.AspectType;
import nl.bytesoflife.natalchart.model.Body;
import nl.bytesoflife.natalchart.model.HouseSystem;
import nl.bytesoflife.natalchart.model.NodeMode;
import nl.bytesoflife.natalchart.parser.BuiltinOrbProfiles;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Options of a chart request. Immutable; create with {@link #builder()}.
 */
public final class ChartConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final HouseSystem houseSystem;
    private final boolean includeChiron;
    private final boolean includeLilith;
    private final NodeMode includeNodes;
    private final String language;
    private final Map<AspectType, Double> maxOrbOverrides;
    private final OrbProfile orbProfile;
    private final Set<AspectType> enabledAspects;
    private final boolean includeAngleAspects;
    private final boolean includeDignities;
    private final Duration computationTimeout;

    private ChartConfig(Builder b) {
        this.houseSystem = b.houseSystem;
        this.includeChiron = b.includeChiron;
        this.includeLilith = b.includeLilith;
        this.includeNodes = b.includeNodes;
        this.language = b.language;
        this.maxOrbOverrides = Collections.unmodifiableMap(new EnumMap<>(b.maxOrbOverrides));
        this.orbProfile = b.orbProfile;
        this.enabledAspects = b.enabledAspects == null ? null : Collections.unmodifiableSet(EnumSet.copyOf(b.enabledAspects));
        this.includeAngleAspects = b.includeAngleAspects;
        this.includeDignities = b.includeDignities;
        this.computationTimeout = b.computationTimeout;
    }

    public static ChartConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .houseSystem(houseSystem)
                .includeChiron(includeChiron)
                .includeLilith(includeLilith)
                .includeNodes(includeNodes)
                .language(language)
                .orbProfile(orbProfile)
                .includeAngleAspects(includeAngleAspects)
                .includeDignities(includeDignities)
                .computationTimeout(computationTimeout);
        b.maxOrbOverrides.putAll(maxOrbOverrides);
        if (enabledAspects != null) {
            b.enabledAspects(enabledAspects);
        }
        return b;
    }

    public HouseSystem getHouseSystem() { return houseSystem; }
    public boolean isIncludeChiron() { return includeChiron; }
    public boolean isIncludeLilith() { return includeLilith; }
    public NodeMode getIncludeNodes() { return includeNodes; }
    public String getLanguage() { return language; }
    public Map<AspectType, Double> getMaxOrbOverrides() { return maxOrbOverrides; }

    /** The configured profile, or null when the built-in default is used. */
    public OrbProfile getOrbProfile() { return orbProfile; }

    /** Enabled aspect types, or null when every type of the profile is enabled. */
    public Set<AspectType> getEnabledAspects() { return enabledAspects; }

    public boolean isIncludeAngleAspects() { return includeAngleAspects; }
    public boolean isIncludeDignities() { return includeDignities; }
    public Duration getComputationTimeout() { return computationTimeout; }

    /** Bodies a chart built with this configuration contains, in canonical order. */
    public List<Body> bodies() {
        List<Body> bodies = new ArrayList<>(Body.CLASSICAL);
        if (includeChiron) bodies.add(Body.CHIRON);
        if (includeLilith) bodies.add(Body.MEAN_LILITH);
        switch (includeNodes) {
            case MEAN -> bodies.add(Body.MEAN_NODE);
            case TRUE -> bodies.add(Body.TRUE_NODE);
            case NONE -> {
            }
        }
        return List.copyOf(bodies);
    }

    /** Orb profile with overrides and the enabled subset applied. */
    public OrbProfile effectiveOrbProfile() {
        OrbProfile profile = orbProfile != null ? orbProfile : BuiltinOrbProfiles.defaultProfile();
        profile = profile.withOrbOverrides(maxOrbOverrides);
        if (enabledAspects != null) {
            profile = profile.restrictedTo(enabledAspects);
        }
        return profile;
    }

    @Override
    public String toString() {
        return "ChartConfig{houseSystem=" + houseSystem
                + ", chiron=" + includeChiron
                + ", lilith=" + includeLilith
                + ", nodes=" + includeNodes
                + ", language=" + language
                + ", orbProfile=" + (orbProfile != null ? orbProfile.getName() : BuiltinOrbProfiles.DEFAULT)
                + ", orbOverrides=" + maxOrbOverrides
                + ", enabledAspects=" + (enabledAspects != null ? enabledAspects : "all")
                + ", angleAspects=" + includeAngleAspects
                + ", dignities=" + includeDignities
                + ", timeout=" + computationTimeout.toMillis() + "ms}";
    }

    public static final class Builder {
        private HouseSystem houseSystem = HouseSystem.PLACIDUS;
        private boolean includeChiron;
        private boolean includeLilith;
        private NodeMode includeNodes = NodeMode.NONE;
        private String language = "en";
        private final Map<AspectType, Double> maxOrbOverrides = new EnumMap<>(AspectType.class);
        private OrbProfile orbProfile;
        private Set<AspectType> enabledAspects;
        private boolean includeAngleAspects;
        private boolean includeDignities = true;
        private Duration computationTimeout = DEFAULT_TIMEOUT;

        private Builder() {
        }

        public Builder houseSystem(HouseSystem houseSystem) {
            if (houseSystem == null) throw new IllegalArgumentException("House system must not be null");
            this.houseSystem = houseSystem;
            return this;
        }

        public Builder includeChiron(boolean includeChiron) {
            this.includeChiron = includeChiron;
            return this;
        }

        public Builder includeLilith(boolean includeLilith) {
            this.includeLilith = includeLilith;
            return this;
        }

        public Builder includeNodes(NodeMode includeNodes) {
            if (includeNodes == null) throw new IllegalArgumentException("Node mode must not be null");
            this.includeNodes = includeNodes;
            return this;
        }

        public Builder language(String language) {
            if (language == null || language.isBlank()) throw new IllegalArgumentException("Language must not be blank");
            this.language = language;
            return this;
        }

        public Builder maxOrb(AspectType type, double orb) {
            if (!(orb >= 0) || Double.isInfinite(orb)) {
                throw new IllegalArgumentException("Orb override for " + type + " must be a non-negative number: " + orb);
            }
            maxOrbOverrides.put(type, orb);
            return this;
        }

        public Builder maxOrbOverrides(Map<AspectType, Double> overrides) {
            overrides.forEach(this::maxOrb);
            return this;
        }

        public Builder orbProfile(OrbProfile orbProfile) {
            this.orbProfile = orbProfile;
            return this;
        }

        public Builder enabledAspects(Set<AspectType> enabledAspects) {
            this.enabledAspects = enabledAspects == null ? null : EnumSet.noneOf(AspectType.class);
            if (enabledAspects != null) {
                this.enabledAspects.addAll(enabledAspects);
            }
            return this;
        }

        public Builder enabledAspects(AspectType first, AspectType... rest) {
            return enabledAspects(EnumSet.of(first, rest));
        }

        public Builder includeAngleAspects(boolean includeAngleAspects) {
            this.includeAngleAspects = includeAngleAspects;
            return this;
        }

        public Builder includeDignities(boolean includeDignities) {
            this.includeDignities = includeDignities;
            return this;
        }

        public Builder computationTimeout(Duration computationTimeout) {
            if (computationTimeout == null || computationTimeout.isNegative() || computationTimeout.isZero()) {
                throw new IllegalArgumentException("Computation timeout must be positive: " + computationTimeout);
            }
            this.computationTimeout = computationTimeout;
            return this;
        }

        public ChartConfig build() {
            return new ChartConfig(this);
        }
    }
}
