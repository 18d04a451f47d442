package nl.bytesoflife.natalchart.aspect;

import nl.bytesoflife.natalchart.model.AspectType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aspect table plus pair category factors. Definitions keep their declaration order, which
 * decides ties between aspect types matching with the same orb.
 */
public final class OrbProfile {

    private final String name;
    private final int version;
    private final List<AspectDefinition> definitions;
    private final Map<PairCategory, Double> pairFactors;

    public OrbProfile(String name, int version, List<AspectDefinition> definitions,
                      Map<PairCategory, Double> pairFactors) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Profile name is required");
        }
        Map<PairCategory, Double> factors = new EnumMap<>(PairCategory.class);
        for (PairCategory category : PairCategory.values()) {
            factors.put(category, 1.0);
        }
        factors.putAll(pairFactors);
        for (Map.Entry<PairCategory, Double> e : factors.entrySet()) {
            if (!(e.getValue() >= 0)) {
                throw new IllegalArgumentException("Pair factor for " + e.getKey() + " must be >= 0: " + e.getValue());
            }
        }
        List<AspectType> seen = new ArrayList<>();
        for (AspectDefinition definition : definitions) {
            if (seen.contains(definition.type())) {
                throw new IllegalArgumentException("Duplicate aspect in profile " + name + ": " + definition.type());
            }
            seen.add(definition.type());
        }
        this.name = name;
        this.version = version;
        this.definitions = List.copyOf(definitions);
        this.pairFactors = Collections.unmodifiableMap(factors);
    }

    public String getName() { return name; }
    public int getVersion() { return version; }
    public List<AspectDefinition> getDefinitions() { return definitions; }
    public Map<PairCategory, Double> getPairFactors() { return pairFactors; }

    public double pairFactor(PairCategory category) {
        return pairFactors.get(category);
    }

    public AspectDefinition definition(AspectType type) {
        for (AspectDefinition definition : definitions) {
            if (definition.type() == type) {
                return definition;
            }
        }
        return null;
    }

    /** Copy with the base orb of the given types replaced. Types not in the profile are ignored. */
    public OrbProfile withOrbOverrides(Map<AspectType, Double> overrides) {
        if (overrides.isEmpty()) {
            return this;
        }
        List<AspectDefinition> result = new ArrayList<>(definitions.size());
        for (AspectDefinition definition : definitions) {
            Double orb = overrides.get(definition.type());
            result.add(orb != null ? definition.withOrb(orb) : definition);
        }
        return new OrbProfile(name, version, result, pairFactors);
    }

    /** Copy keeping only the given types, in their original order. */
    public OrbProfile restrictedTo(Collection<AspectType> enabled) {
        Set<AspectType> keep = enabled.isEmpty() ? Set.of() : Set.copyOf(enabled);
        List<AspectDefinition> result = definitions.stream()
                .filter(d -> keep.contains(d.type()))
                .toList();
        return new OrbProfile(name, version, result, pairFactors);
    }

    @Override
    public String toString() {
        return "OrbProfile{name=" + name + ", version=" + version + ", aspects=" + definitions.size() + "}";
    }
}
