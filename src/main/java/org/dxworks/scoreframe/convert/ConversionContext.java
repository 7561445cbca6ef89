package org.dxworks.scoreframe.convert;

import org.dxworks.scoreframe.musicxml.model.PartSymbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Mutable state of exactly one conversion call: identity allocation, cross-format identity mapping,
 * part staff registration, part symbols and the warning log.
 * <p>
 * Never touches the common tree or the extension store. Not thread-safe; independent conversions
 * each get their own instance.
 */
public final class ConversionContext {

    public static final String DEFAULT_ID_PREFIX = "ly";

    private final String idPrefix;
    private long idCounter;

    private final Map<String, String> sourceToTarget = new HashMap<>();
    private final Map<String, String> targetToSource = new HashMap<>();
    private final Map<String, Map<Integer, Integer>> partStaves = new LinkedHashMap<>();
    private final Map<String, PartSymbol> partSymbols = new HashMap<>();
    private final List<ConversionWarning> warnings = new ArrayList<>();

    public ConversionContext() {
        this(DEFAULT_ID_PREFIX);
    }

    public ConversionContext(String idPrefix) {
        if (idPrefix == null || idPrefix.isBlank()) {
            throw new IllegalArgumentException("Identity prefix must not be blank");
        }
        this.idPrefix = idPrefix;
    }

    public String getIdPrefix() {
        return idPrefix;
    }

    /**
     * Returns {@code <idPrefix>-<prefix>-<n>}; n grows across all prefixes, so identities never collide.
     */
    public String generateId(String prefix) {
        idCounter++;
        return idPrefix + "-" + prefix + "-" + idCounter;
    }

    public void mapId(String sourceId, String targetId) {
        sourceToTarget.put(sourceId, targetId);
        targetToSource.putIfAbsent(targetId, sourceId);
    }

    public Optional<String> resolveId(String sourceId) {
        return Optional.ofNullable(sourceToTarget.get(sourceId));
    }

    /**
     * First source identity mapped onto the given target identity.
     */
    public Optional<String> reverseResolveId(String targetId) {
        return Optional.ofNullable(targetToSource.get(targetId));
    }

    public void registerPartStaff(String partId, int localStaff, int globalStaff) {
        partStaves.computeIfAbsent(partId, k -> new TreeMap<>()).put(localStaff, globalStaff);
    }

    public Optional<Integer> globalStaffForPart(String partId, int localStaff) {
        Map<Integer, Integer> staves = partStaves.get(partId);
        return staves == null ? Optional.empty() : Optional.ofNullable(staves.get(localStaff));
    }

    /**
     * Number of staves registered for the part, at least 1.
     */
    public int stavesForPart(String partId) {
        Map<Integer, Integer> staves = partStaves.get(partId);
        return staves == null || staves.isEmpty() ? 1 : staves.size();
    }

    public void setPartSymbol(String partId, PartSymbol symbol) {
        partSymbols.put(partId, symbol);
    }

    public Optional<PartSymbol> partSymbol(String partId) {
        return Optional.ofNullable(partSymbols.get(partId));
    }

    public void addWarning(String location, String message) {
        warnings.add(new ConversionWarning(location, message));
    }

    public List<ConversionWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public <T> ConversionResult<T> result(T value) {
        return new ConversionResult<>(value, warnings);
    }
}
