package com.columncascade.core.relation;

import com.columncascade.core.model.TypeMapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup from (source platform, source type) to a target platform's type.
 *
 * <p>Platforms and types compare case-insensitively after trimming. An exact type match
 * is tried first, then the base type with any {@code (precision)} suffix removed, so a
 * mapping for {@code NVARCHAR} also covers {@code nvarchar(50)}. When the same key is
 * mapped twice the first entry wins.
 *
 * <p>Instances are immutable and never modified by the cascading engine.
 */
public final class TypeMappingTable {

    private final List<TypeMapping> mappings;
    private final Map<String, String> index;

    /**
     * Creates a table from mapping rows.
     *
     * @param mappings mapping rows, earlier rows take precedence
     */
    public TypeMappingTable(List<TypeMapping> mappings) {
        this.mappings = mappings == null ? List.of() : List.copyOf(mappings);
        Map<String, String> built = new LinkedHashMap<>();
        for (TypeMapping mapping : this.mappings) {
            built.putIfAbsent(
                key(mapping.sourcePlatform(), mapping.sourceDataType(), mapping.targetPlatform()),
                mapping.targetDataType());
        }
        this.index = Collections.unmodifiableMap(built);
    }

    /**
     * Creates an empty table.
     *
     * @return table without mappings
     */
    public static TypeMappingTable empty() {
        return new TypeMappingTable(List.of());
    }

    /**
     * Returns a table with additional rows that apply only where this table has no entry.
     *
     * @param fallback lower-precedence rows
     * @return combined table
     */
    public TypeMappingTable withFallback(List<TypeMapping> fallback) {
        if (fallback == null || fallback.isEmpty()) {
            return this;
        }
        List<TypeMapping> combined = new ArrayList<>(mappings);
        combined.addAll(fallback);
        return new TypeMappingTable(combined);
    }

    /**
     * Looks up the target type for a source type.
     *
     * @param sourcePlatform platform of the source type
     * @param sourceType source data type
     * @param targetPlatform platform to translate to
     * @return target type, or empty if no mapping exists
     */
    public Optional<String> lookup(String sourcePlatform, String sourceType, String targetPlatform) {
        if (sourceType == null || sourceType.isBlank()) {
            return Optional.empty();
        }
        String exact = index.get(key(sourcePlatform, sourceType, targetPlatform));
        if (exact != null) {
            return Optional.of(exact);
        }
        String baseType = baseType(sourceType);
        if (!baseType.equalsIgnoreCase(sourceType.trim())) {
            return Optional.ofNullable(index.get(key(sourcePlatform, baseType, targetPlatform)));
        }
        return Optional.empty();
    }

    /**
     * Returns the mapping rows in precedence order.
     *
     * @return mapping rows
     */
    public List<TypeMapping> mappings() {
        return mappings;
    }

    public int size() {
        return index.size();
    }

    /**
     * Strips a {@code (precision)} suffix from a type name.
     *
     * @param dataType data type such as {@code decimal(18,2)}
     * @return base type such as {@code decimal}
     */
    static String baseType(String dataType) {
        String trimmed = dataType.trim();
        int paren = trimmed.indexOf('(');
        return paren > 0 ? trimmed.substring(0, paren).trim() : trimmed;
    }

    private static String key(String sourcePlatform, String sourceType, String targetPlatform) {
        return normalize(sourcePlatform) + '|' + normalize(sourceType) + '|' + normalize(targetPlatform);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
