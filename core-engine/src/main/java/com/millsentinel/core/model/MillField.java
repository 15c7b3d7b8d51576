package com.millsentinel.core.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Numeric sensor channels recorded for every mill reading.
 *
 * <p>
 * Each constant carries the column name used by the plant historian export,
 * so fields can be resolved either by constant name ({@code SEPARATOR_KW}) or
 * by column name ({@code "Sep KW"}).
 * </p>
 *
 * @since 1.0.0
 */
public enum MillField {

    MILL_TPH("Mill TPH"),
    CLINKER_TPH("Clinker TPH"),
    GYPSUM_TPH("Gypsum TPH"),
    DRY_FLY_ASH_TPH("DFA TPH"),
    WET_FLY_ASH_TPH("WFA TPH"),
    MILL_KW("Mill KW"),
    MILL_INLET_TEMP("Mill I/L Temp"),
    MILL_OUTLET_TEMP("Mill O/L Temp"),
    SEPARATOR_RPM("Sep RPM"),
    SEPARATOR_KW("Sep KW"),
    VENT_FAN_RPM("Mill Vent Fan RPM"),
    VENT_FAN_KW("Mill Vent Fan KW"),
    CA_FAN_KW("CA Fan KW"),
    RESIDUE("Residue"),
    REJECT("Reject");

    /** Column holding the reading timestamp in the historian export. */
    public static final String TIMESTAMP_COLUMN = "Date & Time";

    /** Fields whose values together identify duplicate readings. */
    public static final Set<MillField> DEDUP_KEY = EnumSet.of(
            MILL_TPH, CLINKER_TPH, GYPSUM_TPH, DRY_FLY_ASH_TPH, WET_FLY_ASH_TPH,
            MILL_KW, MILL_INLET_TEMP, MILL_OUTLET_TEMP);

    private final String columnName;

    MillField(String columnName) {
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }

    /**
     * Resolve a field by constant name or column name, ignoring case and
     * surrounding whitespace.
     *
     * @param name constant or column name; must not be {@code null}
     * @return the matching field
     * @throws IllegalArgumentException if nothing matches
     */
    public static MillField fromName(String name) {
        Objects.requireNonNull(name, "Field name must not be null");
        return lookup(name).orElseThrow(
                () -> new IllegalArgumentException("Unknown mill field: '" + name + "'"));
    }

    /**
     * @param name constant or column name, may be {@code null}
     * @return {@code true} if {@link #fromName(String)} would succeed
     */
    public static boolean isKnown(String name) {
        return name != null && lookup(name).isPresent();
    }

    private static Optional<MillField> lookup(String name) {
        String trimmed = name.trim();
        for (MillField field : values()) {
            if (field.name().equalsIgnoreCase(trimmed)
                    || field.columnName.equalsIgnoreCase(trimmed)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
