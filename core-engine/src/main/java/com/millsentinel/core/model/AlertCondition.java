package com.millsentinel.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One threshold test inside an {@link AlertRule}.
 *
 * <p>
 * A condition compares a reading's {@code field} against
 * {@code multiplier × reference}, where the reference is either the mean of a
 * field over the analyzed readings ({@code reference: mean}, optionally of a
 * different {@code referenceField}) or a literal {@code value}
 * ({@code reference: constant}). Comparisons are strict.
 * </p>
 *
 * <pre>
 * - field: SEPARATOR_KW
 *   comparison: above
 *   reference: mean
 *   multiplier: 1.3
 * </pre>
 *
 * @since 1.0.0
 */
public class AlertCondition {

    /** Comparison keyword: value strictly greater than the threshold. */
    public static final String ABOVE = "above";

    /** Comparison keyword: value strictly less than the threshold. */
    public static final String BELOW = "below";

    /** Reference keyword: mean of a field over the analyzed readings. */
    public static final String MEAN = "mean";

    /** Reference keyword: literal {@link #getValue() value}. */
    public static final String CONSTANT = "constant";

    /** Field under test, by constant or column name. */
    private String field;

    /** {@code above} or {@code below}. */
    private String comparison = ABOVE;

    /** {@code mean} or {@code constant}. */
    private String reference = MEAN;

    /** Field whose mean is the reference; defaults to {@link #field}. */
    private String referenceField;

    /** Factor applied to the reference. */
    private double multiplier = 1.0;

    /** Literal reference for {@code constant} conditions; NaN when unset. */
    private double value = Double.NaN;

    public AlertCondition() {
    }

    // ---------------------------------------------------------------
    // Programmatic factories
    // ---------------------------------------------------------------

    public static AlertCondition aboveMean(MillField field, double multiplier) {
        return ofMean(field, ABOVE, multiplier);
    }

    public static AlertCondition belowMean(MillField field, double multiplier) {
        return ofMean(field, BELOW, multiplier);
    }

    public static AlertCondition aboveConstant(MillField field, double value) {
        AlertCondition condition = new AlertCondition();
        condition.setField(field.name());
        condition.setComparison(ABOVE);
        condition.setReference(CONSTANT);
        condition.setValue(value);
        return condition;
    }

    private static AlertCondition ofMean(MillField field, String comparison, double multiplier) {
        AlertCondition condition = new AlertCondition();
        condition.setField(field.name());
        condition.setComparison(comparison);
        condition.setReference(MEAN);
        condition.setMultiplier(multiplier);
        return condition;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Append a message to {@code errors} for every illegal setting.
     *
     * @param ruleName owning rule, for messages
     * @param errors   sink for validation messages
     */
    void validate(String ruleName, List<String> errors) {
        String prefix = "Rule '" + ruleName + "' condition on '" + field + "'";
        if (field == null || field.isBlank()) {
            errors.add("Rule '" + ruleName + "' has a condition without 'field'");
        } else if (!MillField.isKnown(field)) {
            errors.add(prefix + ": unknown field");
        }
        if (!ABOVE.equals(comparison) && !BELOW.equals(comparison)) {
            errors.add(prefix + ": 'comparison' must be above or below, got: " + comparison);
        }
        if (MEAN.equals(reference)) {
            if (referenceField != null && !MillField.isKnown(referenceField)) {
                errors.add(prefix + ": unknown referenceField '" + referenceField + "'");
            }
        } else if (CONSTANT.equals(reference)) {
            if (Double.isNaN(value)) {
                errors.add(prefix + ": constant reference requires 'value'");
            }
        } else {
            errors.add(prefix + ": 'reference' must be mean or constant, got: " + reference);
        }
        if (!Double.isFinite(multiplier) || multiplier <= 0) {
            errors.add(prefix + ": 'multiplier' must be > 0, got: " + multiplier);
        }
    }

    // ---------------------------------------------------------------
    // Resolved views
    // ---------------------------------------------------------------

    public MillField resolveField() {
        return MillField.fromName(field);
    }

    /**
     * @return the field whose mean is the reference, or {@code null} for a
     *         constant reference
     */
    public MillField resolveReferenceField() {
        if (!MEAN.equals(reference)) {
            return null;
        }
        return referenceField != null ? MillField.fromName(referenceField) : resolveField();
    }

    public boolean isAbove() {
        return ABOVE.equals(comparison);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public String getComparison() {
        return comparison;
    }

    public void setComparison(String comparison) {
        this.comparison = comparison != null ? comparison.toLowerCase(Locale.ROOT) : null;
    }

    public String getReference() {
        return reference;
    }

    public void setReference(String reference) {
        this.reference = reference != null ? reference.toLowerCase(Locale.ROOT) : null;
    }

    public String getReferenceField() {
        return referenceField;
    }

    public void setReferenceField(String referenceField) {
        this.referenceField = referenceField;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public void setMultiplier(double multiplier) {
        this.multiplier = multiplier;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertCondition that))
            return false;
        return Double.compare(multiplier, that.multiplier) == 0
                && Objects.equals(field, that.field)
                && Objects.equals(comparison, that.comparison)
                && Objects.equals(reference, that.reference)
                && Objects.equals(referenceField, that.referenceField)
                && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, comparison, reference, referenceField, multiplier, value);
    }

    @Override
    public String toString() {
        return CONSTANT.equals(reference)
                ? field + " " + comparison + " " + value
                : field + " " + comparison + " " + multiplier + " x mean("
                        + (referenceField != null ? referenceField : field) + ")";
    }
}
