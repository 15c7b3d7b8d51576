package com.millsentinel.core.stats;

import com.millsentinel.core.error.EmptyInputException;
import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Extraction of the present values of one field, in collection order.
 */
final class FieldValues {

    private FieldValues() {
        // utility class — not instantiable
    }

    /**
     * @return the values of {@code field} present on {@code readings}
     * @throws EmptyInputException if no reading carries the field
     */
    static double[] of(List<Reading> readings, MillField field) {
        Objects.requireNonNull(readings, "Readings must not be null");
        Objects.requireNonNull(field, "Field must not be null");
        if (readings.isEmpty()) {
            throw new EmptyInputException("No readings to analyze for " + field);
        }
        double[] values = readings.stream()
                .map(r -> r.getNumericField(field))
                .filter(Optional::isPresent)
                .mapToDouble(Optional::get)
                .toArray();
        if (values.length == 0) {
            throw new EmptyInputException("No values recorded for " + field
                    + " across " + readings.size() + " reading(s)");
        }
        return values;
    }
}
