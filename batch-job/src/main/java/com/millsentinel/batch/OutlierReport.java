package com.millsentinel.batch;

import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import com.millsentinel.core.stats.QuartileFrame;

import java.util.List;
import java.util.Map;

/**
 * Fences and flagged readings of one IQR outlier pass.
 *
 * @since 1.0.0
 */
public final class OutlierReport {

    private final double fenceMultiplier;
    private final Map<MillField, QuartileFrame> fences;
    private final List<Reading> outliers;

    OutlierReport(double fenceMultiplier, Map<MillField, QuartileFrame> fences, List<Reading> outliers) {
        this.fenceMultiplier = fenceMultiplier;
        this.fences = fences;
        this.outliers = List.copyOf(outliers);
    }

    public double getFenceMultiplier() {
        return fenceMultiplier;
    }

    public Map<MillField, QuartileFrame> getFences() {
        return fences;
    }

    /**
     * @return outliers, newest first
     */
    public List<Reading> getOutliers() {
        return outliers;
    }

    public int getCount() {
        return outliers.size();
    }
}
