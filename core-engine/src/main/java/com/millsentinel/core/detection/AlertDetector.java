package com.millsentinel.core.detection;

import com.millsentinel.core.model.Reading;

import java.util.List;

/**
 * Contract for all alert detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: every call to
 * {@link #evaluate(List)} derives its reference statistics from the readings
 * it is given, so the same readings always produce the same report and one
 * instance may be shared across threads.
 * </p>
 */
public interface AlertDetector {

    /**
     * Evaluate the rule against a reading collection.
     *
     * @param readings the readings to scan; never modified
     * @return the alerts raised, possibly none
     */
    AlertReport evaluate(List<Reading> readings);

    /**
     * Return the unique name of the rule this detector enforces.
     *
     * @return rule name
     */
    String getRuleName();
}
