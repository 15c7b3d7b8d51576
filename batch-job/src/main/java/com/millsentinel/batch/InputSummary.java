package com.millsentinel.batch;

import com.millsentinel.core.store.CleaningResult;

/**
 * Counts describing how the reading snapshot was obtained.
 *
 * @since 1.0.0
 */
public final class InputSummary {

    private final String source;
    private final int linesRead;
    private final int malformedLines;
    private final int removedMissingThroughput;
    private final int removedDuplicates;
    private final int readings;

    public InputSummary(String source, int linesRead, int malformedLines, CleaningResult cleaning) {
        this.source = source;
        this.linesRead = linesRead;
        this.malformedLines = malformedLines;
        this.removedMissingThroughput = cleaning.getRemovedMissingThroughput();
        this.removedDuplicates = cleaning.getRemovedDuplicates();
        this.readings = cleaning.getReadings().size();
    }

    public String getSource() {
        return source;
    }

    /**
     * @return non-blank lines in the input
     */
    public int getLinesRead() {
        return linesRead;
    }

    public int getMalformedLines() {
        return malformedLines;
    }

    public int getRemovedMissingThroughput() {
        return removedMissingThroughput;
    }

    public int getRemovedDuplicates() {
        return removedDuplicates;
    }

    /**
     * @return readings left for analysis
     */
    public int getReadings() {
        return readings;
    }

    @Override
    public String toString() {
        return "InputSummary{" +
                "source='" + source + '\'' +
                ", linesRead=" + linesRead +
                ", malformedLines=" + malformedLines +
                ", removedMissingThroughput=" + removedMissingThroughput +
                ", removedDuplicates=" + removedDuplicates +
                ", readings=" + readings +
                '}';
    }
}
