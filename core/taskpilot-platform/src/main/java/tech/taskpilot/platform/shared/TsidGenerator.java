package tech.taskpilot.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

/**
 * Centralized TSID generation for numeric entity ids.
 *
 * TSIDs are time-sortable 64-bit values, so task ids preserve creation order
 * and index well. They are exposed to tool callers as plain JSON integers.
 */
public final class TsidGenerator {

    private TsidGenerator() {
    }

    /**
     * Generate a new TSID as a long.
     */
    public static long generateLong() {
        return TsidCreator.getTsid().toLong();
    }
}
