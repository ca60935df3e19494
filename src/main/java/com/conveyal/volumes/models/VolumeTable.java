package com.conveyal.volumes.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * All volume records loaded from one period's count export, keyed by intersection identifier in order of first
 * appearance.
 */
public class VolumeTable {

    public final Period period;

    private final Map<String, VolumeRecord> records = new LinkedHashMap<>();

    public VolumeTable (Period period) {
        this.period = period;
    }

    /**
     * Add a record, replacing any earlier record for the same intersection.
     * @return the replaced record, or null if the intersection was not already present.
     */
    public VolumeRecord put (VolumeRecord record) {
        return records.put(record.intersectionId, record);
    }

    public VolumeRecord get (String intersectionId) {
        return records.get(intersectionId);
    }

    public Set<String> intersectionIds () {
        return Collections.unmodifiableSet(records.keySet());
    }

    public int size () {
        return records.size();
    }
}
