package com.conveyal.volumes.models;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outer join of an AM and a PM volume table. Rows are kept sorted by intersection identifier so repeated runs over
 * the same inputs render identical files.
 */
public class MergedVolumeTable {

    private final SortedMap<String, MergedVolumeRow> rows = new TreeMap<>();

    public void put (MergedVolumeRow row) {
        rows.put(row.intersectionId, row);
    }

    public MergedVolumeRow get (String intersectionId) {
        return rows.get(intersectionId);
    }

    public Set<String> intersectionIds () {
        return Collections.unmodifiableSet(rows.keySet());
    }

    public Collection<MergedVolumeRow> rows () {
        return Collections.unmodifiableCollection(rows.values());
    }

    public int size () {
        return rows.size();
    }
}
