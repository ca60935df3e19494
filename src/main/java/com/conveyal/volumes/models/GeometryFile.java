package com.conveyal.volumes.models;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A parsed ATTOUT geometry export: its header and its usable data rows in order of appearance.
 */
public class GeometryFile {

    public final GeometryHeader header;

    public final ImmutableList<GeometryRecord> records;

    public GeometryFile (GeometryHeader header, List<GeometryRecord> records) {
        this.header = header;
        this.records = ImmutableList.copyOf(records);
    }
}
