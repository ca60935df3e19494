package com.conveyal.volumes.models;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * One data row of an ATTOUT geometry file. Fields are trimmed and padded with empty strings to the header width.
 */
public class GeometryRecord {

    /** One-based line number in the source file, for reporting. */
    public final int lineNumber;

    private final GeometryHeader header;

    private final ImmutableList<String> fields;

    public GeometryRecord (GeometryHeader header, int lineNumber, List<String> fields) {
        if (fields.size() != header.width()) {
            throw new IllegalArgumentException(String.format(
                    "Line %d has %d fields but the header has %d columns.", lineNumber, fields.size(), header.width()));
        }
        this.header = header;
        this.lineNumber = lineNumber;
        this.fields = ImmutableList.copyOf(fields);
    }

    public String getHandle () {
        return fields.get(header.handleIndex);
    }

    public String getBlockName () {
        return fields.get(header.blockNameIndex);
    }

    public String getNodeId () {
        return fields.get(header.nodeIdIndex);
    }

    /** @return the value of the named column, or null if the header has no such column. */
    public String get (String columnName) {
        int index = header.indexOf(columnName);
        return index < 0 ? null : fields.get(index);
    }

    public List<String> getFields () {
        return fields;
    }

    /** True if HANDLE, BLOCKNAME and NODE_ID are all non-blank. */
    public boolean hasIdentity () {
        return !Strings.isNullOrEmpty(getHandle())
                && !Strings.isNullOrEmpty(getBlockName())
                && !Strings.isNullOrEmpty(getNodeId());
    }

    @Override
    public String toString () {
        return String.format("GeometryRecord[line %d, HANDLE=%s, BLOCKNAME=%s, NODE_ID=%s]",
                lineNumber, getHandle(), getBlockName(), getNodeId());
    }
}
