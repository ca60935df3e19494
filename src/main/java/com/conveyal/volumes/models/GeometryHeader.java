package com.conveyal.volumes.models;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The column layout of an ATTOUT geometry file, resolved once from its header line. Records are read positionally
 * against this layout.
 */
public class GeometryHeader {

    public static final String HANDLE = "HANDLE";
    public static final String BLOCKNAME = "BLOCKNAME";
    public static final String NODE_ID = "NODE_ID";

    public static final ImmutableList<String> REQUIRED_COLUMNS = ImmutableList.of(HANDLE, BLOCKNAME, NODE_ID);

    /** The header line as it appeared in the file, without its line terminator. */
    public final String rawLine;

    /** Trimmed column names in file order. */
    public final ImmutableList<String> columns;

    /**
     * The movement columns present in the header, in the order they appear there. A movement column repeated in the
     * header appears here once per occurrence so that output rows stay aligned with the header.
     */
    public final ImmutableList<MovementCode> movementOrder;

    private final ImmutableMap<String, Integer> indexByName;

    public final int handleIndex;
    public final int blockNameIndex;
    public final int nodeIdIndex;

    public GeometryHeader (String rawLine, List<String> columns) {
        this.rawLine = rawLine;
        this.columns = ImmutableList.copyOf(columns);

        ImmutableList.Builder<MovementCode> movements = ImmutableList.builder();
        ImmutableMap.Builder<String, Integer> indexes = ImmutableMap.builder();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i);
            MovementCode.fromColumnName(name).ifPresent(movements::add);
            // Lookups by name resolve to the first occurrence of a repeated column.
            if (seen.add(name)) indexes.put(name, i);
        }
        this.movementOrder = movements.build();
        this.indexByName = indexes.build();
        this.handleIndex = indexOf(HANDLE);
        this.blockNameIndex = indexOf(BLOCKNAME);
        this.nodeIdIndex = indexOf(NODE_ID);
    }

    /** @return the position of the named column, or -1 if the header does not contain it. */
    public int indexOf (String columnName) {
        Integer index = indexByName.get(columnName);
        return index == null ? -1 : index;
    }

    public boolean hasColumn (String columnName) {
        return indexByName.containsKey(columnName);
    }

    public int width () {
        return columns.size();
    }
}
