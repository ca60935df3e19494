package com.conveyal.volumes.processing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Non-fatal anomalies found during one processing run. None of these stop the run; they are logged as they occur,
 * summarized at the end, and handed back to the caller with the outputs.
 */
public class RunWarnings {

    /** Header-level observations, such as a geometry file with fewer than sixteen movement columns. */
    public final List<String> notes = new ArrayList<>();

    /** Volume rows that replaced an earlier row for the same intersection, as "PERIOD:intersectionId". */
    public final List<String> replacedVolumeRows = new ArrayList<>();

    /** Geometry lines dropped while parsing, with the reason. */
    public final List<String> droppedGeometryLines = new ArrayList<>();

    /** Geometry records skipped because HANDLE, BLOCKNAME or NODE_ID was blank, with the reason. */
    public final List<String> incompleteRecords = new ArrayList<>();

    public final Set<String> duplicateHandles = new LinkedHashSet<>();

    /** NODE_IDs from the geometry file that had no merged volumes. */
    public final Set<String> unmatchedNodeIds = new LinkedHashSet<>();

    /** HANDLEs for which no ATTIN line was written, whether incomplete or unmatched. */
    public final Set<String> handlesNotGenerated = new LinkedHashSet<>();

    @JsonIgnore
    public boolean isEmpty () {
        return notes.isEmpty() && replacedVolumeRows.isEmpty() && droppedGeometryLines.isEmpty()
                && incompleteRecords.isEmpty() && duplicateHandles.isEmpty() && unmatchedNodeIds.isEmpty()
                && handlesNotGenerated.isEmpty();
    }

    public String summary () {
        return String.format("%d notes, %d replaced volume rows, %d dropped geometry lines, %d incomplete records, " +
                        "%d duplicate handles, %d unmatched node IDs",
                notes.size(), replacedVolumeRows.size(), droppedGeometryLines.size(), incompleteRecords.size(),
                duplicateHandles.size(), unmatchedNodeIds.size());
    }

    void logSummary (Logger log) {
        if (!unmatchedNodeIds.isEmpty()) {
            log.warn("Summary: {} unique Node IDs from ATTOUT not found in merged data: {}",
                    unmatchedNodeIds.size(), unmatchedNodeIds);
        }
        if (!handlesNotGenerated.isEmpty()) {
            log.warn("Summary: ATTIN lines not generated for {} HANDLEs due to issues.", handlesNotGenerated.size());
        }
        if (!droppedGeometryLines.isEmpty()) {
            log.warn("Summary: {} ATTOUT lines dropped as malformed.", droppedGeometryLines.size());
        }
    }
}
