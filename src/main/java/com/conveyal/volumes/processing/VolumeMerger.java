package com.conveyal.volumes.processing;

import com.conveyal.volumes.models.MergedVolume;
import com.conveyal.volumes.models.MergedVolumeRow;
import com.conveyal.volumes.models.MergedVolumeTable;
import com.conveyal.volumes.models.MovementCode;
import com.conveyal.volumes.models.VolumeRecord;
import com.conveyal.volumes.models.VolumeTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Full outer join of an AM and a PM volume table on intersection ID. An intersection counted in only one period
 * has "no value" for every movement of the other.
 */
public class VolumeMerger {

    private static final Logger LOG = LoggerFactory.getLogger(VolumeMerger.class);

    private final ImmutableList<MovementCode> movements;

    public VolumeMerger () {
        this(MovementCode.CANONICAL_ORDER);
    }

    public VolumeMerger (List<MovementCode> movements) {
        this.movements = ImmutableList.copyOf(movements);
    }

    public MergedVolumeTable merge (VolumeTable am, VolumeTable pm) {
        LOG.info("Merging {} AM and {} PM volume records...", am.size(), pm.size());
        Set<String> intersectionIds = Sets.union(am.intersectionIds(), pm.intersectionIds());
        MergedVolumeTable merged = new MergedVolumeTable();
        for (String intersectionId : intersectionIds) {
            VolumeRecord amRecord = am.get(intersectionId);
            VolumeRecord pmRecord = pm.get(intersectionId);
            MergedVolumeRow row = new MergedVolumeRow(intersectionId);
            for (MovementCode movement : movements) {
                row.setVolume(movement, new MergedVolume(volumeOf(amRecord, movement), volumeOf(pmRecord, movement)));
            }
            merged.put(row);
        }
        LOG.info("Merged data has {} nodes.", merged.size());
        return merged;
    }

    private static OptionalDouble volumeOf (VolumeRecord record, MovementCode movement) {
        return record == null ? OptionalDouble.empty() : record.getVolume(movement);
    }
}
