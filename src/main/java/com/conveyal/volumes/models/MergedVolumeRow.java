package com.conveyal.volumes.models;

import java.util.EnumMap;
import java.util.Map;

/**
 * The AM and PM volumes at one intersection, present whenever either period had a record for it.
 */
public class MergedVolumeRow {

    public final String intersectionId;

    private final Map<MovementCode, MergedVolume> volumes = new EnumMap<>(MovementCode.class);

    public MergedVolumeRow (String intersectionId) {
        this.intersectionId = intersectionId;
    }

    public void setVolume (MovementCode movement, MergedVolume volume) {
        volumes.put(movement, volume);
    }

    public MergedVolume getVolume (MovementCode movement) {
        return volumes.getOrDefault(movement, MergedVolume.EMPTY);
    }

    /** The combined display string for a movement, as written to the merged CSV. */
    public String render (MovementCode movement) {
        return getVolume(movement).render(movement.approach);
    }

    /** As {@link #render(MovementCode)}, but a movement with no value in either period renders as an empty field. */
    public String renderForAttin (MovementCode movement) {
        MergedVolume volume = getVolume(movement);
        return volume.isEmpty() ? "" : volume.render(movement.approach);
    }
}
