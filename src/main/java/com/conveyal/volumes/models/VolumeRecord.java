package com.conveyal.volumes.models;

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * The counted volumes at one intersection for one period. A movement with no usable count holds an empty
 * OptionalDouble, never zero.
 */
public class VolumeRecord {

    /** Opaque intersection identifier, compared by exact string equality. */
    public final String intersectionId;

    private final Map<MovementCode, OptionalDouble> volumes = new EnumMap<>(MovementCode.class);

    public VolumeRecord (String intersectionId) {
        this.intersectionId = intersectionId;
    }

    public void setVolume (MovementCode movement, OptionalDouble volume) {
        volumes.put(movement, volume);
    }

    public OptionalDouble getVolume (MovementCode movement) {
        return volumes.getOrDefault(movement, OptionalDouble.empty());
    }

    @Override
    public String toString () {
        return String.format("VolumeRecord[%s %s]", intersectionId, volumes);
    }
}
