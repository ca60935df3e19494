package com.conveyal.volumes.models;

/**
 * The direction a vehicle is travelling as it enters the intersection.
 *
 * Eastbound and southbound movements are displayed PM first, as (PM)AM. Westbound and northbound movements are
 * displayed AM first, as AM(PM). This is the labelling convention of the downstream simulation tooling.
 */
public enum Approach {
    EAST('E', true),
    WEST('W', false),
    NORTH('N', false),
    SOUTH('S', true);

    public final char letter;

    public final boolean pmFirst;

    Approach (char letter, boolean pmFirst) {
        this.letter = letter;
        this.pmFirst = pmFirst;
    }
}
