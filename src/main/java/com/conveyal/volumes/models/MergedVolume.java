package com.conveyal.volumes.models;

import java.util.OptionalDouble;

/**
 * The AM and PM volumes for one movement at one intersection. Presence is carried through unrendered so that
 * "no value in either period" can be detected without looking at display strings.
 */
public final class MergedVolume {

    /** Placeholder rendered for a period with no value. */
    public static final String NO_VALUE = "-";

    public static final MergedVolume EMPTY = new MergedVolume(OptionalDouble.empty(), OptionalDouble.empty());

    public final OptionalDouble am;

    public final OptionalDouble pm;

    public MergedVolume (OptionalDouble am, OptionalDouble pm) {
        this.am = am;
        this.pm = pm;
    }

    public boolean isEmpty () {
        return !am.isPresent() && !pm.isPresent();
    }

    /**
     * Render the combined display string for a movement on the given approach: (PM)AM when the approach is
     * displayed PM first, otherwise AM(PM). Values are truncated to integers.
     */
    public String render (Approach approach) {
        String amText = formatVolume(am);
        String pmText = formatVolume(pm);
        if (approach.pmFirst) {
            return "(" + pmText + ")" + amText;
        } else {
            return amText + "(" + pmText + ")";
        }
    }

    static String formatVolume (OptionalDouble volume) {
        if (!volume.isPresent()) return NO_VALUE;
        return Long.toString((long) volume.getAsDouble());
    }

    @Override
    public String toString () {
        return String.format("MergedVolume[am=%s, pm=%s]", formatVolume(am), formatVolume(pm));
    }
}
