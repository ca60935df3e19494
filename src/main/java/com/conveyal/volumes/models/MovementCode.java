package com.conveyal.volumes.models;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Optional;

/**
 * One of the sixteen turning movements at an intersection, named by approach direction then movement type
 * (e.g. EBL is eastbound left). The declaration order is the canonical column order used in merged volume tables.
 */
public enum MovementCode {
    EBU(Approach.EAST, MovementType.U_TURN),
    EBL(Approach.EAST, MovementType.LEFT),
    EBT(Approach.EAST, MovementType.THROUGH),
    EBR(Approach.EAST, MovementType.RIGHT),
    WBU(Approach.WEST, MovementType.U_TURN),
    WBL(Approach.WEST, MovementType.LEFT),
    WBT(Approach.WEST, MovementType.THROUGH),
    WBR(Approach.WEST, MovementType.RIGHT),
    NBU(Approach.NORTH, MovementType.U_TURN),
    NBL(Approach.NORTH, MovementType.LEFT),
    NBT(Approach.NORTH, MovementType.THROUGH),
    NBR(Approach.NORTH, MovementType.RIGHT),
    SBU(Approach.SOUTH, MovementType.U_TURN),
    SBL(Approach.SOUTH, MovementType.LEFT),
    SBT(Approach.SOUTH, MovementType.THROUGH),
    SBR(Approach.SOUTH, MovementType.RIGHT);

    public static final ImmutableList<MovementCode> CANONICAL_ORDER = ImmutableList.copyOf(values());

    private static final ImmutableMap<String, MovementCode> BY_COLUMN_NAME;

    static {
        ImmutableMap.Builder<String, MovementCode> builder = ImmutableMap.builder();
        for (MovementCode code : values()) builder.put(code.name(), code);
        BY_COLUMN_NAME = builder.build();
    }

    public final Approach approach;

    public final MovementType type;

    MovementCode (Approach approach, MovementType type) {
        this.approach = approach;
        this.type = type;
    }

    /** Exact, case-sensitive match of a column name against the movement codes. */
    public static Optional<MovementCode> fromColumnName (String columnName) {
        return Optional.ofNullable(BY_COLUMN_NAME.get(columnName));
    }

    public static int count () {
        return CANONICAL_ORDER.size();
    }
}
