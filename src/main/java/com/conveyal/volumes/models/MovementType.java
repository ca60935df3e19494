package com.conveyal.volumes.models;

public enum MovementType {
    U_TURN('U'),
    LEFT('L'),
    THROUGH('T'),
    RIGHT('R');

    public final char letter;

    MovementType (char letter) {
        this.letter = letter;
    }
}
