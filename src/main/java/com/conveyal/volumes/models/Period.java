package com.conveyal.volumes.models;

/** The count period of a volume export. */
public enum Period {
    AM, PM
}
