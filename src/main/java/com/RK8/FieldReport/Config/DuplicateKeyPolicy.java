package com.RK8.FieldReport.Config;

/**
 * Which record survives when a counter or user key appears more than once in an extract.
 */
public enum DuplicateKeyPolicy {
    FIRST_WINS,
    LAST_WINS
}
