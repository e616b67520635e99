package com.smurthy.ai.agri.model;

/**
 * Recommendation priority, highest first.
 */
public enum Priority {
    HIGH,
    MEDIUM,
    LOW
}
