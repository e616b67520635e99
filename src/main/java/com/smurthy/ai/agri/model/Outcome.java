package com.smurthy.ai.agri.model;

/**
 * How a single specialist invocation ended.
 */
public enum Outcome {
    SUCCESS,
    FAILURE,
    TIMEOUT
}
