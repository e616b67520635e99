package com.smurthy.ai.agri.model;

/**
 * Time horizon a recommendation belongs to. Declaration order is presentation order.
 */
public enum Horizon {
    IMMEDIATE_ACTION,
    SHORT_TERM_PLAN,
    LONG_TERM_STRATEGY,
    RISK_MITIGATION,
    OPPORTUNITY
}
