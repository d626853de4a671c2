package com.missionguard.domain.model;

/**
 * Intelligence discipline ("INT lane") gating which data and templates a
 * mission may use.
 */
public enum IntLane {
    SIGINT,
    GEOINT,
    HUMINT,
    OSINT,
    SOCMINT,
    LEO_CRIMINT,
    FININT,
    MASINT,
    IMINT
}
