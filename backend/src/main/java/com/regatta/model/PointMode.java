package com.regatta.model;

/**
 * Who is credited for a lane when a ranking is kept per club.
 */
public enum PointMode {
    SKIFF_ATHLETE,
    CREW_CLUB,
    MIXED
}
