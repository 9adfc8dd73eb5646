package com.guno.drawimport.mapper;

/**
 * What to use as super number when neither an explicit field nor a 21st token exists.
 */
public enum SuperFallback {
    /** Last of the 20 balls in source order. */
    LAST_BALL,
    /** Leave it absent; the record is then incomplete. */
    NONE
}
