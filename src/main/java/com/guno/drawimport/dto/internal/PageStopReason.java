package com.guno.drawimport.dto.internal;

/**
 * Why a pinned pagination run stopped.
 */
public enum PageStopReason {
    TOTAL_COUNT_HINT,
    ROW_SHORTFALL,
    MAX_PAGES,
    EMPTY_PAGE,
    FETCH_FAILED
}
