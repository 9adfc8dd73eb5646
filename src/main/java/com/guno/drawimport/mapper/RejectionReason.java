package com.guno.drawimport.mapper;

public enum RejectionReason {
    EMPTY_PERIOD,
    INSUFFICIENT_BALLS
}
