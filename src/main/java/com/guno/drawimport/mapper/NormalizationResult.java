package com.guno.drawimport.mapper;

import com.guno.drawimport.entity.DrawRecord;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either a record or the reason the raw item was dropped.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NormalizationResult {

    DrawRecord record;
    RejectionReason reason;
    String period;
    String detail;

    public static NormalizationResult accepted(DrawRecord record) {
        return new NormalizationResult(record, null, record.getPeriod(), null);
    }

    public static NormalizationResult rejected(RejectionReason reason, String period, String detail) {
        return new NormalizationResult(null, reason, period, detail);
    }

    public boolean isAccepted() {
        return record != null;
    }
}
