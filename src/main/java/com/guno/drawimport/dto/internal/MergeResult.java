package com.guno.drawimport.dto.internal;

import com.guno.drawimport.entity.DrawStore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of reconciling incoming records into a store
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeResult {

    private DrawStore store;

    /** True iff the serialized store differs from the serialized input store. */
    private boolean changed;

    private int added;

    /** Incomplete entries replaced by complete ones. */
    private int upgraded;

    /** Complete incoming records disagreeing with a complete stored one; not applied. */
    private int conflicts;

    /** Incoming records that left the store untouched. */
    private int ignored;
}
