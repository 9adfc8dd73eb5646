package com.guno.drawimport.dto.internal;

import com.guno.drawimport.api.explore.CandidateRequestShape;
import com.guno.drawimport.entity.DrawRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What one acquisition run produced, before merging
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AcquisitionResult {

    private RunState state;

    /** "API", "HTML" or null when exhausted. */
    private String source;

    @Builder.Default
    private List<DrawRecord> records = new ArrayList<>();

    @Builder.Default
    private List<ErrorReport> rejections = new ArrayList<>();

    private CandidateRequestShape pinnedShape;

    private String htmlUrl;

    private PageStopReason stopReason;

    private int candidatesTried;

    private int apiCalls;

    private int htmlCalls;

    private int pagesFetched;

    public boolean isExhausted() {
        return state == RunState.EXHAUSTED;
    }
}
