package com.guno.drawimport.dto.internal;

import com.guno.drawimport.entity.DrawRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Records and counters of one pinned pagination run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaginationOutcome {

    @Builder.Default
    private List<DrawRecord> records = new ArrayList<>();

    @Builder.Default
    private List<ErrorReport> rejections = new ArrayList<>();

    private int pagesFetched;

    private int rowsSeen;

    private int apiCalls;

    private PageStopReason stopReason;
}
