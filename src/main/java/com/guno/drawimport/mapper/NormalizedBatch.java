package com.guno.drawimport.mapper;

import com.guno.drawimport.dto.internal.ErrorReport;
import com.guno.drawimport.entity.DrawRecord;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Accepted records and rejection diagnostics of one normalized page
 */
@Data
public class NormalizedBatch {

    private final List<DrawRecord> records = new ArrayList<>();

    private final List<ErrorReport> rejections = new ArrayList<>();
}
