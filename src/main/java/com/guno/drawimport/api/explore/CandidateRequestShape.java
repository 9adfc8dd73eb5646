package com.guno.drawimport.api.explore;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpMethod;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One concrete guess at the remote API's parameter contract.
 */
@Value
@Builder
public class CandidateRequestShape {

    int ordinal;
    String endpoint;
    String dateKey;
    DateFormatVariant dateFormat;
    String pageKey;
    HttpMethod method;
    String pageSizeKey;
    int pageIndexOrigin;

    /**
     * Request parameters for the {@code pageOffset}-th page of this shape (0 = first page).
     */
    public Map<String, Object> parameters(LocalDate date, int pageOffset, int pageSize) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(dateKey, dateFormat.format(date));
        params.put(pageKey, pageIndexOrigin + pageOffset);
        params.put(pageSizeKey, pageSize);
        return params;
    }

    public String describe() {
        return String.format("#%d %s %s [%s=%s, %s, %s, origin=%d]",
                ordinal, method, endpoint, dateKey, dateFormat, pageKey, pageSizeKey, pageIndexOrigin);
    }
}
