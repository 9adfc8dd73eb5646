package com.guno.drawimport.dto.internal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * On-disk shape of one draw: {period, date, balls, super}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"period", "date", "balls", "super"})
public class StoredDrawDto {

    @JsonProperty("period")
    private String period;

    /** yyyy-MM-dd, empty when unknown. */
    @JsonProperty("date")
    private String date;

    @JsonProperty("balls")
    private List<Integer> balls;

    @JsonProperty("super")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private Integer superNumber;
}
