package com.guno.drawimport.api.explore;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable dimension lists the candidate search is built from. Lists are copied on
 * construction, so later config changes do not alter a running search.
 */
@Value
public class SearchDimensions {

    List<String> endpoints;
    List<String> dateKeys;
    List<DateFormatVariant> dateFormats;
    List<String> pageKeys;
    List<String> methods;
    List<String> pageSizeKeys;
    List<Integer> pageIndexOrigins;

    @Builder
    private SearchDimensions(List<String> endpoints, List<String> dateKeys, List<DateFormatVariant> dateFormats,
                             List<String> pageKeys, List<String> methods, List<String> pageSizeKeys,
                             List<Integer> pageIndexOrigins) {
        this.endpoints = copy(endpoints);
        this.dateKeys = copy(dateKeys);
        this.dateFormats = copy(dateFormats);
        this.pageKeys = copy(pageKeys);
        this.methods = copy(methods);
        this.pageSizeKeys = copy(pageSizeKeys);
        this.pageIndexOrigins = copy(pageIndexOrigins);
    }

    /**
     * Number of candidates the product yields.
     */
    public long size() {
        return (long) endpoints.size() * dateKeys.size() * dateFormats.size() * pageKeys.size()
                * methods.size() * pageSizeKeys.size() * pageIndexOrigins.size();
    }

    private static <T> List<T> copy(List<T> in) {
        return in == null ? List.of() : List.copyOf(in);
    }
}
