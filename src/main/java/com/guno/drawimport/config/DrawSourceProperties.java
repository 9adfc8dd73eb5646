package com.guno.drawimport.config;

import com.guno.drawimport.api.explore.DateFormatVariant;
import com.guno.drawimport.api.explore.SearchDimensions;
import com.guno.drawimport.mapper.SuperFallback;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Draw Source Configuration - every tunable of the acquisition run
 *
 * Usage in application.yml:
 * bingo:
 *   api:
 *     endpoints: [...]
 *     date-keys: [openDate, date]
 *   pagination:
 *     page-size: 50
 *     max-pages: 20
 */
@Configuration
@ConfigurationProperties(prefix = "bingo")
@Data
public class DrawSourceProperties {

    /** Reference time zone for "today". */
    private String zone = "Asia/Taipei";

    private ApiSettings api = new ApiSettings();
    private HttpSettings http = new HttpSettings();
    private RetrySettings retry = new RetrySettings();
    private PaginationSettings pagination = new PaginationSettings();
    private HtmlSettings html = new HtmlSettings();
    private NormalizeSettings normalize = new NormalizeSettings();
    private StoreSettings store = new StoreSettings();
    private ArtifactSettings artifacts = new ArtifactSettings();
    private RunSettings run = new RunSettings();

    @Data
    public static class ApiSettings {
        private List<String> endpoints = new ArrayList<>();
        private List<String> dateKeys = new ArrayList<>(List.of("openDate"));
        private List<DateFormatVariant> dateFormats = new ArrayList<>(List.of(DateFormatVariant.ISO));
        private List<String> pageKeys = new ArrayList<>(List.of("pageNum"));
        private List<String> methods = new ArrayList<>(List.of("GET"));
        private List<String> pageSizeKeys = new ArrayList<>(List.of("pageSize"));
        private List<Integer> pageIndexOrigins = new ArrayList<>(List.of(1));
        private List<String> containerPaths = new ArrayList<>(List.of("content.bingoQueryResult", "$"));
        private List<String> totalCountPaths = new ArrayList<>(List.of("content.totalSize"));
        private Map<String, String> headers = new LinkedHashMap<>();
    }

    @Data
    public static class HttpSettings {
        private int connectTimeoutMs = 10_000;
        private int readTimeoutMs = 25_000;
        /** Fixed delay between two consecutive requests of a run. */
        private long pacingMs = 400;
    }

    @Data
    public static class RetrySettings {
        /** Attempts per shape for transport failures and 5xx, including the first one. */
        private int maxRetries = 3;
        private long backoffMs = 2_000;
    }

    @Data
    public static class PaginationSettings {
        private int pageSize = 50;
        private int maxPages = 20;
    }

    @Data
    public static class HtmlSettings {
        private List<String> urls = new ArrayList<>();
        private int pollAttempts = 3;
        private long pollWaitMs = 2_000;
    }

    @Data
    public static class NormalizeSettings {
        private SuperFallback superFallback = SuperFallback.LAST_BALL;
    }

    @Data
    public static class StoreSettings {
        private String path = "data/draws.json";
    }

    @Data
    public static class ArtifactSettings {
        private boolean enabled = false;
        private String directory = "artifacts/last_fetch";
    }

    @Data
    public static class RunSettings {
        private boolean enabled = true;
        /** Explicit draw date (yyyy-MM-dd); blank means today in {@link #zone}. */
        private String openDate = "";
        /** Process exit code when the run changed the store. */
        private int changedExitCode = 0;
        /** Process exit code when neither the API nor the HTML pages produced a draw. */
        private int exhaustedExitCode = 0;
    }

    /**
     * Snapshot of the candidate dimension lists for one run.
     */
    public SearchDimensions toSearchDimensions() {
        return SearchDimensions.builder()
                .endpoints(api.getEndpoints())
                .dateKeys(api.getDateKeys())
                .dateFormats(api.getDateFormats())
                .pageKeys(api.getPageKeys())
                .methods(api.getMethods())
                .pageSizeKeys(api.getPageSizeKeys())
                .pageIndexOrigins(api.getPageIndexOrigins())
                .build();
    }
}
