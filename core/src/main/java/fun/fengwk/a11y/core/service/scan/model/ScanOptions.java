package fun.fengwk.a11y.core.service.scan.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Options bag handed to scanning engines and task strategies.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
public class ScanOptions {

    /**
     * Navigation timeout.
     */
    @Builder.Default
    private long timeoutMs = 30000;

    /**
     * Pause after navigation for dynamic content.
     */
    @Builder.Default
    private long settleDelayMs = 2000;

    /**
     * Urls of a batch task, empty means the task url alone.
     */
    @Builder.Default
    private List<String> batchUrls = List.of();

    /**
     * Rule ids to run, empty means all.
     */
    @Builder.Default
    private List<String> rules = List.of();

    /**
     * Crawl page limit of a full-site task, null uses {@code a11y.crawl.max-pages}.
     */
    private Integer maxPages;

    /**
     * Crawl depth limit of a full-site task, null uses {@code a11y.crawl.max-depth}.
     */
    private Integer maxDepth;

    @Builder.Default
    private Map<String, Object> attributes = Map.of();

    public static ScanOptions defaults() {
        return ScanOptions.builder().build();
    }

}
