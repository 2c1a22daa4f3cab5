package fun.fengwk.a11y.core.service.batch;

import com.microsoft.playwright.Page;
import fun.fengwk.a11y.core.service.browser.runtime.BrowserResourceManager;
import fun.fengwk.a11y.core.service.browser.runtime.NavigateOptions;
import fun.fengwk.a11y.core.service.scan.CrawlProperties;
import fun.fengwk.a11y.core.service.scan.SiteAuditor;
import fun.fengwk.a11y.core.service.scan.model.BatchResult;
import fun.fengwk.a11y.core.service.scan.model.PageInfo;
import fun.fengwk.a11y.core.service.scan.model.ScanOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Breadth-first crawler feeding discovered pages into the {@link ParallelBatchAnalyzer}.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class CrawlingSiteAuditor implements SiteAuditor {

    static final String LINK_SCRIPT = "() => Array.from(document.querySelectorAll('a[href]')).map(a => a.href)";

    private final BrowserResourceManager resourceManager;
    private final ParallelBatchAnalyzer batchAnalyzer;
    private final CrawlProperties crawlProperties;

    public CrawlingSiteAuditor(
        BrowserResourceManager resourceManager,
        ParallelBatchAnalyzer batchAnalyzer,
        CrawlProperties crawlProperties
    ) {
        this.resourceManager = resourceManager;
        this.batchAnalyzer = batchAnalyzer;
        this.crawlProperties = crawlProperties;
    }

    @Override
    public BatchResult auditSite(String url, ScanOptions options) {
        if (!StringUtils.hasText(url)) {
            throw new IllegalArgumentException("url must not be blank");
        }
        ScanOptions scanOptions = options == null ? ScanOptions.defaults() : options;
        List<PageInfo> pages = discoverPages(url, scanOptions);
        if (pages.isEmpty()) {
            pages = List.of(PageInfo.of(url));
        }
        log.info("site crawl finished, startUrl={}, pages={}", url, pages.size());

        return batchAnalyzer.analyzePages(pages, batchAnalyzer.defaultOptions().toBuilder()
            .scanOptions(scanOptions)
            .build());
    }

    List<PageInfo> discoverPages(String startUrl, ScanOptions options) {
        int maxPages = options.getMaxPages() != null ? options.getMaxPages() : crawlProperties.getMaxPages();
        int maxDepth = options.getMaxDepth() != null ? options.getMaxDepth() : crawlProperties.getMaxDepth();
        String start = normalizeLink(startUrl);
        if (start == null || maxPages < 1) {
            return List.of();
        }
        String startHost = hostOf(start);

        resourceManager.initialize();
        String sessionId = "crawl-" + UUID.randomUUID();
        List<PageInfo> discovered = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<PageInfo> frontier = new ArrayDeque<>();
        seen.add(start);
        frontier.add(PageInfo.builder().url(start).title("").depth(0).foundOn("").build());

        try {
            while (!frontier.isEmpty() && discovered.size() < maxPages) {
                PageInfo current = frontier.poll();
                List<String> links;
                try {
                    Page page = resourceManager.navigateToUrl(sessionId, current.getUrl(), NavigateOptions.builder()
                        .timeoutMs(options.getTimeoutMs())
                        .settleDelayMs(0L)
                        .build());
                    current.setTitle(resourceManager.runExclusive(page::title));
                    links = current.getDepth() < maxDepth ? collectLinks(page) : List.of();
                } catch (RuntimeException ex) {
                    log.warn("crawl navigation failed, url={}, error={}", current.getUrl(), ex.getMessage());
                    continue;
                }
                discovered.add(current);

                for (String link : links) {
                    String normalized = normalizeLink(link);
                    if (normalized == null || !seen.add(normalized)) {
                        continue;
                    }
                    if (crawlProperties.isSameHostOnly() && !startHost.equalsIgnoreCase(hostOf(normalized))) {
                        continue;
                    }
                    frontier.add(PageInfo.builder()
                        .url(normalized)
                        .title("")
                        .depth(current.getDepth() + 1)
                        .foundOn(current.getUrl())
                        .build());
                }
            }
        } finally {
            resourceManager.cleanup(sessionId);
        }
        return discovered;
    }

    private List<String> collectLinks(Page page) {
        Object raw = resourceManager.runExclusive(() -> page.evaluate(LINK_SCRIPT));
        if (!(raw instanceof List)) {
            return List.of();
        }
        List<String> links = new ArrayList<>();
        for (Object item : (List<?>) raw) {
            if (item != null) {
                links.add(item.toString());
            }
        }
        return links;
    }

    /**
     * Strip the fragment, lower-case scheme and host, keep http(s) urls only. Null when the link is not crawlable.
     */
    static String normalizeLink(String link) {
        if (!StringUtils.hasText(link)) {
            return null;
        }
        try {
            URI uri = new URI(link.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                return null;
            }
            scheme = scheme.toLowerCase(Locale.ROOT);
            if (!"http".equals(scheme) && !"https".equals(scheme)) {
                return null;
            }
            String path = uri.getPath() == null || uri.getPath().isEmpty() ? "/" : uri.getPath();
            return new URI(scheme, uri.getUserInfo(), uri.getHost().toLowerCase(Locale.ROOT), uri.getPort(),
                path, uri.getQuery(), null).toString();
        } catch (URISyntaxException ex) {
            return null;
        }
    }

    private static String hostOf(String url) {
        return URI.create(url).getHost();
    }

}
