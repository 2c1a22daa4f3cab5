package fun.fengwk.a11y.core.service.batch;

import com.microsoft.playwright.Page;
import fun.fengwk.a11y.core.service.browser.runtime.BrowserCall;
import fun.fengwk.a11y.core.service.browser.runtime.BrowserResourceManager;
import fun.fengwk.a11y.core.service.browser.runtime.NavigateOptions;
import fun.fengwk.a11y.core.service.scan.CrawlProperties;
import fun.fengwk.a11y.core.service.scan.model.BatchMetrics;
import fun.fengwk.a11y.core.service.scan.model.BatchResult;
import fun.fengwk.a11y.core.service.scan.model.PageInfo;
import fun.fengwk.a11y.core.service.scan.model.ScanOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class CrawlingSiteAuditorTest {

    private final Map<String, Page> site = new HashMap<>();

    private BrowserResourceManager resourceManager;
    private ParallelBatchAnalyzer batchAnalyzer;
    private CrawlProperties crawlProperties;
    private CrawlingSiteAuditor auditor;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        resourceManager = mock(BrowserResourceManager.class);
        when(resourceManager.navigateToUrl(anyString(), anyString(), any(NavigateOptions.class)))
            .thenAnswer(invocation -> {
                Page page = site.get((String) invocation.getArgument(1));
                if (page == null) {
                    throw new IllegalStateException("net::ERR_NAME_NOT_RESOLVED");
                }
                return page;
            });
        when(resourceManager.runExclusive(any())).thenAnswer(invocation ->
            ((BrowserCall<Object>) invocation.getArgument(0)).call());

        batchAnalyzer = mock(ParallelBatchAnalyzer.class);
        when(batchAnalyzer.defaultOptions()).thenReturn(BatchAnalysisOptions.builder().maxConcurrency(5).build());
        when(batchAnalyzer.analyzePages(any(), any(BatchAnalysisOptions.class))).thenReturn(BatchResult.builder()
            .successful(List.of())
            .failed(List.of())
            .metrics(BatchMetrics.builder().build())
            .build());

        crawlProperties = new CrawlProperties();
        auditor = new CrawlingSiteAuditor(resourceManager, batchAnalyzer, crawlProperties);
    }

    @Test
    public void shouldCrawlBreadthFirstWithinHost() {
        page("https://example.com/", "Home",
            "https://example.com/a", "https://example.com/b#top", "https://other.org/x", "mailto:hi@example.com");
        page("https://example.com/a", "A", "https://example.com/", "https://example.com/c");
        page("https://example.com/b", "B", "https://example.com/a");
        page("https://example.com/c", "C");

        List<PageInfo> pages = auditor.discoverPages("https://example.com", ScanOptions.defaults());

        assertThat(pages).extracting(PageInfo::getUrl).containsExactly(
            "https://example.com/", "https://example.com/a", "https://example.com/b", "https://example.com/c");
        assertThat(pages).extracting(PageInfo::getDepth).containsExactly(0, 1, 1, 2);
        assertThat(pages.get(3).getFoundOn()).isEqualTo("https://example.com/a");
        assertThat(pages.get(1).getTitle()).isEqualTo("A");
        verify(resourceManager).cleanup(startsWith("crawl-"));
    }

    @Test
    public void shouldHonorPageAndDepthLimits() {
        page("https://example.com/", "Home", "https://example.com/a", "https://example.com/b");
        page("https://example.com/a", "A", "https://example.com/deep");
        page("https://example.com/b", "B");
        page("https://example.com/deep", "Deep");

        List<PageInfo> limitedByDepth = auditor.discoverPages("https://example.com",
            ScanOptions.builder().maxDepth(1).build());
        List<PageInfo> limitedByCount = auditor.discoverPages("https://example.com",
            ScanOptions.builder().maxPages(2).build());

        assertThat(limitedByDepth).extracting(PageInfo::getUrl)
            .doesNotContain("https://example.com/deep").hasSize(3);
        assertThat(limitedByCount).hasSize(2);
    }

    @Test
    public void shouldFollowOtherHostsWhenAllowed() {
        crawlProperties.setSameHostOnly(false);
        page("https://example.com/", "Home", "https://other.org/x");
        page("https://other.org/x", "X");

        List<PageInfo> pages = auditor.discoverPages("https://example.com", ScanOptions.defaults());

        assertThat(pages).extracting(PageInfo::getUrl).contains("https://other.org/x");
    }

    @Test
    @SuppressWarnings("unchecked")
    public void shouldAnalyzeDiscoveredPages() {
        page("https://example.com/", "Home", "https://example.com/a");
        page("https://example.com/a", "A");
        ScanOptions options = ScanOptions.builder().timeoutMs(5000).build();

        auditor.auditSite("https://example.com", options);

        ArgumentCaptor<List<PageInfo>> pagesCaptor = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<BatchAnalysisOptions> optionsCaptor = ArgumentCaptor.forClass(BatchAnalysisOptions.class);
        verify(batchAnalyzer).analyzePages(pagesCaptor.capture(), optionsCaptor.capture());
        assertThat(pagesCaptor.getValue()).hasSize(2);
        assertThat(optionsCaptor.getValue().getScanOptions()).isSameAs(options);
        assertThat(optionsCaptor.getValue().getMaxConcurrency()).isEqualTo(5);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void shouldFallBackToStartPageWhenNothingDiscovered() {
        auditor.auditSite("https://unreachable.example", ScanOptions.defaults());

        ArgumentCaptor<List<PageInfo>> pagesCaptor = ArgumentCaptor.forClass(List.class);
        verify(batchAnalyzer).analyzePages(pagesCaptor.capture(), any(BatchAnalysisOptions.class));
        assertThat(pagesCaptor.getValue()).extracting(PageInfo::getUrl)
            .containsExactly("https://unreachable.example");
    }

    @Test
    public void shouldRejectBlankUrl() {
        assertThatThrownBy(() -> auditor.auditSite(" ", ScanOptions.defaults()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldNormalizeLinks() {
        assertThat(CrawlingSiteAuditor.normalizeLink("https://Example.com/a?x=1#frag"))
            .isEqualTo("https://example.com/a?x=1");
        assertThat(CrawlingSiteAuditor.normalizeLink("HTTP://example.com")).isEqualTo("http://example.com/");
        assertThat(CrawlingSiteAuditor.normalizeLink("mailto:hi@example.com")).isNull();
        assertThat(CrawlingSiteAuditor.normalizeLink("javascript:void(0)")).isNull();
        assertThat(CrawlingSiteAuditor.normalizeLink("/relative")).isNull();
        assertThat(CrawlingSiteAuditor.normalizeLink("")).isNull();
        assertThat(CrawlingSiteAuditor.normalizeLink("http://exa mple.com")).isNull();
    }

    private void page(String url, String title, String... links) {
        Page page = mock(Page.class);
        when(page.title()).thenReturn(title);
        when(page.evaluate(eq(CrawlingSiteAuditor.LINK_SCRIPT))).thenReturn(List.of((Object[]) links));
        site.put(url, page);
    }

}
