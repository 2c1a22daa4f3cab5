package fun.fengwk.a11y.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.a11y.core.service.browser.BrowserProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class BrowserResourceManagerTest {

    private final List<Browser> launchedBrowsers = new CopyOnWriteArrayList<>();
    private final List<Playwright> launchedDrivers = new CopyOnWriteArrayList<>();
    private final List<BrowserContext> createdContexts = new CopyOnWriteArrayList<>();

    private BrowserResourceManager manager;

    @BeforeEach
    public void setUp() {
        BrowserProperties properties = new BrowserProperties();
        properties.setSettleDelayMs(0);
        manager = new BrowserResourceManager(properties, this::launch);
    }

    @AfterEach
    public void tearDown() {
        manager.shutdown();
    }

    @Test
    public void shouldRejectAccessBeforeInitialize() {
        assertThatThrownBy(() -> manager.getPage("S"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("browser not initialized, call initialize() first");
    }

    @Test
    public void shouldInitializeOnce() {
        manager.initialize();
        manager.initialize();

        assertThat(launchedBrowsers).hasSize(1);
        assertThat(manager.getResourceUsage().isInitialized()).isTrue();
    }

    @Test
    public void shouldIsolateSessions() {
        manager.initialize();

        Page pageA = manager.getPage("A");
        Page pageB = manager.getPage("B");
        BrowserContext contextA = manager.getContext("A");
        BrowserContext contextB = manager.getContext("B");

        assertThat(pageA).isNotSameAs(pageB);
        assertThat(contextA).isNotSameAs(contextB);
        assertThat(manager.getPage("A")).isSameAs(pageA);

        manager.cleanup("A");

        verify(contextA).close();
        verify(pageA).close();
        verify(contextB, never()).close();
        verify(pageB, never()).close();
        assertThat(manager.getPage("B")).isSameAs(pageB);
        assertThat(manager.getResourceUsage().getContexts()).isEqualTo(1);
        assertThat(manager.getResourceUsage().getPages()).isEqualTo(1);
    }

    @Test
    public void shouldKeepPagesOfSessionsSharingPrefix() {
        manager.initialize();
        Page pageA = manager.getPage("a");
        Page pageAb = manager.getPage("ab");

        manager.cleanup("a");

        verify(pageA).close();
        verify(pageAb, never()).close();
        assertThat(manager.getPage("ab")).isSameAs(pageAb);
    }

    @Test
    public void shouldReplaceClosedPage() {
        manager.initialize();
        Page first = manager.getPage("S");
        when(first.isClosed()).thenReturn(true);

        Page second = manager.getPage("S");

        assertThat(second).isNotNull().isNotSameAs(first);
        assertThat(manager.getPage("S")).isSameAs(second);
        assertThat(manager.getResourceUsage().getPages()).isEqualTo(1);
    }

    @Test
    public void shouldReplaceCrashedPage() {
        manager.initialize();
        Page first = manager.getPage("S");
        when(first.evaluate(anyString())).thenThrow(new RuntimeException("Target crashed"));

        Page second = manager.getPage("S");

        assertThat(second).isNotSameAs(first);
        verify(first).close();
    }

    @Test
    public void shouldReplaceStaleContextAndItsPages() {
        manager.initialize();
        Page page = manager.getPage("S");
        BrowserContext context = manager.getContext("S");
        when(context.newPage()).thenThrow(new RuntimeException("Target page, context or browser has been closed"));

        BrowserContext replaced = manager.getContext("S");

        assertThat(replaced).isNotSameAs(context);
        verify(page).close();
        assertThat(manager.getResourceUsage().getPages()).isZero();
        assertThat(manager.getPage("S")).isNotSameAs(page);
    }

    @Test
    public void shouldRelaunchWhenHealthCheckFails() {
        manager.initialize();
        Browser first = launchedBrowsers.get(0);
        when(first.newContext()).thenThrow(new RuntimeException("Browser has been closed"));

        manager.initialize();

        assertThat(launchedBrowsers).hasSize(2);
        verify(launchedDrivers.get(0)).close();
        assertThat(manager.isBrowserHealthy()).isTrue();
    }

    @Test
    public void shouldResetUsageOnCleanupAll() {
        manager.initialize();
        manager.getPage("A");
        manager.getPage("A", "secondary");
        manager.getPage("B");

        manager.cleanupAll();

        ResourceUsage usage = manager.getResourceUsage();
        assertThat(usage.getContexts()).isZero();
        assertThat(usage.getPages()).isZero();
        assertThat(usage.isInitialized()).isFalse();
        verify(launchedBrowsers.get(0)).close();
    }

    @Test
    public void shouldNavigateWithRequestedOptions() {
        manager.initialize();

        Page page = manager.navigateToUrl("S", "https://example.com", NavigateOptions.builder()
            .waitUntil(WaitUntilState.NETWORKIDLE)
            .timeoutMs(5000L)
            .build());

        verify(page).navigate(eq("https://example.com"), any(Page.NavigateOptions.class));
        assertThat(manager.getPage("S")).isSameAs(page);
    }

    @Test
    public void shouldCreateOneContextForConcurrentCallers() throws Exception {
        manager.initialize();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<BrowserContext>> futures = new CopyOnWriteArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(executor.submit(() -> {
                    start.await(1, TimeUnit.SECONDS);
                    return manager.getContext("shared");
                }));
            }
            start.countDown();

            BrowserContext first = futures.get(0).get(1, TimeUnit.SECONDS);
            for (Future<BrowserContext> future : futures) {
                assertThat(future.get(1, TimeUnit.SECONDS)).isSameAs(first);
            }
            assertThat(manager.getResourceUsage().getContexts()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void shouldKeepSessionLockAcrossCleanup() throws Exception {
        manager.initialize();
        ReentrantLock before = manager.sessionLock("S");
        manager.getPage("S");

        manager.cleanup("S");

        assertThat(manager.sessionLock("S")).isSameAs(before);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        before.lock();
        try {
            Future<?> cleanup = executor.submit(() -> manager.cleanup("S"));
            Thread.sleep(50);
            assertThat(cleanup).isNotDone();
            before.unlock();
            cleanup.get(1, TimeUnit.SECONDS);
        } finally {
            if (before.isHeldByCurrentThread()) {
                before.unlock();
            }
            executor.shutdownNow();
        }
    }

    @Test
    public void shouldSerializeNavigationWithOtherBrowserCalls() throws Exception {
        manager.initialize();
        Page page = manager.getPage("A");
        CountDownLatch navigating = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(page.navigate(anyString(), any(Page.NavigateOptions.class))).thenAnswer(invocation -> {
            navigating.countDown();
            release.await(1, TimeUnit.SECONDS);
            return null;
        });
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Page> navigation = executor.submit(() -> manager.navigateToUrl("A", "https://example.com"));
            assertThat(navigating.await(1, TimeUnit.SECONDS)).isTrue();
            Future<String> other = executor.submit(() -> manager.runExclusive(() -> "done"));
            Thread.sleep(50);
            assertThat(other).isNotDone();

            release.countDown();
            assertThat(other.get(1, TimeUnit.SECONDS)).isEqualTo("done");
            assertThat(navigation.get(1, TimeUnit.SECONDS)).isSameAs(page);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    public void shouldRejectSessionIdWithSeparator() {
        manager.initialize();

        assertThatThrownBy(() -> manager.getPage("a:b"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldResolveWaitUntil() {
        assertThat(BrowserResourceManager.resolveWaitUntil("networkidle")).isEqualTo(WaitUntilState.NETWORKIDLE);
        assertThat(BrowserResourceManager.resolveWaitUntil("")).isEqualTo(WaitUntilState.DOMCONTENTLOADED);
        assertThatThrownBy(() -> BrowserResourceManager.resolveWaitUntil("eventually"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private BrowserSession launch() {
        Playwright playwright = mock(Playwright.class);
        Browser browser = mock(Browser.class);
        when(browser.newContext()).thenAnswer(invocation -> newContext());
        when(browser.newContext(any(Browser.NewContextOptions.class))).thenAnswer(invocation -> newContext());
        launchedDrivers.add(playwright);
        launchedBrowsers.add(browser);
        return new BrowserSession(playwright, browser);
    }

    private BrowserContext newContext() {
        BrowserContext context = mock(BrowserContext.class);
        when(context.newPage()).thenAnswer(invocation -> mock(Page.class));
        createdContexts.add(context);
        return context;
    }

}
