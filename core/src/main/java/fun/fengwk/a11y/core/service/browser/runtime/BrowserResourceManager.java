package fun.fengwk.a11y.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.a11y.core.service.browser.BrowserProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session-keyed pool of browser resources on top of one shared browser process.
 *
 * <p>Resource model:
 * <ul>
 *     <li>One browser process, launched by {@link #initialize()} and replaced when its health check fails.</li>
 *     <li>One isolated context per session key, never handed to another session.</li>
 *     <li>Pages keyed by {@code sessionId:pageId}, {@code pageId} defaults to {@value #DEFAULT_PAGE_ID}.</li>
 * </ul>
 *
 * <p>Every accessor re-validates the cached resource with a cheap real operation before reuse and
 * transparently recreates it on failure. Close and disconnect listeners evict dead resources eagerly.
 *
 * <p>Playwright objects are not thread-safe, so every Playwright call runs under one reentrant browser lock.
 * Collaborators driving a page must do so through {@link #runExclusive(BrowserCall)}. Creation and repair of
 * a session's resources is additionally serialized per session key. Navigation runs under the browser lock
 * too, so page loads of different sessions are serialized; only the settle delay and work outside
 * {@code runExclusive} overlap.
 *
 * @author fengwk
 */
@Component
public class BrowserResourceManager {

    private static final Logger log = LoggerFactory.getLogger(BrowserResourceManager.class);

    public static final String DEFAULT_PAGE_ID = "default";

    private static final String PAGE_KEY_SEPARATOR = ":";

    private final BrowserProperties browserProperties;
    private final BrowserLauncher browserLauncher;

    private final ReentrantLock browserLock = new ReentrantLock(true);
    private final Map<String, ReentrantLock> sessionLocks = new ConcurrentHashMap<>();
    private final Map<String, BrowserContext> contexts = new ConcurrentHashMap<>();
    private final Map<String, Page> pages = new ConcurrentHashMap<>();

    private volatile BrowserSession browserSession;
    private volatile boolean browserConnected = false;
    private volatile boolean initialized = false;

    @Autowired
    public BrowserResourceManager(BrowserProperties browserProperties) {
        this(browserProperties, BrowserLauncher.chromium(browserProperties));
    }

    public BrowserResourceManager(BrowserProperties browserProperties, BrowserLauncher browserLauncher) {
        this.browserProperties = browserProperties;
        this.browserLauncher = browserLauncher;
    }

    /**
     * Start the shared browser if absent, or relaunch it when the health check fails. Idempotent.
     */
    public void initialize() {
        browserLock.lock();
        try {
            if (initialized && browserSession != null) {
                if (browserConnected && checkBrowser()) {
                    return;
                }
                log.warn("shared browser failed health check, relaunching");
                cleanupAll();
            }

            log.info("initializing browser resource manager");
            BrowserSession session;
            try {
                session = browserLauncher.launch();
            } catch (RuntimeException ex) {
                log.warn("failed to launch browser, error={}", ex.getMessage(), ex);
                throw new BrowserResourceException("failed to launch browser: " + ex.getMessage(), ex);
            }
            session.browser().onDisconnected(this::handleBrowserDisconnected);
            browserSession = session;
            browserConnected = true;
            initialized = true;
            log.info("browser resource manager initialized");
        } finally {
            browserLock.unlock();
        }
    }

    /**
     * Check the shared browser by opening and closing a throwaway context and page.
     */
    public boolean isBrowserHealthy() {
        browserLock.lock();
        try {
            return initialized && browserSession != null && browserConnected && checkBrowser();
        } finally {
            browserLock.unlock();
        }
    }

    /**
     * Tear everything down and launch a fresh browser.
     */
    public void forceReinitialize() {
        browserLock.lock();
        try {
            cleanupAll();
            initialize();
        } finally {
            browserLock.unlock();
        }
    }

    public BrowserContext getContext(String sessionId) {
        return getContext(sessionId, ContextOptions.defaults());
    }

    /**
     * Return the live context of {@code sessionId}, creating or replacing it as needed.
     */
    public BrowserContext getContext(String sessionId, ContextOptions options) {
        requireSessionId(sessionId);
        ReentrantLock sessionLock = sessionLock(sessionId);
        sessionLock.lock();
        try {
            BrowserContext existing = contexts.get(sessionId);
            if (existing != null) {
                if (isContextAlive(existing)) {
                    return existing;
                }
                log.info("discarding stale browser context, sessionId={}", sessionId);
                discardContext(sessionId, existing);
            }
            return createContext(sessionId, options == null ? ContextOptions.defaults() : options);
        } finally {
            sessionLock.unlock();
        }
    }

    public Page getPage(String sessionId) {
        return getPage(sessionId, DEFAULT_PAGE_ID);
    }

    /**
     * Return the live page at {@code sessionId:pageId}, creating or replacing it as needed.
     */
    public Page getPage(String sessionId, String pageId) {
        requireSessionId(sessionId);
        String normalizedPageId = StringUtils.hasText(pageId) ? pageId : DEFAULT_PAGE_ID;
        String pageKey = pageKey(sessionId, normalizedPageId);
        ReentrantLock sessionLock = sessionLock(sessionId);
        sessionLock.lock();
        try {
            Page existing = pages.get(pageKey);
            if (existing != null) {
                if (isPageAlive(existing)) {
                    return existing;
                }
                log.info("discarding stale page, sessionId={}, pageId={}", sessionId, normalizedPageId);
                pages.remove(pageKey, existing);
                closeQuietly(existing);
            }
            return createPage(sessionId, normalizedPageId, pageKey);
        } finally {
            sessionLock.unlock();
        }
    }

    public Page navigateToUrl(String sessionId, String url) {
        return navigateToUrl(sessionId, url, NavigateOptions.defaults());
    }

    /**
     * Navigate the session page to {@code url} and wait for visual stabilization.
     */
    public Page navigateToUrl(String sessionId, String url, NavigateOptions options) {
        requireText(url, "url");
        NavigateOptions navigateOptions = options == null ? NavigateOptions.defaults() : options;
        Page page = getPage(sessionId, navigateOptions.getPageId());

        WaitUntilState waitUntil = navigateOptions.getWaitUntil() != null
            ? navigateOptions.getWaitUntil()
            : resolveWaitUntil(browserProperties.getNavigationWaitUntil());
        long timeoutMs = navigateOptions.getTimeoutMs() != null
            ? navigateOptions.getTimeoutMs()
            : browserProperties.getNavigationTimeoutMs();

        log.debug("navigating, sessionId={}, url={}, waitUntil={}, timeoutMs={}", sessionId, url, waitUntil, timeoutMs);
        runExclusive(() -> page.navigate(url, new Page.NavigateOptions()
            .setWaitUntil(waitUntil)
            .setTimeout(timeoutMs)));

        long settleDelayMs = navigateOptions.getSettleDelayMs() != null
            ? navigateOptions.getSettleDelayMs()
            : browserProperties.getSettleDelayMs();
        // Settle outside the browser lock so other sessions keep moving.
        pause(settleDelayMs);
        return page;
    }

    /**
     * Run a Playwright interaction under the browser lock.
     */
    public <T> T runExclusive(BrowserCall<T> call) {
        browserLock.lock();
        try {
            return call.call();
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new BrowserResourceException("browser call failed: " + ex.getMessage(), ex);
        } finally {
            browserLock.unlock();
        }
    }

    /**
     * Close one page and keep the session context.
     */
    public void closePage(String sessionId, String pageId) {
        String normalizedPageId = StringUtils.hasText(pageId) ? pageId : DEFAULT_PAGE_ID;
        Page page = pages.remove(pageKey(sessionId, normalizedPageId));
        if (page != null) {
            closeQuietly(page);
            log.debug("closed page, sessionId={}, pageId={}", sessionId, normalizedPageId);
        }
    }

    /**
     * Close and evict every page and the context of {@code sessionId}. Idempotent, never throws.
     */
    public void cleanup(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return;
        }
        ReentrantLock sessionLock = sessionLock(sessionId);
        sessionLock.lock();
        try {
            BrowserContext context = contexts.remove(sessionId);
            closeSessionPages(sessionId);
            if (context != null) {
                closeQuietly(context);
                log.debug("cleaned up browser resources, sessionId={}", sessionId);
            }
        } catch (RuntimeException ex) {
            log.warn("failed to cleanup session, sessionId={}, error={}", sessionId, ex.getMessage(), ex);
        } finally {
            sessionLock.unlock();
        }
    }

    /**
     * Close every page, context and the shared browser, and reset the initialization state. Never throws.
     */
    public void cleanupAll() {
        browserLock.lock();
        try {
            log.info("cleaning up all browser resources, contexts={}, pages={}", contexts.size(), pages.size());
            for (Page page : List.copyOf(pages.values())) {
                closeQuietly(page);
            }
            pages.clear();
            for (BrowserContext context : List.copyOf(contexts.values())) {
                closeQuietly(context);
            }
            contexts.clear();

            BrowserSession session = browserSession;
            browserSession = null;
            browserConnected = false;
            initialized = false;
            closeQuietly(session);
        } catch (RuntimeException ex) {
            log.warn("failed to cleanup browser resources, error={}", ex.getMessage(), ex);
        } finally {
            browserLock.unlock();
        }
    }

    public ResourceUsage getResourceUsage() {
        return ResourceUsage.builder()
            .contexts(contexts.size())
            .pages(pages.size())
            .initialized(initialized)
            .build();
    }

    @PreDestroy
    public void shutdown() {
        cleanupAll();
    }

    private boolean checkBrowser() {
        BrowserContext scratchContext = null;
        try {
            scratchContext = browserSession.browser().newContext();
            Page scratchPage = scratchContext.newPage();
            scratchPage.close();
            return true;
        } catch (RuntimeException ex) {
            log.warn("browser health check failed, error={}", ex.getMessage());
            return false;
        } finally {
            closeQuietly(scratchContext);
        }
    }

    private boolean isContextAlive(BrowserContext context) {
        try {
            return runExclusive(() -> {
                Page scratchPage = context.newPage();
                scratchPage.close();
                return true;
            });
        } catch (RuntimeException ex) {
            log.debug("context liveness check failed, error={}", ex.getMessage());
            return false;
        }
    }

    private boolean isPageAlive(Page page) {
        try {
            return runExclusive(() -> {
                if (page.isClosed()) {
                    return false;
                }
                page.evaluate("() => true");
                return true;
            });
        } catch (RuntimeException ex) {
            log.debug("page liveness check failed, error={}", ex.getMessage());
            return false;
        }
    }

    private BrowserContext createContext(String sessionId, ContextOptions options) {
        Browser browser = requireBrowser();
        try {
            BrowserContext context = runExclusive(() -> browser.newContext(buildContextOptions(options)));
            context.onClose(closed -> contexts.remove(sessionId, closed));
            contexts.put(sessionId, context);
            log.debug("created browser context, sessionId={}", sessionId);
            return context;
        } catch (RuntimeException ex) {
            log.warn("failed to create browser context, sessionId={}, error={}", sessionId, ex.getMessage());
            throw new BrowserResourceException("failed to create browser context for session " + sessionId
                + ": " + ex.getMessage(), ex);
        }
    }

    private Page createPage(String sessionId, String pageId, String pageKey) {
        BrowserContext context = getContext(sessionId);
        try {
            Page page = runExclusive(() -> {
                Page created = context.newPage();
                created.setDefaultNavigationTimeout(browserProperties.getDefaultNavigationTimeoutMs());
                created.setDefaultTimeout(browserProperties.getDefaultTimeoutMs());
                return created;
            });
            page.onClose(closed -> pages.remove(pageKey, closed));
            pages.put(pageKey, page);
            log.debug("created page, sessionId={}, pageId={}", sessionId, pageId);
            return page;
        } catch (RuntimeException ex) {
            log.warn("failed to create page, sessionId={}, pageId={}, error={}", sessionId, pageId, ex.getMessage());
            throw new BrowserResourceException("failed to create page for session " + sessionId
                + ": " + ex.getMessage(), ex);
        }
    }

    private Browser requireBrowser() {
        if (!initialized) {
            throw new IllegalStateException("browser not initialized, call initialize() first");
        }
        if (!browserConnected) {
            // Crashed process: relaunch before handing out new resources.
            initialize();
        }
        BrowserSession session = browserSession;
        if (session == null) {
            throw new IllegalStateException("browser not initialized, call initialize() first");
        }
        return session.browser();
    }

    private void discardContext(String sessionId, BrowserContext context) {
        contexts.remove(sessionId, context);
        closeSessionPages(sessionId);
        closeQuietly(context);
    }

    private void closeSessionPages(String sessionId) {
        String prefix = sessionId + PAGE_KEY_SEPARATOR;
        for (String pageKey : List.copyOf(pages.keySet())) {
            if (pageKey.startsWith(prefix)) {
                Page page = pages.remove(pageKey);
                closeQuietly(page);
            }
        }
    }

    private void handleBrowserDisconnected(Browser browser) {
        log.warn("shared browser disconnected, evicting contexts={}, pages={}", contexts.size(), pages.size());
        browserConnected = false;
        pages.clear();
        contexts.clear();
    }

    private Browser.NewContextOptions buildContextOptions(ContextOptions options) {
        int width = options.getViewportWidth() != null ? options.getViewportWidth() : browserProperties.getViewportWidth();
        int height = options.getViewportHeight() != null ? options.getViewportHeight() : browserProperties.getViewportHeight();
        Browser.NewContextOptions contextOptions = new Browser.NewContextOptions()
            .setViewportSize(width, height);

        String userAgent = StringUtils.hasText(options.getUserAgent())
            ? options.getUserAgent() : browserProperties.getUserAgent();
        if (StringUtils.hasText(userAgent)) {
            contextOptions.setUserAgent(userAgent);
        }
        String locale = StringUtils.hasText(options.getLocale()) ? options.getLocale() : browserProperties.getLocale();
        if (StringUtils.hasText(locale)) {
            contextOptions.setLocale(locale);
        }
        String timezoneId = StringUtils.hasText(options.getTimezoneId())
            ? options.getTimezoneId() : browserProperties.getTimezoneId();
        if (StringUtils.hasText(timezoneId)) {
            contextOptions.setTimezoneId(timezoneId);
        }
        if (options.getPermissions() != null && !options.getPermissions().isEmpty()) {
            contextOptions.setPermissions(options.getPermissions());
        }

        Map<String, String> headers = new HashMap<>();
        mergeHeaders(headers, browserProperties.getExtraHeaders());
        mergeHeaders(headers, options.getExtraHttpHeaders());
        if (!headers.isEmpty()) {
            contextOptions.setExtraHTTPHeaders(headers);
        }
        return contextOptions;
    }

    private void mergeHeaders(Map<String, String> target, Map<String, String> source) {
        if (source == null) {
            return;
        }
        source.forEach((key, value) -> {
            if (StringUtils.hasText(key) && StringUtils.hasText(value)) {
                target.put(key, value);
            }
        });
    }

    static WaitUntilState resolveWaitUntil(String value) {
        if (!StringUtils.hasText(value)) {
            return WaitUntilState.DOMCONTENTLOADED;
        }
        try {
            return WaitUntilState.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unsupported navigationWaitUntil: " + value, ex);
        }
    }

    /**
     * Session locks live as long as the manager, so every caller of one session shares the same lock.
     */
    ReentrantLock sessionLock(String sessionId) {
        return sessionLocks.computeIfAbsent(sessionId, key -> new ReentrantLock());
    }

    private static String pageKey(String sessionId, String pageId) {
        return sessionId + PAGE_KEY_SEPARATOR + pageId;
    }

    private static void requireSessionId(String sessionId) {
        requireText(sessionId, "sessionId");
        if (sessionId.contains(PAGE_KEY_SEPARATOR)) {
            throw new IllegalArgumentException("sessionId must not contain '" + PAGE_KEY_SEPARATOR + "'");
        }
    }

    private static void requireText(String value, String name) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("settle delay interrupted, millis={}", millis);
        }
    }

    private void closeQuietly(AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        browserLock.lock();
        try {
            closeable.close();
        } catch (Exception ex) {
            if (isExpectedCloseException(ex)) {
                log.debug("browser resource already closed, skip close");
            } else {
                log.warn("failed to close browser resource, error={}", ex.getMessage(), ex);
            }
        } finally {
            browserLock.unlock();
        }
    }

    private boolean isExpectedCloseException(Exception ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase(Locale.ROOT);
        String exceptionName = ex.getClass().getSimpleName();
        return "TargetClosedError".equals(exceptionName)
            || message.contains("target page, context or browser has been closed")
            || message.contains("channel has been closed")
            || message.contains("connection closed");
    }

}
