package fun.fengwk.a11y.core.service.browser.runtime;

/**
 * A unit of Playwright interaction executed under the browser lock.
 *
 * @param <T> call result type
 * @author fengwk
 */
@FunctionalInterface
public interface BrowserCall<T> {

    T call() throws Exception;

}
