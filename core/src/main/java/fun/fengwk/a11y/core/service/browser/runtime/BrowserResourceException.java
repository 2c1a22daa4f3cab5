package fun.fengwk.a11y.core.service.browser.runtime;

/**
 * Thrown when browser resources cannot be launched or created.
 *
 * @author fengwk
 */
public class BrowserResourceException extends RuntimeException {

    public BrowserResourceException(String message) {
        super(message);
    }

    public BrowserResourceException(String message, Throwable cause) {
        super(message, cause);
    }

}
