package fun.fengwk.a11y.core.service.scan;

import com.microsoft.playwright.Page;
import fun.fengwk.a11y.core.service.scan.model.AnalysisResult;
import fun.fengwk.a11y.core.service.scan.model.ScanOptions;

/**
 * Runs the configured scanning engines against a navigated page.
 *
 * <p>Callers invoke it under {@code BrowserResourceManager#runExclusive}.
 *
 * @author fengwk
 */
public interface ScanDispatcher {

    AnalysisResult analyzePageWithTools(Page page, ScanOptions options) throws Exception;

}
