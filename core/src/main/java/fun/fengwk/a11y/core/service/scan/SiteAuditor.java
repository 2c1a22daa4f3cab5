package fun.fengwk.a11y.core.service.scan;

import fun.fengwk.a11y.core.service.scan.model.BatchResult;
import fun.fengwk.a11y.core.service.scan.model.ScanOptions;

/**
 * Crawls a site from a start url and analyzes the pages it discovers.
 *
 * @author fengwk
 */
public interface SiteAuditor {

    BatchResult auditSite(String url, ScanOptions options);

}
