package fun.fengwk.a11y.core.service.scan;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Full-site crawl configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "a11y.crawl")
public class CrawlProperties {

    /**
     * Max pages collected per audit.
     */
    private int maxPages = 50;

    /**
     * Max link distance from the start page.
     */
    private int maxDepth = 3;

    /**
     * Follow only links on the start page host.
     */
    private boolean sameHostOnly = true;

}
