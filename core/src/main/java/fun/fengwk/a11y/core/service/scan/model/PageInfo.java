package fun.fengwk.a11y.core.service.scan.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A page scheduled for analysis.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageInfo {

    private String url;
    private String title;

    /**
     * Link distance from the crawl start page, 0 for pages supplied directly.
     */
    private int depth;

    /**
     * Url of the page that linked here, empty for seed pages.
     */
    private String foundOn;

    public static PageInfo of(String url) {
        return PageInfo.builder().url(url).title("").depth(0).foundOn("").build();
    }

}
