package fun.fengwk.a11y.core.service.scan;

import com.microsoft.playwright.Page;
import fun.fengwk.a11y.core.service.scan.model.AnalysisResult;
import fun.fengwk.a11y.core.service.scan.model.ScanOptions;
import fun.fengwk.a11y.core.service.scan.model.Violation;
import fun.fengwk.a11y.core.service.scan.model.ViolationImpact;
import fun.fengwk.a11y.core.service.scan.model.ViolationSummary;
import fun.fengwk.a11y.core.service.scan.model.WcagLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Built-in scan engine evaluating a small set of DOM rules in the page.
 *
 * <p>Rules: image-alt, html-has-lang, document-title, label, link-name, button-name.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class BasicScanDispatcher implements ScanDispatcher {

    static final String TOOL_NAME = "basic-rules";

    static final String RULE_SCRIPT = """
        (rules) => {
          const enabled = (id) => !rules || rules.length === 0 || rules.includes(id);
          const selectorOf = (el) => {
            if (el.id) return '#' + CSS.escape(el.id);
            const parts = [];
            let node = el;
            while (node && node.nodeType === 1 && parts.length < 4) {
              let part = node.tagName.toLowerCase();
              const parent = node.parentElement;
              if (parent) {
                const siblings = Array.from(parent.children).filter(c => c.tagName === node.tagName);
                if (siblings.length > 1) part += ':nth-of-type(' + (siblings.indexOf(node) + 1) + ')';
              }
              parts.unshift(part);
              node = parent;
            }
            return parts.join(' > ');
          };
          const accessibleText = (el) => (el.innerText || el.textContent || '').trim()
            || (el.getAttribute('aria-label') || '').trim()
            || (el.getAttribute('title') || '').trim()
            || (el.getAttribute('aria-labelledby') ? 'labelled' : '')
            || Array.from(el.querySelectorAll('img[alt]')).map(i => i.alt.trim()).join('');
          const labelled = (el) => (el.id && document.querySelector('label[for="' + CSS.escape(el.id) + '"]'))
            || el.closest('label')
            || (el.getAttribute('aria-label') || '').trim()
            || el.getAttribute('aria-labelledby')
            || (el.getAttribute('title') || '').trim();
          const findings = [];
          const report = (id, impact, wcag, description, help, elements) => {
            if (!enabled(id) || elements.length === 0) return;
            findings.push({
              id, impact, wcag, description, help,
              helpUrl: 'https://dequeuniversity.com/rules/axe/4.8/' + id,
              occurrences: elements.length,
              selectors: elements.slice(0, 20).map(selectorOf)
            });
          };
          report('image-alt', 'critical', 'A', 'Images must have alternate text',
            'Add an alt attribute to every img element',
            Array.from(document.querySelectorAll('img:not([alt])'))
              .filter(img => img.getAttribute('role') !== 'presentation'));
          report('html-has-lang', 'serious', 'A', 'The html element must have a lang attribute',
            'Declare the page language on the html element',
            (document.documentElement.getAttribute('lang') || '').trim() ? [] : [document.documentElement]);
          report('document-title', 'serious', 'A', 'Documents must have a title element',
            'Give the page a non-empty title',
            (document.title || '').trim() ? [] : [document.documentElement]);
          report('label', 'critical', 'A', 'Form elements must have labels',
            'Associate a label with every form control',
            Array.from(document.querySelectorAll('input, select, textarea'))
              .filter(el => !['hidden', 'submit', 'button', 'image', 'reset']
                .includes((el.getAttribute('type') || '').toLowerCase()))
              .filter(el => !labelled(el)));
          report('link-name', 'serious', 'A', 'Links must have discernible text',
            'Give every link text or an accessible name',
            Array.from(document.querySelectorAll('a[href]')).filter(el => !accessibleText(el)));
          report('button-name', 'critical', 'A', 'Buttons must have discernible text',
            'Give every button text or an accessible name',
            Array.from(document.querySelectorAll('button, [role="button"]')).filter(el => !accessibleText(el)));
          return findings;
        }
        """;

    @Override
    public AnalysisResult analyzePageWithTools(Page page, ScanOptions options) {
        ScanOptions scanOptions = options == null ? ScanOptions.defaults() : options;
        List<String> rules = scanOptions.getRules() == null ? List.of() : scanOptions.getRules();
        String url = page.url();
        long startAt = System.currentTimeMillis();

        Object raw = page.evaluate(RULE_SCRIPT, rules);
        List<Violation> violations = parseFindings(raw, url);

        log.info("page scanned, url={}, violations={}, elapsedMs={}",
            url, violations.size(), System.currentTimeMillis() - startAt);
        return AnalysisResult.builder()
            .url(url)
            .timestamp(Instant.now())
            .tool(TOOL_NAME)
            .violations(violations)
            .summary(ViolationSummary.of(violations))
            .build();
    }

    List<Violation> parseFindings(Object raw, String url) {
        if (!(raw instanceof List)) {
            log.warn("unexpected rule script result, url={}, type={}", url, raw == null ? "null" : raw.getClass().getName());
            return List.of();
        }
        List<Violation> violations = new ArrayList<>();
        for (Object item : (List<?>) raw) {
            if (!(item instanceof Map)) {
                continue;
            }
            Map<?, ?> finding = (Map<?, ?>) item;
            violations.add(Violation.builder()
                .id(asString(finding.get("id")))
                .impact(ViolationImpact.fromValue(asString(finding.get("impact"))))
                .description(asString(finding.get("description")))
                .help(asString(finding.get("help")))
                .helpUrl(asString(finding.get("helpUrl")))
                .wcagLevel(WcagLevel.fromValue(asString(finding.get("wcag"))))
                .occurrences(asInt(finding.get("occurrences")))
                .selectors(asStringList(finding.get("selectors")))
                .tools(List.of(TOOL_NAME))
                .build());
        }
        return violations;
    }

    private static String asString(Object value) {
        return value == null ? "" : value.toString();
    }

    private static int asInt(Object value) {
        return value instanceof Number ? ((Number) value).intValue() : 0;
    }

    private static List<String> asStringList(Object value) {
        if (!(value instanceof List)) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

}
