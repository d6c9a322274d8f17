package fun.fengwk.mph.core.service.guard;

import fun.fengwk.mph.core.service.browser.session.FetchSession;
import fun.fengwk.mph.core.service.crawl.CrawlProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Detects the anti-automation block page and records it on the session.
 *
 * <p>A marker lookup that fails counts as marker absent. The page is never mutated.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AntiBlockDetector {

    private final CrawlProperties crawlProperties;

    /**
     * Check whether the session is blocked. A positive check is sticky.
     */
    public boolean check(FetchSession session) {
        if (session.blockState().isBlocked()) {
            return true;
        }

        for (String marker : crawlProperties.getBlockMarkers()) {
            if (hasMarker(session, marker)) {
                return markBlocked(session, "block marker present: " + marker);
            }
        }

        String title = readTitle(session);
        String lowerTitle = title.toLowerCase(Locale.ROOT);
        for (String keyword : crawlProperties.getBlockTitleKeywords()) {
            if (StringUtils.isNotBlank(keyword) && lowerTitle.contains(keyword.toLowerCase(Locale.ROOT))) {
                return markBlocked(session, "block keyword in title: " + title);
            }
        }
        return false;
    }

    private boolean hasMarker(FetchSession session, String marker) {
        try {
            return session.findElement(marker, crawlProperties.getBlockMarkerTimeoutMs()).isPresent();
        } catch (RuntimeException ex) {
            log.debug("block marker lookup failed, marker={}, error={}", marker, ex.getMessage());
            return false;
        }
    }

    private String readTitle(FetchSession session) {
        try {
            return StringUtils.defaultString(session.title());
        } catch (RuntimeException ex) {
            log.debug("read title for block check failed, error={}", ex.getMessage());
            return "";
        }
    }

    private boolean markBlocked(FetchSession session, String reason) {
        if (session.blockState().markBlocked(reason)) {
            log.warn("session blocked by anti-automation check, reason={}", reason);
        }
        return true;
    }

}
