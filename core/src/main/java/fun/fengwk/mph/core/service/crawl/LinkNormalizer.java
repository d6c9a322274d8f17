package fun.fengwk.mph.core.service.crawl;

import org.apache.commons.lang3.StringUtils;

/**
 * Resolves scheme relative and host relative links against a known host.
 *
 * @author fengwk
 */
public final class LinkNormalizer {

    private LinkNormalizer() {
    }

    public static String normalize(String link, String host) {
        if (StringUtils.isBlank(link)) {
            return link;
        }
        String trimmed = link.trim();
        if (trimmed.startsWith("//")) {
            return "https:" + trimmed;
        }
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        String base = StringUtils.removeEnd(host, "/");
        if (trimmed.startsWith("/")) {
            return base + trimmed;
        }
        return base + "/" + trimmed;
    }

}
