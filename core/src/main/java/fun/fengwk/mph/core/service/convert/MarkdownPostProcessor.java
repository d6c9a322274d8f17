package fun.fengwk.mph.core.service.convert;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Post-process converted markdown: equation delimiters, table and heading spacing, blank line collapsing and an
 * optional table of contents. Fenced code blocks are left untouched.
 *
 * @author fengwk
 */
@Component
public class MarkdownPostProcessor {

    static final String TOC_TITLE = "Contents";

    private static final Pattern PADDED_INLINE_EQUATION_PATTERN =
        Pattern.compile("(?<!\\$)\\$[ \\t]+([^$\\n]*?[^ \\t$])[ \\t]+\\$(?!\\$)");
    private static final Pattern HEADING_PATTERN = Pattern.compile("^(#{1,6})\\s*(\\S.*)$");
    private static final Pattern ANCHOR_STRIP_PATTERN =
        Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);

    public String process(String markdown) {
        return process(markdown, false);
    }

    public String process(String markdown, boolean generateToc) {
        if (StringUtils.isBlank(markdown)) {
            return "";
        }
        String normalized = markdown.replace("\r\n", "\n")
            .replace("\uFEFF", "")
            .replace("\u200B", "")
            .replace("\u2060", "");

        List<String> lines = new ArrayList<>();
        boolean inCodeBlock = false;
        boolean previousTableLine = false;
        for (String line : normalized.split("\n", -1)) {
            if (isFenceLine(line)) {
                inCodeBlock = !inCodeBlock;
                lines.add(line);
                previousTableLine = false;
                continue;
            }
            if (inCodeBlock) {
                lines.add(line);
                continue;
            }

            String trimmed = line.trim();
            boolean tableLine = trimmed.startsWith("|");
            if (tableLine != previousTableLine) {
                // Tables need a blank line on both sides to render.
                lines.add("");
            }
            previousTableLine = tableLine;

            Matcher heading = HEADING_PATTERN.matcher(trimmed);
            if (heading.matches()) {
                lines.add("");
                lines.add(heading.group(1) + " " + heading.group(2).trim());
                lines.add("");
                continue;
            }
            if (isDisplayEquationOnOneLine(trimmed)) {
                lines.add("");
                lines.add("$$");
                lines.add(trimmed.substring(2, trimmed.length() - 2).trim());
                lines.add("$$");
                lines.add("");
                continue;
            }
            lines.add(PADDED_INLINE_EQUATION_PATTERN.matcher(line)
                .replaceAll(m -> "\\$" + Matcher.quoteReplacement(m.group(1)) + "\\$"));
        }

        String collapsed = collapseBlankLines(lines);
        return generateToc ? buildToc(collapsed) + collapsed : collapsed;
    }

    private boolean isDisplayEquationOnOneLine(String trimmed) {
        return trimmed.length() > 4 && trimmed.startsWith("$$") && trimmed.endsWith("$$");
    }

    private String collapseBlankLines(List<String> lines) {
        StringBuilder builder = new StringBuilder();
        boolean previousBlank = true;
        for (String line : lines) {
            String trimmedLine = stripTrailingSpaces(line);
            if (trimmedLine.isBlank()) {
                if (!previousBlank) {
                    builder.append("\n");
                }
                previousBlank = true;
                continue;
            }
            builder.append(trimmedLine).append("\n");
            previousBlank = false;
        }
        return builder.toString().trim();
    }

    private String buildToc(String markdown) {
        StringBuilder toc = new StringBuilder("# ").append(TOC_TITLE).append("\n\n");
        boolean inCodeBlock = false;
        for (String line : markdown.split("\n")) {
            if (isFenceLine(line)) {
                inCodeBlock = !inCodeBlock;
                continue;
            }
            Matcher heading = HEADING_PATTERN.matcher(line);
            if (inCodeBlock || !heading.matches()) {
                continue;
            }
            String title = heading.group(2).trim();
            String indent = "  ".repeat(heading.group(1).length() - 1);
            toc.append(indent).append("- [").append(title).append("](#").append(anchorOf(title)).append(")\n");
        }
        return toc.append("\n---\n\n").toString();
    }

    static String anchorOf(String title) {
        String anchor = ANCHOR_STRIP_PATTERN.matcher(title.toLowerCase()).replaceAll("");
        return anchor.trim().replaceAll("\\s+", "-");
    }

    private boolean isFenceLine(String line) {
        return line != null && line.trim().startsWith("```");
    }

    private String stripTrailingSpaces(String line) {
        int end = line.length();
        while (end > 0 && Character.isWhitespace(line.charAt(end - 1)) && line.charAt(end - 1) != '\n') {
            end--;
        }
        return line.substring(0, end);
    }

}
