package uk.gegc.bannertracking.features.tracking.infra.html;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites banner HTML so every link and every stand-alone image goes through the click
 * tracker, and optionally appends a view pixel.
 * <p>
 * The input is scanned tag by tag rather than parsed into a tree, so markup the scanner does
 * not understand is copied through untouched. Output carries a marker comment and is returned
 * as-is when rewritten again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrackingHtmlRewriter {

    public static final String APPLIED_MARKER = "<!-- tracking-applied -->";
    public static final String APPLIED_ATTRIBUTE = "data-tracking-applied=\"true\"";
    public static final String PIXEL_MARKER = "<!-- banner-view-pixel -->";

    static final String TRACKED_ATTRIBUTE = "data-tracked";
    static final String ORIGINAL_HREF_ATTRIBUTE = "data-original-href";

    private static final String IMAGE_LINK_STYLE = "text-decoration:none;display:inline-block;";
    private static final String PIXEL_STYLE =
            "position:absolute;left:-9999px;top:-9999px;width:1px;height:1px;opacity:0;";

    // Lookbehind keeps data-original-href and similar attributes from matching
    private static final Pattern HREF_ATTRIBUTE = Pattern.compile(
            "(?i)(?<![\\w-])href\\s*=\\s*(\"[^\"]*\"|'[^']*'|[^\\s\"'>]+)");
    private static final Pattern TRACKED_MARK = Pattern.compile(
            "(?i)(?<![\\w-])" + TRACKED_ATTRIBUTE + "(?![\\w-])");
    private static final Pattern ORIGINAL_HREF_MARK = Pattern.compile(
            "(?i)(?<![\\w-])" + ORIGINAL_HREF_ATTRIBUTE + "(?![\\w-])");

    private final TrackingUrlBuilder trackingUrlBuilder;

    public static boolean isAlreadyTracked(String html) {
        return html != null && (html.contains(APPLIED_MARKER) || html.contains(APPLIED_ATTRIBUTE));
    }

    /**
     * @param html             banner markup, may be {@code null} or malformed
     * @param bannerId         banner the click and view URLs refer to
     * @param recipientEmail   optional recipient carried in the tracking URLs
     * @param includeViewPixel append the 1x1 view pixel
     * @return the tracked markup; never throws
     */
    public String rewrite(String html, UUID bannerId, String recipientEmail, boolean includeViewPixel) {
        if (html == null) {
            return "";
        }
        if (isAlreadyTracked(html)) {
            return html;
        }

        try {
            String clickUrl = HtmlUtils.htmlEscape(trackingUrlBuilder.clickUrl(bannerId, recipientEmail));
            StringBuilder out = new StringBuilder(html.length() + 256);
            out.append(APPLIED_MARKER);
            new Scanner(html, clickUrl, out).run();

            if (includeViewPixel) {
                String viewUrl = HtmlUtils.htmlEscape(trackingUrlBuilder.viewUrl(bannerId, recipientEmail));
                out.append(PIXEL_MARKER)
                        .append("<img src=\"").append(viewUrl).append("\" width=\"1\" height=\"1\" alt=\"\"")
                        .append(" aria-hidden=\"true\" role=\"presentation\" ")
                        .append(TRACKED_ATTRIBUTE).append("=\"true\" style=\"").append(PIXEL_STYLE).append("\" />");
            }
            return out.toString();
        } catch (RuntimeException e) {
            log.error("Failed to apply tracking to banner {} HTML, returning it unchanged", bannerId, e);
            return html;
        }
    }

    /**
     * Single forward pass over the markup. Tracks how many anchors are open so images that
     * are already links are left alone.
     */
    private static final class Scanner {

        private final String html;
        private final String clickUrl;
        private final StringBuilder out;
        private int pos;
        private int anchorDepth;

        Scanner(String html, String clickUrl, StringBuilder out) {
            this.html = html;
            this.clickUrl = clickUrl;
            this.out = out;
        }

        void run() {
            int length = html.length();
            while (pos < length) {
                int lt = html.indexOf('<', pos);
                if (lt < 0) {
                    out.append(html, pos, length);
                    return;
                }
                out.append(html, pos, lt);
                pos = lt;

                if (html.startsWith("<!--", pos)) {
                    copyComment();
                } else if (isTagStart(pos + 1)) {
                    if (!copyTag()) {
                        return;
                    }
                } else {
                    out.append('<');
                    pos++;
                }
            }
        }

        private boolean isTagStart(int index) {
            if (index >= html.length()) {
                return false;
            }
            char c = html.charAt(index);
            return Character.isLetter(c) || c == '/' || c == '!' || c == '?';
        }

        private void copyComment() {
            int end = html.indexOf("-->", pos + 4);
            int stop = end < 0 ? html.length() : end + 3;
            out.append(html, pos, stop);
            pos = stop;
        }

        /**
         * @return false when the tag never closes, in which case the rest was copied verbatim
         */
        private boolean copyTag() {
            int end = findTagEnd(pos + 1);
            if (end < 0) {
                out.append(html, pos, html.length());
                pos = html.length();
                return false;
            }

            String tag = html.substring(pos, end + 1);
            pos = end + 1;

            boolean closing = tag.startsWith("</");
            String name = tagName(tag, closing ? 2 : 1);

            switch (name) {
                case "a" -> handleAnchor(tag, closing);
                case "img" -> handleImage(tag, closing);
                case "script", "style" -> {
                    out.append(tag);
                    if (!closing) {
                        copyRawText(name);
                    }
                }
                default -> out.append(tag);
            }
            return true;
        }

        private void handleAnchor(String tag, boolean closing) {
            if (closing) {
                anchorDepth = Math.max(0, anchorDepth - 1);
                out.append(tag);
                return;
            }
            // "/>" is ignored on <a>, and may just be the end of an unquoted href
            anchorDepth++;
            out.append(rewriteAnchor(tag));
        }

        private void handleImage(String tag, boolean closing) {
            if (closing || anchorDepth > 0 || TRACKED_MARK.matcher(tag).find()) {
                out.append(tag);
                return;
            }
            out.append("<a href=\"").append(clickUrl).append("\" ")
                    .append(TRACKED_ATTRIBUTE).append("=\"true\" style=\"").append(IMAGE_LINK_STYLE).append("\">")
                    .append(tag)
                    .append("</a>");
        }

        private String rewriteAnchor(String tag) {
            if (TRACKED_MARK.matcher(tag).find() || ORIGINAL_HREF_MARK.matcher(tag).find()) {
                return tag;
            }
            Matcher matcher = HREF_ATTRIBUTE.matcher(tag);
            if (!matcher.find()) {
                return tag;
            }

            String original = unquote(matcher.group(1));
            String replacement = "href=\"" + clickUrl + "\" " + ORIGINAL_HREF_ATTRIBUTE + "=\""
                    + original.replace("\"", "&quot;") + "\"";

            return tag.substring(0, matcher.start()) + replacement + tag.substring(matcher.end());
        }

        private void copyRawText(String name) {
            String lower = html.toLowerCase(Locale.ROOT);
            int close = lower.indexOf("</" + name, pos);
            int stop = close < 0 ? html.length() : close;
            out.append(html, pos, stop);
            pos = stop;
        }

        private int findTagEnd(int from) {
            char quote = 0;
            for (int i = from; i < html.length(); i++) {
                char c = html.charAt(i);
                if (quote != 0) {
                    if (c == quote) {
                        quote = 0;
                    }
                } else if ((c == '"' || c == '\'') && followsEquals(i)) {
                    quote = c;
                } else if (c == '>') {
                    return i;
                }
            }
            return -1;
        }

        // A quote only opens an attribute value when it comes right after '='
        private boolean followsEquals(int index) {
            int i = index - 1;
            while (i >= 0 && Character.isWhitespace(html.charAt(i))) {
                i--;
            }
            return i >= 0 && html.charAt(i) == '=';
        }

        private static String tagName(String tag, int start) {
            int i = start;
            while (i < tag.length() && Character.isLetterOrDigit(tag.charAt(i))) {
                i++;
            }
            return tag.substring(start, i).toLowerCase(Locale.ROOT);
        }

        private static String unquote(String value) {
            if (value.length() >= 2) {
                char first = value.charAt(0);
                char last = value.charAt(value.length() - 1);
                if ((first == '"' || first == '\'') && first == last) {
                    return value.substring(1, value.length() - 1);
                }
            }
            return value;
        }
    }
}
