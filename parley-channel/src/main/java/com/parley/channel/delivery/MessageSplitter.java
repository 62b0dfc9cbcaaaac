package com.parley.channel.delivery;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits reply text into platform-sized chunks at readable boundaries.
 * <p>
 * Cuts fall after the separator, so the chunks concatenate back to the input.
 * Break preference inside the window: paragraph break, line break, sentence
 * end, then a space. Paragraph, line and space breaks are only taken in the
 * second half of the window. A cut never lands inside a fenced code block,
 * an inline code span, a {@code <...>} token (mentions, emoji, timestamps),
 * a markdown link or a bare URL, unless that unit alone is longer than the
 * limit. A surrogate pair is never split.
 */
public final class MessageSplitter {

    private MessageSplitter() {
    }

    private static final Pattern FENCED_CODE = Pattern.compile("```.*?(```|\\z)", Pattern.DOTALL);
    private static final Pattern INLINE_CODE = Pattern.compile("`[^`\\n]+`");
    private static final Pattern ANGLE_TOKEN = Pattern.compile("<[^<>\\s]+>");
    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[[^\\]\\n]*]\\([^)\\s]*\\)");
    private static final Pattern BARE_URL = Pattern.compile("https?://\\S+");

    /**
     * Split {@code text} into chunks of at most {@code limit} characters.
     * Text within the limit comes back as a single chunk, even when empty.
     */
    public static List<String> split(String text, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        String body = text != null ? text : "";
        if (body.length() <= limit) {
            return List.of(body);
        }

        List<int[]> spans = protectedSpans(body);
        List<String> chunks = new ArrayList<>();
        int pos = 0;
        while (body.length() - pos > limit) {
            int cut = keepSurrogatePair(body, pos, findCut(body, pos, pos + limit, spans));
            chunks.add(body.substring(pos, cut));
            pos = cut;
        }
        if (pos < body.length()) {
            chunks.add(body.substring(pos));
        }
        return chunks;
    }

    /**
     * Prefix each chunk with {@code [Part i/n]} when there is more than one.
     */
    public static List<String> withPartHeaders(List<String> chunks) {
        if (chunks.size() <= 1) {
            return chunks;
        }
        List<String> out = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            out.add(partHeader(i + 1, chunks.size()) + chunks.get(i));
        }
        return out;
    }

    public static String partHeader(int index, int total) {
        return "[Part " + index + "/" + total + "]\n";
    }

    // =========================================================================
    // Internal helpers
    // =========================================================================

    private static int findCut(String text, int from, int windowEnd, List<int[]> spans) {
        int half = from + (windowEnd - from) / 2;

        int cut = lastAllowed(text, "\n\n", from, windowEnd, half, spans);
        if (cut < 0)
            cut = lastAllowed(text, "\n", from, windowEnd, half, spans);
        if (cut < 0)
            cut = lastAllowed(text, ". ", from, windowEnd, from, spans);
        if (cut < 0)
            cut = lastAllowed(text, " ", from, windowEnd, half, spans);
        if (cut >= 0)
            return cut;

        int[] span = spanContaining(windowEnd, spans);
        if (span == null) {
            return windowEnd;
        }
        if (span[0] > from) {
            // keep the unit whole for the next chunk
            return span[0];
        }
        // the unit alone exceeds the limit: prefer a line break inside it
        int newline = text.lastIndexOf('\n', windowEnd - 1);
        if (newline >= from) {
            return newline + 1;
        }
        return windowEnd;
    }

    /** Moves a cut that falls between a high and a low surrogate back by one. */
    static int keepSurrogatePair(String text, int from, int cut) {
        if (cut < text.length() && cut - 1 > from && Character.isLowSurrogate(text.charAt(cut))
                && Character.isHighSurrogate(text.charAt(cut - 1))) {
            return cut - 1;
        }
        return cut;
    }

    private static int lastAllowed(String text, String sep, int from, int windowEnd, int minCut,
            List<int[]> spans) {
        int idx = text.lastIndexOf(sep, windowEnd - sep.length());
        while (idx >= from) {
            int cut = idx + sep.length();
            if (cut <= minCut) {
                return -1;
            }
            if (spanContaining(cut, spans) == null) {
                return cut;
            }
            idx = text.lastIndexOf(sep, idx - 1);
        }
        return -1;
    }

    /** Span strictly enclosing the cut position, or null. */
    private static int[] spanContaining(int cut, List<int[]> spans) {
        for (int[] span : spans) {
            if (span[0] < cut && cut < span[1]) {
                return span;
            }
        }
        return null;
    }

    static List<int[]> protectedSpans(String text) {
        List<int[]> spans = new ArrayList<>();
        Matcher fences = FENCED_CODE.matcher(text);
        while (fences.find()) {
            spans.add(new int[] { fences.start(), fences.end() });
        }
        for (Pattern pattern : List.of(INLINE_CODE, ANGLE_TOKEN, MARKDOWN_LINK, BARE_URL)) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                if (spanContaining(m.start() + 1, spans) == null) {
                    spans.add(new int[] { m.start(), m.end() });
                }
            }
        }
        return spans;
    }
}
