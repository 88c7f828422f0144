package com.williamcallahan.gemtext.service.gemtext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Minimum-raggedness word wrap for table cells.
 *
 * <p>Line breaks are chosen to minimise the sum of squared trailing slack over all
 * lines but the last, rather than filling each line greedily. No line is longer than
 * the limit, which is first raised to the widest single word.</p>
 */
final class WordWrapper {

    private WordWrapper() {
    }

    /**
     * Wraps text at a width limit.
     *
     * @param text text whose newlines count as spaces
     * @param limit preferred maximum line width; raised to the widest single word
     * @return wrapped lines, at least one
     */
    static List<String> wrap(String text, int limit) {
        String[] words = text.replace('\n', ' ').split(" ", -1);
        int effectiveLimit = limit;
        for (String word : words) {
            effectiveLimit = Math.max(effectiveLimit, displayWidth(word));
        }
        int[] breaks = breakPoints(words, effectiveLimit);
        List<String> lines = new ArrayList<>();
        int start = 0;
        while (start < words.length) {
            lines.add(String.join(" ", Arrays.asList(words).subList(start, breaks[start])));
            start = breaks[start];
        }
        return lines;
    }

    private static int[] breakPoints(String[] words, int limit) {
        int count = words.length;
        // widthBefore[i]: summed width of the first i words
        long[] widthBefore = new long[count + 1];
        for (int index = 0; index < count; index++) {
            widthBefore[index + 1] = widthBefore[index] + displayWidth(words[index]);
        }
        int[] nextBreak = new int[count];
        long[] cost = new long[count];
        for (int first = count - 1; first >= 0; first--) {
            if (lineWidth(widthBefore, first, count) <= limit) {
                cost[first] = 0;
                nextBreak[first] = count;
                continue;
            }
            cost[first] = Long.MAX_VALUE;
            for (int next = first + 1; next < count; next++) {
                long width = lineWidth(widthBefore, first, next);
                if (width > limit) {
                    break;
                }
                long slack = limit - width;
                long candidate = slack * slack + cost[next];
                if (candidate < cost[first]) {
                    cost[first] = candidate;
                    nextBreak[first] = next;
                }
            }
        }
        return nextBreak;
    }

    /**
     * Width of words {@code first} up to, not including, {@code end} joined by single spaces.
     */
    private static long lineWidth(long[] widthBefore, int first, int end) {
        return widthBefore[end] - widthBefore[first] + (end - first - 1);
    }

    static int displayWidth(String text) {
        return text.codePointCount(0, text.length());
    }
}
