package com.jreinhal.covenant.index;

import com.jreinhal.covenant.constant.StopWords;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lower-cases text and splits it into index terms.
 *
 * Dollar amounts and decimals survive as single terms ({@code $55.00}); an amount is also
 * emitted without its currency sign so "55.00" in a query matches "$55.00" in a chunk.
 */
public final class Tokenizer {
    private static final Pattern SEPARATORS = Pattern.compile("[^a-z0-9$.]+");

    private Tokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> terms = new ArrayList<>();
        for (String raw : SEPARATORS.split(text.toLowerCase(Locale.ROOT))) {
            String token = trimDots(raw);
            if (token.isEmpty() || token.equals("$")) {
                continue;
            }
            if (token.indexOf('$') > 0) {
                token = token.replace("$", "");
            }
            if (!isTerm(token)) {
                continue;
            }
            terms.add(token);
            if (token.startsWith("$") && token.length() > 1) {
                terms.add(token.substring(1));
            }
        }
        return terms;
    }

    /**
     * Distinct terms in first-seen order.
     */
    public static List<String> distinctTerms(String text) {
        return new ArrayList<>(new LinkedHashSet<>(tokenize(text)));
    }

    private static boolean isTerm(String token) {
        if (StopWords.LEXICAL.contains(token)) {
            return false;
        }
        return token.length() > 1 || Character.isDigit(token.charAt(0));
    }

    private static String trimDots(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && token.charAt(start) == '.') {
            start++;
        }
        while (end > start && token.charAt(end - 1) == '.') {
            end--;
        }
        return token.substring(start, end);
    }
}
