package com.jreinhal.covenant.constant;

import java.util.Set;

public final class StopWords {

    /**
     * Dropped from indexed chunk text and from lexical queries. Contract vocabulary such as
     * "shall" and "party" is kept.
     */
    public static final Set<String> LEXICAL = Set.of(
            "a", "an", "the", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "can", "and", "but", "or", "nor", "for", "so", "as", "if",
            "when", "where", "what", "which", "who", "whom", "whose", "why", "how",
            "that", "this", "these", "those", "then", "than", "in", "on", "at", "by",
            "with", "about", "into", "to", "from", "of", "up", "out", "i", "me", "my",
            "we", "our", "us", "you", "your", "it", "its", "they", "them", "their",
            "tell", "show", "give", "find", "also"
    );

    private StopWords() {
    }
}
