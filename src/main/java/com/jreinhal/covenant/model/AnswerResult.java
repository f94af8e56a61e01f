package com.jreinhal.covenant.model;

import java.util.List;

public record AnswerResult(String text, List<Citation> citations, boolean evidenceFound, int candidatesConsidered) {

    public static final String NO_EVIDENCE_TEXT =
            "No supporting content was found in the indexed documents for this question.";

    public AnswerResult {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public static AnswerResult noEvidence() {
        return new AnswerResult(NO_EVIDENCE_TEXT, List.of(), false, 0);
    }
}
