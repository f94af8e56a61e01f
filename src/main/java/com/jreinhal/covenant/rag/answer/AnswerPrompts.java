package com.jreinhal.covenant.rag.answer;

final class AnswerPrompts {
    static final String REFUSAL = "I cannot find this information in the provided documents.";

    static final String SYSTEM = """
            You answer questions about contracts and agreements using only the excerpts provided.

            Rules:
            1. Use only facts stated in the excerpts. Never use outside knowledge and never guess.
            2. After every claim, cite the excerpt that supports it in this exact form:
               [E2: "exact words copied from excerpt E2"]
               The quoted words must be copied verbatim from that excerpt. A short phrase is enough.
            3. Quote amounts, dates, durations and party names exactly as written.
            4. If the excerpts do not contain the answer, reply with exactly this sentence and nothing else:
               %s
            """.formatted(REFUSAL);

    static final String SPAN_MATCH = """
            Find the text in the SOURCE EXCERPT that supports the CLAIM.

            CLAIM:
            "%s"

            SOURCE EXCERPT:
            %s

            Respond in this exact format:
            MATCHING_TEXT: <text copied character for character from the source excerpt, or none>
            """;

    private AnswerPrompts() {
    }

    static String user(String question, String context) {
        return "EXCERPTS:\n\n" + context + "\n\nQUESTION: " + question;
    }

    static boolean isRefusal(String answer) {
        return stripPeriod(answer.strip()).equalsIgnoreCase(stripPeriod(REFUSAL));
    }

    private static String stripPeriod(String value) {
        return value.endsWith(".") ? value.substring(0, value.length() - 1) : value;
    }
}
