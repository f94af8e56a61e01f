package com.jreinhal.covenant.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Facts read off a contract's text at ingestion time. Every fact keeps the absolute span of the
 * text it was read from, using the same offsets as {@link DocumentChunk}, so answers built from
 * it can cite the contract itself. Absent facts are {@code null}.
 */
public record ContractMetadata(List<Party> parties,
                               LocalDate effectiveDate, Span effectiveDateSpan,
                               String governingLaw, Span governingLawSpan,
                               Boolean mutual, Span mutualSpan,
                               Integer termMonths, Span termSpan,
                               Integer survivalMonths, Span survivalSpan) {

    public ContractMetadata {
        parties = parties == null ? List.of() : List.copyOf(parties);
    }

    public static ContractMetadata empty() {
        return new ContractMetadata(List.of(), null, null, null, null, null, null, null, null, null, null);
    }

    public boolean hasFacts() {
        return !parties.isEmpty() || effectiveDate != null || governingLaw != null || mutual != null
                || termMonths != null || survivalMonths != null;
    }

    public record Party(String name, PartyRole role, int spanStart, int spanEnd) {
    }

    public record Span(int start, int end) {
    }

    public enum PartyRole {
        DISCLOSING,
        RECEIVING,
        UNSPECIFIED
    }
}
