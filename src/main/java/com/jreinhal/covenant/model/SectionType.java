package com.jreinhal.covenant.model;

public enum SectionType {
    TITLE,
    RECITAL,
    HEADER,
    CLAUSE,
    BODY
}
