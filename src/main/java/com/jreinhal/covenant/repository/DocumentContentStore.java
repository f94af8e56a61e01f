package com.jreinhal.covenant.repository;

/**
 * Raw uploaded bytes, kept so a document can be reprocessed without a new upload.
 */
public interface DocumentContentStore {

    /**
     * @return reference to pass to {@link #load(String)}
     */
    String store(String documentId, String filename, byte[] content);

    byte[] load(String contentRef);

    void delete(String contentRef);
}
