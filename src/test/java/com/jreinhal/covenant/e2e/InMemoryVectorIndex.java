package com.jreinhal.covenant.e2e;

import com.jreinhal.covenant.index.VectorIndex;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exact cosine-distance search over a map.
 */
public class InMemoryVectorIndex implements VectorIndex {
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public void upsert(String chunkId, String documentId, float[] vector) {
        this.entries.put(chunkId, new Entry(chunkId, documentId, vector.clone()));
    }

    @Override
    public List<VectorHit> query(float[] vector, int k, String documentId) {
        List<VectorHit> hits = new ArrayList<>();
        for (Entry entry : this.entries.values()) {
            if (documentId != null && !documentId.equals(entry.documentId())) {
                continue;
            }
            hits.add(new VectorHit(entry.chunkId(), entry.documentId(), 1.0 - cosine(vector, entry.vector())));
        }
        return hits.stream()
                .sorted(Comparator.comparingDouble(VectorHit::distance).thenComparing(VectorHit::chunkId))
                .limit(k)
                .toList();
    }

    @Override
    public long deleteByDocument(String documentId) {
        List<String> ids = this.entries.values().stream()
                .filter(e -> e.documentId().equals(documentId))
                .map(Entry::chunkId)
                .toList();
        ids.forEach(this.entries::remove);
        return ids.size();
    }

    @Override
    public long countByDocument(String documentId) {
        return this.entries.values().stream().filter(e -> e.documentId().equals(documentId)).count();
    }

    public int size() {
        return this.entries.size();
    }

    private static double cosine(float[] a, float[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < Math.min(a.length, b.length); i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private record Entry(String chunkId, String documentId, float[] vector) {
    }
}
