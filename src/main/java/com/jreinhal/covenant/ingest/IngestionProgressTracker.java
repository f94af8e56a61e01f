package com.jreinhal.covenant.ingest;

import com.jreinhal.covenant.model.IngestionProgress;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Owner of the ingestion progress snapshot.
 *
 * <p>Every change builds a new {@link IngestionProgress} and swaps it in under one lock, and
 * readers take the same lock, so a poll never sees a half-applied update. A run starts when
 * work arrives while idle and ends when every accepted document has finished; work accepted
 * during a run extends it. {@code completed} only grows within a run and never exceeds
 * {@code total}.</p>
 */
@Component
public class IngestionProgressTracker {
    private final Object lock = new Object();
    private final Clock clock;
    private IngestionProgress current = IngestionProgress.idle();

    @Autowired
    public IngestionProgressTracker() {
        this(Clock.systemUTC());
    }

    IngestionProgressTracker(Clock clock) {
        this.clock = clock;
    }

    public IngestionProgress snapshot() {
        synchronized (this.lock) {
            return this.current;
        }
    }

    public void enqueued(Collection<String> documentIds) {
        if (documentIds.isEmpty()) {
            return;
        }
        synchronized (this.lock) {
            IngestionProgress p = this.current;
            if (p.running()) {
                this.current = new IngestionProgress(p.total() + documentIds.size(), p.completed(), p.currentDocuments(),
                        p.errors(), true, p.startedAt(), null);
            } else {
                this.current = new IngestionProgress(documentIds.size(), 0, List.of(), List.of(), true, this.now(), null);
            }
        }
    }

    public void started(String documentId) {
        synchronized (this.lock) {
            IngestionProgress p = this.current;
            List<String> working = new ArrayList<>(p.currentDocuments());
            if (!working.contains(documentId)) {
                working.add(documentId);
            }
            this.current = new IngestionProgress(p.total(), p.completed(), working, p.errors(), p.running(),
                    p.startedAt(), p.finishedAt());
        }
    }

    /**
     * @param error failure reason, or {@code null} when the document finished without error
     */
    public void finished(String documentId, String error) {
        synchronized (this.lock) {
            IngestionProgress p = this.current;
            if (!p.running()) {
                return;
            }
            List<String> working = new ArrayList<>(p.currentDocuments());
            working.remove(documentId);
            List<String> errors = p.errors();
            if (error != null) {
                errors = new ArrayList<>(p.errors());
                errors.add(documentId + ": " + error);
            }
            int completed = Math.min(p.total(), p.completed() + 1);
            boolean running = completed < p.total();
            this.current = new IngestionProgress(p.total(), completed, working, errors, running, p.startedAt(),
                    running ? null : this.now());
        }
    }

    private Instant now() {
        return this.clock.instant();
    }
}
