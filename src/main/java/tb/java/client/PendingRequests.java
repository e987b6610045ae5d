package tb.java.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tb.java.wire.AcquireResponse;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-flight requests of one connection, keyed by correlation id.
 * A response completes the entry with its id, in whatever order it arrives.
 */
final class PendingRequests {

    private static final Logger log = LoggerFactory.getLogger(PendingRequests.class);

    private final ConcurrentHashMap<Long, CompletableFuture<AcquireResponse>> byId = new ConcurrentHashMap<>();

    CompletableFuture<AcquireResponse> register(long correlationId) {
        CompletableFuture<AcquireResponse> future = new CompletableFuture<>();
        if (byId.putIfAbsent(correlationId, future) != null) {
            throw new IllegalStateException("correlation id already in flight: " + correlationId);
        }
        return future;
    }

    void complete(AcquireResponse response) {
        CompletableFuture<AcquireResponse> future = byId.remove(response.correlationId());
        if (future == null) {
            // Timed out or cancelled before the answer arrived
            log.debug("Dropping response for unknown correlation id {}", response.correlationId());
            return;
        }
        future.complete(response);
    }

    void remove(long correlationId) {
        byId.remove(correlationId);
    }

    void failAll(Throwable cause) {
        for (Map.Entry<Long, CompletableFuture<AcquireResponse>> entry : byId.entrySet()) {
            if (byId.remove(entry.getKey(), entry.getValue())) {
                entry.getValue().completeExceptionally(cause);
            }
        }
    }

    int size() {
        return byId.size();
    }
}
