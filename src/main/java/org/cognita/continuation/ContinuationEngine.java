package org.cognita.continuation;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.cognita.runtime.model.ContinuationPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks pending continuations and resolves each one to either an attached extension or its
 * default target.
 * <p>
 * Every continuation moves {@code OPEN -> EXTENDED | TIMED_OUT -> RESOLVED}. An extension is
 * accepted only while the continuation is OPEN and its deadline has not passed; any later attach
 * is answered with {@link AttachResult#ALREADY_RESOLVED} and never throws. Resolved continuations
 * leave the pending set but stay in a bounded history ({@code resolvedHistorySize}, oldest evicted
 * first) so late extensions for them are still recognized. All operations are thread-safe:
 * extensions usually arrive on a delivery thread while the owning loop polls.
 */
public class ContinuationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ContinuationEngine.class);

    private final Clock clock;
    private final long defaultTimeoutMs;
    private final Map<String, PendingContinuation> pending = new ConcurrentHashMap<>();
    private final Map<String, Object> payloads = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> signals = new ConcurrentHashMap<>();
    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong timedOut = new AtomicLong();
    private final Map<String, PendingContinuation> history;

    /**
     * Creates an engine with default options and the system clock.
     */
    public ContinuationEngine() {
        this(ConfigFactory.empty(), Clock.systemUTC());
    }

    /**
     * Creates an engine.
     * @param options The {@code cognita.continuation} configuration subtree.
     * @param clock The clock deadlines are measured against.
     */
    public ContinuationEngine(Config options, Clock clock) {
        Config defaults = ConfigFactory.parseMap(Map.of(
                "defaultTimeoutMs", 5000,
                "resolvedHistorySize", 256));
        Config finalConfig = options.withFallback(defaults);
        this.defaultTimeoutMs = finalConfig.getLong("defaultTimeoutMs");
        if (defaultTimeoutMs < 0) {
            throw new IllegalArgumentException("defaultTimeoutMs must not be negative");
        }
        int historySize = finalConfig.getInt("resolvedHistorySize");
        if (historySize < 0) {
            throw new IllegalArgumentException("resolvedHistorySize must not be negative");
        }
        this.history = Collections.synchronizedMap(new LinkedHashMap<String, PendingContinuation>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, PendingContinuation> eldest) {
                return size() > historySize;
            }
        });
        this.clock = clock;
    }

    /**
     * Opens a continuation.
     * @param pointName The continuation point name.
     * @param timeout How long to wait for an extension; null uses the configured default.
     * @param defaultTarget The flow name or bytecode offset to continue at without extension.
     * @return The new OPEN continuation.
     */
    public PendingContinuation open(String pointName, Duration timeout, String defaultTarget) {
        long timeoutMs = timeout != null ? timeout.toMillis() : defaultTimeoutMs;
        PendingContinuation continuation = new PendingContinuation(
                UUID.randomUUID().toString(),
                pointName,
                ContinuationPoint.hashName(pointName),
                clock.millis() + timeoutMs,
                defaultTarget,
                ContinuationState.OPEN,
                null);
        signals.put(continuation.id(), new CompletableFuture<>());
        pending.put(continuation.id(), continuation);
        LOG.debug("Opened continuation {} at '{}' (timeout {} ms)", continuation.id(), pointName, timeoutMs);
        return continuation;
    }

    /**
     * Attaches an extension without checking its attach-point hash.
     * @see #attachExtension(String, Object, Integer)
     */
    public AttachResult attachExtension(String continuationId, Object payload) {
        return attachExtension(continuationId, payload, null);
    }

    /**
     * Attaches an extension to a continuation.
     * @param continuationId The continuation id.
     * @param payload The extension payload.
     * @param attachPointHash The point hash the extension declares, or null to skip the check.
     * @return The attach outcome.
     */
    public AttachResult attachExtension(String continuationId, Object payload, Integer attachPointHash) {
        long now = clock.millis();
        AttachResult[] result = {AttachResult.NOT_FOUND};
        pending.computeIfPresent(continuationId, (id, current) -> {
            if (attachPointHash != null && attachPointHash != current.nameHash()) {
                result[0] = AttachResult.MISMATCHED;
                return current;
            }
            if (current.state() != ContinuationState.OPEN) {
                result[0] = AttachResult.ALREADY_RESOLVED;
                return current;
            }
            if (now >= current.deadlineEpochMs()) {
                result[0] = AttachResult.ALREADY_RESOLVED;
                timedOut.incrementAndGet();
                return current.withState(ContinuationState.TIMED_OUT);
            }
            result[0] = AttachResult.ACCEPTED;
            payloads.put(id, payload);
            return current.withExtension(describe(payload));
        });
        if (result[0] == AttachResult.NOT_FOUND && history.containsKey(continuationId)) {
            result[0] = AttachResult.ALREADY_RESOLVED;
        }

        switch (result[0]) {
            case ACCEPTED -> {
                accepted.incrementAndGet();
                signal(continuationId);
                LOG.debug("Extension attached to continuation {}", continuationId);
            }
            case ALREADY_RESOLVED -> {
                rejected.incrementAndGet();
                signal(continuationId);
                LOG.debug("Extension for continuation {} rejected: already resolved", continuationId);
            }
            case MISMATCHED -> {
                rejected.incrementAndGet();
                LOG.debug("Extension for continuation {} rejected: attach point mismatch", continuationId);
            }
            case NOT_FOUND -> LOG.debug("Extension for unknown continuation {}", continuationId);
        }
        return result[0];
    }

    /**
     * Attaches an extension to the oldest OPEN continuation with the given point name.
     * @param pointName The continuation point name.
     * @param payload The extension payload.
     * @return {@link AttachResult#NOT_FOUND} if no continuation with that name exists,
     *         {@link AttachResult#ALREADY_RESOLVED} if none of them is still OPEN.
     */
    public AttachResult attachExtensionByName(String pointName, Object payload) {
        List<PendingContinuation> candidates = pending.values().stream()
                .filter(p -> p.pointName().equals(pointName))
                .sorted(Comparator.comparingLong(PendingContinuation::deadlineEpochMs))
                .toList();
        if (candidates.isEmpty()) {
            if (wasResolved(pointName)) {
                rejected.incrementAndGet();
                LOG.debug("Extension for continuation point '{}' rejected: already resolved", pointName);
                return AttachResult.ALREADY_RESOLVED;
            }
            LOG.debug("Extension for unknown continuation point '{}'", pointName);
            return AttachResult.NOT_FOUND;
        }
        AttachResult last = AttachResult.ALREADY_RESOLVED;
        for (PendingContinuation candidate : candidates) {
            if (candidate.state() == ContinuationState.OPEN) {
                last = attachExtension(candidate.id(), payload, null);
                if (last == AttachResult.ACCEPTED) {
                    return last;
                }
            }
        }
        if (candidates.stream().noneMatch(p -> p.state() == ContinuationState.OPEN)) {
            rejected.incrementAndGet();
            LOG.debug("Extension for continuation point '{}' rejected: already resolved", pointName);
        }
        return last;
    }

    /**
     * Moves every OPEN continuation whose deadline has passed to TIMED_OUT.
     * @return The continuations that timed out during this call.
     */
    public List<PendingContinuation> poll() {
        long now = clock.millis();
        List<PendingContinuation> expired = new ArrayList<>();
        for (String id : pending.keySet()) {
            pending.computeIfPresent(id, (key, current) -> {
                if (current.state() == ContinuationState.OPEN && now >= current.deadlineEpochMs()) {
                    PendingContinuation next = current.withState(ContinuationState.TIMED_OUT);
                    expired.add(next);
                    return next;
                }
                return current;
            });
        }
        for (PendingContinuation continuation : expired) {
            timedOut.incrementAndGet();
            signal(continuation.id());
            LOG.debug("Continuation {} at '{}' timed out", continuation.id(), continuation.pointName());
        }
        return expired;
    }

    /**
     * Checks whether a continuation can be resolved now (extended, or past its deadline).
     */
    public boolean isResolvable(String continuationId) {
        PendingContinuation continuation = pending.get(continuationId);
        if (continuation == null) {
            return false;
        }
        return continuation.state() == ContinuationState.EXTENDED
                || continuation.state() == ContinuationState.TIMED_OUT
                || (continuation.state() == ContinuationState.OPEN && clock.millis() >= continuation.deadlineEpochMs());
    }

    /**
     * Resolves a continuation and moves it from the pending set to the resolved history.
     * @param continuationId The continuation id.
     * @return The resolution: the extension if EXTENDED, the default target if TIMED_OUT.
     * @throws NoSuchElementException if the id is unknown.
     * @throws IllegalStateException if the continuation is still OPEN before its deadline.
     */
    public Resolution resolve(String continuationId) {
        poll();
        PendingContinuation[] before = new PendingContinuation[1];
        PendingContinuation resolved = pending.computeIfPresent(continuationId, (id, current) -> {
            before[0] = current;
            if (current.state() == ContinuationState.OPEN) {
                return current;
            }
            return current.withState(ContinuationState.RESOLVED);
        });
        if (resolved == null) {
            throw new NoSuchElementException("Unknown continuation " + continuationId);
        }
        if (resolved.state() != ContinuationState.RESOLVED) {
            throw new IllegalStateException("Continuation " + continuationId + " is still open");
        }
        pending.remove(continuationId);
        history.put(continuationId, resolved);
        signals.remove(continuationId);
        Object payload = payloads.remove(continuationId);
        boolean extended = before[0].state() == ContinuationState.EXTENDED && payload != null;
        LOG.debug("Continuation {} resolved with {}", continuationId, extended ? "extension" : "default flow");
        return new Resolution(before[0], extended, extended ? payload : null);
    }

    /**
     * Waits until the continuation is extended or its deadline passes, then resolves it.
     * Never waits longer than the remaining time to the deadline.
     * @param continuationId The continuation id.
     * @return The resolution.
     * @throws InterruptedException if the waiting thread is interrupted.
     */
    public Resolution awaitResolution(String continuationId) throws InterruptedException {
        PendingContinuation continuation = pending.get(continuationId);
        if (continuation == null) {
            throw new NoSuchElementException("Unknown continuation " + continuationId);
        }
        CompletableFuture<Void> signal = signals.get(continuationId);
        long remaining = continuation.remainingMs(clock.millis());
        if (signal != null && continuation.state() == ContinuationState.OPEN && remaining > 0) {
            try {
                signal.get(remaining, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                LOG.debug("Continuation {} reached its deadline", continuationId);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Continuation signal failed", e.getCause());
            }
        }
        // The clock may lag the timed wait by a few milliseconds.
        long lag = pending.getOrDefault(continuationId, continuation).remainingMs(clock.millis());
        if (lag > 0 && pending.get(continuationId) != null
                && pending.get(continuationId).state() == ContinuationState.OPEN) {
            Thread.sleep(lag);
        }
        return resolve(continuationId);
    }

    /**
     * Removes a continuation without resolving it, e.g. when its owner stops.
     */
    public void discard(String continuationId) {
        pending.remove(continuationId);
        payloads.remove(continuationId);
        CompletableFuture<Void> signal = signals.remove(continuationId);
        if (signal != null) {
            signal.complete(null);
        }
    }

    public Optional<PendingContinuation> get(String continuationId) {
        return Optional.ofNullable(pending.get(continuationId));
    }

    /**
     * Looks up a continuation that has already been resolved.
     * @return The RESOLVED record while it is still in the history.
     */
    public Optional<PendingContinuation> getResolved(String continuationId) {
        return Optional.ofNullable(history.get(continuationId));
    }

    /**
     * @return All pending continuations as plain data.
     */
    public List<PendingContinuation> snapshot() {
        return pending.values().stream()
                .sorted(Comparator.comparingLong(PendingContinuation::deadlineEpochMs))
                .toList();
    }

    /**
     * Restores continuations from a snapshot. EXTENDED entries whose payload is not available
     * any more fall back to TIMED_OUT so they resolve to their default target.
     */
    public void restore(List<PendingContinuation> continuations) {
        for (PendingContinuation continuation : continuations) {
            PendingContinuation restored = continuation;
            if (continuation.state() == ContinuationState.EXTENDED && !payloads.containsKey(continuation.id())) {
                restored = new PendingContinuation(continuation.id(), continuation.pointName(), continuation.nameHash(),
                        continuation.deadlineEpochMs(), continuation.defaultTarget(), ContinuationState.TIMED_OUT, null);
            }
            if (restored.state() == ContinuationState.RESOLVED) {
                continue;
            }
            pending.put(restored.id(), restored);
            CompletableFuture<Void> signal = new CompletableFuture<>();
            if (restored.state() != ContinuationState.OPEN) {
                signal.complete(null);
            }
            signals.put(restored.id(), signal);
        }
    }

    public long getAcceptedCount() {
        return accepted.get();
    }

    public long getRejectedCount() {
        return rejected.get();
    }

    public long getTimedOutCount() {
        return timedOut.get();
    }

    public int getPendingCount() {
        return pending.size();
    }

    private boolean wasResolved(String pointName) {
        synchronized (history) {
            return history.values().stream().anyMatch(p -> p.pointName().equals(pointName));
        }
    }

    private void signal(String continuationId) {
        CompletableFuture<Void> signal = signals.get(continuationId);
        if (signal != null) {
            signal.complete(null);
        }
    }

    private static String describe(Object payload) {
        return payload == null ? "null" : payload.getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(payload));
    }
}
