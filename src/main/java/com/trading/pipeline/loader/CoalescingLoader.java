package com.trading.pipeline.loader;

import com.trading.pipeline.api.LoadRequest;
import com.trading.pipeline.api.Loader;
import com.trading.pipeline.data.AssetUniverse;
import com.trading.pipeline.data.Matrix;
import com.trading.pipeline.term.Term;

import java.time.LocalDate;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shares one delegate call between identical requests.
 *
 * <p>
 * The first caller for a (term, start, end, assets) key performs the load;
 * concurrent and later callers with the same key wait for and receive the same
 * array. A failed load is shared the same way. Instances are meant to live for
 * one run, so nothing is evicted.
 */
public final class CoalescingLoader implements Loader {
    private final Loader delegate;
    private final ConcurrentMap<LoadRequest, CompletableFuture<Matrix>> inFlight = new ConcurrentHashMap<>();
    private final AtomicInteger delegateCalls = new AtomicInteger();
    private final AtomicInteger sharedHits = new AtomicInteger();

    public CoalescingLoader(Loader delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public Matrix getWindow(Term term, LocalDate start, LocalDate end, AssetUniverse assets) {
        LoadRequest key = new LoadRequest(term, start, end, assets);
        CompletableFuture<Matrix> mine = new CompletableFuture<>();
        CompletableFuture<Matrix> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            sharedHits.incrementAndGet();
            try {
                return existing.join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException re)
                    throw re;
                if (e.getCause() instanceof Error err)
                    throw err;
                throw e;
            }
        }
        delegateCalls.incrementAndGet();
        try {
            Matrix m = delegate.getWindow(term, start, end, assets);
            mine.complete(m);
            return m;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        }
    }

    /** Calls that reached the delegate. */
    public int delegateCalls() {
        return delegateCalls.get();
    }

    /** Calls answered from an earlier or in-flight identical request. */
    public int sharedHits() {
        return sharedHits.get();
    }
}
