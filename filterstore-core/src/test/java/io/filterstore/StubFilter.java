package io.filterstore;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory {@link Filter} whose last-taken time is set by the test. */
public final class StubFilter implements Filter {
    private final FilterId id;
    private volatile Instant lastTaken;
    private volatile ResultSink sink;
    public final AtomicInteger clearCalls = new AtomicInteger();

    public StubFilter(FilterId id, Instant lastTaken) {
        this.id = id;
        this.lastTaken = lastTaken;
    }

    public StubFilter(Instant lastTaken) {
        this(FilterIdGenerator.getDefault().newFilterId(), lastTaken);
    }

    public StubFilter() {
        this(Instant.now());
    }

    @Override
    public FilterId id() {
        return id;
    }

    @Override
    public Instant lastTaken() {
        return lastTaken;
    }

    public void take(Instant when) {
        this.lastTaken = when;
    }

    @Override
    public void setSubChannel(ResultSink sink) {
        this.sink = sink;
    }

    @Override
    public void clearSubChannel() {
        clearCalls.incrementAndGet();
        this.sink = null;
    }

    public ResultSink sink() {
        return sink;
    }
}
