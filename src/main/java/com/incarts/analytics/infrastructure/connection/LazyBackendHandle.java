package com.incarts.analytics.infrastructure.connection;

import com.incarts.analytics.domain.exception.BackendUnavailableException;
import com.incarts.analytics.domain.executor.ExecutorKind;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Process-wide backend client built on first use.
 *
 * Concurrent first callers construct it once; later callers reuse it. A failed
 * construction is not remembered, so the next call tries again.
 */
@Slf4j
public class LazyBackendHandle<T> implements Supplier<T> {

    private final ExecutorKind kind;
    private final Callable<T> factory;
    private volatile T handle;

    public LazyBackendHandle(ExecutorKind kind, Callable<T> factory) {
        this.kind = kind;
        this.factory = factory;
    }

    @Override
    public T get() {
        T current = handle;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (handle == null) {
                handle = create();
            }
            return handle;
        }
    }

    public boolean isInitialized() {
        return handle != null;
    }

    public ExecutorKind getKind() {
        return kind;
    }

    private T create() {
        try {
            T created = factory.call();
            if (created == null) {
                throw new BackendUnavailableException(kind, kind + " backend factory returned no client");
            }
            log.info("{} backend client initialized", kind);
            return created;
        } catch (BackendUnavailableException e) {
            log.warn("{} backend unavailable: {}", kind, e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Failed to initialize {} backend client: {}", kind, e.getMessage());
            throw new BackendUnavailableException(kind, "Could not initialize " + kind + " backend", e);
        }
    }
}
