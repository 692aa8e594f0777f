package com.p14n.pubsub.lifecycle;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A cancellable scope that work can observe to find out it should wind down.
 * Cancelling a scope cancels every scope derived from it. Cancellation is
 * cooperative: it runs registered callbacks and flips {@link #isCancelled()},
 * nothing is interrupted.
 */
public final class LifecycleScope {
    private static final Logger logger = LoggerFactory.getLogger(LifecycleScope.class);

    private final String name;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    private LifecycleScope(String name) {
        this.name = name;
    }

    public static LifecycleScope root(String name) {
        return new LifecycleScope(name);
    }

    /**
     * Derives a scope that is cancelled when this one is. A child of an already
     * cancelled scope starts out cancelled.
     *
     * @param childName name used in logs
     * @return the child scope
     */
    public LifecycleScope child(String childName) {
        var child = new LifecycleScope(name + "/" + childName);
        onCancel(child::cancel);
        return child;
    }

    /**
     * Registers a callback to run on cancellation. Runs immediately when the
     * scope is already cancelled.
     *
     * @param callback the callback
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runCallback(callback);
        }
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        logger.atDebug().addArgument(name).log("Scope {} cancelled");
        for (var callback : callbacks) {
            if (callbacks.remove(callback)) {
                runCallback(callback);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String name() {
        return name;
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(name)
                    .log("Cancellation callback failed in scope {}");
        }
    }
}
