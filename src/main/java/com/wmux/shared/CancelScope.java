package com.wmux.shared;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Hierarchical cancellation token. Cancelling a scope cancels every scope
 * derived from it; a child derived from a cancelled scope starts cancelled.
 */
public final class CancelScope {

    private final CancelScope parent;
    private final List<CancelScope> children = new ArrayList<>();
    private final List<Runnable> callbacks = new ArrayList<>();
    private final CountDownLatch done = new CountDownLatch(1);
    private boolean cancelled;

    private CancelScope(CancelScope parent) {
        this.parent = parent;
    }

    public static CancelScope root() {
        return new CancelScope(null);
    }

    public CancelScope child() {
        CancelScope child = new CancelScope(this);
        synchronized (this) {
            if (!cancelled) {
                children.add(child);
                return child;
            }
        }
        child.cancel();
        return child;
    }

    public void cancel() {
        List<CancelScope> toCancel;
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toCancel = new ArrayList<>(children);
            toRun = new ArrayList<>(callbacks);
            children.clear();
            callbacks.clear();
        }
        done.countDown();
        for (CancelScope child : toCancel) {
            child.cancel();
        }
        for (Runnable callback : toRun) {
            runCallback(callback);
        }
        if (parent != null) {
            parent.detach(this);
        }
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    /**
     * Registers a callback run once on cancellation, or immediately if the
     * scope is already cancelled.
     */
    public void onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        runCallback(callback);
    }

    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return done.await(timeout, unit);
    }

    private synchronized void detach(CancelScope child) {
        children.remove(child);
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            System.err.println("[CancelScope] Cancel callback failed: " + e.getMessage());
        }
    }
}
