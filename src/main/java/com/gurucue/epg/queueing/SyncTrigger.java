/*
 * This file is part of Guru Cue Search & Recommendation Engine.
 * Copyright (C) 2017 Guru Cue Ltd.
 *
 * Guru Cue Search & Recommendation Engine is free software: you can
 * redistribute it and/or modify it under the terms of the GNU General
 * Public License as published by the Free Software Foundation, either
 * version 3 of the License, or (at your option) any later version.
 *
 * Guru Cue Search & Recommendation Engine is distributed in the hope
 * that it will be useful, but WITHOUT ANY WARRANTY; without even the
 * implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 * See the GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with Guru Cue Search & Recommendation Engine. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.gurucue.epg.queueing;

import com.gurucue.epg.SyncException;
import com.gurucue.epg.xmltv.SyncReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs synchronizations on a single background thread, at most one at a
 * time. A request arriving while a run is queued, in progress or waiting
 * for a retry is dropped: the existing run is kept. Runs that fail on the
 * transport are retried with an exponential backoff; terminal failures are
 * only logged, the next request starts afresh.
 */
public final class SyncTrigger {
    private static final Logger log = LogManager.getLogger(SyncTrigger.class);

    public static final long DEFAULT_INITIAL_BACKOFF_MILLIS = 30000L;
    public static final long DEFAULT_MAX_BACKOFF_MILLIS = 30L * 60L * 1000L;
    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    /**
     * One synchronization run, usually {@link com.gurucue.epg.xmltv.XmltvIngestionPipeline#sync()}.
     */
    public interface SyncJob {
        SyncReport run() throws SyncException;
    }

    private final String name;
    private final SyncJob job;
    private final NetworkStatus network;
    private final long initialBackoffMillis;
    private final long maxBackoffMillis;
    private final int maxAttempts;
    private final ScheduledExecutorService executor;

    private final Lock lock = new ReentrantLock();
    private final Condition runFinished = lock.newCondition();
    private boolean inFlight = false;
    private boolean running = true;
    private SyncReport lastReport = null;
    private SyncException lastFailure = null;
    private int completedRuns = 0;

    public SyncTrigger(final String name, final SyncJob job, final NetworkStatus network) {
        this(name, job, network, DEFAULT_INITIAL_BACKOFF_MILLIS, DEFAULT_MAX_BACKOFF_MILLIS, DEFAULT_MAX_ATTEMPTS);
    }

    public SyncTrigger(final String name, final SyncJob job, final NetworkStatus network, final long initialBackoffMillis, final long maxBackoffMillis, final int maxAttempts) {
        if (maxAttempts < 1) throw new IllegalArgumentException("At least one attempt is required");
        this.name = name;
        this.job = job;
        this.network = network == null ? NetworkStatus.ALWAYS_CONNECTED : network;
        this.initialBackoffMillis = initialBackoffMillis;
        this.maxBackoffMillis = Math.max(initialBackoffMillis, maxBackoffMillis);
        this.maxAttempts = maxAttempts;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "SyncTrigger-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Requests a synchronization run.
     *
     * @return true if a run was started, false if the request was dropped because a
     * run is already pending, the network is down, or the trigger is shut down
     */
    public boolean requestSync() {
        if (!network.isConnected()) {
            log.info(name + ": network is not connected, synchronization request dropped");
            return false;
        }
        lock.lock();
        try {
            if (!running) {
                log.warn(name + ": trigger is shut down, synchronization request dropped");
                return false;
            }
            if (inFlight) {
                log.debug(name + ": a synchronization is already pending, keeping it and dropping the new request");
                return false;
            }
            inFlight = true;
        }
        finally {
            lock.unlock();
        }
        try {
            executor.execute(new Attempt(1));
        }
        catch (RejectedExecutionException e) {
            log.warn(name + ": synchronization could not be queued: " + e.toString());
            finished(null, null);
            return false;
        }
        return true;
    }

    public boolean isSyncPending() {
        lock.lock();
        try {
            return inFlight;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Waits until no run is pending anymore, retries included.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(final long timeout, final TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (inFlight) {
                if (nanos <= 0L) return false;
                nanos = runFinished.awaitNanos(nanos);
            }
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    public SyncReport getLastReport() {
        lock.lock();
        try {
            return lastReport;
        }
        finally {
            lock.unlock();
        }
    }

    public SyncException getLastFailure() {
        lock.lock();
        try {
            return lastFailure;
        }
        finally {
            lock.unlock();
        }
    }

    public int getCompletedRuns() {
        lock.lock();
        try {
            return completedRuns;
        }
        finally {
            lock.unlock();
        }
    }

    public void shutdown() {
        lock.lock();
        try {
            if (!running) return;
            running = false;
        }
        finally {
            lock.unlock();
        }
        log.info(name + ": stopping synchronization thread...");
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) log.warn(name + ": synchronization thread failed to stop in a minute");
        }
        catch (InterruptedException e) {
            log.error(name + ": interrupted while waiting for the synchronization thread to stop: " + e.toString());
            Thread.currentThread().interrupt();
        }
        lock.lock();
        try {
            inFlight = false;
            runFinished.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    long backoffMillis(final int attempt) {
        long delay = initialBackoffMillis;
        for (int i = 1; (i < attempt) && (delay < maxBackoffMillis); i++) delay *= 2L;
        return Math.min(delay, maxBackoffMillis);
    }

    private void finished(final SyncReport report, final SyncException failure) {
        lock.lock();
        try {
            inFlight = false;
            if (report != null) lastReport = report;
            lastFailure = failure;
            completedRuns++;
            runFinished.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    private final class Attempt implements Runnable {
        private final int attempt;

        Attempt(final int attempt) {
            this.attempt = attempt;
        }

        @Override
        public void run() {
            final String logPrefix = "[" + name + " #" + attempt + "] ";
            final SyncReport report;
            try {
                if (!network.isConnected()) throw new SyncException(SyncException.Kind.RETRYABLE_TRANSPORT, "Network is not connected");
                report = job.run();
            }
            catch (SyncException e) {
                if (e.isRetryable() && (attempt < maxAttempts) && retry(logPrefix, e)) return;
                log.error(logPrefix + "Synchronization failed, giving up: " + e.getMessage(), e);
                finished(null, e);
                return;
            }
            catch (Throwable e) {
                log.error(logPrefix + "Synchronization failed unexpectedly: " + e.toString(), e);
                finished(null, SyncException.terminal("Synchronization failed unexpectedly: " + e.toString(), e));
                return;
            }
            log.info(logPrefix + "Synchronization succeeded");
            finished(report, null);
        }

        private boolean retry(final String logPrefix, final SyncException e) {
            final long delay = backoffMillis(attempt);
            try {
                executor.schedule(new Attempt(attempt + 1), delay, TimeUnit.MILLISECONDS);
            }
            catch (RejectedExecutionException e1) {
                log.warn(logPrefix + "Cannot schedule a retry, the trigger is shutting down");
                return false;
            }
            log.warn(logPrefix + "Synchronization failed, retrying in " + delay + " ms: " + e.getMessage());
            return true;
        }
    }
}
