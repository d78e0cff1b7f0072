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
package com.gurucue.epg.data.postgresql;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;
import com.gurucue.epg.DatabaseException;
import com.gurucue.epg.data.ScheduleStore;
import com.gurucue.epg.entity.Channel;
import com.gurucue.epg.entity.Program;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Schedule store implementation for PostgreSQL. Every operation runs in
 * its own transaction on a recycled connection.
 */
public final class PostgreSqlScheduleStore implements ScheduleStore {
    private static final String JDBC_DRIVER = "org.postgresql.Driver";
    private static final String ENV_URL = "PROVIDER_POSTGRESQL_URL";
    private static final String ENV_USERNAME = "PROVIDER_POSTGRESQL_USERNAME";
    private static final String ENV_PASSWORD = "PROVIDER_POSTGRESQL_PASSWORD";
    private static final String SCHEMA_RESOURCE = "epg-schema.sql";
    private static final int MAX_IDLE_LINKS = 30;

    private static final Logger log = LogManager.getLogger(PostgreSqlScheduleStore.class);

    // makes sure the PostgreSQL JDBC driver is loaded
    static {
        try {
            Class.forName(JDBC_DRIVER);
        } catch (final ClassNotFoundException e) {
            throw new DatabaseException("Unable to load the JDBC driver for PostgreSQL: " + e.toString(), e);
        }
    }

    /**
     * Factory method for creation of a PostgreSQL schedule store instance
     * which is configured from environment variables. The user should set
     * environment variables <code>PROVIDER_POSTGRESQL_URL</code>,
     * <code>PROVIDER_POSTGRESQL_USERNAME</code> and
     * <code>PROVIDER_POSTGRESQL_PASSWORD</code> before calling this method.
     *
     * @return a new PostgreSQL schedule store instance
     */
    public static PostgreSqlScheduleStore create() {
        return new PostgreSqlScheduleStore(System.getenv(ENV_URL), System.getenv(ENV_USERNAME), System.getenv(ENV_PASSWORD));
    }

    /**
     * Factory method for creation of a PostgreSQL schedule store instance
     * which is configured with the given arguments.
     *
     * @param dbUrl the JDBC URL of the database to connect to
     * @param dbUsername username with which to login to the database
     * @param dbPassword password to use to login to the database
     * @return a new PostgreSQL schedule store instance
     */
    public static PostgreSqlScheduleStore create(final String dbUrl, final String dbUsername, final String dbPassword) {
        return new PostgreSqlScheduleStore(dbUrl, dbUsername, dbPassword);
    }

    final String jdbcUrl;
    final String jdbcUsername;
    final String jdbcPassword;

    private final ReadWriteLock rwLock;
    private final Lock readLock;
    private final Lock writeLock;
    private boolean isClosed;
    private final Queue<PostgreSqlDataLink> linkQueue;
    private final AtomicInteger linkQueueSize;
    private final ExecutorService asyncJobExecutor;
    private final ConcurrentMap<PostgreSqlDataLink, Boolean> activeLinks;

    private PostgreSqlScheduleStore(final String dbUrl, final String dbUsername, final String dbPassword) {
        this.jdbcUrl = dbUrl;
        this.jdbcUsername = dbUsername;
        this.jdbcPassword = dbPassword;
        if ((jdbcUrl == null) || (jdbcUrl.length() == 0)) throw new DatabaseException("PostgreSQL schedule store: no database URL provided, and none set in the environment variable " + ENV_URL);
        if ((jdbcUsername == null) || (jdbcUsername.length() == 0)) throw new DatabaseException("PostgreSQL schedule store: no database username provided, and none set in the environment variable " + ENV_USERNAME);
        if (jdbcPassword == null) throw new DatabaseException("PostgreSQL schedule store: no database login password provided, and none set in the environment variable " + ENV_PASSWORD);
        log.info("Using driver " + JDBC_DRIVER + " for database at " + jdbcUrl + ", username=" + jdbcUsername);

        rwLock = new ReentrantReadWriteLock();
        readLock = rwLock.readLock();
        writeLock = rwLock.writeLock();
        isClosed = false;
        linkQueue = new ConcurrentLinkedQueue<>();
        linkQueueSize = new AtomicInteger(0);
        asyncJobExecutor = Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, "PostgreSqlScheduleStore-link-recycler");
            t.setDaemon(true);
            return t;
        });
        activeLinks = new ConcurrentHashMap<>(64);
    }

    /**
     * Creates the tables and indexes if they do not exist yet.
     */
    public void ensureSchema() {
        final String script;
        try {
            script = Resources.toString(Resources.getResource(PostgreSqlScheduleStore.class, "/" + SCHEMA_RESOURCE), StandardCharsets.UTF_8);
        } catch (IOException e) {
            final String reason = "Failed to read the schema script " + SCHEMA_RESOURCE + ": " + e.toString();
            log.error(reason, e);
            throw new DatabaseException(reason, e);
        }
        inTransaction(link -> {
            for (final String statement : Splitter.on(';').trimResults().omitEmptyStrings().split(script)) {
                link.execute(statement);
            }
            return null;
        });
        log.info("Schedule schema is in place");
    }

    @Override
    public void upsertChannels(final Collection<Channel> channels) {
        if ((channels == null) || channels.isEmpty()) return;
        inTransaction(link -> {
            link.getChannelManager().upsert(channels);
            return null;
        });
    }

    @Override
    public void upsertPrograms(final Collection<Program> programs) {
        if ((programs == null) || programs.isEmpty()) return;
        inTransaction(link -> {
            link.getProgramManager().upsert(programs);
            return null;
        });
    }

    @Override
    public List<Program> queryPrograms(final Collection<String> channelIds, final long windowStart, final long windowEnd) {
        if ((channelIds == null) || channelIds.isEmpty() || (windowEnd <= windowStart)) return ImmutableList.of();
        return inTransaction(link -> ImmutableList.copyOf(link.getProgramManager().overlapping(new LinkedHashSet<>(channelIds), windowStart, windowEnd)));
    }

    @Override
    public int deleteProgramsOlderThan(final long cutoff) {
        final int deleted = inTransaction(link -> link.getProgramManager().deleteEndedBefore(cutoff));
        log.debug("Deleted " + deleted + " programmes that ended before " + cutoff);
        return deleted;
    }

    @Override
    public void deleteAllChannels() {
        inTransaction(link -> {
            link.getChannelManager().deleteAll();
            return null;
        });
    }

    @Override
    public void deleteAllPrograms() {
        inTransaction(link -> {
            link.getProgramManager().deleteAll();
            return null;
        });
    }

    @Override
    public Channel getChannel(final String channelId) {
        return inTransaction(link -> link.getChannelManager().getById(channelId));
    }

    @Override
    public int countChannels() {
        return inTransaction(link -> link.getChannelManager().count());
    }

    @Override
    public int countPrograms() {
        return inTransaction(link -> link.getProgramManager().count());
    }

    /**
     * Runs the job on a pooled link and commits, or rolls back if the job
     * throws.
     */
    private <V> V inTransaction(final Function<PostgreSqlDataLink, V> job) {
        try (final PostgreSqlDataLink link = borrowLink()) {
            final V result;
            try {
                result = job.apply(link);
            }
            catch (RuntimeException e) {
                try {
                    link.rollback();
                }
                catch (DatabaseException e1) {
                    e.addSuppressed(e1);
                }
                throw e;
            }
            link.commit();
            return result;
        }
    }

    @Override
    public void close() {
        writeLock.lock();
        try {
            if (isClosed) return;
            isClosed = true;
        }
        finally {
            writeLock.unlock();
        }
        // the recycler takes the read lock, so it is stopped outside the write lock
        log.info("Stopping the link recycler...");
        asyncJobExecutor.shutdownNow();
        try {
            asyncJobExecutor.awaitTermination(1, TimeUnit.MINUTES);
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for the link recycler to stop: " + e.toString());
            Thread.currentThread().interrupt();
        }
        log.info("Closing " + activeLinks.size() + " connections...");
        for (final PostgreSqlDataLink link : activeLinks.keySet()) {
            try {
                link.connection.close();
            }
            catch (Exception e) {
                log.error("Failed to close a JDBC connection while the store is closing: " + e.toString(), e);
            }
        }
        activeLinks.clear();
        linkQueue.clear();
        log.info("PostgreSQL schedule store is closed.");
    }

    /**
     * Hands out an idle link when one passes validation, or opens a new one.
     */
    PostgreSqlDataLink borrowLink() {
        readLock.lock();
        try {
            if (isClosed) throw new DatabaseException("The PostgreSQL schedule store is closed");
            PostgreSqlDataLink idle;
            while ((idle = linkQueue.poll()) != null) {
                linkQueueSize.decrementAndGet();
                // isValid() destroys a broken link itself
                if (idle.isValid()) return idle;
            }
            final PostgreSqlDataLink fresh = new PostgreSqlDataLink(this);
            activeLinks.put(fresh, Boolean.TRUE);
            return fresh;
        }
        finally {
            readLock.unlock();
        }
    }

    /**
     * Called from {@link PostgreSqlDataLink#close()}. The link is cleaned up
     * and parked on the recycler thread, so closing never blocks on the database.
     */
    void recycleLink(final PostgreSqlDataLink link) {
        readLock.lock();
        try {
            // close() tears down every active connection itself
            if (!isClosed) asyncJobExecutor.execute(new LinkRecycler(link));
        }
        finally {
            readLock.unlock();
        }
    }

    void forgetLink(final PostgreSqlDataLink link) {
        readLock.lock();
        try {
            if (!isClosed) activeLinks.remove(link);
        }
        finally {
            readLock.unlock();
        }
    }

    /**
     * Rolls a returned link back to a clean transaction and parks it, unless
     * {@value #MAX_IDLE_LINKS} links are idle already or the rollback fails.
     */
    private final class LinkRecycler implements Runnable {
        private final PostgreSqlDataLink link;

        LinkRecycler(final PostgreSqlDataLink link) {
            this.link = link;
        }

        @Override
        public void run() {
            try {
                link.rollback();
            }
            catch (DatabaseException e) {
                log.warn("Discarding a connection that failed to roll back: " + e.getMessage());
                link.destroy();
                return;
            }
            try {
                if (linkQueueSize.get() >= MAX_IDLE_LINKS) {
                    link.destroy();
                    return;
                }
                linkQueueSize.incrementAndGet();
                linkQueue.add(link);
            }
            catch (RuntimeException e) {
                log.error("Failed to park a returned connection: " + e.toString(), e);
                link.destroy();
            }
        }
    }
}
