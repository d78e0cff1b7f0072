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
package com.gurucue.epg.xmltv;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.gurucue.epg.DatabaseException;
import com.gurucue.epg.SyncException;
import com.gurucue.epg.data.ScheduleStore;
import com.gurucue.epg.entity.Channel;
import com.gurucue.epg.entity.Program;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.xml.stream.XMLStreamException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Downloads the XMLTV feed, streams it into the schedule store in batches
 * and finally purges programmes past the retention window.
 * <p>
 * A run is not transactional as a whole, only every batch is: when a run
 * fails, the batches flushed so far stay stored and the next run replaces
 * them by upserting. Runs must not overlap; see
 * {@link com.gurucue.epg.queueing.SyncTrigger}.
 */
public final class XmltvIngestionPipeline {
    private static final Logger log = LogManager.getLogger(XmltvIngestionPipeline.class);

    private static final String ENV_URL = "EPG_XMLTV_URL";
    private static final String ENV_DENYLIST = "EPG_DENYLIST";
    private static final String ENV_BATCH_SIZE = "EPG_BATCH_SIZE";
    private static final String ENV_RETENTION_HOURS = "EPG_RETENTION_HOURS";
    private static final String ENV_FETCH_TIMEOUT_SECONDS = "EPG_FETCH_TIMEOUT_SECONDS";

    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final long DEFAULT_RETENTION_MILLIS = 24L * 60L * 60L * 1000L;

    /**
     * Factory method for creation of a pipeline configured from environment
     * variables: <code>EPG_XMLTV_URL</code> (required), <code>EPG_DENYLIST</code>,
     * <code>EPG_BATCH_SIZE</code>, <code>EPG_RETENTION_HOURS</code> and
     * <code>EPG_FETCH_TIMEOUT_SECONDS</code>.
     *
     * @param store where to write the schedule
     * @return a new pipeline
     */
    public static XmltvIngestionPipeline create(final ScheduleStore store) {
        final String url = System.getenv(ENV_URL);
        if ((url == null) || (url.length() == 0)) throw new IllegalStateException("No XMLTV feed URL set in the environment variable " + ENV_URL);
        final String denylist = System.getenv(ENV_DENYLIST);
        final int batchSize = envInt(ENV_BATCH_SIZE, DEFAULT_BATCH_SIZE);
        final long retentionMillis = envInt(ENV_RETENTION_HOURS, 24) * 60L * 60L * 1000L;
        final int timeoutSeconds = envInt(ENV_FETCH_TIMEOUT_SECONDS, 60);
        final XmltvFeedFetcher fetcher = new XmltvFeedFetcher(URI.create(url), Duration.ofSeconds(10), Duration.ofSeconds(timeoutSeconds));
        final ContentSafetyFilter filter = denylist == null ? ContentSafetyFilter.defaultFilter() : ContentSafetyFilter.fromCommaSeparated(denylist);
        return new XmltvIngestionPipeline(fetcher, store, filter, batchSize, retentionMillis, Clock.systemUTC());
    }

    public static XmltvIngestionPipeline create(final FeedSource feedSource, final ScheduleStore store) {
        return new XmltvIngestionPipeline(feedSource, store, ContentSafetyFilter.defaultFilter(), DEFAULT_BATCH_SIZE, DEFAULT_RETENTION_MILLIS, Clock.systemUTC());
    }

    private static int envInt(final String name, final int defaultValue) {
        try {
            final int value = Integer.parseInt(System.getenv(name), 10);
            return value > 0 ? value : defaultValue;
        }
        catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private final FeedSource feedSource;
    private final ScheduleStore store;
    private final ContentSafetyFilter filter;
    private final int batchSize;
    private final long retentionMillis;
    private final Clock clock;
    private final XmltvReader reader = new XmltvReader();

    public XmltvIngestionPipeline(final FeedSource feedSource, final ScheduleStore store, final ContentSafetyFilter filter, final int batchSize, final long retentionMillis, final Clock clock) {
        if (batchSize < 1) throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        if (retentionMillis < 0L) throw new IllegalArgumentException("Retention must not be negative: " + retentionMillis);
        this.feedSource = feedSource;
        this.store = store;
        this.filter = filter;
        this.batchSize = batchSize;
        this.retentionMillis = retentionMillis;
        this.clock = clock;
    }

    /**
     * Runs one synchronization: download, parse, filter, store in batches,
     * purge programmes that ended before now minus the retention window.
     *
     * @return counts of what was written, dropped and purged
     * @throws SyncException {@link SyncException.Kind#RETRYABLE_TRANSPORT} if the feed could
     * not be downloaded or the download broke off, {@link SyncException.Kind#TERMINAL}
     * if the document is malformed or the store failed
     */
    public SyncReport sync() throws SyncException {
        final long startMillis = clock.millis();
        log.info("Starting XMLTV synchronization from " + feedSource);
        final InputStream in = feedSource.open();
        final Batcher batcher = new Batcher();
        try {
            reader.read(in, batcher);
            batcher.flushRemaining();
        }
        catch (XMLStreamException e) {
            if (isTransportFailure(e)) {
                final String reason = "XMLTV feed download broke off after " + batcher.programsWritten + " programmes: " + e.toString();
                log.warn(reason, e);
                throw SyncException.retryable(reason, e);
            }
            final String reason = "Failed to parse the XMLTV feed after " + batcher.programsWritten + " programmes: " + e.toString();
            log.error(reason, e);
            throw SyncException.terminal(reason, e);
        }
        catch (DatabaseException e) {
            final String reason = "Failed to store the XMLTV feed after " + batcher.programsWritten + " programmes: " + e.toString();
            log.error(reason, e);
            throw SyncException.terminal(reason, e);
        }
        finally {
            try {
                in.close();
            }
            catch (IOException e) {
                log.warn("Failed to close the XMLTV feed stream: " + e.toString(), e);
            }
        }

        final long cutoff = clock.millis() - retentionMillis;
        final int purged;
        try {
            purged = store.deleteProgramsOlderThan(cutoff);
        }
        catch (DatabaseException e) {
            final String reason = "Failed to purge programmes that ended before " + cutoff + ": " + e.toString();
            log.error(reason, e);
            throw SyncException.terminal(reason, e);
        }

        final SyncReport report = new SyncReport(batcher.channelsWritten, batcher.programsWritten, batcher.channelFlushes, batcher.programFlushes,
                batcher.rejectedChannels, batcher.rejectedPrograms, batcher.filteredChannels, batcher.filteredPrograms,
                purged, clock.millis() - startMillis);
        log.info("XMLTV synchronization finished; " + report);
        return report;
    }

    /**
     * Whether the parser failed because the underlying stream did, rather
     * than on the document.
     */
    static boolean isTransportFailure(final XMLStreamException e) {
        if (Throwables.getCausalChain(e).stream().anyMatch(t -> t instanceof IOException)) return true;
        final Throwable nested = e.getNestedException();
        return (nested != null) && Throwables.getCausalChain(nested).stream().anyMatch(t -> t instanceof IOException);
    }

    /**
     * Validates and filters elements as they are read and writes them in
     * batches of <code>batchSize</code>.
     */
    private final class Batcher implements XmltvReader.Listener {
        private final List<Channel> channels = new ArrayList<>(batchSize);
        private final List<Program> programs = new ArrayList<>(batchSize);
        int channelsWritten = 0;
        int programsWritten = 0;
        int channelFlushes = 0;
        int programFlushes = 0;
        int rejectedChannels = 0;
        int rejectedPrograms = 0;
        int filteredChannels = 0;
        int filteredPrograms = 0;

        @Override
        public void onChannel(final XmltvReader.XmltvChannel element) {
            if (element.id == null) {
                rejectedChannels++;
                log.debug("Skipping a channel without an id");
                return;
            }
            if (filter.isUnsafe(element.displayName)) {
                filteredChannels++;
                return;
            }
            channels.add(new Channel(element.id, element.displayName, element.iconUrl));
            if (channels.size() >= batchSize) flushChannels();
        }

        @Override
        public void onProgramme(final XmltvReader.XmltvProgramme element) {
            if (element.channelId == null) {
                rejectedPrograms++;
                log.debug("Skipping a programme without a channel, start=" + element.start);
                return;
            }
            final long startTime = XmltvDates.parse(element.start);
            final long endTime = XmltvDates.parse(element.stop);
            if ((startTime == XmltvDates.INVALID) || (endTime == XmltvDates.INVALID)) {
                rejectedPrograms++;
                log.debug("Skipping a programme on " + element.channelId + " with an unparsable time: start=" + element.start + ", stop=" + element.stop);
                return;
            }
            if (endTime <= startTime) {
                rejectedPrograms++;
                log.debug("Skipping a programme on " + element.channelId + " that does not end after it begins: start=" + element.start + ", stop=" + element.stop);
                return;
            }
            if (filter.anyUnsafe(element.title, element.description, element.category)) {
                filteredPrograms++;
                return;
            }
            programs.add(new Program(element.channelId, element.title == null ? "" : element.title, element.description, startTime, endTime, element.category));
            if (programs.size() >= batchSize) flushPrograms();
        }

        void flushRemaining() {
            if (!channels.isEmpty()) flushChannels();
            if (!programs.isEmpty()) flushPrograms();
        }

        private void flushChannels() {
            store.upsertChannels(ImmutableList.copyOf(channels));
            channelsWritten += channels.size();
            channelFlushes++;
            channels.clear();
        }

        private void flushPrograms() {
            store.upsertPrograms(ImmutableList.copyOf(programs));
            programsWritten += programs.size();
            programFlushes++;
            programs.clear();
        }
    }
}
