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

import com.google.common.collect.ImmutableList;
import com.gurucue.epg.SyncException;
import com.gurucue.epg.entity.Program;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import javax.xml.stream.XMLStreamException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class XmltvIngestionPipelineTests {
    private static final long T0 = Instant.parse("2024-01-01T12:00:00Z").toEpochMilli();
    private static final long HALF_HOUR = 30L * 60L * 1000L;
    private static final long HOUR = 2L * HALF_HOUR;

    private RecordingScheduleStore store;

    @Before
    public void setUp() {
        store = new RecordingScheduleStore();
    }

    @After
    public void tearDown() {
        store.close();
    }

    private static FeedSource feedOf(final String xml) {
        return () -> new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8));
    }

    private XmltvIngestionPipeline pipeline(final FeedSource feed, final long now) {
        return new XmltvIngestionPipeline(feed, store, ContentSafetyFilter.defaultFilter(), XmltvIngestionPipeline.DEFAULT_BATCH_SIZE,
                XmltvIngestionPipeline.DEFAULT_RETENTION_MILLIS, Clock.fixed(Instant.ofEpochMilli(now), ZoneOffset.UTC));
    }

    private static String programme(final String channel, final long start, final long stop, final String title) {
        return "<programme channel=\"" + channel + "\" start=\"" + XmltvDates.format(start) + "\" stop=\"" + XmltvDates.format(stop) + "\">" +
                "<title>" + title + "</title></programme>\n";
    }

    private static String consecutiveProgrammes(final String channel, final int count) {
        final StringBuilder sb = new StringBuilder("<tv><channel id=\"" + channel + "\"><display-name>Channel</display-name></channel>\n");
        for (int i = 0; i < count; i++) {
            sb.append(programme(channel, T0 + i * HALF_HOUR, T0 + (i + 1) * HALF_HOUR, "Show " + i));
        }
        return sb.append("</tv>").toString();
    }

    @Test
    public void writesInBatchesOfOneHundred() throws SyncException {
        final SyncReport report = pipeline(feedOf(consecutiveProgrammes("c1", 250)), T0).sync();

        assertEquals(ImmutableList.of(100, 100, 50), store.programBatches);
        assertEquals(ImmutableList.of(1), store.channelBatches);
        assertEquals(250, report.programsWritten);
        assertEquals(3, report.programFlushes);
        assertEquals(1, report.channelsWritten);
        assertEquals(250, store.countPrograms());
        assertEquals("Channel", store.getChannel("c1").displayName);
    }

    @Test
    public void storedProgrammeIsFoundByItsWindow() throws SyncException {
        pipeline(feedOf("<tv>" + programme("c1", T0, T0 + HALF_HOUR, "News") + "</tv>"), T0).sync();

        final List<Program> hit = store.queryPrograms(ImmutableList.of("c1"), T0 - 1L, T0 + 1L);
        assertEquals(1, hit.size());
        assertEquals("News", hit.get(0).title);
        assertEquals(T0, hit.get(0).startTime);
        assertEquals(T0 + HALF_HOUR, hit.get(0).endTime);
        assertTrue(store.queryPrograms(ImmutableList.of("c1"), T0 + HALF_HOUR + 1L, T0 + HOUR).isEmpty());
    }

    @Test
    public void rejectsProgrammesThatDoNotEndAfterTheyBegin() throws SyncException {
        final String xml = "<tv>" +
                programme("c1", T0, T0, "Zero") +
                programme("c1", T0 + HOUR, T0, "Backwards") +
                "<programme channel=\"c1\" start=\"tomorrow\" stop=\"20240101130000 +0000\"><title>Bad</title></programme>" +
                "<programme start=\"20240101120000 +0000\" stop=\"20240101130000 +0000\"><title>Orphan</title></programme>" +
                programme("c1", T0 + 2 * HOUR, T0 + 3 * HOUR, "Fine") +
                "</tv>";
        final SyncReport report = pipeline(feedOf(xml), T0).sync();

        assertEquals(4, report.rejectedPrograms);
        assertEquals(1, report.programsWritten);
        assertEquals(1, store.countPrograms());
        assertEquals("Fine", store.queryPrograms(ImmutableList.of("c1"), T0, T0 + 4 * HOUR).get(0).title);
    }

    @Test
    public void filtersDenylistedContent() throws SyncException {
        final String xml = "<tv>" +
                "<channel id=\"a\"><display-name>Adult Zone</display-name></channel>" +
                "<channel id=\"b\"><display-name>Kids</display-name></channel>" +
                programme("b", T0, T0 + HOUR, "XXX Files") +
                "<programme channel=\"b\" start=\"" + XmltvDates.format(T0 + HOUR) + "\" stop=\"" + XmltvDates.format(T0 + 2 * HOUR) + "\">" +
                "<title>Movie</title><category>porn</category></programme>" +
                programme("b", T0 + 2 * HOUR, T0 + 3 * HOUR, "Cartoons") +
                "<programme channel=\"b\" start=\"" + XmltvDates.format(T0 + 3 * HOUR) + "\" stop=\"" + XmltvDates.format(T0 + 4 * HOUR) + "\">" +
                "<title>Late Show</title><desc>contains xxx scenes</desc></programme>" +
                "</tv>";
        final SyncReport report = pipeline(feedOf(xml), T0).sync();

        assertEquals(1, report.filteredChannels);
        assertEquals(3, report.filteredPrograms);
        assertTrue(store.queryPrograms("b", T0 + 3 * HOUR, T0 + 4 * HOUR).isEmpty());
        assertNull(store.getChannel("a"));
        assertNotNull(store.getChannel("b"));
        final List<Program> programs = store.queryPrograms(ImmutableList.of("b"), T0, T0 + 3 * HOUR);
        assertEquals(1, programs.size());
        assertEquals("Cartoons", programs.get(0).title);
    }

    @Test
    public void missingTitleBecomesEmpty() throws SyncException {
        pipeline(feedOf("<tv><programme channel=\"c1\" start=\"" + XmltvDates.format(T0) + "\" stop=\"" + XmltvDates.format(T0 + HOUR) + "\"/></tv>"), T0).sync();
        assertEquals("", store.queryPrograms(ImmutableList.of("c1"), T0, T0 + HOUR).get(0).title);
    }

    @Test
    public void repeatedRunsAreIdempotent() throws SyncException {
        final String xml = consecutiveProgrammes("c1", 10);
        pipeline(feedOf(xml), T0).sync();
        final List<Program> first = store.queryPrograms(ImmutableList.of("c1"), T0, T0 + 5 * HOUR);
        pipeline(feedOf(xml), T0).sync();
        final List<Program> second = store.queryPrograms(ImmutableList.of("c1"), T0, T0 + 5 * HOUR);

        assertEquals(10, store.countPrograms());
        assertEquals(1, store.countChannels());
        assertEquals(first, second);
    }

    @Test
    public void purgesProgrammesPastRetention() throws SyncException {
        final long now = T0 + 3L * 24L * HOUR;
        final String xml = "<tv>" +
                programme("c1", T0, T0 + HOUR, "Old") +
                programme("c1", now - 2 * HOUR, now - HOUR, "Recent") +
                programme("c1", now, now + HOUR, "Current") +
                "</tv>";
        final SyncReport report = pipeline(feedOf(xml), now).sync();

        assertEquals(1, report.purgedPrograms);
        assertEquals(2, store.countPrograms());
        assertTrue(store.queryPrograms(ImmutableList.of("c1"), T0, T0 + HOUR).isEmpty());
    }

    @Test
    public void malformedDocumentIsTerminal() {
        final String xml = "<tv>" + programme("c1", T0, T0 + HOUR, "Kept") + "<programme channel=\"c1\"><title>Broken</programme></tv>";
        try {
            new XmltvIngestionPipeline(feedOf(xml), store, ContentSafetyFilter.defaultFilter(), 1,
                    XmltvIngestionPipeline.DEFAULT_RETENTION_MILLIS, Clock.fixed(Instant.ofEpochMilli(T0), ZoneOffset.UTC)).sync();
            fail("Expected a SyncException");
        }
        catch (SyncException e) {
            assertEquals(SyncException.Kind.TERMINAL, e.getKind());
            assertFalse(e.isRetryable());
        }
        // batches flushed before the failure stay stored
        assertEquals(1, store.countPrograms());
    }

    @Test
    public void storeFailureIsTerminal() {
        store.failOnProgramBatch = 1;
        try {
            pipeline(feedOf(consecutiveProgrammes("c1", 250)), T0).sync();
            fail("Expected a SyncException");
        }
        catch (SyncException e) {
            assertEquals(SyncException.Kind.TERMINAL, e.getKind());
        }
        assertEquals(100, store.countPrograms());
    }

    @Test
    public void feedFailureIsPassedOn() {
        final FeedSource unreachable = () -> {
            throw SyncException.retryable("connection refused", new IOException("connection refused"));
        };
        try {
            pipeline(unreachable, T0).sync();
            fail("Expected a SyncException");
        }
        catch (SyncException e) {
            assertTrue(e.isRetryable());
        }
        assertTrue(store.programBatches.isEmpty());
    }

    @Test
    public void feedStreamIsClosed() throws SyncException {
        final boolean[] closed = {false};
        final byte[] xml = consecutiveProgrammes("c1", 3).getBytes(StandardCharsets.UTF_8);
        final FeedSource feed = () -> new ByteArrayInputStream(xml) {
            @Override
            public void close() throws IOException {
                closed[0] = true;
                super.close();
            }
        };
        pipeline(feed, T0).sync();
        assertTrue(closed[0]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositiveBatchSize() {
        new XmltvIngestionPipeline(feedOf("<tv/>"), store, ContentSafetyFilter.defaultFilter(), 0, 0L, Clock.systemUTC());
    }

    @Test
    public void readFailureOfTheStreamCountsAsTransportFailure() {
        assertTrue(XmltvIngestionPipeline.isTransportFailure(new XMLStreamException("read failed", new IOException("connection reset"))));
        assertFalse(XmltvIngestionPipeline.isTransportFailure(new XMLStreamException("unexpected close tag")));
    }
}
