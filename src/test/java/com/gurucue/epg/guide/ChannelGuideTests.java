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
package com.gurucue.epg.guide;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.gurucue.epg.caching.InMemoryScheduleStore;
import com.gurucue.epg.entity.ArchivePolicy;
import com.gurucue.epg.entity.CatalogChannel;
import com.gurucue.epg.entity.Program;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ChannelGuideTests {
    private static final long T0 = 1704110400000L;
    private static final long HOUR = 3600000L;

    private InMemoryScheduleStore store;
    private ChannelGuide guide;

    @Before
    public void setUp() {
        store = new InMemoryScheduleStore();
        store.upsertPrograms(ImmutableList.of(
                new Program("bbc1.uk", "Earlier", null, T0 - 2 * HOUR, T0 - HOUR, null),
                new Program("bbc1.uk", "Now", null, T0 - HOUR, T0 + HOUR, null)));
        guide = new ChannelGuide(new ScheduleQueryEngine(store, Clock.fixed(Instant.ofEpochMilli(T0), ZoneOffset.UTC), ImmutableMap.of()));
    }

    @After
    public void tearDown() {
        store.close();
    }

    @Test
    public void joinsOnTheEpgChannelId() {
        final CatalogChannel hd = new CatalogChannel(101, "BBC One HD", "bbc1.uk", ArchivePolicy.enabled(2));
        final CatalogChannel sd = new CatalogChannel(102, "BBC One", " bbc1.uk ", null);
        final List<ChannelGuide.Row> rows = guide.build(ImmutableList.of(hd, sd), T0 - 3 * HOUR, T0 + 3 * HOUR);

        assertEquals(2, rows.size());
        final ChannelGuide.Row hdRow = rows.get(0);
        assertSame(hd, hdRow.channel);
        assertTrue(hdRow.hasScheduleData());
        assertEquals(2, hdRow.programs.size());
        assertEquals("Now", hdRow.live().title);
        // the catalog channel's own archive policy applies
        assertTrue(hdRow.programs.get(0).isCatchupAvailable);
        assertFalse(rows.get(1).programs.get(0).isCatchupAvailable);
    }

    @Test
    public void channelsWithoutScheduleGetAPlaceholder() {
        final List<ChannelGuide.Row> rows = guide.build(ImmutableList.of(
                new CatalogChannel(1, "No EPG", null, null),
                new CatalogChannel(2, "Unknown EPG", "nothing.here", ArchivePolicy.enabled(1))), T0 - HOUR, T0 + HOUR);

        for (final ChannelGuide.Row row : rows) {
            assertFalse(row.hasScheduleData());
            assertEquals(1, row.programs.size());
            final ProgramProjection placeholder = row.programs.get(0);
            assertTrue(placeholder.isPlaceholder);
            assertTrue(placeholder.isLive);
            assertFalse(placeholder.isCatchupAvailable);
            assertEquals(ProgramProjection.PLACEHOLDER_TITLE, placeholder.title);
            assertEquals(ProgramProjection.PLACEHOLDER_DESCRIPTION, placeholder.description);
            assertEquals(T0 - HOUR, placeholder.startTime);
            assertEquals(T0 + HOUR, placeholder.endTime);
            assertEquals(120, placeholder.getDurationMinutes());
        }
        assertNull(rows.get(0).programs.get(0).channelId);
        assertEquals("nothing.here", rows.get(1).programs.get(0).channelId);
    }

    @Test
    public void noChannelsNoRows() {
        assertTrue(guide.build(ImmutableList.of(), T0, T0 + HOUR).isEmpty());
    }
}
