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
import com.gurucue.epg.entity.Program;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ScheduleQueryEngineTests {
    private static final long T0 = 1704110400000L;
    private static final long HALF_HOUR = 1800000L;
    private static final long HOUR = 3600000L;

    private InMemoryScheduleStore store;
    private ScheduleQueryEngine engine;

    @Before
    public void setUp() {
        store = new InMemoryScheduleStore();
        store.upsertPrograms(ImmutableList.of(
                new Program("c1", "Morning", null, T0 - HOUR, T0 - HALF_HOUR, null),
                new Program("c1", "News", "Headlines", T0, T0 + HALF_HOUR, "News"),
                new Program("c1", "Film", null, T0 + HALF_HOUR, T0 + 3 * HOUR, "Movie"),
                new Program("c2", "Cartoons", null, T0, T0 + HOUR, null)));
        engine = new ScheduleQueryEngine(store, Clock.fixed(Instant.ofEpochMilli(T0 + 900000L), ZoneOffset.UTC),
                ImmutableMap.of("c1", ArchivePolicy.enabled(1)));
    }

    @After
    public void tearDown() {
        store.close();
    }

    @Test
    public void projectsAgainstNow() {
        final List<ProgramProjection> programs = engine.programsForChannel("c1", T0 - HOUR, T0 + HOUR);
        assertEquals(3, programs.size());

        final ProgramProjection morning = programs.get(0);
        assertFalse(morning.isLive);
        assertTrue(morning.isCatchupAvailable);

        final ProgramProjection news = programs.get(1);
        assertEquals("News", news.title);
        assertTrue(news.isLive);
        assertEquals(0.5f, news.progress, 0.0001f);
        assertFalse(news.isCatchupAvailable);
        assertFalse(news.isPlaceholder);

        assertFalse(programs.get(2).isLive);
    }

    @Test
    public void liveFlagFollowsTheProjectionTime() {
        final List<ProgramProjection> later = engine.programsForChannel("c1", T0, T0 + HALF_HOUR, T0 + HALF_HOUR + 1L);
        assertEquals(1, later.size());
        assertFalse(later.get(0).isLive);
        assertTrue(later.get(0).isCatchupAvailable);
    }

    @Test
    public void channelsWithoutPolicyHaveNoCatchup() {
        final List<ProgramProjection> programs = engine.programsForChannel("c2", T0, T0 + HOUR, T0 + 2 * HOUR);
        assertEquals(1, programs.size());
        assertFalse(programs.get(0).isCatchupAvailable);
    }

    @Test
    public void everyRequestedChannelHasAnEntryInRequestOrder() {
        final Map<String, List<ProgramProjection>> result = engine.programsForChannels(ImmutableList.of("unknown", "c2", "c1", "c2"), T0, T0 + HALF_HOUR);
        assertEquals(ImmutableList.of("unknown", "c2", "c1"), ImmutableList.copyOf(result.keySet()));
        assertTrue(result.get("unknown").isEmpty());
        assertEquals(1, result.get("c2").size());
        assertEquals(1, result.get("c1").size());
    }

    @Test
    public void noChannelsMeansNoResult() {
        assertTrue(engine.programsForChannels(ImmutableList.of(), T0, T0 + HOUR).isEmpty());
    }

    @Test
    public void emptyWindowYieldsEmptyLists() {
        final Map<String, List<ProgramProjection>> result = engine.programsForChannels(ImmutableList.of("c1"), T0 + HOUR, T0);
        assertEquals(1, result.size());
        assertTrue(result.get("c1").isEmpty());
    }
}
