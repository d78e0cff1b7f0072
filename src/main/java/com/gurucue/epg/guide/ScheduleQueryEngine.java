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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.gurucue.epg.data.ScheduleStore;
import com.gurucue.epg.entity.ArchivePolicy;
import com.gurucue.epg.entity.Program;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Answers "what is on these channels between these times" from the
 * schedule store, with every programme projected against the current
 * time. Read-only and safe for concurrent use, also while a
 * synchronization is writing: a query may then see some channels
 * refreshed and others not yet.
 */
public final class ScheduleQueryEngine {
    private static final Logger log = LogManager.getLogger(ScheduleQueryEngine.class);

    private final ScheduleStore store;
    private final Clock clock;
    private final Function<String, ArchivePolicy> archivePolicies;

    /**
     * @param store the schedule store to read from
     * @param clock source of "now"
     * @param archivePolicies maps an EPG channel ID to its archive policy; null results mean no archive
     */
    public ScheduleQueryEngine(final ScheduleStore store, final Clock clock, final Function<String, ArchivePolicy> archivePolicies) {
        this.store = Preconditions.checkNotNull(store, "store");
        this.clock = Preconditions.checkNotNull(clock, "clock");
        this.archivePolicies = Preconditions.checkNotNull(archivePolicies, "archivePolicies");
    }

    public ScheduleQueryEngine(final ScheduleStore store, final Clock clock, final Map<String, ArchivePolicy> archivePolicies) {
        this(store, clock, ImmutableMap.copyOf(archivePolicies)::get);
    }

    public List<ProgramProjection> programsForChannel(final String channelId, final long windowStart, final long windowEnd) {
        return programsForChannel(channelId, windowStart, windowEnd, clock.millis());
    }

    public List<ProgramProjection> programsForChannel(final String channelId, final long windowStart, final long windowEnd, final long now) {
        Preconditions.checkNotNull(channelId, "channelId");
        final List<ProgramProjection> result = programsForChannels(ImmutableList.of(channelId), windowStart, windowEnd, now).get(channelId);
        return result == null ? ImmutableList.of() : result;
    }

    public Map<String, List<ProgramProjection>> programsForChannels(final Collection<String> channelIds, final long windowStart, final long windowEnd) {
        return programsForChannels(channelIds, windowStart, windowEnd, clock.millis());
    }

    /**
     * Returns the programmes overlapping <code>[windowStart, windowEnd)</code>
     * for each requested channel, ordered by begin time.
     *
     * @param channelIds EPG channel IDs; the result keeps their order, duplicates collapsed
     * @param windowStart start of the window, inclusive
     * @param windowEnd end of the window, exclusive
     * @param now the moment to project against
     * @return a map with an entry for every requested channel, possibly an empty list;
     * an empty map if no channel was requested
     */
    public Map<String, List<ProgramProjection>> programsForChannels(final Collection<String> channelIds, final long windowStart, final long windowEnd, final long now) {
        final Map<String, List<Program>> schedules = schedulesForChannels(channelIds, windowStart, windowEnd);
        if (schedules.isEmpty()) return ImmutableMap.of();
        final ImmutableMap.Builder<String, List<ProgramProjection>> result = ImmutableMap.builder();
        for (final Map.Entry<String, List<Program>> entry : schedules.entrySet()) {
            final List<Program> programs = entry.getValue();
            if (programs.isEmpty()) {
                result.put(entry.getKey(), ImmutableList.of());
                continue;
            }
            final ArchivePolicy policy = policyFor(entry.getKey());
            final ImmutableList.Builder<ProgramProjection> projections = ImmutableList.builder();
            for (final Program program : programs) projections.add(ProgramProjection.of(program, policy, now));
            result.put(entry.getKey(), projections.build());
        }
        return result.build();
    }

    /**
     * Returns the stored programmes overlapping <code>[windowStart, windowEnd)</code>
     * grouped by channel, each group ordered by begin time, without projecting them.
     *
     * @return a map with an entry for every requested channel, in request order
     */
    public Map<String, List<Program>> schedulesForChannels(final Collection<String> channelIds, final long windowStart, final long windowEnd) {
        Preconditions.checkNotNull(channelIds, "channelIds");
        if (channelIds.isEmpty()) return ImmutableMap.of();

        final Map<String, List<Program>> grouped = new LinkedHashMap<>();
        for (final String channelId : channelIds) {
            if (channelId != null) grouped.putIfAbsent(channelId, new ArrayList<>());
        }
        if (grouped.isEmpty()) return ImmutableMap.of();

        final long startNano = System.nanoTime();
        final List<Program> programs = windowEnd > windowStart ? store.queryPrograms(grouped.keySet(), windowStart, windowEnd) : ImmutableList.of();
        for (final Program program : programs) {
            final List<Program> list = grouped.get(program.channelId);
            if (list != null) list.add(program);
        }

        final ImmutableMap.Builder<String, List<Program>> result = ImmutableMap.builder();
        for (final Map.Entry<String, List<Program>> entry : grouped.entrySet()) {
            result.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
        }
        if (log.isDebugEnabled()) {
            log.debug("Fetched " + programs.size() + " programmes of " + grouped.size() + " channels between " + windowStart + " and " + windowEnd + " in " + (System.nanoTime() - startNano) + " ns");
        }
        return result.build();
    }

    public long now() {
        return clock.millis();
    }

    ArchivePolicy policyFor(final String channelId) {
        final ArchivePolicy policy = archivePolicies.apply(channelId);
        return policy == null ? ArchivePolicy.DISABLED : policy;
    }
}
