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
import com.gurucue.epg.entity.CatalogChannel;
import com.gurucue.epg.entity.Program;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds guide rows for catalog channels. Catalog channels are keyed by
 * the provider's stream ID; they are joined to the schedule by their EPG
 * channel ID. A channel without an EPG channel ID, or without programmes
 * in the window, gets a single placeholder entry.
 */
public final class ChannelGuide {

    public static final class Row {
        public final CatalogChannel channel;
        public final List<ProgramProjection> programs;

        Row(final CatalogChannel channel, final List<ProgramProjection> programs) {
            this.channel = channel;
            this.programs = programs;
        }

        public boolean hasScheduleData() {
            return !programs.isEmpty() && !programs.get(0).isPlaceholder;
        }

        /**
         * @return the programme on air at the projection time, or null
         */
        public ProgramProjection live() {
            for (final ProgramProjection p : programs) {
                if (p.isLive) return p;
            }
            return null;
        }
    }

    private final ScheduleQueryEngine engine;

    public ChannelGuide(final ScheduleQueryEngine engine) {
        this.engine = Preconditions.checkNotNull(engine, "engine");
    }

    public List<Row> build(final List<CatalogChannel> channels, final long windowStart, final long windowEnd) {
        return build(channels, windowStart, windowEnd, engine.now());
    }

    /**
     * @param channels catalog channels in display order
     * @param windowStart start of the guide window, inclusive
     * @param windowEnd end of the guide window, exclusive
     * @param now the moment to project against
     * @return one row per catalog channel, in the given order
     */
    public List<Row> build(final List<CatalogChannel> channels, final long windowStart, final long windowEnd, final long now) {
        Preconditions.checkNotNull(channels, "channels");
        if (channels.isEmpty()) return ImmutableList.of();

        final Set<String> epgIds = new LinkedHashSet<>();
        for (final CatalogChannel channel : channels) {
            if (channel.hasEpgChannelId()) epgIds.add(channel.epgChannelId);
        }
        final Map<String, List<Program>> schedules = engine.schedulesForChannels(epgIds, windowStart, windowEnd);

        final List<Row> rows = new ArrayList<>(channels.size());
        for (final CatalogChannel channel : channels) {
            final List<Program> programs = channel.hasEpgChannelId() ? schedules.get(channel.epgChannelId) : null;
            if ((programs == null) || programs.isEmpty()) {
                rows.add(new Row(channel, ImmutableList.of(ProgramProjection.placeholder(channel.epgChannelId, now))));
                continue;
            }
            final ImmutableList.Builder<ProgramProjection> projections = ImmutableList.builder();
            // the catalog channel's own archive policy wins: two streams may share one EPG channel
            for (final Program program : programs) projections.add(ProgramProjection.of(program, channel.archivePolicy, now));
            rows.add(new Row(channel, projections.build()));
        }
        return rows;
    }
}
