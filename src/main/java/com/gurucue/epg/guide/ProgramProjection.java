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

import com.gurucue.epg.entity.ArchivePolicy;
import com.gurucue.epg.entity.Program;

/**
 * A programme as seen at a particular moment: whether it is on air, how
 * far along it is and whether it can be replayed. Computed per query and
 * never stored.
 */
public final class ProgramProjection {
    public static final String PLACEHOLDER_TITLE = "No Program Info";
    public static final String PLACEHOLDER_DESCRIPTION = "Program information not available";
    private static final long PLACEHOLDER_HALF_SPAN = 60L * 60L * 1000L;

    public final String channelId;
    public final String title;
    public final String description;
    public final String category;
    public final long startTime;
    public final long endTime;
    public final boolean isLive;
    public final boolean isCatchupAvailable;
    public final float progress;
    public final boolean isPlaceholder;

    private ProgramProjection(final String channelId, final String title, final String description, final String category,
                              final long startTime, final long endTime, final boolean isLive, final boolean isCatchupAvailable,
                              final float progress, final boolean isPlaceholder) {
        this.channelId = channelId;
        this.title = title;
        this.description = description;
        this.category = category;
        this.startTime = startTime;
        this.endTime = endTime;
        this.isLive = isLive;
        this.isCatchupAvailable = isCatchupAvailable;
        this.progress = progress;
        this.isPlaceholder = isPlaceholder;
    }

    public static ProgramProjection of(final Program program, final ArchivePolicy policy, final long now) {
        return new ProgramProjection(program.channelId, program.title, program.description, program.category,
                program.startTime, program.endTime,
                CatchupPolicy.isLive(program.startTime, program.endTime, now),
                CatchupPolicy.isCatchupAvailable(policy, program.startTime, program.endTime, now),
                CatchupPolicy.progress(program.startTime, program.endTime, now),
                false);
    }

    /**
     * Stands in for a channel without schedule data: one hour either side
     * of <code>now</code>, live, never replayable.
     *
     * @param channelId the EPG channel ID, may be null when the channel has none
     */
    public static ProgramProjection placeholder(final String channelId, final long now) {
        return new ProgramProjection(channelId, PLACEHOLDER_TITLE, PLACEHOLDER_DESCRIPTION, null,
                now - PLACEHOLDER_HALF_SPAN, now + PLACEHOLDER_HALF_SPAN, true, false, 0.5f, true);
    }

    public int getDurationMinutes() {
        return (int) ((endTime - startTime) / 60000L);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(128);
        sb.append("ProgramProjection(").append(channelId).append(", \"").append(title).append("\", ")
                .append(startTime).append("-").append(endTime);
        if (isLive) sb.append(", live ").append(Math.round(progress * 100f)).append("%");
        if (isCatchupAvailable) sb.append(", catch-up");
        return sb.append(")").toString();
    }
}
