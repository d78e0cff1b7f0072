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

/**
 * Outcome of one successful XMLTV synchronization run.
 */
public final class SyncReport {
    public final int channelsWritten;
    public final int programsWritten;
    public final int channelFlushes;
    public final int programFlushes;
    public final int rejectedChannels;
    public final int rejectedPrograms;
    public final int filteredChannels;
    public final int filteredPrograms;
    public final int purgedPrograms;
    public final long durationMillis;

    SyncReport(final int channelsWritten, final int programsWritten, final int channelFlushes, final int programFlushes,
               final int rejectedChannels, final int rejectedPrograms, final int filteredChannels, final int filteredPrograms,
               final int purgedPrograms, final long durationMillis) {
        this.channelsWritten = channelsWritten;
        this.programsWritten = programsWritten;
        this.channelFlushes = channelFlushes;
        this.programFlushes = programFlushes;
        this.rejectedChannels = rejectedChannels;
        this.rejectedPrograms = rejectedPrograms;
        this.filteredChannels = filteredChannels;
        this.filteredPrograms = filteredPrograms;
        this.purgedPrograms = purgedPrograms;
        this.durationMillis = durationMillis;
    }

    @Override
    public String toString() {
        return new StringBuilder(256)
                .append("channels written: ").append(channelsWritten).append(" in ").append(channelFlushes).append(" batches")
                .append(", programmes written: ").append(programsWritten).append(" in ").append(programFlushes).append(" batches")
                .append("; rejected channels: ").append(rejectedChannels)
                .append(", rejected programmes: ").append(rejectedPrograms)
                .append("; filtered channels: ").append(filteredChannels)
                .append(", filtered programmes: ").append(filteredPrograms)
                .append("; purged programmes: ").append(purgedPrograms)
                .append("; timing: ").append(durationMillis).append(" ms")
                .toString();
    }
}
