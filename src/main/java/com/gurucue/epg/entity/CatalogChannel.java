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
package com.gurucue.epg.entity;

/**
 * A live channel from the provider's catalog. Its stream ID lives in the
 * provider's identifier space; the EPG channel ID, when present, is the
 * join key into the schedule.
 */
public final class CatalogChannel {
    public final int streamId;
    public final String name;
    public final String epgChannelId;
    public final ArchivePolicy archivePolicy;

    public CatalogChannel(final int streamId, final String name, final String epgChannelId, final ArchivePolicy archivePolicy) {
        this.streamId = streamId;
        this.name = name;
        this.epgChannelId = ((epgChannelId == null) || epgChannelId.trim().isEmpty()) ? null : epgChannelId.trim();
        this.archivePolicy = archivePolicy == null ? ArchivePolicy.DISABLED : archivePolicy;
    }

    public boolean hasEpgChannelId() {
        return epgChannelId != null;
    }

    @Override
    public String toString() {
        return "CatalogChannel(" + streamId + ", " + name + ", epg=" + epgChannelId + ", " + archivePolicy + ")";
    }
}
