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

import java.util.Objects;

/**
 * An EPG channel as announced by the XMLTV feed. Replaced wholesale on
 * every synchronization.
 */
public final class Channel {
    public final String channelId;
    public final String displayName;
    public final String iconUrl;

    public Channel(final String channelId, final String displayName, final String iconUrl) {
        if ((channelId == null) || (channelId.length() == 0)) throw new IllegalArgumentException("A channel requires a non-empty channel ID");
        this.channelId = channelId;
        this.displayName = displayName;
        this.iconUrl = iconUrl;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if ((o == null) || (getClass() != o.getClass())) return false;
        final Channel other = (Channel) o;
        return channelId.equals(other.channelId) && Objects.equals(displayName, other.displayName) && Objects.equals(iconUrl, other.iconUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channelId, displayName, iconUrl);
    }

    @Override
    public String toString() {
        return "Channel(" + channelId + ", " + displayName + ")";
    }
}
