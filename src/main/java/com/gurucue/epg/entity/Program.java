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
 * A TV-programme on one channel, with its begin and end time in
 * milliseconds since the epoch. Immutable; an upsert with the same
 * channel ID and begin time replaces it.
 * <p>
 * The surrogate ID is 0 until the store assigns one.
 */
public final class Program {
    public static final long UNASSIGNED_ID = 0L;

    public final long id;
    public final String channelId;
    public final String title;
    public final String description;
    public final long startTime;
    public final long endTime;
    public final String category;

    public Program(final long id, final String channelId, final String title, final String description, final long startTime, final long endTime, final String category) {
        if ((channelId == null) || (channelId.length() == 0)) throw new IllegalArgumentException("A programme requires a non-empty channel ID");
        if (title == null) throw new IllegalArgumentException("A programme requires a title");
        if (endTime <= startTime) throw new IllegalArgumentException("A programme must end after it begins: channel " + channelId + ", start " + startTime + ", end " + endTime);
        this.id = id;
        this.channelId = channelId;
        this.title = title;
        this.description = description;
        this.startTime = startTime;
        this.endTime = endTime;
        this.category = category;
    }

    public Program(final String channelId, final String title, final String description, final long startTime, final long endTime, final String category) {
        this(UNASSIGNED_ID, channelId, title, description, startTime, endTime, category);
    }

    public Program withId(final long newId) {
        if (newId == id) return this;
        return new Program(newId, channelId, title, description, startTime, endTime, category);
    }

    /**
     * Whether this programme overlaps the half-open interval
     * <code>[windowStart, windowEnd)</code>.
     */
    public boolean overlaps(final long windowStart, final long windowEnd) {
        return (endTime > windowStart) && (startTime < windowEnd);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if ((o == null) || (getClass() != o.getClass())) return false;
        final Program other = (Program) o;
        return (id == other.id) && (startTime == other.startTime) && (endTime == other.endTime) &&
                channelId.equals(other.channelId) && title.equals(other.title) &&
                Objects.equals(description, other.description) && Objects.equals(category, other.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, channelId, title, description, startTime, endTime, category);
    }

    @Override
    public String toString() {
        return "Program(" + id + ", " + channelId + ", \"" + title + "\", " + startTime + "-" + endTime + ")";
    }
}
