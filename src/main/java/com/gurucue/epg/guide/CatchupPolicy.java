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

/**
 * Live and catch-up rules relative to a given "now".
 */
public final class CatchupPolicy {
    public static final long MILLIS_PER_DAY = 86400000L;
    /** Archive length assumed when a channel has its archive enabled but no length set. */
    public static final int DEFAULT_ARCHIVE_DAYS = 1;

    private CatchupPolicy() {}

    /**
     * A programme is live while <code>now</code> is in <code>[startTime, endTime)</code>.
     */
    public static boolean isLive(final long startTime, final long endTime, final long now) {
        return (now >= startTime) && (now < endTime);
    }

    /**
     * A programme can be replayed when its channel keeps an archive, the
     * programme has ended, and it ended no longer ago than the archive
     * reaches back.
     */
    public static boolean isCatchupAvailable(final ArchivePolicy policy, final long startTime, final long endTime, final long now) {
        if ((policy == null) || !policy.archiveEnabled) return false;
        if (endTime <= startTime) return false;
        if (endTime > now) return false;
        final int days = policy.archiveDurationDays > 0 ? policy.archiveDurationDays : DEFAULT_ARCHIVE_DAYS;
        return (now - endTime) <= days * MILLIS_PER_DAY;
    }

    /**
     * @return the elapsed fraction of a live programme in <code>[0, 1]</code>, 0 if not live
     */
    public static float progress(final long startTime, final long endTime, final long now) {
        if (!isLive(startTime, endTime, now)) return 0f;
        final long total = endTime - startTime;
        if (total <= 0L) return 0f;
        final float fraction = (float) (now - startTime) / (float) total;
        return Math.max(0f, Math.min(1f, fraction));
    }
}
