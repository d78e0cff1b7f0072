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
package com.gurucue.epg.data;

import com.gurucue.epg.entity.Channel;
import com.gurucue.epg.entity.Program;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Persistent table of EPG channels and their programmes. The XMLTV
 * ingestion writes to it, the schedule query engine reads from it;
 * nothing else may write.
 * <p>
 * Every upsert call is atomic: readers see either none or all of a batch.
 * Implementations must be thread-safe. Failures are reported with
 * {@link com.gurucue.epg.DatabaseException}.
 */
public interface ScheduleStore extends AutoCloseable {
    /**
     * Inserts the given channels, replacing any existing channel with the
     * same channel ID.
     *
     * @param channels the channels to store
     */
    void upsertChannels(Collection<Channel> channels);

    /**
     * Inserts the given programmes, replacing any existing programme with
     * the same channel ID and begin time. A replaced programme keeps its
     * surrogate ID, a new one gets the next free ID.
     *
     * @param programs the programmes to store
     */
    void upsertPrograms(Collection<Program> programs);

    /**
     * Returns the programmes of the given channels that overlap the
     * interval, i.e. <code>endTime &gt; windowStart</code> and
     * <code>startTime &lt; windowEnd</code>, ordered by begin time.
     * Channel IDs without a stored channel are matched all the same.
     *
     * @param channelIds the channels whose programmes to return
     * @param windowStart start of the interval, inclusive
     * @param windowEnd end of the interval, exclusive
     * @return programmes ordered by begin time, an empty list if there are none
     */
    List<Program> queryPrograms(Collection<String> channelIds, long windowStart, long windowEnd);

    default List<Program> queryPrograms(final String channelId, final long windowStart, final long windowEnd) {
        return queryPrograms(Collections.singletonList(channelId), windowStart, windowEnd);
    }

    /**
     * Deletes programmes that ended before the cutoff.
     *
     * @param cutoff milliseconds since the epoch
     * @return the number of deleted programmes
     */
    int deleteProgramsOlderThan(long cutoff);

    /**
     * Deletes all channels, and the programmes of those channels.
     */
    void deleteAllChannels();

    void deleteAllPrograms();

    Channel getChannel(String channelId);

    int countChannels();

    int countPrograms();

    @Override
    void close();
}
