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
package com.gurucue.epg.caching;

import com.google.common.collect.ImmutableList;
import com.gurucue.epg.data.ScheduleStore;
import com.gurucue.epg.entity.Channel;
import com.gurucue.epg.entity.Program;
import gnu.trove.map.TLongObjectMap;
import gnu.trove.map.hash.TLongObjectHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A schedule store held entirely in memory. Programmes are indexed per
 * channel by their begin time, so an interval query only visits the
 * programmes that can overlap it.
 */
public final class InMemoryScheduleStore implements ScheduleStore {
    private static final Logger log = LogManager.getLogger(InMemoryScheduleStore.class);
    private static final Comparator<Program> BY_START_TIME = Comparator.comparingLong((Program p) -> p.startTime).thenComparing(p -> p.channelId);

    private final ReadWriteLock rwLock = new ReentrantReadWriteLock(false);
    private final Lock readLock = rwLock.readLock();
    private final Lock writeLock = rwLock.writeLock();

    private final Map<String, Channel> channels = new HashMap<>();
    private final Map<String, NavigableMap<Long, Program>> programsByChannel = new HashMap<>();
    private final TLongObjectMap<Program> programsById = new TLongObjectHashMap<>();
    private long nextProgramId = 1L;
    // the longest programme ever stored bounds how far back an interval search must start
    private long maxDuration = 0L;
    private boolean isClosed = false;

    @Override
    public void upsertChannels(final Collection<Channel> newChannels) {
        if ((newChannels == null) || newChannels.isEmpty()) return;
        writeLocked(() -> {
            for (final Channel channel : newChannels) channels.put(channel.channelId, channel);
            return null;
        });
    }

    @Override
    public void upsertPrograms(final Collection<Program> programs) {
        if ((programs == null) || programs.isEmpty()) return;
        writeLocked(() -> {
            for (final Program program : programs) {
                final NavigableMap<Long, Program> index = programsByChannel.computeIfAbsent(program.channelId, k -> new TreeMap<>());
                final Program existing = index.get(program.startTime);
                final Program stored = program.withId(existing == null ? nextProgramId++ : existing.id);
                index.put(stored.startTime, stored);
                programsById.put(stored.id, stored);
                final long duration = stored.endTime - stored.startTime;
                if (duration > maxDuration) maxDuration = duration;
            }
            return null;
        });
    }

    @Override
    public List<Program> queryPrograms(final Collection<String> channelIds, final long windowStart, final long windowEnd) {
        if ((channelIds == null) || channelIds.isEmpty() || (windowEnd <= windowStart)) return ImmutableList.of();
        return readLocked(() -> {
            final List<Program> result = new ArrayList<>();
            // anything beginning before this cannot reach into the window; saturates at Long.MIN_VALUE
            final long lowestStart = windowStart < Long.MIN_VALUE + maxDuration ? Long.MIN_VALUE : windowStart - maxDuration;
            for (final String channelId : new LinkedHashSet<>(channelIds)) {
                final NavigableMap<Long, Program> index = programsByChannel.get(channelId);
                if (index == null) continue;
                for (final Program p : index.subMap(lowestStart, true, windowEnd, false).values()) {
                    if (p.endTime > windowStart) result.add(p);
                }
            }
            result.sort(BY_START_TIME);
            return ImmutableList.copyOf(result);
        });
    }

    @Override
    public int deleteProgramsOlderThan(final long cutoff) {
        final int deleted = writeLocked(() -> {
            int count = 0;
            final Iterator<NavigableMap<Long, Program>> channelIterator = programsByChannel.values().iterator();
            while (channelIterator.hasNext()) {
                final NavigableMap<Long, Program> index = channelIterator.next();
                final Iterator<Program> it = index.values().iterator();
                while (it.hasNext()) {
                    final Program p = it.next();
                    if (p.endTime < cutoff) {
                        it.remove();
                        programsById.remove(p.id);
                        count++;
                    }
                }
                if (index.isEmpty()) channelIterator.remove();
            }
            return count;
        });
        log.debug("Deleted " + deleted + " programmes that ended before " + cutoff);
        return deleted;
    }

    @Override
    public void deleteAllChannels() {
        writeLocked(() -> {
            for (final String channelId : channels.keySet()) {
                final NavigableMap<Long, Program> index = programsByChannel.remove(channelId);
                if (index == null) continue;
                for (final Program p : index.values()) programsById.remove(p.id);
            }
            channels.clear();
            return null;
        });
    }

    @Override
    public void deleteAllPrograms() {
        writeLocked(() -> {
            programsByChannel.clear();
            programsById.clear();
            maxDuration = 0L;
            return null;
        });
    }

    @Override
    public Channel getChannel(final String channelId) {
        return readLocked(() -> channels.get(channelId));
    }

    public Program getProgram(final long id) {
        return readLocked(() -> programsById.get(id));
    }

    @Override
    public int countChannels() {
        return readLocked(channels::size);
    }

    @Override
    public int countPrograms() {
        return readLocked(programsById::size);
    }

    @Override
    public void close() {
        writeLock.lock();
        try {
            if (isClosed) return;
            isClosed = true;
            channels.clear();
            programsByChannel.clear();
            programsById.clear();
        }
        finally {
            writeLock.unlock();
        }
        log.info("In-memory schedule store is closed.");
    }

    private <V> V readLocked(final Callable<V> job) {
        readLock.lock();
        try {
            if (isClosed) throw new IllegalStateException("The schedule store is closed");
            return job.call();
        }
        catch (RuntimeException e) {
            throw e;
        }
        catch (Exception e) {
            throw new IllegalStateException("Read job failed: " + e.toString(), e);
        }
        finally {
            readLock.unlock();
        }
    }

    private <V> V writeLocked(final Callable<V> job) {
        writeLock.lock();
        try {
            if (isClosed) throw new IllegalStateException("The schedule store is closed");
            return job.call();
        }
        catch (RuntimeException e) {
            throw e;
        }
        catch (Exception e) {
            throw new IllegalStateException("Write job failed: " + e.toString(), e);
        }
        finally {
            writeLock.unlock();
        }
    }
}
