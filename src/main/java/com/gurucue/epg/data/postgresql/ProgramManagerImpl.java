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
package com.gurucue.epg.data.postgresql;

import com.gurucue.epg.DatabaseException;
import com.gurucue.epg.entity.Program;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * SQL access to the <code>epg_program</code> table. Programmes are keyed
 * by channel ID and begin time; the surrogate <code>id</code> survives
 * an upsert.
 */
public final class ProgramManagerImpl {
    private static final Logger log = LogManager.getLogger(ProgramManagerImpl.class);

    private static final String SQL_UPSERT = "insert into epg_program (channel_id, title, description, start_time, end_time, category) values (?, ?, ?, ?, ?, ?) " +
            "on conflict (channel_id, start_time) do update set title = excluded.title, description = excluded.description, end_time = excluded.end_time, category = excluded.category";

    // parameter #1: channel-id array, parameter #2: window start, parameter #3: window end
    private static final String SQL_SELECT_OVERLAPPING = "select id, channel_id, title, description, start_time, end_time, category from epg_program " +
            "where channel_id = any(?) and end_time > ? and start_time < ? order by start_time, channel_id";

    private final PostgreSqlDataLink dataLink;

    ProgramManagerImpl(final PostgreSqlDataLink dataLink) {
        this.dataLink = dataLink;
    }

    public void upsert(final Collection<Program> programs) {
        try (final PreparedStatement st = dataLink.prepareStatement(SQL_UPSERT)) {
            for (final Program program : programs) {
                st.setString(1, program.channelId);
                st.setString(2, program.title);
                if (program.description == null) st.setNull(3, Types.VARCHAR);
                else st.setString(3, program.description);
                st.setLong(4, program.startTime);
                st.setLong(5, program.endTime);
                if (program.category == null) st.setNull(6, Types.VARCHAR);
                else st.setString(6, program.category);
                st.addBatch();
            }
            st.executeBatch();
        }
        catch (SQLException e) {
            final String reason = "Failed to upsert a batch of " + programs.size() + " programmes: " + e.toString();
            log.error(reason, e);
            throw new DatabaseException(reason, e);
        }
    }

    public List<Program> overlapping(final Collection<String> channelIds, final long windowStart, final long windowEnd) {
        final List<Program> result = new ArrayList<>();
        try (final PreparedStatement st = dataLink.prepareStatement(SQL_SELECT_OVERLAPPING, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY)) {
            st.setFetchSize(1000);
            st.setArray(1, dataLink.createVarcharArray(channelIds.toArray(new String[0])));
            st.setLong(2, windowStart);
            st.setLong(3, windowEnd);
            try (final ResultSet rs = st.executeQuery()) {
                while (rs.next()) {
                    result.add(new Program(rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getLong(5), rs.getLong(6), rs.getString(7)));
                }
            }
        }
        catch (SQLException e) {
            final String reason = "Failed to select programmes of " + channelIds.size() + " channels between " + windowStart + " and " + windowEnd + ": " + e.toString();
            log.error(reason, e);
            throw new DatabaseException(reason, e);
        }
        return result;
    }

    public int deleteEndedBefore(final long cutoff) {
        try (final PreparedStatement st = dataLink.prepareStatement("delete from epg_program where end_time < ?")) {
            st.setLong(1, cutoff);
            return st.executeUpdate();
        }
        catch (SQLException e) {
            final String reason = "Failed to delete programmes that ended before " + cutoff + ": " + e.toString();
            log.error(reason, e);
            throw new DatabaseException(reason, e);
        }
    }

    public int count() {
        try (final PreparedStatement st = dataLink.prepareStatement("select count(*) from epg_program")) {
            try (final ResultSet rs = st.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
        catch (SQLException e) {
            final String reason = "Failed to count programmes: " + e.toString();
            log.error(reason, e);
            throw new DatabaseException(reason, e);
        }
    }

    public void deleteAll() {
        dataLink.execute("delete from epg_program");
    }
}
