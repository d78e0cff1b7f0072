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
import com.gurucue.epg.entity.Channel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collection;

/**
 * SQL access to the <code>epg_channel</code> table.
 */
public final class ChannelManagerImpl {
    private static final Logger log = LogManager.getLogger(ChannelManagerImpl.class);

    private static final String SQL_UPSERT = "insert into epg_channel (channel_id, display_name, icon_url) values (?, ?, ?) " +
            "on conflict (channel_id) do update set display_name = excluded.display_name, icon_url = excluded.icon_url";

    private final PostgreSqlDataLink dataLink;

    ChannelManagerImpl(final PostgreSqlDataLink dataLink) {
        this.dataLink = dataLink;
    }

    public void upsert(final Collection<Channel> channels) {
        try (final PreparedStatement st = dataLink.prepareStatement(SQL_UPSERT)) {
            for (final Channel channel : channels) {
                st.setString(1, channel.channelId);
                if (channel.displayName == null) st.setNull(2, Types.VARCHAR);
                else st.setString(2, channel.displayName);
                if (channel.iconUrl == null) st.setNull(3, Types.VARCHAR);
                else st.setString(3, channel.iconUrl);
                st.addBatch();
            }
            st.executeBatch();
        }
        catch (SQLException e) {
            final String reason = "Failed to upsert a batch of " + channels.size() + " channels: " + e.toString();
            log.error(reason, e);
            throw new DatabaseException(reason, e);
        }
    }

    public Channel getById(final String channelId) {
        try (final PreparedStatement st = dataLink.prepareStatement("select channel_id, display_name, icon_url from epg_channel where channel_id = ?")) {
            st.setString(1, channelId);
            try (final ResultSet rs = st.executeQuery()) {
                if (rs.next()) return new Channel(rs.getString(1), rs.getString(2), rs.getString(3));
                return null;
            }
        }
        catch (SQLException e) {
            final String reason = "Failed to retrieve channel " + channelId + ": " + e.toString();
            log.error(reason, e);
            throw new DatabaseException(reason, e);
        }
    }

    public int count() {
        try (final PreparedStatement st = dataLink.prepareStatement("select count(*) from epg_channel")) {
            try (final ResultSet rs = st.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
        catch (SQLException e) {
            final String reason = "Failed to count channels: " + e.toString();
            log.error(reason, e);
            throw new DatabaseException(reason, e);
        }
    }

    /**
     * Deletes all channels together with the programmes that reference them.
     */
    public void deleteAll() {
        dataLink.execute("delete from epg_program where channel_id in (select channel_id from epg_channel)");
        dataLink.execute("delete from epg_channel");
    }
}
