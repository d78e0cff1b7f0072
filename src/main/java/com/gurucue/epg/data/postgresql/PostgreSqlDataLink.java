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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Array;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * A single database connection of the {@link PostgreSqlScheduleStore},
 * with lazily created table managers. Closing a link hands it back to
 * the store for recycling.
 * THIS CLASS IS NOT THREAD-SAFE!
 */
public final class PostgreSqlDataLink implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(PostgreSqlDataLink.class);

    final PostgreSqlScheduleStore store;
    final Connection connection;

    private ChannelManagerImpl channelManager = null;
    private ProgramManagerImpl programManager = null;

    PostgreSqlDataLink(final PostgreSqlScheduleStore store) {
        this.store = store;
        try {
            connection = DriverManager.getConnection(store.jdbcUrl, store.jdbcUsername, store.jdbcPassword);
            connection.setAutoCommit(false);
            connection.setTransactionIsolation(Connection.TRANSACTION_READ_COMMITTED);
            connection.setHoldability(ResultSet.CLOSE_CURSORS_AT_COMMIT);
        } catch (final SQLException e) {
            final String reason = "Failed to open a connection to the database: " + e.toString();
            log.error(reason, e);
            throw new DatabaseException(reason, e);
        }
    }

    @Override
    public void close() {
        store.recycleLink(this);
    }

    void destroy() {
        try {
            connection.close();
        } catch (SQLException e) {
            // Do not treat exceptions at connection closing time as fatal. Just log them.
            log.error("destroy(): A connection failed to close(): " + e.toString(), e);
        } finally {
            store.forgetLink(this);
        }
    }

    public void commit() {
        try {
            connection.commit();
        } catch (SQLException e) {
            final String reason = "Failed to commit: " + e.toString();
            log.error(reason, e);
            throw new DatabaseException(reason, e);
        }
    }

    public void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            final String reason = "Failed to rollback: " + e.toString();
            log.error(reason, e);
            throw new DatabaseException(reason, e);
        }
    }

    public ChannelManagerImpl getChannelManager() {
        if (channelManager == null) channelManager = new ChannelManagerImpl(this);
        return channelManager;
    }

    public ProgramManagerImpl getProgramManager() {
        if (programManager == null) programManager = new ProgramManagerImpl(this);
        return programManager;
    }

    public boolean isValid() {
        try {
            if (connection.isClosed()) return false;
            try (final Statement test = connection.createStatement()) {
                test.execute("select 1");
            }
            if (!connection.getAutoCommit()) connection.commit();
            return true;
        } catch (SQLException e) {
            log.warn("A connection failed validation, closing it: " + e.toString(), e);
            destroy();
        }
        return false;
    }

    public PreparedStatement prepareStatement(final String sql) {
        try {
            return connection.prepareStatement(sql);
        } catch (SQLException e) {
            final String reason = "Failed to prepare a statement: " + e.toString();
            log.error(reason, e);
            throw new DatabaseException(reason, e);
        }
    }

    public PreparedStatement prepareStatement(final String sql, final int resultSetType, final int resultSetConcurrency) {
        try {
            return connection.prepareStatement(sql, resultSetType, resultSetConcurrency);
        } catch (SQLException e) {
            final String reason = "Failed to prepare a statement: " + e.toString();
            log.error(reason, e);
            throw new DatabaseException(reason, e);
        }
    }

    public Array createVarcharArray(final String[] values) {
        try {
            return connection.createArrayOf("varchar", values);
        } catch (SQLException e) {
            final String reason = "Failed to create an SQL array: " + e.toString();
            log.error(reason, e);
            throw new DatabaseException(reason, e);
        }
    }

    public void execute(final String sql) {
        try (final Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
        catch (SQLException e) {
            final String reason = "Failed to execute SQL statement \"" + sql.replace("\"", "\\\"") + "\": " + e.toString();
            log.error(reason, e);
            throw new DatabaseException(reason, e);
        }
    }
}
