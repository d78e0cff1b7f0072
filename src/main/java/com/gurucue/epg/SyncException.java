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
package com.gurucue.epg;

/**
 * Signals that an XMLTV synchronization run did not complete. The
 * {@link Kind} tells the caller whether to reschedule the run.
 */
public class SyncException extends Exception {
    public enum Kind {
        /** The feed could not be fetched; the run should be retried with a backoff. */
        RETRYABLE_TRANSPORT,
        /** Parsing or storing failed mid-stream; already flushed batches remain stored. */
        TERMINAL
    }

    private final Kind kind;

    public SyncException(final Kind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public SyncException(final Kind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static SyncException retryable(final String message, final Throwable cause) {
        return new SyncException(Kind.RETRYABLE_TRANSPORT, message, cause);
    }

    public static SyncException terminal(final String message, final Throwable cause) {
        return new SyncException(Kind.TERMINAL, message, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind == Kind.RETRYABLE_TRANSPORT;
    }
}
