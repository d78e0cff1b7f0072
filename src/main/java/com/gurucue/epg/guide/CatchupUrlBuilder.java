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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.gurucue.epg.entity.CatalogChannel;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Builds Xtream-style timeshift URLs for replaying a programme:
 * <code>{server}/timeshift/{username}/{password}/{minutes}/{yyyy-MM-dd:HH-mm}/{streamId}.{ext}</code>.
 * The start time is rendered in the zone the provider's server runs in.
 */
public final class CatchupUrlBuilder {
    public static final String DEFAULT_EXTENSION = "ts";
    private static final DateTimeFormatter START_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd:HH-mm");

    private final String serverUrl;
    private final String username;
    private final String password;
    private final ZoneId serverZone;

    public CatchupUrlBuilder(final String serverUrl, final String username, final String password, final ZoneId serverZone) {
        Preconditions.checkArgument((serverUrl != null) && !serverUrl.isEmpty(), "No server URL given");
        this.serverUrl = CharMatcher.is('/').trimTrailingFrom(serverUrl);
        this.username = Preconditions.checkNotNull(username, "username");
        this.password = Preconditions.checkNotNull(password, "password");
        this.serverZone = Preconditions.checkNotNull(serverZone, "serverZone");
    }

    public String build(final int streamId, final long startTime, final long endTime, final String extension) {
        final long durationMinutes = Math.max(1L, (endTime - startTime) / 60000L);
        final String start = START_FORMAT.format(Instant.ofEpochMilli(startTime).atZone(serverZone));
        return serverUrl + "/timeshift/" + username + "/" + password + "/" + durationMinutes + "/" + start + "/" + streamId + "." + extension;
    }

    /**
     * @return the replay URL, or null when the programme cannot be replayed
     */
    public String forProgram(final CatalogChannel channel, final ProgramProjection program) {
        if ((channel == null) || (program == null) || !program.isCatchupAvailable) return null;
        return build(channel.streamId, program.startTime, program.endTime, DEFAULT_EXTENSION);
    }
}
