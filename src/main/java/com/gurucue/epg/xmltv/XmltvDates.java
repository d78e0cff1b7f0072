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
package com.gurucue.epg.xmltv;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses XMLTV timestamps of the form <code>yyyyMMddHHmmss +HHMM</code>.
 * Seconds may be omitted, and so may the offset, in which case the time
 * is taken to be UTC.
 */
public final class XmltvDates {
    /** Returned by {@link #parse(String)} for values that cannot be parsed. */
    public static final long INVALID = -1L;

    private static final Pattern XMLTV_TIME = Pattern.compile("^(\\d{14}|\\d{12})\\s*([+-]\\d{4})?$");
    private static final DateTimeFormatter WITH_SECONDS = DateTimeFormatter.ofPattern("uuuuMMddHHmmss").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter WITHOUT_SECONDS = DateTimeFormatter.ofPattern("uuuuMMddHHmm").withResolverStyle(ResolverStyle.STRICT);

    private XmltvDates() {}

    /**
     * @param value the attribute value, e.g. <code>20080715003000 -0600</code>
     * @return milliseconds since the epoch, or {@link #INVALID}
     */
    public static long parse(final String value) {
        if (value == null) return INVALID;
        final Matcher m = XMLTV_TIME.matcher(value.trim());
        if (!m.matches()) return INVALID;
        final String digits = m.group(1);
        final String offset = m.group(2);
        try {
            final LocalDateTime local = LocalDateTime.parse(digits, digits.length() == 14 ? WITH_SECONDS : WITHOUT_SECONDS);
            final ZoneOffset zone = offset == null ? ZoneOffset.UTC : ZoneOffset.of(offset);
            return local.toInstant(zone).toEpochMilli();
        }
        catch (DateTimeException e) {
            return INVALID;
        }
    }

    /**
     * Formats the time as an XMLTV timestamp in UTC.
     */
    public static String format(final long millis) {
        return WITH_SECONDS.format(LocalDateTime.ofEpochSecond(Math.floorDiv(millis, 1000L), 0, ZoneOffset.UTC)) + " +0000";
    }
}
