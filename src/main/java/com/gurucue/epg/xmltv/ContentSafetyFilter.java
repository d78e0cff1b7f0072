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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.Locale;

/**
 * Decides whether text from the feed contains a denylisted keyword.
 * Matching is a case-insensitive substring test.
 */
public final class ContentSafetyFilter {
    public static final String DEFAULT_DENYLIST = "Adult,XXX,Porn";

    private final ImmutableList<String> keywords;

    public ContentSafetyFilter(final Collection<String> denylist) {
        final ImmutableList.Builder<String> builder = ImmutableList.builder();
        if (denylist != null) {
            for (final String keyword : denylist) {
                if (keyword == null) continue;
                final String k = keyword.trim();
                if (k.length() > 0) builder.add(k.toLowerCase(Locale.ROOT));
            }
        }
        this.keywords = builder.build();
    }

    /**
     * Creates a filter from a comma-separated list of keywords.
     */
    public static ContentSafetyFilter fromCommaSeparated(final String denylist) {
        if (denylist == null) return new ContentSafetyFilter(ImmutableList.of());
        return new ContentSafetyFilter(Splitter.on(',').trimResults().omitEmptyStrings().splitToList(denylist));
    }

    public static ContentSafetyFilter defaultFilter() {
        return fromCommaSeparated(DEFAULT_DENYLIST);
    }

    public boolean isUnsafe(final String text) {
        if ((text == null) || keywords.isEmpty()) return false;
        final String lower = text.toLowerCase(Locale.ROOT);
        for (final String keyword : keywords) {
            if (lower.contains(keyword)) return true;
        }
        return false;
    }

    /**
     * @return true if any of the given fields is unsafe; null fields are safe
     */
    public boolean anyUnsafe(final String... texts) {
        for (final String text : texts) {
            if (isUnsafe(text)) return true;
        }
        return false;
    }

    public ImmutableList<String> getKeywords() {
        return keywords;
    }
}
