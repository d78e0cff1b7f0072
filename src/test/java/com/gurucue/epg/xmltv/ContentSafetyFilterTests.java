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

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ContentSafetyFilterTests {

    @Test
    public void defaultDenylistMatchesCaseInsensitively() {
        final ContentSafetyFilter filter = ContentSafetyFilter.defaultFilter();
        assertEquals(ImmutableList.of("adult", "xxx", "porn"), filter.getKeywords());
        assertTrue(filter.isUnsafe("Late Night ADULT Movies"));
        assertTrue(filter.isUnsafe("xXx channel"));
        assertTrue(filter.isUnsafe("softporn"));
        assertFalse(filter.isUnsafe("Evening News"));
    }

    @Test
    public void nullTextIsSafe() {
        final ContentSafetyFilter filter = ContentSafetyFilter.defaultFilter();
        assertFalse(filter.isUnsafe(null));
        assertFalse(filter.anyUnsafe(null, null));
        assertTrue(filter.anyUnsafe(null, "adult swim"));
    }

    @Test
    public void customListIgnoresBlankEntries() {
        final ContentSafetyFilter filter = ContentSafetyFilter.fromCommaSeparated(" gore , ,violence,");
        assertEquals(ImmutableList.of("gore", "violence"), filter.getKeywords());
        assertTrue(filter.isUnsafe("Extreme Violence"));
        assertFalse(filter.isUnsafe("Adult Education"));
    }

    @Test
    public void emptyListAllowsEverything() {
        final ContentSafetyFilter filter = ContentSafetyFilter.fromCommaSeparated("");
        assertFalse(filter.isUnsafe("XXX"));
    }
}
