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
package com.gurucue.epg.entity;

/**
 * Per-channel catch-up archive settings, as supplied by the provider's
 * channel catalog.
 */
public final class ArchivePolicy {
    public static final ArchivePolicy DISABLED = new ArchivePolicy(false, 0);

    public final boolean archiveEnabled;
    public final int archiveDurationDays;

    public ArchivePolicy(final boolean archiveEnabled, final int archiveDurationDays) {
        this.archiveEnabled = archiveEnabled;
        this.archiveDurationDays = archiveDurationDays;
    }

    public static ArchivePolicy enabled(final int archiveDurationDays) {
        return new ArchivePolicy(true, archiveDurationDays);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof ArchivePolicy)) return false;
        final ArchivePolicy other = (ArchivePolicy) o;
        return (archiveEnabled == other.archiveEnabled) && (archiveDurationDays == other.archiveDurationDays);
    }

    @Override
    public int hashCode() {
        return (archiveEnabled ? 31 : 0) + archiveDurationDays;
    }

    @Override
    public String toString() {
        return archiveEnabled ? "ArchivePolicy(" + archiveDurationDays + " days)" : "ArchivePolicy(disabled)";
    }
}
