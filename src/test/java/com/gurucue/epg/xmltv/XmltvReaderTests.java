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

import org.junit.Test;

import javax.xml.stream.XMLStreamException;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class XmltvReaderTests {

    private static final class Collector implements XmltvReader.Listener {
        final List<XmltvReader.XmltvChannel> channels = new ArrayList<>();
        final List<XmltvReader.XmltvProgramme> programmes = new ArrayList<>();

        @Override
        public void onChannel(final XmltvReader.XmltvChannel channel) {
            channels.add(channel);
        }

        @Override
        public void onProgramme(final XmltvReader.XmltvProgramme programme) {
            programmes.add(programme);
        }
    }

    private static Collector read(final String xml) throws XMLStreamException {
        final Collector collector = new Collector();
        new XmltvReader().read(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), collector);
        return collector;
    }

    @Test
    public void readsChannelsAndProgrammes() throws XMLStreamException {
        final Collector c = read("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n" +
                "<tv generator-info-name=\"test\">\n" +
                "  <channel id=\"bbc1.uk\">\n" +
                "    <display-name lang=\"en\">BBC One</display-name>\n" +
                "    <display-name>BBC 1</display-name>\n" +
                "    <icon src=\"http://example.com/bbc1.png\"/>\n" +
                "  </channel>\n" +
                "  <programme start=\"20240101120000 +0000\" stop=\"20240101130000 +0000\" channel=\"bbc1.uk\">\n" +
                "    <title lang=\"en\">News</title>\n" +
                "    <title lang=\"de\">Nachrichten</title>\n" +
                "    <desc>The <b>latest</b> headlines</desc>\n" +
                "    <category>News</category>\n" +
                "    <credits><director>Someone</director></credits>\n" +
                "  </programme>\n" +
                "</tv>");

        assertEquals(1, c.channels.size());
        final XmltvReader.XmltvChannel channel = c.channels.get(0);
        assertEquals("bbc1.uk", channel.id);
        assertEquals("BBC One", channel.displayName);
        assertEquals("http://example.com/bbc1.png", channel.iconUrl);

        assertEquals(1, c.programmes.size());
        final XmltvReader.XmltvProgramme p = c.programmes.get(0);
        assertEquals("bbc1.uk", p.channelId);
        assertEquals("20240101120000 +0000", p.start);
        assertEquals("20240101130000 +0000", p.stop);
        assertEquals("News", p.title);
        assertEquals("The latest headlines", p.description);
        assertEquals("News", p.category);
    }

    @Test
    public void emptyValuesAreNull() throws XMLStreamException {
        final Collector c = read("<tv><channel id=\"  \"><display-name> </display-name></channel>" +
                "<programme channel=\"x\" start=\"20240101120000\"><title></title></programme></tv>");
        assertNull(c.channels.get(0).id);
        assertNull(c.channels.get(0).displayName);
        assertNull(c.channels.get(0).iconUrl);
        assertNull(c.programmes.get(0).stop);
        assertNull(c.programmes.get(0).title);
    }

    @Test
    public void skipsUnknownTopLevelElements() throws XMLStreamException {
        final Collector c = read("<tv><metadata><channel id=\"hidden\"/></metadata><channel id=\"a\"/></tv>");
        assertEquals(1, c.channels.size());
        assertEquals("a", c.channels.get(0).id);
    }

    @Test
    public void ignoresNamespacePrefixes() throws XMLStreamException {
        final Collector c = read("<tv xmlns:ext=\"urn:x\"><ext:extra>1</ext:extra><channel id=\"a\" ext:flag=\"1\"/></tv>");
        assertEquals(1, c.channels.size());
    }

    @Test(expected = XMLStreamException.class)
    public void failsOnMalformedDocument() throws XMLStreamException {
        read("<tv><channel id=\"a\"><display-name>A</channel></tv>");
    }
}
