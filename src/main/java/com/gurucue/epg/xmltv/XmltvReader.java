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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.InputStream;

/**
 * Streams an XMLTV document with a pull parser and hands every
 * <code>&lt;channel&gt;</code> and <code>&lt;programme&gt;</code> element to a
 * {@link Listener} as soon as it has been read. Only one element is held
 * in memory at any time. Namespaces are ignored, and elements the reader
 * does not know are skipped together with their content.
 * <p>
 * Values are passed on as they appear in the feed, trimmed, with empty
 * values reported as <code>null</code>; validation is the listener's job.
 */
public final class XmltvReader {
    private static final Logger log = LogManager.getLogger(XmltvReader.class);

    public interface Listener {
        void onChannel(XmltvChannel channel);

        void onProgramme(XmltvProgramme programme);
    }

    public static final class XmltvChannel {
        public final String id;
        public final String displayName;
        public final String iconUrl;

        XmltvChannel(final String id, final String displayName, final String iconUrl) {
            this.id = id;
            this.displayName = displayName;
            this.iconUrl = iconUrl;
        }
    }

    public static final class XmltvProgramme {
        public final String channelId;
        public final String start;
        public final String stop;
        public final String title;
        public final String description;
        public final String category;

        XmltvProgramme(final String channelId, final String start, final String stop, final String title, final String description, final String category) {
            this.channelId = channelId;
            this.start = start;
            this.stop = stop;
            this.title = title;
            this.description = description;
            this.category = category;
        }
    }

    private final XMLInputFactory factory;

    public XmltvReader() {
        factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
        // a feed has no business pulling in external resources
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
    }

    /**
     * Reads the whole document. The stream is not closed.
     *
     * @param in the XMLTV document
     * @param listener receives the elements in document order
     * @throws XMLStreamException if the document is not well-formed or the stream fails
     */
    public void read(final InputStream in, final Listener listener) throws XMLStreamException {
        final XMLStreamReader reader = factory.createXMLStreamReader(in);
        int channels = 0;
        int programmes = 0;
        try {
            while (reader.hasNext()) {
                if (reader.next() != XMLStreamConstants.START_ELEMENT) continue;
                switch (reader.getLocalName()) {
                    case "tv":
                        break; // descend into the root element
                    case "channel":
                        listener.onChannel(readChannel(reader));
                        channels++;
                        break;
                    case "programme":
                        listener.onProgramme(readProgramme(reader));
                        programmes++;
                        break;
                    default:
                        skip(reader);
                }
            }
        }
        finally {
            reader.close();
        }
        log.debug("Read " + channels + " channel and " + programmes + " programme elements");
    }

    private static XmltvChannel readChannel(final XMLStreamReader reader) throws XMLStreamException {
        final String id = trimToNull(reader.getAttributeValue(null, "id"));
        String displayName = null;
        String iconUrl = null;
        while (nextChild(reader)) {
            switch (reader.getLocalName()) {
                case "display-name":
                    final String name = readText(reader);
                    if (displayName == null) displayName = name;
                    break;
                case "icon":
                    if (iconUrl == null) iconUrl = trimToNull(reader.getAttributeValue(null, "src"));
                    skip(reader);
                    break;
                default:
                    skip(reader);
            }
        }
        return new XmltvChannel(id, displayName, iconUrl);
    }

    private static XmltvProgramme readProgramme(final XMLStreamReader reader) throws XMLStreamException {
        final String channelId = trimToNull(reader.getAttributeValue(null, "channel"));
        final String start = trimToNull(reader.getAttributeValue(null, "start"));
        final String stop = trimToNull(reader.getAttributeValue(null, "stop"));
        String title = null;
        String description = null;
        String category = null;
        while (nextChild(reader)) {
            switch (reader.getLocalName()) {
                case "title":
                    final String t = readText(reader);
                    if (title == null) title = t;
                    break;
                case "desc":
                    final String d = readText(reader);
                    if (description == null) description = d;
                    break;
                case "category":
                    final String c = readText(reader);
                    if (category == null) category = c;
                    break;
                default:
                    skip(reader);
            }
        }
        return new XmltvProgramme(channelId, start, stop, title, description, category);
    }

    /**
     * Advances to the next child element of the current element.
     *
     * @return false when the end tag of the current element was reached
     */
    private static boolean nextChild(final XMLStreamReader reader) throws XMLStreamException {
        for (;;) {
            switch (reader.next()) {
                case XMLStreamConstants.START_ELEMENT:
                    return true;
                case XMLStreamConstants.END_ELEMENT:
                    return false;
                case XMLStreamConstants.END_DOCUMENT:
                    throw new XMLStreamException("Unexpected end of document", reader.getLocation());
                default:
                    // text, comments and processing instructions between children
            }
        }
    }

    /**
     * Collects the text content of the current element, including the text
     * of any nested elements, and leaves the reader on its end tag.
     */
    static String readText(final XMLStreamReader reader) throws XMLStreamException {
        final StringBuilder text = new StringBuilder();
        int depth = 1;
        while (depth > 0) {
            switch (reader.next()) {
                case XMLStreamConstants.START_ELEMENT:
                    depth++;
                    break;
                case XMLStreamConstants.END_ELEMENT:
                    depth--;
                    break;
                case XMLStreamConstants.CHARACTERS:
                case XMLStreamConstants.CDATA:
                case XMLStreamConstants.SPACE:
                    text.append(reader.getText());
                    break;
                case XMLStreamConstants.END_DOCUMENT:
                    throw new XMLStreamException("Unexpected end of document", reader.getLocation());
                default:
            }
        }
        return trimToNull(text.toString());
    }

    /**
     * Skips the current element with everything it contains, leaving the
     * reader on its end tag.
     */
    static void skip(final XMLStreamReader reader) throws XMLStreamException {
        if (reader.getEventType() != XMLStreamConstants.START_ELEMENT) throw new IllegalStateException("skip() must be invoked on a start tag");
        int depth = 1;
        while (depth != 0) {
            switch (reader.next()) {
                case XMLStreamConstants.START_ELEMENT:
                    depth++;
                    break;
                case XMLStreamConstants.END_ELEMENT:
                    depth--;
                    break;
                case XMLStreamConstants.END_DOCUMENT:
                    throw new XMLStreamException("Unexpected end of document", reader.getLocation());
                default:
            }
        }
    }

    private static String trimToNull(final String value) {
        if (value == null) return null;
        final String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
