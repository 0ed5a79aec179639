package com.largomodo.romcatalog.dat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Streaming reader for Logiqx XML DAT files as published by No-Intro and Redump.
 * <p>
 * Recognised structure:
 * <pre>{@code
 * <datafile>
 *   <header><name/><description/><version/></header>
 *   <game name="..."> <rom name="..." size="..." crc="..." sha1="..." md5="..." serial="..."/> </game>
 * </datafile>
 * }</pre>
 * {@code machine} is accepted as a synonym of {@code game}. A game without a name or a
 * ROM without a parseable size is skipped with a warning; the rest of the file is still
 * read. DTD processing and external entities are disabled.
 */
public class LogiqxDatReader {

    private static final Logger log = LoggerFactory.getLogger(LogiqxDatReader.class);

    private final XMLInputFactory factory;

    public LogiqxDatReader() {
        factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    }

    public DatFile read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public DatFile read(InputStream in) throws IOException {
        XMLStreamReader xml;
        try {
            xml = factory.createXMLStreamReader(in);
        } catch (XMLStreamException e) {
            throw new DatParseException("Cannot open DAT stream: " + e.getMessage(), e);
        }

        String name = "";
        String description = "";
        String version = "";
        List<DatGame> games = new ArrayList<>();

        boolean inHeader = false;
        String gameName = null;
        String gameRegion = null;
        boolean gameValid = false;
        List<DatRom> roms = new ArrayList<>();

        try {
            while (xml.hasNext()) {
                int event = xml.next();
                if (event == XMLStreamConstants.START_ELEMENT) {
                    String tag = xml.getLocalName();
                    switch (tag) {
                        case "header" -> inHeader = true;
                        case "name" -> {
                            if (inHeader) {
                                name = xml.getElementText().trim();
                            }
                        }
                        case "description" -> {
                            if (inHeader) {
                                description = xml.getElementText().trim();
                            }
                        }
                        case "version" -> {
                            if (inHeader) {
                                version = xml.getElementText().trim();
                            }
                        }
                        case "game", "machine" -> {
                            gameName = xml.getAttributeValue(null, "name");
                            gameRegion = xml.getAttributeValue(null, "region");
                            gameValid = gameName != null && !gameName.isBlank();
                            roms = new ArrayList<>();
                            if (!gameValid) {
                                log.warn("Skipping DAT game without a name at line {}",
                                        xml.getLocation().getLineNumber());
                            }
                        }
                        case "rom" -> {
                            if (gameValid) {
                                DatRom rom = readRom(xml, gameName);
                                if (rom != null) {
                                    roms.add(rom);
                                }
                            }
                        }
                        default -> {
                            // Unused element (category, release, sample...)
                        }
                    }
                } else if (event == XMLStreamConstants.END_ELEMENT) {
                    String tag = xml.getLocalName();
                    if (tag.equals("header")) {
                        inHeader = false;
                    } else if ((tag.equals("game") || tag.equals("machine")) && gameValid) {
                        games.add(new DatGame(gameName, gameRegion, roms));
                        gameValid = false;
                    }
                }
            }
        } catch (XMLStreamException e) {
            throw new DatParseException("Malformed DAT XML: " + e.getMessage(), e);
        } finally {
            try {
                xml.close();
            } catch (XMLStreamException e) {
                log.debug("Failed to close XML reader: {}", e.getMessage());
            }
        }

        log.debug("Read DAT '{}' version {} with {} games", name, version, games.size());
        return new DatFile(name, description, version, games);
    }

    private static DatRom readRom(XMLStreamReader xml, String gameName) {
        String romName = xml.getAttributeValue(null, "name");
        String sizeText = xml.getAttributeValue(null, "size");
        if (romName == null || romName.isBlank()) {
            log.warn("Skipping ROM without a name in game '{}'", gameName);
            return null;
        }
        long size;
        try {
            size = Long.parseLong(sizeText == null ? "" : sizeText.trim());
        } catch (NumberFormatException e) {
            size = -1;
        }
        if (size < 0) {
            log.warn("Skipping ROM '{}' in game '{}': invalid size '{}'", romName, gameName, sizeText);
            return null;
        }
        return new DatRom(romName, size,
                xml.getAttributeValue(null, "crc"),
                xml.getAttributeValue(null, "sha1"),
                xml.getAttributeValue(null, "md5"),
                xml.getAttributeValue(null, "serial"));
    }
}
