/*
 * This file is part of PNSym.
 * Copyright (c) 2026 The PNSym authors.
 *
 * PNSym is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * PNSym is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PNSym. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.pnsym.net;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Reads 1-safe place/transition nets from PNML documents. Elements are matched by their local name,
 * so documents with or without the PNML namespace are accepted. Places are ordered as they appear in
 * the document.
 */
public final class PnmlReader {
    private static final Logger logger = Logger.getLogger(PnmlReader.class.getName());
    private static final String ANY_NAMESPACE = "*";

    private PnmlReader() {}

    public static PetriNet read(Path path) throws IOException, ModelException {
        try (InputStream stream = Files.newInputStream(path)) {
            return read(stream);
        }
    }

    public static PetriNet read(InputStream stream) throws IOException, ModelException {
        Document document;
        try {
            document = newDocumentBuilder().parse(stream);
        } catch (SAXException e) {
            throw new ModelException("Unreadable PNML document: " + e.getMessage(), e);
        }

        Element net = firstDescendant(document, "net");
        if (net == null) {
            throw new ModelException("PNML document has no <net>");
        }

        Map<String, Element> placeElements = collectById(net, "place");
        Map<String, Element> transitionElements = collectById(net, "transition");
        if (placeElements.isEmpty()) {
            throw new ModelException("No places found");
        }
        if (transitionElements.isEmpty()) {
            throw new ModelException("No transitions found");
        }

        List<String> places = new ArrayList<>(placeElements.keySet());
        Map<String, Integer> placeIndex = new LinkedHashMap<>();
        for (String place : places) {
            placeIndex.put(place, placeIndex.size());
        }

        BitSet initial = new BitSet(places.size());
        for (Map.Entry<String, Element> entry : placeElements.entrySet()) {
            String id = entry.getKey();
            Optional<String> text = childText(entry.getValue(), "initialMarking");
            int tokens = text.isPresent() ? parseInt(text.get(), "initial marking of place " + id) : 0;
            if (tokens != 0 && tokens != 1) {
                throw new ModelException(
                        String.format("Initial marking of place %s is %d, but the net must be 1-safe", id, tokens));
            }
            if (tokens == 1) {
                initial.set(placeIndex.get(id));
            }
        }

        Map<String, BitSet> presets = new LinkedHashMap<>();
        Map<String, BitSet> postsets = new LinkedHashMap<>();
        for (String id : transitionElements.keySet()) {
            presets.put(id, new BitSet());
            postsets.put(id, new BitSet());
        }

        NodeList arcs = net.getElementsByTagNameNS(ANY_NAMESPACE, "arc");
        for (int i = 0; i < arcs.getLength(); i++) {
            Element arc = (Element) arcs.item(i);
            String arcId = arc.hasAttribute("id") ? arc.getAttribute("id") : "(no id)";
            String source = arc.getAttribute("source");
            String target = arc.getAttribute("target");

            Element inscription = firstDescendant(arc, "inscription");
            Optional<String> weightText = inscription == null ? Optional.empty() : descendantText(inscription);
            int weight = weightText.isPresent() ? parseInt(weightText.get(), "weight of arc " + arcId) : 1;
            if (weight != 1) {
                throw new ModelException(
                        String.format("Arc %s has weight %d, only unit weights are supported", arcId, weight));
            }

            boolean sourceIsPlace = placeIndex.containsKey(source);
            boolean sourceIsTransition = transitionElements.containsKey(source);
            boolean targetIsPlace = placeIndex.containsKey(target);
            boolean targetIsTransition = transitionElements.containsKey(target);
            if (!(sourceIsPlace || sourceIsTransition) || !(targetIsPlace || targetIsTransition)) {
                throw new ModelException(
                        String.format("Arc %s refers to a nonexistent node: %s -> %s", arcId, source, target));
            }

            if (sourceIsPlace && targetIsTransition) {
                presets.get(target).set(placeIndex.get(source));
            } else if (sourceIsTransition && targetIsPlace) {
                postsets.get(source).set(placeIndex.get(target));
            } else {
                throw new ModelException(String.format(
                        "Arc %s connects two %s: %s -> %s",
                        arcId, sourceIsPlace ? "places" : "transitions", source, target));
            }
        }

        List<Transition> transitions = new ArrayList<>(transitionElements.size());
        for (Map.Entry<String, Element> entry : transitionElements.entrySet()) {
            String id = entry.getKey();
            String name = childText(entry.getValue(), "name")
                    .filter(text -> !text.isEmpty())
                    .orElse(id);
            transitions.add(Transition.of(id, name, presets.get(id), postsets.get(id)));
        }

        PetriNet result = PetriNet.create(places, transitions, Marking.of(places.size(), initial));
        logger.log(Level.FINE, "Read {0}", result);
        return result;
    }

    private static DocumentBuilder newDocumentBuilder() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("No usable XML parser", e);
        }
    }

    private static Map<String, Element> collectById(Element net, String localName) throws ModelException {
        Map<String, Element> elements = new LinkedHashMap<>();
        NodeList nodes = net.getElementsByTagNameNS(ANY_NAMESPACE, localName);
        for (int i = 0; i < nodes.getLength(); i++) {
            Element element = (Element) nodes.item(i);
            if (!element.hasAttribute("id")) {
                throw new ModelException("A " + localName + " has no id");
            }
            String id = element.getAttribute("id");
            if (elements.putIfAbsent(id, element) != null) {
                throw new ModelException("Duplicate " + localName + " id " + id);
            }
        }
        return elements;
    }

    @Nullable
    private static Element firstDescendant(Node parent, String localName) {
        NodeList nodes = parent instanceof Document
                ? ((Document) parent).getElementsByTagNameNS(ANY_NAMESPACE, localName)
                : ((Element) parent).getElementsByTagNameNS(ANY_NAMESPACE, localName);
        return nodes.getLength() == 0 ? null : (Element) nodes.item(0);
    }

    /**
     * Text of the first {@code <text>} below the first direct child called {@code localName}.
     */
    private static Optional<String> childText(Element parent, String localName) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element && localName.equals(child.getLocalName())) {
                return descendantText((Element) child);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> descendantText(Element element) {
        Element text = firstDescendant(element, "text");
        if (text == null) {
            return Optional.empty();
        }
        String content = text.getTextContent().strip();
        return content.isEmpty() ? Optional.empty() : Optional.of(content);
    }

    private static int parseInt(String text, String what) throws ModelException {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new ModelException("Invalid " + what + ": " + text, e);
        }
    }
}
