package com.questrail.l5x.project;

import com.questrail.l5x.api.ControllerProject;
import com.questrail.l5x.api.ControllerTag;
import com.questrail.l5x.api.Routine;
import com.questrail.l5x.api.RungRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * L5xProjectLoader
 * =============================================================================
 * Parses an RSLogix 5000 / Studio 5000 XML export ({@code .L5X}) into a
 * read-only {@link ControllerProject}.
 *
 * <h2>What is read</h2>
 * <ul>
 *   <li>{@code Controller/Programs/Program/Routines/Routine} elements that have
 *       an {@code RLLContent} child (ladder routines only)</li>
 *   <li>{@code Rung/Comment} and {@code Rung/Text} payloads of every rung</li>
 *   <li>{@code Controller/Tags/Tag}: name, data type, top-level members and
 *       per-operand comments</li>
 * </ul>
 *
 * <h2>What is NOT read</h2>
 * <ul>
 *   <li>Program-scope tags and alias resolution</li>
 *   <li>Structured text, function block and SFC routines</li>
 *   <li>Add-on instruction definitions</li>
 * </ul>
 *
 * <h2>Member discovery</h2>
 * Members come from the tag's {@code Data Format="Decorated"} structure when
 * present. Exports that only carry L5K data fall back to the matching
 * {@code Controller/DataTypes/DataType} definition.
 *
 * <h2>Parser hardening</h2>
 * DOCTYPE declarations and external entities are rejected; an L5X export never
 * legitimately contains either.
 */
public final class L5xProjectLoader
{
    private static final Logger log = LoggerFactory.getLogger(L5xProjectLoader.class);

    /** Root element of every L5X export. */
    static final String ROOT_ELEMENT = "RSLogix5000Content";

    /** Default language picked from multi-language comments. */
    public static final String DEFAULT_LANGUAGE = "en-US";

    private final String preferredLanguage;

    public L5xProjectLoader() {
        this(DEFAULT_LANGUAGE);
    }

    /**
     * @param preferredLanguage {@code Lang} attribute to prefer when an export
     *                          carries localized comments
     */
    public L5xProjectLoader(String preferredLanguage) {
        this.preferredLanguage = Objects.requireNonNull(preferredLanguage, "preferredLanguage");
    }

    /**
     * Loads an export from disk.
     *
     * @param path location of the {@code .L5X} file
     * @return the parsed project
     * @throws InputMissingException if the file does not exist or cannot be read
     * @throws L5xFormatException    if the file is not a valid L5X export
     */
    public ControllerProject load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new InputMissingException(path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.getFileName().toString());
        } catch (IOException e) {
            throw new InputMissingException(path, e);
        }
    }

    /**
     * Loads an export from a stream. The stream is not closed.
     *
     * @param in         export content
     * @param sourceName name used in log and error messages
     * @return the parsed project
     * @throws L5xFormatException if the content is not a valid L5X export
     */
    public ControllerProject load(InputStream in, String sourceName) {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(sourceName, "sourceName");

        Document document = parse(in, sourceName);
        Element root = document.getDocumentElement();
        if (!ROOT_ELEMENT.equals(root.getNodeName())) {
            throw new L5xFormatException("Invalid L5X file " + sourceName
                    + ": root element is <" + root.getNodeName() + ">, expected <" + ROOT_ELEMENT + ">");
        }

        Element controller = L5xElements.child(root, "Controller")
                .orElseThrow(() -> new L5xFormatException(
                        "Invalid L5X file " + sourceName + ": no <Controller> element"));

        Map<String, List<L5xMember>> dataTypes = readDataTypes(controller);
        List<ControllerTag> tags = readTags(controller, dataTypes);
        List<Routine> routines = readRoutines(controller);

        log.debug("Loaded {}: {} controller tags, {} ladder routines", sourceName, tags.size(), routines.size());
        return new L5xControllerProject(L5xElements.attribute(controller, "Name"), routines, tags);
    }

    private static Document parse(InputStream in, String sourceName) {
        try {
            DocumentBuilder builder = newDocumentBuilderFactory().newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException e) {
                    log.debug("XML warning in {}: {}", sourceName, e.getMessage());
                }

                @Override
                public void error(SAXParseException e) throws SAXException {
                    throw e;
                }

                @Override
                public void fatalError(SAXParseException e) throws SAXException {
                    throw e;
                }
            });
            return builder.parse(in, sourceName);
        } catch (SAXException e) {
            throw new L5xFormatException("Invalid L5X file " + sourceName + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new L5xFormatException("Failed to read L5X content from " + sourceName, e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser cannot be configured", e);
        }
    }

    private static DocumentBuilderFactory newDocumentBuilderFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        // CDATA sections are merged into text so payloads read as plain strings.
        factory.setCoalescing(true);
        return factory;
    }

    // ========================================================================
    // Routines
    // ========================================================================

    private List<Routine> readRoutines(Element controller) {
        List<Routine> routines = new ArrayList<>();
        Optional<Element> programs = L5xElements.child(controller, "Programs");
        if (programs.isEmpty()) {
            return routines;
        }
        for (Element program : L5xElements.children(programs.get(), "Program")) {
            String programName = Objects.requireNonNullElse(L5xElements.attribute(program, "Name"), "");
            Optional<Element> routinesElement = L5xElements.child(program, "Routines");
            if (routinesElement.isEmpty()) {
                continue;
            }
            for (Element routine : L5xElements.children(routinesElement.get(), "Routine")) {
                Optional<Element> rll = L5xElements.child(routine, "RLLContent");
                if (rll.isEmpty()) {
                    continue;
                }
                String routineName = Objects.requireNonNullElse(L5xElements.attribute(routine, "Name"), "");
                routines.add(new Routine(programName, routineName, readRungs(rll.get())));
            }
        }
        return routines;
    }

    private List<RungRecord> readRungs(Element rllContent) {
        List<RungRecord> rungs = new ArrayList<>();
        int position = 0;
        for (Element rung : L5xElements.children(rllContent, "Rung")) {
            String comment = L5xElements.child(rung, "Comment")
                    .map(e -> L5xElements.text(e, preferredLanguage))
                    .orElse(null);
            String text = L5xElements.child(rung, "Text")
                    .map(e -> L5xElements.text(e, preferredLanguage))
                    .orElse(null);
            rungs.add(RungRecord.of(position++, comment, text));
        }
        return rungs;
    }

    // ========================================================================
    // Tags
    // ========================================================================

    private List<ControllerTag> readTags(Element controller, Map<String, List<L5xMember>> dataTypes) {
        List<ControllerTag> tags = new ArrayList<>();
        Optional<Element> tagsElement = L5xElements.child(controller, "Tags");
        if (tagsElement.isEmpty()) {
            return tags;
        }
        for (Element tag : L5xElements.children(tagsElement.get(), "Tag")) {
            String name = L5xElements.attribute(tag, "Name");
            if (name == null || name.isEmpty()) {
                log.debug("Skipping controller tag without a Name attribute");
                continue;
            }
            String dataType = Objects.requireNonNullElse(L5xElements.attribute(tag, "DataType"), "");

            Map<String, L5xMember> members = readDecoratedMembers(tag);
            if (members.isEmpty()) {
                for (L5xMember member : dataTypes.getOrDefault(dataType, List.of())) {
                    members.put(member.name(), member);
                }
            }
            tags.add(new L5xTag(name, dataType, members, readOperandComments(tag)));
        }
        return tags;
    }

    private static Map<String, L5xMember> readDecoratedMembers(Element tag) {
        Map<String, L5xMember> members = new LinkedHashMap<>();
        for (Element data : L5xElements.children(tag, "Data")) {
            if (!"Decorated".equals(data.getAttribute("Format"))) {
                continue;
            }
            Optional<Element> structure = L5xElements.child(data, "Structure");
            if (structure.isEmpty()) {
                continue;
            }
            for (Element member : L5xElements.children(structure.get())) {
                String memberName = L5xElements.attribute(member, "Name");
                if (memberName == null) {
                    continue;
                }
                String memberType = Objects.requireNonNullElse(L5xElements.attribute(member, "DataType"), "");
                int dimension = "ArrayMember".equals(member.getNodeName())
                        ? parseDimension(L5xElements.attribute(member, "Dimensions"))
                        : 0;
                members.put(memberName, new L5xMember(memberName, memberType, dimension));
            }
        }
        return members;
    }

    private Map<String, String> readOperandComments(Element tag) {
        Map<String, String> comments = new HashMap<>();
        Optional<Element> commentsElement = L5xElements.child(tag, "Comments");
        if (commentsElement.isEmpty()) {
            return comments;
        }
        for (Element comment : L5xElements.children(commentsElement.get(), "Comment")) {
            String operand = L5xElements.attribute(comment, "Operand");
            String text = L5xElements.text(comment, preferredLanguage);
            if (operand != null && text != null) {
                comments.put(L5xTag.operandKey(operand), text);
            }
        }
        return comments;
    }

    private static Map<String, List<L5xMember>> readDataTypes(Element controller) {
        Map<String, List<L5xMember>> dataTypes = new HashMap<>();
        Optional<Element> dataTypesElement = L5xElements.child(controller, "DataTypes");
        if (dataTypesElement.isEmpty()) {
            return dataTypes;
        }
        for (Element dataType : L5xElements.children(dataTypesElement.get(), "DataType")) {
            String typeName = L5xElements.attribute(dataType, "Name");
            Optional<Element> membersElement = L5xElements.child(dataType, "Members");
            if (typeName == null || membersElement.isEmpty()) {
                continue;
            }
            List<L5xMember> members = new ArrayList<>();
            for (Element member : L5xElements.children(membersElement.get(), "Member")) {
                String memberName = L5xElements.attribute(member, "Name");
                // Hidden members back BOOL bit fields and are not addressable.
                if (memberName == null || "true".equalsIgnoreCase(member.getAttribute("Hidden"))) {
                    continue;
                }
                String memberType = Objects.requireNonNullElse(L5xElements.attribute(member, "DataType"), "");
                members.add(new L5xMember(memberName, memberType,
                        parseDimension(L5xElements.attribute(member, "Dimension"))));
            }
            dataTypes.put(typeName, members);
        }
        return dataTypes;
    }

    /**
     * Parses the first dimension of an L5X dimension attribute ({@code "4"},
     * {@code "4 2"}, {@code "4,2"}). Missing or unparsable values count as 0.
     */
    static int parseDimension(String attribute) {
        if (attribute == null || attribute.isBlank()) {
            return 0;
        }
        String first = attribute.strip().split("[\\s,]+")[0];
        try {
            return Math.max(0, Integer.parseInt(first));
        } catch (NumberFormatException e) {
            log.debug("Unparsable dimension attribute '{}'", attribute);
            return 0;
        }
    }
}
