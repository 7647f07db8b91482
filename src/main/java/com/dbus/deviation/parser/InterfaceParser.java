package com.dbus.deviation.parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Comment;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import com.dbus.deviation.diagnostics.DiagnosticsLedger;
import com.dbus.deviation.model.Annotation;
import com.dbus.deviation.model.Argument;
import com.dbus.deviation.model.AstNode;
import com.dbus.deviation.model.Interface;
import com.dbus.deviation.model.Member;
import com.dbus.deviation.model.Method;
import com.dbus.deviation.model.NodeKind;
import com.dbus.deviation.model.Property;
import com.dbus.deviation.model.Signal;
import com.dbus.deviation.model.WellKnownAnnotations;
import com.dbus.deviation.parser.exception.DuplicateNodeException;
import com.dbus.deviation.parser.exception.InterfaceParseException;
import com.dbus.deviation.parser.exception.MalformedDocumentException;
import com.dbus.deviation.parser.exception.MissingAttributeException;
import com.dbus.deviation.parser.exception.UnknownNodeException;

/**
 * Parser for D-Bus introspection XML.
 * Converts one document into a map of interface name to {@link Interface}.
 *
 * Only the fixed introspection vocabulary described by {@link NodeKind} is
 * accepted; elements from the Telepathy and freedesktop documentation
 * namespaces are allowed anywhere and skipped.
 *
 * In fail-fast mode the first violation is thrown. In recovery mode every
 * violation is logged to the {@link DiagnosticsLedger}, the offending element
 * is skipped, parsing continues with its siblings, and no interfaces are
 * returned at the end.
 */
public class InterfaceParser {
    private static final Logger log = LoggerFactory.getLogger(InterfaceParser.class);

    public static final String STAGE = "parser";

    public static final String TP_NAMESPACE = "http://telepathy.freedesktop.org/wiki/DbusSpec#extensions-v0";
    public static final String DOC_NAMESPACE = "http://www.freedesktop.org/dbus/1.0/doc.dtd";

    private static final String WRAPPER_TAG = "spec";

    private final DiagnosticsLedger ledger;

    private String sourceId;
    private boolean recover;
    private int errorCount;

    public InterfaceParser(DiagnosticsLedger ledger) {
        this.ledger = ledger;
    }

    public Optional<Map<String, Interface>> parse(Path file, boolean recover) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(new InputSource(in), file.toString(), recover);
        }
    }

    public Optional<Map<String, Interface>> parse(String xml, String sourceId, boolean recover) {
        try {
            return parse(new InputSource(new StringReader(xml)), sourceId, recover);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Optional<Map<String, Interface>> parse(InputSource input, String sourceId, boolean recover)
            throws IOException {
        this.sourceId = sourceId;
        this.recover = recover;
        this.errorCount = 0;

        Document document;
        try {
            document = createDocumentBuilder().parse(input);
        } catch (SAXException e) {
            report(new MalformedDocumentException(e.getMessage(), e));
            return Optional.empty();
        }

        Map<String, Interface> interfaces = new LinkedHashMap<>();
        resolveInterfaceSet(document.getDocumentElement()).ifPresent(node ->
                parseChildren(node, NodeKind.NODE, NodeKind.NODE.describe(null),
                        (child, kind, comment) -> parseInterface(child, comment, interfaces)));

        if (errorCount > 0) {
            log.warn("{}: {} error(s) found, no interfaces produced", sourceId, errorCount);
            return Optional.empty();
        }

        log.debug("{}: parsed {} interface(s)", sourceId, interfaces.size());
        return Optional.of(Collections.unmodifiableMap(interfaces));
    }

    private Optional<Element> resolveInterfaceSet(Element root) {
        if (isStructural(root, NodeKind.NODE)) {
            return Optional.of(root);
        }

        if (!isWrapper(root)) {
            report(UnknownNodeException.atRoot(root.getTagName()));
            return Optional.empty();
        }

        Element found = null;
        for (Node child = root.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (!(child instanceof Element element) || isDocumentation(element)) {
                continue;
            }
            if (found == null && isStructural(element, NodeKind.NODE)) {
                found = element;
            } else {
                report(UnknownNodeException.inContext(element.getTagName(), NodeKind.NODE.describe(null)));
            }
        }

        if (found == null) {
            report(UnknownNodeException.atRoot(root.getTagName()));
        }
        return Optional.ofNullable(found);
    }

    private void parseInterface(Element element, String comment, Map<String, Interface> interfaces) {
        if (!checkRequiredAttributes(element, NodeKind.INTERFACE)) {
            return;
        }

        String name = element.getAttribute("name");
        if (interfaces.containsKey(name)) {
            report(new DuplicateNodeException(NodeKind.INTERFACE.getLabel(), name));
            return;
        }

        Interface iface = new Interface(name);
        iface.setComment(comment);
        interfaces.put(name, iface);
        log.debug("Parsed interface: {}", name);

        parseChildren(element, NodeKind.INTERFACE, NodeKind.INTERFACE.describe(name), (child, kind, childComment) -> {
            switch (kind) {
                case METHOD -> parseMember(child, childComment, kind, iface, iface.getMethods(),
                        Method::new, iface::addMethod);
                case SIGNAL -> parseMember(child, childComment, kind, iface, iface.getSignals(),
                        Signal::new, iface::addSignal);
                case PROPERTY -> parseProperty(child, childComment, iface);
                case ANNOTATION -> parseAnnotation(child, childComment, iface);
                default -> throw unexpectedChild(kind, NodeKind.INTERFACE);
            }
        });

        applyDocString(iface);
    }

    private <T extends Member> void parseMember(Element element, String comment, NodeKind kind, Interface iface,
                                                Map<String, T> siblings, Function<String, T> factory,
                                                Consumer<T> inserter) {
        if (!checkRequiredAttributes(element, kind)) {
            return;
        }

        String name = element.getAttribute("name");
        if (siblings.containsKey(name)) {
            report(new DuplicateNodeException(kind.getLabel(), iface.formatName() + "." + name));
            return;
        }

        T member = factory.apply(name);
        member.setComment(comment);
        inserter.accept(member);
        log.debug("Parsed {}: {}", kind.getLabel(), member.formatName());

        parseChildren(element, kind, kind.describe(name), (child, childKind, childComment) -> {
            switch (childKind) {
                case ARGUMENT -> parseArgument(child, childComment, member);
                case ANNOTATION -> parseAnnotation(child, childComment, member);
                default -> throw unexpectedChild(childKind, kind);
            }
        });

        applyDocString(member);
    }

    private void parseProperty(Element element, String comment, Interface iface) {
        if (!checkRequiredAttributes(element, NodeKind.PROPERTY)) {
            return;
        }

        String name = element.getAttribute("name");
        if (iface.getProperties().containsKey(name)) {
            report(new DuplicateNodeException(NodeKind.PROPERTY.getLabel(), iface.formatName() + "." + name));
            return;
        }

        Property property = new Property(name, element.getAttribute("type"), element.getAttribute("access"));
        property.setComment(comment);
        iface.addProperty(property);
        log.debug("Parsed property: {} ({}, {})", property.formatName(), property.getType(), property.getAccess());

        parseAnnotationsOnly(element, NodeKind.PROPERTY, NodeKind.PROPERTY.describe(name), property);
        applyDocString(property);
    }

    private void parseArgument(Element element, String comment, Member member) {
        if (!checkRequiredAttributes(element, NodeKind.ARGUMENT)) {
            return;
        }

        String name = element.hasAttribute("name") ? element.getAttribute("name") : null;
        String direction = element.hasAttribute("direction") ? element.getAttribute("direction") : null;

        Argument argument = new Argument(name, element.getAttribute("type"), direction);
        argument.setComment(comment);
        member.addArgument(argument);

        parseAnnotationsOnly(element, NodeKind.ARGUMENT, NodeKind.ARGUMENT.describe(argument.getDisplayName()),
                argument);
        applyDocString(argument);
    }

    private void parseAnnotation(Element element, String comment, AstNode owner) {
        if (!checkRequiredAttributes(element, NodeKind.ANNOTATION)) {
            return;
        }

        Annotation annotation = new Annotation(element.getAttribute("name"), element.getAttribute("value"));
        annotation.setComment(comment);
        owner.addAnnotation(annotation);

        // Annotations permit no structural children; anything found is reported as unknown.
        parseChildren(element, NodeKind.ANNOTATION, NodeKind.ANNOTATION.describe(annotation.getName()),
                (child, kind, childComment) -> {
                    throw unexpectedChild(kind, NodeKind.ANNOTATION);
                });
    }

    private void parseAnnotationsOnly(Element element, NodeKind kind, String context, AstNode owner) {
        parseChildren(element, kind, context, (child, childKind, childComment) -> {
            if (childKind != NodeKind.ANNOTATION) {
                throw unexpectedChild(childKind, kind);
            }
            parseAnnotation(child, childComment, owner);
        });
    }

    /**
     * Walk the children of one element in document order, attaching the
     * immediately preceding XML comment to each structural child.
     */
    private void parseChildren(Element parent, NodeKind parentKind, String context, ChildHandler handler) {
        String pendingComment = null;

        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Comment xmlComment) {
                pendingComment = xmlComment.getData();
                continue;
            }
            if (!(child instanceof Element element)) {
                continue;
            }

            String comment = pendingComment;
            pendingComment = null;

            if (isDocumentation(element)) {
                continue;
            }

            Optional<NodeKind> kind = structuralKind(element).filter(parentKind::permits);
            if (kind.isEmpty()) {
                report(UnknownNodeException.inContext(element.getTagName(), context));
                continue;
            }

            handler.handle(element, kind.get(), comment);
        }
    }

    private boolean checkRequiredAttributes(Element element, NodeKind kind) {
        boolean complete = true;
        for (String attribute : kind.getRequiredAttributes()) {
            if (!element.hasAttribute(attribute)) {
                report(new MissingAttributeException(attribute, kind.getTag()));
                complete = false;
            }
        }
        return complete;
    }

    private void applyDocString(AstNode node) {
        node.findAnnotation(WellKnownAnnotations.DOC_STRING)
                .ifPresent(docString -> node.setComment(docString.getValue()));
    }

    private void report(InterfaceParseException e) {
        if (!recover) {
            throw e;
        }
        errorCount++;
        ledger.log(sourceId, STAGE, e.getErrorCode(), e.getMessage());
        log.debug("{}: recovered from {}: {}", sourceId, e.getErrorCode().getCode(), e.getMessage());
    }

    private static Optional<NodeKind> structuralKind(Element element) {
        if (element.getNamespaceURI() != null) {
            return Optional.empty();
        }
        return NodeKind.forTag(element.getLocalName());
    }

    private static boolean isStructural(Element element, NodeKind kind) {
        return structuralKind(element).filter(k -> k == kind).isPresent();
    }

    private static boolean isWrapper(Element element) {
        return TP_NAMESPACE.equals(element.getNamespaceURI()) && WRAPPER_TAG.equals(element.getLocalName());
    }

    private static boolean isDocumentation(Element element) {
        String namespace = element.getNamespaceURI();
        return TP_NAMESPACE.equals(namespace) || DOC_NAMESPACE.equals(namespace);
    }

    private static IllegalStateException unexpectedChild(NodeKind child, NodeKind parent) {
        return new IllegalStateException("Grammar permits " + child + " in " + parent + " but no handler exists");
    }

    private static DocumentBuilder createDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setIgnoringComments(false);
            factory.setValidating(false);
            factory.setExpandEntityReferences(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            // Introspection files usually reference the freedesktop DTD; never fetch it.
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException e) {
                    log.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
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
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Unable to create an XML parser", e);
        }
    }

    @FunctionalInterface
    private interface ChildHandler {
        void handle(Element element, NodeKind kind, String comment);
    }
}
