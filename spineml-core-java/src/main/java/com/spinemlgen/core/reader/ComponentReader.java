package com.spinemlgen.core.reader;

import com.spinemlgen.core.TranslationException.ConfigurationException;
import com.spinemlgen.core.TranslationListener;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a SpineML component document into a {@link ComponentClass}.
 *
 * Builds the regime table exactly once and checks every transition target against it, so a
 * dangling {@code target_regime} is reported before any code is generated.
 */
public class ComponentReader {

    static final String[] TRANSITION_TAGS = {"OnCondition", "OnEvent", "OnImpulse"};

    private final TranslationListener listener;

    public ComponentReader() {
        this(TranslationListener.NONE);
    }

    public ComponentReader(TranslationListener listener) {
        this.listener = listener;
    }

    public ComponentClass read(Path url, ComponentKind expectedKind) {
        if (!Files.exists(url)) {
            throw new ConfigurationException("Component file not found: " + url);
        }
        try (InputStream in = Files.newInputStream(url)) {
            return read(parse(in, url.toString()), url.toString(), expectedKind);
        } catch (IOException e) {
            throw new ConfigurationException("Could not open component file: " + url + ": " + e.getMessage(), e);
        }
    }

    public ComponentClass read(Document document, String url, ComponentKind expectedKind) {
        Element root = document.getDocumentElement();
        if (root == null || !"SpineML".equals(Dom.tagOf(root))) {
            throw new ConfigurationException("XML file: " + url
                    + " is not a SpineML component - it has no root SpineML node");
        }
        Element componentClass = Dom.child(root, "ComponentClass");
        if (componentClass == null) {
            throw new ConfigurationException("XML file: " + url + " has no ComponentClass node");
        }
        return read(componentClass, url, expectedKind);
    }

    public ComponentClass read(Element componentClass, String url, ComponentKind expectedKind) {
        String type = Dom.attr(componentClass, "type");
        ComponentKind kind = ComponentKind.fromTypeName(type).orElse(null);
        if (kind != expectedKind) {
            throw new ConfigurationException("XML file: " + url + " is not a SpineML "
                    + expectedKind.typeName() + " component - its ComponentClass has type '" + type + "'");
        }
        String name = Dom.attr(componentClass, "name");
        if (name == null) {
            throw new ConfigurationException("XML file: " + url + " has a ComponentClass without a name");
        }

        Element dynamics = Dom.child(componentClass, "Dynamics");
        if (dynamics == null) {
            throw new ConfigurationException("Component " + name + " (" + url + ") has no Dynamics node");
        }
        listener.onModel(url, name, kind);

        List<Element> regimes = Dom.children(dynamics, "Regime");
        List<String> regimeNames = new ArrayList<>();
        for (Element regime : regimes) {
            regimeNames.add(requireName(regime, url));
        }
        RegimeTable table = RegimeTable.build(url, regimeNames);
        validateTransitions(regimes, table, url);

        return new ComponentClass(
                url, name, kind, regimes, table,
                requireNames(componentClass, "Parameter", url),
                requireNames(dynamics, "StateVariable", url),
                Dom.names(componentClass, "AnalogReceivePort"),
                Dom.names(componentClass, "AnalogReducePort"),
                Dom.names(componentClass, "AnalogSendPort"),
                Dom.names(componentClass, "ImpulseReceivePort"));
    }

    public static Document parse(InputStream in, String url) {
        DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
        f.setNamespaceAware(true);
        f.setIgnoringComments(true);
        f.setCoalescing(true);
        try {
            DocumentBuilder b = f.newDocumentBuilder();
            return b.parse(in);
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new ConfigurationException("Unable to load XML file: " + url + ", error: " + e.getMessage(), e);
        }
    }

    private void validateTransitions(List<Element> regimes, RegimeTable table, String url) {
        for (Element regime : regimes) {
            String regimeName = Dom.attr(regime, "name");
            for (String tag : TRANSITION_TAGS) {
                for (Element transition : Dom.children(regime, tag)) {
                    table.resolveTarget(regimeName, tag, targetRegimeOf(transition, regimeName, url));
                }
            }
        }
    }

    /** The {@code target_regime} of a transition; required by SpineML. */
    public static String targetRegimeOf(Element transition, String regimeName, String url) {
        String target = Dom.attr(transition, "target_regime");
        if (target == null) {
            throw new ConfigurationException("Component " + url + ": <" + Dom.tagOf(transition)
                    + "> in regime '" + regimeName + "' has no target_regime");
        }
        return target;
    }

    private static String requireName(Element e, String url) {
        String name = Dom.attr(e, "name");
        if (name == null) {
            throw new ConfigurationException("Component " + url + ": <" + Dom.tagOf(e) + "> without a name");
        }
        return name;
    }

    private static List<String> requireNames(Element parent, String tag, String url) {
        List<String> names = new ArrayList<>();
        for (Element e : Dom.children(parent, tag)) {
            names.add(requireName(e, url));
        }
        return names;
    }
}
