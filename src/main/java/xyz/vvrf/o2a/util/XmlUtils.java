package xyz.vvrf.o2a.util;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * DOM 辅助方法。所有标签比较都使用去掉命名空间后的本地名称，
 * 因为 workflow.xml 的命名空间随 schema 版本变化 (uri:oozie:workflow:0.5 等)。
 *
 * @author ruifeng.wen
 */
public final class XmlUtils {

    private XmlUtils() {}

    /**
     * 以命名空间感知模式解析 XML，并禁用外部实体。
     *
     * @param inputStream XML 输入流
     * @return 解析得到的文档
     * @throws IllegalArgumentException 如果内容不是格式正确的 XML
     */
    public static Document parse(InputStream inputStream) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(inputStream);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("无法创建 XML 解析器", e);
        } catch (SAXException e) {
            throw new IllegalArgumentException("工作流 XML 格式错误: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("读取工作流 XML 失败", e);
        }
    }

    /**
     * @param node DOM 节点
     * @return 去掉命名空间前缀后的标签名
     */
    public static String localName(Node node) {
        String localName = node.getLocalName();
        if (localName != null) {
            return localName;
        }
        String nodeName = node.getNodeName();
        int colon = nodeName.indexOf(':');
        return colon >= 0 ? nodeName.substring(colon + 1) : nodeName;
    }

    /**
     * @param parent 父元素
     * @return 所有直接子元素，按文档顺序
     */
    public static List<Element> childElements(Element parent) {
        NodeList children = parent.getChildNodes();
        List<Element> elements = new ArrayList<>();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) child);
            }
        }
        return Collections.unmodifiableList(elements);
    }

    /**
     * @param parent 父元素
     * @param tag    本地标签名
     * @return 所有标签名匹配的直接子元素
     */
    public static List<Element> childElements(Element parent, String tag) {
        List<Element> matched = new ArrayList<>();
        for (Element child : childElements(parent)) {
            if (tag.equals(localName(child))) {
                matched.add(child);
            }
        }
        return Collections.unmodifiableList(matched);
    }

    /**
     * @param parent 父元素
     * @param tag    本地标签名
     * @return 第一个标签名匹配的直接子元素
     */
    public static Optional<Element> findChild(Element parent, String tag) {
        List<Element> matched = childElements(parent, tag);
        return matched.isEmpty() ? Optional.empty() : Optional.of(matched.get(0));
    }

    /**
     * @param parent 父元素
     * @param tag    本地标签名
     * @return 第一个匹配子元素的去首尾空白文本；不存在时为空
     */
    public static Optional<String> childText(Element parent, String tag) {
        return findChild(parent, tag).map(element -> element.getTextContent().trim());
    }

    /**
     * @param parent 父元素
     * @param tag    本地标签名
     * @return 所有匹配子元素的文本，按文档顺序
     */
    public static List<String> childTexts(Element parent, String tag) {
        List<String> texts = new ArrayList<>();
        for (Element child : childElements(parent, tag)) {
            texts.add(child.getTextContent().trim());
        }
        return Collections.unmodifiableList(texts);
    }

    /**
     * @param element   元素
     * @param attribute 属性名
     * @return 属性值；属性不存在时为空 (DOM 对不存在的属性返回空字符串)
     */
    public static Optional<String> attribute(Element element, String attribute) {
        if (!element.hasAttribute(attribute)) {
            return Optional.empty();
        }
        return Optional.of(element.getAttribute(attribute));
    }
}
