package com.feeyo.kvclient.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import com.feeyo.kvclient.connection.ConnectionParameters;
import com.feeyo.kvclient.connection.RedisConnectionFactory;

/**
 * Loads connection schemes and node lists from xml, e.g.
 *
 * <pre>
 * &lt;connections&gt;
 *   &lt;scheme name="tls" class="com.example.TlsConnection"/&gt;
 *   &lt;node uri="tcp://10.0.0.1:6379?alias=first"/&gt;
 *   &lt;node host="10.0.0.2" port="6380" alias="second"&gt;
 *     &lt;property name="password"&gt;secret&lt;/property&gt;
 *   &lt;/node&gt;
 * &lt;/connections&gt;
 * </pre>
 */
public class ConnectionConfigLoader extends AbstractConfigLoader {

	private static Logger LOGGER = LoggerFactory.getLogger( ConnectionConfigLoader.class );

	/**
	 * scheme name -> connection class name
	 */
	public static Map<String, String> loadSchemeMap(String uri) throws Exception {
		Map<String, String> map = new LinkedHashMap<String, String>();
		try {
			NodeList nodeList = loadXmlDoc(uri).getElementsByTagName("scheme");
			for (int i = 0; i < nodeList.getLength(); i++) {
				NamedNodeMap attrs = nodeList.item(i).getAttributes();
				String name = getAttribute(attrs, "name", null);
				String clazz = getAttribute(attrs, "class", null);
				if (name == null || clazz == null) {
					throw new Exception("scheme element needs both name and class attributes");
				}
				map.put(name.trim(), clazz.trim());
			}
		} catch (Exception e) {
			LOGGER.error("load schemes err, uri=" + uri, e);
			throw e;
		}
		return map;
	}

	public static List<ConnectionParameters> loadNodeList(String uri) throws Exception {
		List<ConnectionParameters> nodes = new ArrayList<ConnectionParameters>();
		try {
			NodeList nodeList = loadXmlDoc(uri).getElementsByTagName("node");
			for (int i = 0; i < nodeList.getLength(); i++) {
				nodes.add( toParameters(nodeList.item(i)) );
			}
		} catch (Exception e) {
			LOGGER.error("load nodes err, uri=" + uri, e);
			throw e;
		}
		return nodes;
	}

	private static ConnectionParameters toParameters(Node node) {
		NamedNodeMap attrs = node.getAttributes();

		String nodeUri = getAttribute(attrs, "uri", null);
		if (nodeUri != null) {
			return ConnectionParameters.parse(nodeUri);
		}

		Map<String, String> values = new LinkedHashMap<String, String>();
		for (int i = 0; i < attrs.getLength(); i++) {
			Node attr = attrs.item(i);
			values.put(attr.getNodeName(), attr.getNodeValue());
		}
		for (Node property : getChildNodes(node, "property")) {
			Element e = (Element) property;
			values.put(e.getAttribute("name"), e.getTextContent().trim());
		}
		return ConnectionParameters.fromMap(values);
	}

	/**
	 * A factory with the built-in schemes plus every scheme of the file.
	 */
	public static RedisConnectionFactory loadFactory(String uri) throws Exception {
		RedisConnectionFactory factory = new RedisConnectionFactory();
		for (Map.Entry<String, String> entry : loadSchemeMap(uri).entrySet()) {
			factory.define(entry.getKey(), entry.getValue());
			LOGGER.info("scheme {} -> {}", entry.getKey(), entry.getValue());
		}
		return factory;
	}
}
