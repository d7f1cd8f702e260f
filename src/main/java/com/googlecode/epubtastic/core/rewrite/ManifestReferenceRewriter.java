package com.googlecode.epubtastic.core.rewrite;

import com.googlecode.epubtastic.core.EpubException;
import com.googlecode.epubtastic.core.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

/**
 * Rewrites the {@code <item>} entries of an opf package manifest. A renamed item gets
 * its new href, and a jpeg media type becomes {@code image/png}; every other attribute
 * is left alone.
 */
public class ManifestReferenceRewriter implements ReferenceRewriter {

	public static final String OPF_NAMESPACE = "http://www.idpf.org/2007/opf";

	static final String PNG_MEDIA_TYPE = "image/png";

	private final Logger log;

	/** */
	public ManifestReferenceRewriter(Logger log) {
		this.log = log;
	}

	/**
	 * {@inheritDoc}
	 *
	 * @throws EpubException of kind MANIFEST_PARSE if the content is not well formed xml
	 */
	@Override
	public RewriteResult rewrite(String documentPath, String content, ReferenceMatcher matcher) {
		final Document document = parse(documentPath, content);

		final Element manifest = findManifest(document);
		if (manifest == null) {
			log.error("Could not find manifest in %s", documentPath);
			return RewriteResult.unchanged(content);
		}

		int replacements = 0;
		final NodeList items = manifest.getElementsByTagNameNS("*", "item");
		for (int i = 0; i < items.getLength(); i++) {
			final Element item = (Element) items.item(i);
			final String renamed = matcher.rename(documentPath, item.getAttribute("href"));
			if (renamed == null) {
				continue;
			}

			item.setAttribute("href", renamed);
			if (isJpeg(item.getAttribute("media-type"))) {
				item.setAttribute("media-type", PNG_MEDIA_TYPE);
			}
			replacements++;
		}

		return (replacements == 0) ? RewriteResult.unchanged(content)
				: new RewriteResult(serialize(documentPath, document), replacements);
	}

	/**
	 * Look in the root element's namespace first (the opf namespace when none is
	 * declared), then fall back to an unqualified manifest element.
	 */
	Element findManifest(Document document) {
		final String rootNamespace = document.getDocumentElement().getNamespaceURI();
		final String namespace = (rootNamespace == null) ? OPF_NAMESPACE : rootNamespace;

		NodeList manifests = document.getElementsByTagNameNS(namespace, "manifest");
		if (manifests.getLength() == 0) {
			manifests = document.getElementsByTagName("manifest");
		}
		return (manifests.getLength() == 0) ? null : (Element) manifests.item(0);
	}

	/* image/jpg is not a registered type but turns up in the wild */
	private static boolean isJpeg(String mediaType) {
		return "image/jpeg".equalsIgnoreCase(mediaType) || "image/jpg".equalsIgnoreCase(mediaType);
	}

	/* */
	private Document parse(String documentPath, String content) {
		try {
			final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
			factory.setNamespaceAware(true);
			factory.setExpandEntityReferences(false);
			factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);

			final DocumentBuilder builder = factory.newDocumentBuilder();
			final String xml = content.startsWith("\uFEFF") ? content.substring(1) : content;
			return builder.parse(new InputSource(new StringReader(xml)));

		} catch (ParserConfigurationException | SAXException | IOException e) {
			throw new EpubException(EpubException.Kind.MANIFEST_PARSE,
					String.format("Error parsing manifest %s: %s", documentPath, e.getMessage()), e);
		}
	}

	/* */
	private String serialize(String documentPath, Document document) {
		try {
			final Transformer transformer = TransformerFactory.newInstance().newTransformer();
			transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
			transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");
			if (document.getDoctype() != null) {
				if (document.getDoctype().getPublicId() != null) {
					transformer.setOutputProperty(OutputKeys.DOCTYPE_PUBLIC, document.getDoctype().getPublicId());
				}
				if (document.getDoctype().getSystemId() != null) {
					transformer.setOutputProperty(OutputKeys.DOCTYPE_SYSTEM, document.getDoctype().getSystemId());
				}
			}
			document.setXmlStandalone(true);

			final StringWriter out = new StringWriter();
			transformer.transform(new DOMSource(document), new StreamResult(out));
			return out.toString();

		} catch (TransformerException e) {
			throw new EpubException(EpubException.Kind.MANIFEST_PARSE,
					String.format("Error writing manifest %s: %s", documentPath, e.getMessage()), e);
		}
	}
}
