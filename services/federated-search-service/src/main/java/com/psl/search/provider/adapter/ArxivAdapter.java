package com.psl.search.provider.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.search.provider.AbstractHttpProviderAdapter;
import com.psl.search.provider.ProviderProperties;
import com.psl.search.provider.ProviderUnavailableException;
import com.psl.search.provider.RawCandidate;
import com.psl.search.resilience.ResilienceRegistry;
import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * arXiv export API. Responses are Atom feeds, not JSON.
 */
@Component
public class ArxivAdapter extends AbstractHttpProviderAdapter {
    static final String ID = "arxiv";
    private static final String ATOM = "http://www.w3.org/2005/Atom";
    private static final String ARXIV = "http://arxiv.org/schemas/atom";
    private static final int MAX_LIMIT = 200;

    public ArxivAdapter(
        @Qualifier("providerRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        ProviderProperties properties,
        ResilienceRegistry resilienceRegistry
    ) {
        super(ID, "arXiv", "https://export.arxiv.org", 100,
            restTemplate, objectMapper, properties, resilienceRegistry);
    }

    @Override
    protected List<RawCandidate> fetch(String query, int limit) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl())
            .path("/api/query")
            .queryParam("search_query", "{query}")
            .queryParam("start", 0)
            .queryParam("max_results", Math.min(limit, MAX_LIMIT))
            .queryParam("sortBy", "relevance")
            .encode()
            .buildAndExpand("all:" + query)
            .toUri();
        return parseFeed(getText(uri, null));
    }

    List<RawCandidate> parseFeed(String xml) {
        Document document = parse(xml);
        NodeList entries = document.getElementsByTagNameNS(ATOM, "entry");
        List<RawCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < entries.getLength(); i++) {
            Element entry = (Element) entries.item(i);
            String title = collapse(child(entry, ATOM, "title"));
            if (title == null) {
                continue;
            }
            RawCandidate candidate = new RawCandidate();
            candidate.setTitle(title);
            candidate.setAbstractText(collapse(child(entry, ATOM, "summary")));
            List<String> authors = new ArrayList<>();
            NodeList authorNodes = entry.getElementsByTagNameNS(ATOM, "author");
            for (int j = 0; j < authorNodes.getLength(); j++) {
                String name = collapse(child((Element) authorNodes.item(j), ATOM, "name"));
                if (name != null) {
                    authors.add(name);
                }
            }
            candidate.setAuthors(authors);
            String arxivId = arxivId(child(entry, ATOM, "id"));
            candidate.setArxivId(arxivId);
            candidate.setProviderId(arxivId);
            candidate.setDoi(collapse(child(entry, ARXIV, "doi")));
            String published = child(entry, ATOM, "published");
            candidate.setPublicationDate(isoDate(published));
            candidate.setPublicationYear(yearOf(published));
            candidate.setVenue(collapse(child(entry, ARXIV, "journal_ref")));
            candidate.setPdfUrl(pdfLink(entry));
            candidates.add(candidate);
        }
        return candidates;
    }

    private static Document parse(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new ProviderUnavailableException("invalid_xml", e);
        }
    }

    private static String child(Element parent, String namespace, String name) {
        NodeList nodes = parent.getElementsByTagNameNS(namespace, name);
        if (nodes.getLength() == 0) {
            return null;
        }
        return nodes.item(0).getTextContent();
    }

    private static String pdfLink(Element entry) {
        NodeList links = entry.getElementsByTagNameNS(ATOM, "link");
        for (int i = 0; i < links.getLength(); i++) {
            Element link = (Element) links.item(i);
            if ("pdf".equals(link.getAttribute("title"))) {
                return link.getAttribute("href");
            }
        }
        return null;
    }

    // http://arxiv.org/abs/2101.00001v2 -> 2101.00001
    static String arxivId(String idUrl) {
        if (idUrl == null) {
            return null;
        }
        String value = idUrl.trim();
        int idx = value.indexOf("/abs/");
        if (idx >= 0) {
            value = value.substring(idx + "/abs/".length());
        }
        return value.replaceFirst("v\\d+$", "");
    }

    private static String collapse(String value) {
        if (value == null) {
            return null;
        }
        String collapsed = value.replaceAll("\\s+", " ").trim();
        return collapsed.isEmpty() ? null : collapsed;
    }
}
