package com.psl.search.provider.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.search.provider.ProviderOutcome;
import com.psl.search.provider.ProviderProperties;
import com.psl.search.provider.RawCandidate;
import com.psl.search.resilience.ResilienceProperties;
import com.psl.search.resilience.ResilienceRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class ArxivAdapterTest {

    private static final String FEED = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
        + "<feed xmlns=\"http://www.w3.org/2005/Atom\" xmlns:arxiv=\"http://arxiv.org/schemas/atom\">"
        + "<entry>"
        + "<id>http://arxiv.org/abs/1706.03762v7</id>"
        + "<published>2017-06-12T17:57:34Z</published>"
        + "<title>Attention Is All\n    You Need</title>"
        + "<summary>  The dominant sequence transduction models\n are based on recurrent networks. </summary>"
        + "<author><name>Ashish Vaswani</name></author>"
        + "<author><name>Noam Shazeer</name></author>"
        + "<arxiv:doi>10.48550/arXiv.1706.03762</arxiv:doi>"
        + "<arxiv:journal_ref>NeurIPS 2017</arxiv:journal_ref>"
        + "<link href=\"http://arxiv.org/abs/1706.03762v7\" rel=\"alternate\" type=\"text/html\"/>"
        + "<link title=\"pdf\" href=\"http://arxiv.org/pdf/1706.03762v7\" rel=\"related\"/>"
        + "</entry>"
        + "<entry><id>http://arxiv.org/abs/0000.00000v1</id><title>   </title></entry>"
        + "</feed>";

    private final RestTemplate restTemplate = new RestTemplate();

    @Test
    void parsesAtomEntries() {
        List<RawCandidate> candidates = adapter().parseFeed(FEED);

        assertEquals(1, candidates.size());
        RawCandidate candidate = candidates.get(0);
        assertEquals("Attention Is All You Need", candidate.getTitle());
        assertEquals("The dominant sequence transduction models are based on recurrent networks.",
            candidate.getAbstractText());
        assertThat(candidate.getAuthors()).containsExactly("Ashish Vaswani", "Noam Shazeer");
        assertEquals("1706.03762", candidate.getArxivId());
        assertEquals("1706.03762", candidate.getProviderId());
        assertEquals("10.48550/arXiv.1706.03762", candidate.getDoi());
        assertEquals("2017-06-12", candidate.getPublicationDate());
        assertEquals(2017, candidate.getPublicationYear());
        assertEquals("NeurIPS 2017", candidate.getVenue());
        assertEquals("http://arxiv.org/pdf/1706.03762v7", candidate.getPdfUrl());
        assertNull(candidate.getCitationCount());
    }

    @Test
    void searchPrefixesAllFieldQuery() {
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo(containsString("search_query=all%3Agraph%20networks")))
            .andRespond(withSuccess(FEED, MediaType.APPLICATION_ATOM_XML));

        ProviderOutcome outcome = adapter().search("graph networks", 5);

        server.verify();
        assertEquals("ok:1", outcome.summary());
        assertEquals("arxiv", outcome.getCandidates().get(0).getProvider());
    }

    @Test
    void brokenXmlIsAnError() {
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo(containsString("export.arxiv.org")))
            .andRespond(withSuccess("<feed><entry>", MediaType.APPLICATION_ATOM_XML));

        assertEquals("err:invalid_xml", adapter().search("q", 5).summary());
    }

    @Test
    void stripsVersionFromId() {
        assertEquals("2101.00001", ArxivAdapter.arxivId("http://arxiv.org/abs/2101.00001v2"));
        assertEquals("hep-th/9901001", ArxivAdapter.arxivId("http://arxiv.org/abs/hep-th/9901001v1"));
        assertNull(ArxivAdapter.arxivId(null));
    }

    private ArxivAdapter adapter() {
        return new ArxivAdapter(
            restTemplate,
            new ObjectMapper(),
            new ProviderProperties(),
            new ResilienceRegistry(new ResilienceProperties())
        );
    }
}
