package com.foiarelay.directory.service;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.extract.ContactExtractor;
import com.foiarelay.directory.http.PoliteHttpClient;
import com.foiarelay.directory.model.CanonicalRecord;
import com.foiarelay.directory.model.DeliveryChannel;
import com.foiarelay.directory.model.PipelineRunRequest;
import com.foiarelay.directory.model.PipelineRunSummary;
import com.foiarelay.directory.model.ResolutionQuery;
import com.foiarelay.directory.model.ResolutionResult;
import com.foiarelay.directory.persistence.JsonFileDirectoryRepository;
import com.foiarelay.directory.reconcile.ReconciliationEngine;
import com.foiarelay.directory.registry.RegistryPageFetcher;
import com.foiarelay.directory.registry.RegistryRecordMapper;
import com.foiarelay.directory.resolve.AgencyResolver;
import com.foiarelay.directory.resolve.AgencySearchService;
import com.foiarelay.directory.resolve.ExactNameMatcher;
import com.foiarelay.directory.resolve.NameContainsMatcher;
import com.foiarelay.directory.resolve.UnitIdMatcher;
import com.foiarelay.directory.scrape.HttpPageSessionFactory;
import com.foiarelay.directory.scrape.ScraperPool;
import com.foiarelay.directory.store.DirectoryStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class DirectoryPipelineEndToEndTest {

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private ExecutorService httpExecutor;
    private ExecutorService runExecutor;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new FoiaSiteDispatcher());
        server.start();
        httpExecutor = Executors.newFixedThreadPool(4);
        runExecutor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        httpExecutor.shutdownNow();
        runExecutor.shutdownNow();
    }

    @Test
    void pipelineBuildsDirectoryThatResolverAndSearchServe() {
        String origin = "http://" + server.getHostName() + ":" + server.getPort();
        DirectoryProperties properties = new DirectoryProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestMaxRetries(0);
        properties.getRegistry().setBaseUrl(origin + "/api");
        properties.getRegistry().setPageSize(2);
        properties.getRegistry().setPageDelayMs(0);
        properties.getScrape().setEngine("http");
        properties.getScrape().setPageUrlTemplate(origin + "/request/agency-component/{id}/");
        properties.getScrape().setInitialSettleMs(0);
        properties.getScrape().setRevealSettleMs(0);
        properties.getScrape().setTaskTimeoutSeconds(10);
        properties.getStore().setFilePath(tempDir.resolve("agency-directory.json").toString());

        ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        Clock clock = Clock.systemUTC();
        PoliteHttpClient httpClient = new PoliteHttpClient(properties, httpExecutor);
        ContactExtractor extractor = new ContactExtractor(properties);
        DirectoryStore store = new DirectoryStore(
            new JsonFileDirectoryRepository(properties, objectMapper),
            properties,
            clock
        );
        DirectoryPipelineService pipeline = new DirectoryPipelineService(
            new RegistryPageFetcher(properties, httpClient, new RegistryRecordMapper(), objectMapper),
            new ScraperPool(properties, new HttpPageSessionFactory(httpClient), extractor),
            new ReconciliationEngine(extractor, clock),
            store,
            properties,
            runExecutor,
            clock
        );

        PipelineRunSummary summary = pipeline.run(new PipelineRunRequest(null, 2, null));

        assertThat(summary.status()).isEqualTo(DirectoryPipelineService.STATUS_COMPLETED);
        assertThat(summary.registryCount()).isEqualTo(3);
        assertThat(summary.scrapedCount()).isEqualTo(3);
        assertThat(summary.withEmailCount()).isEqualTo(1);
        assertThat(tempDir.resolve("agency-directory.json")).exists();

        store.invalidate();
        List<CanonicalRecord> records = store.records();
        assertThat(records).extracting(CanonicalRecord::unitId).containsExactly("u1", "u2", "u3");
        assertThat(records.get(0).emails()).containsExactly("foia@records.gov");
        assertThat(records.get(0).name()).isEqualTo("Records Office");
        assertThat(records.get(0).parentAgencyName()).isEqualTo("Department of Examples");
        assertThat(records.get(1).emails()).isEmpty();
        assertThat(records.get(2).name()).isEqualTo("Broken Office");
        assertThat(records.get(2).website()).isEqualTo(origin + "/request/agency-component/u3/");

        AgencyResolver resolver = new AgencyResolver(
            store,
            List.of(new UnitIdMatcher(), new ExactNameMatcher(), new NameContainsMatcher())
        );
        ResolutionResult byName = resolver.resolve(ResolutionQuery.byName("records office"));
        assertThat(byName.channel()).isEqualTo(DeliveryChannel.EMAIL);
        assertThat(byName.emailAddress()).isEqualTo("foia@records.gov");

        ResolutionResult sharedOnly = resolver.resolve(ResolutionQuery.byUnitId("u2"));
        assertThat(sharedOnly.channel()).isEqualTo(DeliveryChannel.PORTAL);
        assertThat(sharedOnly.record().unitId()).isEqualTo("u2");

        AgencySearchService search = new AgencySearchService(store, properties);
        assertThat(search.search("examples", null)).extracting(CanonicalRecord::unitId).containsExactly("u1");
    }

    private static final class FoiaSiteDispatcher extends Dispatcher {
        @Override
        public MockResponse dispatch(RecordedRequest request) {
            String path = request.getRequestUrl() == null ? "" : request.getRequestUrl().encodedPath();
            if (path.equals("/api/agency_components")) {
                String offset = request.getRequestUrl().queryParameter("page[offset]");
                return json("0".equals(offset)
                    ? registryPage(component("u1", "Records Office"), component("u2", "Shared Intake Office"))
                    : registryPage(component("u3", "Broken Office")));
            }
            switch (path) {
                case "/request/agency-component/u1/":
                    return html("<h1>Records Office (scraped)</h1>"
                        + "<p>Send requests to <a href=\"mailto:foia@records.gov\">foia@records.gov</a></p>");
                case "/request/agency-component/u2/":
                    return html("<h1>Shared Intake Office</h1>"
                        + "<p>Use <a href=\"mailto:National.FOIAPortal@usdoj.gov\">the portal</a></p>");
                case "/request/agency-component/u3/":
                    return new MockResponse().setResponseCode(500).setBody("error");
                default:
                    return new MockResponse().setResponseCode(404);
            }
        }

        private static MockResponse json(String body) {
            return new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/json").setBody(body);
        }

        private static MockResponse html(String body) {
            return new MockResponse().setResponseCode(200)
                .setHeader("Content-Type", "text/html")
                .setBody("<html><body>" + body + "</body></html>");
        }

        private static String registryPage(String... components) {
            return "{\"data\":[" + String.join(",", components) + "],"
                + "\"included\":[{\"id\":\"dept\",\"type\":\"agency\",\"attributes\":"
                + "{\"name\":\"Department of Examples\",\"abbreviation\":\"DOE\"}}]}";
        }

        private static String component(String id, String title) {
            return "{\"id\":\"" + id + "\",\"type\":\"agency_component\",\"attributes\":{\"title\":\"" + title + "\"},"
                + "\"relationships\":{\"agency\":{\"data\":{\"id\":\"dept\",\"type\":\"agency\"}}}}";
        }
    }
}
