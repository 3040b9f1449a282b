package com.foiarelay.directory.registry;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.http.PoliteHttpClient;
import com.foiarelay.directory.model.HttpFetchResult;
import com.foiarelay.directory.model.RegistryRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pages through the registry's {@code agency_components} endpoint with an offset cursor.
 *
 * <p>Enumeration degrades rather than fails: a non-success status, transport error or
 * unreadable page ends the stream and keeps whatever earlier pages produced.
 */
@Service
public class RegistryPageFetcher {
    private static final Logger log = LoggerFactory.getLogger(RegistryPageFetcher.class);
    static final String API_KEY_HEADER = "X-API-Key";

    private final DirectoryProperties properties;
    private final PoliteHttpClient httpClient;
    private final RegistryRecordMapper mapper;
    private final ObjectMapper objectMapper;

    public RegistryPageFetcher(
        DirectoryProperties properties,
        PoliteHttpClient httpClient,
        RegistryRecordMapper mapper,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.objectMapper = objectMapper;
    }

    /**
     * Lazily fetches pages as the returned stream is consumed; no request is issued until
     * the first element is pulled.
     */
    public Stream<RegistryRecord> fetch(int pageSize) {
        PageIterator pages = new PageIterator(Math.max(1, pageSize), properties.getRegistry().getMaxPages());
        Spliterator<List<RegistryRecord>> spliterator = Spliterators.spliteratorUnknownSize(
            pages,
            Spliterator.ORDERED | Spliterator.NONNULL
        );
        return StreamSupport.stream(spliterator, false).flatMap(List::stream);
    }

    public List<RegistryRecord> fetchAll(int pageSize) {
        try (Stream<RegistryRecord> records = fetch(pageSize)) {
            return records.collect(Collectors.toList());
        }
    }

    public List<String> fetchUnitIds(int pageSize) {
        try (Stream<RegistryRecord> records = fetch(pageSize)) {
            return records.map(RegistryRecord::unitId).distinct().collect(Collectors.toList());
        }
    }

    String pageUrl(int pageSize, int offset) {
        String base = properties.getRegistry().getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        // brackets are percent-encoded; java.net.URI rejects them in a query
        return base + "/agency_components?include=agency"
            + "&page%5Blimit%5D=" + pageSize
            + "&page%5Boffset%5D=" + offset;
    }

    private final class PageIterator implements Iterator<List<RegistryRecord>> {
        private final int pageSize;
        private final int maxPages;
        private int pageIndex;
        private boolean exhausted;
        private List<RegistryRecord> buffered;

        private PageIterator(int pageSize, int maxPages) {
            this.pageSize = pageSize;
            this.maxPages = maxPages;
        }

        @Override
        public boolean hasNext() {
            if (buffered != null) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            if (pageIndex >= maxPages) {
                log.warn("Registry pagination stopped at page ceiling {}", maxPages);
                exhausted = true;
                return false;
            }
            if (pageIndex > 0 && !pauseBetweenPages()) {
                exhausted = true;
                return false;
            }
            List<RegistryRecord> page = fetchPage(pageIndex);
            pageIndex++;
            if (page == null || page.isEmpty()) {
                exhausted = true;
                return false;
            }
            if (page.size() < pageSize) {
                exhausted = true;
            }
            buffered = page;
            return true;
        }

        @Override
        public List<RegistryRecord> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            List<RegistryRecord> page = buffered;
            buffered = null;
            return page;
        }

        private List<RegistryRecord> fetchPage(int index) {
            String url = pageUrl(pageSize, index * pageSize);
            HttpFetchResult result = httpClient.get(
                url,
                "application/json",
                Map.of(API_KEY_HEADER, properties.getRegistry().getApiKey())
            );
            if (!result.isSuccessful()) {
                log.warn("Registry page {} failed ({}); keeping {} earlier page(s)", index + 1, result.describeFailure(), index);
                return null;
            }
            try {
                JsonNode root = objectMapper.readTree(result.body() == null ? "" : result.body());
                List<RegistryRecord> records = mapper.mapPage(root);
                log.info("Registry page {}: {} component(s)", index + 1, records.size());
                return records;
            } catch (JsonProcessingException e) {
                log.warn("Registry page {} returned unreadable JSON; keeping {} earlier page(s)", index + 1, index, e);
                return null;
            }
        }

        private boolean pauseBetweenPages() {
            int delayMs = properties.getRegistry().getPageDelayMs();
            if (delayMs <= 0) {
                return true;
            }
            try {
                Thread.sleep(delayMs);
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
