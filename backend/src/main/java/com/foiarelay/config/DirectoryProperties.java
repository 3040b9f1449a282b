package com.foiarelay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "directory")
public class DirectoryProperties {
    private static final String DEFAULT_USER_AGENT = "foia-relay/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 200;
    private int globalConcurrency = 10;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 4000;
    private Registry registry = new Registry();
    private Scrape scrape = new Scrape();
    private Store store = new Store();
    private Portal portal = new Portal();
    private Search search = new Search();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = requestMaxRetries;
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Scrape getScrape() {
        return scrape;
    }

    public void setScrape(Scrape scrape) {
        this.scrape = scrape;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Portal getPortal() {
        return portal;
    }

    public void setPortal(Portal portal) {
        this.portal = portal;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Registry {
        private String baseUrl = "https://api.foia.gov/api";
        private String apiKey = "";
        private int pageSize = 50;
        private int maxPages = 20;
        private int pageDelayMs = 200;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey == null ? "" : apiKey.trim();
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getPageSize() {
            return Math.max(1, pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = Math.max(1, pageSize);
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public int getPageDelayMs() {
            return Math.max(0, pageDelayMs);
        }

        public void setPageDelayMs(int pageDelayMs) {
            this.pageDelayMs = Math.max(0, pageDelayMs);
        }
    }

    public static class Scrape {
        private String engine = "playwright";
        private int concurrency = 10;
        private String pageUrlTemplate = "https://www.foia.gov/request/agency-component/{id}/";
        private String revealLabel = "Agency information";
        private String sharedIntakeAddress = "National.FOIAPortal@usdoj.gov";
        private int navigationTimeoutMs = 15000;
        private int initialSettleMs = 500;
        private int revealSettleMs = 800;
        private int taskTimeoutSeconds = 30;
        private boolean headless = true;
        private String browserUserAgent =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36";

        public String getEngine() {
            return engine == null || engine.isBlank() ? "playwright" : engine.trim().toLowerCase();
        }

        public void setEngine(String engine) {
            this.engine = engine;
        }

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public String getPageUrlTemplate() {
            return pageUrlTemplate;
        }

        public void setPageUrlTemplate(String pageUrlTemplate) {
            this.pageUrlTemplate = pageUrlTemplate;
        }

        public String pageUrlFor(String unitId) {
            return pageUrlTemplate.replace("{id}", unitId == null ? "" : unitId.trim());
        }

        public String getRevealLabel() {
            return revealLabel;
        }

        public void setRevealLabel(String revealLabel) {
            this.revealLabel = revealLabel;
        }

        public String getSharedIntakeAddress() {
            return sharedIntakeAddress;
        }

        public void setSharedIntakeAddress(String sharedIntakeAddress) {
            this.sharedIntakeAddress = sharedIntakeAddress;
        }

        public int getNavigationTimeoutMs() {
            return Math.max(1, navigationTimeoutMs);
        }

        public void setNavigationTimeoutMs(int navigationTimeoutMs) {
            this.navigationTimeoutMs = Math.max(1, navigationTimeoutMs);
        }

        public int getInitialSettleMs() {
            return Math.max(0, initialSettleMs);
        }

        public void setInitialSettleMs(int initialSettleMs) {
            this.initialSettleMs = Math.max(0, initialSettleMs);
        }

        public int getRevealSettleMs() {
            return Math.max(0, revealSettleMs);
        }

        public void setRevealSettleMs(int revealSettleMs) {
            this.revealSettleMs = Math.max(0, revealSettleMs);
        }

        public int getTaskTimeoutSeconds() {
            return Math.max(1, taskTimeoutSeconds);
        }

        public void setTaskTimeoutSeconds(int taskTimeoutSeconds) {
            this.taskTimeoutSeconds = Math.max(1, taskTimeoutSeconds);
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public String getBrowserUserAgent() {
            return browserUserAgent;
        }

        public void setBrowserUserAgent(String browserUserAgent) {
            this.browserUserAgent = browserUserAgent;
        }
    }

    public static class Store {
        private String backend = "jdbc";
        private String filePath = "../data/agency-directory.json";
        private long cacheTtlMinutes = 24 * 60;

        public String getBackend() {
            return backend == null || backend.isBlank() ? "jdbc" : backend.trim().toLowerCase();
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public String getFilePath() {
            return filePath;
        }

        public void setFilePath(String filePath) {
            this.filePath = filePath;
        }

        public long getCacheTtlMinutes() {
            return Math.max(1, cacheTtlMinutes);
        }

        public void setCacheTtlMinutes(long cacheTtlMinutes) {
            this.cacheTtlMinutes = Math.max(1, cacheTtlMinutes);
        }
    }

    public static class Portal {
        private String urlTemplate = "https://www.foia.gov/request/agency-component/{id}/";
        private List<String> extendedFormUnitIds = new ArrayList<>(List.of("e366935f-20e1-4404-ac40-ed5518a5ce5a"));
        private String fallbackUrl = "https://www.foia.gov/request/";
        private String manualFallbackMessage = "Please submit your request manually at foia.gov.";

        public String getUrlTemplate() {
            return urlTemplate;
        }

        public void setUrlTemplate(String urlTemplate) {
            this.urlTemplate = urlTemplate;
        }

        public String portalUrlFor(String unitId) {
            if (unitId == null || unitId.isBlank()) {
                return fallbackUrl;
            }
            return urlTemplate.replace("{id}", unitId.trim());
        }

        public String getFallbackUrl() {
            return fallbackUrl;
        }

        public void setFallbackUrl(String fallbackUrl) {
            this.fallbackUrl = fallbackUrl;
        }

        public List<String> getExtendedFormUnitIds() {
            return extendedFormUnitIds;
        }

        public void setExtendedFormUnitIds(List<String> extendedFormUnitIds) {
            this.extendedFormUnitIds = extendedFormUnitIds == null ? new ArrayList<>() : extendedFormUnitIds;
        }

        public boolean isExtendedFormUnit(String unitId) {
            return unitId != null && extendedFormUnitIds.contains(unitId.trim());
        }

        public String getManualFallbackMessage() {
            return manualFallbackMessage;
        }

        public void setManualFallbackMessage(String manualFallbackMessage) {
            this.manualFallbackMessage = manualFallbackMessage;
        }
    }

    public static class Search {
        private int defaultLimit = 20;

        public int getDefaultLimit() {
            return Math.max(1, defaultLimit);
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = Math.max(1, defaultLimit);
        }
    }

    public static class Cli {
        private boolean run;
        private int limit = 0;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
