package com.foiarelay.directory.scrape;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.extract.PageSnapshots;
import com.foiarelay.directory.model.PageSnapshot;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Headless Chromium sessions. Playwright objects are not thread-safe, so each session
 * owns its own driver and is only ever touched from the worker thread that opened it.
 */
@Component
@ConditionalOnProperty(prefix = "directory.scrape", name = "engine", havingValue = "playwright", matchIfMissing = true)
public class PlaywrightPageSessionFactory implements PageSessionFactory {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightPageSessionFactory.class);

    private final DirectoryProperties properties;

    public PlaywrightPageSessionFactory(DirectoryProperties properties) {
        this.properties = properties;
    }

    @Override
    public String engine() {
        return "playwright";
    }

    @Override
    public PageSession open(int workerIndex) {
        DirectoryProperties.Scrape scrape = properties.getScrape();
        Playwright playwright = Playwright.create();
        try {
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(scrape.isHeadless()));
            BrowserContext context = browser.newContext(new Browser.NewContextOptions().setUserAgent(scrape.getBrowserUserAgent()));
            Page page = context.newPage();
            log.debug("Opened browser page for scrape worker {}", workerIndex);
            return new PlaywrightPageSession(playwright, browser, context, page);
        } catch (PlaywrightException e) {
            playwright.close();
            throw new PageSessionException("Unable to launch browser for worker " + workerIndex, e);
        }
    }

    static final class PlaywrightPageSession implements PageSession {
        private final Playwright playwright;
        private final Browser browser;
        private final BrowserContext context;
        private final Page page;

        private PlaywrightPageSession(Playwright playwright, Browser browser, BrowserContext context, Page page) {
            this.playwright = playwright;
            this.browser = browser;
            this.context = context;
            this.page = page;
        }

        @Override
        public void navigate(String url, Duration timeout) {
            try {
                page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout((double) timeout.toMillis()));
            } catch (PlaywrightException e) {
                throw new PageSessionException("Navigation failed for " + url, e);
            }
        }

        @Override
        public void settle(Duration duration) {
            if (!duration.isZero() && !duration.isNegative()) {
                page.waitForTimeout((double) duration.toMillis());
            }
        }

        @Override
        public boolean reveal(String label, Duration settle) {
            if (label == null || label.isBlank()) {
                return false;
            }
            try {
                Locator tab = page.getByText(label, new Page.GetByTextOptions().setExact(true));
                if (tab.count() == 0) {
                    return false;
                }
                tab.first().click();
                settle(settle);
                return true;
            } catch (PlaywrightException e) {
                log.debug("Reveal '{}' unavailable on {}: {}", label, page.url(), e.getMessage());
                return false;
            }
        }

        @Override
        public PageSnapshot capture() {
            try {
                return PageSnapshots.fromRendered(page.url(), page.content(), page.innerText("body"));
            } catch (PlaywrightException e) {
                throw new PageSessionException("Capture failed for " + page.url(), e);
            }
        }

        @Override
        public void close() {
            closeQuietly(page::close, "page");
            closeQuietly(context::close, "context");
            closeQuietly(browser::close, "browser");
            closeQuietly(playwright::close, "driver");
        }

        private void closeQuietly(Runnable closer, String what) {
            try {
                closer.run();
            } catch (PlaywrightException e) {
                log.debug("Failed to close browser {}: {}", what, e.getMessage());
            }
        }
    }
}
