/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.seeker.adapter.outbound.fetch;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.LoadState;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.seeker.domain.model.CandidateDocument;
import me.golemcore.seeker.infrastructure.config.SeekerProperties;
import me.golemcore.seeker.port.outbound.DocumentFetchPort;
import me.golemcore.seeker.port.outbound.FetchException;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Headless Chromium fetcher for pages that only render their text with
 * JavaScript.
 *
 * <p>
 * Playwright objects are not thread-safe, so every browser call runs on one
 * dedicated thread. The browser is launched lazily on the first fetch and
 * closed on shutdown. Reader workers still fetch concurrently in the sense that
 * their requests queue here; pages are loaded one at a time.
 */
@Component
@Slf4j
public class BrowserDocumentFetcher implements DocumentFetchPort {

    private static final String EXTRACT_TEXT_SCRIPT = """
            (() => {
                const clone = document.body.cloneNode(true);
                clone.querySelectorAll('script, style, noscript, nav, footer').forEach(el => el.remove());
                return clone.innerText;
            })()
            """;

    private final SeekerProperties properties;
    private final HtmlTextExtractor extractor;
    private final ExecutorService browserThread = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "seeker-browser");
        thread.setDaemon(true);
        return thread;
    });

    private Playwright playwright;
    private Browser browser;
    private BrowserContext context;

    public BrowserDocumentFetcher(SeekerProperties properties, HtmlTextExtractor extractor) {
        this.properties = properties;
        this.extractor = extractor;
    }

    @Override
    public CompletableFuture<String> fetchAndExtract(CandidateDocument document) {
        return CompletableFuture.supplyAsync(() -> load(document.url()), browserThread);
    }

    @SuppressWarnings("PMD.UseTryWithResources")
    private String load(String url) {
        ensureInitialized();
        Page page = context.newPage();
        try {
            page.setDefaultTimeout(properties.getBrowser().getTimeout());
            Response response = page.navigate(url);
            if (response != null && response.status() >= 400) {
                throw new FetchException(url, "HTTP " + response.status());
            }
            page.waitForLoadState(LoadState.DOMCONTENTLOADED);

            String text = extractor.extract(page.content());
            if (text.isBlank()) {
                text = extractor.normalize(renderedText(page));
            }
            log.debug("[Fetch] {} rendered ({} chars)", url, text.length());
            return text;
        } catch (PlaywrightException e) {
            throw new FetchException(url, "Browser navigation failed: " + e.getMessage(), e);
        } finally {
            page.close();
        }
    }

    private String renderedText(Page page) {
        Object result = page.evaluate(EXTRACT_TEXT_SCRIPT);
        return result != null ? result.toString() : "";
    }

    @SuppressWarnings("PMD.CloseResource")
    private void ensureInitialized() {
        if (context != null) {
            return;
        }
        Playwright pw = null;
        Browser br = null;
        try {
            pw = Playwright.create();
            br = pw.chromium().launch(new BrowserType.LaunchOptions()
                    .setHeadless(properties.getBrowser().isHeadless()));
            this.context = br.newContext(new Browser.NewContextOptions()
                    .setUserAgent(properties.getFetch().getUserAgent()));
            this.browser = br;
            this.playwright = pw;
            log.info("Playwright browser initialized (headless: {})", properties.getBrowser().isHeadless());
        } catch (PlaywrightException e) {
            closeQuietly(br);
            closeQuietly(pw);
            throw new FetchException(null, "Browser unavailable: " + e.getMessage(), e);
        }
    }

    @PreDestroy
    public void destroy() {
        browserThread.submit(() -> {
            closeQuietly(context);
            closeQuietly(browser);
            closeQuietly(playwright);
            context = null;
            browser = null;
            playwright = null;
        });
        browserThread.shutdown();
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception e) {
            log.trace("Error closing browser resource: {}", e.getMessage());
        }
    }
}
