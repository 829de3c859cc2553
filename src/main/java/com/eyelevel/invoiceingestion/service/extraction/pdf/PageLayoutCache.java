package com.eyelevel.invoiceingestion.service.extraction.pdf;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded LRU cache of parsed page layouts keyed by {@code <document fingerprint>-<page>}, so that several
 * fields on the same page only parse it once. Documents without a fingerprint are never cached. Safe for
 * concurrent use.
 */
@Slf4j
@Component
public class PageLayoutCache {

    @FunctionalInterface
    public interface PageLoader {
        PageLayout load() throws IOException;
    }

    private final Map<String, PageLayout> pages;

    public PageLayoutCache(IngestionProperties properties) {
        this(properties.getExtraction().getPageCacheSize());
    }

    PageLayoutCache(int capacity) {
        this.pages = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, PageLayout> eldest) {
                return size() > capacity;
            }
        };
    }

    public static String key(final String fingerprint, final int pageNumber) {
        Objects.requireNonNull(fingerprint, "A page layout can only be cached for a fingerprinted document");
        return fingerprint + "-" + pageNumber;
    }

    public PageLayout getOrLoad(final String key, final PageLoader loader) throws IOException {
        synchronized (pages) {
            final PageLayout cached = pages.get(key);
            if (cached != null) {
                return cached;
            }
        }
        final PageLayout loaded = loader.load();
        synchronized (pages) {
            pages.put(key, loaded);
        }
        log.trace("Cached page layout {}", key);
        return loaded;
    }

    public int size() {
        synchronized (pages) {
            return pages.size();
        }
    }
}
