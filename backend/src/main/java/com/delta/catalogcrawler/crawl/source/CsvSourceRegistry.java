package com.delta.catalogcrawler.crawl.source;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.Source;
import com.delta.catalogcrawler.crawl.render.RenderMode;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Source descriptors read from a CSV file with the columns
 * {@code id, display_name, listing_url, weidian_id, taobao_shop, render_mode}.
 */
@Component
public class CsvSourceRegistry implements SourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(CsvSourceRegistry.class);

    private final CrawlerProperties properties;
    private volatile Map<String, Source> sources;

    public CsvSourceRegistry(CrawlerProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<Source> allSources() {
        return List.copyOf(loaded().values());
    }

    @Override
    public Optional<Source> findSource(String sourceId) {
        if (sourceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(loaded().get(sourceId.trim()));
    }

    public synchronized int reload() {
        sources = read(resolvePath(properties.getData().getSourcesCsv()));
        return sources.size();
    }

    private Map<String, Source> loaded() {
        Map<String, Source> current = sources;
        if (current == null) {
            synchronized (this) {
                if (sources == null) {
                    sources = read(resolvePath(properties.getData().getSourcesCsv()));
                }
                current = sources;
            }
        }
        return current;
    }

    private Map<String, Source> read(Path path) {
        Map<String, Source> out = new LinkedHashMap<>();
        if (!Files.isRegularFile(path)) {
            log.warn("Sources CSV not found at {}; no sources registered", path);
            return out;
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                Source source = toSource(record);
                if (source == null) {
                    log.warn("Skipping sources CSV line {}: id and listing_url are required", record.getRecordNumber());
                    continue;
                }
                if (out.putIfAbsent(source.id(), source) != null) {
                    log.warn("Duplicate source id {} in {}; keeping the first entry", source.id(), path);
                }
            }
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to read sources CSV at {}", path, e);
        }
        log.info("Loaded {} sources from {}", out.size(), path);
        return out;
    }

    private Source toSource(CSVRecord record) {
        String id = getColumn(record, "id");
        String listingUrl = getColumn(record, "listing_url", "url");
        if (id == null || listingUrl == null) {
            return null;
        }
        return new Source(
            id,
            getColumn(record, "display_name", "name"),
            listingUrl,
            getColumn(record, "weidian_id"),
            getColumn(record, "taobao_shop"),
            parseRenderMode(getColumn(record, "render_mode"))
        );
    }

    private RenderMode parseRenderMode(String raw) {
        if (raw == null) {
            return properties.getDefaultRenderMode();
        }
        try {
            return RenderMode.valueOf(raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown render_mode {}; using {}", raw, properties.getDefaultRenderMode());
            return properties.getDefaultRenderMode();
        }
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header != null && header.trim().equalsIgnoreCase(name)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
