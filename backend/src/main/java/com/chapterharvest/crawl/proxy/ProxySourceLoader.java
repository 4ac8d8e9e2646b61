package com.chapterharvest.crawl.proxy;

import com.chapterharvest.config.CrawlerProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads candidate relay endpoints from the configured sources: the inline list, a YAML file with a
 * top-level {@code proxies:} list, and a CSV file with {@code ip,port,protocols} columns.
 */
@Component
public class ProxySourceLoader {
    private static final Logger log = LoggerFactory.getLogger(ProxySourceLoader.class);

    private final CrawlerProperties properties;

    public ProxySourceLoader(CrawlerProperties properties) {
        this.properties = properties;
    }

    public List<String> loadCandidates() {
        CrawlerProperties.Proxy config = properties.getProxy();
        List<String> collected = new ArrayList<>();
        for (String raw : config.getUrls()) {
            String normalized = normalizeUrl(raw);
            if (normalized != null) {
                collected.add(normalized);
            }
        }
        if (config.getYamlPath() != null) {
            collected.addAll(readYaml(Path.of(config.getYamlPath())));
        }
        if (config.getCsvPath() != null) {
            collected.addAll(readCsv(Path.of(config.getCsvPath())));
        }
        return collected;
    }

    List<String> readYaml(Path path) {
        if (!Files.isRegularFile(path)) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(reader);
            if (!(root instanceof Map<?, ?> map)) {
                return List.of();
            }
            Object items = map.get("proxies");
            if (!(items instanceof List<?> list)) {
                return List.of();
            }
            for (Object item : list) {
                if (!(item instanceof String raw)) {
                    continue;
                }
                String normalized = normalizeUrl(raw);
                if (normalized != null) {
                    out.add(normalized);
                }
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load proxy list from {}", path, e);
        }
        return out;
    }

    List<String> readCsv(Path path) {
        if (!Files.isRegularFile(path)) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String endpoint = fromTriple(
                    getColumn(record, "ip", "host"),
                    getColumn(record, "port"),
                    getColumn(record, "protocols", "protocol")
                );
                if (endpoint != null) {
                    out.add(endpoint);
                }
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load proxy table from {}", path, e);
        }
        return out;
    }

    /**
     * Fully-qualified endpoint URL, {@code http://} assumed for {@code host:port}; {@code null} for bare hosts.
     */
    public static String normalizeUrl(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        if (value.isEmpty()) {
            return null;
        }
        if (value.contains("://")) {
            return value;
        }
        if (value.contains(":")) {
            return "http://" + value;
        }
        return null;
    }

    public static String fromTriple(String host, String port, String protocol) {
        String safeHost = host == null ? "" : host.trim();
        String safePort = port == null ? "" : port.trim();
        if (safeHost.isEmpty() || safePort.isEmpty()) {
            return null;
        }
        String proto = protocol == null ? "" : protocol.trim().toLowerCase(Locale.ROOT);
        String scheme;
        if (proto.startsWith("socks5")) {
            scheme = "socks5";
        } else if (proto.startsWith("socks4")) {
            scheme = "socks4";
        } else {
            scheme = "http";
        }
        return scheme + "://" + safeHost + ":" + safePort;
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
        Map<String, String> values = record.toMap();
        for (String name : names) {
            for (Map.Entry<String, String> entry : values.entrySet()) {
                if (entry.getKey() != null && entry.getKey().trim().equalsIgnoreCase(name)) {
                    return entry.getValue();
                }
            }
        }
        return null;
    }
}
