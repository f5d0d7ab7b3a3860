package com.di.tripstar.extract;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Resolves raw trip locations to the {@link TripSource} serving their scheme.
 *
 * <p>All {@link TripSource} beans are discovered at startup. Schemes are matched
 * case-insensitively; two sources claiming the same scheme fail startup. A
 * location without a scheme is treated as a local file path.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TripSourceRegistry {

    private final List<TripSource> sources;

    private Map<String, TripSource> sourcesByScheme;

    @PostConstruct
    void initialize() {
        if (sources == null || sources.isEmpty()) {
            log.warn("No TripSource beans found. Registry will be empty.");
            sourcesByScheme = Collections.emptyMap();
            return;
        }

        Map<String, TripSource> byScheme = new TreeMap<>();
        for (TripSource source : sources) {
            String scheme = normalize(source.scheme());
            TripSource previous = byScheme.putIfAbsent(scheme, source);
            if (previous != null) {
                throw new IllegalStateException(String.format(
                        "Duplicate TripSource for scheme '%s': %s and %s",
                        scheme, previous.getClass().getSimpleName(), source.getClass().getSimpleName()));
            }
        }
        sourcesByScheme = Collections.unmodifiableMap(byScheme);
        log.info("Registered {} trip source scheme(s): {}", sourcesByScheme.size(), sourcesByScheme.keySet());
    }

    /**
     * Opens the raw trip file at {@code location}.
     *
     * @throws TripInputException on a malformed location, an unsupported scheme or a missing file
     */
    public Reader open(String location) throws IOException {
        URI uri = toUri(location);
        return getSource(uri.getScheme()).open(uri);
    }

    public TripSource getSource(String scheme) {
        if (scheme == null || scheme.isBlank()) {
            throw new TripInputException("Source scheme cannot be null or blank");
        }
        TripSource source = sourcesByScheme.get(normalize(scheme));
        if (source == null) {
            throw new TripInputException(String.format(
                    "Unsupported source scheme: '%s'. Available schemes: %s", scheme, sourcesByScheme.keySet()));
        }
        return source;
    }

    public List<String> getRegisteredSchemes() {
        return List.copyOf(sourcesByScheme.keySet());
    }

    static URI toUri(String location) {
        if (location == null || location.isBlank()) {
            throw new TripInputException("Source location cannot be null or blank");
        }
        String trimmed = location.trim();
        try {
            if (trimmed.contains("://") || trimmed.startsWith("file:")) {
                return new URI(trimmed);
            }
            return Path.of(trimmed).toAbsolutePath().toUri();
        } catch (URISyntaxException | InvalidPathException e) {
            throw new TripInputException("Malformed source location: " + trimmed, e);
        }
    }

    private static String normalize(String scheme) {
        return scheme.trim().toLowerCase(Locale.ROOT);
    }
}
