package com.di.tripstar.extract;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code file:} URIs; scheme-less locations are mapped here by the registry.
 */
@Slf4j
@Component
public class LocalFileTripSource implements TripSource {

    @Override
    public String scheme() {
        return "file";
    }

    @Override
    public Reader open(URI uri) throws IOException {
        Path path = Path.of(uri);
        if (!Files.isRegularFile(path)) {
            throw new TripInputException("Raw trip file not found: " + path);
        }
        log.info("[EXTRACT] opening {} ({} bytes)", path, Files.size(path));
        return Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }
}
