package com.di.tripstar.extract;

import com.google.cloud.ReadChannel;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.Storage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.Reader;
import java.net.URI;
import java.nio.channels.Channels;
import java.nio.charset.StandardCharsets;

/**
 * Reads {@code gs://bucket/object} through the Cloud Storage client.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GcsTripSource implements TripSource {

    private final Storage storage;

    @Override
    public String scheme() {
        return "gs";
    }

    @Override
    public Reader open(URI uri) {
        // getAuthority, not getHost: bucket names may contain underscores
        String bucket = uri.getAuthority();
        String path   = uri.getPath();
        if (bucket == null || bucket.isBlank() || path == null || path.length() <= 1) {
            throw new TripInputException("GCS URI must be gs://<bucket>/<object>: " + uri);
        }
        String object = path.substring(1);

        Blob blob = storage.get(BlobId.of(bucket, object));
        if (blob == null || !blob.exists()) {
            throw new TripInputException("Raw trip file not found: " + uri);
        }
        log.info("[EXTRACT] opening gs://{}/{} ({} bytes)", bucket, object, blob.getSize());

        ReadChannel channel = blob.reader();
        return new BufferedReader(Channels.newReader(channel, StandardCharsets.UTF_8));
    }
}
