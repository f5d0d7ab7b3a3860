package com.di.tripstar.extract;

import com.google.cloud.ReadChannel;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.Storage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.Reader;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * The registry is initialized by hand; no Spring context.
 */
@DisplayName("TripSourceRegistry Tests")
class TripSourceRegistryTest {

    private static TripSourceRegistry registry(TripSource... sources) {
        TripSourceRegistry registry = new TripSourceRegistry(List.of(sources));
        registry.initialize();
        return registry;
    }

    // ============================================================================
    // Registration
    // ============================================================================

    @Test
    @DisplayName("Should register sources by lower-cased scheme")
    void testRegisteredSchemes() {
        TripSourceRegistry registry = registry(new LocalFileTripSource(), new GcsTripSource(mock(Storage.class)));

        assertEquals(List.of("file", "gs"), registry.getRegisteredSchemes());
        assertInstanceOf(GcsTripSource.class, registry.getSource("GS"));
    }

    @Test
    @DisplayName("Should reject two sources for the same scheme")
    void testDuplicateScheme() {
        TripSourceRegistry registry = new TripSourceRegistry(
                List.of(new LocalFileTripSource(), new LocalFileTripSource()));
        assertThrows(IllegalStateException.class, registry::initialize);
    }

    @Test
    @DisplayName("Should be empty without sources")
    void testEmptyRegistry() {
        TripSourceRegistry registry = new TripSourceRegistry(Collections.emptyList());
        registry.initialize();

        assertTrue(registry.getRegisteredSchemes().isEmpty());
        assertThrows(TripInputException.class, () -> registry.getSource("file"));
    }

    // ============================================================================
    // Location parsing
    // ============================================================================

    @Test
    @DisplayName("Should treat a scheme-less location as a local file")
    void testSchemelessLocation() {
        URI uri = TripSourceRegistry.toUri("data/uber_data.csv");
        assertEquals("file", uri.getScheme());
        assertTrue(uri.getPath().endsWith("/data/uber_data.csv"));
    }

    @Test
    @DisplayName("Should keep bucket names with underscores")
    void testGcsLocation() {
        URI uri = TripSourceRegistry.toUri("gs://my_bucket/raw/uber_data.csv");
        assertEquals("gs", uri.getScheme());
        assertEquals("my_bucket", uri.getAuthority());
        assertEquals("/raw/uber_data.csv", uri.getPath());
    }

    @Test
    @DisplayName("Should reject blank and malformed locations")
    void testBadLocations() {
        assertThrows(TripInputException.class, () -> TripSourceRegistry.toUri(""));
        assertThrows(TripInputException.class, () -> TripSourceRegistry.toUri("gs://bucket/with space.csv"));
    }

    // ============================================================================
    // GCS source
    // ============================================================================

    @Test
    @DisplayName("Should read a GCS object through its read channel")
    void testGcsOpen() throws Exception {
        byte[] content = "VendorID\n1\n".getBytes(StandardCharsets.UTF_8);
        ReadChannel channel = mock(ReadChannel.class);
        ByteBuffer[] served = {ByteBuffer.wrap(content)};
        when(channel.isOpen()).thenReturn(true);
        when(channel.read(any(ByteBuffer.class))).thenAnswer(inv -> {
            ByteBuffer dst = inv.getArgument(0);
            if (!served[0].hasRemaining()) {
                return -1;
            }
            int n = Math.min(dst.remaining(), served[0].remaining());
            for (int i = 0; i < n; i++) {
                dst.put(served[0].get());
            }
            return n;
        });

        Blob blob = mock(Blob.class);
        when(blob.exists()).thenReturn(true);
        when(blob.reader()).thenReturn(channel);
        Storage storage = mock(Storage.class);
        when(storage.get(BlobId.of("my_bucket", "raw/uber.csv"))).thenReturn(blob);

        try (Reader reader = registry(new GcsTripSource(storage)).open("gs://my_bucket/raw/uber.csv")) {
            BufferedReader lines = new BufferedReader(reader);
            assertEquals("VendorID", lines.readLine());
            assertEquals("1", lines.readLine());
        }
    }

    @Test
    @DisplayName("Should report a missing GCS object as an input error")
    void testGcsMissingObject() {
        Storage storage = mock(Storage.class);
        TripSourceRegistry registry = registry(new GcsTripSource(storage));

        assertThrows(TripInputException.class, () -> registry.open("gs://bucket/missing.csv"));
        assertThrows(TripInputException.class, () -> registry.open("gs://bucket"));
    }
}
