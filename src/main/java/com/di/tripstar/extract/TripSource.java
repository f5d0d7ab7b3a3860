package com.di.tripstar.extract;

import java.io.IOException;
import java.io.Reader;
import java.net.URI;

/**
 * Opens raw trip files for one URI scheme.
 *
 * <p>Implementations are discovered as Spring beans by {@link TripSourceRegistry}.
 */
public interface TripSource {

    /** URI scheme served by this source, e.g. {@code gs} or {@code file}. */
    String scheme();

    /**
     * Opens the file for reading. The caller closes the reader.
     *
     * @throws TripInputException if the file does not exist
     * @throws IOException        if it exists but cannot be read
     */
    Reader open(URI uri) throws IOException;
}
