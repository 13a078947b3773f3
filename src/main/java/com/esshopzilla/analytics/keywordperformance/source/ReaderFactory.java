package com.esshopzilla.analytics.keywordperformance.source;

import java.io.IOException;
import java.io.Reader;

/**
 * Supplies a new reader positioned at the start of the input on every call.
 */
@FunctionalInterface
public interface ReaderFactory {

    Reader openReader() throws IOException;
}
