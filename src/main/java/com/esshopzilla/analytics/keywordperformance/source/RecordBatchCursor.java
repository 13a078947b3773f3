package com.esshopzilla.analytics.keywordperformance.source;

import com.esshopzilla.analytics.keywordperformance.model.RecordBatch;

import java.io.Closeable;
import java.util.Iterator;

/**
 * One pass over a {@link RecordSource}. Lazy, finite, consumed once.
 * {@link #close()} does not throw checked exceptions.
 */
public interface RecordBatchCursor extends Iterator<RecordBatch>, Closeable {

    @Override
    void close();
}
