package com.title.reconciliation.bulk;

import com.title.reconciliation.core.model.PersonRecord;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the person records of one reconciliation batch, in input order.
 */
@FunctionalInterface
public interface PersonRecordSource {

    /**
     * Reads the batch. Each returned record's {@code sequence} is its 0-based position in the list.
     *
     * @throws IOException when the underlying input cannot be read
     */
    List<PersonRecord> read() throws IOException;
}
