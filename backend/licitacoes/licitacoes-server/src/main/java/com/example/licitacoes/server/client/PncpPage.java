package com.example.licitacoes.server.client;

import java.util.List;

/**
 * One page of the PNCP publication listing.
 *
 * @param totalPages 0 when the portal did not report it
 */
public record PncpPage(
        List<RawRecord> records,
        boolean hasNextPage,
        long totalRecords,
        int totalPages,
        int pageNumber) {

    public static PncpPage empty(int pageNumber) {
        return new PncpPage(List.of(), false, 0, 0, pageNumber);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
