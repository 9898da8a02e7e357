package com.example.licitacoes.server.sync;

public enum SyncStatus {
    /** Every page stored and indexed; watermark advanced. */
    COMPLETED,
    /** Some pages could not be read; watermark left in place so the window is re-read. */
    COMPLETED_WITH_ERRORS,
    /** The watermark already covers the requested window. */
    UP_TO_DATE,
    CANCELLED,
    ABORTED
}
