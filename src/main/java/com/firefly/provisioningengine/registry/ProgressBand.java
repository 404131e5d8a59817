package com.firefly.provisioningengine.registry;

/**
 * Global percentage band table. Each provisioning step reports progress inside its band; the values are
 * relied upon by UI progress bars and must not change.
 */
public enum ProgressBand {
    WORKSPACE(0, 10),
    STORAGE_PREP(10, 20),
    BULK_UPLOAD(20, 40),
    TABLE_MATERIALIZATION(40, 45),
    TIMESERIES_DB(45, 55),
    TIMESERIES_INGEST(55, 65),
    ONTOLOGY_BUILD(65, 80),
    INDEXING_WAIT(80, 90),
    MODEL_DISCOVERY(90, 95),
    FINALIZE(95, 100);

    private final int start;
    private final int end;

    ProgressBand(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }
}
