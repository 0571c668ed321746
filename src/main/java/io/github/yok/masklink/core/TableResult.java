package io.github.yok.masklink.core;

import java.time.Duration;
import lombok.Value;

/**
 * Outcome of processing one table.
 */
@Value
public class TableResult {

    String table;
    int batches;
    long rows;
    int failedBatches;
    Duration elapsed;
}
