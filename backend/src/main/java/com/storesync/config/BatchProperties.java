package com.storesync.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storesync.batch")
@NoArgsConstructor
@Getter
@Setter
public class BatchProperties {

    /** Batches up to this size are sent all at once; larger ones are chunked. Default 10. */
    private int bulkThreshold = 10;

    /** Items per chunk. Default 10. */
    private int chunkSize = 10;

    /** Base pause between chunks, widened after rate limits. Default 500. */
    private long chunkDelayMs = 500L;

    /** Fail the stage when any item of a batch failed. Default true. */
    private boolean failOnPartialFailure = true;
}
