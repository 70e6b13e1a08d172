package com.eyelevel.mediadownloader.service.job;

/**
 * Discovers work and pushes it into a {@link JobSink}, typically while still traversing its
 * source. Returning means no more jobs will follow.
 */
@FunctionalInterface
public interface JobProducer {

    void produce(JobSink sink) throws Exception;
}
