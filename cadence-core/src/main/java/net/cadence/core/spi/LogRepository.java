package net.cadence.core.spi;

import net.cadence.core.model.Log;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface LogRepository {
    Log create(Log log) throws Exception;
    Optional<Log> findById(long id) throws Exception;

    /** newest run first */
    List<Log> findByJob(long jobId) throws Exception;
    Optional<Log> findLatest(long jobId) throws Exception;

    int deleteRunOnOrBefore(Instant threshold) throws Exception;
}
