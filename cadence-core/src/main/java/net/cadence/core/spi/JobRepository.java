package net.cadence.core.spi;

import net.cadence.core.model.Job;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface JobRepository {
    /** disabled = false, running = false, next_run <= now. Not a claim: nothing is locked. */
    List<Job> findDue(Instant now) throws Exception;

    Optional<Job> findById(long id) throws Exception;
    Optional<Job> findByName(String name) throws Exception;
    List<Job> findAll() throws Exception;

    /** Inserts when {@code job.id()} is null, otherwise overwrites the row and its subscribers. */
    Job save(Job job) throws Exception;

    /** disabled = true, next_run = null */
    int disable(Collection<Long> ids) throws Exception;

    /** running = false; for jobs left flagged by a crashed run */
    int resetRunning(Collection<Long> ids) throws Exception;
}
