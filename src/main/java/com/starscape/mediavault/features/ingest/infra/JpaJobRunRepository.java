package com.starscape.mediavault.features.ingest.infra;

import com.starscape.mediavault.features.ingest.domain.JobRun;
import com.starscape.mediavault.features.ingest.domain.JobRunRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaJobRunRepository extends JpaRepository<JobRun, String>, JobRunRepository {
}
