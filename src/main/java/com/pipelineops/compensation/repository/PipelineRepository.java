package com.pipelineops.compensation.repository;

import com.pipelineops.compensation.entity.Pipeline;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Stored pipeline definitions. Read in bulk by the pipeline cache.
 */
@Repository
public interface PipelineRepository extends JpaRepository<Pipeline, String> {

    /**
     * All definitions in a stable order so cache snapshots are reproducible.
     */
    List<Pipeline> findAllByOrderByApplicationAscIdAsc();
}
