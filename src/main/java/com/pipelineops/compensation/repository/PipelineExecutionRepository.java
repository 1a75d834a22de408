package com.pipelineops.compensation.repository;

import com.pipelineops.compensation.entity.PipelineExecution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for pipeline executions.
 */
@Repository
public interface PipelineExecutionRepository extends JpaRepository<PipelineExecution, Long> {

    /**
     * Executions of the given pipeline configs, newest first within each config.
     * Used as a single batched lookup by the execution history service.
     */
    @Query("SELECT e FROM PipelineExecution e WHERE e.pipelineConfigId IN :ids " +
            "ORDER BY e.pipelineConfigId ASC, e.createdAt DESC, e.id DESC")
    List<PipelineExecution> findByPipelineConfigIdsNewestFirst(@Param("ids") Collection<String> ids);

    List<PipelineExecution> findByPipelineConfigIdOrderByCreatedAtDesc(String pipelineConfigId);

    long countByPipelineConfigId(String pipelineConfigId);
}
