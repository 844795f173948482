package com.mediai.mediai_agents.repository;

import com.mediai.mediai_agents.model.domain.WorkflowRun;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface WorkflowRunRepository extends JpaRepository<WorkflowRun, UUID> {

    // Run history page, newest first
    List<WorkflowRun> findAllByOrderByStartedAtDesc();

    List<WorkflowRun> findByWorkflowOrderByStartedAtDesc(String workflow);
}
