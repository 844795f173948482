package com.mediai.mediai_agents.crew;

import com.mediai.mediai_agents.model.crew.CrewContext;
import com.mediai.mediai_agents.model.crew.CrewReport;
import com.mediai.mediai_agents.model.result.ExecutionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fail-fast linear pipeline.
 *
 * For each declared task, in declaration order (key order of the context is ignored):
 *   - absent from the context  -> skipped, no report entry
 *   - result not SUCCESS       -> stop, report FAILED with failed_at = task
 *   - post-condition rejects   -> stop, report FAILED with failed_at = task and the reason as error
 * Otherwise the crew reports SUCCESS with every task result.
 */
@Slf4j
public class SequentialCrew implements Crew {

    private final String         name;
    private final List<CrewTask> tasks;

    public SequentialCrew(String name, List<CrewTask> tasks) {
        this.name = name;
        this.tasks = List.copyOf(tasks);
    }

    @Override
    public String name() {
        return name;
    }

    public List<CrewTask> tasks() {
        return tasks;
    }

    @Override
    public CrewReport kickoff(CrewContext context) {
        long startedNanos = System.nanoTime();
        log.info("[{}] Crew starting with tasks {}", name, context);

        Map<String, ExecutionResult> results = new LinkedHashMap<>();
        int position = 0;
        for (CrewTask task : tasks) {
            position++;
            Optional<Map<String, Object>> input = context.task(task.name());
            if (input.isEmpty()) {
                log.debug("[{}] Task {} not requested, skipping", name, task.name());
                continue;
            }

            log.info("[{}] Task {}/{}: {}", name, position, tasks.size(), task.name());
            ExecutionResult result = task.agent().execute(input.get());
            results.put(task.name(), result);

            if (!result.isSuccess()) {
                log.error("[{}] Task {} failed, aborting crew: {}", name, task.name(), result.getErrors());
                return CrewReport.failed(name, results, task.name(),
                        String.join("; ", result.getErrors()), elapsedSeconds(startedNanos));
            }

            Optional<String> rejection = task.postCondition().check(result);
            if (rejection.isPresent()) {
                log.warn("[{}] Task {} succeeded but was rejected: {}", name, task.name(), rejection.get());
                return CrewReport.failed(name, results, task.name(), rejection.get(), elapsedSeconds(startedNanos));
            }
        }

        log.info("[{}] Crew complete: {} task(s) succeeded", name, results.size());
        return CrewReport.success(name, results, elapsedSeconds(startedNanos));
    }

    private static double elapsedSeconds(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }
}
