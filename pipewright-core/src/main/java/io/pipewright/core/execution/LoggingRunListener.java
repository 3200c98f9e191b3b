package io.pipewright.core.execution;

import io.pipewright.core.execution.result.RunRecord;
import io.pipewright.core.execution.result.StageOutcome;
import io.pipewright.core.graph.PipelineGraph;
import io.pipewright.core.graph.StageNode;
import java.util.logging.Logger;

/// Logs run and stage progress through `java.util.logging`.
///
/// ### Log Format
/// ```
/// [runId] pipeline 'p' started (n stages)
/// [runId] -> stageId
/// [runId] <- stageId SUCCEEDED | FAILED (TRANSIENT): msg | SKIPPED: reason
/// [runId] pipeline 'p' finished: STATUS in 12 ms
/// ```
/// Failures log at WARNING, everything else at INFO, stage starts at FINE.
public class LoggingRunListener implements RunListener {

    private static final Logger logger = Logger.getLogger(LoggingRunListener.class.getName());

    @Override
    public void onRunStart(PipelineGraph graph, String runId) {
        logger.info(
                "["
                        + runId
                        + "] pipeline '"
                        + graph.getPipelineId()
                        + "' started ("
                        + graph.getNodes().size()
                        + " stages)");
    }

    @Override
    public void onStageStart(String runId, StageNode node) {
        logger.fine("[" + runId + "] -> " + node.getId());
    }

    @Override
    public void onStageComplete(String runId, StageNode node, StageOutcome outcome) {
        String prefix = "[" + runId + "] <- " + node.getId() + " ";
        if (outcome instanceof StageOutcome.Failed failed) {
            logger.warning(prefix + "FAILED (" + failed.kind() + "): " + failed.message());
        } else if (outcome instanceof StageOutcome.Skipped skipped) {
            logger.info(prefix + "SKIPPED: " + skipped.reason());
        } else {
            logger.info(prefix + "SUCCEEDED");
        }
    }

    @Override
    public void onRunComplete(RunRecord record) {
        String message =
                "["
                        + record.runId()
                        + "] pipeline '"
                        + record.pipelineId()
                        + "' finished: "
                        + record.status()
                        + " in "
                        + record.duration().toMillis()
                        + " ms";
        if (record.status().isClean()) {
            logger.info(message);
        } else {
            logger.warning(message);
        }
    }
}
