package io.pipewright.core.execution;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.pipewright.core.execution.result.RunRecord;
import io.pipewright.core.execution.result.RunStatus;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositeRunListenerTest {

    private static RunRecord record() {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        return new RunRecord("run-1", "sensors", now, now, Map.of(), RunStatus.SUCCESS);
    }

    @Test
    void shouldNotifyDelegatesInOrder() {
        RunListener first = mock(RunListener.class);
        RunListener second = mock(RunListener.class);
        RunRecord record = record();

        new CompositeRunListener(first, second).onRunComplete(record);

        var order = inOrder(first, second);
        order.verify(first).onRunComplete(record);
        order.verify(second).onRunComplete(record);
    }

    @Test
    void shouldContinueAfterFailingDelegate() {
        RunListener failing = mock(RunListener.class);
        RunListener healthy = mock(RunListener.class);
        doThrow(new IllegalStateException("boom")).when(failing).onRunComplete(any());
        RunRecord record = record();

        new CompositeRunListener(failing, healthy).onRunComplete(record);

        verify(healthy).onRunComplete(record);
    }
}
