package io.datashape.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.datashape.core.error.AsyncUsageException;
import io.datashape.core.model.SchemaOptions;
import io.datashape.core.model.TypeName;
import io.datashape.core.spi.SchemaNode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

class StepsTest {

    private record Node(TypeName typeName, String hint, SchemaOptions options) implements SchemaNode {}

    private static final Node NODE = new Node(TypeName.ANY, "any", SchemaOptions.NONE);

    @Test
    void join_returnsCompletedValue() {
        assertThat(Steps.join(CompletableFuture.completedFuture("x"))).isEqualTo("x");
    }

    @Test
    void join_rejectsPendingStep() {
        assertThatThrownBy(() -> Steps.join(new CompletableFuture<>())).isInstanceOf(AsyncUsageException.class);
    }

    @Test
    void join_rethrowsOriginalFailure() {
        CompletableFuture<Object> failed = CompletableFuture.failedFuture(new IllegalStateException("boom"));

        assertThatThrownBy(() -> Steps.join(failed))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }

    @Test
    void await_rejectsDeferredValueInSyncMode() {
        ParseContext sync = ParseContext.root(NODE, null, ParseOptions.DEFAULT, false);

        assertThatThrownBy(() -> Steps.await(sync, CompletableFuture.completedFuture(1)))
                .isInstanceOf(AsyncUsageException.class);
        assertThat(Steps.<Object>await(sync, 1).join()).isEqualTo(1);
    }

    @Test
    void await_passesDeferredValueInAsyncMode() {
        ParseContext async = ParseContext.root(NODE, null, ParseOptions.DEFAULT, true);
        CompletableFuture<Integer> pending = new CompletableFuture<>();

        CompletableFuture<Object> awaited = Steps.await(async, pending);
        pending.complete(7);

        assertThat(awaited.join()).isEqualTo(7);
    }

    @Test
    void sequence_runsStepsInOrderAndStopsOnFalse() {
        List<Integer> ran = new ArrayList<>();

        Steps.sequence(5, i -> {
                    ran.add(i);
                    return CompletableFuture.completedFuture(i < 2);
                })
                .join();

        assertThat(ran).containsExactly(0, 1, 2);
    }

    @Test
    void sequence_waitsForEachStep() {
        List<Integer> ran = new ArrayList<>();
        CompletableFuture<Boolean> gate = new CompletableFuture<>();

        CompletableFuture<Void> done = Steps.sequence(2, i -> {
            ran.add(i);
            return i == 0 ? gate : CompletableFuture.completedFuture(true);
        });

        assertThat(ran).containsExactly(0);
        assertThat(done).isNotDone();
        gate.complete(true);
        assertThat(ran).containsExactly(0, 1);
        assertThat(done).isDone();
    }

    @Test
    void guard_turnsThrowIntoFailedFuture() {
        CompletableFuture<Object> guarded = Steps.guard(() -> {
            throw new IllegalArgumentException("bad");
        });

        assertThat(guarded).isCompletedExceptionally();
        assertThatThrownBy(guarded::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }
}
