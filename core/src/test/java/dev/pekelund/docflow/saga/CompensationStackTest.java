package dev.pekelund.docflow.saga;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CompensationStackTest {

    @Test
    void unwindsInReverseCreationOrder() {
        List<String> undone = new ArrayList<>();
        CompensationStack stack = new CompensationStack("provision");
        stack.push("layout", () -> undone.add("layout"));
        stack.push("tables", () -> undone.add("tables"));
        stack.push("registry", () -> undone.add("registry"));

        List<String> failed = stack.unwind(new IllegalStateException("boom"));

        assertThat(undone).containsExactly("registry", "tables", "layout");
        assertThat(failed).isEmpty();
        assertThat(stack.size()).isZero();
    }

    @Test
    void failingCompensationDoesNotStopTheRest() {
        List<String> undone = new ArrayList<>();
        CompensationStack stack = new CompensationStack("provision");
        stack.push("layout", () -> undone.add("layout"));
        stack.push("tables", () -> {
            throw new IllegalStateException("store offline");
        });
        stack.push("registry", () -> undone.add("registry"));

        List<String> failed = stack.unwind(new IllegalStateException("boom"));

        assertThat(undone).containsExactly("registry", "layout");
        assertThat(failed).containsExactly("tables");
    }

    @Test
    void clearedStackRunsNothing() {
        List<String> undone = new ArrayList<>();
        CompensationStack stack = new CompensationStack("intake");
        stack.push("blob", () -> undone.add("blob"));
        stack.clear();

        stack.unwind(null);

        assertThat(undone).isEmpty();
    }
}
