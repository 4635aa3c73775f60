package dev.pekelund.docflow.records;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.docflow.model.Placement;
import dev.pekelund.docflow.model.TransactionType;
import dev.pekelund.docflow.model.TransitionKind;
import dev.pekelund.docflow.model.TransitionMarker;
import org.junit.jupiter.api.Test;

class TransitionMarkerCodecTest {

    private final TransitionMarkerCodec codec = new TransitionMarkerCodec(new ObjectMapper());

    @Test
    void encodesOnlyPopulatedFields() {
        String encoded = codec.encode(TransitionMarker.retryRequested("2024-03-01T10:00:00Z"));

        assertThat(encoded)
            .contains("\"kind\":\"RETRY_REQUESTED\"")
            .contains("\"at\":\"2024-03-01T10:00:00Z\"")
            .doesNotContain("justification")
            .doesNotContain("placement");
    }

    @Test
    void decodesDeletionMarker() {
        TransitionMarker marker = TransitionMarker.deleted("duplicate invoice", "2024-03-01T10:00:00Z",
            Placement.OUTFLOW, TransactionType.OUTFLOW);

        TransitionMarker decoded = codec.decode(codec.encode(marker)).orElseThrow();

        assertThat(decoded.is(TransitionKind.DELETED)).isTrue();
        assertThat(decoded.justification()).isEqualTo("duplicate invoice");
        assertThat(decoded.placement()).isEqualTo(Placement.OUTFLOW);
        assertThat(decoded.transactionType()).isEqualTo(TransactionType.OUTFLOW);
    }

    @Test
    void blankOrUnreadableCellsDecodeToEmpty() {
        assertThat(codec.decode("")).isEmpty();
        assertThat(codec.decode("   ")).isEmpty();
        assertThat(codec.decode("Deleted: by hand")).isEmpty();
        assertThat(codec.decode("{\"at\":\"2024-03-01T10:00:00Z\"}")).isEmpty();
    }

    @Test
    void encodesNullAsEmptyCell() {
        assertThat(codec.encode(null)).isEmpty();
    }
}
