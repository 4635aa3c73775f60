package dev.pekelund.docflow.records;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.model.TransitionMarker;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Serialises {@link TransitionMarker}s into the single {@code Last Transition} cell.
 */
public class TransitionMarkerCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransitionMarkerCodec.class);

    private final ObjectMapper objectMapper;

    public TransitionMarkerCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(TransitionMarker marker) {
        if (marker == null) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(marker);
        } catch (JsonProcessingException ex) {
            throw DocumentFlowException.systemError("Unable to serialise transition marker " + marker, ex);
        }
    }

    /**
     * Decodes a stored marker. A blank or unreadable cell yields an empty result so that detection falls back
     * to the reason text.
     */
    public Optional<TransitionMarker> decode(String value) {
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        try {
            TransitionMarker marker = objectMapper.readValue(value, TransitionMarker.class);
            return Optional.ofNullable(marker).filter(decoded -> decoded.kind() != null);
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Ignoring unreadable transition marker '{}': {}", value, ex.getOriginalMessage());
            return Optional.empty();
        }
    }
}
