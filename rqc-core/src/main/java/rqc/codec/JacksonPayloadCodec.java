package rqc.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import rqc.RqcException;
import rqc.model.DecisionEvent;
import rqc.model.EditorAssignment;

import java.util.List;
import java.util.Objects;

/**
 * {@link PayloadCodec} on Jackson. Instants are written as ISO-8601 strings.
 */
public final class JacksonPayloadCodec implements PayloadCodec {
  static final JacksonPayloadCodec INSTANCE = new JacksonPayloadCodec(defaultMapper());

  private static final TypeReference<List<EditorAssignment>> EDITOR_LIST = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public JacksonPayloadCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public static ObjectMapper defaultMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  @Override
  public String encodeEvent(DecisionEvent event) {
    return write(event);
  }

  @Override
  public DecisionEvent decodeEvent(String payload) {
    try {
      return mapper.readValue(payload, DecisionEvent.class);
    } catch (JsonProcessingException e) {
      throw new RqcException("Cannot decode queued decision event", e);
    }
  }

  @Override
  public String encodeEditors(List<EditorAssignment> editors) {
    return write(editors);
  }

  @Override
  public List<EditorAssignment> decodeEditors(String payload) {
    try {
      return mapper.readValue(payload, EDITOR_LIST);
    } catch (JsonProcessingException e) {
      throw new RqcException("Cannot decode recorded editor set", e);
    }
  }

  private String write(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new RqcException("Cannot encode " + value.getClass().getSimpleName(), e);
    }
  }
}
