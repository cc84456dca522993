package rqc.codec;

import rqc.model.DecisionEvent;
import rqc.model.EditorAssignment;

import java.util.List;

/**
 * Serializes the values the adapter persists as text columns: queued decision events and
 * recorded editor sets.
 *
 * @see JacksonPayloadCodec
 */
public interface PayloadCodec {

  String encodeEvent(DecisionEvent event);

  DecisionEvent decodeEvent(String payload);

  String encodeEditors(List<EditorAssignment> editors);

  List<EditorAssignment> decodeEditors(String payload);

  /** Returns the shared Jackson-backed codec. */
  static PayloadCodec getDefault() {
    return JacksonPayloadCodec.INSTANCE;
  }
}
