package rqc.model;

import java.util.Objects;

public record EditorAssignment(PersonRef editor, EditorLevel level) {

  public EditorAssignment {
    Objects.requireNonNull(editor, "editor");
    Objects.requireNonNull(level, "level");
  }
}
