package rqc.host;

import java.util.Objects;

public record HostEditorAssignment(Person editor, HostEditorRole role) {

  public HostEditorAssignment {
    Objects.requireNonNull(editor, "editor");
    Objects.requireNonNull(role, "role");
  }
}
