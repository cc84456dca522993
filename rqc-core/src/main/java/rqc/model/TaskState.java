package rqc.model;

public enum TaskState {
  PENDING(0),
  IN_FLIGHT(1),
  ABANDONED(2);

  private final int code;

  TaskState(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static TaskState fromCode(int code) {
    for (TaskState state : values()) {
      if (state.code == code) {
        return state;
      }
    }
    throw new IllegalArgumentException("Unknown task state code: " + code);
  }
}
