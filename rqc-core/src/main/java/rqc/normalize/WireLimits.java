package rqc.normalize;

/**
 * Size limits RQC enforces on incoming data.
 */
public final class WireLimits {
  public static final int MAX_LINE_LENGTH = 2_000;
  public static final int MAX_TEXT_LENGTH = 200_000;
  public static final int MAX_LIST_SIZE = 20;

  private WireLimits() {}

  public static String line(String value) {
    return truncate(value, MAX_LINE_LENGTH);
  }

  public static String text(String value) {
    return truncate(value, MAX_TEXT_LENGTH);
  }

  private static String truncate(String value, int max) {
    if (value == null) {
      return "";
    }
    if (value.length() <= max) {
      return value;
    }
    // never cut between the halves of a surrogate pair
    int end = Character.isHighSurrogate(value.charAt(max - 1)) ? max - 1 : max;
    return value.substring(0, end);
  }
}
