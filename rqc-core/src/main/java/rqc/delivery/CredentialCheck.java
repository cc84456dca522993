package rqc.delivery;

/**
 * Verdict of a credential check, local or remote.
 *
 * @param ok     whether the credentials are usable
 * @param reason why not, {@code null} when {@code ok}
 */
public record CredentialCheck(boolean ok, String reason) {

  private static final CredentialCheck OK = new CredentialCheck(true, null);

  public static CredentialCheck passed() {
    return OK;
  }

  public static CredentialCheck failed(String reason) {
    return new CredentialCheck(false, reason);
  }
}
