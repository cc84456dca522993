package rqc.model;

/**
 * Identity of a person as sent to RQC. Empty strings stand for unknown fields.
 */
public record PersonRef(String email, String firstName, String lastName, String orcid) {

  public PersonRef {
    email = email == null ? "" : email;
    firstName = firstName == null ? "" : firstName;
    lastName = lastName == null ? "" : lastName;
    orcid = orcid == null ? "" : orcid;
  }

  /** Identity carrying only a pseudonymous address. */
  public static PersonRef pseudonymous(String token) {
    return new PersonRef(token, "", "", "");
  }
}
