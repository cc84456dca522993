package rqc.host;

import rqc.model.PersonRef;

import java.util.Objects;

/**
 * A host user as seen by the adapter.
 *
 * @param personId stable host identifier, used to deduplicate roles and key consent
 */
public record Person(String personId, String email, String firstName, String lastName, String orcid) {

  public Person {
    Objects.requireNonNull(personId, "personId");
  }

  public PersonRef toRef() {
    return new PersonRef(email, firstName, lastName, orcid);
  }
}
