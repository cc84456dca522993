package rqc.credential;

import rqc.ConfigurationException;
import rqc.RqcException;
import rqc.delivery.CredentialCheck;
import rqc.delivery.DeliveryClient;
import rqc.model.JournalCredential;
import rqc.spi.ConnectionProvider;
import rqc.spi.CredentialStore;

import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Journal credentials and the per-journal anonymization salt.
 *
 * <p>A call to RQC is never made with absent or unvalidated credentials. Saving a key resets
 * it to unvalidated; only a successful remote check validates it.
 */
public final class CredentialService {
  private static final Logger logger = Logger.getLogger(CredentialService.class.getName());

  private static final Pattern API_KEY = Pattern.compile("[A-Za-z0-9]+");
  private static final int SALT_BYTES = 32;

  private final ConnectionProvider connectionProvider;
  private final CredentialStore credentialStore;
  private final DeliveryClient deliveryClient;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  public CredentialService(ConnectionProvider connectionProvider, CredentialStore credentialStore,
      DeliveryClient deliveryClient, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.credentialStore = Objects.requireNonNull(credentialStore, "credentialStore");
    this.deliveryClient = Objects.requireNonNull(deliveryClient, "deliveryClient");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Local format check: the journal id must not be blank and the key must be alphanumeric.
   */
  public static CredentialCheck checkFormat(String journalId, String apiKey) {
    if (journalId == null || journalId.isBlank()) {
      return CredentialCheck.failed("Journal id must not be blank");
    }
    if (apiKey == null || !API_KEY.matcher(apiKey).matches()) {
      return CredentialCheck.failed("API key must be alphanumeric");
    }
    return CredentialCheck.passed();
  }

  /**
   * Saves new credentials and immediately validates them against RQC.
   *
   * @return the format or remote verdict; malformed credentials are not stored
   * @throws rqc.delivery.TransientDeliveryException if RQC could not be reached; the
   *     credentials stay saved but unvalidated
   */
  public CredentialCheck save(String journalId, String apiKey) {
    CredentialCheck format = checkFormat(journalId, apiKey);
    if (!format.ok()) {
      return format;
    }
    try (Connection conn = connectionProvider.getConnection()) {
      credentialStore.save(conn, journalId, apiKey);
    } catch (SQLException e) {
      throw new RqcException("Failed to save credentials of journal " + journalId, e);
    }
    logger.log(Level.INFO, "Saved RQC credentials of journal {0}", journalId);
    return validate(journalId);
  }

  /**
   * Validates the stored credentials against RQC and records the verdict.
   *
   * @throws rqc.delivery.TransientDeliveryException if RQC could not be reached
   */
  public CredentialCheck validate(String journalId) {
    Optional<JournalCredential> stored = find(journalId);
    if (stored.isEmpty()) {
      return CredentialCheck.failed("No RQC credentials saved for journal " + journalId);
    }
    JournalCredential credential = stored.get();
    CredentialCheck check = deliveryClient.validateCredentials(credential);
    try (Connection conn = connectionProvider.getConnection()) {
      if (check.ok()) {
        credentialStore.markValidated(conn, journalId, credential.apiKey(), clock.instant());
      } else {
        credentialStore.markInvalid(conn, journalId);
        logger.log(Level.WARNING, "RQC refused credentials of journal {0}: {1}",
            new Object[]{journalId, check.reason()});
      }
    } catch (SQLException e) {
      throw new RqcException("Failed to record validation of journal " + journalId, e);
    }
    return check;
  }

  public Optional<JournalCredential> find(String journalId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return credentialStore.find(conn, journalId);
    } catch (SQLException e) {
      throw new RqcException("Failed to load credentials of journal " + journalId, e);
    }
  }

  /**
   * Returns the journal's credentials if they are present and validated.
   *
   * @throws ConfigurationException otherwise
   */
  public JournalCredential requireValidated(String journalId) {
    JournalCredential credential = find(journalId)
        .orElseThrow(() -> new ConfigurationException(journalId,
            "No RQC credentials saved for journal " + journalId));
    if (!credential.validated()) {
      throw new ConfigurationException(journalId,
          "RQC credentials of journal " + journalId + " are not validated");
    }
    return credential;
  }

  /**
   * Blocks further calls for the journal until its credentials are validated again.
   */
  public void markInvalid(String journalId) {
    try (Connection conn = connectionProvider.getConnection()) {
      credentialStore.markInvalid(conn, journalId);
    } catch (SQLException e) {
      throw new RqcException("Failed to invalidate credentials of journal " + journalId, e);
    }
  }

  /**
   * Returns the journal's anonymization salt, generating it on first use.
   */
  public byte[] getOrCreateSalt(String journalId) {
    try (Connection conn = connectionProvider.getConnection()) {
      Optional<byte[]> salt = credentialStore.findSalt(conn, journalId);
      if (salt.isPresent()) {
        return salt.get();
      }
      byte[] fresh = new byte[SALT_BYTES];
      random.nextBytes(fresh);
      if (credentialStore.insertSaltIfAbsent(conn, journalId, fresh)) {
        return fresh;
      }
      return credentialStore.findSalt(conn, journalId)
          .orElseThrow(() -> new RqcException("Salt of journal " + journalId + " vanished"));
    } catch (SQLException e) {
      throw new RqcException("Failed to load salt of journal " + journalId, e);
    }
  }
}
