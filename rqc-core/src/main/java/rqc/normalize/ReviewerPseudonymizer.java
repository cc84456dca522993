package rqc.normalize;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Derives a stable pseudonymous address for a reviewer within one submission.
 *
 * <p>The token is {@code HMAC-SHA256(journalSalt, submissionRef + "|" + reviewerId)} in hex,
 * followed by {@code @example.edu}. The same reviewer gets the same token on every report of
 * the submission; different submissions yield unrelated tokens.
 */
public final class ReviewerPseudonymizer {
  static final String DOMAIN = "@example.edu";
  private static final String ALGORITHM = "HmacSHA256";

  private final SecretKeySpec key;
  private final String submissionRef;

  private ReviewerPseudonymizer(byte[] salt, String submissionRef) {
    this.key = new SecretKeySpec(salt, ALGORITHM);
    this.submissionRef = submissionRef;
  }

  public static ReviewerPseudonymizer forSubmission(byte[] journalSalt, String submissionRef) {
    Objects.requireNonNull(journalSalt, "journalSalt");
    Objects.requireNonNull(submissionRef, "submissionRef");
    if (journalSalt.length == 0) {
      throw new IllegalArgumentException("journalSalt must not be empty");
    }
    return new ReviewerPseudonymizer(journalSalt.clone(), submissionRef);
  }

  public String tokenFor(String reviewerId) {
    Objects.requireNonNull(reviewerId, "reviewerId");
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(key);
      byte[] digest = mac.doFinal((submissionRef + "|" + reviewerId).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest) + DOMAIN;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HmacSHA256 unavailable", e);
    }
  }
}
