package ca.gc.cra.ctscan.domain.cert;

import java.util.Arrays;
import java.util.Base64;

/**
 * <strong>What:</strong> Opaque serialized identifier of a scanned certificate.
 * <p><strong>Why:</strong> Lets scan and store adapters exchange certificates without this core parsing them.</p>
 * <p><strong>Role:</strong> Domain value carried inside {@link CertEntry}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 * <p><strong>Performance:</strong> Clones the encoded bytes once on construction and on access.</p>
 *
 * @param encoded serialized descriptor bytes; defensively copied
 * @since 0.1.0
 */
public record CertificateDescriptor(byte[] encoded) {
  /**
   * Copies the encoded bytes so callers cannot mutate the descriptor.
   */
  public CertificateDescriptor {
    encoded = encoded != null ? encoded.clone() : new byte[0];
  }

  /**
   * Decodes a descriptor from its base64 text form.
   *
   * @param base64 standard base64 text
   * @return decoded descriptor
   * @throws IllegalArgumentException if the text is not valid base64
   */
  public static CertificateDescriptor fromBase64(String base64) {
    if (base64 == null) {
      throw new IllegalArgumentException("descriptor must not be null");
    }
    return new CertificateDescriptor(Base64.getDecoder().decode(base64.trim()));
  }

  @Override
  public byte[] encoded() {
    return encoded.clone();
  }

  /**
   * Returns the descriptor as standard base64 text, the form used by NDJSON adapters.
   *
   * @return base64 encoding of the descriptor bytes
   */
  public String toBase64() {
    return Base64.getEncoder().encodeToString(encoded);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CertificateDescriptor that)) {
      return false;
    }
    return Arrays.equals(encoded, that.encoded);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(encoded);
  }

  @Override
  public String toString() {
    return "CertificateDescriptor{" + "length=" + encoded.length + '}';
  }
}
