package tech.yump.rotation.storage;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Base64;

/**
 * Envelope for AES-GCM encrypted payloads persisted by the engine (backup snapshots and
 * locally stored secret material).
 *
 * <pre>
 * {
 *   "v": 1,
 *   "n": "BASE64_ENCODED_NONCE",
 *   "c": "BASE64_ENCODED_CIPHERTEXT",
 *   "ts": "2026-10-18T10:15:30Z"
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EncryptedData {

  public static final int NONCE_LENGTH_BYTE = 12;

  @JsonProperty("v")
  private int version = 1;

  @JsonProperty("n")
  private String nonceBase64;

  @JsonProperty("c")
  private String ciphertextBase64;

  @JsonProperty("ts")
  private Instant timestamp;

  public EncryptedData(byte[] nonce, byte[] ciphertext) {
    if (nonce == null || ciphertext == null) {
      throw new IllegalArgumentException("Nonce and ciphertext cannot be null.");
    }
    this.version = 1;
    this.nonceBase64 = Base64.getEncoder().encodeToString(nonce);
    this.ciphertextBase64 = Base64.getEncoder().encodeToString(ciphertext);
    this.timestamp = Instant.now();
  }

  /**
   * Splits the {@code nonce || ciphertext} output of the encryption service into an envelope.
   */
  public static EncryptedData fromNonceAndCiphertext(byte[] nonceAndCiphertext) {
    if (nonceAndCiphertext == null || nonceAndCiphertext.length <= NONCE_LENGTH_BYTE) {
      throw new IllegalArgumentException("Encrypted payload is too short to contain a nonce and ciphertext.");
    }
    ByteBuffer buffer = ByteBuffer.wrap(nonceAndCiphertext);
    byte[] nonce = new byte[NONCE_LENGTH_BYTE];
    buffer.get(nonce);
    byte[] ciphertext = new byte[buffer.remaining()];
    buffer.get(ciphertext);
    return new EncryptedData(nonce, ciphertext);
  }

  /**
   * Joins the envelope back into the {@code nonce || ciphertext} form the encryption service decrypts.
   */
  @JsonIgnore
  public byte[] getNonceAndCiphertext() {
    byte[] nonce = getNonceBytes();
    byte[] ciphertext = getCiphertextBytes();
    return ByteBuffer.allocate(nonce.length + ciphertext.length).put(nonce).put(ciphertext).array();
  }

  @JsonIgnore
  public byte[] getNonceBytes() {
    if (this.nonceBase64 == null) {
      throw new IllegalStateException("Nonce Base64 string is null.");
    }
    return Base64.getDecoder().decode(this.nonceBase64);
  }

  @JsonIgnore
  public byte[] getCiphertextBytes() {
    if (this.ciphertextBase64 == null) {
      throw new IllegalStateException("Ciphertext Base64 string is null.");
    }
    return Base64.getDecoder().decode(this.ciphertextBase64);
  }
}
