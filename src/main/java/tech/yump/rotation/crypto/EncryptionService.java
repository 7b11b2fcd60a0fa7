package tech.yump.rotation.crypto;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tech.yump.rotation.config.RotationProperties;

import javax.crypto.AEADBadTagException;
import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM encryption of backup snapshots and locally stored secret material.
 * Output format is {@code nonce || ciphertext}.
 */
@Slf4j
@Service
public class EncryptionService {

  static {
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
  }

  public static final int NONCE_LENGTH_BYTE = 12;
  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int TAG_LENGTH_BIT = 128;
  private static final int EXPECTED_KEY_LENGTH = 32;
  private static final String AES = "AES";

  private final SecretKey key;
  private final SecureRandom secureRandom = new SecureRandom();

  @Autowired
  public EncryptionService(RotationProperties properties) {
    this(decodeKey(properties.backup().encryptionKeyB64()));
  }

  EncryptionService(SecretKey key) {
    this.key = key;
  }

  static SecretKey decodeKey(String base64Key) {
    if (!StringUtils.hasText(base64Key)) {
      throw new IllegalArgumentException("Encryption key cannot be null or empty.");
    }
    byte[] keyBytes;
    try {
      keyBytes = Base64.getDecoder().decode(base64Key.trim());
    } catch (IllegalArgumentException e) {
      log.error("Failed to decode Base64 encryption key.");
      throw new IllegalArgumentException("Invalid Base64 encoding for encryption key.", e);
    }
    if (keyBytes.length != EXPECTED_KEY_LENGTH) {
      log.error("Invalid encryption key length. Expected {} bytes, but got {}.", EXPECTED_KEY_LENGTH, keyBytes.length);
      throw new IllegalArgumentException("Invalid encryption key length. Expected " + EXPECTED_KEY_LENGTH + " bytes for AES-256.");
    }
    SecretKey secretKey = new SecretKeySpec(keyBytes, AES);
    Arrays.fill(keyBytes, (byte) 0);
    return secretKey;
  }

  /**
   * Encrypts the given plaintext using AES-GCM with a fresh random nonce.
   *
   * @return nonce prepended to the ciphertext.
   * @throws EncryptionException If any cryptographic error occurs.
   */
  public byte[] encrypt(byte[] plaintext) {
    if (plaintext == null) {
      throw new EncryptionException("Plaintext cannot be null.");
    }
    log.debug("Attempting to encrypt {} bytes of data.", plaintext.length);

    byte[] nonce = new byte[NONCE_LENGTH_BYTE];
    secureRandom.nextBytes(nonce);

    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BIT, nonce));
      byte[] ciphertext = cipher.doFinal(plaintext);

      return ByteBuffer.allocate(nonce.length + ciphertext.length)
              .put(nonce)
              .put(ciphertext)
              .array();
    } catch (NoSuchAlgorithmException | NoSuchPaddingException | InvalidKeyException |
             InvalidAlgorithmParameterException | IllegalBlockSizeException | BadPaddingException e) {
      log.error("Encryption failed: {}", e.getMessage(), e);
      throw new EncryptionException("Failed to encrypt data.", e);
    }
  }

  /**
   * Decrypts {@code nonce || ciphertext}, verifying the GCM authentication tag.
   *
   * @throws EncryptionException on invalid input, wrong key or tampered data.
   */
  public byte[] decrypt(byte[] nonceAndCiphertext) {
    if (nonceAndCiphertext == null || nonceAndCiphertext.length < NONCE_LENGTH_BYTE) {
      throw new EncryptionException("Invalid input: Nonce and ciphertext array is null or too short.");
    }
    ByteBuffer bb = ByteBuffer.wrap(nonceAndCiphertext);
    byte[] nonce = new byte[NONCE_LENGTH_BYTE];
    bb.get(nonce);
    byte[] ciphertext = new byte[bb.remaining()];
    bb.get(ciphertext);

    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BIT, nonce));
      return cipher.doFinal(ciphertext);
    } catch (AEADBadTagException e) {
      log.error("Decryption failed due to invalid authentication tag (potential tampering or wrong key): {}", e.getMessage());
      throw new EncryptionException("Decryption failed: Invalid authentication tag. Data may be corrupt or tampered with.", e);
    } catch (NoSuchAlgorithmException | NoSuchPaddingException | InvalidKeyException |
             InvalidAlgorithmParameterException | IllegalBlockSizeException | BadPaddingException e) {
      log.error("Decryption failed due to other cryptographic error: {}", e.getMessage(), e);
      throw new EncryptionException("Failed to decrypt data.", e);
    }
  }

  /**
   * Custom runtime exception for encryption/decryption errors.
   */
  public static class EncryptionException extends RuntimeException {
    public EncryptionException(String message) {
      super(message);
    }

    public EncryptionException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
