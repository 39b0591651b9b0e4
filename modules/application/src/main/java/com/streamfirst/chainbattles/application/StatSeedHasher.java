package com.streamfirst.chainbattles.application;

import com.streamfirst.chainbattles.domain.Identity;
import com.streamfirst.chainbattles.domain.TokenId;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * One-way mixing function behind stat growth. Derivable by anyone holding the same inputs; it only
 * guarantees that equal inputs give equal outputs.
 *
 * <p>The seed is the packed byte sequence of the timestamp (8 bytes, big-endian), the caller's
 * identity (UTF-8) and the token identifier as decimal text (UTF-8). The SHA-256 digest of the
 * seed is read as an unsigned 256-bit integer.
 */
public class StatSeedHasher {

  private static final String ALGORITHM = "SHA-256";

  public BigInteger hash(long timestamp, Identity caller, TokenId tokenId) {
    MessageDigest digest = newDigest();
    digest.update(ByteBuffer.allocate(Long.BYTES).putLong(timestamp).array());
    digest.update(caller.value().getBytes(StandardCharsets.UTF_8));
    digest.update(tokenId.toDecimalString().getBytes(StandardCharsets.UTF_8));
    return new BigInteger(1, digest.digest());
  }

  /**
   * Hashes the seed and reduces it into {@code [0, modulus)}.
   *
   * @throws IllegalArgumentException if {@code modulus} is not positive
   */
  public long bounded(long timestamp, Identity caller, TokenId tokenId, int modulus) {
    if (modulus <= 0) {
      throw new IllegalArgumentException("Modulus must be positive: " + modulus);
    }
    return hash(timestamp, caller, tokenId).mod(BigInteger.valueOf(modulus)).longValueExact();
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(ALGORITHM);
    } catch (NoSuchAlgorithmException e) {
      // every JRE ships SHA-256
      throw new IllegalStateException(ALGORITHM + " is not available", e);
    }
  }
}
