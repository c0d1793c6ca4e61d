package com.featureprobe.sdk.server;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * Encapsulates the logic for percentage rollouts.
 * <p>
 * The bucket for a user is {@code sha1(hashKey + salt)}, reading the last four bytes of the digest as an
 * unsigned big-endian integer, modulo {@link #BUCKET_SIZE}. Every FeatureProbe SDK computes the same
 * value, so a split authored on the server lands each user in the same variation everywhere.
 */
abstract class EvaluatorBucketing {
  private EvaluatorBucketing() {}

  static final int BUCKET_SIZE = 10000;

  static int computeBucketValue(String hashKey, String salt) {
    byte[] digest = DigestUtils.sha1(hashKey + salt);
    int n = digest.length;
    long value = ((digest[n - 4] & 0xffL) << 24)
        | ((digest[n - 3] & 0xffL) << 16)
        | ((digest[n - 2] & 0xffL) << 8)
        | (digest[n - 1] & 0xffL);
    return (int)(value % BUCKET_SIZE);
  }
}
