package com.dvc.core.flag;

import com.dvc.config.DvcProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Generates and verifies per-session flags.
 *
 * <p>A flag is {@code flag{<hex>}} where the hex digits are the leading
 * characters of HMAC-SHA256(secret, {@code challengeId:userId:epochMillis}).
 * Nothing about a flag is stored: verification recomputes the expected value
 * from the session's inputs and compares in constant time.
 */
@Service
public class FlagService {

    private static final Logger log = LoggerFactory.getLogger(FlagService.class);

    private static final String ALGORITHM = "HmacSHA256";
    private static final int MIN_DIGEST_LENGTH = 8;
    private static final int MAX_DIGEST_LENGTH = 64;

    private final SecretKeySpec key;
    private final int digestLength;
    private final Pattern flagFormat;

    @Autowired
    public FlagService(DvcProperties properties) {
        this(properties.getFlag().getSecret(), properties.getFlag().getDigestLength());
    }

    public FlagService(String secret, int digestLength) {
        if (digestLength < MIN_DIGEST_LENGTH || digestLength > MAX_DIGEST_LENGTH) {
            throw new IllegalArgumentException("Flag digest length must be between "
                    + MIN_DIGEST_LENGTH + " and " + MAX_DIGEST_LENGTH + ", got " + digestLength);
        }
        this.key = new SecretKeySpec(resolveSecret(secret), ALGORITHM);
        this.digestLength = digestLength;
        this.flagFormat = Pattern.compile("flag\\{[0-9a-f]{" + digestLength + "}\\}");
    }

    /**
     * Computes the flag for one challenge attempt. Identical inputs always
     * produce the identical flag.
     */
    public String generateFlag(String challengeId, String userId, Instant timestamp) {
        String message = challengeId + ":" + userId + ":" + timestamp.toEpochMilli();
        byte[] digest = hmac(message.getBytes(StandardCharsets.UTF_8));
        return "flag{" + HexFormat.of().formatHex(digest).substring(0, digestLength) + "}";
    }

    /**
     * Returns true only if {@code submitted} is exactly the flag for these inputs.
     */
    public boolean validateFlag(String submitted, String challengeId, String userId, Instant timestamp) {
        if (submitted == null || !flagFormat.matcher(submitted).matches()) {
            return false;
        }
        String expected = generateFlag(challengeId, userId, timestamp);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                submitted.getBytes(StandardCharsets.UTF_8));
    }

    public int digestLength() {
        return digestLength;
    }

    private byte[] hmac(byte[] message) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(message);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static byte[] resolveSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            log.warn("dvc.flag.secret is not set; using a random per-process secret. "
                    + "Flags will not survive a restart.");
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            return random;
        }
        if (DvcProperties.Flag.DEV_SECRET.equals(secret)) {
            log.warn("Using the development flag secret. Set DVC_FLAG_SECRET before exposing challenges.");
        }
        return secret.getBytes(StandardCharsets.UTF_8);
    }
}
