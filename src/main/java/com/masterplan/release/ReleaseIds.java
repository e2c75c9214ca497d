package com.masterplan.release;

import com.google.common.io.BaseEncoding;

import java.security.SecureRandom;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Release ids look like rel_20240115100000_a1b2c3d4: the UTC publish time to the second, then 32 random bits.
 * Ids sort in publication order, and the random suffix keeps two publishes in the same second apart.
 */
public abstract class ReleaseIds {

    public static final Pattern RELEASE_ID = Pattern.compile("^rel_\\d{14}_[0-9a-f]{8}$");

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private static final SecureRandom random = new SecureRandom();

    public static String newReleaseId (Instant now) {
        byte[] suffix = new byte[4];
        random.nextBytes(suffix);
        return "rel_" + TIMESTAMP.format(now) + "_" + BaseEncoding.base16().lowerCase().encode(suffix);
    }

    public static boolean isReleaseId (String id) {
        return id != null && RELEASE_ID.matcher(id).matches();
    }

}
