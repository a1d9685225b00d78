package se.chronotrust_be.util;

import java.util.regex.Pattern;

public class StellarKeys {

    // Account ids are 56 chars of base32, version byte 'G'
    private static final Pattern PUBLIC_KEY = Pattern.compile("^G[A-Z2-7]{55}$");

    private StellarKeys() {
    }

    public static boolean isValidPublicKey(String key) {
        return key != null && PUBLIC_KEY.matcher(key).matches();
    }
}
