package com.digitalgroup.zapdesk.util;

import com.digitalgroup.zapdesk.exception.PhoneValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public final class PhoneUtils {

    public static final String BRAZIL = "55";

    private static final int MIN_DIGITS = 8;
    private static final int MAX_DIGITS = 13;
    private static final int MAX_NATIONAL_DIGITS = 11;
    private static final int MIN_LOCAL_AFTER_CODE = 8;

    // Longest codes first so 595 wins over 59x lookalikes and 1 is tried last
    private static final List<String> COUNTRY_CODES = List.of(
            "595", "598", "593", "591", "353", "351",
            "81", "61", "55", "54", "56", "57", "58", "52", "51", "34", "39", "49", "33", "44",
            "1");

    private static final Set<Integer> BRAZIL_AREA_CODES = Set.of(
            11, 12, 13, 14, 15, 16, 17, 18, 19,
            21, 22, 24, 27, 28,
            31, 32, 33, 34, 35, 37, 38,
            41, 42, 43, 44, 45, 46, 47, 48, 49,
            51, 53, 54, 55,
            61, 62, 63, 64, 65, 66, 67, 68, 69,
            71, 73, 74, 75, 77, 79,
            81, 82, 83, 84, 85, 86, 87, 88, 89,
            91, 92, 93, 94, 95, 96, 97, 98, 99);

    private PhoneUtils() {}

    /**
     * Strips WhatsApp suffixes (@c.us, @s.whatsapp.net, @lid) and every non-digit.
     */
    public static String digitsOnly(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replace("@c.us", "")
                .replace("@s.whatsapp.net", "")
                .replace("@lid", "")
                .replaceAll("[^0-9]", "");
    }

    /**
     * Normalizes a raw phone into (national number, country code).
     * WhatsApp ids ({@code ...@c.us}), numbers written with a leading {@code +} and numbers
     * longer than 11 digits carry their own country code; anything else is a national
     * number of {@code assumedCountry}.
     *
     * @throws PhoneValidationException for out-of-range lengths, repeated digits,
     *                                  or Brazilian numbers with a bad area code or mobile prefix
     */
    public static NormalizedPhone normalize(String raw, String assumedCountry) {
        String digits = checkedDigits(raw);
        String country = assumedCountry == null || assumedCountry.isBlank()
                ? BRAZIL : digitsOnly(assumedCountry);

        String trimmed = raw.trim();
        boolean international = trimmed.startsWith("+") || trimmed.contains("@")
                || digits.length() > MAX_NATIONAL_DIGITS;
        NormalizedPhone phone = international
                ? splitInternational(raw, digits)
                : new NormalizedPhone(digits, country);
        return validated(raw, phone);
    }

    /**
     * Normalizes an identifier that always starts with its country code: gateway chat ids,
     * numbers a gateway resolved and stored {@link NormalizedPhone#fullNumber()} values.
     */
    public static NormalizedPhone normalizeFullNumber(String raw) {
        String digits = checkedDigits(raw);
        return validated(raw, splitInternational(raw, digits));
    }

    private static String checkedDigits(String raw) {
        String digits = digitsOnly(raw);
        if (digits.length() < MIN_DIGITS || digits.length() > MAX_DIGITS) {
            throw new PhoneValidationException(raw, "expected " + MIN_DIGITS + "-" + MAX_DIGITS + " digits");
        }
        if (allSameDigit(digits)) {
            throw new PhoneValidationException(raw, "all digits are identical");
        }
        return digits;
    }

    private static NormalizedPhone validated(String raw, NormalizedPhone phone) {
        if (phone.fullNumber().length() > MAX_DIGITS) {
            throw new PhoneValidationException(raw, "too long once the country code is added");
        }
        if (BRAZIL.equals(phone.countryCode())) {
            validateBrazilian(raw, phone.localNumber());
        }
        return phone;
    }

    public static NormalizedPhone normalize(String raw) {
        return normalize(raw, BRAZIL);
    }

    public static boolean isValid(String raw, String assumedCountry) {
        try {
            normalize(raw, assumedCountry);
            return true;
        } catch (PhoneValidationException e) {
            return false;
        }
    }

    private static NormalizedPhone splitInternational(String raw, String digits) {
        for (String code : COUNTRY_CODES) {
            if (digits.startsWith(code) && digits.length() - code.length() >= MIN_LOCAL_AFTER_CODE) {
                return new NormalizedPhone(digits.substring(code.length()), code);
            }
        }
        if (digits.length() <= 10) {
            throw new PhoneValidationException(raw, "unknown country code");
        }
        // Unknown country code: keep the last 10 digits as the national number
        int split = digits.length() - 10;
        return new NormalizedPhone(digits.substring(split), digits.substring(0, split));
    }

    private static void validateBrazilian(String raw, String local) {
        if (local.length() != 10 && local.length() != 11) {
            throw new PhoneValidationException(raw, "Brazilian numbers need area code plus 8 or 9 digits");
        }
        int areaCode = Integer.parseInt(local.substring(0, 2));
        if (!BRAZIL_AREA_CODES.contains(areaCode)) {
            throw new PhoneValidationException(raw, "unknown area code " + areaCode);
        }
        if (local.length() == 11 && local.charAt(2) != '9') {
            throw new PhoneValidationException(raw, "mobile numbers must start with 9");
        }
    }

    private static boolean allSameDigit(String digits) {
        char first = digits.charAt(0);
        for (int i = 1; i < digits.length(); i++) {
            if (digits.charAt(i) != first) {
                return false;
            }
        }
        return true;
    }

    /**
     * Display format: Brazil as (XX) XXXXX-XXXX, everything else as +cc local.
     */
    public static String formatForDisplay(String localNumber, String countryCode) {
        if (localNumber == null || localNumber.isEmpty()) {
            return "";
        }
        String local = digitsOnly(localNumber);
        if (countryCode == null || BRAZIL.equals(countryCode)) {
            if (local.length() == 11) {
                return "(" + local.substring(0, 2) + ") " + local.substring(2, 7) + "-" + local.substring(7);
            }
            if (local.length() == 10) {
                return "(" + local.substring(0, 2) + ") " + local.substring(2, 6) + "-" + local.substring(6);
            }
        }
        return countryCode == null ? local : "+" + countryCode + " " + local;
    }

    /**
     * Two numbers are the same line when their last 10 digits match.
     */
    public static boolean isSameLine(String a, String b) {
        String left = digitsOnly(a);
        String right = digitsOnly(b);
        if (left.length() < 8 || right.length() < 8) {
            return false;
        }
        return lastDigits(left, 10).equals(lastDigits(right, 10));
    }

    public static String lastDigits(String digits, int count) {
        return digits.length() <= count ? digits : digits.substring(digits.length() - count);
    }

    /**
     * Brazilian mobiles may be registered on WhatsApp with or without the ninth digit.
     * Returns the number itself first, then the other variant.
     */
    public static List<String> brazilianVariants(String fullNumber) {
        List<String> variants = new ArrayList<>();
        variants.add(fullNumber);
        if (!fullNumber.startsWith(BRAZIL)) {
            return variants;
        }
        String local = fullNumber.substring(2);
        if (local.length() == 11 && local.charAt(2) == '9') {
            variants.add(BRAZIL + local.substring(0, 2) + local.substring(3));
        } else if (local.length() == 10) {
            variants.add(BRAZIL + local.substring(0, 2) + "9" + local.substring(2));
        }
        return variants;
    }
}
