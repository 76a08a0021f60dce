package com.digitalgroup.zapdesk.util;

/**
 * A phone split into country code and national number, both digits only.
 */
public record NormalizedPhone(String localNumber, String countryCode) {

    public String fullNumber() {
        return countryCode + localNumber;
    }

    public String e164() {
        return "+" + fullNumber();
    }
}
