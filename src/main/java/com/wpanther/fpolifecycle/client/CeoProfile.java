package com.wpanther.fpolifecycle.client;

import com.wpanther.fpolifecycle.entity.OrganizationRecord;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * User payload for the FPO's CEO, derived from the profile captured at registration.
 */
@Getter
@Builder
@ToString
public class CeoProfile {

    public static final String CEO_ROLE = "CEO";
    public static final String DEFAULT_COUNTRY_CODE = "+91";

    private static final int LOCAL_NUMBER_LENGTH = 10;

    private final String username;
    private final String firstName;
    private final String lastName;
    private final String fullName;
    private final String phoneNumber;
    private final String countryCode;
    private final String email;
    private final String role;

    public static CeoProfile fromRecord(OrganizationRecord record) {
        String firstName = record.getCeoFirstName();
        String lastName = record.getCeoLastName();
        return CeoProfile.builder()
                .username(firstName + "_" + lastName)
                .firstName(firstName)
                .lastName(lastName)
                .fullName(firstName + " " + lastName)
                .phoneNumber(normalizePhone(record.getCeoPhoneNumber()))
                .countryCode(DEFAULT_COUNTRY_CODE)
                .email(record.getCeoEmail())
                .role(CEO_ROLE)
                .build();
    }

    /**
     * The access-control service expects the local ten digit number; the country code travels separately.
     */
    public static String normalizePhone(String phone) {
        if (phone == null) {
            return null;
        }
        String trimmed = phone.trim();
        if (trimmed.startsWith(DEFAULT_COUNTRY_CODE)) {
            return trimmed.substring(DEFAULT_COUNTRY_CODE.length());
        }
        if (trimmed.length() > LOCAL_NUMBER_LENGTH) {
            return trimmed.substring(trimmed.length() - LOCAL_NUMBER_LENGTH);
        }
        return trimmed;
    }
}
