package com.mike.leadscout.quality;

public final class QualityFlags {

    public static final String MISSING_NAME = "missing_name";
    public static final String INVALID_NAME = "invalid_name";
    public static final String SHORT_NAME = "short_name";

    public static final String MISSING_PHONE = "missing_phone";
    public static final String INVALID_PHONE_FORMAT = "invalid_phone_format";
    public static final String FAKE_555_PREFIX = "fake_555_prefix";
    public static final String TEST_NUMBER = "test_number";
    public static final String REPEATED_DIGITS = "repeated_digits";
    public static final String INVALID_AREA_CODE = "invalid_area_code";

    public static final String MISSING_WEBSITE = "missing_website";
    public static final String INVALID_URL = "invalid_url";
    public static final String PARKED_DOMAIN = "parked_domain";
    public static final String PLACEHOLDER_DOMAIN = "placeholder_domain";
    public static final String SOCIAL_MEDIA_PROFILE = "social_media_profile";

    public static final String MISSING_EMAIL = "missing_email";
    public static final String INVALID_EMAIL_FORMAT = "invalid_email_format";
    public static final String GENERIC_EMAIL = "generic_email";
    public static final String PERSONAL_EMAIL_DOMAIN = "personal_email_domain";
    public static final String NOREPLY_EMAIL = "noreply_email";

    public static final String MISSING_ADDRESS = "missing_address";
    public static final String INCOMPLETE_ADDRESS = "incomplete_address";

    public static final String MERGED_FROM_PREFIX = "merged_from_";

    private QualityFlags() {
    }
}
