package com.mike.leadscout.quality;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldValidatorTest {

    @Nested
    @DisplayName("validateEmail")
    class ValidateEmail {

        @Test
        @DisplayName("info@gmail.com -> generic + personal domain, valid, score < 1")
        void validateEmail_generic_personal_domain() {
            //Act
            FieldCheck result = FieldValidator.validateEmail("info@gmail.com");
            //Assert
            assertTrue(result.valid());
            assertTrue(result.hasFlag(QualityFlags.GENERIC_EMAIL));
            assertTrue(result.hasFlag(QualityFlags.PERSONAL_EMAIL_DOMAIN));
            assertTrue(result.score() < 1.0);
        }

        @Test
        @DisplayName("noreply -> invalid")
        void validateEmail_noreply_is_invalid() {
            //Act
            FieldCheck result = FieldValidator.validateEmail("noreply@smithdental.com");
            //Assert
            assertFalse(result.valid());
            assertTrue(result.hasFlag(QualityFlags.NOREPLY_EMAIL));
        }

        @Test
        @DisplayName("missing -> missing_email, score 0")
        void validateEmail_missing() {
            //Act
            FieldCheck result = FieldValidator.validateEmail(" ");
            //Assert
            assertFalse(result.valid());
            assertEquals(0.0, result.score());
            assertTrue(result.hasFlag(QualityFlags.MISSING_EMAIL));
        }

        @Test
        @DisplayName("personal address on business domain -> no flags")
        void validateEmail_clean() {
            //Act
            FieldCheck result = FieldValidator.validateEmail("jane.smith@smithdental.com");
            //Assert
            assertTrue(result.valid());
            assertEquals(1.0, result.score());
            assertTrue(result.flags().isEmpty());
        }
    }

    @Nested
    @DisplayName("validateWebsite")
    class ValidateWebsite {

        @Test
        @DisplayName("example-forsale.com -> parked_domain")
        void validateWebsite_parked() {
            //Act
            FieldCheck result = FieldValidator.validateWebsite("example-forsale.com");
            //Assert
            assertTrue(result.hasFlag(QualityFlags.PARKED_DOMAIN));
            assertFalse(result.valid());
        }

        @Test
        @DisplayName("facebook page -> social profile, still valid")
        void validateWebsite_social_profile() {
            //Act
            FieldCheck result = FieldValidator.validateWebsite("https://www.facebook.com/smithdental");
            //Assert
            assertTrue(result.valid());
            assertTrue(result.hasFlag(QualityFlags.SOCIAL_MEDIA_PROFILE));
        }

        @Test
        @DisplayName("example.com -> placeholder")
        void validateWebsite_placeholder() {
            //Act
            FieldCheck result = FieldValidator.validateWebsite("http://example.com");
            //Assert
            assertTrue(result.hasFlag(QualityFlags.PLACEHOLDER_DOMAIN));
        }

        @Test
        @DisplayName("no dot in host -> invalid_url")
        void validateWebsite_invalid() {
            //Act
            FieldCheck result = FieldValidator.validateWebsite("not a website");
            //Assert
            assertTrue(result.hasFlag(QualityFlags.INVALID_URL));
        }
    }

    @Nested
    @DisplayName("validatePhone")
    class ValidatePhone {

        @Test
        @DisplayName("555 exchange -> fake_555_prefix")
        void validatePhone_555() {
            //Act
            FieldCheck result = FieldValidator.validatePhone("(512) 555-0100");
            //Assert
            assertTrue(result.hasFlag(QualityFlags.FAKE_555_PREFIX));
            assertFalse(result.valid());
        }

        @Test
        @DisplayName("1234567890 -> test number and invalid area code accumulate")
        void validatePhone_flags_accumulate() {
            //Act
            FieldCheck result = FieldValidator.validatePhone("123-456-7890");
            //Assert
            assertTrue(result.hasFlag(QualityFlags.TEST_NUMBER));
            assertTrue(result.hasFlag(QualityFlags.INVALID_AREA_CODE));
        }

        @Test
        @DisplayName("real-looking number -> ok")
        void validatePhone_ok() {
            //Act
            FieldCheck result = FieldValidator.validatePhone("+1 512-430-1100");
            //Assert
            assertTrue(result.valid());
            assertEquals(1.0, result.score());
        }
    }

    @Test
    @DisplayName("validateName: two characters -> invalid_name")
    void validateName_too_short() {
        //Act
        FieldCheck result = FieldValidator.validateName("AB");
        //Assert
        assertFalse(result.valid());
        assertTrue(result.hasFlag(QualityFlags.INVALID_NAME));
    }
}
