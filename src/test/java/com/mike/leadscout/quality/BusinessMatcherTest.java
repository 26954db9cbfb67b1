package com.mike.leadscout.quality;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BusinessMatcherTest {

    @Nested
    @DisplayName("compareNames")
    class CompareNames {

        @Test
        @DisplayName("Joe's Pizza LLC vs Joes Pizza -> >= 0.9")
        void compareNames_legal_suffix_and_apostrophe_ignored() {
            //Arrange
            String a = "Joe's Pizza LLC";
            String b = "Joes Pizza";
            //Act
            double result = BusinessMatcher.compareNames(a, b);
            //Assert
            assertTrue(result >= 0.9, "was " + result);
        }

        @Test
        @DisplayName("sponsored prefix -> identical")
        void compareNames_sponsored_prefix_ignored() {
            //Arrange
            String a = "Sponsored: Smith Dental";
            String b = "smith dental";
            //Act
            double result = BusinessMatcher.compareNames(a, b);
            //Assert
            assertEquals(1.0, result);
        }

        @Test
        @DisplayName("unrelated names -> low")
        void compareNames_unrelated_is_low() {
            //Arrange
            String a = "Smith Dental";
            String b = "Jones Orthodontics";
            //Act
            double result = BusinessMatcher.compareNames(a, b);
            //Assert
            assertTrue(result < 0.8, "was " + result);
        }

        @Test
        @DisplayName("null name -> 0")
        void compareNames_null_returns_zero() {
            //Act
            double result = BusinessMatcher.compareNames(null, "Smith Dental");
            //Assert
            assertEquals(0.0, result);
        }
    }

    @Nested
    @DisplayName("similarity")
    class Similarity {

        @Test
        @DisplayName("identical phone, different names -> >= 0.8")
        void similarity_identical_phone_dominates() {
            //Arrange
            BusinessSignature a = BusinessSignature.of("Austin Family Dentistry", "(512) 430-1100", null, null);
            BusinessSignature b = BusinessSignature.of("Dr. Lee DDS", "+1 512 430 1100", null, null);
            //Act
            SimilarityScore result = BusinessMatcher.similarity(a, b);
            //Assert
            assertTrue(result.score() >= 0.8, "was " + result.score());
            assertTrue(result.reasons().contains("phone"));
        }

        @Test
        @DisplayName("same domain -> >= 0.9")
        void similarity_same_domain() {
            //Arrange
            BusinessSignature a = BusinessSignature.of("Smith Dental", null, "https://www.smithdental.com/", null);
            BusinessSignature b = BusinessSignature.of("Smith Family Dental Care", null, "smithdental.com", null);
            //Act
            SimilarityScore result = BusinessMatcher.similarity(a, b);
            //Assert
            assertTrue(result.score() >= 0.9, "was " + result.score());
        }

        @Test
        @DisplayName("different name, phone and address -> below threshold")
        void similarity_different_businesses() {
            //Arrange
            BusinessSignature a = BusinessSignature.of("Smith Dental", "512-430-1100", null, "100 Congress Ave, Austin, TX 78701");
            BusinessSignature b = BusinessSignature.of("Jones Orthodontics", "512-430-2200", null, "200 Lamar Blvd, Austin, TX 78704");
            //Act
            SimilarityScore result = BusinessMatcher.similarity(a, b);
            //Assert
            assertTrue(result.score() < 0.75, "was " + result.score());
        }
    }

    @Nested
    @DisplayName("compareAddresses")
    class CompareAddresses {

        @Test
        @DisplayName("Street vs St, same city/state/zip -> >= 0.8")
        void compareAddresses_abbreviations_match() {
            //Arrange
            String a = "123 Main Street, Austin, TX 78701";
            String b = "123 Main St, Austin, TX 78701";
            //Act
            double result = BusinessMatcher.compareAddresses(a, b);
            //Assert
            assertTrue(result >= 0.8, "was " + result);
        }

        @Test
        @DisplayName("same city and state only -> partial credit")
        void compareAddresses_same_city_partial_credit() {
            //Arrange
            String a = "100 Congress Ave, Austin, TX 78701";
            String b = "9800 Research Blvd, Austin, TX 78759";
            //Act
            double result = BusinessMatcher.compareAddresses(a, b);
            //Assert
            assertTrue(result >= 0.4 && result < 0.8, "was " + result);
        }
    }
}
