package com.mike.leadscout.email.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WhoisXmlClientTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("contacts in record order, registry duplicates dropped, lower-cased")
    void parse_record_order() throws JsonProcessingException {
        //Arrange
        String json = "{\"WhoisRecord\":{"
                + "\"registrant\":{\"email\":\"Owner@SmithDental.com\"},"
                + "\"technicalContact\":{\"email\":\"tech@webhost.net\"},"
                + "\"registryData\":{\"registrant\":{\"email\":\"owner@smithdental.com\"},"
                + "\"contactEmail\":\"abuse@registrar.com\"}}}";
        //Act
        List<DomainContact> contacts = WhoisXmlClient.parse(mapper.readTree(json));
        //Assert
        assertEquals(List.of(
                new DomainContact("owner@smithdental.com", "registrant"),
                new DomainContact("tech@webhost.net", "technicalContact"),
                new DomainContact("abuse@registrar.com", "contact")), contacts);
    }

    @Test
    @DisplayName("privacy-redacted record -> no contacts")
    void parse_empty() throws JsonProcessingException {
        //Act
        List<DomainContact> contacts = WhoisXmlClient.parse(mapper.readTree("{\"WhoisRecord\":{\"registrant\":{}}}"));
        //Assert
        assertTrue(contacts.isEmpty());
    }
}
