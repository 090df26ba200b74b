package com.questrail.hamgateway.protocol.n1mm.validation;

import com.questrail.hamgateway.protocol.n1mm.schema.ContactInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class ContactInfoMinimumContentValidatorTest {

    private final ContactInfoMinimumContentValidator validator = new ContactInfoMinimumContentValidator();
    private ContactInfo contact;

    @BeforeEach
    void completeContact() {
        contact = new ContactInfo();
        contact.setCall("DL1ABC");
        contact.setStationName("STATION-1");
        contact.setOperator("W1AW");
        contact.setTimestamp(LocalDateTime.of(2024, 3, 9, 14, 35, 7));
        contact.setMode("CW");
    }

    @Test
    void acceptsCompleteContact() {
        assertTrue(validator.isValid(contact));
    }

    @Test
    void requiresCall() {
        contact.setCall(" ");
        assertFalse(validator.isValid(contact));

        contact.setCall(null);
        assertFalse(validator.isValid(contact));
    }

    @Test
    void stationNameOrOperatorIsEnough() {
        contact.setStationName(null);
        assertTrue(validator.isValid(contact));

        contact.setStationName("STATION-1");
        contact.setOperator("");
        assertTrue(validator.isValid(contact));

        contact.setStationName("");
        assertFalse(validator.isValid(contact));
    }

    @Test
    void requiresTimestampAndMode() {
        contact.setTimestamp(null);
        assertFalse(validator.isValid(contact));

        contact.setTimestamp(LocalDateTime.of(2024, 3, 9, 14, 35, 7));
        contact.setMode("");
        assertFalse(validator.isValid(contact));
    }

    @Test
    void rejectsNull() {
        assertFalse(validator.isValid(null));
    }
}
