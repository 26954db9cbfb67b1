package com.mike.leadscout.email.verify;

import com.mike.leadscout.cache.EmailCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CatchAllDetectorTest {

    private MxLookUp mxLookUp;
    private SmtpProbe smtpProbe;
    private EmailCache emailCache;
    private CatchAllDetector detector;

    @BeforeEach
    void setUp() {
        mxLookUp = mock(MxLookUp.class);
        smtpProbe = mock(SmtpProbe.class);
        emailCache = mock(EmailCache.class);
        detector = new CatchAllDetector(mxLookUp, smtpProbe, emailCache);
    }

    @Test
    @DisplayName("cached verdict is used without probing")
    void cached() {
        //Arrange
        when(emailCache.catchAll("acme.com")).thenReturn(true);
        //Act
        boolean catchAll = detector.isCatchAll("acme.com");
        //Assert
        assertTrue(catchAll);
        verifyNoInteractions(smtpProbe);
    }

    @Test
    @DisplayName("random recipient accepted -> catch-all, remembered")
    void accepted_random_recipient() {
        //Arrange
        when(smtpProbe.isEnabled()).thenReturn(true);
        when(mxLookUp.mxHosts("acme.com")).thenReturn(List.of("mx.acme.com"));
        when(smtpProbe.probe(eq("mx.acme.com"), startsWith("probe_"))).thenReturn(SmtpVerdict.ACCEPTED);
        //Act
        boolean catchAll = detector.isCatchAll("acme.com");
        //Assert
        assertTrue(catchAll);
        verify(emailCache).storeCatchAll("acme.com", true);
    }

    @Test
    @DisplayName("inconclusive probe -> not catch-all and not remembered")
    void inconclusive() {
        //Arrange
        when(smtpProbe.isEnabled()).thenReturn(true);
        when(mxLookUp.mxHosts("acme.com")).thenReturn(List.of("mx.acme.com"));
        when(smtpProbe.probe(anyString(), anyString())).thenReturn(SmtpVerdict.UNKNOWN);
        //Act
        boolean catchAll = detector.isCatchAll("acme.com");
        //Assert
        assertFalse(catchAll);
        verify(emailCache, never()).storeCatchAll(anyString(), anyBoolean());
    }
}
