package com.mike.leadscout.email.verify;

public enum SmtpVerdict {
    /** RCPT TO answered 250/251. */
    ACCEPTED,
    /** RCPT TO answered 5xx. */
    REJECTED,
    /** No usable answer: timeout, greylisting, blocked port, handshake refused. */
    UNKNOWN
}
