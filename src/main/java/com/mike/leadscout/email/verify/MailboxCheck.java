package com.mike.leadscout.email.verify;

public enum MailboxCheck {
    PASSED, FAILED, INCONCLUSIVE, NO_MX
}
