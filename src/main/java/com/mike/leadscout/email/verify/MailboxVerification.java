package com.mike.leadscout.email.verify;

public record MailboxVerification(
        String email,
        boolean valid,
        double confidence,
        MailboxCheck check,
        boolean mxValid
) {
    public boolean smtpAccepted() {
        return check == MailboxCheck.PASSED;
    }
}
