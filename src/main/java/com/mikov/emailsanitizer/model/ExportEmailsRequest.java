package com.mikov.emailsanitizer.model;

import java.util.List;

/**
 * Request model for exporting sanitized addresses as CSV
 *
 * @author zahari.mikov
 */
public class ExportEmailsRequest {
    private List<String> emails;

    public ExportEmailsRequest() {
        // Default constructor for Jackson
    }

    public ExportEmailsRequest(final List<String> emails) {
        this.emails = emails;
    }

    public List<String> getEmails() {
        return emails;
    }

    public void setEmails(final List<String> emails) {
        this.emails = emails;
    }
}
