package com.acme.brickwatch.service;

import java.util.List;

/**
 * Partial update; null fields stay unchanged. An {@code emails} list consisting of the single
 * entry {@value #CLEAR_EMAILS} removes all recipients.
 */
public record BrickUpdate(String name, String periodicity, String description, List<String> emails) {

  public static final String CLEAR_EMAILS = "-";

  public boolean isEmpty() {
    return name == null && periodicity == null && description == null && emails == null;
  }

  public boolean clearsEmails() {
    return emails != null && emails.size() == 1 && CLEAR_EMAILS.equals(emails.get(0));
  }
}
