package com.acme.brickwatch.scheduler;

import com.acme.brickwatch.config.MailConfig;
import com.acme.brickwatch.domain.Brick;
import com.acme.brickwatch.domain.HistoryEntry;
import com.acme.brickwatch.domain.TransitionKind;
import jakarta.inject.Singleton;
import java.util.List;

/** Renders the subject and plain-text body of late and recovery notices. */
@Singleton
public class NotificationComposer {

  private final MailConfig mailConfig;

  public NotificationComposer(MailConfig mailConfig) {
    this.mailConfig = mailConfig;
  }

  public record Message(String subject, String body) {}

  public Message compose(Brick brick, TransitionKind kind) {
    StringBuilder body = new StringBuilder();
    String subject;
    if (kind == TransitionKind.BECAME_LATE) {
      subject = String.format("[LATE] %s has not reported", brick.getName());
      body.append(
          String.format(
              "The brick %s (%s) was expected to report before %s.%n",
              brick.getName(), brick.getId(), brick.getDeadline()));
    } else {
      subject = String.format("[RESUMED] %s is reporting again", brick.getName());
      body.append(
          String.format(
              "The brick %s (%s) is reporting again as of %s.%n",
              brick.getName(), brick.getId(), brick.lastEventAt()));
      if (brick.getDeadline() != null) {
        body.append(
            String.format("%nThe next trigger for this brick is due before %s.%n", brick.getDeadline()));
      } else if (brick.getResumeAt() != null) {
        body.append(
            String.format(
                "%nNo trigger is due until its schedule resumes at %s.%n", brick.getResumeAt()));
      }
    }

    if (brick.getDescription() != null && !brick.getDescription().isBlank()) {
      body.append(String.format("%nDescription: %s%n", brick.getDescription()));
    }

    body.append(String.format("%nRecent events for this brick:%n%n"));
    List<HistoryEntry> recent = brick.recentHistory(mailConfig.getRecentEvents());
    for (int i = recent.size() - 1; i >= 0; i--) {
      HistoryEntry event = recent.get(i);
      body.append(String.format("%-30s %s%n", event.at(), event.comment()));
    }
    return new Message(subject, body.toString());
  }
}
