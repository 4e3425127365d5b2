package com.acme.brickwatch.scheduler;

import com.acme.brickwatch.core.TransientException;
import com.acme.brickwatch.domain.Brick;
import com.acme.brickwatch.domain.BrickFilter;
import com.acme.brickwatch.domain.BrickIdentity;
import com.acme.brickwatch.domain.HistoryEntry;
import com.acme.brickwatch.domain.TransitionKind;
import com.acme.brickwatch.repository.BrickRepository;
import com.acme.brickwatch.schedule.DeadlineCalculator;
import com.acme.brickwatch.schedule.Periodicity;
import com.acme.brickwatch.service.BrickNotFoundException;
import com.acme.brickwatch.service.BrickService;
import com.acme.brickwatch.service.BrickUpdate;
import com.acme.brickwatch.service.DuplicateSlugException;
import com.acme.brickwatch.service.NewBrick;
import com.acme.brickwatch.service.TriggerResult;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Brick lifecycle operations. Every mutation is a versioned compare-and-set against the store;
 * a lost race re-reads the brick and re-applies the change.
 */
@Singleton
@RequiredArgsConstructor
@Slf4j
public class BrickServiceImpl implements BrickService {

    static final int MAX_ATTEMPTS = 3;

    private final BrickRepository repository;
    private final DeadlineCalculator calculator;
    private final DeadlineScheduler scheduler;
    private final NotificationCoordinator coordinator;
    private final Clock clock;

    @Override
    public Brick create(NewBrick request) {
        String name = requireName(request.name());
        String slug = slugOf(name);
        Periodicity periodicity = Periodicity.parse(request.periodicity());
        if (repository.findIdBySlug(slug).isPresent()) {
            throw new DuplicateSlugException(slug);
        }

        Instant now = now();
        Brick brick = new Brick();
        brick.setId(unusedId());
        brick.setName(name);
        brick.setSlug(slug);
        brick.setDescription(request.description() != null ? request.description() : "");
        brick.setPeriodicity(periodicity.spec());
        brick.setEmails(normalizeEmails(request.emails()));
        brick.setPaused(request.paused());
        brick.setCreatedAt(now);
        brick.recordEvent(HistoryEntry.of(now, "Brick created", null));
        brick.applyDeadline(calculator.nextDeadline(now, periodicity, request.paused()));

        repository.insert(brick);
        log.info("Created brick id={} slug={} periodicity='{}' paused={}",
                brick.getId(), slug, brick.getPeriodicity(), brick.isPaused());

        reschedule(brick);
        return brick;
    }

    @Override
    public Brick get(String id) {
        return repository.findById(id).orElseThrow(() -> BrickNotFoundException.byId(id));
    }

    @Override
    public Brick find(String id, String slug, String name) {
        int given = (id != null ? 1 : 0) + (slug != null ? 1 : 0) + (name != null ? 1 : 0);
        if (given != 1) {
            throw new IllegalArgumentException("Must specify exactly one of id, slug or name");
        }
        if (id != null) {
            return get(id);
        }
        String wanted = slug != null ? slug : BrickIdentity.slugify(name);
        String found = repository.findIdBySlug(wanted).orElseThrow(() -> BrickNotFoundException.bySlug(wanted));
        return get(found);
    }

    @Override
    public List<Brick> list(BrickFilter filter, boolean verbose) {
        return repository.list(filter != null ? filter : BrickFilter.all(), verbose);
    }

    @Override
    public Brick update(String id, BrickUpdate update) {
        if (update.isEmpty()) {
            throw new IllegalArgumentException("No updates specified");
        }
        String newName = update.name() != null ? requireName(update.name()) : null;
        String newSlug = newName != null ? slugOf(newName) : null;
        Periodicity newPeriodicity = update.periodicity() != null ? Periodicity.parse(update.periodicity()) : null;
        if (newSlug != null) {
            repository.findIdBySlug(newSlug)
                    .filter(owner -> !owner.equals(id))
                    .ifPresent(owner -> {
                        throw new DuplicateSlugException(newSlug);
                    });
        }
        List<String> newEmails = update.emails() == null ? null
                : update.clearsEmails() ? new ArrayList<>() : normalizeEmails(update.emails());

        Instant now = now();
        Applied<Boolean> applied = mutate(id, "update", brick -> {
            boolean changed = false;
            if (newName != null && !newName.equals(brick.getName())) {
                brick.setName(newName);
                brick.setSlug(newSlug);
                changed = true;
            }
            if (update.description() != null && !update.description().equals(brick.getDescription())) {
                brick.setDescription(update.description());
                changed = true;
            }
            if (newEmails != null && !newEmails.equals(brick.getEmails())) {
                brick.setEmails(newEmails);
                changed = true;
            }
            boolean flipped = false;
            if (newPeriodicity != null && !newPeriodicity.spec().equals(brick.getPeriodicity())) {
                brick.setPeriodicity(newPeriodicity.spec());
                changed = true;
                if (!brick.isPaused()) {
                    flipped = brick.reevaluate(
                            calculator.nextDeadline(brick.lastEventAt(), newPeriodicity, false), now);
                }
            }
            if (!changed) {
                throw new IllegalArgumentException("No updates specified");
            }
            return flipped;
        });

        Brick brick = applied.brick();
        log.info("Updated brick id={} lateFlipped={}", id, applied.outcome());
        reschedule(brick);
        if (applied.outcome()) {
            coordinator.dispatch(id, TransitionKind.forLate(brick.isLate()));
        }
        return brick;
    }

    @Override
    public TriggerResult trigger(String id, String comment) {
        Instant now = now();
        Applied<TriggerResult> applied = mutate(id, "trigger", brick -> {
            boolean wasPaused = brick.isPaused();
            boolean recovered = brick.trigger(
                    HistoryEntry.of(now, "Triggered", comment),
                    calculator.nextDeadline(now, brick.parsedPeriodicity(), false));
            return new TriggerResult(brick, recovered, wasPaused);
        });

        TriggerResult result = applied.outcome();
        log.debug("Triggered brick id={} recovered={} unpaused={}", id, result.recovered(), result.unpaused());
        reschedule(result.brick());
        if (result.recovered()) {
            coordinator.dispatch(id, TransitionKind.RECOVERED);
        }
        return result;
    }

    @Override
    public Brick pause(String id, String comment) {
        Instant now = now();
        Brick brick = mutate(id, "pause", b -> {
            b.pause(HistoryEntry.of(now, "Paused", comment));
            return Boolean.TRUE;
        }).brick();

        log.info("Paused brick id={}", id);
        scheduler.unscheduleBrick(id);
        return brick;
    }

    @Override
    public Brick unpause(String id, String comment) {
        Instant now = now();
        Brick brick = mutate(id, "unpause", b -> {
            b.unpause(HistoryEntry.of(now, "Unpaused", comment),
                    calculator.nextDeadline(now, b.parsedPeriodicity(), false));
            return Boolean.TRUE;
        }).brick();

        log.info("Unpaused brick id={} deadline={}", id, brick.getDeadline());
        reschedule(brick);
        return brick;
    }

    @Override
    public void delete(String id) {
        if (!repository.delete(id)) {
            throw BrickNotFoundException.byId(id);
        }
        log.info("Deleted brick id={}", id);
        scheduler.unscheduleBrick(id);
    }

    private <T> Applied<T> mutate(String id, String operation, Function<Brick, T> change) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Brick brick = get(id);
            long version = brick.getVersion();
            T outcome = change.apply(brick);
            if (repository.update(brick, version)) {
                return new Applied<>(brick, outcome);
            }
            log.debug("Brick id={} changed concurrently during {} (attempt {}/{})", id, operation, attempt, MAX_ATTEMPTS);
        }
        throw new TransientException("Brick " + id + " kept changing concurrently during " + operation);
    }

    private void reschedule(Brick brick) {
        Instant wakeAt = brick.wakeTarget();
        if (wakeAt == null) {
            scheduler.unscheduleBrick(brick.getId());
        } else {
            scheduler.scheduleBrick(brick.getId(), wakeAt);
        }
    }

    private String unusedId() {
        String id = BrickIdentity.newId();
        while (repository.findById(id).isPresent()) {
            id = BrickIdentity.newId();
        }
        return id;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Brick name must not be empty");
        }
        return name.trim();
    }

    private static String slugOf(String name) {
        String slug = BrickIdentity.slugify(name);
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Brick name '" + name + "' yields an empty slug");
        }
        return slug;
    }

    private static List<String> normalizeEmails(List<String> emails) {
        if (emails == null) {
            return new ArrayList<>();
        }
        Set<String> unique = new LinkedHashSet<>();
        emails.stream().filter(Objects::nonNull).map(String::trim).filter(e -> !e.isEmpty()).forEach(email -> {
            if (email.indexOf('@') < 1) {
                throw new IllegalArgumentException("Invalid email address: " + email);
            }
            unique.add(email);
        });
        return new ArrayList<>(unique);
    }

    private record Applied<T>(Brick brick, T outcome) {
    }
}
