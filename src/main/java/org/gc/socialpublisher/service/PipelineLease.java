package org.gc.socialpublisher.service;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide run token for the content pipeline. Whoever holds it is the only caller allowed to
 * produce or publish. Acquired by compare-and-set, released by the holder only.
 */
@Slf4j
@Component
public class PipelineLease {

    private final AtomicReference<Holder> holder = new AtomicReference<>();
    private final Clock clock;

    public PipelineLease(Clock clock) {
        this.clock = clock;
    }

    @Value
    public static class Holder {
        String token;
        String label;
        Instant acquiredAt;
    }

    public Optional<String> tryAcquire(String label) {
        Holder candidate = new Holder(UUID.randomUUID().toString(), label, clock.instant());
        if (holder.compareAndSet(null, candidate)) {
            log.debug("Pipeline lease acquired by {}", label);
            return Optional.of(candidate.getToken());
        }
        return Optional.empty();
    }

    public void release(String token) {
        Holder current = holder.get();
        if (current != null && current.getToken().equals(token) && holder.compareAndSet(current, null)) {
            log.debug("Pipeline lease released by {}", current.getLabel());
        }
    }

    public boolean isHeld() {
        return holder.get() != null;
    }

    public Optional<Holder> current() {
        return Optional.ofNullable(holder.get());
    }
}
