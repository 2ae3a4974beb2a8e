package org.gc.socialpublisher.support;

import org.gc.socialpublisher.domain.PostMetricsSnapshot;
import org.gc.socialpublisher.domain.PostRecord;
import org.gc.socialpublisher.domain.PostStatus;
import org.gc.socialpublisher.domain.QueueEntry;
import org.gc.socialpublisher.domain.ScheduleConfig;
import org.gc.socialpublisher.repository.PostMetricsSnapshotRepository;
import org.gc.socialpublisher.repository.PostRecordRepository;
import org.gc.socialpublisher.repository.QueueEntryRepository;
import org.gc.socialpublisher.repository.ScheduleConfigRepository;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

/**
 * Map-backed repository mocks, so services can be tested against realistic persistence without
 * an Elasticsearch node.
 */
public final class InMemoryRepositories {

    private InMemoryRepositories() {
    }

    public static QueueEntryRepository queue(Map<Long, QueueEntry> store) {
        QueueEntryRepository repository = mock(QueueEntryRepository.class);
        lenient().when(repository.save(any(QueueEntry.class))).thenAnswer(invocation -> {
            QueueEntry entry = invocation.getArgument(0);
            store.put(entry.getId(), entry);
            return entry;
        });
        lenient().when(repository.findById(any())).thenAnswer(invocation ->
                Optional.ofNullable(store.get((Long) invocation.getArgument(0))));
        lenient().when(repository.findAll()).thenAnswer(invocation -> new ArrayList<>(store.values()));
        lenient().when(repository.findByStatus(any())).thenAnswer(invocation -> store.values().stream()
                .filter(entry -> entry.getStatus() == invocation.getArgument(0))
                .toList());
        lenient().when(repository.findByScheduledDate(any())).thenAnswer(invocation -> store.values().stream()
                .filter(entry -> invocation.getArgument(0).equals(entry.getScheduledDate()))
                .toList());
        lenient().when(repository.findByScheduledDateBetween(any(), any())).thenAnswer(invocation -> {
            LocalDate from = invocation.getArgument(0);
            LocalDate to = invocation.getArgument(1);
            return store.values().stream()
                    .filter(entry -> !entry.getScheduledDate().isBefore(from) && !entry.getScheduledDate().isAfter(to))
                    .toList();
        });
        lenient().when(repository.findFirstByOrderByIdDesc()).thenAnswer(invocation -> store.values().stream()
                .max(Comparator.comparing(QueueEntry::getId)));
        lenient().doAnswer(invocation -> store.remove((Long) invocation.getArgument(0)))
                .when(repository).deleteById(any());
        return repository;
    }

    public static PostRecordRepository posts(Map<Long, PostRecord> store) {
        PostRecordRepository repository = mock(PostRecordRepository.class);
        lenient().when(repository.save(any(PostRecord.class))).thenAnswer(invocation -> {
            PostRecord post = invocation.getArgument(0);
            store.put(post.getId(), post);
            return post;
        });
        lenient().when(repository.findById(any())).thenAnswer(invocation ->
                Optional.ofNullable(store.get((Long) invocation.getArgument(0))));
        lenient().when(repository.findAll()).thenAnswer(invocation -> new ArrayList<>(store.values()));
        lenient().when(repository.findAll(any(Pageable.class))).thenAnswer(invocation -> {
            Pageable pageable = invocation.getArgument(0);
            List<PostRecord> page = store.values().stream()
                    .sorted(Comparator.comparing(PostRecord::getId).reversed())
                    .limit(pageable.getPageSize())
                    .toList();
            return new PageImpl<>(page, pageable, store.size());
        });
        lenient().when(repository.findByStatus(any())).thenAnswer(invocation -> store.values().stream()
                .filter(post -> post.getStatus() == invocation.getArgument(0))
                .toList());
        lenient().when(repository.findByStatusIn(any())).thenAnswer(invocation -> {
            Collection<PostStatus> statuses = invocation.getArgument(0);
            return store.values().stream()
                    .filter(post -> statuses.contains(post.getStatus()))
                    .toList();
        });
        lenient().when(repository.findByIgMediaId(any())).thenAnswer(invocation -> store.values().stream()
                .filter(post -> invocation.getArgument(0).equals(post.getIgMediaId()))
                .findFirst());
        lenient().when(repository.findByPublishedAtUtcAfter(any())).thenAnswer(invocation -> {
            Instant since = invocation.getArgument(0);
            return store.values().stream()
                    .filter(post -> post.getPublishedAtUtc() != null && post.getPublishedAtUtc().isAfter(since))
                    .toList();
        });
        lenient().when(repository.findFirstByOrderByIdDesc()).thenAnswer(invocation -> store.values().stream()
                .max(Comparator.comparing(PostRecord::getId)));
        return repository;
    }

    public static PostMetricsSnapshotRepository snapshots(List<PostMetricsSnapshot> store) {
        PostMetricsSnapshotRepository repository = mock(PostMetricsSnapshotRepository.class);
        lenient().when(repository.save(any(PostMetricsSnapshot.class))).thenAnswer(invocation -> {
            PostMetricsSnapshot snapshot = invocation.getArgument(0);
            store.add(snapshot);
            return snapshot;
        });
        lenient().when(repository.findByPostIdOrderByCollectedAtUtcDesc(any())).thenAnswer(invocation -> store.stream()
                .filter(snapshot -> invocation.getArgument(0).equals(snapshot.getPostId()))
                .sorted(Comparator.comparing(PostMetricsSnapshot::getCollectedAtUtc).reversed())
                .toList());
        return repository;
    }

    public static ScheduleConfigRepository config(ScheduleConfig initial) {
        Map<String, ScheduleConfig> store = new ConcurrentHashMap<>();
        if (initial != null) {
            store.put(ScheduleConfig.SINGLETON_ID, initial);
        }
        ScheduleConfigRepository repository = mock(ScheduleConfigRepository.class);
        lenient().when(repository.save(any(ScheduleConfig.class))).thenAnswer(invocation -> {
            ScheduleConfig config = invocation.getArgument(0);
            store.put(config.getId(), config);
            return config;
        });
        lenient().when(repository.findById(any())).thenAnswer(invocation ->
                Optional.ofNullable(store.get((String) invocation.getArgument(0))));
        return repository;
    }
}
