package org.gc.socialpublisher.repository;

import org.gc.socialpublisher.domain.QueueEntry;
import org.springframework.data.elasticsearch.repository.ElasticsearchRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface QueueEntryRepository extends ElasticsearchRepository<QueueEntry, Long> {

    List<QueueEntry> findByScheduledDate(LocalDate scheduledDate);

    List<QueueEntry> findByScheduledDateBetween(LocalDate from, LocalDate to);

    List<QueueEntry> findByStatus(QueueEntry.Status status);

    Optional<QueueEntry> findFirstByOrderByIdDesc();
}
