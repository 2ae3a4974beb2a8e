package org.gc.socialpublisher.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.gc.socialpublisher.domain.QueueEntry;

@Data
@AllArgsConstructor
public class QueueAddResult {

    private QueueEntry entry;
    /** Soft duplicate-slot warning, null when the slot was free. */
    private String warning;
}
