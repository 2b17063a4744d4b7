package io.practicedb.core.validation;

import java.util.List;

/**
 * @param blockedBy source collections holding restrict references, empty when the delete may go ahead
 */
public record DeleteCheck(boolean canDelete, List<String> blockedBy) {

    public DeleteCheck {
        blockedBy = List.copyOf(blockedBy);
    }
}
