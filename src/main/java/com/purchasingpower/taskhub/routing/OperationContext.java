package com.purchasingpower.taskhub.routing;

import lombok.Builder;

/**
 * Routing hints for one operation.
 *
 * @param projectTag prefer sources tagged with this project; ignored when none match
 * @param listId list the operation concerns, for logging
 * @param requireWritable drop read-only sources even for reads
 */
@Builder
public record OperationContext(String projectTag, String listId, boolean requireWritable) {

    public static final OperationContext NONE = new OperationContext(null, null, false);

    public static OperationContext forProject(String projectTag) {
        return new OperationContext(projectTag, null, false);
    }
}
