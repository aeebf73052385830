package io.taskmaster.model;

public record DuplicateRelationship(
        long canonicalFileId,
        long duplicateFileId,
        RelationType relationType,
        double confidence,
        String matchBasis,
        String canonicalPath,
        String duplicatePath,
        long updatedAtMs
) {
}
