package io.practicedb.core;

public class DuplicateDocumentException extends PracticeDbException {
    private final String collection;
    private final String documentId;

    public DuplicateDocumentException(String collection, String documentId) {
        super("Document with ID " + documentId + " already exists in " + collection);
        this.collection = collection;
        this.documentId = documentId;
    }

    public String getCollection() {
        return collection;
    }

    public String getDocumentId() {
        return documentId;
    }
}
