package com.quizharvester.core.store;

/** 레코드/코퍼스 불변식 위반. 메시지에 가능한 한 레코드 id를 포함한다. */
public class ValidationException extends IllegalArgumentException {
    private final String recordId;

    public ValidationException(String recordId, String message) {
        super(recordId == null ? message : message + " (id=" + recordId + ")");
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
