package com.ryuqq.dealstore.adapter.file.table;

/**
 * The bytes on disk are not a workbook this codec can decode.
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public class WorkbookFormatException extends RuntimeException {

    public WorkbookFormatException(String message) {
        super(message);
    }

    public WorkbookFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
