package io.liveprobe.server.dto;

import java.util.Map;

/**
 * JSON body POSTed to the error sink.
 * Example:
 *   {
 *     "app": "liveprobe",
 *     "timestamp": "2024-05-01T10:15:34.120Z",
 *     "message": "Operation failed: update",
 *     "errorType": "io.liveprobe.core.storage.StorageException",
 *     "errorMessage": "update failed (code=-3, transient=true): timeout",
 *     "context": { "op": "update", "id": "doc-17", "worker": "worker-2" }
 *   }
 */
public class ErrorEvent {
    public String app;
    public String timestamp;
    public String message;
    public String errorType;
    public String errorMessage;
    public Map<String, String> context;
}
