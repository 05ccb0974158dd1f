package com.ryuqq.recon.adapter.inmemory.registry;

/**
 * Raised by {@link InMemoryScanRegistry} for unknown scans and requests the scan's state cannot satisfy.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScanRegistryException extends RuntimeException {

    public ScanRegistryException(String message) {
        super(message);
    }

    public ScanRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
