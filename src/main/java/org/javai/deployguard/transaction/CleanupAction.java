package org.javai.deployguard.transaction;

/**
 * Undoes the creation of one provisioned resource.
 */
@FunctionalInterface
public interface CleanupAction {

    void cleanup() throws Exception;
}
