package org.javai.deployguard.secret;

import java.util.Optional;

/**
 * Where secrets come from when the remote store is off or unavailable.
 */
@FunctionalInterface
public interface LocalSecretSource {

    Optional<String> lookup(String name) throws Exception;
}
