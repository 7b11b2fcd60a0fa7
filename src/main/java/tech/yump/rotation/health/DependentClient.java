package tech.yump.rotation.health;

import tech.yump.rotation.policy.SecretClass;
import tech.yump.rotation.store.SecretVersion;

/**
 * Calls the dependents that consume a secret class's credentials. Only version references are
 * sent; dependents fetch the material from the store themselves.
 */
public interface DependentClient {

    /**
     * Pushes the new version reference to a dependent.
     *
     * @throws DependentException if the dependent is unknown, unreachable or refuses the push.
     */
    void distribute(String dependent, SecretClass secretClass, SecretVersion version);

    /**
     * Asks a dependent to perform a synthetic login with the given version. Never throws.
     */
    VerifyOutcome verify(String dependent, SecretClass secretClass, SecretVersion version);
}
