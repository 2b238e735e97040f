package tech.rolesync.engine.exec;

import tech.rolesync.engine.plan.Operation;

/**
 * Performs one operation against the provider.
 */
@FunctionalInterface
public interface OperationHandler {

    /**
     * @return the provider id of the entity created, or null
     * @throws tech.rolesync.engine.provider.ProviderException if a call fails
     */
    String apply(Operation operation);
}
