package com.partsbin.integration.inventory;

import com.partsbin.core.catalog.InventoryRecord;
import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.StorageSlot;
import com.partsbin.logging.AppLogger;
import io.github.resilience4j.core.functions.CheckedSupplier;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Wraps the inventory interfaces in a resilience4j {@link Retry} built from a {@link RetryPolicy}.
 * Only {@link IOException}s are retried; once the attempts are used up the last failure is rethrown
 * as {@link RemoteUnavailableException}.
 */
public final class RetryingInventoryClient implements InventorySource, InventoryWriter {

    private static final Logger LOGGER = AppLogger.get();

    private final InventorySource source;
    private final InventoryWriter writer;
    private final RetryPolicy policy;
    private final RetryConfig retryConfig;

    public RetryingInventoryClient(InventorySource source, InventoryWriter writer, RetryPolicy policy) {
        this.source = source;
        this.writer = writer;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.retryConfig = policy.toRetryConfig();
    }

    @Override
    public List<InventoryRecord> fetchComponents() throws IOException {
        InventorySource target = Objects.requireNonNull(source, "No inventory source configured");
        return call("fetch components", target::fetchComponents);
    }

    @Override
    public void setDefaultLocation(ComponentIdentity identity, StorageSlot slot) throws IOException {
        InventoryWriter target = Objects.requireNonNull(writer, "No inventory writer configured");
        call("set default location of " + identity.key(), () -> {
            target.setDefaultLocation(identity, slot);
            return null;
        });
    }

    @Override
    public void moveStock(ComponentIdentity identity, StorageSlot slot, int quantity) throws IOException {
        InventoryWriter target = Objects.requireNonNull(writer, "No inventory writer configured");
        call("move stock of " + identity.key(), () -> {
            target.moveStock(identity, slot, quantity);
            return null;
        });
    }

    private <T> T call(String operation, CheckedSupplier<T> action) throws IOException {
        Retry retry = Retry.of(operation, retryConfig);
        retry.getEventPublisher().onRetry(event -> LOGGER.warning("Attempt %d/%d to %s failed (%s); retrying in %d ms"
            .formatted(event.getNumberOfRetryAttempts(), policy.maxAttempts(), operation,
                event.getLastThrowable() == null ? "unknown error" : event.getLastThrowable().getMessage(),
                event.getWaitInterval().toMillis())));
        try {
            return Retry.decorateCheckedSupplier(retry, action).get();
        } catch (IOException ex) {
            LOGGER.severe("Giving up on %s after %d attempt(s)".formatted(operation, policy.maxAttempts()));
            throw new RemoteUnavailableException(operation, policy.maxAttempts(), ex);
        } catch (RuntimeException | Error ex) {
            throw ex;
        } catch (Throwable ex) {
            throw new IllegalStateException("Unexpected failure during " + operation, ex);
        }
    }
}
