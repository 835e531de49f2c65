package com.platform.provisioner.reconciliation;

import com.platform.provisioner.remote.RemoteResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The remote calls needed to reconcile one child collection.
 *
 * @param list   lists the remote collection
 * @param insert creates an item that has no remote counterpart
 * @param patch  updates an item under the identity it was assigned
 */
public record CollectionOperations<T>(
        Supplier<CompletableFuture<RemoteResult<List<T>>>> list,
        Function<T, CompletableFuture<RemoteResult<T>>> insert,
        Function<T, CompletableFuture<RemoteResult<T>>> patch) {}
