package com.platform.provisioner.remote;

/**
 * Outcome of a Management API call together with the path it was made against.
 */
public record RemoteResult<T>(ResourcePath path, T value) {}
