package com.tenantclient.service.api;

/**
 * Durable key/value storage backing the {@link TokenStore}. The keys in use are
 * {@code access_token} and {@code refresh_token}.
 */
public interface TokenStorage {

    /**
     * @param key The key to read.
     * @return the stored value, or {@code null} if nothing is stored under the key.
     */
    String read(String key);

    /**
     * Stores a value, replacing any previous one.
     *
     * @param key   The key to write.
     * @param value The value to store.
     */
    void write(String key, String value);

    /**
     * Removes the given keys. Missing keys are ignored.
     *
     * @param keys The keys to remove.
     */
    void remove(String... keys);
}
