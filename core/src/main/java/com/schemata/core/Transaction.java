package com.schemata.core;

/**
 * A read snapshot opened by a {@link CatalogFetcher}. Every read issued with the same handle observes the
 * same catalog state. Closing the handle releases the snapshot; reads through a closed handle fail.
 */
public interface Transaction extends AutoCloseable {
    boolean isOpen();

    @Override
    void close();
}
