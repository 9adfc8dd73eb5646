package com.guno.drawimport.repository;

import com.guno.drawimport.entity.DrawStore;

/**
 * Durable home of the draw store.
 */
public interface DrawStoreRepository {

    /**
     * Never fails: an absent or unreadable store loads as empty.
     */
    DrawStore load();

    /**
     * Replace the stored content.
     *
     * @throws com.guno.drawimport.exception.StoreWriteException when the store cannot be written
     */
    void save(DrawStore store);
}
