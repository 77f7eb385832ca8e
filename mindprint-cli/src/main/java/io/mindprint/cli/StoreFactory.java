package io.mindprint.cli;

import io.mindprint.core.config.model.MindprintConfig;
import io.mindprint.core.error.StoreException;
import io.mindprint.core.store.PersonaStore;

@FunctionalInterface
public interface StoreFactory {
    PersonaStore open(MindprintConfig config) throws StoreException;
}
